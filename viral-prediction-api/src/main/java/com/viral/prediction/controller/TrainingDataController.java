package com.viral.prediction.controller;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.TrainingDatasetDocument;
import com.viral.prediction.model.ViralDataPointDocument;
import com.viral.prediction.service.training.DataQualityReport;
import com.viral.prediction.service.training.DatasetInfo;
import com.viral.prediction.service.training.DatasetOptions;
import com.viral.prediction.service.training.ExportFormat;
import com.viral.prediction.service.training.TrainingDataManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/training")
@Tag(name = "Training data", description = "Datasets, data quality and synthetic samples")
public class TrainingDataController {

    private final TrainingDataManager trainingDataManager;

    public TrainingDataController(TrainingDataManager trainingDataManager) {
        this.trainingDataManager = trainingDataManager;
    }

    // ============ DATASETS ============

    @PostMapping("/datasets/{platform}/prepare")
    @Operation(summary = "Prepare dataset", description = "Label, balance, quality-check and split a new dataset version")
    public DatasetInfo prepareDataset(
            @PathVariable String platform,
            @RequestBody(required = false) DatasetOptions options
    ) {
        return trainingDataManager.prepareDataset(Platform.fromId(platform),
                options != null ? options : DatasetOptions.defaults());
    }

    @GetMapping("/datasets")
    @Operation(summary = "List datasets", description = "All datasets, or one platform's newest first")
    public List<TrainingDatasetDocument> listDatasets(@RequestParam(required = false) String platform) {
        return trainingDataManager.listDatasets(platform != null ? Platform.fromId(platform) : null);
    }

    @GetMapping("/datasets/{id}")
    @Operation(summary = "Get dataset")
    public TrainingDatasetDocument getDataset(@PathVariable String id) {
        return trainingDataManager.getDataset(id);
    }

    @GetMapping("/datasets/{id}/export")
    @Operation(summary = "Export dataset", description = "JSON or CSV")
    public ResponseEntity<String> exportDataset(
            @PathVariable String id,
            @RequestParam(defaultValue = "json") String format
    ) {
        ExportFormat exportFormat = ExportFormat.fromId(format);
        String body = trainingDataManager.exportDataset(id, exportFormat);
        MediaType type = exportFormat == ExportFormat.CSV
                ? MediaType.parseMediaType("text/csv")
                : MediaType.APPLICATION_JSON;
        return ResponseEntity.ok().contentType(type).body(body);
    }

    // ============ DATA ============

    @GetMapping("/{platform}/quality")
    @Operation(summary = "Data quality report", description = "Quality of all stored samples for a platform")
    public DataQualityReport quality(@PathVariable String platform) {
        return trainingDataManager.assessDataQuality(Platform.fromId(platform));
    }

    @PostMapping("/{platform}/synthetic")
    @Operation(summary = "Generate synthetic samples", description = "Jittered copies of stored samples")
    public List<ViralDataPointDocument> synthetic(
            @PathVariable String platform,
            @RequestParam(defaultValue = "100") int count,
            @RequestParam(defaultValue = "false") boolean save
    ) {
        return trainingDataManager.generateSyntheticData(Platform.fromId(platform), count, save);
    }
}
