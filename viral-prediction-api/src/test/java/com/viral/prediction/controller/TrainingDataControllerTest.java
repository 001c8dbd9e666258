package com.viral.prediction.controller;

import com.viral.prediction.exception.DatasetNotFoundException;
import com.viral.prediction.exception.LowQualityException;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.training.DatasetOptions;
import com.viral.prediction.service.training.ExportFormat;
import com.viral.prediction.service.training.TrainingDataManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TrainingDataController.class)
class TrainingDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TrainingDataManager trainingDataManager;

    // ============ DATASETS ============

    @Test
    void prepareDataset_withoutBodyUsesDefaults() throws Exception {
        mockMvc.perform(post("/api/training/datasets/twitter/prepare"))
                .andExpect(status().isOk());

        verify(trainingDataManager).prepareDataset(Platform.TWITTER, DatasetOptions.defaults());
    }

    @Test
    void prepareDataset_passesOptions() throws Exception {
        mockMvc.perform(post("/api/training/datasets/tiktok/prepare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minSamples\":50,\"qualityThreshold\":0.7,\"balance\":false}"))
                .andExpect(status().isOk());

        verify(trainingDataManager).prepareDataset(Platform.TIKTOK, new DatasetOptions(50, null, null, 0.7, false));
    }

    @Test
    void prepareDataset_lowQualityIsUnprocessable() throws Exception {
        when(trainingDataManager.prepareDataset(eq(Platform.TWITTER), any()))
                .thenThrow(new LowQualityException(0.6, 0.8));

        mockMvc.perform(post("/api/training/datasets/twitter/prepare"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("LOW_QUALITY"));
    }

    @Test
    void getDataset_unknownIdIsNotFound() throws Exception {
        when(trainingDataManager.getDataset("nope")).thenThrow(new DatasetNotFoundException("nope"));

        mockMvc.perform(get("/api/training/datasets/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void listDatasets_filtersByPlatformWhenGiven() throws Exception {
        when(trainingDataManager.listDatasets(any())).thenReturn(List.of());

        mockMvc.perform(get("/api/training/datasets").param("platform", "instagram"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/training/datasets"))
                .andExpect(status().isOk());

        verify(trainingDataManager).listDatasets(Platform.INSTAGRAM);
        verify(trainingDataManager).listDatasets(null);
    }

    @Test
    void exportDataset_csvIsServedAsCsv() throws Exception {
        when(trainingDataManager.exportDataset("ds-1", ExportFormat.CSV))
                .thenReturn("id,platform,viral_score,is_viral,engagement_tier\nv0,twitter,90.000,true,viral");

        mockMvc.perform(get("/api/training/datasets/ds-1/export").param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(org.hamcrest.Matchers.startsWith("id,platform")));
    }

    @Test
    void exportDataset_defaultsToJson() throws Exception {
        when(trainingDataManager.exportDataset("ds-1", ExportFormat.JSON)).thenReturn("{\"id\":\"ds-1\"}");

        mockMvc.perform(get("/api/training/datasets/ds-1/export"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.id").value("ds-1"));
    }

    @Test
    void exportDataset_unknownFormatIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/training/datasets/ds-1/export").param("format", "xml"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported export format: xml"));

        verifyNoInteractions(trainingDataManager);
    }

    // ============ DATA ============

    @Test
    void synthetic_defaultsToHundredUnsaved() throws Exception {
        when(trainingDataManager.generateSyntheticData(Platform.YOUTUBE, 100, false)).thenReturn(List.of());

        mockMvc.perform(post("/api/training/youtube/synthetic"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(trainingDataManager).generateSyntheticData(Platform.YOUTUBE, 100, false);
    }

    @Test
    void quality_unknownPlatformIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/training/myspace/quality"))
                .andExpect(status().isBadRequest());
    }
}
