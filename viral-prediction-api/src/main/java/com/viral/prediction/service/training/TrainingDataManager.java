package com.viral.prediction.service.training;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.viral.prediction.config.PredictionProperties;
import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.exception.DataPointNotFoundException;
import com.viral.prediction.exception.DatasetNotFoundException;
import com.viral.prediction.exception.InsufficientDataException;
import com.viral.prediction.exception.LowQualityException;
import com.viral.prediction.model.*;
import com.viral.prediction.model.TrainingDatasetDocument.FeatureAnalysis;
import com.viral.prediction.model.TrainingDatasetDocument.Statistics;
import com.viral.prediction.repository.PredictionRecordRepository;
import com.viral.prediction.repository.TrainingDatasetRepository;
import com.viral.prediction.repository.ViralDataPointRepository;
import com.viral.prediction.service.feature.ContentFeatures;
import com.viral.prediction.service.feature.FeatureDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Collects served predictions and their outcomes, and turns them into labeled, split training datasets.
 */
@Service
public class TrainingDataManager {

    private static final Logger log = LoggerFactory.getLogger(TrainingDataManager.class);

    private static final double SYNTHETIC_JITTER = 0.1;
    private static final String SYNTHETIC_VERSION = "synthetic-1.0";

    private final ViralDataPointRepository dataPointRepository;
    private final PredictionRecordRepository predictionRecordRepository;
    private final TrainingDatasetRepository datasetRepository;
    private final LabelingStrategy labelingStrategy;
    private final DataQualityAssessor qualityAssessor;
    private final PredictionProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TrainingDataManager(
            ViralDataPointRepository dataPointRepository,
            PredictionRecordRepository predictionRecordRepository,
            TrainingDatasetRepository datasetRepository,
            LabelingStrategy labelingStrategy,
            DataQualityAssessor qualityAssessor,
            PredictionProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.dataPointRepository = dataPointRepository;
        this.predictionRecordRepository = predictionRecordRepository;
        this.datasetRepository = datasetRepository;
        this.labelingStrategy = labelingStrategy;
        this.qualityAssessor = qualityAssessor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ============ COLLECTION ============

    /**
     * Stores a served prediction until its outcome is known. Returns the record id (the prediction id).
     */
    public String recordPrediction(ContentRequest request, ViralPrediction prediction, ContentFeatures features) {
        PredictionRecordDocument record = new PredictionRecordDocument();
        record.setId(prediction.predictionId());
        record.setPlatform(prediction.platform());
        record.setContentText(request.content().text());
        record.setHashtags(request.content().hashtags());
        record.setFeatures(new LinkedHashMap<>(FeatureDictionary.toMap(features)));
        record.setPredictedScore(prediction.viralScore());
        record.setPredictedConfidence(prediction.confidence());
        record.setTimestamp(clock.instant());

        predictionRecordRepository.save(record);
        log.debug("Recorded prediction {} for {}", record.getId(), record.getPlatform());
        return record.getId();
    }

    /**
     * Labels the observed outcome of a recorded prediction and appends it to the platform's latest dataset.
     */
    public ViralDataPointDocument recordOutcome(String predictionId, ActualPerformanceMetrics metrics) {
        PredictionRecordDocument record = predictionRecordRepository.findById(predictionId)
                .orElseThrow(() -> new DataPointNotFoundException(predictionId));
        if (record.getFeatures() == null || record.getFeatures().isEmpty()) {
            throw new IllegalStateException("Prediction " + predictionId + " has no features to train on");
        }

        ViralDataPointDocument point = new ViralDataPointDocument();
        point.setId(record.getId());
        point.setPlatform(record.getPlatform());
        point.setContentText(record.getContentText());
        point.setHashtags(record.getHashtags());
        point.setFeatures(record.getFeatures());
        point.setActualMetrics(metrics);
        point.setPredictedScore(record.getPredictedScore());
        point.setTimestamp(record.getTimestamp());
        point.setLabels(labelingStrategy.label(metrics, record.getPlatform()));
        point.setMetadata(DataPointMetadata.organic(record.getCreatorId()));

        ViralDataPointDocument saved = dataPointRepository.save(point);
        record.setOutcomeRecorded(true);
        predictionRecordRepository.save(record);

        addToDataset(saved);
        log.info("Outcome recorded for {} ({}): viral={}, score={}", predictionId, saved.getPlatform().getId(),
                saved.getLabels().viral(), String.format("%.1f", saved.getLabels().viralScore()));
        return saved;
    }

    private void addToDataset(ViralDataPointDocument point) {
        Optional<TrainingDatasetDocument> latest =
                datasetRepository.findFirstByPlatformOrderByCreatedAtDesc(point.getPlatform());

        if (latest.isEmpty()) {
            TrainingDatasetDocument created = buildDataset(point.getPlatform(), List.of(point),
                    qualityAssessor.assess(List.of(point)));
            datasetRepository.save(created);
            log.info("Created dataset {} for {}", created.getName(), point.getPlatform().getId());
            return;
        }

        TrainingDatasetDocument dataset = latest.get();
        List<String> ids = new ArrayList<>(dataset.getDataPointIds());
        if (!ids.contains(point.getId())) {
            ids.add(point.getId());
        }
        List<ViralDataPointDocument> points = dataPointRepository.findAllById(ids);
        dataset.setDataPointIds(ids);
        dataset.setSplits(DatasetSplitter.split(ids, newRandom()));
        dataset.setStatistics(statistics(points, qualityAssessor.assess(points).score()));
        dataset.setFeatureAnalysis(analyzeFeatures(points));
        dataset.setUpdatedAt(clock.instant());
        datasetRepository.save(dataset);
    }

    // ============ DATASET PREPARATION ============

    public DatasetInfo prepareDataset(Platform platform, DatasetOptions options) {
        DatasetOptions opts = options == null ? DatasetOptions.defaults() : options;
        int minSamples = opts.minSamples() != null ? opts.minSamples() : properties.getDataset().getMinSamples();
        double qualityThreshold = opts.qualityThreshold() != null
                ? opts.qualityThreshold()
                : properties.getDataset().getQualityThreshold();
        boolean balance = opts.balance() == null || opts.balance();

        log.info("Preparing {} dataset (minSamples={}, qualityThreshold={}, balance={})",
                platform.getId(), minSamples, qualityThreshold, balance);

        List<ViralDataPointDocument> points = labeledPoints(platform, opts);
        if (points.size() < minSamples) {
            throw new InsufficientDataException(points.size(), minSamples);
        }

        Random random = newRandom();
        if (balance) {
            points = balance(points, random);
        }

        DataQualityReport report = qualityAssessor.assess(points);
        if (report.score() < qualityThreshold) {
            throw new LowQualityException(report.score(), qualityThreshold);
        }

        TrainingDatasetDocument dataset = buildDataset(platform, points, report);
        TrainingDatasetDocument saved = datasetRepository.save(dataset);

        log.info("Prepared dataset {} with {} samples (train={}, validation={}, test={})",
                saved.getName(), points.size(), saved.getSplits().train().size(),
                saved.getSplits().validation().size(), saved.getSplits().test().size());
        return DatasetInfo.of(saved, report);
    }

    private List<ViralDataPointDocument> labeledPoints(Platform platform, DatasetOptions opts) {
        List<ViralDataPointDocument> points;
        if (opts.hasTimeRange()) {
            Instant start = opts.timeRangeStart() != null ? opts.timeRangeStart() : Instant.EPOCH;
            Instant end = opts.timeRangeEnd() != null ? opts.timeRangeEnd() : clock.instant();
            points = dataPointRepository.findByPlatformAndTimeRange(platform, start, end);
        } else {
            points = dataPointRepository.findByPlatform(platform);
        }
        return points.stream()
                .filter(dp -> dp.getLabels() != null && dp.getActualMetrics() != null)
                .filter(dp -> dp.getFeatures() != null && !dp.getFeatures().isEmpty())
                .toList();
    }

    /**
     * Down-samples the majority class to the size of the minority class.
     * A single-class sample is returned unchanged.
     */
    static List<ViralDataPointDocument> balance(List<ViralDataPointDocument> points, Random random) {
        List<ViralDataPointDocument> viral = points.stream().filter(dp -> dp.getLabels().viral()).toList();
        List<ViralDataPointDocument> nonViral = points.stream().filter(dp -> !dp.getLabels().viral()).toList();

        if (viral.isEmpty() || nonViral.isEmpty()) {
            log.warn("Cannot balance dataset: {} viral, {} non-viral samples", viral.size(), nonViral.size());
            return points;
        }

        int count = Math.min(viral.size(), nonViral.size());
        List<ViralDataPointDocument> balanced = new ArrayList<>(DatasetSplitter.sample(viral, count, random));
        balanced.addAll(DatasetSplitter.sample(nonViral, count, random));
        return balanced;
    }

    private TrainingDatasetDocument buildDataset(Platform platform, List<ViralDataPointDocument> points,
                                                 DataQualityReport report) {
        Instant now = clock.instant();
        int existing = datasetRepository.findByPlatformOrderByCreatedAtDesc(platform).size();
        List<String> ids = points.stream().map(ViralDataPointDocument::getId).toList();

        TrainingDatasetDocument dataset = new TrainingDatasetDocument();
        dataset.setName(platform.getId() + "-viral-dataset-" + now.toEpochMilli());
        dataset.setPlatform(platform);
        dataset.setVersion((existing + 1) + ".0.0");
        dataset.setCreatedAt(now);
        dataset.setUpdatedAt(now);
        dataset.setDataPointIds(new ArrayList<>(ids));
        dataset.setSplits(DatasetSplitter.split(ids, newRandom()));
        dataset.setStatistics(statistics(points, report.score()));
        dataset.setFeatureAnalysis(analyzeFeatures(points));
        return dataset;
    }

    static Statistics statistics(List<ViralDataPointDocument> points, double qualityScore) {
        int viral = (int) points.stream().filter(dp -> dp.getLabels() != null && dp.getLabels().viral()).count();
        double avgEngagement = points.stream()
                .filter(dp -> dp.getLabels() != null)
                .mapToLong(dp -> dp.getLabels().totalEngagement())
                .average()
                .orElse(0.0);
        Instant start = points.stream().map(ViralDataPointDocument::getTimestamp).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null);
        Instant end = points.stream().map(ViralDataPointDocument::getTimestamp).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);

        return new Statistics(points.size(), viral, points.isEmpty() ? 0.0 : (double) viral / points.size(),
                avgEngagement, start, end, qualityScore);
    }

    static FeatureAnalysis analyzeFeatures(List<ViralDataPointDocument> points) {
        if (points.isEmpty() || points.get(0).getFeatures() == null) {
            return new FeatureAnalysis(0, List.of(), Map.of(), Map.of());
        }

        List<String> names = List.copyOf(points.get(0).getFeatures().keySet());
        Map<String, Double> correlations = new LinkedHashMap<>();
        Map<String, Double> importance = new LinkedHashMap<>();

        if (points.size() >= 2) {
            double[] target = points.stream()
                    .mapToDouble(dp -> dp.getLabels() == null ? 0.0 : dp.getLabels().viralScore())
                    .toArray();
            for (String name : names) {
                double[] values = points.stream()
                        .mapToDouble(dp -> featureValue(dp, name))
                        .toArray();
                double r = correlation(values, target);
                correlations.put(name, r);
                importance.put(name, Math.abs(r));
            }
        }

        return new FeatureAnalysis(names.size(), names, correlations, importance);
    }

    static double correlation(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return 0.0;
        }
        double meanX = Arrays.stream(x, 0, n).average().orElse(0.0);
        double meanY = Arrays.stream(y, 0, n).average().orElse(0.0);

        double numerator = 0;
        double denomX = 0;
        double denomY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            numerator += dx * dy;
            denomX += dx * dx;
            denomY += dy * dy;
        }
        double denom = Math.sqrt(denomX * denomY);
        return denom == 0 ? 0.0 : numerator / denom;
    }

    private static double featureValue(ViralDataPointDocument dp, String name) {
        Double value = dp.getFeatures() == null ? null : dp.getFeatures().get(name);
        return value == null || !Double.isFinite(value) ? 0.0 : value;
    }

    // ============ QUERIES ============

    public List<ViralDataPointDocument> getRecentData(Platform platform, int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        return dataPointRepository.findByPlatformAndTimestampAfter(platform, cutoff);
    }

    public List<ViralDataPointDocument> getRecentData(Platform platform) {
        return getRecentData(platform, properties.getLearning().getRecentDataDays());
    }

    /**
     * Test split of the platform's latest dataset, in split order. Empty when there is no dataset.
     */
    public List<ViralDataPointDocument> getTestDataset(Platform platform) {
        return datasetRepository.findFirstByPlatformOrderByCreatedAtDesc(platform)
                .filter(ds -> ds.getSplits() != null)
                .map(ds -> inOrder(ds.getSplits().test()))
                .orElse(List.of());
    }

    public DataQualityReport assessDataQuality(List<ViralDataPointDocument> points) {
        return qualityAssessor.assess(points);
    }

    public DataQualityReport assessDataQuality(Platform platform) {
        return qualityAssessor.assess(dataPointRepository.findByPlatform(platform));
    }

    public TrainingDatasetDocument getDataset(String datasetId) {
        return datasetRepository.findById(datasetId)
                .orElseThrow(() -> new DatasetNotFoundException(datasetId));
    }

    public List<TrainingDatasetDocument> listDatasets(Platform platform) {
        if (platform == null) {
            return datasetRepository.findAll();
        }
        return datasetRepository.findByPlatformOrderByCreatedAtDesc(platform);
    }

    private List<ViralDataPointDocument> inOrder(List<String> ids) {
        Map<String, ViralDataPointDocument> byId = dataPointRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(ViralDataPointDocument::getId, Function.identity(), (a, b) -> a));
        return ids.stream().map(byId::get).filter(Objects::nonNull).toList();
    }

    // ============ AUGMENTATION ============

    /**
     * Jittered copies of existing samples: every numeric feature is scaled by a factor in [0.95, 1.05]
     * and clamped back into its range. Labels and metrics are copied unchanged. Deterministic for the same inputs.
     */
    public List<ViralDataPointDocument> generateSyntheticData(Platform platform, int count,
                                                              List<ViralDataPointDocument> basedOn) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        if (count > 0 && (basedOn == null || basedOn.isEmpty())) {
            throw new IllegalArgumentException("Synthetic data needs at least one base sample");
        }

        Random random = newRandom();
        Instant now = clock.instant();
        List<ViralDataPointDocument> synthetic = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            ViralDataPointDocument base = basedOn.get(random.nextInt(basedOn.size()));

            Map<String, Double> features = new LinkedHashMap<>();
            if (base.getFeatures() != null) {
                for (Map.Entry<String, Double> e : base.getFeatures().entrySet()) {
                    double noise = (random.nextDouble() - 0.5) * SYNTHETIC_JITTER;
                    double value = e.getValue() == null ? 0.0 : e.getValue();
                    features.put(e.getKey(), FeatureDictionary.clampToRange(e.getKey(), value * (1 + noise)));
                }
            }

            DataPointMetadata baseMeta = base.getMetadata();
            ViralDataPointDocument point = new ViralDataPointDocument();
            point.setId("syn-" + base.getId() + "-" + i);
            point.setPlatform(platform);
            point.setContentText(base.getContentText());
            point.setHashtags(base.getHashtags());
            point.setFeatures(features);
            point.setActualMetrics(base.getActualMetrics());
            point.setTimestamp(now);
            point.setLabels(base.getLabels());
            point.setMetadata(new DataPointMetadata(
                    baseMeta == null ? null : baseMeta.creatorId(),
                    baseMeta == null ? null : baseMeta.campaignId(),
                    SYNTHETIC_VERSION,
                    DataSource.SYNTHETIC));
            synthetic.add(point);
        }

        return synthetic;
    }

    /**
     * Synthetic copies of the platform's stored samples, optionally persisted.
     */
    public List<ViralDataPointDocument> generateSyntheticData(Platform platform, int count, boolean save) {
        List<ViralDataPointDocument> base = dataPointRepository.findByPlatform(platform).stream()
                .filter(dp -> dp.getMetadata() == null || dp.getMetadata().source() != DataSource.SYNTHETIC)
                .toList();
        List<ViralDataPointDocument> synthetic = generateSyntheticData(platform, count, base);
        if (save && !synthetic.isEmpty()) {
            dataPointRepository.saveAll(synthetic);
            log.info("Stored {} synthetic {} samples", synthetic.size(), platform.getId());
        }
        return synthetic;
    }

    // ============ EXPORT ============

    public String exportDataset(String datasetId, ExportFormat format) {
        TrainingDatasetDocument dataset = getDataset(datasetId);
        List<ViralDataPointDocument> points = inOrder(dataset.getDataPointIds());

        switch (format) {
            case JSON:
                return exportAsJson(dataset, points);
            case CSV:
                return exportAsCsv(points);
            default:
                throw new IllegalArgumentException("Unsupported export format: "
                        + format.name().toLowerCase(Locale.ROOT));
        }
    }

    private String exportAsJson(TrainingDatasetDocument dataset, List<ViralDataPointDocument> points) {
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("dataset", dataset);
        export.put("dataPoints", points);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to export dataset " + dataset.getId(), e);
        }
    }

    static String exportAsCsv(List<ViralDataPointDocument> points) {
        StringBuilder csv = new StringBuilder("id,platform,viral_score,is_viral,engagement_tier");
        for (ViralDataPointDocument dp : points) {
            DataPointLabels labels = dp.getLabels();
            csv.append('\n')
                    .append(dp.getId()).append(',')
                    .append(dp.getPlatform() == null ? "" : dp.getPlatform().getId()).append(',')
                    .append(labels == null ? "" : String.format(Locale.ROOT, "%.3f", labels.viralScore()))
                    .append(',')
                    .append(labels != null && labels.viral()).append(',')
                    .append(labels == null ? "" : labels.engagementTier().getId());
        }
        return csv.toString();
    }

    private Random newRandom() {
        return new Random(properties.getDataset().getShuffleSeed());
    }
}
