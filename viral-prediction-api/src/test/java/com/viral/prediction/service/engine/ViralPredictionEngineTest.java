package com.viral.prediction.service.engine;

import com.viral.prediction.config.ExecutionConfig;
import com.viral.prediction.config.PredictionProperties;
import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.exception.InsufficientDataException;
import com.viral.prediction.exception.ModelBusyException;
import com.viral.prediction.exception.UnsupportedPlatformException;
import com.viral.prediction.model.DataPointLabels;
import com.viral.prediction.model.EngagementTier;
import com.viral.prediction.model.Platform;
import com.viral.prediction.model.ViralDataPointDocument;
import com.viral.prediction.repository.ViralDataPointRepository;
import com.viral.prediction.service.cache.PredictionCache;
import com.viral.prediction.service.explain.ExplainableAI;
import com.viral.prediction.service.explain.FactorCategory;
import com.viral.prediction.service.feature.ContentFeatures;
import com.viral.prediction.service.feature.FeatureDictionary;
import com.viral.prediction.service.feature.FeatureExtractor;
import com.viral.prediction.service.feature.TrendingTopicStore;
import com.viral.prediction.service.platform.*;
import com.viral.prediction.service.training.DatasetInfo;
import com.viral.prediction.service.training.TrainingDataManager;
import com.viral.runtime.client.ModelRuntime;
import com.viral.runtime.dto.ModelMetrics;
import com.viral.runtime.dto.RuntimePrediction;
import com.viral.runtime.dto.TrainingJob;
import com.viral.runtime.exception.ModelRuntimeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static com.viral.prediction.util.ScoreMath.round1;
import static com.viral.prediction.util.ScoreMath.round3;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ViralPredictionEngineTest {

    // Wednesday, noon UTC: a Twitter peak hour
    private static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");
    private static final RuntimePrediction RUNTIME_RESULT = new RuntimePrediction(0.4, 0.6, Map.of());

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private ModelRuntime modelRuntime;
    private TrainingDataManager trainingDataManager;
    private PlatformModelStateService modelStateService;
    private PredictionProperties properties;
    private FeatureExtractor featureExtractor;
    private PlatformModelRegistry registry;
    private ViralPredictionEngine engine;

    @BeforeEach
    void setUp() {
        modelRuntime = mock(ModelRuntime.class);
        trainingDataManager = mock(TrainingDataManager.class);
        modelStateService = mock(PlatformModelStateService.class);
        properties = new PredictionProperties();
        properties.getLearning().setJobPollInterval(Duration.ZERO);

        when(modelStateService.runtimeModelId(any())).thenAnswer(inv -> "viral-" + inv.<Platform>getArgument(0).getId());
        when(modelRuntime.predict(any())).thenReturn(RUNTIME_RESULT);

        TrendingTopicStore topics = new TrendingTopicStore(mock(ViralDataPointRepository.class));
        featureExtractor = new FeatureExtractor(topics, clock, Runnable::run);
        registry = new PlatformModelRegistry(List.of(new TwitterModel(), new InstagramModel(), new TikTokModel(),
                new YouTubeModel(), new FacebookModel(), new LinkedInModel()));
        engine = newEngine(topics, Runnable::run);
    }

    private ViralPredictionEngine newEngine(TrendingTopicStore topics, Executor predictionExecutor) {
        return new ViralPredictionEngine(featureExtractor, registry, modelRuntime, new ExplainableAI(),
                trainingDataManager, new PredictionCache(properties), modelStateService, topics, properties, clock,
                predictionExecutor, Runnable::run);
    }

    private static ContentRequest request(String text, String platform, String... hashtags) {
        return new ContentRequest(ContentRequest.Content.text(text, hashtags), platform);
    }

    // ============ PREDICTION ============

    @Test
    void predictViralPotential_blendsPlatformAndRuntimeScores() {
        ContentRequest request = new ContentRequest(
                ContentRequest.Content.text("Excited to share our new AI tool! What do you think?", "#AI", "#tech"),
                "twitter", new ContentRequest.Creator(50_000, 0.04, "tech", false), null, null, null);

        ViralPrediction prediction = engine.predictViralPotential(request);

        PlatformPrediction platform = new TwitterModel().predict(featureExtractor.extractFeatures(request), null);
        double raw = 0.5 * platform.viralScore() / 100 + 0.5 * RUNTIME_RESULT.prediction();
        assertEquals(round1(ViralPredictionEngine.normalizeScore(raw, Platform.TWITTER)), prediction.viralScore());
        assertEquals(round3(0.5 * platform.confidence() + 0.5 * RUNTIME_RESULT.confidence()),
                prediction.confidence(), 1e-9);

        assertFalse(prediction.fallback());
        assertEquals(Platform.TWITTER, prediction.platform());
        assertEquals(Instant.parse("2024-01-10T15:00:00Z"), prediction.optimalPostingTime());
        assertEquals(NOW, prediction.generatedAt());
        assertThat(prediction.explanation().keyFactors())
                .anySatisfy(f -> assertEquals(FactorCategory.TIMING, f.category()));
        assertThat(prediction.predictedMetrics()).containsKeys("views", "retweets");
        verify(trainingDataManager).recordPrediction(eq(request), eq(prediction), any(ContentFeatures.class));
    }

    @Test
    void predictViralPotential_plainTweetFromMidSizedCreatorLandsInModerateBand() {
        // untrained runtime model: neutral output
        when(modelRuntime.predict(any())).thenReturn(new RuntimePrediction(0.5, 0.6, Map.of()));
        String text = "Our team shipped the quarterly report today and the numbers look steady #finance";
        ContentRequest request = new ContentRequest(ContentRequest.Content.text(text), "twitter",
                new ContentRequest.Creator(10_000, 0.03, null, false), null, null, null);
        assertEquals(80, text.length());

        ViralPrediction prediction = engine.predictViralPotential(request);

        PlatformPrediction platform = new TwitterModel().predict(featureExtractor.extractFeatures(request), null);
        assertThat(platform.viralScore()).isBetween(40.0, 80.0);
        assertFalse(prediction.fallback());
        // Twitter's moderate (45) and trending (65) cut-offs map onto 40 and 70
        assertThat(prediction.viralScore()).isGreaterThanOrEqualTo(40.0).isLessThan(70.0);
        assertThat(prediction.confidence()).isBetween(0.5, 0.8);
        assertThat(prediction.explanation().keyFactors())
                .anySatisfy(f -> assertEquals(FactorCategory.TIMING, f.category()));
    }

    @Test
    void predictViralPotential_identicalRequestIsServedFromCache() {
        ContentRequest request = request("Hello world", "tiktok", "#fyp");

        ViralPrediction first = engine.predictViralPotential(request);
        ViralPrediction second = engine.predictViralPotential(request);

        assertSame(first, second);
        verify(modelRuntime, times(1)).predict(any());
        assertEquals(1, engine.getCacheStats().hitCount());
    }

    @Test
    void predictViralPotential_runtimeFailureGivesUncachedFallback() {
        when(modelRuntime.predict(any())).thenThrow(new ModelRuntimeException("predict", "503"));
        ContentRequest request = request("Hello world", "instagram");

        ViralPrediction first = engine.predictViralPotential(request);
        ViralPrediction second = engine.predictViralPotential(request);

        assertTrue(first.fallback());
        assertEquals(ViralPredictionEngine.FALLBACK_SCORE, first.viralScore());
        assertEquals(ViralPredictionEngine.FALLBACK_CONFIDENCE, first.confidence());
        assertEquals(Platform.INSTAGRAM, first.platform());
        assertNotEquals(first.predictionId(), second.predictionId());
        verify(modelRuntime, times(2)).predict(any());
        verify(trainingDataManager, never()).recordPrediction(any(), any(), any());
    }

    @Test
    void predictViralPotential_slowRuntimeTimesOutToFallback() {
        properties.setRuntimeTimeout(Duration.ofMillis(50));
        when(modelRuntime.predict(any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return RUNTIME_RESULT;
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            ViralPredictionEngine slowEngine =
                    newEngine(new TrendingTopicStore(mock(ViralDataPointRepository.class)), executor);

            long start = System.nanoTime();
            ViralPrediction prediction = slowEngine.predictViralPotential(request("Hello", "twitter"));

            assertTrue(prediction.fallback());
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void predictViralPotential_unknownPlatformIsRejected() {
        assertThrows(UnsupportedPlatformException.class,
                () -> engine.predictViralPotential(request("Hello", "myspace")));
    }

    @Test
    void predictViralPotential_recordingFailureDoesNotAffectResult() {
        when(trainingDataManager.recordPrediction(any(), any(), any())).thenThrow(new IllegalStateException("db down"));

        ViralPrediction prediction = engine.predictViralPotential(request("Hello world", "linkedin"));

        assertFalse(prediction.fallback());
    }

    // ============ BATCH & COMPARISON ============

    @Test
    void batchPredict_preservesOrderAndIsolatesFailures() {
        List<ViralPrediction> predictions = engine.batchPredict(List.of(
                request("one", "twitter"),
                request("two", "myspace"),
                request("three", "youtube")));

        assertEquals(3, predictions.size());
        assertEquals(Platform.TWITTER, predictions.get(0).platform());
        assertTrue(predictions.get(1).fallback());
        assertNull(predictions.get(1).platform());
        assertEquals(Platform.YOUTUBE, predictions.get(2).platform());
    }

    @Test
    void batchPredict_largeBatchOnPooledExecutorsKeepsEveryItem() {
        ExecutionConfig executionConfig = new ExecutionConfig();
        ThreadPoolTaskExecutor predictionPool = (ThreadPoolTaskExecutor) executionConfig.predictionExecutor();
        ThreadPoolTaskExecutor batchPool = (ThreadPoolTaskExecutor) executionConfig.batchExecutor();
        when(modelRuntime.predict(any())).thenAnswer(inv -> {
            Thread.sleep(2);
            return RUNTIME_RESULT;
        });
        ViralPredictionEngine pooled = new ViralPredictionEngine(featureExtractor, registry, modelRuntime,
                new ExplainableAI(), trainingDataManager, new PredictionCache(properties), modelStateService,
                new TrendingTopicStore(mock(ViralDataPointRepository.class)), properties, clock,
                predictionPool, batchPool);
        List<ContentRequest> requests = IntStream.range(0, 1200)
                .mapToObj(i -> request("Release notes for build " + i, i % 2 == 0 ? "twitter" : "youtube"))
                .toList();

        try {
            List<ViralPrediction> predictions = pooled.batchPredict(requests);

            assertEquals(1200, predictions.size());
            for (int i = 0; i < predictions.size(); i++) {
                assertFalse(predictions.get(i).fallback());
                assertEquals(i % 2 == 0 ? Platform.TWITTER : Platform.YOUTUBE, predictions.get(i).platform());
            }
        } finally {
            predictionPool.shutdown();
            batchPool.shutdown();
        }
    }

    @Test
    void batchPredict_saturatedPoolScoresRejectedItemsInline() {
        ThreadPoolTaskExecutor tinyPool = new ThreadPoolTaskExecutor();
        tinyPool.setCorePoolSize(1);
        tinyPool.setMaxPoolSize(1);
        tinyPool.setQueueCapacity(1);
        tinyPool.initialize();
        when(modelRuntime.predict(any())).thenAnswer(inv -> {
            Thread.sleep(20);
            return RUNTIME_RESULT;
        });
        ViralPredictionEngine saturated = new ViralPredictionEngine(featureExtractor, registry, modelRuntime,
                new ExplainableAI(), trainingDataManager, new PredictionCache(properties), modelStateService,
                new TrendingTopicStore(mock(ViralDataPointRepository.class)), properties, clock,
                Runnable::run, tinyPool);
        List<ContentRequest> requests = IntStream.range(0, 12)
                .mapToObj(i -> request("Post " + i, "facebook"))
                .toList();

        try {
            List<ViralPrediction> predictions = saturated.batchPredict(requests);

            assertEquals(12, predictions.size());
            assertThat(predictions).allSatisfy(p -> {
                assertFalse(p.fallback());
                assertEquals(Platform.FACEBOOK, p.platform());
            });
        } finally {
            tinyPool.shutdown();
        }
    }

    @Test
    void comparePlatforms_keysFollowInputOrderWithoutDuplicates() {
        Map<Platform, ViralPrediction> comparison = engine.comparePlatforms(request("Big news today", "twitter"),
                List.of(Platform.TIKTOK, Platform.TWITTER, Platform.TIKTOK));

        assertThat(comparison.keySet()).containsExactly(Platform.TIKTOK, Platform.TWITTER);
        assertEquals(Platform.TIKTOK, comparison.get(Platform.TIKTOK).platform());
    }

    @Test
    void comparePlatforms_requiresAPlatform() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.comparePlatforms(request("x", "twitter"), List.of()));
    }

    @Test
    void getOptimalStrategy_primaryHasHighestScore() {
        ContentRequest content = request("Big news today", "twitter", "#news");
        List<Platform> platforms = List.of(Platform.values());

        OptimalStrategy strategy = engine.getOptimalStrategy(content, platforms);

        Map<Platform, ViralPrediction> comparison = engine.comparePlatforms(content, platforms);
        double best = comparison.values().stream().mapToDouble(ViralPrediction::viralScore).max().orElseThrow();
        assertEquals(best, comparison.get(strategy.primary()).viralScore());
        assertThat(strategy.secondary()).hasSize(2).doesNotContain(strategy.primary());
        assertThat(strategy.timing()).hasSize(6);
        assertThat(strategy.modifications().values()).allSatisfy(m -> assertThat(m).hasSizeLessThanOrEqualTo(3));
    }

    @Test
    void abTestContent_winnerHasHighestComposite() {
        List<ContentRequest> variants = List.of(
                request("ok", "twitter"),
                request("I love this amazing incredible news! Share it now #AI #trending", "twitter", "#AI"));

        ABTestResult result = engine.abTestContent(variants, Platform.TWITTER);

        assertEquals(2, result.variants().size());
        double best = result.variants().stream().mapToDouble(ABTestResult.VariantResult::compositeScore).max()
                .orElseThrow();
        assertEquals(best, result.variants().get(result.winnerIndex()).compositeScore());
        assertEquals(1, result.winnerIndex());
        assertThat(result.confidence()).isBetween(0.0, 1.0);
        assertEquals("variation_0", result.variants().get(0).variantId());
    }

    @Test
    void abTestContent_requiresVariants() {
        assertThrows(IllegalArgumentException.class, () -> engine.abTestContent(List.of(), Platform.TWITTER));
    }

    // ============ SCORE DERIVATION ============

    @Test
    void normalizeScore_mapsPlatformCutoffsOntoCommonScale() {
        assertEquals(90.0, ViralPredictionEngine.normalizeScore(0.85, Platform.TWITTER), 1e-9);
        assertEquals(70.0, ViralPredictionEngine.normalizeScore(0.65, Platform.TWITTER), 1e-9);
        assertEquals(40.0, ViralPredictionEngine.normalizeScore(0.50, Platform.TIKTOK), 1e-9);
        assertEquals(90.0, ViralPredictionEngine.normalizeScore(0.80, Platform.YOUTUBE), 1e-9);
        assertEquals(0.0, ViralPredictionEngine.normalizeScore(-1, Platform.FACEBOOK), 1e-9);
        assertEquals(100.0, ViralPredictionEngine.normalizeScore(2, Platform.FACEBOOK), 1e-9);
    }

    @Test
    void normalizeScore_isMonotonic() {
        for (Platform platform : Platform.values()) {
            double previous = -1;
            for (int i = 0; i <= 100; i++) {
                double score = ViralPredictionEngine.normalizeScore(i / 100.0, platform);
                assertThat(score).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
        }
    }

    @Test
    void optimalPostingTime_usesRequestZoneAndRollsToTomorrow() {
        ContentRequest late = new ContentRequest(ContentRequest.Content.text("x"), "twitter", null,
                new ContentRequest.Timing(null, "America/New_York"), null, null);

        // 12:00Z is 07:00 in New York, so 09:00 local is next
        assertEquals(Instant.parse("2024-01-10T14:00:00Z"),
                ViralPredictionEngine.optimalPostingTime(Platform.TWITTER, late, NOW));
        assertEquals(Instant.parse("2024-01-11T09:00:00Z"), ViralPredictionEngine.optimalPostingTime(
                Platform.TWITTER, request("x", "twitter"), Instant.parse("2024-01-10T18:00:00Z")));
    }

    @Test
    void auc_rankStatistic() {
        assertEquals(1.0, ViralPredictionEngine.auc(new double[]{10, 20, 80, 90},
                new boolean[]{false, false, true, true}), 1e-9);
        assertEquals(0.0, ViralPredictionEngine.auc(new double[]{10, 20, 80, 90},
                new boolean[]{true, true, false, false}), 1e-9);
        assertEquals(0.5, ViralPredictionEngine.auc(new double[]{50, 50}, new boolean[]{true, false}), 1e-9);
        assertEquals(0.5, ViralPredictionEngine.auc(new double[]{10, 90}, new boolean[]{true, true}), 1e-9);
    }

    // ============ MODEL LIFECYCLE ============

    private static ViralDataPointDocument testPoint(String id, double featureValue, boolean viral) {
        Map<String, Double> features = new HashMap<>();
        for (String key : FeatureDictionary.toMap(FeatureDictionary.fromMap(Map.of())).keySet()) {
            features.put(key, featureValue);
        }
        ViralDataPointDocument dp = new ViralDataPointDocument();
        dp.setId(id);
        dp.setPlatform(Platform.TWITTER);
        dp.setFeatures(features);
        dp.setLabels(new DataPointLabels(viral, viral ? 95 : 20,
                viral ? EngagementTier.VIRAL : EngagementTier.LOW, 12, 0));
        return dp;
    }

    @Test
    void evaluateModel_rescoresTestSplit() {
        when(trainingDataManager.getTestDataset(Platform.TWITTER))
                .thenReturn(List.of(testPoint("weak", 0.0, false), testPoint("strong", 1.0, true)));

        ModelPerformance performance = engine.evaluateModel(Platform.TWITTER);

        assertEquals("test-split", performance.source());
        assertEquals(2, performance.samples());
        assertEquals(1.0, performance.accuracy());
        assertEquals(1.0, performance.auc());
        assertEquals(List.of(List.of(1L, 0L), List.of(0L, 1L)), performance.confusionMatrix());
        verify(modelStateService).markEvaluated(Platform.TWITTER, 1.0);
        verify(modelRuntime, never()).getModelMetrics(anyString());
    }

    @Test
    void evaluateModel_withoutTestDataUsesRuntimeMetrics() {
        when(trainingDataManager.getTestDataset(Platform.FACEBOOK)).thenReturn(List.of());
        when(modelRuntime.getModelMetrics("viral-facebook"))
                .thenReturn(new ModelMetrics("viral-facebook", 0.81, 0.7, null, null, null));

        ModelPerformance performance = engine.evaluateModel(Platform.FACEBOOK);

        assertEquals("runtime", performance.source());
        assertEquals(0.81, performance.accuracy());
        assertEquals(0.7, performance.precision());
        assertEquals(0.0, performance.recall());
        assertEquals(0.5, performance.auc());
        verify(modelStateService).markEvaluated(Platform.FACEBOOK, 0.81);
    }

    private static DatasetInfo dataset() {
        return new DatasetInfo("ds-1", "twitter-viral-dataset-1", Platform.TWITTER, "1.0.0", NOW, 1200, 60,
                null, null);
    }

    @Test
    void trainModel_pollsUntilJobCompletes() {
        when(trainingDataManager.prepareDataset(eq(Platform.TWITTER), any())).thenReturn(dataset());
        when(modelStateService.ensureRegistered(Platform.TWITTER)).thenReturn("model-7");
        when(modelRuntime.trainModel(any())).thenReturn("job-1");
        when(modelRuntime.getTrainingJob("job-1")).thenReturn(
                new TrainingJob("job-1", TrainingJob.Status.QUEUED, null, null),
                new TrainingJob("job-1", TrainingJob.Status.RUNNING, null, null),
                new TrainingJob("job-1", TrainingJob.Status.COMPLETED, Map.of("val_accuracy", 0.83), null));

        TrainingResult result = engine.trainModel(Platform.TWITTER);

        assertTrue(result.succeeded());
        assertEquals(0.83, result.accuracy());
        assertEquals("ds-1", result.datasetId());
        verify(modelRuntime, times(3)).getTrainingJob("job-1");
        verify(modelStateService).markTrained(Platform.TWITTER, 0.83, "job-1");
    }

    @Test
    void trainModel_failedJobIsReportedWithoutMarkingTrained() {
        when(trainingDataManager.prepareDataset(eq(Platform.TWITTER), any())).thenReturn(dataset());
        when(modelStateService.ensureRegistered(Platform.TWITTER)).thenReturn("model-7");
        when(modelRuntime.trainModel(any())).thenReturn("job-2");
        when(modelRuntime.getTrainingJob("job-2"))
                .thenReturn(new TrainingJob("job-2", TrainingJob.Status.FAILED, null, "out of memory"));

        TrainingResult result = engine.trainModel(Platform.TWITTER);

        assertFalse(result.succeeded());
        assertEquals("out of memory", result.message());
        verify(modelStateService, never()).markTrained(any(), any(), any());
    }

    @Test
    void trainModel_stopsPollingAtLimit() {
        properties.getLearning().setMaxJobPolls(4);
        when(trainingDataManager.prepareDataset(eq(Platform.TWITTER), any())).thenReturn(dataset());
        when(modelStateService.ensureRegistered(Platform.TWITTER)).thenReturn("model-7");
        when(modelRuntime.trainModel(any())).thenReturn("job-3");
        when(modelRuntime.getTrainingJob("job-3"))
                .thenReturn(new TrainingJob("job-3", TrainingJob.Status.RUNNING, null, null));

        TrainingResult result = engine.trainModel(Platform.TWITTER);

        assertEquals(TrainingJob.Status.RUNNING, result.status());
        verify(modelRuntime, times(4)).getTrainingJob("job-3");
    }

    @Test
    void trainModels_allPlatformsIsolatesFailures() {
        when(trainingDataManager.prepareDataset(any(), any())).thenThrow(new InsufficientDataException(10, 1000));

        List<TrainingResult> results = engine.trainModels(null);

        assertEquals(Platform.values().length, results.size());
        assertThat(results).allSatisfy(r -> {
            assertNull(r.status());
            assertFalse(r.succeeded());
        });
    }

    @Test
    void trainModels_singlePlatformPropagatesFailure() {
        when(trainingDataManager.prepareDataset(any(), any())).thenThrow(new InsufficientDataException(10, 1000));

        assertThrows(InsufficientDataException.class, () -> engine.trainModels(Platform.TIKTOK));
    }

    @Test
    void trainModel_overlappingRunOnSamePlatformIsRejected() {
        when(trainingDataManager.prepareDataset(eq(Platform.TWITTER), any())).thenAnswer(inv -> {
            assertTrue(engine.isModelBusy(Platform.TWITTER));
            assertFalse(engine.isModelBusy(Platform.YOUTUBE));
            assertThrows(ModelBusyException.class, () -> engine.trainModel(Platform.TWITTER));
            assertThrows(ModelBusyException.class, () -> engine.evaluateModel(Platform.TWITTER));
            return dataset();
        });
        when(modelStateService.ensureRegistered(Platform.TWITTER)).thenReturn("model-7");
        when(modelRuntime.trainModel(any())).thenReturn("job-4");
        when(modelRuntime.getTrainingJob("job-4"))
                .thenReturn(new TrainingJob("job-4", TrainingJob.Status.COMPLETED, Map.of("accuracy", 0.9), null));

        TrainingResult result = engine.trainModel(Platform.TWITTER);

        assertTrue(result.succeeded());
        assertFalse(engine.isModelBusy(Platform.TWITTER));
        verify(trainingDataManager, times(1)).prepareDataset(eq(Platform.TWITTER), any());
        verify(modelStateService, times(1)).markTrained(Platform.TWITTER, 0.9, "job-4");
        verify(modelStateService, never()).markEvaluated(any(), anyDouble());
    }

    @Test
    void trainModel_failedRunReleasesPlatform() {
        when(trainingDataManager.prepareDataset(any(), any())).thenThrow(new InsufficientDataException(10, 1000));

        assertThrows(InsufficientDataException.class, () -> engine.trainModel(Platform.LINKEDIN));

        assertFalse(engine.isModelBusy(Platform.LINKEDIN));
        assertThrows(InsufficientDataException.class, () -> engine.trainModel(Platform.LINKEDIN));
    }

    // ============ INTROSPECTION ============

    @Test
    void clearCache_forcesRecomputation() {
        ContentRequest request = request("Hello world", "facebook");
        engine.predictViralPotential(request);

        engine.clearCache();
        engine.predictViralPotential(request);

        verify(modelRuntime, times(2)).predict(any());
    }

    @Test
    void getTrendingFactors_exposesSeedTopicsAndPeakHours() {
        TrendingFactors factors = engine.getTrendingFactors(Platform.TIKTOK);

        assertEquals(Platform.TIKTOK.getOptimalHours(), factors.optimalHours());
        assertThat(factors.topics()).isNotEmpty();
    }
}
