package com.viral.prediction.service.engine;

import com.viral.prediction.config.PredictionProperties;
import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralMetrics;
import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.exception.ModelBusyException;
import com.viral.prediction.exception.UnsupportedPlatformException;
import com.viral.prediction.model.Platform;
import com.viral.prediction.model.ViralDataPointDocument;
import com.viral.prediction.service.cache.PredictionCache;
import com.viral.prediction.service.explain.ExplainableAI;
import com.viral.prediction.service.explain.ExplanationConfig;
import com.viral.prediction.service.explain.ViralExplanation;
import com.viral.prediction.service.feature.ContentFeatures;
import com.viral.prediction.service.feature.FeatureDictionary;
import com.viral.prediction.service.feature.FeatureExtractor;
import com.viral.prediction.service.feature.TrendingTopicStore;
import com.viral.prediction.service.platform.PlatformModel;
import com.viral.prediction.service.platform.PlatformModelRegistry;
import com.viral.prediction.service.platform.PlatformPrediction;
import com.viral.prediction.service.training.DatasetInfo;
import com.viral.prediction.service.training.DatasetOptions;
import com.viral.prediction.service.training.TrainingDataManager;
import com.viral.runtime.client.ModelRuntime;
import com.viral.runtime.dto.ModelMetrics;
import com.viral.runtime.dto.PredictRequest;
import com.viral.runtime.dto.RuntimePrediction;
import com.viral.runtime.dto.TrainRequest;
import com.viral.runtime.dto.TrainingConfig;
import com.viral.runtime.dto.TrainingJob;
import com.viral.runtime.exception.ModelRuntimeException;
import com.viral.runtime.exception.ModelRuntimeTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static com.viral.prediction.util.ScoreMath.clamp;
import static com.viral.prediction.util.ScoreMath.clamp01;
import static com.viral.prediction.util.ScoreMath.round1;
import static com.viral.prediction.util.ScoreMath.round3;

/**
 * Orchestrates a prediction: features, platform model, runtime model, blending, explanation and caching.
 * Scoring failures never reach the caller; they produce a neutral fallback prediction instead.
 */
@Service
public class ViralPredictionEngine {

    private static final Logger log = LoggerFactory.getLogger(ViralPredictionEngine.class);

    public static final double FALLBACK_SCORE = 50.0;
    public static final double FALLBACK_CONFIDENCE = 0.3;
    static final String FALLBACK_SUMMARY = "Prediction unavailable";

    private static final double PLATFORM_BLEND = 0.5;
    private static final int STRATEGY_SECONDARY_COUNT = 2;
    private static final int STRATEGY_MODIFICATIONS = 3;
    static final int BATCH_CHUNK_SIZE = 50;

    private final FeatureExtractor featureExtractor;
    private final PlatformModelRegistry modelRegistry;
    private final ModelRuntime modelRuntime;
    private final ExplainableAI explainableAI;
    private final TrainingDataManager trainingDataManager;
    private final PredictionCache predictionCache;
    private final PlatformModelStateService modelStateService;
    private final TrendingTopicStore trendingTopicStore;
    private final PredictionProperties properties;
    private final Clock clock;
    private final Executor predictionExecutor;
    private final Executor batchExecutor;
    private final Map<Platform, AtomicBoolean> modelRuns = new EnumMap<>(Platform.class);

    public ViralPredictionEngine(
            FeatureExtractor featureExtractor,
            PlatformModelRegistry modelRegistry,
            ModelRuntime modelRuntime,
            ExplainableAI explainableAI,
            TrainingDataManager trainingDataManager,
            PredictionCache predictionCache,
            PlatformModelStateService modelStateService,
            TrendingTopicStore trendingTopicStore,
            PredictionProperties properties,
            Clock clock,
            @Qualifier("predictionExecutor") Executor predictionExecutor,
            @Qualifier("batchExecutor") Executor batchExecutor
    ) {
        this.featureExtractor = featureExtractor;
        this.modelRegistry = modelRegistry;
        this.modelRuntime = modelRuntime;
        this.explainableAI = explainableAI;
        this.trainingDataManager = trainingDataManager;
        this.predictionCache = predictionCache;
        this.modelStateService = modelStateService;
        this.trendingTopicStore = trendingTopicStore;
        this.properties = properties;
        this.clock = clock;
        this.predictionExecutor = predictionExecutor;
        this.batchExecutor = batchExecutor;
        for (Platform platform : Platform.values()) {
            modelRuns.put(platform, new AtomicBoolean(false));
        }
    }

    // ============ PREDICTION ============

    /**
     * Scores one request. An unknown platform is rejected; any other failure yields the fallback prediction.
     */
    public ViralPrediction predictViralPotential(ContentRequest request) {
        Platform platform = Platform.fromId(request.platform());
        String cacheKey = PredictionCache.fingerprint(request, platform);

        Optional<ViralPrediction> cached = predictionCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Cache hit for {} prediction {}", platform.getId(), cached.get().predictionId());
            return cached.get();
        }

        try {
            ContentFeatures features = featureExtractor.extractFeatures(request);
            PlatformModel model = modelRegistry.get(platform);
            PlatformPrediction platformPrediction = model.predict(features, request.metadata());
            RuntimePrediction runtimePrediction = runtimePredict(platform, features);

            ViralPrediction prediction = assemble(request, platform, features, platformPrediction, runtimePrediction);
            predictionCache.put(cacheKey, prediction);
            recordAsync(request, prediction, features);
            return prediction;
        } catch (UnsupportedPlatformException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Prediction failed for {}, returning fallback: {}", platform.getId(), e.getMessage());
            return fallback(platform);
        }
    }

    private RuntimePrediction runtimePredict(Platform platform, ContentFeatures features) {
        PredictRequest request = new PredictRequest(
                modelStateService.runtimeModelId(platform),
                FeatureDictionary.toMap(features),
                PredictRequest.Options.full());
        Duration timeout = properties.getRuntimeTimeout();

        CompletableFuture<RuntimePrediction> call =
                CompletableFuture.supplyAsync(() -> modelRuntime.predict(request), predictionExecutor);
        try {
            RuntimePrediction result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Runtime prediction for {}: {}", platform.getId(), result.prediction());
            return result;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ModelRuntimeTimeoutException("predict", timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ModelRuntimeException("predict", String.valueOf(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelRuntimeException("predict", "interrupted", e);
        }
    }

    private ViralPrediction assemble(ContentRequest request, Platform platform, ContentFeatures features,
                                     PlatformPrediction platformPrediction, RuntimePrediction runtimePrediction) {
        double raw = PLATFORM_BLEND * (platformPrediction.viralScore() / 100.0)
                + (1 - PLATFORM_BLEND) * clamp01(runtimePrediction.prediction());
        double viralScore = round1(normalizeScore(raw, platform));
        double confidence = round3(clamp01(PLATFORM_BLEND * platformPrediction.confidence()
                + (1 - PLATFORM_BLEND) * runtimePrediction.confidence()));

        ViralMetrics metrics = viralMetrics(features);
        ViralExplanation explanation = explainableAI.explainPrediction(viralScore, confidence, features, platform,
                ExplanationConfig.defaults());

        List<String> recommendations = new ArrayList<>(recommendations(features, metrics, request, platform));
        platformPrediction.recommendations().stream()
                .filter(r -> !recommendations.contains(r))
                .forEach(recommendations::add);

        return new ViralPrediction(
                UUID.randomUUID().toString(),
                viralScore,
                confidence,
                platform,
                round1(timeToViral(metrics, features)),
                round3(peakEngagement(metrics, features)),
                explanation,
                recommendations,
                riskFactors(features, platform),
                round3(competitiveAdvantage(features, request.context())),
                optimalPostingTime(platform, request, clock.instant()),
                metrics,
                platformPrediction.predictedMetrics(),
                false,
                clock.instant()
        );
    }

    private void recordAsync(ContentRequest request, ViralPrediction prediction, ContentFeatures features) {
        try {
            CompletableFuture
                    .runAsync(() -> trainingDataManager.recordPrediction(request, prediction, features), batchExecutor)
                    .exceptionally(e -> {
                        log.warn("Failed to record prediction {}: {}", prediction.predictionId(), e.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Prediction {} not recorded, batch pool saturated", prediction.predictionId());
        }
    }

    ViralPrediction fallback(Platform platform) {
        return new ViralPrediction(
                UUID.randomUUID().toString(),
                FALLBACK_SCORE,
                FALLBACK_CONFIDENCE,
                platform,
                24.0,
                0.05,
                ViralExplanation.empty(FALLBACK_SUMMARY),
                List.of("Retry prediction when services are available"),
                List.of("Prediction uncertainty due to service issues"),
                0.5,
                null,
                ViralMetrics.NONE,
                Map.of(),
                true,
                clock.instant()
        );
    }

    // ============ SCORE DERIVATION ============

    /**
     * Maps a 0-1 blended output onto the 0-100 scale so that the platform's viral, trending and
     * moderate cut-offs land on 90, 70 and 40. Monotonic in {@code raw}.
     */
    public static double normalizeScore(double raw, Platform platform) {
        double[] cutoffs = switch (platform) {
            case TIKTOK -> new double[]{90, 70, 50};
            case TWITTER -> new double[]{85, 65, 45};
            default -> new double[]{80, 60, 40};
        };
        double viral = cutoffs[0];
        double trending = cutoffs[1];
        double moderate = cutoffs[2];

        double n = clamp(raw * 100, 0, 100);
        if (n >= viral) {
            return 90 + (n - viral) / (100 - viral) * 10;
        } else if (n >= trending) {
            return 70 + (n - trending) / (viral - trending) * 20;
        } else if (n >= moderate) {
            return 40 + (n - moderate) / (trending - moderate) * 30;
        }
        return n / moderate * 40;
    }

    static ViralMetrics viralMetrics(ContentFeatures f) {
        double sentiment = f.sentiment().sentimentScore();
        double emotion = f.sentiment().emotionalScore();
        double readability = f.text().readabilityScore() / 100.0;
        double trend = f.trending().trendingTopicsScore();

        return new ViralMetrics(
                round3(clamp(sentiment * 0.05 + emotion * 0.1, 0, 0.15)),
                round3(clamp(trend * 0.02 + emotion * 0.01, 0, 0.03)),
                round3(clamp(readability * 0.05 + emotion * 0.03, 0, 0.08)),
                round1(clamp(trend * 100 + emotion * 50, 0, 100)),
                round3(clamp(readability * 0.6 + sentiment * 0.2, 0, 0.8)),
                round3(clamp01(trend * 0.7 + Math.min(10, f.social().hashtagCount()) / 10.0 * 0.3))
        );
    }

    static double timeToViral(ViralMetrics metrics, ContentFeatures f) {
        double velocityFactor = Math.max(0.1, metrics.viralVelocity() / 100);
        return Math.max(1, 24 / (velocityFactor * (1 + f.trending().trendingTopicsScore())));
    }

    static double peakEngagement(ViralMetrics metrics, ContentFeatures f) {
        return Math.min(0.5, metrics.engagementRate() * 2 * (1 + f.creator().influenceScore()));
    }

    static double competitiveAdvantage(ContentFeatures f, ContentRequest.Context context) {
        double advantage = 0.5
                + f.trending().trendingTopicsScore() * 0.3
                + f.timing().optimalTimingScore() * 0.2;
        if (context != null && !context.trends().isEmpty()) {
            advantage += 0.1;
        }
        if (context != null && !context.competitors().isEmpty()) {
            advantage += 0.05;
        }
        return Math.min(1.0, advantage);
    }

    static List<String> recommendations(ContentFeatures f, ViralMetrics metrics, ContentRequest request,
                                        Platform platform) {
        List<String> recommendations = new ArrayList<>();
        if (f.social().hashtagCount() < 3) {
            recommendations.add("Add 2-3 more relevant hashtags to increase discoverability");
        }
        if (f.sentiment().sentimentScore() < 0.2) {
            recommendations.add("Use more positive or emotionally engaging language");
        }
        if (f.text().readabilityScore() < 60) {
            recommendations.add("Simplify language for better readability and broader appeal");
        }
        if (f.trending().trendingTopicsScore() < 0.3) {
            recommendations.add("Incorporate current trending topics or events");
        }
        if (request.content().text().length() > 200 && platform == Platform.TWITTER) {
            recommendations.add("Consider shortening content for Twitter's fast-paced environment");
        }
        if (request.content().media().isEmpty() && platform == Platform.INSTAGRAM) {
            recommendations.add("Add visual content - Instagram heavily favors posts with images or videos");
        }
        if (metrics.shareRate() < 0.01) {
            recommendations.add("Include a clear call-to-action encouraging shares");
        }
        return recommendations;
    }

    static List<String> riskFactors(ContentFeatures f, Platform platform) {
        List<String> risks = new ArrayList<>();
        if (f.sentiment().sentimentScore() < -0.3) {
            risks.add("Negative sentiment may limit viral spread");
        }
        if (f.text().textLength() > 500 && platform != Platform.LINKEDIN) {
            risks.add("Content may be too long for platform audience");
        }
        if (f.social().hashtagCount() > 10) {
            risks.add("Too many hashtags may appear spammy");
        }
        if (f.text().readabilityScore() > 80) {
            risks.add("Content may be too simple and lack depth");
        }
        return risks;
    }

    /**
     * Next optimal posting hour strictly after {@code now} in the request's time zone (UTC when absent),
     * otherwise the platform's first optimal hour tomorrow.
     */
    static Instant optimalPostingTime(Platform platform, ContentRequest request, Instant now) {
        ZoneId zone = request.timing() != null && request.timing().timezone() != null
                ? FeatureExtractor.resolveZone(request.timing().timezone())
                : ZoneOffset.UTC;
        ZonedDateTime local = now.atZone(zone);
        List<Integer> hours = platform.getOptimalHours();

        for (int hour : hours) {
            ZonedDateTime candidate = local.truncatedTo(ChronoUnit.DAYS).withHour(hour);
            if (candidate.isAfter(local)) {
                return candidate.toInstant();
            }
        }
        return local.truncatedTo(ChronoUnit.DAYS).plusDays(1).withHour(hours.get(0)).toInstant();
    }

    // ============ BATCH & COMPARISON ============

    /**
     * Scores every request concurrently, {@value #BATCH_CHUNK_SIZE} at a time. Output order and size match
     * the input; a failing item (unknown platform included) becomes a fallback prediction. An item the batch
     * pool does not accept is scored on the calling thread.
     */
    public List<ViralPrediction> batchPredict(List<ContentRequest> requests) {
        List<ViralPrediction> predictions = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i += BATCH_CHUNK_SIZE) {
            List<ContentRequest> chunk = requests.subList(i, Math.min(i + BATCH_CHUNK_SIZE, requests.size()));
            List<CompletableFuture<ViralPrediction>> futures = chunk.stream()
                    .map(this::submitIsolated)
                    .toList();
            futures.stream()
                    .map(CompletableFuture::join)
                    .forEach(predictions::add);
        }
        return predictions;
    }

    private CompletableFuture<ViralPrediction> submitIsolated(ContentRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> predictIsolated(request), batchExecutor);
        } catch (RejectedExecutionException e) {
            log.debug("Batch pool saturated, scoring '{}' item inline", request.platform());
            return CompletableFuture.completedFuture(predictIsolated(request));
        }
    }

    private ViralPrediction predictIsolated(ContentRequest request) {
        try {
            return predictViralPotential(request);
        } catch (Exception e) {
            log.warn("Batch item for platform '{}' failed: {}", request.platform(), e.getMessage());
            return fallback(platformOrNull(request.platform()));
        }
    }

    private static Platform platformOrNull(String id) {
        try {
            return Platform.fromId(id);
        } catch (UnsupportedPlatformException e) {
            return null;
        }
    }

    /**
     * Same content scored on each platform, keyed in input order.
     */
    public Map<Platform, ViralPrediction> comparePlatforms(ContentRequest content, List<Platform> platforms) {
        if (platforms == null || platforms.isEmpty()) {
            throw new IllegalArgumentException("At least one platform is required");
        }
        List<Platform> distinct = new ArrayList<>(new LinkedHashSet<>(platforms));
        List<ContentRequest> requests = distinct.stream()
                .map(p -> content.withPlatform(p.getId()))
                .toList();
        List<ViralPrediction> predictions = batchPredict(requests);

        Map<Platform, ViralPrediction> comparison = new LinkedHashMap<>();
        for (int i = 0; i < distinct.size(); i++) {
            comparison.put(distinct.get(i), predictions.get(i));
        }
        return comparison;
    }

    public OptimalStrategy getOptimalStrategy(ContentRequest content, List<Platform> platforms) {
        Map<Platform, ViralPrediction> comparison = comparePlatforms(content, platforms);

        List<Platform> ranked = comparison.entrySet().stream()
                .sorted(Comparator.comparingDouble(
                        (Map.Entry<Platform, ViralPrediction> e) -> e.getValue().viralScore()).reversed())
                .map(Map.Entry::getKey)
                .toList();

        Map<Platform, Instant> timing = new LinkedHashMap<>();
        Map<Platform, List<String>> modifications = new LinkedHashMap<>();
        Instant now = clock.instant();
        for (Map.Entry<Platform, ViralPrediction> entry : comparison.entrySet()) {
            ViralPrediction prediction = entry.getValue();
            timing.put(entry.getKey(), prediction.optimalPostingTime() != null
                    ? prediction.optimalPostingTime()
                    : optimalPostingTime(entry.getKey(), content, now));
            modifications.put(entry.getKey(), prediction.recommendations().stream()
                    .limit(STRATEGY_MODIFICATIONS)
                    .toList());
        }

        return new OptimalStrategy(
                ranked.get(0),
                ranked.subList(1, Math.min(ranked.size(), 1 + STRATEGY_SECONDARY_COUNT)),
                timing,
                modifications);
    }

    /**
     * Scores each variant on one platform and picks the one with the best projected engagement mix.
     */
    public ABTestResult abTestContent(List<ContentRequest> variants, Platform platform) {
        if (variants == null || variants.isEmpty()) {
            throw new IllegalArgumentException("At least one variant is required");
        }
        List<ViralPrediction> predictions = batchPredict(variants.stream()
                .map(v -> v.withPlatform(platform.getId()))
                .toList());

        List<ABTestResult.VariantResult> results = new ArrayList<>();
        int winner = 0;
        double best = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < predictions.size(); i++) {
            ViralPrediction p = predictions.get(i);
            double composite = round3(abComposite(p));
            results.add(new ABTestResult.VariantResult("variation_" + i, p.viralScore(), p.confidence(),
                    composite, p.viralMetrics(), p.fallback()));
            if (composite > best) {
                best = composite;
                winner = i;
            }
        }

        DoubleSummaryStatistics scores = predictions.stream().mapToDouble(ViralPrediction::viralScore)
                .summaryStatistics();
        double spread = scores.getMax() - scores.getMin();
        double runnerUp = 0;
        for (int i = 0; i < predictions.size(); i++) {
            if (i != winner) {
                runnerUp = Math.max(runnerUp, predictions.get(i).viralScore());
            }
        }
        double margin = predictions.size() > 1 ? Math.max(0, predictions.get(winner).viralScore() - runnerUp) : 0;
        double confidence = clamp01(predictions.get(winner).confidence() * (0.5 + 0.5 * Math.min(1, margin / 10)));

        return new ABTestResult(winner, variants.get(winner), round3(confidence), round1(spread), results);
    }

    private static double abComposite(ViralPrediction p) {
        ViralMetrics m = p.viralMetrics();
        return m.engagementRate() * 0.3
                + m.shareRate() * 0.25
                + m.viralVelocity() / 100 * 0.2
                + m.sustainedEngagement() * 0.15
                + m.crossPlatformSpread() * 0.1;
    }

    // ============ MODEL LIFECYCLE ============

    /**
     * Runs {@code work} while holding the platform's model slot. Training and evaluation of one platform
     * never overlap, whether started by a request or by the scheduler.
     *
     * @throws ModelBusyException when another run holds the slot
     */
    private <T> T exclusively(Platform platform, String operation, Supplier<T> work) {
        AtomicBoolean running = modelRuns.get(platform);
        if (!running.compareAndSet(false, true)) {
            log.info("Skipping {} of {} model: another run is in progress", operation, platform.getId());
            throw new ModelBusyException(platform.getId(), operation);
        }
        try {
            return work.get();
        } finally {
            running.set(false);
        }
    }

    public boolean isModelBusy(Platform platform) {
        return modelRuns.get(platform).get();
    }

    /**
     * Re-scores the latest test split with the platform model. Falls back to the runtime's reported
     * accuracy when there is no test data.
     *
     * @throws ModelBusyException when the platform is being trained or evaluated already
     */
    public ModelPerformance evaluateModel(Platform platform) {
        return exclusively(platform, "evaluate", () -> doEvaluateModel(platform));
    }

    private ModelPerformance doEvaluateModel(Platform platform) {
        PlatformModel model = modelRegistry.get(platform);
        List<ViralDataPointDocument> testData = trainingDataManager.getTestDataset(platform);
        Instant now = clock.instant();

        ModelPerformance performance;
        if (testData.isEmpty()) {
            ModelMetrics metrics = modelRuntime.getModelMetrics(modelStateService.runtimeModelId(platform));
            performance = new ModelPerformance(platform, metrics.accuracy(),
                    orZero(metrics.precision()), orZero(metrics.recall()), orZero(metrics.f1Score()),
                    metrics.auc() != null ? metrics.auc() : 0.5,
                    List.of(List.of(0L, 0L), List.of(0L, 0L)), 0, "runtime", now);
        } else {
            double threshold = model.config().thresholds().trending();
            double[] scores = new double[testData.size()];
            boolean[] actual = new boolean[testData.size()];
            long tn = 0, fp = 0, fn = 0, tp = 0;

            for (int i = 0; i < testData.size(); i++) {
                ViralDataPointDocument point = testData.get(i);
                scores[i] = model.predict(FeatureDictionary.fromMap(point.getFeatures()), null).viralScore();
                actual[i] = point.getLabels() != null && point.getLabels().viral();
                boolean predicted = scores[i] >= threshold;
                if (actual[i] && predicted) tp++;
                else if (actual[i]) fn++;
                else if (predicted) fp++;
                else tn++;
            }

            int n = testData.size();
            double accuracy = (double) (tp + tn) / n;
            double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
            double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
            double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);

            performance = new ModelPerformance(platform, round3(accuracy), round3(precision), round3(recall),
                    round3(f1), round3(auc(scores, actual)),
                    List.of(List.of(tn, fp), List.of(fn, tp)), n, "test-split", now);
        }

        modelStateService.markEvaluated(platform, performance.accuracy());
        log.info("Evaluated {} model: accuracy={}, f1={}, samples={} ({})", platform.getId(),
                performance.accuracy(), performance.f1Score(), performance.samples(), performance.source());
        return performance;
    }

    /**
     * Area under the ROC curve via the rank statistic; tied scores share their average rank.
     * 0.5 when only one class is present.
     */
    static double auc(double[] scores, boolean[] positive) {
        int n = scores.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(idx -> scores[idx]));

        double[] ranks = new double[n];
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1;
            for (int k = i; k <= j; k++) {
                ranks[order[k]] = averageRank;
            }
            i = j + 1;
        }

        long positives = 0;
        double positiveRankSum = 0;
        for (int k = 0; k < n; k++) {
            if (positive[k]) {
                positives++;
                positiveRankSum += ranks[k];
            }
        }
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return 0.5;
        }
        return (positiveRankSum - positives * (positives + 1) / 2.0) / (positives * negatives);
    }

    /**
     * Trains one platform. Data and runtime failures propagate to the caller.
     *
     * @throws ModelBusyException when the platform is being trained or evaluated already
     */
    public TrainingResult trainModel(Platform platform) {
        return exclusively(platform, "train", () -> doTrainModel(platform));
    }

    private TrainingResult doTrainModel(Platform platform) {
        log.info("Training {} model", platform.getId());
        DatasetInfo dataset = trainingDataManager.prepareDataset(platform, DatasetOptions.defaults());
        String modelId = modelStateService.ensureRegistered(platform);

        String jobId = modelRuntime.trainModel(new TrainRequest(modelId, dataset.id(),
                TrainingConfig.viralDefaults()));
        TrainingJob job = awaitJob(jobId);

        if (job.status() == TrainingJob.Status.COMPLETED) {
            Double accuracy = job.metric("accuracy") != null ? job.metric("accuracy") : job.metric("val_accuracy");
            modelStateService.markTrained(platform, accuracy, jobId);
            log.info("Training of {} completed (job {}, accuracy={})", platform.getId(), jobId, accuracy);
            return new TrainingResult(platform, job.status(), jobId, dataset.id(), accuracy, "completed");
        }

        if (job.status() == TrainingJob.Status.FAILED) {
            log.warn("Training of {} failed (job {}): {}", platform.getId(), jobId, job.error());
        } else {
            log.warn("Training of {} still {} after polling limit (job {})", platform.getId(), job.status(), jobId);
        }
        return new TrainingResult(platform, job.status(), jobId, dataset.id(), null,
                job.error() != null ? job.error() : "job " + job.status());
    }

    /**
     * Trains the given platform, or every platform when {@code platform} is null.
     * In the all-platforms case each platform is isolated: a failure is logged and reported, not thrown.
     */
    public List<TrainingResult> trainModels(Platform platform) {
        if (platform != null) {
            return List.of(trainModel(platform));
        }

        List<TrainingResult> results = new ArrayList<>();
        for (Platform p : Platform.values()) {
            try {
                results.add(trainModel(p));
            } catch (Exception e) {
                log.warn("Training skipped for {}: {}", p.getId(), e.getMessage());
                results.add(new TrainingResult(p, null, null, null, null, e.getMessage()));
            }
        }
        return results;
    }

    private TrainingJob awaitJob(String jobId) {
        int maxPolls = Math.max(1, properties.getLearning().getMaxJobPolls());
        Duration interval = properties.getLearning().getJobPollInterval();

        TrainingJob job = modelRuntime.getTrainingJob(jobId);
        for (int poll = 1; poll < maxPolls && !job.isTerminal(); poll++) {
            sleep(interval);
            job = modelRuntime.getTrainingJob(jobId);
        }
        return job;
    }

    private static void sleep(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelRuntimeException("getTrainingJob", "interrupted while waiting for job", e);
        }
    }

    // ============ INTROSPECTION ============

    public TrendingFactors getTrendingFactors(Platform platform) {
        return new TrendingFactors(platform, trendingTopicStore.getTopics(platform), platform.getOptimalHours(),
                platform.getOptimalDays(), trendingTopicStore.getLastRefreshed());
    }

    public void clearCache() {
        predictionCache.clear();
        log.info("Prediction cache cleared");
    }

    public PredictionCache.CacheStats getCacheStats() {
        return predictionCache.stats();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
