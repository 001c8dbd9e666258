package com.viral.prediction.scheduler;

import com.viral.prediction.config.PredictionProperties;
import com.viral.prediction.exception.ModelBusyException;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import com.viral.prediction.service.feature.TrendingTopicStore;
import com.viral.prediction.service.training.TrainingDataManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Continuous-learning job queue: periodic retraining, evaluation and trend refresh.
 * Driven by {@link #tick(Instant)}, so tests can advance time without waiting.
 */
@Component
public class LearningScheduler {

    private static final Logger log = LoggerFactory.getLogger(LearningScheduler.class);

    public static final String DAILY_RETRAIN = "daily-retrain";
    public static final String WEEKLY_EVALUATE = "weekly-evaluate";
    public static final String TREND_REFRESH = "trend-refresh";

    private final ViralPredictionEngine engine;
    private final TrainingDataManager trainingDataManager;
    private final TrendingTopicStore trendingTopicStore;
    private final PredictionProperties properties;
    private final List<ScheduledJob> jobs = new ArrayList<>();

    public LearningScheduler(ViralPredictionEngine engine, TrainingDataManager trainingDataManager,
                             TrendingTopicStore trendingTopicStore, PredictionProperties properties, Clock clock) {
        this.engine = engine;
        this.trainingDataManager = trainingDataManager;
        this.trendingTopicStore = trendingTopicStore;
        this.properties = properties;

        Instant start = clock.instant();
        PredictionProperties.Scheduler cadence = properties.getScheduler();
        jobs.add(new ScheduledJob(DAILY_RETRAIN, cadence.getRetrainInterval(), start, now -> retrain()));
        jobs.add(new ScheduledJob(WEEKLY_EVALUATE, cadence.getEvaluationInterval(), start, now -> evaluate()));
        jobs.add(new ScheduledJob(TREND_REFRESH, cadence.getTrendRefreshInterval(), start,
                trendingTopicStore::refresh));
    }

    /**
     * Runs every job that is due at {@code now}, each at most once. A failed job is still rescheduled.
     *
     * @return names of the jobs that ran
     */
    public List<String> tick(Instant now) {
        List<String> ran = new ArrayList<>();
        for (ScheduledJob job : jobs) {
            if (!job.isDue(now)) {
                continue;
            }
            if (!job.running.compareAndSet(false, true)) {
                log.debug("Skipping {}: previous run still in progress", job.name);
                continue;
            }
            try {
                log.info("Running scheduled job {}", job.name);
                job.task.accept(now);
            } catch (Exception e) {
                log.error("Scheduled job {} failed: {}", job.name, e.getMessage(), e);
            } finally {
                job.nextRun = now.plus(job.interval);
                job.running.set(false);
                ran.add(job.name);
            }
        }
        return ran;
    }

    public List<JobStatus> getJobs() {
        return jobs.stream()
                .map(job -> new JobStatus(job.name, job.interval, job.nextRun, job.running.get()))
                .toList();
    }

    public Optional<JobStatus> getJob(String name) {
        return getJobs().stream().filter(j -> j.name().equals(name)).findFirst();
    }

    // ============ JOBS ============

    void retrain() {
        int days = properties.getLearning().getRecentDataDays();
        int minPoints = properties.getLearning().getRetrainMinNewPoints();

        for (Platform platform : Platform.values()) {
            try {
                int recent = trainingDataManager.getRecentData(platform, days).size();
                if (recent < minPoints) {
                    log.debug("Not retraining {}: {} new points (need {})", platform.getId(), recent, minPoints);
                    continue;
                }
                engine.trainModels(platform);
            } catch (ModelBusyException e) {
                log.info("Not retraining {}: {}", platform.getId(), e.getMessage());
            } catch (Exception e) {
                log.warn("Retraining {} failed: {}", platform.getId(), e.getMessage());
            }
        }
    }

    void evaluate() {
        for (Platform platform : Platform.values()) {
            try {
                engine.evaluateModel(platform);
            } catch (ModelBusyException e) {
                log.info("Not evaluating {}: {}", platform.getId(), e.getMessage());
            } catch (Exception e) {
                log.warn("Evaluating {} failed: {}", platform.getId(), e.getMessage());
            }
        }
    }

    // ============ TYPES ============

    private static final class ScheduledJob {
        private final String name;
        private final Duration interval;
        private final Consumer<Instant> task;
        private final AtomicBoolean running = new AtomicBoolean(false);
        private volatile Instant nextRun;

        private ScheduledJob(String name, Duration interval, Instant firstRun, Consumer<Instant> task) {
            this.name = name;
            this.interval = interval;
            this.nextRun = firstRun;
            this.task = task;
        }

        private boolean isDue(Instant now) {
            return !now.isBefore(nextRun);
        }
    }

    public record JobStatus(String name, Duration interval, Instant nextRun, boolean running) {}
}
