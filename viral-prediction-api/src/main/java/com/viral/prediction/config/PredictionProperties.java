package com.viral.prediction.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "viral.prediction")
public class PredictionProperties {

    private final Cache cache = new Cache();
    private final Learning learning = new Learning();
    private final Dataset dataset = new Dataset();
    private final Scheduler scheduler = new Scheduler();

    /**
     * Deadline for a single Model Runtime call on the prediction path.
     */
    private Duration runtimeTimeout = Duration.ofSeconds(5);

    public Cache getCache() { return cache; }
    public Learning getLearning() { return learning; }
    public Dataset getDataset() { return dataset; }
    public Scheduler getScheduler() { return scheduler; }

    public Duration getRuntimeTimeout() { return runtimeTimeout; }
    public void setRuntimeTimeout(Duration runtimeTimeout) { this.runtimeTimeout = runtimeTimeout; }

    public static class Cache {
        private Duration ttl = Duration.ofHours(1);
        private long maximumSize = 10_000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public long getMaximumSize() { return maximumSize; }
        public void setMaximumSize(long maximumSize) { this.maximumSize = maximumSize; }
    }

    public static class Learning {
        private int retrainMinNewPoints = 100;
        private int recentDataDays = 7;
        private int maxJobPolls = 60;
        private Duration jobPollInterval = Duration.ofSeconds(10);
        private boolean registerOnStartup = true;

        public int getRetrainMinNewPoints() { return retrainMinNewPoints; }
        public void setRetrainMinNewPoints(int retrainMinNewPoints) { this.retrainMinNewPoints = retrainMinNewPoints; }

        public int getRecentDataDays() { return recentDataDays; }
        public void setRecentDataDays(int recentDataDays) { this.recentDataDays = recentDataDays; }

        public int getMaxJobPolls() { return maxJobPolls; }
        public void setMaxJobPolls(int maxJobPolls) { this.maxJobPolls = maxJobPolls; }

        public Duration getJobPollInterval() { return jobPollInterval; }
        public void setJobPollInterval(Duration jobPollInterval) { this.jobPollInterval = jobPollInterval; }

        public boolean isRegisterOnStartup() { return registerOnStartup; }
        public void setRegisterOnStartup(boolean registerOnStartup) { this.registerOnStartup = registerOnStartup; }
    }

    public static class Dataset {
        private int minSamples = 1000;
        private double qualityThreshold = 0.8;
        private long shuffleSeed = 42L;

        public int getMinSamples() { return minSamples; }
        public void setMinSamples(int minSamples) { this.minSamples = minSamples; }

        public double getQualityThreshold() { return qualityThreshold; }
        public void setQualityThreshold(double qualityThreshold) { this.qualityThreshold = qualityThreshold; }

        public long getShuffleSeed() { return shuffleSeed; }
        public void setShuffleSeed(long shuffleSeed) { this.shuffleSeed = shuffleSeed; }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration retrainInterval = Duration.ofDays(1);
        private Duration evaluationInterval = Duration.ofDays(7);
        private Duration trendRefreshInterval = Duration.ofMinutes(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getRetrainInterval() { return retrainInterval; }
        public void setRetrainInterval(Duration retrainInterval) { this.retrainInterval = retrainInterval; }

        public Duration getEvaluationInterval() { return evaluationInterval; }
        public void setEvaluationInterval(Duration evaluationInterval) { this.evaluationInterval = evaluationInterval; }

        public Duration getTrendRefreshInterval() { return trendRefreshInterval; }
        public void setTrendRefreshInterval(Duration trendRefreshInterval) { this.trendRefreshInterval = trendRefreshInterval; }
    }
}
