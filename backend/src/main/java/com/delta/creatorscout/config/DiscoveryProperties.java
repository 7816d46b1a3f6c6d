package com.delta.creatorscout.config;

import com.delta.creatorscout.discovery.model.Platform;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private static final String DEFAULT_USER_AGENT = "creator-scout/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 100;
    private int perHostConcurrency = 5;
    private int globalConcurrency = 8;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private Provider provider = new Provider();
    private Jobs jobs = new Jobs();
    private Enrichment enrichment = new Enrichment();
    private Continuation continuation = new Continuation();
    private Recovery recovery = new Recovery();
    private Invocation invocation = new Invocation();
    private Worker worker = new Worker();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Continuation getContinuation() {
        return continuation;
    }

    public void setContinuation(Continuation continuation) {
        this.continuation = continuation;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Invocation getInvocation() {
        return invocation;
    }

    public void setInvocation(Invocation invocation) {
        this.invocation = invocation;
    }

    /**
     * Invocation wall-clock budget, never shorter than one full enrichment batch plus a search
     * request.
     */
    public int getInvocationBudgetSeconds() {
        Enrichment config = getEnrichment();
        long batchMs = config.getRequestTimeoutSeconds() * 1000L
            + (long) config.getInterRequestDelayMs() * (config.getBatchSize() - 1)
            + config.getInterBatchDelayMs()
            + 1000L;
        long floorSeconds = getRequestTimeoutSeconds() + (batchMs + 999) / 1000;
        return (int) Math.max(getInvocation().getMaxDurationSeconds(), floorSeconds);
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Provider {
        private String baseUrl = "https://api.scrapecreators.com";
        private String apiKey;
        private String region = "US";

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return "https://api.scrapecreators.com";
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getRegion() {
            return region == null || region.isBlank() ? "US" : region.trim();
        }

        public void setRegion(String region) {
            this.region = region;
        }
    }

    public static class Jobs {
        private int defaultMaxApiCalls = 50;
        private int maxApiCallsCeiling = 500;
        private int maxTargetResults = 1000;
        private int timeoutMinutes = 60;

        public int getDefaultMaxApiCalls() {
            return Math.max(1, defaultMaxApiCalls);
        }

        public void setDefaultMaxApiCalls(int defaultMaxApiCalls) {
            this.defaultMaxApiCalls = Math.max(1, defaultMaxApiCalls);
        }

        public int getMaxApiCallsCeiling() {
            return Math.max(getDefaultMaxApiCalls(), maxApiCallsCeiling);
        }

        public void setMaxApiCallsCeiling(int maxApiCallsCeiling) {
            this.maxApiCallsCeiling = maxApiCallsCeiling;
        }

        public int getMaxTargetResults() {
            return Math.max(1, maxTargetResults);
        }

        public void setMaxTargetResults(int maxTargetResults) {
            this.maxTargetResults = Math.max(1, maxTargetResults);
        }

        public int getTimeoutMinutes() {
            return timeoutMinutes;
        }

        public void setTimeoutMinutes(int timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
        }
    }

    public static class Enrichment {
        private int batchSize = 3;
        private int interRequestDelayMs = 100;
        private int interBatchDelayMs = 200;
        private int requestTimeoutSeconds = 10;

        public int getBatchSize() {
            return Math.min(5, Math.max(1, batchSize));
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.min(5, Math.max(1, batchSize));
        }

        public int getInterRequestDelayMs() {
            return Math.max(0, interRequestDelayMs);
        }

        public void setInterRequestDelayMs(int interRequestDelayMs) {
            this.interRequestDelayMs = Math.max(0, interRequestDelayMs);
        }

        public int getInterBatchDelayMs() {
            return Math.max(0, interBatchDelayMs);
        }

        public void setInterBatchDelayMs(int interBatchDelayMs) {
            this.interBatchDelayMs = Math.max(0, interBatchDelayMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Continuation {
        private int tiktokDelayMs = 1000;
        private int instagramDelayMs = 2000;
        private int youtubeDelayMs = 1000;
        private int minDelayMs = 250;
        private int retryBackoffMs = 5000;
        private int rateLimitBackoffMs = 30000;
        private int maxBackoffMs = 300000;
        private double quotaHeadroomRatio = 0.5;
        private int maxConsecutiveRateLimits = 8;

        public long baseDelayMs(Platform platform) {
            int delay = switch (platform) {
                case TIKTOK -> tiktokDelayMs;
                case INSTAGRAM -> instagramDelayMs;
                case YOUTUBE -> youtubeDelayMs;
            };
            return Math.max(getMinDelayMs(), delay);
        }

        public int getTiktokDelayMs() {
            return tiktokDelayMs;
        }

        public void setTiktokDelayMs(int tiktokDelayMs) {
            this.tiktokDelayMs = Math.max(0, tiktokDelayMs);
        }

        public int getInstagramDelayMs() {
            return instagramDelayMs;
        }

        public void setInstagramDelayMs(int instagramDelayMs) {
            this.instagramDelayMs = Math.max(0, instagramDelayMs);
        }

        public int getYoutubeDelayMs() {
            return youtubeDelayMs;
        }

        public void setYoutubeDelayMs(int youtubeDelayMs) {
            this.youtubeDelayMs = Math.max(0, youtubeDelayMs);
        }

        public int getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(int minDelayMs) {
            this.minDelayMs = Math.max(0, minDelayMs);
        }

        public int getRetryBackoffMs() {
            return Math.max(getMinDelayMs(), retryBackoffMs);
        }

        public void setRetryBackoffMs(int retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public int getRateLimitBackoffMs() {
            return Math.max(getRetryBackoffMs(), rateLimitBackoffMs);
        }

        public void setRateLimitBackoffMs(int rateLimitBackoffMs) {
            this.rateLimitBackoffMs = rateLimitBackoffMs;
        }

        public int getMaxBackoffMs() {
            return Math.max(getRateLimitBackoffMs(), maxBackoffMs);
        }

        public void setMaxBackoffMs(int maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getQuotaHeadroomRatio() {
            return Math.min(1.0, Math.max(0.0, quotaHeadroomRatio));
        }

        public void setQuotaHeadroomRatio(double quotaHeadroomRatio) {
            this.quotaHeadroomRatio = quotaHeadroomRatio;
        }

        public int getMaxConsecutiveRateLimits() {
            return Math.max(1, maxConsecutiveRateLimits);
        }

        public void setMaxConsecutiveRateLimits(int maxConsecutiveRateLimits) {
            this.maxConsecutiveRateLimits = Math.max(1, maxConsecutiveRateLimits);
        }
    }

    public static class Recovery {
        private double serverErrorSalvageFraction = 0.8;
        private int minSalvageCount = 10;
        private double minSalvageFraction = 0.2;

        public double getServerErrorSalvageFraction() {
            return Math.min(1.0, Math.max(0.0, serverErrorSalvageFraction));
        }

        public void setServerErrorSalvageFraction(double serverErrorSalvageFraction) {
            this.serverErrorSalvageFraction = serverErrorSalvageFraction;
        }

        public int getMinSalvageCount() {
            return Math.max(1, minSalvageCount);
        }

        public void setMinSalvageCount(int minSalvageCount) {
            this.minSalvageCount = Math.max(1, minSalvageCount);
        }

        public double getMinSalvageFraction() {
            return Math.min(1.0, Math.max(0.0, minSalvageFraction));
        }

        public void setMinSalvageFraction(double minSalvageFraction) {
            this.minSalvageFraction = minSalvageFraction;
        }
    }

    public static class Invocation {
        private int maxDurationSeconds = 60;

        public int getMaxDurationSeconds() {
            return Math.max(5, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(5, maxDurationSeconds);
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = 2;
        private int pollIntervalMs = 1000;
        private int lockTtlSeconds = 300;
        private boolean recoverOnStartup = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(50, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(50, pollIntervalMs);
        }

        public int getLockTtlSeconds() {
            return Math.max(1, lockTtlSeconds);
        }

        public void setLockTtlSeconds(int lockTtlSeconds) {
            this.lockTtlSeconds = Math.max(1, lockTtlSeconds);
        }

        public boolean isRecoverOnStartup() {
            return recoverOnStartup;
        }

        public void setRecoverOnStartup(boolean recoverOnStartup) {
            this.recoverOnStartup = recoverOnStartup;
        }
    }
}
