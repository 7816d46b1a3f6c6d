package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.ContinuationRequest;
import com.delta.creatorscout.discovery.model.Platform;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

@Component
public class ContinuationScheduler {
    private static final double LOW_QUOTA_RATIO = 0.1;

    private final DiscoveryProperties properties;

    public ContinuationScheduler(DiscoveryProperties properties) {
        this.properties = properties;
    }

    /**
     * Another invocation is needed while the target is unmet and either the search can go on within
     * the call budget or admitted candidates are still waiting for enrichment.
     */
    public boolean shouldContinue(
        int resultsCollected,
        int targetResultCount,
        int apiCallsMade,
        int apiCallBudget,
        boolean hasMore,
        int pendingEnrichment
    ) {
        if (resultsCollected >= targetResultCount) {
            return false;
        }
        boolean canFetch = hasMore && apiCallsMade < apiCallBudget;
        return canFetch || pendingEnrichment > 0;
    }

    public Duration nextPageDelay(Platform platform, Double quotaRemainingRatio) {
        DiscoveryProperties.Continuation config = properties.getContinuation();
        long base = config.baseDelayMs(platform);
        if (quotaRemainingRatio != null) {
            if (quotaRemainingRatio >= config.getQuotaHeadroomRatio()) {
                base = Math.max(config.getMinDelayMs(), base / 2);
            } else if (quotaRemainingRatio < LOW_QUOTA_RATIO) {
                base = Math.min(config.getMaxBackoffMs(), base * 4);
            }
        }
        return Duration.ofMillis(base);
    }

    public Duration backlogDelay(Platform platform) {
        return Duration.ofMillis(properties.getContinuation().getMinDelayMs());
    }

    public Duration rateLimitDelay(Platform platform, int consecutiveFailures) {
        DiscoveryProperties.Continuation config = properties.getContinuation();
        long delay = Math.max(config.baseDelayMs(platform), exponential(config.getRateLimitBackoffMs(), consecutiveFailures));
        return Duration.ofMillis(Math.min(config.getMaxBackoffMs(), delay));
    }

    public Duration retryDelay(Platform platform, int consecutiveFailures) {
        DiscoveryProperties.Continuation config = properties.getContinuation();
        long delay = Math.max(config.baseDelayMs(platform), exponential(config.getRetryBackoffMs(), consecutiveFailures));
        return Duration.ofMillis(Math.min(config.getMaxBackoffMs(), delay));
    }

    public ContinuationRequest request(UUID jobId, Duration delay, String reason) {
        return new ContinuationRequest(jobId, delay, reason);
    }

    private long exponential(long baseMs, int consecutiveFailures) {
        int exponent = Math.min(10, Math.max(0, consecutiveFailures - 1));
        return baseMs * (1L << exponent);
    }
}
