package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.Platform;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ContinuationSchedulerTest {
    private final ContinuationScheduler scheduler = new ContinuationScheduler(new DiscoveryProperties());

    @Test
    void continuesOnlyWhileTargetUnmetAndSearchCanGoOn() {
        assertThat(scheduler.shouldContinue(10, 50, 3, 10, true, 0)).isTrue();
        assertThat(scheduler.shouldContinue(50, 50, 3, 10, true, 0)).isFalse();
        assertThat(scheduler.shouldContinue(10, 50, 10, 10, true, 0)).isFalse();
        assertThat(scheduler.shouldContinue(10, 50, 3, 10, false, 0)).isFalse();
    }

    @Test
    void pendingEnrichmentKeepsJobAliveAfterSearchEnds() {
        assertThat(scheduler.shouldContinue(10, 50, 10, 10, false, 4)).isTrue();
        assertThat(scheduler.shouldContinue(50, 50, 10, 10, false, 4)).isFalse();
    }

    @Test
    void nextPageDelayUsesPlatformBaseAndQuotaHeadroom() {
        assertThat(scheduler.nextPageDelay(Platform.TIKTOK, null)).isEqualTo(Duration.ofMillis(1000));
        assertThat(scheduler.nextPageDelay(Platform.INSTAGRAM, null)).isEqualTo(Duration.ofMillis(2000));
        assertThat(scheduler.nextPageDelay(Platform.INSTAGRAM, 0.8)).isEqualTo(Duration.ofMillis(1000));
        assertThat(scheduler.nextPageDelay(Platform.YOUTUBE, 0.05)).isEqualTo(Duration.ofMillis(4000));
        assertThat(scheduler.nextPageDelay(Platform.YOUTUBE, 0.3)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void rateLimitBackoffGrowsAndIsCapped() {
        assertThat(scheduler.rateLimitDelay(Platform.TIKTOK, 1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(scheduler.rateLimitDelay(Platform.TIKTOK, 3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(scheduler.rateLimitDelay(Platform.TIKTOK, 9)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void retryBackoffStartsShort() {
        assertThat(scheduler.retryDelay(Platform.INSTAGRAM, 1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(scheduler.retryDelay(Platform.INSTAGRAM, 2)).isEqualTo(Duration.ofSeconds(10));
    }
}
