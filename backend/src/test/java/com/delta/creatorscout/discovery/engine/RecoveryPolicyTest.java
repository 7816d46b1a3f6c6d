package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.FailureKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryPolicyTest {
    private final RecoveryPolicy policy = new RecoveryPolicy(new DiscoveryProperties());

    @Test
    void rateLimitRetriesWithoutCountingTheCall() {
        RecoveryDecision decision = policy.decide(FailureKind.RATE_LIMITED, "http_429", false, 5, 100, 0);

        assertThat(decision.action()).isEqualTo(RecoveryAction.RETRY_LATER);
        assertThat(decision.countsCall()).isFalse();
    }

    @Test
    void repeatedRateLimitsEscalateToFatal() {
        RecoveryDecision salvage = policy.decide(FailureKind.RATE_LIMITED, "http_429", false, 30, 100, 7);
        RecoveryDecision fail = policy.decide(FailureKind.RATE_LIMITED, "http_429", false, 2, 100, 7);

        assertThat(salvage.action()).isEqualTo(RecoveryAction.SALVAGE);
        assertThat(salvage.message()).contains("rate limited 8 consecutive times");
        assertThat(fail.action()).isEqualTo(RecoveryAction.FAIL);
        assertThat(fail.countsCall()).isFalse();
    }

    @Test
    void serverErrorSalvagesAtEightyPercent() {
        assertThat(policy.decide(FailureKind.UPSTREAM_SERVER_ERROR, "http_503", false, 80, 100, 0).action())
            .isEqualTo(RecoveryAction.SALVAGE);
        RecoveryDecision retry = policy.decide(FailureKind.UPSTREAM_SERVER_ERROR, "http_503", false, 79, 100, 0);
        assertThat(retry.action()).isEqualTo(RecoveryAction.RETRY_LATER);
        assertThat(retry.countsCall()).isTrue();
    }

    @Test
    void networkErrorAlwaysRetries() {
        RecoveryDecision decision = policy.decide(FailureKind.NETWORK_ERROR, "timeout", false, 99, 100, 4);

        assertThat(decision.action()).isEqualTo(RecoveryAction.RETRY_LATER);
        assertThat(decision.countsCall()).isTrue();
    }

    @Test
    void malformedPageAdvancesOnlyWithIndependentCursor() {
        assertThat(policy.decide(FailureKind.MALFORMED_RESPONSE, "bad json", true, 0, 100, 0).action())
            .isEqualTo(RecoveryAction.ADVANCE_CURSOR);
        assertThat(policy.decide(FailureKind.MALFORMED_RESPONSE, "bad json", false, 0, 100, 0).action())
            .isEqualTo(RecoveryAction.FAIL);
    }

    @Test
    void fatalSalvagesByCountOrFraction() {
        assertThat(policy.decide(FailureKind.FATAL, "http_401", false, 10, 1000, 0).action())
            .isEqualTo(RecoveryAction.SALVAGE);
        assertThat(policy.decide(FailureKind.FATAL, "http_401", false, 4, 20, 0).action())
            .isEqualTo(RecoveryAction.SALVAGE);
        RecoveryDecision fail = policy.decide(FailureKind.FATAL, "http_401", false, 3, 20, 0);
        assertThat(fail.action()).isEqualTo(RecoveryAction.FAIL);
        assertThat(fail.message()).isEqualTo("http_401");
        assertThat(policy.decide(FailureKind.FATAL, null, false, 0, 20, 0).message()).isEqualTo("unclassified failure");
    }
}
