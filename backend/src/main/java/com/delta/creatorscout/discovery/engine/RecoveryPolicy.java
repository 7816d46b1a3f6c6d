package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.FailureKind;
import org.springframework.stereotype.Component;

@Component
public class RecoveryPolicy {
    private final DiscoveryProperties properties;

    public RecoveryPolicy(DiscoveryProperties properties) {
        this.properties = properties;
    }

    public RecoveryDecision decide(
        FailureKind kind,
        String message,
        boolean cursorIndependent,
        int resultsCollected,
        int targetResultCount,
        int consecutiveFailures
    ) {
        FailureKind safeKind = kind == null ? FailureKind.FATAL : kind;
        return switch (safeKind) {
            case RATE_LIMITED -> {
                int streak = consecutiveFailures + 1;
                if (streak >= properties.getContinuation().getMaxConsecutiveRateLimits()) {
                    yield fatal(
                        FailureKind.RATE_LIMITED,
                        "rate limited " + streak + " consecutive times: " + message,
                        resultsCollected,
                        targetResultCount
                    );
                }
                yield new RecoveryDecision(safeKind, RecoveryAction.RETRY_LATER, false, message);
            }
            case UPSTREAM_SERVER_ERROR -> {
                if (coversServerErrorSalvage(resultsCollected, targetResultCount)) {
                    yield new RecoveryDecision(safeKind, RecoveryAction.SALVAGE, true, null);
                }
                yield new RecoveryDecision(safeKind, RecoveryAction.RETRY_LATER, true, message);
            }
            case NETWORK_ERROR, ENRICHMENT_FAILURE ->
                new RecoveryDecision(safeKind, RecoveryAction.RETRY_LATER, true, message);
            case MALFORMED_RESPONSE -> cursorIndependent
                ? new RecoveryDecision(safeKind, RecoveryAction.ADVANCE_CURSOR, true, message)
                : fatal(safeKind, message, resultsCollected, targetResultCount);
            case FATAL -> fatal(safeKind, message, resultsCollected, targetResultCount);
        };
    }

    public boolean coversServerErrorSalvage(int resultsCollected, int targetResultCount) {
        if (resultsCollected <= 0 || targetResultCount <= 0) {
            return false;
        }
        return resultsCollected >= properties.getRecovery().getServerErrorSalvageFraction() * targetResultCount;
    }

    public boolean isSalvageable(int resultsCollected, int targetResultCount) {
        if (resultsCollected <= 0) {
            return false;
        }
        DiscoveryProperties.Recovery recovery = properties.getRecovery();
        return resultsCollected >= recovery.getMinSalvageCount()
            || resultsCollected >= recovery.getMinSalvageFraction() * targetResultCount;
    }

    private RecoveryDecision fatal(FailureKind kind, String message, int resultsCollected, int targetResultCount) {
        RecoveryAction action = isSalvageable(resultsCollected, targetResultCount)
            ? RecoveryAction.SALVAGE
            : RecoveryAction.FAIL;
        boolean countsCall = kind != FailureKind.RATE_LIMITED;
        return new RecoveryDecision(kind, action, countsCall, message == null ? "unclassified failure" : message);
    }
}
