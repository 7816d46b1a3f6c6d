package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.discovery.model.FailureKind;

public record RecoveryDecision(FailureKind kind, RecoveryAction action, boolean countsCall, String message) {
}
