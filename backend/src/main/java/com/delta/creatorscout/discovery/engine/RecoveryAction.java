package com.delta.creatorscout.discovery.engine;

public enum RecoveryAction {
    RETRY_LATER,
    ADVANCE_CURSOR,
    SALVAGE,
    FAIL
}
