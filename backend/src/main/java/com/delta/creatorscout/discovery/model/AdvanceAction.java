package com.delta.creatorscout.discovery.model;

public enum AdvanceAction {
    ALREADY_TERMINAL,
    CONTINUED,
    RETRY_SCHEDULED,
    FINALIZED,
    CONFLICT
}
