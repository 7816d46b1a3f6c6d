package com.delta.creatorscout.discovery.model;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    PARTIAL_COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL_COMPLETED || this == ERROR;
    }
}
