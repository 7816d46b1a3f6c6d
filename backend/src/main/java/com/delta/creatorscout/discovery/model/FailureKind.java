package com.delta.creatorscout.discovery.model;

public enum FailureKind {
    RATE_LIMITED,
    UPSTREAM_SERVER_ERROR,
    NETWORK_ERROR,
    MALFORMED_RESPONSE,
    ENRICHMENT_FAILURE,
    FATAL
}
