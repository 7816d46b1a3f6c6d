package com.delta.creatorscout.discovery.engine;

import java.util.Map;

public interface DiscoveryEventRecorder {
    void record(String event, Map<String, ?> fields);
}
