package com.delta.creatorscout.discovery.engine;

import java.util.LinkedHashMap;
import java.util.Map;

final class EventFields {
    private EventFields() {}

    static Map<String, Object> of(Object... pairs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            fields.put(String.valueOf(pairs[i]), pairs[i + 1]);
        }
        return fields;
    }
}
