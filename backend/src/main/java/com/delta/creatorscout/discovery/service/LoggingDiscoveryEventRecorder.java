package com.delta.creatorscout.discovery.service;

import com.delta.creatorscout.discovery.engine.DiscoveryEventRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

@Component
public class LoggingDiscoveryEventRecorder implements DiscoveryEventRecorder {
    private static final Logger log = LoggerFactory.getLogger("discovery.events");

    @Override
    public void record(String event, Map<String, ?> fields) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info("event={} {}", event, format(fields));
    }

    static String format(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return "";
        }
        return fields.entrySet().stream()
            .filter(entry -> entry.getValue() != null)
            .map(entry -> entry.getKey() + "=" + quote(String.valueOf(entry.getValue())))
            .collect(Collectors.joining(" "));
    }

    private static String quote(String value) {
        if (value.isEmpty() || value.chars().anyMatch(Character::isWhitespace)) {
            return "\"" + value.replace("\"", "'") + "\"";
        }
        return value;
    }
}
