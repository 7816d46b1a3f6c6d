package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.HttpFetchResult;
import com.delta.creatorscout.discovery.util.FailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

abstract class ScrapeCreatorsSupport {
    protected final DiscoveryProperties properties;
    protected final PoliteHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected ScrapeCreatorsSupport(
        DiscoveryProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    protected ApiResponse get(String path, Map<String, ?> params, Duration timeout) {
        String apiKey = properties.getProvider().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new PlatformFetchException(FailureKind.FATAL, "discovery.provider.api-key is not configured");
        }
        String url = buildUrl(path, params);
        Duration effectiveTimeout = timeout == null ? Duration.ofSeconds(properties.getRequestTimeoutSeconds()) : timeout;
        HttpFetchResult result = httpClient.getJson(url, Map.of("x-api-key", apiKey), effectiveTimeout, maxAttempts());
        if (!result.isSuccessful()) {
            FailureKind kind = FailureClassifier.classify(result);
            throw new PlatformFetchException(kind, path + " failed: " + FailureClassifier.describe(result));
        }
        return new ApiResponse(readTree(path, result.body()), result.quotaRemainingRatio());
    }

    // Search pages are budgeted one request per fetch; the engine owns retries for them.
    protected int maxAttempts() {
        return 1;
    }

    private JsonNode readTree(String path, String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedPayloadException(path + " returned an empty body", null);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new MalformedPayloadException(path + " returned a non-object payload", null);
            }
            if (root.path("success").isBoolean() && !root.path("success").asBoolean()) {
                String message = text(root, "message", "error");
                throw new PlatformFetchException(
                    FailureKind.FATAL,
                    path + " reported failure: " + (message == null ? "unknown error" : message)
                );
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(path + " returned unparseable JSON", e);
        }
    }

    protected String regionOf(DiscoveryJob job) {
        return job.region() == null || job.region().isBlank() ? properties.getProvider().getRegion() : job.region();
    }

    protected String buildUrl(String path, Map<String, ?> params) {
        StringBuilder url = new StringBuilder(properties.getProvider().getBaseUrl()).append(path);
        if (params != null && !params.isEmpty()) {
            StringJoiner query = new StringJoiner("&", "?", "");
            params.forEach((name, value) -> {
                if (value != null && !value.toString().isBlank()) {
                    query.add(name + "=" + URLEncoder.encode(value.toString(), StandardCharsets.UTF_8));
                }
            });
            url.append(query);
        }
        return url.toString();
    }

    protected static Map<String, Object> params(Object... pairs) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            params.put(pairs[i].toString(), pairs[i + 1]);
        }
        return params;
    }

    protected static JsonNode requireArray(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isArray()) {
            throw new MalformedPayloadException("expected array at '" + field + "'", null);
        }
        return node;
    }

    protected static String text(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text.trim();
                }
            }
        }
        return null;
    }

    protected static long number(JsonNode node, String... fields) {
        if (node == null) {
            return 0;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return Math.max(0, value.asLong());
            }
            if (value.isTextual()) {
                long parsed = parseCount(value.asText());
                if (parsed >= 0) {
                    return parsed;
                }
            }
        }
        return 0;
    }

    protected static boolean flag(JsonNode node, String... fields) {
        if (node == null) {
            return false;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isBoolean()) {
                return value.asBoolean();
            }
            if (value.isNumber()) {
                return value.asInt() > 0;
            }
            if (value.isTextual()) {
                return Boolean.parseBoolean(value.asText());
            }
        }
        return false;
    }

    protected static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }

    // "1.2M subscribers", "15,300", "980"
    static long parseCount(String raw) {
        if (raw == null) {
            return -1;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT).replace(",", "");
        int end = 0;
        while (end < value.length() && (Character.isDigit(value.charAt(end)) || value.charAt(end) == '.')) {
            end++;
        }
        if (end == 0) {
            return -1;
        }
        double base;
        try {
            base = Double.parseDouble(value.substring(0, end));
        } catch (NumberFormatException e) {
            return -1;
        }
        String rest = value.substring(end).trim();
        double multiplier = 1;
        if (rest.startsWith("K")) {
            multiplier = 1_000;
        } else if (rest.startsWith("M")) {
            multiplier = 1_000_000;
        } else if (rest.startsWith("B")) {
            multiplier = 1_000_000_000;
        }
        return Math.round(base * multiplier);
    }

    protected PlatformFetchException malformed(String variant, MalformedPayloadException e, SearchCursor independentNext) {
        String next = independentNext == null ? null : independentNext.encode(objectMapper);
        return PlatformFetchException.malformed(variant + ": " + e.getMessage(), next, e);
    }

    protected PlatformFetchException malformedDependent(String variant, MalformedPayloadException e) {
        return new PlatformFetchException(FailureKind.MALFORMED_RESPONSE, variant + ": " + e.getMessage(), e);
    }

    protected record ApiResponse(JsonNode root, Double quotaRemainingRatio) {
    }

    static class MalformedPayloadException extends RuntimeException {
        MalformedPayloadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
