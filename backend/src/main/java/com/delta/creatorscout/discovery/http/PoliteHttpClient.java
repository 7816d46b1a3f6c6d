package com.delta.creatorscout.discovery.http;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);
    private static final Duration MAX_COOLDOWN = Duration.ofMinutes(5);

    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_IO = "io_error";
    public static final String ERROR_INTERRUPTED = "interrupted";
    public static final String ERROR_HTTP = "http_error";
    public static final String ERROR_INVALID_URL = "invalid_url";
    public static final String ERROR_HOST_COOLDOWN = "host_cooldown";

    private final DiscoveryProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostCooldownUntil = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        DiscoveryProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult getJson(String url, Map<String, String> headers) {
        return getJson(url, headers, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    public HttpFetchResult getJson(String url, Map<String, String> headers, Duration timeout) {
        return getJson(url, headers, timeout, 1 + properties.getRequestMaxRetries());
    }

    /**
     * Sends at most {@code maxAttempts} requests; timeouts, I/O errors and 502/503/504 are retried
     * with jittered backoff while attempts remain.
     */
    public HttpFetchResult getJson(String url, Map<String, String> headers, Duration timeout, int maxAttempts) {
        maxAttempts = Math.max(1, maxAttempts);
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, headers, timeout);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, Map<String, String> headers, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, ERROR_INVALID_URL, "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        Instant cooldownUntil = hostCooldownUntil.get(host);
        if (cooldownUntil != null && cooldownUntil.isAfter(Instant.now())) {
            return errorResult(url, startedAt, ERROR_HOST_COOLDOWN, "host cooling down until " + cooldownUntil);
        }

        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(
                host,
                ignored -> new Semaphore(properties.getPerHostConcurrency())
            );
            hostLimiter.acquire();
            hostAcquired = true;
            enforcePerHostDelay(host);

            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "application/json");
            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (value != null && !value.isBlank()) {
                        builder.header(name, value);
                    }
                });
            }

            HttpResponse<String> response = client.send(
                builder.GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
            );
            String retryAfter = response.headers().firstValue("Retry-After").orElse(null);
            if (response.statusCode() == 429) {
                startCooldown(host, retryAfter);
            }
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                retryAfter,
                quotaRemainingRatio(response),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, ERROR_TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, ERROR_IO, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, ERROR_INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, ERROR_HTTP, e.getMessage());
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return errorCode.equals(ERROR_TIMEOUT) || errorCode.equals(ERROR_IO);
        }
        int status = result.statusCode();
        return status == 502 || status == 503 || status == 504;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void startCooldown(String host, String retryAfter) {
        Duration duration = parseRetryAfter(retryAfter);
        Instant candidate = Instant.now().plus(duration);
        hostCooldownUntil.merge(host, candidate, (current, next) -> next.isAfter(current) ? next : current);
        log.warn("Host {} rate limited; cooling down for {}s", host, duration.toSeconds());
    }

    static Duration parseRetryAfter(String retryAfter) {
        if (retryAfter == null || retryAfter.isBlank()) {
            return DEFAULT_COOLDOWN;
        }
        try {
            long seconds = Long.parseLong(retryAfter.trim());
            if (seconds <= 0) {
                return DEFAULT_COOLDOWN;
            }
            Duration parsed = Duration.ofSeconds(seconds);
            return parsed.compareTo(MAX_COOLDOWN) > 0 ? MAX_COOLDOWN : parsed;
        } catch (NumberFormatException ignored) {
            return DEFAULT_COOLDOWN;
        }
    }

    private Double quotaRemainingRatio(HttpResponse<?> response) {
        String remaining = response.headers().firstValue("X-RateLimit-Remaining").orElse(null);
        String limit = response.headers().firstValue("X-RateLimit-Limit").orElse(null);
        if (remaining == null || limit == null) {
            return null;
        }
        try {
            double limitValue = Double.parseDouble(limit.trim());
            if (limitValue <= 0) {
                return null;
            }
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(remaining.trim()) / limitValue));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
