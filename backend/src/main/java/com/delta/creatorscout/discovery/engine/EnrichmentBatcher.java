package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.EnrichedCandidate;
import com.delta.creatorscout.discovery.model.EnrichmentStatus;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.ProfileEnrichment;
import com.delta.creatorscout.discovery.platform.ProfileEnricher;
import com.delta.creatorscout.discovery.util.EmailExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class EnrichmentBatcher {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentBatcher.class);
    private static final long JOIN_GRACE_MS = 500;

    private final ProfileEnricher enricher;
    private final ExecutorService executor;
    private final DiscoveryProperties properties;
    private final DiscoveryEventRecorder recorder;
    private final Clock clock;

    public EnrichmentBatcher(
        ProfileEnricher enricher,
        @Qualifier("enrichmentExecutor") ExecutorService executor,
        DiscoveryProperties properties,
        DiscoveryEventRecorder recorder,
        Clock clock
    ) {
        this.enricher = enricher;
        this.executor = executor;
        this.properties = properties;
        this.recorder = recorder;
        this.clock = clock;
    }

    /**
     * Enriches candidates in the given order, one batch at a time. The first batch always runs;
     * later batches that would not finish before {@code deadline} are not started and their
     * candidates come back as deferred.
     */
    public EnrichmentBatchResult enrich(Platform platform, List<CandidateCreator> ordered, Instant deadline) {
        if (ordered == null || ordered.isEmpty()) {
            return new EnrichmentBatchResult(List.of(), List.of(), 0);
        }
        DiscoveryProperties.Enrichment config = properties.getEnrichment();
        int batchSize = config.getBatchSize();
        List<EnrichedCandidate> enriched = new ArrayList<>();
        List<CandidateCreator> deferred = new ArrayList<>();
        int failures = 0;
        for (int start = 0; start < ordered.size(); start += batchSize) {
            List<CandidateCreator> batch = ordered.subList(start, Math.min(ordered.size(), start + batchSize));
            if (start > 0 && !pause(config.getInterBatchDelayMs())) {
                deferred.addAll(ordered.subList(start, ordered.size()));
                break;
            }
            // The first batch always runs so every invocation enriches something.
            boolean fits = deadline == null
                || !clock.instant().plus(estimatedBatchDuration(batch.size())).isAfter(deadline);
            if (start > 0 && !fits) {
                deferred.addAll(ordered.subList(start, ordered.size()));
                break;
            }
            List<EnrichedCandidate> results = runBatch(platform, batch);
            for (EnrichedCandidate result : results) {
                if (result.status() == EnrichmentStatus.SKIPPED) {
                    failures++;
                }
            }
            enriched.addAll(results);
        }
        if (!deferred.isEmpty()) {
            log.info("Deferred enrichment of {} {} candidates to the next invocation", deferred.size(), platform);
        }
        record("enrichment_completed", EventFields.of(
            "platform", platform,
            "enriched", enriched.size() - failures,
            "skipped", failures,
            "deferred", deferred.size()
        ));
        return new EnrichmentBatchResult(enriched, deferred, failures);
    }

    Duration estimatedBatchDuration(int size) {
        DiscoveryProperties.Enrichment config = properties.getEnrichment();
        long staggerMs = (long) config.getInterRequestDelayMs() * Math.max(0, size - 1);
        return Duration.ofSeconds(config.getRequestTimeoutSeconds()).plusMillis(staggerMs + JOIN_GRACE_MS);
    }

    private List<EnrichedCandidate> runBatch(Platform platform, List<CandidateCreator> batch) {
        DiscoveryProperties.Enrichment config = properties.getEnrichment();
        Duration timeout = Duration.ofSeconds(config.getRequestTimeoutSeconds());
        List<CompletableFuture<ProfileEnrichment>> futures = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0 && !pause(config.getInterRequestDelayMs())) {
                break;
            }
            CandidateCreator candidate = batch.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> enricher.enrich(platform, candidate, timeout), executor));
        }

        List<EnrichedCandidate> results = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            CandidateCreator candidate = batch.get(i);
            if (i >= futures.size()) {
                results.add(EnrichedCandidate.skipped(candidate));
                continue;
            }
            results.add(await(candidate, futures.get(i), timeout));
        }
        return results;
    }

    private EnrichedCandidate await(CandidateCreator candidate, CompletableFuture<ProfileEnrichment> future, Duration timeout) {
        try {
            ProfileEnrichment enrichment = future.get(timeout.toMillis() + JOIN_GRACE_MS, TimeUnit.MILLISECONDS);
            return toEnriched(candidate, enrichment);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Enrichment timed out for {}", candidate.platformUserId());
            return EnrichedCandidate.skipped(candidate);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Enrichment failed for {}: {}", candidate.platformUserId(), cause.getMessage());
            return EnrichedCandidate.skipped(candidate);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return EnrichedCandidate.skipped(candidate);
        }
    }

    static EnrichedCandidate toEnriched(CandidateCreator candidate, ProfileEnrichment enrichment) {
        if (enrichment == null) {
            return EnrichedCandidate.skipped(candidate);
        }
        String biography = enrichment.biography();
        long followers = enrichment.followerCount() == null ? candidate.followerCount() : enrichment.followerCount();
        return new EnrichedCandidate(
            candidate,
            EnrichmentStatus.COMPLETED,
            biography,
            EmailExtractor.extract(biography),
            followers,
            enrichment.businessAccount()
        );
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void record(String event, Map<String, ?> fields) {
        try {
            recorder.record(event, fields);
        } catch (RuntimeException e) {
            log.debug("Event recorder failed for {}", event, e);
        }
    }
}
