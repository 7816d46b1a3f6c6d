package com.delta.creatorscout.discovery.service;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.engine.JobNotFoundException;
import com.delta.creatorscout.discovery.engine.JobStateMachine;
import com.delta.creatorscout.discovery.model.CreatorRecord;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.DiscoveryJobRequest;
import com.delta.creatorscout.discovery.model.JobAdvanceOutcome;
import com.delta.creatorscout.discovery.model.NewDiscoveryJob;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.SearchMode;
import com.delta.creatorscout.discovery.model.SearchVariant;
import com.delta.creatorscout.discovery.persistence.ContinuationQueue;
import com.delta.creatorscout.discovery.persistence.CreatorResultStore;
import com.delta.creatorscout.discovery.persistence.DiscoveryJobStore;
import com.delta.creatorscout.discovery.platform.PlatformSearchRegistry;
import com.delta.creatorscout.discovery.platform.SeedQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@Service
public class DiscoveryJobService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryJobService.class);
    private static final int MAX_KEYWORDS = 10;

    private final DiscoveryJobStore jobStore;
    private final CreatorResultStore resultStore;
    private final ContinuationQueue continuationQueue;
    private final JobStateMachine stateMachine;
    private final PlatformSearchRegistry searchRegistry;
    private final DiscoveryProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DiscoveryJobService(
        DiscoveryJobStore jobStore,
        CreatorResultStore resultStore,
        ContinuationQueue continuationQueue,
        JobStateMachine stateMachine,
        PlatformSearchRegistry searchRegistry,
        DiscoveryProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.jobStore = jobStore;
        this.resultStore = resultStore;
        this.continuationQueue = continuationQueue;
        this.stateMachine = stateMachine;
        this.searchRegistry = searchRegistry;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Creates a {@code PENDING} job and queues its first invocation.
     */
    public DiscoveryJob createJob(DiscoveryJobRequest request) {
        NewDiscoveryJob newJob = validate(request);
        Instant now = clock.instant();
        DiscoveryJob job = transactionTemplate.execute(status -> {
            DiscoveryJob inserted = jobStore.insert(newJob, now);
            continuationQueue.enqueue(inserted.id(), Duration.ZERO);
            return inserted;
        });
        log.info(
            "Created discovery job {} for account {} ({}, target={}, maxApiCalls={})",
            job.id(),
            job.accountId(),
            job.searchVariant(),
            job.targetResultCount(),
            job.maxApiCalls()
        );
        return job;
    }

    public DiscoveryJob getJob(UUID jobId) {
        return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<CreatorRecord> getResults(UUID jobId) {
        getJob(jobId);
        List<CreatorRecord> counted = new ArrayList<>();
        for (CreatorRecord record : resultStore.findByJob(jobId)) {
            if (record.isCounted()) {
                counted.add(record);
            }
        }
        return counted;
    }

    /**
     * Handles one delivered continuation message: advances the job and queues the follow-up
     * invocation when the state machine asks for one.
     */
    public JobAdvanceOutcome handleContinuation(UUID jobId) {
        if (jobId == null) {
            throw new ResponseStatusException(BAD_REQUEST, "jobId is required");
        }
        JobAdvanceOutcome outcome = stateMachine.advance(jobId);
        if (outcome.hasContinuation()) {
            continuationQueue.enqueue(jobId, outcome.continuation().delay());
        }
        return outcome;
    }

    NewDiscoveryJob validate(DiscoveryJobRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        String accountId = trimToNull(request.accountId());
        if (accountId == null) {
            throw new ResponseStatusException(BAD_REQUEST, "accountId is required");
        }
        Platform platform = Platform.fromString(request.platform());
        if (platform == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported platform: " + request.platform());
        }
        SearchMode mode = SearchMode.fromString(request.mode());
        if (mode == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported mode: " + request.mode());
        }
        SearchVariant variant = new SearchVariant(platform, mode);
        if (!searchRegistry.supportedVariants().contains(variant)) {
            throw new ResponseStatusException(BAD_REQUEST, "No search client for " + variant);
        }

        List<String> keywords = normalizeKeywords(request.keywords());
        String seedHandle = trimToNull(SeedQueries.normalizeHandle(request.seedHandle()));
        if (mode == SearchMode.KEYWORD && keywords.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "keywords are required for keyword search");
        }
        if (mode == SearchMode.SIMILAR_TO_SEED && seedHandle == null) {
            throw new ResponseStatusException(BAD_REQUEST, "seedHandle is required for similar search");
        }

        DiscoveryProperties.Jobs jobs = properties.getJobs();
        int target = request.targetResultCount() == null ? 0 : request.targetResultCount();
        if (target <= 0 || target > jobs.getMaxTargetResults()) {
            throw new ResponseStatusException(
                BAD_REQUEST,
                "targetResultCount must be between 1 and " + jobs.getMaxTargetResults()
            );
        }
        int maxApiCalls = request.maxApiCalls() == null ? jobs.getDefaultMaxApiCalls() : request.maxApiCalls();
        if (maxApiCalls <= 0 || maxApiCalls > jobs.getMaxApiCallsCeiling()) {
            throw new ResponseStatusException(
                BAD_REQUEST,
                "maxApiCalls must be between 1 and " + jobs.getMaxApiCallsCeiling()
            );
        }

        String region = trimToNull(request.region());
        Instant timeoutAt = jobs.getTimeoutMinutes() > 0
            ? clock.instant().plus(Duration.ofMinutes(jobs.getTimeoutMinutes()))
            : null;
        return new NewDiscoveryJob(
            accountId,
            platform,
            mode,
            keywords,
            mode == SearchMode.SIMILAR_TO_SEED ? seedHandle : null,
            region == null ? properties.getProvider().getRegion() : region,
            target,
            maxApiCalls,
            timeoutAt
        );
    }

    private List<String> normalizeKeywords(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String keyword : keywords) {
            String trimmed = trimToNull(keyword);
            if (trimmed != null) {
                unique.add(trimmed);
            }
        }
        if (unique.size() > MAX_KEYWORDS) {
            throw new ResponseStatusException(BAD_REQUEST, "at most " + MAX_KEYWORDS + " keywords are allowed");
        }
        return List.copyOf(unique);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
