package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.AdvanceAction;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.ContinuationRequest;
import com.delta.creatorscout.discovery.model.CreatorRecord;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.EnrichedCandidate;
import com.delta.creatorscout.discovery.model.EnrichmentStatus;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.JobAdvanceOutcome;
import com.delta.creatorscout.discovery.model.JobProgressUpdate;
import com.delta.creatorscout.discovery.model.JobStatus;
import com.delta.creatorscout.discovery.model.SearchPage;
import com.delta.creatorscout.discovery.model.UsageEvent;
import com.delta.creatorscout.discovery.persistence.CreatorResultStore;
import com.delta.creatorscout.discovery.persistence.DiscoveryJobStore;
import com.delta.creatorscout.discovery.persistence.UsageSink;
import com.delta.creatorscout.discovery.platform.PlatformFetchException;
import com.delta.creatorscout.discovery.platform.PlatformSearchClient;
import com.delta.creatorscout.discovery.platform.PlatformSearchRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one discovery job forward by a single bounded step. Every invocation starts from the
 * persisted job and result set only, so any worker can run the next step.
 */
@Service
public class JobStateMachine {
    private static final Logger log = LoggerFactory.getLogger(JobStateMachine.class);
    static final String TIMEOUT_MESSAGE = "job exceeded maximum processing time";

    private final DiscoveryJobStore jobStore;
    private final CreatorResultStore resultStore;
    private final UsageSink usageSink;
    private final PlatformSearchRegistry searchRegistry;
    private final EnrichmentBatcher enrichmentBatcher;
    private final ContinuationScheduler scheduler;
    private final RecoveryPolicy recoveryPolicy;
    private final DiscoveryEventRecorder recorder;
    private final DiscoveryProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JobStateMachine(
        DiscoveryJobStore jobStore,
        CreatorResultStore resultStore,
        UsageSink usageSink,
        PlatformSearchRegistry searchRegistry,
        EnrichmentBatcher enrichmentBatcher,
        ContinuationScheduler scheduler,
        RecoveryPolicy recoveryPolicy,
        DiscoveryEventRecorder recorder,
        DiscoveryProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.jobStore = jobStore;
        this.resultStore = resultStore;
        this.usageSink = usageSink;
        this.searchRegistry = searchRegistry;
        this.enrichmentBatcher = enrichmentBatcher;
        this.scheduler = scheduler;
        this.recoveryPolicy = recoveryPolicy;
        this.recorder = recorder;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Runs one invocation for the job. Terminal jobs are returned as they are without side effects.
     *
     * @throws JobNotFoundException when no job with this id exists
     */
    public JobAdvanceOutcome advance(UUID jobId) {
        DiscoveryJob job = jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.isTerminal()) {
            log.debug("Job {} already {}; nothing to do", jobId, job.status());
            return JobAdvanceOutcome.of(job, AdvanceAction.ALREADY_TERMINAL, null);
        }
        try {
            return runInvocation(job);
        } catch (StaleJobStateException e) {
            return conflict(job, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure advancing job {}", jobId, e);
            return abortAfterUnexpectedFailure(jobId, e);
        }
    }

    private JobAdvanceOutcome runInvocation(DiscoveryJob job) {
        Instant now = clock.instant();
        if (job.status() == JobStatus.PENDING) {
            record("job_started", EventFields.of(
                "jobId", job.id(),
                "variant", job.searchVariant(),
                "target", job.targetResultCount(),
                "maxApiCalls", job.maxApiCalls()
            ));
        }
        if (job.timeoutAt() != null && !now.isBefore(job.timeoutAt())) {
            int counted = resultStore.countCounted(job.id());
            RecoveryDecision decision = recoveryPolicy.decide(
                FailureKind.FATAL,
                TIMEOUT_MESSAGE,
                false,
                counted,
                job.targetResultCount(),
                job.consecutiveFailures()
            );
            return applyTerminalDecision(job, decision, Snapshot.of(job, counted), TIMEOUT_MESSAGE);
        }

        Instant deadline = now.plusSeconds(properties.getInvocationBudgetSeconds());
        List<CreatorRecord> persisted = resultStore.findByJob(job.id());
        List<CreatorRecord> pending = new ArrayList<>();
        int counted = 0;
        for (CreatorRecord record : persisted) {
            if (record.isCounted()) {
                counted++;
            } else if (record.isPending()) {
                pending.add(record);
            }
        }

        if (counted >= job.targetResultCount()) {
            return finalizeJob(job, Snapshot.of(job, counted), Writes.none(), null);
        }
        if (!pending.isEmpty()) {
            return processBacklog(job, pending, counted, deadline);
        }
        if (!job.hasCallBudgetLeft() || job.searchExhausted()) {
            return finalizeJob(job, Snapshot.of(job, counted), Writes.none(), null);
        }
        return fetchNextPage(job, persisted, counted, deadline);
    }

    private JobAdvanceOutcome processBacklog(DiscoveryJob job, List<CreatorRecord> pending, int counted, Instant deadline) {
        Map<String, Long> admissionOrders = new HashMap<>();
        List<CandidateCreator> candidates = new ArrayList<>();
        for (CreatorRecord record : pending) {
            admissionOrders.put(record.platformUserId(), record.admissionOrder());
            candidates.add(record.toCandidate());
        }
        Screened screened = enrichAndScreen(job, QualityFilter.prioritize(candidates), admissionOrders, deadline);
        Snapshot snapshot = new Snapshot(
            job.apiCallsMade(),
            counted + screened.accepted(),
            job.resumeCursor(),
            job.searchExhausted(),
            job.consecutiveFailures()
        );
        boolean continueJob = scheduler.shouldContinue(
            snapshot.results(),
            job.targetResultCount(),
            snapshot.apiCallsMade(),
            job.maxApiCalls(),
            !snapshot.exhausted(),
            screened.deferred()
        );
        if (!continueJob) {
            return finalizeJob(job, snapshot, screened.writes(), null);
        }
        return commitProgress(
            job,
            snapshot,
            screened.writes(),
            scheduler.backlogDelay(job.platform()),
            "enrichment_backlog",
            AdvanceAction.CONTINUED
        );
    }

    private JobAdvanceOutcome fetchNextPage(DiscoveryJob job, List<CreatorRecord> persisted, int counted, Instant deadline) {
        SearchPage page;
        try {
            PlatformSearchClient client = searchRegistry.resolve(job.searchVariant());
            page = client.fetchPage(job, job.resumeCursor());
        } catch (PlatformFetchException e) {
            return handleFetchFailure(job, counted, e);
        }

        DeduplicationLedger ledger = DeduplicationLedger.rebuild(persisted);
        List<CandidateCreator> admitted = QualityFilter.admit(page.candidates(), ledger);
        long nextOrder = 0;
        for (CreatorRecord record : persisted) {
            nextOrder = Math.max(nextOrder, record.admissionOrder() + 1);
        }
        Map<String, Long> admissionOrders = new HashMap<>();
        for (CandidateCreator candidate : admitted) {
            admissionOrders.put(candidate.platformUserId(), nextOrder++);
        }
        Screened screened = enrichAndScreen(job, QualityFilter.prioritize(admitted), admissionOrders, deadline);

        boolean exhausted = !page.hasMore() || page.nextCursor() == null;
        Snapshot snapshot = new Snapshot(
            job.apiCallsMade() + 1,
            counted + screened.accepted(),
            page.nextCursor(),
            exhausted,
            0
        );
        record("page_fetched", EventFields.of(
            "jobId", job.id(),
            "variant", job.searchVariant(),
            "candidates", page.candidates().size(),
            "admitted", admitted.size(),
            "accepted", screened.accepted(),
            "deferred", screened.deferred(),
            "apiCallsMade", snapshot.apiCallsMade(),
            "results", snapshot.results(),
            "hasMore", !exhausted
        ));

        boolean continueJob = scheduler.shouldContinue(
            snapshot.results(),
            job.targetResultCount(),
            snapshot.apiCallsMade(),
            job.maxApiCalls(),
            !exhausted,
            screened.deferred()
        );
        if (!continueJob) {
            return finalizeJob(job, snapshot, screened.writes(), null);
        }
        return commitProgress(
            job,
            snapshot,
            screened.writes(),
            scheduler.nextPageDelay(job.platform(), page.quotaRemainingRatio()),
            "next_page",
            AdvanceAction.CONTINUED
        );
    }

    private JobAdvanceOutcome handleFetchFailure(DiscoveryJob job, int counted, PlatformFetchException e) {
        RecoveryDecision decision = recoveryPolicy.decide(
            e.getKind(),
            e.getMessage(),
            e.isCursorIndependent(),
            counted,
            job.targetResultCount(),
            job.consecutiveFailures()
        );
        int calls = Math.min(job.maxApiCalls(), job.apiCallsMade() + (decision.countsCall() ? 1 : 0));
        log.warn(
            "Search page failed for job {} ({}): {} -> {}",
            job.id(),
            decision.kind(),
            e.getMessage(),
            decision.action()
        );
        record("page_failed", EventFields.of(
            "jobId", job.id(),
            "kind", decision.kind(),
            "action", decision.action(),
            "message", e.getMessage(),
            "apiCallsMade", calls
        ));

        switch (decision.action()) {
            case RETRY_LATER -> {
                int failures = job.consecutiveFailures() + 1;
                Snapshot snapshot = new Snapshot(calls, counted, job.resumeCursor(), job.searchExhausted(), failures);
                if (!scheduler.shouldContinue(counted, job.targetResultCount(), calls, job.maxApiCalls(), true, 0)) {
                    return finalizeJob(job, snapshot, Writes.none(), decision.message());
                }
                Duration delay = decision.kind() == FailureKind.RATE_LIMITED
                    ? scheduler.rateLimitDelay(job.platform(), failures)
                    : scheduler.retryDelay(job.platform(), failures);
                return commitProgress(
                    job,
                    snapshot,
                    Writes.none(),
                    delay,
                    "retry_" + decision.kind().name().toLowerCase(Locale.ROOT),
                    AdvanceAction.RETRY_SCHEDULED
                );
            }
            case ADVANCE_CURSOR -> {
                String nextCursor = e.getNextCursor();
                boolean exhausted = nextCursor == null;
                Snapshot snapshot = new Snapshot(calls, counted, nextCursor, exhausted, 0);
                if (!scheduler.shouldContinue(counted, job.targetResultCount(), calls, job.maxApiCalls(), !exhausted, 0)) {
                    return finalizeJob(job, snapshot, Writes.none(), null);
                }
                return commitProgress(
                    job,
                    snapshot,
                    Writes.none(),
                    scheduler.nextPageDelay(job.platform(), null),
                    "skip_malformed_page",
                    AdvanceAction.CONTINUED
                );
            }
            default -> {
                Snapshot snapshot = new Snapshot(calls, counted, job.resumeCursor(), job.searchExhausted(), job.consecutiveFailures());
                String message = decision.message() != null ? decision.message() : e.getMessage();
                return applyTerminalDecision(job, decision, snapshot, message);
            }
        }
    }

    private JobAdvanceOutcome applyTerminalDecision(DiscoveryJob job, RecoveryDecision decision, Snapshot snapshot, String message) {
        if (decision.action() == RecoveryAction.SALVAGE) {
            return finalizeJob(job, snapshot, Writes.none(), message);
        }
        return failJob(job, snapshot, message);
    }

    private JobAdvanceOutcome abortAfterUnexpectedFailure(UUID jobId, RuntimeException failure) {
        DiscoveryJob current = jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (current.isTerminal()) {
            return JobAdvanceOutcome.of(current, AdvanceAction.ALREADY_TERMINAL, null);
        }
        String message = "unexpected failure: " + (failure.getMessage() == null
            ? failure.getClass().getSimpleName()
            : failure.getMessage());
        try {
            int counted = resultStore.countCounted(jobId);
            RecoveryDecision decision = recoveryPolicy.decide(
                FailureKind.FATAL,
                message,
                false,
                counted,
                current.targetResultCount(),
                current.consecutiveFailures()
            );
            return applyTerminalDecision(current, decision, Snapshot.of(current, counted), message);
        } catch (StaleJobStateException e) {
            return conflict(current, e);
        }
    }

    private Screened enrichAndScreen(
        DiscoveryJob job,
        List<CandidateCreator> ordered,
        Map<String, Long> admissionOrders,
        Instant deadline
    ) {
        if (ordered.isEmpty()) {
            return new Screened(Writes.none(), 0, 0);
        }
        EnrichmentBatchResult batch = enrichmentBatcher.enrich(job.platform(), ordered, deadline);
        List<CreatorRecord> save = new ArrayList<>();
        int accepted = 0;
        for (EnrichedCandidate enriched : batch.enriched()) {
            long admissionOrder = admissionOrders.get(enriched.candidate().platformUserId());
            if (QualityFilter.passesStageTwo(enriched)) {
                save.add(toRecord(enriched, admissionOrder));
                accepted++;
            } else {
                save.add(toRecord(enriched, admissionOrder, EnrichmentStatus.REJECTED));
            }
        }
        for (CandidateCreator deferred : batch.deferred()) {
            save.add(toPendingRecord(deferred, admissionOrders.get(deferred.platformUserId())));
        }
        return new Screened(new Writes(save), accepted, batch.deferred().size());
    }

    private JobAdvanceOutcome commitProgress(
        DiscoveryJob job,
        Snapshot snapshot,
        Writes writes,
        Duration delay,
        String reason,
        AdvanceAction action
    ) {
        Instant now = clock.instant();
        int progress = ProgressCalculator.intermediate(
            job.progressPercent(),
            snapshot.apiCallsMade(),
            job.maxApiCalls(),
            snapshot.results(),
            job.targetResultCount()
        );
        JobProgressUpdate update = new JobProgressUpdate(
            JobStatus.PROCESSING,
            snapshot.apiCallsMade(),
            snapshot.results(),
            snapshot.cursor(),
            snapshot.exhausted(),
            progress,
            snapshot.consecutiveFailures(),
            job.error(),
            startedAt(job, now),
            null
        );
        transactionTemplate.executeWithoutResult(status -> {
            commitJob(job, update, now);
            applyWrites(job.id(), writes);
        });
        ContinuationRequest continuation = scheduler.request(job.id(), delay, reason);
        record("job_continued", EventFields.of(
            "jobId", job.id(),
            "reason", reason,
            "delayMs", delay.toMillis(),
            "progress", progress
        ));
        return JobAdvanceOutcome.of(applied(job, update, now), action, continuation);
    }

    /**
     * Delivers exactly {@code targetResultCount} results when enough were found: deferred and
     * rejected entries are dropped, the overflow beyond the target is trimmed in admission order
     * and one usage event is recorded for the final count.
     */
    private JobAdvanceOutcome finalizeJob(DiscoveryJob job, Snapshot snapshot, Writes writes, String message) {
        Instant now = clock.instant();
        DiscoveryJob finished = transactionTemplate.execute(status -> {
            applyWrites(job.id(), writes);
            resultStore.deleteUndelivered(job.id());
            resultStore.trimToFirst(job.id(), job.targetResultCount());
            int finalCount = resultStore.countCounted(job.id());
            JobStatus finalStatus = finalCount == job.targetResultCount()
                ? JobStatus.COMPLETED
                : JobStatus.PARTIAL_COMPLETED;
            JobProgressUpdate update = new JobProgressUpdate(
                finalStatus,
                snapshot.apiCallsMade(),
                finalCount,
                snapshot.cursor(),
                snapshot.exhausted(),
                100,
                snapshot.consecutiveFailures(),
                message,
                startedAt(job, now),
                now
            );
            commitJob(job, update, now);
            if (!usageSink.record(new UsageEvent(job.accountId(), finalCount, job.id(), now))) {
                log.warn("Usage event for job {} already recorded", job.id());
            }
            return applied(job, update, now);
        });
        log.info(
            "Job {} finalized as {} with {}/{} results after {} API calls",
            job.id(),
            finished.status(),
            finished.uniqueResultsCollected(),
            job.targetResultCount(),
            finished.apiCallsMade()
        );
        record("job_finalized", EventFields.of(
            "jobId", job.id(),
            "status", finished.status(),
            "results", finished.uniqueResultsCollected(),
            "target", job.targetResultCount(),
            "apiCallsMade", finished.apiCallsMade(),
            "error", message
        ));
        return JobAdvanceOutcome.of(finished, AdvanceAction.FINALIZED, null);
    }

    private JobAdvanceOutcome failJob(DiscoveryJob job, Snapshot snapshot, String message) {
        Instant now = clock.instant();
        JobProgressUpdate update = new JobProgressUpdate(
            JobStatus.ERROR,
            snapshot.apiCallsMade(),
            snapshot.results(),
            snapshot.cursor(),
            snapshot.exhausted(),
            job.progressPercent(),
            snapshot.consecutiveFailures(),
            message,
            startedAt(job, now),
            now
        );
        transactionTemplate.executeWithoutResult(status -> commitJob(job, update, now));
        log.warn("Job {} failed with {} results: {}", job.id(), snapshot.results(), message);
        record("job_failed", EventFields.of(
            "jobId", job.id(),
            "results", snapshot.results(),
            "apiCallsMade", snapshot.apiCallsMade(),
            "error", message
        ));
        return JobAdvanceOutcome.of(applied(job, update, now), AdvanceAction.FINALIZED, null);
    }

    private JobAdvanceOutcome conflict(DiscoveryJob job, StaleJobStateException e) {
        log.info("Dropping invocation for job {}: {}", job.id(), e.getMessage());
        record("job_conflict", EventFields.of("jobId", job.id(), "version", job.version()));
        return JobAdvanceOutcome.of(job, AdvanceAction.CONFLICT, null);
    }

    private void commitJob(DiscoveryJob job, JobProgressUpdate update, Instant now) {
        if (!jobStore.commit(job.id(), job.version(), update, now)) {
            throw new StaleJobStateException(job.id(), job.version());
        }
    }

    private void applyWrites(UUID jobId, Writes writes) {
        if (!writes.save().isEmpty()) {
            resultStore.saveAll(jobId, writes.save());
        }
    }

    private static Instant startedAt(DiscoveryJob job, Instant now) {
        return job.startedAt() != null ? job.startedAt() : now;
    }

    static CreatorRecord toRecord(EnrichedCandidate enriched, long admissionOrder) {
        return toRecord(enriched, admissionOrder, enriched.status());
    }

    static CreatorRecord toRecord(EnrichedCandidate enriched, long admissionOrder, EnrichmentStatus status) {
        CandidateCreator candidate = enriched.candidate();
        long followers = enriched.followerCount();
        double engagement = QualityFilter.engagementRate(candidate.likes(), candidate.comments(), followers);
        double score = QualityFilter.score(
            candidate.verified(),
            followers,
            candidate.privateAccount(),
            candidate.hasHandle(),
            engagement
        );
        return new CreatorRecord(
            candidate.platformUserId(),
            candidate.handle(),
            candidate.displayName(),
            candidate.verified(),
            candidate.privateAccount(),
            followers,
            enriched.businessAccount(),
            score,
            engagement,
            enriched.biography(),
            enriched.emails(),
            status,
            admissionOrder,
            candidate.source()
        );
    }

    static CreatorRecord toPendingRecord(CandidateCreator candidate, long admissionOrder) {
        return new CreatorRecord(
            candidate.platformUserId(),
            candidate.handle(),
            candidate.displayName(),
            candidate.verified(),
            candidate.privateAccount(),
            candidate.followerCount(),
            false,
            QualityFilter.score(candidate),
            QualityFilter.engagementRate(candidate.likes(), candidate.comments(), candidate.followerCount()),
            null,
            List.of(),
            EnrichmentStatus.PENDING,
            admissionOrder,
            candidate.source()
        );
    }

    private static DiscoveryJob applied(DiscoveryJob job, JobProgressUpdate update, Instant now) {
        return new DiscoveryJob(
            job.id(),
            job.accountId(),
            job.platform(),
            job.mode(),
            job.keywords(),
            job.seedHandle(),
            job.region(),
            job.targetResultCount(),
            job.maxApiCalls(),
            update.apiCallsMade(),
            update.uniqueResultsCollected(),
            update.resumeCursor(),
            update.searchExhausted(),
            update.progressPercent(),
            update.status(),
            update.consecutiveFailures(),
            update.error(),
            job.createdAt(),
            update.startedAt(),
            update.completedAt(),
            now,
            job.timeoutAt(),
            job.version() + 1
        );
    }

    private void record(String event, Map<String, ?> fields) {
        try {
            recorder.record(event, fields);
        } catch (RuntimeException e) {
            log.debug("Event recorder failed for {}", event, e);
        }
    }

    private record Snapshot(int apiCallsMade, int results, String cursor, boolean exhausted, int consecutiveFailures) {
        static Snapshot of(DiscoveryJob job, int results) {
            return new Snapshot(
                job.apiCallsMade(),
                results,
                job.resumeCursor(),
                job.searchExhausted(),
                job.consecutiveFailures()
            );
        }
    }

    private record Writes(List<CreatorRecord> save) {
        static Writes none() {
            return new Writes(List.of());
        }
    }

    private record Screened(Writes writes, int accepted, int deferred) {
    }
}
