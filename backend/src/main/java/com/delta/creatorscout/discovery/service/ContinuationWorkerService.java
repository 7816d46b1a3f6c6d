package com.delta.creatorscout.discovery.service;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.engine.JobNotFoundException;
import com.delta.creatorscout.discovery.engine.JobStateMachine;
import com.delta.creatorscout.discovery.model.AdvanceAction;
import com.delta.creatorscout.discovery.model.ContinuationMessage;
import com.delta.creatorscout.discovery.model.JobAdvanceOutcome;
import com.delta.creatorscout.discovery.persistence.ContinuationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the continuation queue and runs one state machine invocation per claimed message.
 * A message whose worker dies is redelivered once its lease expires.
 */
@Service
public class ContinuationWorkerService {
    private static final Logger log = LoggerFactory.getLogger(ContinuationWorkerService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final ContinuationQueue queue;
    private final JobStateMachine stateMachine;
    private final DiscoveryProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;

    public ContinuationWorkerService(
        ContinuationQueue queue,
        JobStateMachine stateMachine,
        DiscoveryProperties properties
    ) {
        this.queue = queue;
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            DiscoveryProperties.Worker config = properties.getWorker();
            int workerCount = config.getWorkerCount();
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("continuation-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, config.getPollIntervalMs(), config.getLockTtlSeconds()));
            }
            log.info("Started {} continuation workers as {}", workerCount, instanceId);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
        }
    }

    /**
     * Claims and processes at most one due message.
     *
     * @return true when a message was claimed
     */
    public boolean processNext(long lockTtlSeconds) {
        Optional<ContinuationMessage> claimed = queue.claimNext(instanceId, lockTtlSeconds);
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get());
        return true;
    }

    private void workerLoop(int workerIndex, int pollIntervalMs, long lockTtlSeconds) {
        Thread.currentThread().setName("continuation-worker-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean claimed;
            try {
                claimed = processNext(lockTtlSeconds);
            } catch (Exception e) {
                log.warn("Continuation worker {} failed to claim a message", workerIndex, e);
                claimed = false;
            }
            if (!claimed) {
                sleep(pollIntervalMs);
            }
        }
    }

    void process(ContinuationMessage message) {
        try {
            JobAdvanceOutcome outcome = stateMachine.advance(message.jobId());
            if (outcome.hasContinuation()) {
                queue.reschedule(message.id(), outcome.continuation().delay());
            } else if (outcome.action() == AdvanceAction.CONFLICT) {
                queue.release(message.id(), retryDelay(message), "conflict");
            } else {
                queue.acknowledge(message.id());
            }
        } catch (JobNotFoundException e) {
            log.warn("Dropping continuation {} for unknown job {}", message.id(), message.jobId());
            queue.acknowledge(message.id());
        } catch (Exception e) {
            log.warn("Continuation {} for job {} failed", message.id(), message.jobId(), e);
            releaseAfterFailure(message, e);
        }
    }

    private void releaseAfterFailure(ContinuationMessage message, Exception failure) {
        String error = "exception=" + failure.getClass().getSimpleName();
        if (failure.getMessage() != null) {
            error = error + ": " + failure.getMessage();
        }
        if (error.length() > MAX_ERROR_LENGTH) {
            error = error.substring(0, MAX_ERROR_LENGTH);
        }
        try {
            queue.release(message.id(), retryDelay(message), error);
        } catch (Exception ex) {
            log.warn("Failed to release continuation {}; it is redelivered after its lease expires", message.id(), ex);
        }
    }

    private Duration retryDelay(ContinuationMessage message) {
        DiscoveryProperties.Continuation config = properties.getContinuation();
        int exponent = Math.min(10, Math.max(0, message.deliveryCount() - 1));
        long delayMs = Math.min(config.getMaxBackoffMs(), (long) config.getRetryBackoffMs() * (1L << exponent));
        return Duration.ofMillis(delayMs);
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(50, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
