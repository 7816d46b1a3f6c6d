package com.delta.creatorscout.discovery.service;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.persistence.ContinuationQueue;
import com.delta.creatorscout.discovery.persistence.DiscoveryJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Re-queues non-terminal jobs that lost their continuation message, for example after a queue
 * outage, so that every such job has exactly one pending invocation.
 */
@Component
public class StalledJobRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StalledJobRecoveryRunner.class);
    static final int MAX_JOBS_PER_STARTUP = 500;

    private final DiscoveryJobStore jobStore;
    private final ContinuationQueue queue;
    private final DiscoveryProperties properties;

    public StalledJobRecoveryRunner(DiscoveryJobStore jobStore, ContinuationQueue queue, DiscoveryProperties properties) {
        this.jobStore = jobStore;
        this.queue = queue;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getWorker().isRecoverOnStartup()) {
            return;
        }
        int recovered = recoverStalledJobs();
        if (recovered > 0) {
            log.info("Re-queued {} stalled discovery jobs on startup", recovered);
        }
    }

    public int recoverStalledJobs() {
        List<DiscoveryJob> jobs;
        try {
            jobs = jobStore.findNonTerminal(MAX_JOBS_PER_STARTUP);
        } catch (Exception e) {
            log.warn("Skipping stalled job recovery because the database is unreachable", e);
            return 0;
        }
        int recovered = 0;
        for (DiscoveryJob job : jobs) {
            if (queue.hasMessage(job.id())) {
                continue;
            }
            queue.enqueue(job.id(), Duration.ZERO);
            recovered++;
            log.info("Re-queued stalled job {} status={} apiCallsMade={}", job.id(), job.status(), job.apiCallsMade());
        }
        return recovered;
    }
}
