package com.delta.creatorscout.discovery.service;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.JobStatus;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.SearchMode;
import com.delta.creatorscout.discovery.persistence.ContinuationQueue;
import com.delta.creatorscout.discovery.persistence.DiscoveryJobStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StalledJobRecoveryRunnerTest {

    @Mock
    private DiscoveryJobStore jobStore;
    @Mock
    private ContinuationQueue queue;

    @Test
    void requeuesOnlyJobsWithoutPendingMessage() {
        DiscoveryJob orphaned = job(JobStatus.PROCESSING);
        DiscoveryJob queued = job(JobStatus.PENDING);
        when(jobStore.findNonTerminal(StalledJobRecoveryRunner.MAX_JOBS_PER_STARTUP)).thenReturn(List.of(orphaned, queued));
        when(queue.hasMessage(orphaned.id())).thenReturn(false);
        when(queue.hasMessage(queued.id())).thenReturn(true);

        int recovered = new StalledJobRecoveryRunner(jobStore, queue, new DiscoveryProperties()).recoverStalledJobs();

        assertThat(recovered).isEqualTo(1);
        verify(queue).enqueue(orphaned.id(), Duration.ZERO);
        verify(queue, never()).enqueue(eq(queued.id()), any());
    }

    @Test
    void unreachableDatabaseSkipsRecovery() {
        when(jobStore.findNonTerminal(StalledJobRecoveryRunner.MAX_JOBS_PER_STARTUP))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        int recovered = new StalledJobRecoveryRunner(jobStore, queue, new DiscoveryProperties()).recoverStalledJobs();

        assertThat(recovered).isZero();
        verify(queue, never()).enqueue(any(), any());
    }

    private static DiscoveryJob job(JobStatus status) {
        Instant now = Instant.now();
        return new DiscoveryJob(
            UUID.randomUUID(), "acct-1", Platform.YOUTUBE, SearchMode.KEYWORD, List.of("guitar lessons"), null, "US",
            20, 10, 2, 4, null, false, 30, status, 0, null, now, now, null, now, null, 3
        );
    }
}
