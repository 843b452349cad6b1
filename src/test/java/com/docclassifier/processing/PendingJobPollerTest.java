package com.docclassifier.processing;

import com.docclassifier.api.messaging.JobPublisher;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PendingJobPollerTest {

    @Mock
    private ClassificationJobRepository jobRepository;

    @Mock
    private JobPublisher jobPublisher;

    @Mock
    private ClassificationJobWorker worker;

    private final UUID first = UUID.randomUUID();
    private final UUID second = UUID.randomUUID();

    @Test
    void saturatedPoolLeavesJobsPendingInsteadOfRunningThemOnTheSchedulerThread() {
        // Given: the worker pool rejects the hand-off
        when(jobRepository.findJobUuidsByStatus(eq(JobState.PENDING), any(Pageable.class)))
                .thenReturn(List.of(first, second));
        when(jobPublisher.publishJobQueued(first)).thenReturn(false);
        PendingJobPoller poller = new PendingJobPoller(jobRepository, jobPublisher, worker, "executor", 20);

        // When
        poller.pollPendingJobs();

        // Then: nothing runs inline and the rest waits for the next poll
        verifyNoInteractions(worker);
        verify(jobPublisher, never()).publishJobQueued(second);
    }

    @Test
    void executorModeRepublishesEveryPendingJob() {
        when(jobRepository.findJobUuidsByStatus(eq(JobState.PENDING), any(Pageable.class)))
                .thenReturn(List.of(first, second));
        when(jobPublisher.publishJobQueued(any())).thenReturn(true);
        PendingJobPoller poller = new PendingJobPoller(jobRepository, jobPublisher, worker, "executor", 20);

        poller.pollPendingJobs();

        verify(jobPublisher).publishJobQueued(first);
        verify(jobPublisher).publishJobQueued(second);
        verifyNoInteractions(worker);
    }

    @Test
    void pollModeProcessesJobsDirectly() {
        when(jobRepository.findJobUuidsByStatus(eq(JobState.PENDING), any(Pageable.class)))
                .thenReturn(List.of(first, second));
        PendingJobPoller poller = new PendingJobPoller(jobRepository, jobPublisher, worker, "poll", 20);

        poller.pollPendingJobs();

        verify(worker).process(first);
        verify(worker).process(second);
        verifyNoInteractions(jobPublisher);
    }
}
