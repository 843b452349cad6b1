package com.docclassifier.api.messaging;

import com.docclassifier.processing.ClassificationJobWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ExecutorJobPublisherTest {

    @Mock
    private ClassificationJobWorker worker;

    private ThreadPoolTaskExecutor executor;
    private final CountDownLatch firstJobStarted = new CountDownLatch(1);
    private final CountDownLatch releaseFirstJob = new CountDownLatch(1);
    private final UUID blockingJob = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        doAnswer(invocation -> {
            firstJobStarted.countDown();
            releaseFirstJob.await(10, TimeUnit.SECONDS);
            return null;
        }).when(worker).process(blockingJob);
    }

    @AfterEach
    void tearDown() {
        releaseFirstJob.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void republishingQueuedJobsDoesNotGrowTheQueue() throws Exception {
        // Given: one worker thread, busy with a blocking job
        executor = executor(1, 10);
        ExecutorJobPublisher publisher = new ExecutorJobPublisher(executor, worker);
        publisher.publishJobQueued(blockingJob);
        assertThat(firstJobStarted.await(5, TimeUnit.SECONDS)).isTrue();
        UUID second = UUID.randomUUID();
        UUID third = UUID.randomUUID();
        publisher.publishJobQueued(second);
        publisher.publishJobQueued(third);

        // When: the same PENDING jobs are published again, as a poll would
        assertThat(publisher.publishJobQueued(second)).isTrue();
        assertThat(publisher.publishJobQueued(third)).isTrue();

        // Then
        assertThat(executor.getThreadPoolExecutor().getQueue()).hasSize(2);
        releaseFirstJob.countDown();
        executor.shutdown();
        verify(worker, times(1)).process(second);
        verify(worker, times(1)).process(third);
        assertThat(publisher.inFlightCount()).isZero();
    }

    @Test
    void rejectedHandOffIsReportedAndCanBeRetried() throws Exception {
        executor = executor(1, 0);
        ExecutorJobPublisher publisher = new ExecutorJobPublisher(executor, worker);
        publisher.publishJobQueued(blockingJob);
        assertThat(firstJobStarted.await(5, TimeUnit.SECONDS)).isTrue();
        UUID rejected = UUID.randomUUID();

        assertThat(publisher.publishJobQueued(rejected)).isFalse();
        assertThat(publisher.publishJobQueued(rejected)).isFalse();
        assertThat(publisher.inFlightCount()).isEqualTo(1);
    }

    private static ThreadPoolTaskExecutor executor(int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
