package com.docclassifier.config;

import com.docclassifier.api.messaging.ExecutorJobPublisher;
import com.docclassifier.api.messaging.JobPublisher;
import com.docclassifier.processing.PendingJobPoller;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "app.worker.pool-size=3",
        "app.worker.queue-capacity=7"
})
class WorkerConfigTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    @Qualifier("classificationExecutor")
    private ThreadPoolTaskExecutor classificationExecutor;

    @Test
    void executorModeIsTheDefault() {
        // When: no messaging mode is configured
        // Then: jobs are handed to the in-process worker pool and the poller is active
        assertThat(context.getBean(JobPublisher.class)).isInstanceOf(ExecutorJobPublisher.class);
        assertThat(context.getBeansOfType(PendingJobPoller.class)).hasSize(1);
    }

    @Test
    void workerPoolIsBounded() {
        assertThat(classificationExecutor.getCorePoolSize()).isEqualTo(3);
        assertThat(classificationExecutor.getMaxPoolSize()).isEqualTo(3);
        assertThat(classificationExecutor.getQueueCapacity()).isEqualTo(7);
        assertThat(classificationExecutor.getThreadNamePrefix()).isEqualTo("classify-");
    }

    @Test
    void scheduledTasksDoNotShareASingleThread() {
        ThreadPoolTaskScheduler scheduler = context.getBean("taskScheduler", ThreadPoolTaskScheduler.class);

        assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(3);
    }
}
