package com.docclassifier.config;

import com.docclassifier.api.messaging.JobPublisher;
import com.docclassifier.api.messaging.NoopJobPublisher;
import com.docclassifier.processing.PendingJobPoller;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "app.messaging.mode=poll",
        "app.worker.poller-enabled=false"
})
class PollModeConfigTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void pollModePublishesNothingAndPollerCanBeSwitchedOff() {
        assertThat(context.getBean(JobPublisher.class)).isInstanceOf(NoopJobPublisher.class);
        assertThat(context.getBeansOfType(PendingJobPoller.class)).isEmpty();
    }
}
