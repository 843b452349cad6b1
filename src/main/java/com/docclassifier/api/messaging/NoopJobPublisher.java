package com.docclassifier.api.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Leaves every job PENDING; jobs are picked up only by the pending-job poller.
 * Registered when app.messaging.mode=poll.
 */
@Service
@ConditionalOnProperty(name = "app.messaging.mode", havingValue = "poll")
public class NoopJobPublisher implements JobPublisher {

    private static final Logger logger = LoggerFactory.getLogger(NoopJobPublisher.class);

    @Override
    public boolean publishJobQueued(UUID jobId) {
        logger.debug("No-op: job {} left for the pending-job poller", jobId);
        return false;
    }
}
