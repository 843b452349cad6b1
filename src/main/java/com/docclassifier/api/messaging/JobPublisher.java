package com.docclassifier.api.messaging;

import java.util.UUID;

/**
 * Hands a persisted PENDING job to whatever runs it.
 * A hand-off that is not accepted leaves the job PENDING for the pending-job poller.
 */
public interface JobPublisher {

    /**
     * @return true if the job was accepted for processing
     */
    boolean publishJobQueued(UUID jobId);
}
