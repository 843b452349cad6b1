package com.docclassifier.processing;

import com.docclassifier.api.messaging.JobPublisher;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Picks up jobs still PENDING.
 * <p>
 * In executor mode the jobs are published again, e.g. after the worker pool rejected a hand-off
 * or the process restarted; a rejected publish leaves the rest for the next poll. Jobs are never
 * run on the scheduler thread in this mode. With app.messaging.mode=poll this poller is the
 * only consumer and processes the jobs itself.
 */
@Service
@ConditionalOnProperty(name = "app.worker.poller-enabled", havingValue = "true", matchIfMissing = true)
public class PendingJobPoller {

    private static final Logger logger = LoggerFactory.getLogger(PendingJobPoller.class);

    static final String POLL_MODE = "poll";

    private final ClassificationJobRepository jobRepository;
    private final JobPublisher jobPublisher;
    private final ClassificationJobWorker worker;
    private final boolean processInline;
    private final int batchSize;

    public PendingJobPoller(ClassificationJobRepository jobRepository,
                            JobPublisher jobPublisher,
                            ClassificationJobWorker worker,
                            @Value("${app.messaging.mode:executor}") String messagingMode,
                            @Value("${app.worker.poll-batch-size:20}") int batchSize) {
        this.jobRepository = jobRepository;
        this.jobPublisher = jobPublisher;
        this.worker = worker;
        this.processInline = POLL_MODE.equalsIgnoreCase(messagingMode);
        this.batchSize = Math.max(1, batchSize);
    }

    @Scheduled(fixedDelayString = "${app.worker.poll-ms:5000}", initialDelayString = "${app.worker.poll-ms:5000}")
    public void pollPendingJobs() {
        try {
            List<UUID> pending = jobRepository.findJobUuidsByStatus(JobState.PENDING, PageRequest.of(0, batchSize));
            if (pending.isEmpty()) {
                return;
            }
            logger.debug("Found {} PENDING job(s), inline={}", pending.size(), processInline);
            for (UUID jobUuid : pending) {
                if (processInline) {
                    worker.process(jobUuid);
                } else if (!jobPublisher.publishJobQueued(jobUuid)) {
                    logger.debug("Worker pool still saturated; remaining PENDING jobs wait for the next poll");
                    return;
                }
            }
        } catch (RuntimeException e) {
            logger.error("Error during pending job polling", e);
        }
    }
}
