package com.docclassifier.processing;

import com.docclassifier.observability.ClassificationMetrics;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Scheduled liveness check. RUNNING jobs whose lease has expired are failed with
 * WORKER_TIMEOUT; they are never put back to PENDING. Their uploads are kept, so a batch
 * member that timed out can be retried.
 */
@Service
public class JobReaperService {

    private static final Logger logger = LoggerFactory.getLogger(JobReaperService.class);

    private final ClassificationJobRepository jobRepository;
    private final ClassificationMetrics metrics;

    public JobReaperService(ClassificationJobRepository jobRepository,
                            ClassificationMetrics metrics) {
        this.jobRepository = jobRepository;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${app.job.reaper-interval-ms:60000}",
            initialDelayString = "${app.job.reaper-interval-ms:60000}")
    public void scheduledReap() {
        try {
            reapStaleJobs();
        } catch (RuntimeException e) {
            logger.error("Error during job reaping", e);
        }
    }

    /**
     * @return number of jobs failed with WORKER_TIMEOUT
     */
    @Transactional
    public int reapStaleJobs() {
        Instant now = Instant.now();
        List<UUID> staleJobs = jobRepository.findExpiredLeases(JobState.RUNNING, now);
        if (staleJobs.isEmpty()) {
            return 0;
        }
        logger.info("Found {} RUNNING job(s) with expired leases", staleJobs.size());

        int reaped = 0;
        for (UUID jobUuid : staleJobs) {
            int updatedRows = jobRepository.failIfLeaseExpired(jobUuid, JobState.RUNNING, JobState.FAILURE,
                    ErrorCode.WORKER_TIMEOUT, "Worker did not finish before its lease expired", now);
            if (updatedRows == 0) {
                continue;
            }
            reaped++;
            metrics.recordJobOutcome(JobState.FAILURE, ErrorCode.WORKER_TIMEOUT);
            logger.warn("Marked stale job {} as FAILURE (WORKER_TIMEOUT)", jobUuid);
        }
        return reaped;
    }
}
