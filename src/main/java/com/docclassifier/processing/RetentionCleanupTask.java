package com.docclassifier.processing;

import com.docclassifier.api.storage.StorageService;
import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.BatchJobRepository;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;

/**
 * Scheduled task that deletes finished jobs, their stored uploads and emptied batches once
 * they are older than the retention period.
 */
@Service
public class RetentionCleanupTask {

    private static final Logger logger = LoggerFactory.getLogger(RetentionCleanupTask.class);

    private final ClassificationJobRepository jobRepository;
    private final BatchJobRepository batchRepository;
    private final StorageService storageService;
    private final int retentionDays;

    public RetentionCleanupTask(ClassificationJobRepository jobRepository,
                                BatchJobRepository batchRepository,
                                StorageService storageService,
                                @Value("${app.retention.days:30}") int retentionDays) {
        this.jobRepository = jobRepository;
        this.batchRepository = batchRepository;
        this.storageService = storageService;
        this.retentionDays = retentionDays;
        logger.info("RetentionCleanupTask initialized: retentionDays={}", retentionDays);
    }

    @Scheduled(fixedDelayString = "${app.retention.interval-ms:3600000}", initialDelayString = "${app.retention.interval-ms:3600000}")
    public void scheduledCleanup() {
        try {
            cleanupOldData(Instant.now().minus(retentionDays, ChronoUnit.DAYS));
        } catch (RuntimeException e) {
            logger.error("Error during retention cleanup", e);
        }
    }

    /**
     * Deletes terminal jobs created before the cutoff and batches left without members.
     *
     * @return number of jobs deleted
     */
    @Transactional
    public int cleanupOldData(Instant cutoff) {
        List<ClassificationJob> expired = jobRepository.findCreatedBeforeWithStatusIn(cutoff,
                EnumSet.of(JobState.SUCCESS, JobState.FAILURE));
        for (ClassificationJob job : expired) {
            if (job.getStoragePath() != null) {
                try {
                    storageService.delete(job.getStoragePath());
                } catch (IOException | IllegalArgumentException e) {
                    logger.warn("Upload {} of expired job {} could not be deleted: {}",
                            job.getStoragePath(), job.getJobUuid(), e.getMessage());
                }
            }
        }
        jobRepository.deleteAllInBatch(expired);
        int deletedBatches = batchRepository.deleteEmptyBatchesCreatedBefore(cutoff);
        logger.info("Retention cleanup (cutoff {}): deleted {} job(s) and {} batch(es)",
                cutoff, expired.size(), deletedBatches);
        return expired.size();
    }
}
