package com.docclassifier.processing;

import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import com.docclassifier.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * Claims jobs and records their outcome, each inside a single transaction.
 * This is a separate bean to avoid @Transactional self-invocation.
 */
@Service
public class JobClaimService {

    private static final Logger logger = LoggerFactory.getLogger(JobClaimService.class);

    private final ClassificationJobRepository jobRepository;

    @Value("${app.job.lease-duration-minutes:10}")
    private int leaseDurationMinutes;

    public JobClaimService(ClassificationJobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    /**
     * Atomically moves a job from PENDING to RUNNING.
     *
     * @return the claimed job, or empty if another worker got it first or it is not PENDING
     */
    @Transactional
    public Optional<ClassificationJob> claim(UUID jobUuid) {
        Instant now = Instant.now();
        Instant leaseExpiresAt = now.plus(leaseDurationMinutes, ChronoUnit.MINUTES);
        int updatedRows = jobRepository.claim(jobUuid, JobState.PENDING, JobState.RUNNING, leaseExpiresAt, now);
        if (updatedRows == 0) {
            logger.debug("Could not claim job {} (already claimed or not PENDING)", jobUuid);
            return Optional.empty();
        }
        logger.debug("Claimed job {} with lease expiring at {}", jobUuid, leaseExpiresAt);
        return jobRepository.findByJobUuid(jobUuid);
    }

    /**
     * RUNNING -> SUCCESS for the given attempt.
     *
     * @return false if the job is no longer RUNNING under that attempt (e.g. reaped)
     */
    @Transactional
    public boolean complete(UUID jobUuid, int attempt, String resultJson, String documentType,
                            double confidence, String mediaType) {
        int updatedRows = jobRepository.complete(jobUuid, attempt, JobState.RUNNING, JobState.SUCCESS,
                resultJson, documentType, confidence, mediaType, Instant.now());
        if (updatedRows == 0) {
            logger.warn("Job {} attempt {} lost its claim before completion; result discarded", jobUuid, attempt);
            return false;
        }
        return true;
    }

    /**
     * RUNNING -> FAILURE for the given attempt.
     */
    @Transactional
    public boolean fail(UUID jobUuid, int attempt, ErrorCode errorCode, String errorMessage, String mediaType) {
        int updatedRows = jobRepository.fail(jobUuid, attempt, JobState.RUNNING, JobState.FAILURE,
                errorCode, Strings.truncate(errorMessage, ClassificationJob.MAX_ERROR_MESSAGE_LENGTH),
                mediaType, Instant.now());
        if (updatedRows == 0) {
            logger.warn("Job {} attempt {} lost its claim before failure could be recorded", jobUuid, attempt);
            return false;
        }
        return true;
    }
}
