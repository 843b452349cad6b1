package com.docclassifier.processing;

import com.docclassifier.api.storage.StorageService;
import com.docclassifier.observability.ClassificationMetrics;
import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.PipelineResult;
import com.docclassifier.shared.exception.ClassificationException;
import com.docclassifier.shared.exception.UnsupportedFormatException;
import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.JobState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one claimed job through the pipeline and records SUCCESS or FAILURE.
 * Storage and job store errors are retried with a fixed backoff; document errors are not.
 */
@Service
public class ClassificationJobWorker {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationJobWorker.class);

    private final JobClaimService claimService;
    private final ClassificationPipeline pipeline;
    private final StorageService storageService;
    private final ClassificationMetrics metrics;
    private final ObjectMapper objectMapper;

    @Value("${app.job.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${app.job.retry-backoff-ms:500}")
    private long retryBackoffMs = 500;

    public ClassificationJobWorker(JobClaimService claimService,
                                   ClassificationPipeline pipeline,
                                   StorageService storageService,
                                   ClassificationMetrics metrics,
                                   ObjectMapper objectMapper) {
        this.claimService = claimService;
        this.pipeline = pipeline;
        this.storageService = storageService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Claims and processes a job. A job that cannot be claimed is left alone.
     */
    public void process(UUID jobId) {
        MDC.put("job_id", jobId.toString());
        try {
            Optional<ClassificationJob> claimed = withRetries("claim", () -> claimService.claim(jobId));
            if (claimed.isEmpty()) {
                return;
            }
            ClassificationJob job = claimed.get();
            if (job.getBatchUuid() != null) {
                MDC.put("batch_id", job.getBatchUuid().toString());
            }
            logger.info("Processing job {} (attempt {})", jobId, job.getAttemptCount());
            runClaimed(job);
        } catch (InfrastructureFailure e) {
            logger.error("Job {} could not be claimed: {}", jobId, e.getMessage(), e.getCause());
        } finally {
            MDC.remove("job_id");
            MDC.remove("batch_id");
        }
    }

    private void runClaimed(ClassificationJob job) {
        UUID jobId = job.getJobUuid();
        int attempt = job.getAttemptCount();

        byte[] content;
        try {
            content = withRetries("load document", () -> storageService.load(job.getStoragePath()));
        } catch (InfrastructureFailure e) {
            record(job, attempt, JobState.FAILURE, () -> claimService.fail(jobId, attempt,
                    ErrorCode.INFRASTRUCTURE, "Document could not be loaded: " + e.getMessage(), null),
                    ErrorCode.INFRASTRUCTURE);
            return;
        }

        PipelineResult outcome;
        try {
            outcome = pipeline.run(content, job.getIndustry());
        } catch (ClassificationException e) {
            String mediaType = e instanceof UnsupportedFormatException
                    ? ((UnsupportedFormatException) e).getMediaType() : null;
            logger.info("Job {} failed with {}: {}", jobId, e.getErrorCode(), e.getMessage());
            record(job, attempt, JobState.FAILURE, () -> claimService.fail(jobId, attempt,
                    e.getErrorCode(), e.getMessage(), mediaType), e.getErrorCode());
            return;
        } catch (RuntimeException e) {
            logger.error("Job {} failed unexpectedly", jobId, e);
            record(job, attempt, JobState.FAILURE, () -> claimService.fail(jobId, attempt,
                    ErrorCode.INFRASTRUCTURE, "Unexpected error: " + e.getMessage(), null),
                    ErrorCode.INFRASTRUCTURE);
            return;
        }

        ClassificationResult result = outcome.getResult();
        String resultJson;
        try {
            resultJson = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            logger.error("Result of job {} could not be serialized", jobId, e);
            record(job, attempt, JobState.FAILURE, () -> claimService.fail(jobId, attempt,
                    ErrorCode.CLASSIFIER_ERROR, "Result could not be serialized: " + e.getOriginalMessage(),
                    outcome.getMediaType()), ErrorCode.CLASSIFIER_ERROR);
            return;
        }

        record(job, attempt, JobState.SUCCESS, () -> claimService.complete(jobId, attempt, resultJson,
                result.getDocumentType(), result.getConfidence(), outcome.getMediaType()), null);
        logger.info("Job {} succeeded: {} ({})", jobId, result.getDocumentType(), result.getConfidence());
    }

    private void record(ClassificationJob job, int attempt, JobState state, RetryableAction<Boolean> transition,
                        ErrorCode errorCode) {
        boolean recorded;
        try {
            recorded = withRetries("record " + state, transition);
        } catch (InfrastructureFailure e) {
            // the lease will expire and the reaper records WORKER_TIMEOUT
            logger.error("Outcome {} of job {} attempt {} could not be recorded", state, job.getJobUuid(), attempt,
                    e.getCause());
            return;
        }
        if (recorded) {
            metrics.recordJobOutcome(state, errorCode);
            // failed uploads stay for batch retry until retention removes them
            if (state == JobState.SUCCESS) {
                deleteUpload(job);
            }
        }
    }

    private void deleteUpload(ClassificationJob job) {
        if (job.getStoragePath() == null) {
            return;
        }
        try {
            storageService.delete(job.getStoragePath());
        } catch (IOException | RuntimeException e) {
            logger.warn("Stored upload {} of finished job {} could not be deleted: {}",
                    job.getStoragePath(), job.getJobUuid(), e.getMessage());
        }
    }

    private <T> T withRetries(String what, RetryableAction<T> action) {
        Exception last = null;
        for (int attempt = 1; attempt <= Math.max(1, maxAttempts); attempt++) {
            try {
                return action.run();
            } catch (IOException | DataAccessException e) {
                last = e;
                logger.warn("{} failed (attempt {}/{}): {}", what, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleep(retryBackoffMs);
                }
            }
        }
        throw new InfrastructureFailure(what + " failed after " + maxAttempts + " attempts", last);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfrastructureFailure("interrupted while backing off", e);
        }
    }

    void setRetryPolicy(int maxAttempts, long retryBackoffMs) {
        this.maxAttempts = maxAttempts;
        this.retryBackoffMs = retryBackoffMs;
    }

    @FunctionalInterface
    interface RetryableAction<T> {
        T run() throws IOException;
    }

    private static final class InfrastructureFailure extends RuntimeException {
        InfrastructureFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
