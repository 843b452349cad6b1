package com.docclassifier.processing;

import com.docclassifier.api.messaging.JobPublisher;
import com.docclassifier.api.storage.StorageService;
import com.docclassifier.observability.ClassificationMetrics;
import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.DocumentSubmission;
import com.docclassifier.processing.strategy.StrategyRegistry;
import com.docclassifier.shared.dto.JobView;
import com.docclassifier.shared.exception.InfrastructureException;
import com.docclassifier.shared.exception.JobNotFoundException;
import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.ErrorInfo;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.UUID;

/**
 * Creates classification jobs and answers status reads. Processing happens elsewhere; nothing
 * here waits for a job to finish.
 */
@Service
public class ClassificationJobService {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationJobService.class);

    private final ClassificationJobRepository jobRepository;
    private final StorageService storageService;
    private final JobPublisher jobPublisher;
    private final StrategyRegistry strategyRegistry;
    private final ClassificationMetrics metrics;
    private final ObjectMapper objectMapper;

    public ClassificationJobService(ClassificationJobRepository jobRepository,
                                    StorageService storageService,
                                    JobPublisher jobPublisher,
                                    StrategyRegistry strategyRegistry,
                                    ClassificationMetrics metrics,
                                    ObjectMapper objectMapper) {
        this.jobRepository = jobRepository;
        this.storageService = storageService;
        this.jobPublisher = jobPublisher;
        this.strategyRegistry = strategyRegistry;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Persists a PENDING job for the submission and hands it to the queue.
     *
     * @throws com.docclassifier.shared.exception.UnknownIndustryException for an unregistered industry;
     *         no job is created
     * @throws InfrastructureException if the document cannot be stored
     */
    public ClassificationJob submit(DocumentSubmission submission) {
        strategyRegistry.validate(submission.getIndustry());
        ClassificationJob job = newJob(new ClassificationJob(), submission, null, null);
        try {
            job.setStoragePath(store(job, submission));
        } catch (IOException e) {
            logger.error("Failed to store document for job {}", job.getJobUuid(), e);
            throw new InfrastructureException("Document could not be stored", e);
        }
        ClassificationJob saved = save(job);
        publish(saved.getJobUuid());
        return saved;
    }

    /**
     * Persists a batch member without publishing it. A member whose document cannot be stored is
     * saved as FAILURE with INFRASTRUCTURE so that its siblings still run.
     *
     * @param jobUuid id for the new job
     */
    ClassificationJob createMember(DocumentSubmission submission, UUID batchUuid, int position, UUID jobUuid) {
        ClassificationJob job = newJob(new ClassificationJob(jobUuid), submission, batchUuid, position);
        try {
            job.setStoragePath(store(job, submission));
        } catch (IOException e) {
            logger.error("Failed to store member {} of batch {}", position, batchUuid, e);
            job.failBeforeQueueing(ErrorCode.INFRASTRUCTURE, "Document could not be stored: " + e.getMessage());
            metrics.recordJobOutcome(JobState.FAILURE, ErrorCode.INFRASTRUCTURE);
        }
        return save(job);
    }

    void publish(UUID jobUuid) {
        if (!jobPublisher.publishJobQueued(jobUuid)) {
            logger.debug("Job {} not accepted by publisher; stays PENDING", jobUuid);
        }
    }

    private static ClassificationJob newJob(ClassificationJob job, DocumentSubmission submission,
                                            UUID batchUuid, Integer position) {
        job.setFilename(submission.getFilename());
        job.setIndustry(submission.getIndustry());
        job.setFileSizeBytes((long) submission.getSize());
        job.setBatchUuid(batchUuid);
        job.setBatchPosition(position);
        return job;
    }

    private String store(ClassificationJob job, DocumentSubmission submission) throws IOException {
        return storageService.store(job.getJobUuid(), submission.getFilename(), submission.getContent());
    }

    private ClassificationJob save(ClassificationJob job) {
        ClassificationJob saved = jobRepository.save(job);
        logger.info("Created job {} (file={}, size={} bytes, industry={}, batch={}, status={})", saved.getJobUuid(),
                saved.getFilename(), saved.getFileSizeBytes(), saved.getIndustry(), saved.getBatchUuid(),
                saved.getStatus());
        return saved;
    }

    /**
     * Non-blocking status read.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public JobView status(UUID jobUuid) {
        ClassificationJob job = jobRepository.findByJobUuid(jobUuid)
                .orElseThrow(() -> new JobNotFoundException("Job", jobUuid));
        return toView(job);
    }

    JobView toView(ClassificationJob job) {
        ClassificationResult result = null;
        if (job.getStatus() == JobState.SUCCESS && job.getResultJson() != null) {
            try {
                result = objectMapper.readValue(job.getResultJson(), ClassificationResult.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Stored result of job " + job.getJobUuid() + " is unreadable", e);
            }
        }
        ErrorInfo error = job.getStatus() == JobState.FAILURE && job.getErrorCode() != null
                ? new ErrorInfo(job.getErrorCode(), job.getErrorMessage())
                : null;
        return new JobView(job.getJobUuid(), job.getStatus(), job.getBatchUuid(), job.getFilename(),
                job.getMediaType(), result, error, job.getAttemptCount(), job.getCreatedAt(),
                job.getStartedAt(), job.getCompletedAt());
    }
}
