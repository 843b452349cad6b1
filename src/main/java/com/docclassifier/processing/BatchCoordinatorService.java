package com.docclassifier.processing;

import com.docclassifier.api.storage.StorageService;
import com.docclassifier.processing.model.DocumentSubmission;
import com.docclassifier.processing.strategy.StrategyRegistry;
import com.docclassifier.shared.dto.BatchStatus;
import com.docclassifier.shared.dto.JobView;
import com.docclassifier.shared.exception.JobNotFoundException;
import com.docclassifier.shared.model.BatchJob;
import com.docclassifier.shared.model.BatchState;
import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.BatchJobRepository;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Groups independent classification jobs into a batch. Members succeed or fail on their own;
 * the batch state is derived from them on every read.
 */
@Service
public class BatchCoordinatorService {

    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinatorService.class);

    private final BatchJobRepository batchRepository;
    private final ClassificationJobRepository jobRepository;
    private final ClassificationJobService jobService;
    private final StrategyRegistry strategyRegistry;
    private final StorageService storageService;
    private final int maxBatchSize;

    public BatchCoordinatorService(BatchJobRepository batchRepository,
                                   ClassificationJobRepository jobRepository,
                                   ClassificationJobService jobService,
                                   StrategyRegistry strategyRegistry,
                                   StorageService storageService,
                                   @Value("${app.batch.max-size:100}") int maxBatchSize) {
        this.batchRepository = batchRepository;
        this.jobRepository = jobRepository;
        this.jobService = jobService;
        this.strategyRegistry = strategyRegistry;
        this.storageService = storageService;
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Creates one member job per submission, in input order, then queues them.
     * Industries and the batch size are validated before anything is created, so an unknown
     * industry rejects the whole submission. A member whose document cannot be stored fails on
     * its own with INFRASTRUCTURE.
     *
     * @param industry default industry for members that carry none; may be null
     */
    public BatchJob submitBatch(List<DocumentSubmission> submissions, String industry) {
        if (submissions == null || submissions.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one document");
        }
        if (submissions.size() > maxBatchSize) {
            throw new IllegalArgumentException(String.format("Batch size (%d) exceeds maximum of %d documents",
                    submissions.size(), maxBatchSize));
        }
        List<DocumentSubmission> members = new ArrayList<>(submissions.size());
        for (DocumentSubmission submission : submissions) {
            DocumentSubmission member = submission.withDefaultIndustry(industry);
            strategyRegistry.validate(member.getIndustry());
            members.add(member);
        }

        BatchJob batch = new BatchJob();
        batch.setIndustry(industry == null || industry.isBlank() ? null : industry.trim());
        batch.setMemberCount(members.size());
        batch = batchRepository.save(batch);
        MDC.put("batch_id", batch.getBatchUuid().toString());
        try {
            List<ClassificationJob> created = new ArrayList<>(members.size());
            for (int position = 0; position < members.size(); position++) {
                created.add(jobService.createMember(members.get(position), batch.getBatchUuid(), position,
                        UUID.randomUUID()));
            }
            logger.info("Created batch {} with {} member job(s)", batch.getBatchUuid(), created.size());
            publishPending(created);
            return batch;
        } finally {
            MDC.remove("batch_id");
        }
    }

    /**
     * Reads the batch and its current members once and derives the state from that read.
     *
     * @throws JobNotFoundException if the batch does not exist
     */
    public BatchStatus status(UUID batchUuid) {
        BatchJob batch = findBatch(batchUuid);
        List<ClassificationJob> members = currentMembers(batchUuid);

        List<JobView> views = new ArrayList<>(members.size());
        List<JobState> states = new ArrayList<>(members.size());
        for (ClassificationJob member : members) {
            views.add(jobService.toView(member));
            states.add(member.getStatus());
        }
        return new BatchStatus(batchUuid, BatchState.derive(states), batch.getIndustry(), batch.getCreatedAt(), views);
    }

    /**
     * Fails every member that is still PENDING with CANCELLED. Running and finished members
     * are left alone. Uploads of cancelled members are kept so they can be retried.
     *
     * @return number of members cancelled
     */
    public int cancel(UUID batchUuid) {
        findBatch(batchUuid);
        int cancelled = jobRepository.failPendingInBatch(batchUuid, JobState.PENDING, JobState.FAILURE,
                ErrorCode.CANCELLED, "Cancelled before processing started", Instant.now());
        logger.info("Cancelled {} pending member(s) of batch {}", cancelled, batchUuid);
        return cancelled;
    }

    /**
     * Resubmits failed and cancelled members as new jobs at the same batch position. The
     * replaced member keeps its history and drops out of the batch status. Members whose upload
     * is gone, e.g. because it could never be stored, are skipped.
     *
     * @return number of members resubmitted
     */
    public int retry(UUID batchUuid) {
        BatchJob batch = findBatch(batchUuid);
        MDC.put("batch_id", batchUuid.toString());
        try {
            List<ClassificationJob> resubmitted = new ArrayList<>();
            for (ClassificationJob member : currentMembers(batchUuid)) {
                if (member.getStatus() != JobState.FAILURE) {
                    continue;
                }
                if (member.getStoragePath() == null) {
                    logger.warn("Member {} of batch {} has no stored upload and cannot be retried",
                            member.getJobUuid(), batchUuid);
                    continue;
                }
                resubmit(batch, member).ifPresent(resubmitted::add);
            }
            logger.info("Resubmitted {} failed member(s) of batch {}", resubmitted.size(), batchUuid);
            publishPending(resubmitted);
            return resubmitted.size();
        } finally {
            MDC.remove("batch_id");
        }
    }

    private Optional<ClassificationJob> resubmit(BatchJob batch, ClassificationJob member) {
        byte[] content;
        try {
            content = storageService.load(member.getStoragePath());
        } catch (IOException e) {
            logger.warn("Upload of member {} could not be read for retry: {}", member.getJobUuid(), e.getMessage());
            return Optional.empty();
        }
        UUID retryUuid = UUID.randomUUID();
        if (jobRepository.markRetried(member.getJobUuid(), JobState.FAILURE, retryUuid, Instant.now()) == 0) {
            logger.debug("Member {} was retried concurrently", member.getJobUuid());
            return Optional.empty();
        }
        DocumentSubmission submission = new DocumentSubmission(member.getFilename(), content, member.getIndustry());
        ClassificationJob retry = jobService.createMember(submission, batch.getBatchUuid(),
                member.getBatchPosition(), retryUuid);
        logger.info("Member {} of batch {} retried as job {} ({} previously)", member.getBatchPosition(),
                batch.getBatchUuid(), retryUuid, member.getErrorCode());
        deleteUpload(member);
        return Optional.of(retry);
    }

    private void publishPending(List<ClassificationJob> jobs) {
        for (ClassificationJob job : jobs) {
            if (job.getStatus() == JobState.PENDING) {
                jobService.publish(job.getJobUuid());
            }
        }
    }

    private List<ClassificationJob> currentMembers(UUID batchUuid) {
        return jobRepository.findByBatchUuidAndRetriedAsIsNullOrderByBatchPositionAsc(batchUuid);
    }

    private BatchJob findBatch(UUID batchUuid) {
        return batchRepository.findByBatchUuid(batchUuid)
                .orElseThrow(() -> new JobNotFoundException("Batch", batchUuid));
    }

    private void deleteUpload(ClassificationJob member) {
        try {
            storageService.delete(member.getStoragePath());
            jobRepository.clearStoragePath(member.getJobUuid());
        } catch (IOException e) {
            logger.warn("Upload of retried job {} could not be deleted: {}", member.getJobUuid(), e.getMessage());
        }
    }
}
