package com.docclassifier.processing;

import com.docclassifier.processing.extraction.ExtractorRegistry;
import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.DocumentSubmission;
import com.docclassifier.processing.strategy.StrategyRegistry;
import com.docclassifier.shared.dto.BatchStatus;
import com.docclassifier.shared.dto.JobView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point to the classification core for transport adapters.
 */
@Service
public class DocumentClassificationFacade {

    private static final Logger logger = LoggerFactory.getLogger(DocumentClassificationFacade.class);

    private final ClassificationPipeline pipeline;
    private final ClassificationJobService jobService;
    private final BatchCoordinatorService batchCoordinator;
    private final ExtractorRegistry extractorRegistry;
    private final StrategyRegistry strategyRegistry;

    public DocumentClassificationFacade(ClassificationPipeline pipeline,
                                        ClassificationJobService jobService,
                                        BatchCoordinatorService batchCoordinator,
                                        ExtractorRegistry extractorRegistry,
                                        StrategyRegistry strategyRegistry) {
        this.pipeline = pipeline;
        this.jobService = jobService;
        this.batchCoordinator = batchCoordinator;
        this.extractorRegistry = extractorRegistry;
        this.strategyRegistry = strategyRegistry;
    }

    /**
     * Classifies in the caller's thread. Errors surface as
     * {@link com.docclassifier.shared.exception.ClassificationException} subtypes.
     */
    public ClassificationResult classifySync(DocumentSubmission submission) {
        logger.info("Synchronous classification of {} ({} bytes)", submission.getFilename(), submission.getSize());
        return pipeline.run(submission.getContent(), submission.getIndustry()).getResult();
    }

    public UUID classifyAsync(DocumentSubmission submission) {
        return jobService.submit(submission).getJobUuid();
    }

    public JobView getStatus(UUID jobId) {
        return jobService.status(jobId);
    }

    public UUID submitBatch(List<DocumentSubmission> submissions, String industry) {
        return batchCoordinator.submitBatch(submissions, industry).getBatchUuid();
    }

    public BatchStatus getBatchStatus(UUID batchId) {
        return batchCoordinator.status(batchId);
    }

    public int cancelBatch(UUID batchId) {
        return batchCoordinator.cancel(batchId);
    }

    /**
     * Resubmits the failed and cancelled members of a batch as new jobs.
     *
     * @return number of members resubmitted
     */
    public int retryBatch(UUID batchId) {
        return batchCoordinator.retry(batchId);
    }

    public Map<String, String> supportedMediaTypes() {
        return extractorRegistry.supportedMediaTypes();
    }

    public List<Map<String, Object>> industries() {
        return strategyRegistry.metadata();
    }
}
