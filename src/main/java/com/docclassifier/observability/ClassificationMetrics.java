package com.docclassifier.observability;

import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.JobState;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import com.docclassifier.util.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Custom Micrometer meters.
 *
 * Metrics:
 * - docclassifier.documents.classified: counter tagged with industry, document_type and format
 * - docclassifier.classification.confidence: distribution of confidence scores
 * - docclassifier.pipeline.duration: timer for extract, classify and enhance
 * - docclassifier.pipeline.failure: counter tagged with error_code
 * - docclassifier.job.outcome: counter tagged with status and error_code
 * - docclassifier.job.backlog: gauge of PENDING jobs
 */
@Service
public class ClassificationMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationMetrics.class);

    private final MeterRegistry meterRegistry;
    private final ObjectProvider<ClassificationJobRepository> jobRepository;

    private DistributionSummary confidenceSummary;

    public ClassificationMetrics(MeterRegistry meterRegistry,
                                 ObjectProvider<ClassificationJobRepository> jobRepository) {
        this.meterRegistry = meterRegistry;
        this.jobRepository = jobRepository;
    }

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("docclassifier.job.backlog", this, ClassificationMetrics::pendingBacklog)
                .description("Number of PENDING classification jobs")
                .register(meterRegistry);

        confidenceSummary = DistributionSummary.builder("docclassifier.classification.confidence")
                .description("Confidence of classification results")
                .maximumExpectedValue(1.0)
                .register(meterRegistry);

        logger.info("Classification metrics initialized");
    }

    private double pendingBacklog() {
        ClassificationJobRepository repository = jobRepository.getIfAvailable();
        if (repository == null) {
            return 0.0;
        }
        try {
            return repository.countByStatus(JobState.PENDING);
        } catch (RuntimeException e) {
            logger.warn("Failed to read job backlog: {}", e.getMessage());
            return 0.0;
        }
    }

    public void recordClassification(ClassificationResult result, String format, Duration duration) {
        Counter.builder("docclassifier.documents.classified")
                .tag("industry", Strings.tagValue(result.getIndustry()))
                .tag("document_type", Strings.tagValue(result.getDocumentType()))
                .tag("format", Strings.tagValue(format))
                .register(meterRegistry)
                .increment();
        confidenceSummary.record(result.getConfidence());
        Timer.builder("docclassifier.pipeline.duration")
                .description("Extract, classify and enhance duration")
                .tag("format", Strings.tagValue(format))
                .register(meterRegistry)
                .record(duration);
    }

    public void recordPipelineFailure(ErrorCode errorCode) {
        Counter.builder("docclassifier.pipeline.failure")
                .tag("error_code", errorCode.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordJobOutcome(JobState status, ErrorCode errorCode) {
        Counter.builder("docclassifier.job.outcome")
                .tag("status", status.name())
                .tag("error_code", errorCode != null ? errorCode.name() : "none")
                .register(meterRegistry)
                .increment();
    }
}
