package com.docclassifier.processing;

import com.docclassifier.observability.ClassificationMetrics;
import com.docclassifier.observability.TracingService;
import com.docclassifier.processing.extraction.DocumentExtractor;
import com.docclassifier.processing.extraction.ExtractorRegistry;
import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.processing.model.PipelineResult;
import com.docclassifier.processing.strategy.StrategyRegistry;
import com.docclassifier.shared.exception.ClassificationException;
import com.docclassifier.shared.exception.ClassifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * extract -> classify -> enhance. Shared by synchronous requests and job workers.
 */
@Service
public class ClassificationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationPipeline.class);

    private final ExtractorRegistry extractorRegistry;
    private final StrategyRegistry strategyRegistry;
    private final DocumentClassifierService classifierService;
    private final ResultEnhancementService enhancementService;
    private final TracingService tracingService;
    private final ClassificationMetrics metrics;

    public ClassificationPipeline(ExtractorRegistry extractorRegistry,
                                  StrategyRegistry strategyRegistry,
                                  DocumentClassifierService classifierService,
                                  ResultEnhancementService enhancementService,
                                  TracingService tracingService,
                                  ClassificationMetrics metrics) {
        this.extractorRegistry = extractorRegistry;
        this.strategyRegistry = strategyRegistry;
        this.classifierService = classifierService;
        this.enhancementService = enhancementService;
        this.tracingService = tracingService;
        this.metrics = metrics;
    }

    /**
     * Runs the full pipeline over a document.
     *
     * @param content  document bytes; never modified
     * @param industry requested industry or null
     * @throws ClassificationException for unsupported formats, extraction failures,
     *                                 unknown industries and classifier errors
     */
    public PipelineResult run(byte[] content, String industry) {
        long start = System.nanoTime();
        try {
            strategyRegistry.validate(industry);

            String mediaType = extractorRegistry.detectMediaType(content);
            DocumentExtractor extractor = extractorRegistry.resolveMediaType(mediaType);
            ExtractedContent extracted = tracingService.trace("document.extract",
                    Map.of("media_type", mediaType, "extractor", extractor.name()),
                    () -> extractor.extract(content));

            ClassificationResult classified = tracingService.trace("document.classify",
                    Map.of("industry", industry != null ? industry : "any"),
                    () -> classify(extracted, industry));

            ClassificationResult enhanced = tracingService.trace("document.enhance",
                    () -> enhancementService.enhance(extracted, classified));

            metrics.recordClassification(enhanced, extracted.getFormat().name(),
                    Duration.ofNanos(System.nanoTime() - start));
            logger.info("Pipeline finished: format={} type={} confidence={}",
                    extracted.getFormat(), enhanced.getDocumentType(), enhanced.getConfidence());
            return new PipelineResult(mediaType, extracted, enhanced);
        } catch (ClassificationException e) {
            metrics.recordPipelineFailure(e.getErrorCode());
            throw e;
        }
    }

    private ClassificationResult classify(ExtractedContent extracted, String industry) {
        try {
            return classifierService.classify(extracted, industry);
        } catch (ClassificationException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Classifier failed unexpectedly", e);
            throw new ClassifierException("Classifier failed: " + e.getMessage(), e);
        }
    }
}
