package com.docclassifier.processing;

import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.processing.strategy.IndustryStrategy;
import com.docclassifier.processing.strategy.KeywordMatcher;
import com.docclassifier.processing.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rules-based classifier. Every candidate document type is scored by weighted keyword
 * occurrences, and the score is mapped to a confidence with {@code s / (s + k)}, which stays
 * strictly below 1. Results below the confidence floor are reported as {@code unknown}.
 * <p>
 * A pure function of the content and the registered strategies.
 */
@Service
public class DocumentClassifierService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentClassifierService.class);

    static final String METHOD = "keyword_matching";

    private final StrategyRegistry strategyRegistry;
    private final double saturationConstant;
    private final double minConfidence;

    public DocumentClassifierService(StrategyRegistry strategyRegistry,
                                     @Value("${app.classifier.saturation-constant:3.0}") double saturationConstant,
                                     @Value("${app.classifier.min-confidence:0.2}") double minConfidence) {
        if (!(saturationConstant > 0)) {
            throw new IllegalArgumentException("app.classifier.saturation-constant must be > 0, got " + saturationConstant);
        }
        // a floor of 0 would still report unknown for documents that match nothing
        if (!(minConfidence > 0) || minConfidence > 1) {
            throw new IllegalArgumentException("app.classifier.min-confidence must be within (0,1], got " + minConfidence);
        }
        this.strategyRegistry = strategyRegistry;
        this.saturationConstant = saturationConstant;
        this.minConfidence = minConfidence;
    }

    /**
     * Classifies extracted content.
     *
     * @param content  extracted document content
     * @param industry industry to restrict scoring to, or null to evaluate every registered one
     * @return the best scoring document type, or {@code unknown} below the confidence floor
     * @throws com.docclassifier.shared.exception.UnknownIndustryException if the industry is not registered
     */
    public ClassificationResult classify(ExtractedContent content, String industry) {
        List<IndustryStrategy> candidates = strategyRegistry.strategiesFor(industry);
        String text = content.getRawText();

        Map<String, Integer> matchedKeywords = new LinkedHashMap<>();
        List<String> evaluated = new ArrayList<>();
        String bestType = null;
        String bestIndustry = null;
        double bestScore = 0.0;

        for (IndustryStrategy strategy : candidates) {
            evaluated.add(strategy.industryName());
            for (String documentType : strategy.documentTypes()) {
                int hits = 0;
                for (String keyword : strategy.keywords().getOrDefault(documentType, Set.of())) {
                    hits += KeywordMatcher.count(text, keyword);
                }
                if (hits == 0) {
                    continue;
                }
                matchedKeywords.putIfAbsent(documentType, hits);
                double score = hits * strategy.weightFor(documentType);
                // strictly greater keeps the earliest candidate on ties
                if (score > bestScore) {
                    bestScore = score;
                    bestType = documentType;
                    bestIndustry = strategy.industryName();
                }
            }
        }

        double confidence = confidenceFor(bestScore);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("classification_method", METHOD);
        metadata.put("raw_score", bestScore);
        metadata.put("strategies_evaluated", evaluated);

        if (bestType == null || confidence < minConfidence) {
            String reportedIndustry = industry == null || industry.isBlank() ? ClassificationResult.UNKNOWN : industry;
            logger.info("Classification below floor: confidence={} floor={} industry={}",
                    confidence, minConfidence, reportedIndustry);
            return new ClassificationResult(ClassificationResult.UNKNOWN, reportedIndustry, confidence,
                    matchedKeywords, metadata, null);
        }

        logger.info("Classified as {}/{} with confidence {}", bestIndustry, bestType, confidence);
        return new ClassificationResult(bestType, bestIndustry, confidence, matchedKeywords, metadata, null);
    }

    double confidenceFor(double score) {
        if (score <= 0) {
            return 0.0;
        }
        return score / (score + saturationConstant);
    }

    public double getMinConfidence() {
        return minConfidence;
    }
}
