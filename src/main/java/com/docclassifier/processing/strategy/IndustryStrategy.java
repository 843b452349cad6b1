package com.docclassifier.processing.strategy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword vocabulary for one industry. Implementations are immutable and registered once at
 * startup through {@link StrategyRegistry}.
 */
public interface IndustryStrategy {

    /**
     * Unique registry key, e.g. {@code financial}.
     */
    String industryName();

    /**
     * Document types in declaration order; earlier types win score ties.
     */
    List<String> documentTypes();

    Map<String, Set<String>> keywords();

    /**
     * Multipliers applied to a document type's raw keyword score. Absent entries weigh 1.0.
     */
    Map<String, Double> scoringWeights();

    default double weightFor(String documentType) {
        return scoringWeights().getOrDefault(documentType, 1.0);
    }

    default Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("industry", industryName());
        metadata.put("supported_types", documentTypes());
        metadata.put("keyword_count", keywords().values().stream().mapToInt(Set::size).sum());
        return metadata;
    }
}
