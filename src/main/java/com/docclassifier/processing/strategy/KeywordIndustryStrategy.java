package com.docclassifier.processing.strategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base for strategies declared as an ordered table of document type to keywords.
 */
public abstract class KeywordIndustryStrategy implements IndustryStrategy {

    private final String industryName;
    private final List<String> documentTypes;
    private final Map<String, Set<String>> keywords;
    private final Map<String, Double> scoringWeights;

    protected KeywordIndustryStrategy(String industryName,
                                      Map<String, List<String>> keywordTable,
                                      Map<String, Double> scoringWeights) {
        if (industryName == null || industryName.isBlank()) {
            throw new IllegalArgumentException("industryName is required");
        }
        if (keywordTable == null || keywordTable.isEmpty()) {
            throw new IllegalArgumentException("Strategy " + industryName + " declares no document types");
        }
        this.industryName = industryName;

        Map<String, Set<String>> table = new LinkedHashMap<>();
        keywordTable.forEach((type, words) ->
                table.put(type, Collections.unmodifiableSet(new LinkedHashSet<>(words))));
        this.keywords = Collections.unmodifiableMap(table);
        this.documentTypes = Collections.unmodifiableList(new ArrayList<>(table.keySet()));
        this.scoringWeights = scoringWeights == null ? Map.of() : Map.copyOf(scoringWeights);
    }

    /**
     * Ordered keyword table builder; insertion order is the declared document type order.
     */
    protected static Map<String, List<String>> table() {
        return new LinkedHashMap<>();
    }

    @Override
    public String industryName() {
        return industryName;
    }

    @Override
    public List<String> documentTypes() {
        return documentTypes;
    }

    @Override
    public Map<String, Set<String>> keywords() {
        return keywords;
    }

    @Override
    public Map<String, Double> scoringWeights() {
        return scoringWeights;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{industry=" + industryName + ", types=" + documentTypes + "}";
    }
}
