package com.docclassifier.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Outcome of classifying one document.
 * Created once per classification call and never modified; enhancement produces a copy.
 */
public final class ClassificationResult {

    public static final String UNKNOWN = "unknown";

    private final String documentType;
    private final String industry;
    private final double confidence;
    private final Map<String, Integer> matchedKeywords;
    private final Map<String, Object> metadata;
    private final Enhancement enhancement;

    @JsonCreator
    public ClassificationResult(@JsonProperty("document_type") String documentType,
                                @JsonProperty("industry") String industry,
                                @JsonProperty("confidence") double confidence,
                                @JsonProperty("matched_keywords") Map<String, Integer> matchedKeywords,
                                @JsonProperty("metadata") Map<String, Object> metadata,
                                @JsonProperty("enhancement") Enhancement enhancement) {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be within [0,1], got " + confidence);
        }
        this.documentType = Objects.requireNonNull(documentType, "documentType is required");
        this.industry = industry != null ? industry : UNKNOWN;
        this.confidence = confidence;
        this.matchedKeywords = matchedKeywords != null
                ? Collections.unmodifiableMap(new TreeMap<>(matchedKeywords))
                : Map.of();
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        this.enhancement = enhancement != null ? enhancement : Enhancement.none();
    }

    /**
     * Returns a copy carrying the given enhancement and additional metadata.
     * Confidence and classification fields are copied unchanged.
     */
    public ClassificationResult withEnhancement(Enhancement enhancement, Map<String, Object> extraMetadata) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        if (extraMetadata != null) {
            merged.putAll(extraMetadata);
        }
        return new ClassificationResult(documentType, industry, confidence, matchedKeywords, merged, enhancement);
    }

    @JsonProperty("document_type")
    public String getDocumentType() {
        return documentType;
    }

    @JsonProperty("industry")
    public String getIndustry() {
        return industry;
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("matched_keywords")
    public Map<String, Integer> getMatchedKeywords() {
        return matchedKeywords;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonProperty("enhancement")
    public Enhancement getEnhancement() {
        return enhancement;
    }

    @JsonIgnore
    public boolean isUnknown() {
        return UNKNOWN.equals(documentType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClassificationResult)) {
            return false;
        }
        ClassificationResult that = (ClassificationResult) o;
        return Double.compare(confidence, that.confidence) == 0
                && documentType.equals(that.documentType)
                && industry.equals(that.industry)
                && matchedKeywords.equals(that.matchedKeywords)
                && metadata.equals(that.metadata)
                && enhancement.equals(that.enhancement);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentType, industry, confidence, matchedKeywords, metadata, enhancement);
    }

    @Override
    public String toString() {
        return "ClassificationResult{documentType=" + documentType + ", industry=" + industry
                + ", confidence=" + confidence + "}";
    }
}
