package com.docclassifier.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural post-pass attached to a classification result.
 */
public final class Enhancement {

    private static final Enhancement NONE = new Enhancement(0, List.of(), Map.of());

    private final int tablesDetected;
    private final List<TableSummary> tableSummaries;
    private final Map<String, Object> formatFeatures;

    @JsonCreator
    public Enhancement(@JsonProperty("tables_detected") int tablesDetected,
                       @JsonProperty("table_summaries") List<TableSummary> tableSummaries,
                       @JsonProperty("format_features") Map<String, Object> formatFeatures) {
        this.tablesDetected = tablesDetected;
        this.tableSummaries = tableSummaries != null
                ? Collections.unmodifiableList(new ArrayList<>(tableSummaries))
                : List.of();
        this.formatFeatures = formatFeatures != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(formatFeatures))
                : Map.of();
    }

    public static Enhancement none() {
        return NONE;
    }

    @JsonProperty("tables_detected")
    public int getTablesDetected() {
        return tablesDetected;
    }

    @JsonProperty("table_summaries")
    public List<TableSummary> getTableSummaries() {
        return tableSummaries;
    }

    @JsonProperty("format_features")
    public Map<String, Object> getFormatFeatures() {
        return formatFeatures;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Enhancement)) {
            return false;
        }
        Enhancement that = (Enhancement) o;
        return tablesDetected == that.tablesDetected
                && tableSummaries.equals(that.tableSummaries)
                && formatFeatures.equals(that.formatFeatures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tablesDetected, tableSummaries, formatFeatures);
    }
}
