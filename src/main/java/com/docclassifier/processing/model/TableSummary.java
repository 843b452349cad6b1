package com.docclassifier.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Shape and heuristic classification of one extracted table.
 */
public final class TableSummary {

    private final int rows;
    private final int columns;
    private final boolean headerRow;
    private final String kind;

    @JsonCreator
    public TableSummary(@JsonProperty("rows") int rows,
                        @JsonProperty("columns") int columns,
                        @JsonProperty("header_row") boolean headerRow,
                        @JsonProperty("kind") String kind) {
        this.rows = rows;
        this.columns = columns;
        this.headerRow = headerRow;
        this.kind = kind;
    }

    @JsonProperty("rows")
    public int getRows() {
        return rows;
    }

    @JsonProperty("columns")
    public int getColumns() {
        return columns;
    }

    @JsonProperty("header_row")
    public boolean isHeaderRow() {
        return headerRow;
    }

    /**
     * One of {@code financial}, {@code list}, {@code form} or {@code grid}.
     */
    @JsonProperty("kind")
    public String getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableSummary)) {
            return false;
        }
        TableSummary that = (TableSummary) o;
        return rows == that.rows && columns == that.columns
                && headerRow == that.headerRow && Objects.equals(kind, that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, columns, headerRow, kind);
    }
}
