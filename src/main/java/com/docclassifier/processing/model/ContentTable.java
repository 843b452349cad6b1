package com.docclassifier.processing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A table lifted out of a document: ordered rows of cell strings.
 * Rows may be ragged; {@link #getColumnCount()} reports the widest row.
 */
public final class ContentTable {

    private final List<List<String>> rows;

    public ContentTable(List<List<String>> rows) {
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    for (String cell : row) {
                        cells.add(cell != null ? cell : "");
                    }
                }
                copy.add(Collections.unmodifiableList(cells));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        int max = 0;
        for (List<String> row : rows) {
            max = Math.max(max, row.size());
        }
        return max;
    }

    /**
     * Returns the first row, or an empty list for an empty table.
     */
    public List<String> getFirstRow() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContentTable)) {
            return false;
        }
        return rows.equals(((ContentTable) o).rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows);
    }
}
