package com.docclassifier.processing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized content produced by an extractor, whatever the source format.
 * Immutable once built; owned by the classification call that produced it.
 */
public final class ExtractedContent {

    private final String rawText;
    private final List<ContentTable> tables;
    private final Set<String> headers;
    private final Set<String> footers;
    private final DocumentFormat format;
    private final Integer pageCount;
    private final String mediaType;
    private final Map<String, Object> properties;

    private ExtractedContent(Builder builder) {
        this.rawText = builder.rawText != null ? builder.rawText : "";
        this.tables = Collections.unmodifiableList(new ArrayList<>(builder.tables));
        this.headers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.headers));
        this.footers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.footers));
        this.format = Objects.requireNonNull(builder.format, "format is required");
        this.pageCount = builder.pageCount;
        this.mediaType = builder.mediaType;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    public static Builder builder(DocumentFormat format) {
        return new Builder(format);
    }

    public String getRawText() {
        return rawText;
    }

    public List<ContentTable> getTables() {
        return tables;
    }

    public Set<String> getHeaders() {
        return headers;
    }

    public Set<String> getFooters() {
        return footers;
    }

    public DocumentFormat getFormat() {
        return format;
    }

    public Integer getPageCount() {
        return pageCount;
    }

    public String getMediaType() {
        return mediaType;
    }

    /**
     * Format-specific facts reported by the extractor (author, embedded image count,
     * merged cell count and so on). Keys are snake_case.
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    public Object getProperty(String key) {
        return properties.get(key);
    }

    public static final class Builder {
        private final DocumentFormat format;
        private String rawText;
        private final List<ContentTable> tables = new ArrayList<>();
        private final Set<String> headers = new LinkedHashSet<>();
        private final Set<String> footers = new LinkedHashSet<>();
        private Integer pageCount;
        private String mediaType;
        private final Map<String, Object> properties = new LinkedHashMap<>();

        private Builder(DocumentFormat format) {
            this.format = format;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder addTable(ContentTable table) {
            if (table != null && table.getRowCount() > 0) {
                this.tables.add(table);
            }
            return this;
        }

        public Builder addHeader(String header) {
            if (header != null && !header.isBlank()) {
                this.headers.add(header.trim());
            }
            return this;
        }

        public Builder addFooter(String footer) {
            if (footer != null && !footer.isBlank()) {
                this.footers.add(footer.trim());
            }
            return this;
        }

        public Builder pageCount(Integer pageCount) {
            this.pageCount = pageCount;
            return this;
        }

        public Builder mediaType(String mediaType) {
            this.mediaType = mediaType;
            return this;
        }

        public Builder property(String key, Object value) {
            if (value != null) {
                this.properties.put(key, value);
            }
            return this;
        }

        public ExtractedContent build() {
            return new ExtractedContent(this);
        }
    }
}
