package com.docclassifier.processing.model;

import java.util.Objects;

/**
 * A document handed to the core by the upload layer: its bytes, the name the caller gave it
 * and an optional industry hint. The filename is informational only; format detection never
 * looks at it.
 */
public final class DocumentSubmission {

    private final String filename;
    private final byte[] content;
    private final String industry;

    public DocumentSubmission(String filename, byte[] content, String industry) {
        Objects.requireNonNull(content, "content is required");
        this.filename = filename == null || filename.isBlank() ? "document" : filename;
        this.content = content.clone();
        this.industry = industry == null || industry.isBlank() ? null : industry.trim();
    }

    public static DocumentSubmission of(String filename, byte[] content) {
        return new DocumentSubmission(filename, content, null);
    }

    public String getFilename() {
        return filename;
    }

    /**
     * Returns a copy of the document bytes.
     */
    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }

    public String getIndustry() {
        return industry;
    }

    /**
     * Same document, with the given industry applied when this submission carries none.
     */
    public DocumentSubmission withDefaultIndustry(String defaultIndustry) {
        if (industry != null || defaultIndustry == null || defaultIndustry.isBlank()) {
            return this;
        }
        return new DocumentSubmission(filename, content, defaultIndustry);
    }
}
