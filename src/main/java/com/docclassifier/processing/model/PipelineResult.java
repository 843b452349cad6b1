package com.docclassifier.processing.model;

/**
 * Output of one pipeline run: the enhanced classification, the content it was computed from
 * and the sniffed media type.
 */
public final class PipelineResult {

    private final String mediaType;
    private final ExtractedContent content;
    private final ClassificationResult result;

    public PipelineResult(String mediaType, ExtractedContent content, ClassificationResult result) {
        this.mediaType = mediaType;
        this.content = content;
        this.result = result;
    }

    public String getMediaType() {
        return mediaType;
    }

    public ExtractedContent getContent() {
        return content;
    }

    public ClassificationResult getResult() {
        return result;
    }
}
