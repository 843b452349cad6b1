package com.docclassifier.shared.exception;

import com.docclassifier.shared.model.ErrorCode;

public class ExtractionFailedException extends ClassificationException {

    private final String reason;

    public ExtractionFailedException(String reason) {
        super(ErrorCode.EXTRACTION_FAILED, "Extraction failed: " + reason);
        this.reason = reason;
    }

    public ExtractionFailedException(String reason, Throwable cause) {
        super(ErrorCode.EXTRACTION_FAILED, "Extraction failed: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
