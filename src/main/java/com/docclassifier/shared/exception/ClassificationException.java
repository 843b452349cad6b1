package com.docclassifier.shared.exception;

import com.docclassifier.shared.model.ErrorCode;

/**
 * Root of the classification error taxonomy. Every subtype carries the {@link ErrorCode}
 * recorded against a failed job.
 */
public abstract class ClassificationException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ClassificationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ClassificationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
