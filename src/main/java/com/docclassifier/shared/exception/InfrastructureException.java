package com.docclassifier.shared.exception;

import com.docclassifier.shared.model.ErrorCode;

/**
 * Storage or job store failure unrelated to the document itself.
 */
public class InfrastructureException extends ClassificationException {

    public InfrastructureException(String message, Throwable cause) {
        super(ErrorCode.INFRASTRUCTURE, message, cause);
    }
}
