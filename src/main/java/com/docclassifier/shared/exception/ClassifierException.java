package com.docclassifier.shared.exception;

import com.docclassifier.shared.model.ErrorCode;

/**
 * Unexpected internal failure while scoring a document.
 */
public class ClassifierException extends ClassificationException {

    public ClassifierException(String message, Throwable cause) {
        super(ErrorCode.CLASSIFIER_ERROR, message, cause);
    }
}
