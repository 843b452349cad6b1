package com.docclassifier.processing.model;

/**
 * Document families the extraction layer knows how to normalize.
 */
public enum DocumentFormat {
    PDF,
    WORD,
    EXCEL,
    IMAGE
}
