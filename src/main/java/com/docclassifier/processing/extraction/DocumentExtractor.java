package com.docclassifier.processing.extraction;

import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;

import java.util.Set;

/**
 * Turns the raw bytes of one document family into {@link ExtractedContent}.
 * Implementations must not modify the input array and must fail with
 * {@link com.docclassifier.shared.exception.ExtractionFailedException} rather than return
 * empty content for corrupt, encrypted or empty input.
 */
public interface DocumentExtractor {

    /**
     * Media types this extractor handles, as reported by {@link MediaTypeDetector}.
     */
    Set<String> supportedMediaTypes();

    DocumentFormat format();

    ExtractedContent extract(byte[] content);

    default String name() {
        return getClass().getSimpleName();
    }
}
