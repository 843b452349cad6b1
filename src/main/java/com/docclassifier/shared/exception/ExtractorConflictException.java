package com.docclassifier.shared.exception;

/**
 * Two extractors claim the same media type. Raised while wiring the registry at startup.
 */
public class ExtractorConflictException extends RuntimeException {

    public ExtractorConflictException(String mediaType, String existing, String incoming) {
        super(String.format("Media type %s is already handled by %s, cannot register %s",
                mediaType, existing, incoming));
    }
}
