package com.docclassifier.shared.exception;

import com.docclassifier.shared.model.ErrorCode;

public class UnsupportedFormatException extends ClassificationException {

    private final String mediaType;

    public UnsupportedFormatException(String mediaType) {
        super(ErrorCode.UNSUPPORTED_FORMAT, "No extractor registered for media type: " + mediaType);
        this.mediaType = mediaType;
    }

    public String getMediaType() {
        return mediaType;
    }
}
