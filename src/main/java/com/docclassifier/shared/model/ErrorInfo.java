package com.docclassifier.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Failure recorded on a job: the taxonomy code and a human readable message.
 */
public final class ErrorInfo {

    private final ErrorCode code;
    private final String message;

    @JsonCreator
    public ErrorInfo(@JsonProperty("code") ErrorCode code, @JsonProperty("message") String message) {
        this.code = Objects.requireNonNull(code, "code is required");
        this.message = message;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorInfo)) {
            return false;
        }
        ErrorInfo that = (ErrorInfo) o;
        return code == that.code && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
