package com.docclassifier.shared.model;

/**
 * Structured reason attached to a failed job or surfaced to a synchronous caller.
 */
public enum ErrorCode {
    /** No extractor handles the sniffed media type. Not retried. */
    UNSUPPORTED_FORMAT,
    /** Corrupt, encrypted, empty or undecodable content. Not retried. */
    EXTRACTION_FAILED,
    /** Caller asked for an industry nobody registered. Rejected before enqueueing. */
    UNKNOWN_INDUSTRY,
    /** Unexpected failure while scoring. */
    CLASSIFIER_ERROR,
    /** Storage or job store unavailable after the dispatch-level retries ran out. */
    INFRASTRUCTURE,
    /** Worker lease expired without the job reaching a terminal state. */
    WORKER_TIMEOUT,
    /** Pending member of a cancelled batch. */
    CANCELLED
}
