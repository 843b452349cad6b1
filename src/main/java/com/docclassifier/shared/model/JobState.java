package com.docclassifier.shared.model;

/**
 * Lifecycle of a classification job. Transitions only move forward:
 * PENDING -> RUNNING -> SUCCESS | FAILURE. A cancelled job moves from PENDING straight to FAILURE.
 */
public enum JobState {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}
