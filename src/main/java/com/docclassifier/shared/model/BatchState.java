package com.docclassifier.shared.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Aggregate state of a batch. Never stored; always derived from the member job states.
 */
public enum BatchState {
    PENDING,
    RUNNING,
    PARTIAL,
    SUCCESS,
    FAILURE;

    /**
     * Derives the batch state from its members.
     * <ul>
     *     <li>all PENDING: PENDING</li>
     *     <li>all SUCCESS: SUCCESS</li>
     *     <li>all FAILURE: FAILURE</li>
     *     <li>any RUNNING, or PENDING mixed with anything else: RUNNING</li>
     *     <li>every member terminal with both outcomes present: PARTIAL</li>
     * </ul>
     * An empty batch is PENDING.
     */
    public static BatchState derive(Collection<JobState> members) {
        if (members.isEmpty()) {
            return PENDING;
        }
        Set<JobState> present = EnumSet.copyOf(members);
        if (present.size() == 1) {
            switch (present.iterator().next()) {
                case PENDING:
                    return PENDING;
                case SUCCESS:
                    return SUCCESS;
                case FAILURE:
                    return FAILURE;
                default:
                    return RUNNING;
            }
        }
        if (present.contains(JobState.RUNNING) || present.contains(JobState.PENDING)) {
            return RUNNING;
        }
        return PARTIAL;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == PARTIAL;
    }
}
