package com.docclassifier.shared.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchStateTest {

    @Test
    void derivesUniformStates() {
        assertThat(BatchState.derive(List.of())).isEqualTo(BatchState.PENDING);
        assertThat(BatchState.derive(List.of(JobState.PENDING, JobState.PENDING))).isEqualTo(BatchState.PENDING);
        assertThat(BatchState.derive(List.of(JobState.SUCCESS, JobState.SUCCESS))).isEqualTo(BatchState.SUCCESS);
        assertThat(BatchState.derive(List.of(JobState.FAILURE))).isEqualTo(BatchState.FAILURE);
        assertThat(BatchState.derive(List.of(JobState.RUNNING))).isEqualTo(BatchState.RUNNING);
    }

    @Test
    void unfinishedMembersKeepBatchRunning() {
        assertThat(BatchState.derive(List.of(JobState.PENDING, JobState.SUCCESS))).isEqualTo(BatchState.RUNNING);
        assertThat(BatchState.derive(List.of(JobState.RUNNING, JobState.FAILURE))).isEqualTo(BatchState.RUNNING);
    }

    @Test
    void mixedTerminalOutcomesArePartial() {
        BatchState state = BatchState.derive(List.of(
                JobState.SUCCESS, JobState.SUCCESS, JobState.FAILURE, JobState.SUCCESS, JobState.SUCCESS));

        assertThat(state).isEqualTo(BatchState.PARTIAL);
        assertThat(state.isTerminal()).isTrue();
        assertThat(BatchState.RUNNING.isTerminal()).isFalse();
    }
}
