/* (C)2026 */
package com.ammann.conversion.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JobStatus")
class JobStatusTest {

    @Test
    @DisplayName("should allow only forward transitions")
    void shouldAllowOnlyForwardTransitions() {
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.RUNNING)).isTrue();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.COMPLETED)).isFalse();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.QUEUED)).isFalse();

        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.QUEUED)).isFalse();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.RUNNING)).isFalse();
    }

    @Test
    @DisplayName("should not leave terminal statuses")
    void shouldNotLeaveTerminalStatuses() {
        for (JobStatus terminal : new JobStatus[] {JobStatus.COMPLETED, JobStatus.FAILED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (JobStatus next : JobStatus.values()) {
                assertThat(terminal.canTransitionTo(next)).isFalse();
            }
        }
    }

    @Test
    @DisplayName("should never allow a move to a lower rank")
    void shouldNeverMoveToLowerRank() {
        for (JobStatus from : JobStatus.values()) {
            for (JobStatus to : JobStatus.values()) {
                if (from.canTransitionTo(to)) {
                    assertThat(to.rank()).isGreaterThan(from.rank());
                }
            }
        }
    }

    @Test
    @DisplayName("should expose lowercase wire names")
    void shouldExposeWireNames() {
        assertThat(JobStatus.QUEUED.wireName()).isEqualTo("queued");
        assertThat(EventKind.forStatus(JobStatus.COMPLETED).wireName()).isEqualTo("job_completed");
        assertThat(FailureKind.MALFORMED_INPUT.wireName()).isEqualTo("malformed_input");
    }
}
