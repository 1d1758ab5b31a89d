package datamigrator.phase;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PhaseStatus")
class PhaseStatusTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "PENDING, SKIPPED",
            "PENDING, VALIDATING",
            "VALIDATING, SNAPSHOTTING",
            "VALIDATING, TRANSFERRING",
            "SNAPSHOTTING, TRANSFERRING",
            "TRANSFERRING, POST_VALIDATING",
            "TRANSFERRING, ROLLING_BACK",
            "POST_VALIDATING, COMMITTED",
            "POST_VALIDATING, ROLLING_BACK",
            "ROLLING_BACK, FAILED"
    })
    @DisplayName("should allow the forward transitions")
    void shouldAllowTransition(PhaseStatus from, PhaseStatus to) {
        assertThat(from.canTransitionTo(to)).isTrue();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "PENDING, COMMITTED",
            "VALIDATING, COMMITTED",
            "TRANSFERRING, COMMITTED",
            "ROLLING_BACK, COMMITTED",
            "COMMITTED, ROLLING_BACK",
            "FAILED, PENDING",
            "SKIPPED, VALIDATING",
            "POST_VALIDATING, TRANSFERRING"
    })
    @DisplayName("should refuse other transitions")
    void shouldRefuseTransition(PhaseStatus from, PhaseStatus to) {
        assertThat(from.canTransitionTo(to)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = PhaseStatus.class, names = {"COMMITTED", "FAILED", "SKIPPED"})
    @DisplayName("should have no way out of a terminal state")
    void shouldStayInTerminalState(PhaseStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (PhaseStatus next : PhaseStatus.values()) {
            assertThat(terminal.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    @DisplayName("should satisfy dependencies only when committed or skipped")
    void shouldSatisfyDependencies() {
        assertThat(PhaseStatus.COMMITTED.isDone()).isTrue();
        assertThat(PhaseStatus.SKIPPED.isDone()).isTrue();
        assertThat(PhaseStatus.FAILED.isDone()).isFalse();
        assertThat(PhaseStatus.TRANSFERRING.isDone()).isFalse();
    }
}
