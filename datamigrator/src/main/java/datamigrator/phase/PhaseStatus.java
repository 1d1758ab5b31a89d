package datamigrator.phase;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a phase within a run.
 *
 * <pre>
 * PENDING -&gt; VALIDATING -&gt; SNAPSHOTTING -&gt; TRANSFERRING -&gt; POST_VALIDATING -&gt; COMMITTED
 *    |            |              |               |                  |
 *    |            |              |               +--&gt; ROLLING_BACK &lt;-+
 *    |            |              |                        |
 *    +--&gt; SKIPPED +--&gt; FAILED &lt;--+------------------------+
 * </pre>
 *
 * <p>SNAPSHOTTING is passed over by phases that do not require rollback.
 * COMMITTED, FAILED and SKIPPED are terminal.
 */
public enum PhaseStatus {

    PENDING,
    VALIDATING,
    SNAPSHOTTING,
    TRANSFERRING,
    POST_VALIDATING,
    ROLLING_BACK,
    COMMITTED,
    FAILED,
    SKIPPED;

    private Set<PhaseStatus> successors() {
        switch (this) {
            case PENDING:
                return EnumSet.of(SKIPPED, VALIDATING, FAILED);
            case VALIDATING:
                return EnumSet.of(SNAPSHOTTING, TRANSFERRING, FAILED);
            case SNAPSHOTTING:
                return EnumSet.of(TRANSFERRING, FAILED);
            case TRANSFERRING:
                return EnumSet.of(POST_VALIDATING, ROLLING_BACK, FAILED);
            case POST_VALIDATING:
                return EnumSet.of(COMMITTED, ROLLING_BACK, FAILED);
            case ROLLING_BACK:
                return EnumSet.of(FAILED);
            default:
                return EnumSet.noneOf(PhaseStatus.class);
        }
    }

    /** Returns true if a phase in this state may move to {@code next}. */
    public boolean canTransitionTo(PhaseStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED || this == SKIPPED;
    }

    /** Returns true for the terminal states that satisfy a dependency. */
    public boolean isDone() {
        return this == COMMITTED || this == SKIPPED;
    }
}
