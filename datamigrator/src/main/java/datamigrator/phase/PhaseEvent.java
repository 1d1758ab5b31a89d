package datamigrator.phase;

import datamigrator.engine.PhaseResult;
import datamigrator.engine.RunContext;

/**
 * What {@link PhaseListener}s receive.
 *
 * @param context the run context; listeners may cancel the run through it
 * @param phase the phase
 * @param status the phase status when the event fired
 * @param result the phase result; null before the phase ran
 */
public record PhaseEvent(RunContext context, MigrationPhase phase, PhaseStatus status, PhaseResult result) {

    public long runId() {
        return context.runId();
    }
}
