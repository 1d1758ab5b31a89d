package datamigrator.phase;

import datamigrator.engine.RunContext;
import datamigrator.exceptions.CompileException;
import datamigrator.exceptions.MigrateException;
import datamigrator.mapping.FieldMappingCompiler;
import datamigrator.transfer.TransferListener;
import datamigrator.transfer.TransferResult;

/**
 * The work a phase does. One implementation exists per kind of phase, so new
 * kinds are added without touching the orchestrator.
 *
 * <p>The orchestrator calls, for one run:
 * <ol>
 *   <li>{@link #compile} for every phase, before any row is touched</li>
 *   <li>{@link #affectedRows} when the phase requires rollback, to snapshot them</li>
 *   <li>{@link #execute} to do the writes</li>
 * </ol>
 *
 * @see TransferPhaseHandler
 * @see PurgePhaseHandler
 */
public interface PhaseHandler {

    /**
     * Checks and compiles the handler's definitions for a run. Anything compiled
     * is kept in the run context, never in the handler.
     *
     * @throws CompileException if the definitions are invalid
     */
    default void compile(MigrationPhase phase, FieldMappingCompiler compiler, RunContext ctx)
            throws CompileException {
    }

    /**
     * Returns the rows {@link #execute} will write or delete.
     */
    AffectedRows affectedRows(MigrationPhase phase, RunContext ctx) throws MigrateException;

    /**
     * Does the phase's writes.
     *
     * @return what was written
     * @throws MigrateException if the work fails or is cancelled
     */
    TransferResult execute(MigrationPhase phase, RunContext ctx, TransferListener listener) throws MigrateException;
}
