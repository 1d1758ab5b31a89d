package datamigrator.phase;

import datamigrator.exceptions.MigrateException;

/**
 * Callbacks around each phase, registered on the orchestrator and invoked
 * synchronously in registration order.
 *
 * <p>Typical uses are quiescing application writes to the migrated tables
 * before a phase and resuming them afterwards.
 *
 * <h2>Usage:</h2>
 * <pre>
 * orchestrator.addListener(new PhaseListener() {
 *     public void beforePhase(PhaseEvent event) {
 *         writeGate.close(event.phase().id());
 *     }
 *     public void afterPhase(PhaseEvent event) {
 *         writeGate.open(event.phase().id());
 *     }
 * });
 * </pre>
 */
public interface PhaseListener {

    /**
     * Called before a phase does any work, skipped phases excluded.
     *
     * <p>Throwing refuses the phase: it ends FAILED without touching any row.
     *
     * @throws MigrateException if the phase must not run
     */
    void beforePhase(PhaseEvent event) throws MigrateException;

    /**
     * Called after a phase reached its final state, including when it failed.
     * Exceptions are logged and otherwise ignored.
     */
    void afterPhase(PhaseEvent event) throws MigrateException;
}
