package datamigrator.metrics;

import datamigrator.engine.RunReport;
import datamigrator.phase.PhaseStatus;

/**
 * Observer for run progress, typically forwarded to a telemetry sink or a
 * console progress bar.
 *
 * <p>All callbacks of a run are made synchronously on the thread driving that
 * run, never on a flush worker. A reporter shared by runs of several scopes at
 * once must be thread-safe. Implementations should be fast.
 * Exceptions thrown by a reporter are logged and ignored.
 *
 * @see NoopProgressReporter
 */
public interface ProgressReporter {

    /**
     * Called on every phase state transition.
     */
    void phaseStateChanged(long runId, String phaseId, PhaseStatus from, PhaseStatus to);

    /**
     * Called after a batch of a transfer was written.
     *
     * @param batchNumber the 1-based batch number within the phase
     * @param rows the number of rows in the batch
     */
    void batchFlushed(long runId, String phaseId, int batchNumber, int rows);

    /**
     * Called once the run has finished, successfully or not.
     */
    void runFinished(RunReport report);
}
