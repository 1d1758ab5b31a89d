package datamigrator.metrics;

import datamigrator.engine.RunReport;
import datamigrator.phase.PhaseStatus;

/**
 * {@link ProgressReporter} that ignores every event. Used when no reporter is configured.
 */
public enum NoopProgressReporter implements ProgressReporter {
    INSTANCE;

    @Override
    public void phaseStateChanged(long runId, String phaseId, PhaseStatus from, PhaseStatus to) {
        // no-op
    }

    @Override
    public void batchFlushed(long runId, String phaseId, int batchNumber, int rows) {
        // no-op
    }

    @Override
    public void runFinished(RunReport report) {
        // no-op
    }
}
