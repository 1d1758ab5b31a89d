package upgrade;

import datamigrator.engine.RunReport;
import datamigrator.metrics.ProgressReporter;
import datamigrator.phase.PhaseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes run progress to the {@code upgrade.progress} logger.
 */
public final class LoggingProgressReporter implements ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger("upgrade.progress");

    @Override
    public void phaseStateChanged(long runId, String phaseId, PhaseStatus from, PhaseStatus to) {
        log.info("[run {}] {}: {} -> {}", runId, phaseId, from, to);
    }

    @Override
    public void batchFlushed(long runId, String phaseId, int batchNumber, int rows) {
        log.debug("[run {}] {}: batch {} written ({} rows)", runId, phaseId, batchNumber, rows);
    }

    @Override
    public void runFinished(RunReport report) {
        log.info(report.summary());
    }
}
