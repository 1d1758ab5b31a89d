package datamigrator.alert;

import datamigrator.config.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for migration events.
 *
 * <p>Entries start with an event marker such as RUN_STARTED, PHASE_COMMITTED or
 * ROLLBACK_TRIGGERED, followed by key=value pairs, so log aggregators can parse
 * and alert on them. All entries go to the {@code migration} logger.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 * Failed restores are logged at every level.
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED run=3 scope=tenant:acme phases=2
 * 12:00:00.010 INFO  migration - PHASE_STARTED run=3 phase=copy-grades
 * 12:00:01.200 INFO  migration - PHASE_COMMITTED run=3 phase=copy-grades tag=50100-CustomerGrade-20250120 rows=12000 duration_ms=1190
 * 12:00:01.300 INFO  migration - RUN_COMPLETED run=3 scope=tenant:acme success=true duration_ms=1300
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void runStarted(long runId, String scope, int phaseCount) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED run={} scope={} phases={}", runId, scope, phaseCount);
        }
    }

    public static void phaseStarted(long runId, String phaseId) {
        if (shouldLogInfo()) {
            log.info("PHASE_STARTED run={} phase={}", runId, phaseId);
        }
    }

    /**
     * Log when a phase is skipped because its tag is already in the ledger.
     */
    public static void phaseSkipped(long runId, String phaseId, String tagId) {
        if (shouldLogInfo()) {
            log.info("PHASE_SKIPPED run={} phase={} tag={}", runId, phaseId, tagId);
        }
    }

    public static void phaseCommitted(long runId, String phaseId, String tagId, long rows, long durationMs) {
        if (shouldLogInfo()) {
            log.info("PHASE_COMMITTED run={} phase={} tag={} rows={} duration_ms={}",
                    runId, phaseId, tagId, rows, durationMs);
        }
    }

    /**
     * Log a warning-severity validation failure. The phase continues.
     */
    public static void validationWarning(long runId, String phaseId, String rule, String message) {
        if (shouldLogWarn()) {
            log.warn("VALIDATION_WARNING run={} phase={} rule={} message=\"{}\"", runId, phaseId, rule, message);
        }
    }

    /**
     * Log when a phase ends FAILED.
     *
     * @param runId the run identifier
     * @param phaseId the failed phase
     * @param stage the state the phase was in when it failed
     * @param reason the failure message
     */
    public static void phaseFailed(long runId, String phaseId, String stage, String reason) {
        log.error("PHASE_FAILED run={} phase={} stage={} error=\"{}\"", runId, phaseId, stage, reason);
    }

    public static void rollbackTriggered(long runId, String phaseId, String reason) {
        if (shouldLogWarn()) {
            log.warn("ROLLBACK_TRIGGERED run={} phase={} reason=\"{}\"", runId, phaseId, reason);
        }
    }

    /**
     * Log when a rollback completes.
     *
     * @param runId the run identifier, or 0 for operator-initiated rollbacks
     * @param phaseId the rolled back phase
     * @param rowsRestored the number of captured rows replayed
     * @param success whether the restore succeeded
     */
    public static void rollbackCompleted(long runId, String phaseId, int rowsRestored, boolean success) {
        if (success) {
            if (shouldLogWarn()) {
                log.warn("ROLLBACK_COMPLETED run={} phase={} rows={} status=SUCCESS", runId, phaseId, rowsRestored);
            }
        } else {
            // Always log errors
            log.error("ROLLBACK_COMPLETED run={} phase={} status=FAILED", runId, phaseId);
        }
    }

    public static void runCancelled(long runId, String scope, String phaseId) {
        if (shouldLogWarn()) {
            log.warn("RUN_CANCELLED run={} scope={} phase={}", runId, scope, phaseId);
        }
    }

    public static void runCompleted(long runId, String scope, long durationMs, long rowsTransferred) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED run={} scope={} success=true duration_ms={} rows={}",
                    runId, scope, durationMs, rowsTransferred);
        }
    }

    public static void runFailed(long runId, String scope, String reason, long durationMs) {
        log.error("RUN_FAILED run={} scope={} duration_ms={} error=\"{}\"", runId, scope, durationMs, reason);
    }
}
