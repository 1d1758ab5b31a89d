package datamigrator.history;

import datamigrator.engine.RunReport;

import java.time.Instant;

/**
 * One finished run in a {@link RunHistory}.
 *
 * @param runId the run identifier
 * @param timestamp when the run finished
 * @param scope the scope key of the run
 * @param success whether the run succeeded
 * @param report the full report
 */
public record RunHistoryEntry(long runId, Instant timestamp, String scope, boolean success, RunReport report) {

    public static RunHistoryEntry of(RunReport report) {
        return new RunHistoryEntry(report.runId(), Instant.now(), report.scope().key(),
                report.overallSuccess(), report);
    }
}
