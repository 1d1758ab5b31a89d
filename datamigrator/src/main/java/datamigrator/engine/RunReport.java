package datamigrator.engine;

import datamigrator.ledger.TagScope;
import datamigrator.metrics.MigrationMetrics;
import datamigrator.phase.PhaseStatus;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Structured outcome of a run, returned to the caller of the orchestrator's
 * entry points.
 *
 * <p>Every phase of the plan appears in {@link #phasesRun()}, in execution
 * order; phases the run never reached are PENDING.
 *
 * @param runId the run identifier
 * @param scope the scope the run worked on
 * @param phasesRun one result per phase
 * @param overallSuccess true if every phase committed or was skipped
 * @param durationMs wall-clock duration of the run
 * @param restoreFailed true if a rollback failed; the store needs operator attention
 * @param cancelled true if the run was cancelled
 * @param errorMessage run-level failure such as a compile error, or null
 * @param metrics metrics collected during the run
 */
public record RunReport(long runId,
                        TagScope scope,
                        List<PhaseResult> phasesRun,
                        boolean overallSuccess,
                        long durationMs,
                        boolean restoreFailed,
                        boolean cancelled,
                        String errorMessage,
                        MigrationMetrics metrics) {

    public RunReport {
        phasesRun = List.copyOf(phasesRun);
    }

    public Optional<PhaseResult> phase(String phaseId) {
        return phasesRun.stream().filter(p -> p.phaseId().equals(phaseId)).findFirst();
    }

    public long rowsTransferred() {
        return phasesRun.stream().mapToLong(PhaseResult::rowsTransferred).sum();
    }

    public long count(PhaseStatus status) {
        return phasesRun.stream().filter(p -> p.status() == status).count();
    }

    /**
     * Returns the phases a cancelled or crashed run left mid-way, as
     * {@code phaseId@STATE}, comma separated; empty when there are none.
     */
    public String interrupted() {
        return phasesRun.stream()
                .filter(p -> p.status() != PhaseStatus.PENDING && !p.status().isTerminal())
                .map(p -> p.phaseId() + "@" + p.status())
                .collect(Collectors.joining(","));
    }

    public String summary() {
        return "Run #" + runId + " " + scope + ": " + (overallSuccess ? "SUCCESS" : "FAILED")
                + " in " + durationMs + "ms, committed=" + count(PhaseStatus.COMMITTED)
                + " skipped=" + count(PhaseStatus.SKIPPED)
                + " failed=" + count(PhaseStatus.FAILED)
                + " pending=" + count(PhaseStatus.PENDING)
                + (interrupted().isEmpty() ? "" : " interrupted=" + interrupted())
                + ", rows=" + rowsTransferred()
                + (cancelled ? ", cancelled" : "")
                + (restoreFailed ? ", RESTORE FAILED" : "")
                + (errorMessage != null ? ", error=" + errorMessage : "");
    }
}
