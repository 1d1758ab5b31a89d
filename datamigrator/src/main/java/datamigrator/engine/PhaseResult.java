package datamigrator.engine;

import datamigrator.phase.PhaseStatus;
import datamigrator.transfer.RowError;
import datamigrator.validation.ValidationFailure;

import java.util.List;

/**
 * Outcome of one phase in a run.
 *
 * @param phaseId the phase
 * @param status the state the phase ended in; PENDING if it never started
 * @param rowsTransferred rows written by the phase (before any rollback)
 * @param rowErrors rows skipped because of row errors
 * @param validationFailures failed validation rules, warnings included
 * @param errorMessage why the phase failed or stopped, or null
 * @param durationMs time spent in the phase
 * @param restoreFailed true if the phase failed and its rollback failed too
 */
public record PhaseResult(String phaseId,
                          PhaseStatus status,
                          long rowsTransferred,
                          List<RowError> rowErrors,
                          List<ValidationFailure> validationFailures,
                          String errorMessage,
                          long durationMs,
                          boolean restoreFailed) {

    public PhaseResult {
        rowErrors = List.copyOf(rowErrors);
        validationFailures = List.copyOf(validationFailures);
    }

    public static PhaseResult pending(String phaseId) {
        return new PhaseResult(phaseId, PhaseStatus.PENDING, 0, List.of(), List.of(), null, 0, false);
    }

    public int rowErrorCount() {
        return rowErrors.size();
    }

    public boolean failed() {
        return status == PhaseStatus.FAILED;
    }
}
