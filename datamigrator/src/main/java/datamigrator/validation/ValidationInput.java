package datamigrator.validation;

import datamigrator.engine.RunContext;
import datamigrator.phase.MigrationPhase;
import datamigrator.store.RecordStore;
import datamigrator.transfer.TransferResult;

import java.util.Objects;
import java.util.Optional;

/**
 * What a {@link ValidationCheck} can look at.
 *
 * @param phase the phase being validated
 * @param context the run context
 * @param transferResult the transfer outcome; null for pre-validation
 */
public record ValidationInput(MigrationPhase phase, RunContext context, TransferResult transferResult) {

    public ValidationInput {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(context, "context");
    }

    /** Shortcut for {@code context().store()}. */
    public RecordStore store() {
        return context.store();
    }

    public Optional<TransferResult> result() {
        return Optional.ofNullable(transferResult);
    }
}
