package datamigrator.exceptions;

import datamigrator.transfer.TransferResult;

/**
 * Thrown when a transfer stops before the source is exhausted, either because
 * the run was cancelled between batches or because a row error occurred under
 * the {@link datamigrator.transfer.RowErrorPolicy#FAIL_PHASE} policy.
 */
public class TransferAbortedException extends MigrateException {

    private final boolean cancelled;
    private final TransferResult partialResult;

    public TransferAbortedException(String message, boolean cancelled, TransferResult partialResult) {
        super(message);
        this.cancelled = cancelled;
        this.partialResult = partialResult;
    }

    /** Returns true if the transfer stopped because the run was cancelled. */
    public boolean isCancelled() {
        return cancelled;
    }

    /** Returns counts accumulated before the transfer stopped. */
    public TransferResult getPartialResult() {
        return partialResult;
    }
}
