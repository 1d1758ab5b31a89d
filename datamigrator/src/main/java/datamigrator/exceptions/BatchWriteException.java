package datamigrator.exceptions;

import datamigrator.transfer.TransferResult;

/**
 * Thrown when flushing a batch to the target table fails.
 *
 * <p>Batches flushed before the failing one stay written; undoing them is the job
 * of the rollback manager at the phase level. The partial result describes what
 * had been written when the failure happened.
 */
public class BatchWriteException extends MigrateException {

    private final int batchNumber;
    private final TransferResult partialResult;

    public BatchWriteException(String message, int batchNumber, TransferResult partialResult, Throwable cause) {
        super(message + " (batch #" + batchNumber + ")", cause);
        this.batchNumber = batchNumber;
        this.partialResult = partialResult;
    }

    /** Returns the 1-based number of the batch whose flush failed. */
    public int getBatchNumber() {
        return batchNumber;
    }

    /** Returns counts accumulated up to the failure. */
    public TransferResult getPartialResult() {
        return partialResult;
    }
}
