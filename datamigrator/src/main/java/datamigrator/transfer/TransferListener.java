package datamigrator.transfer;

/**
 * Receives progress events from {@link BatchTransferExecutor}.
 *
 * <p>Events are delivered on the thread that called the executor, in batch
 * order, also when batches are written by parallel workers.
 */
public interface TransferListener {

    TransferListener NOOP = new TransferListener() {
    };

    /**
     * Called after a batch was written.
     *
     * @param batchNumber the 1-based batch number
     * @param rows rows in the batch
     */
    default void onBatchFlushed(int batchNumber, int rows) {
    }

    default void onRowError(RowError error) {
    }
}
