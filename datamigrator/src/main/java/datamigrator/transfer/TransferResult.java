package datamigrator.transfer;

import java.util.List;

/**
 * Outcome of a transfer, or the part of it completed before it stopped.
 *
 * @param copied rows written to the target table
 * @param skipped rows skipped because of a row error
 * @param errors the row errors, in source order
 * @param batches batches written
 */
public record TransferResult(long copied, long skipped, List<RowError> errors, int batches) {

    private static final TransferResult EMPTY = new TransferResult(0, 0, List.of(), 0);

    public TransferResult {
        errors = List.copyOf(errors);
    }

    public static TransferResult empty() {
        return EMPTY;
    }

    public int rowErrors() {
        return errors.size();
    }
}
