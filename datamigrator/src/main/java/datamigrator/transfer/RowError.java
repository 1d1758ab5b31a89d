package datamigrator.transfer;

import datamigrator.row.RowKey;

/**
 * A source row that could not be transferred.
 *
 * @param sourceKey the key of the source row, or null if the row had none
 * @param message what went wrong
 * @param cause the underlying exception, or null
 */
public record RowError(RowKey sourceKey, String message, Throwable cause) {

    @Override
    public String toString() {
        return "RowError{key=" + sourceKey + ", message=" + message + '}';
    }
}
