package datamigrator.store;

/**
 * Exception thrown by a {@link RecordStore} when a read or write fails.
 *
 * <p>This is an unchecked exception. The engine converts it into the matching
 * migration failure (row error, batch write failure or restore failure)
 * depending on where it occurs.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
