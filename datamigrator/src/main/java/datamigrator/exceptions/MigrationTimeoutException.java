package datamigrator.exceptions;

import java.time.Duration;

/**
 * Exception thrown when an operation exceeds its configured timeout.
 *
 * <p>This is an unchecked exception so timeout protection can wrap callbacks
 * without changing their signatures.
 *
 * @see datamigrator.engine.TimeoutExecutor
 */
public class MigrationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    /**
     * Creates a new timeout exception with a cause.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     * @param cause the underlying cause (typically TimeoutException or InterruptedException)
     */
    public MigrationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /** Returns the name of the operation that timed out. */
    public String getOperation() {
        return operation;
    }

    /** Returns the configured timeout that was exceeded. */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis());
    }
}
