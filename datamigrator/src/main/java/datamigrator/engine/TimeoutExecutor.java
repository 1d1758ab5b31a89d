package datamigrator.engine;

import datamigrator.exceptions.MigrationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs operations with an optional timeout.
 *
 * <p>If an operation exceeds its timeout, a {@link MigrationTimeoutException} is
 * thrown and the operation is interrupted, though it may not respond to
 * interruption. A null or non-positive timeout runs the operation directly on
 * the calling thread.
 *
 * @see MigrationTimeoutException
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    // daemon threads so they don't prevent JVM shutdown
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "migration-timeout-executor");
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {
        // Utility class
    }

    /**
     * Returns true if the timeout is set (non-null and positive).
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Executes a callable with a timeout.
     *
     * @param operation the name of the operation (for error messages)
     * @param timeout the timeout duration, or null/zero to disable
     * @param callable the operation to execute
     * @param <T> the return type
     * @return the result of the callable
     * @throws MigrationTimeoutException if the operation times out
     * @throws Exception if the callable throws
     */
    public static <T> T executeWithTimeout(String operation, Duration timeout, Callable<T> callable) throws Exception {
        if (!isEnabled(timeout)) {
            return callable.call();
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return callable.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, EXECUTOR);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new MigrationTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MigrationTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new RuntimeException("Operation '" + operation + "' failed", cause);
            }
        }
    }
}
