package datamigrator.exceptions;

/**
 * Thrown when restoring a rollback snapshot fails.
 *
 * <p>This is the most severe failure class. The engine does not retry a failed
 * restore; the snapshot is kept and the failure is surfaced in the run report so
 * an operator can decide how to recover.
 *
 * @see datamigrator.rollback.RollbackManager#restore(datamigrator.rollback.RollbackSnapshot)
 */
public class RestoreException extends MigrateException {

    private final String snapshotId;

    public RestoreException(String message, String snapshotId, Throwable cause) {
        super(message + " [snapshot=" + snapshotId + "]", cause);
        this.snapshotId = snapshotId;
    }

    /** Returns the id of the snapshot that could not be restored. */
    public String getSnapshotId() {
        return snapshotId;
    }
}
