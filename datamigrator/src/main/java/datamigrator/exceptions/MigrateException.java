package datamigrator.exceptions;

/**
 * Exception thrown when a migration operation fails.
 *
 * <p>Besides the message and cause, the exception may carry diagnostic context:
 * <ul>
 *   <li>the id of the phase that was executing</li>
 *   <li>the stage of the phase where the failure occurred (for example
 *       {@code TRANSFERRING} or {@code ROLLING_BACK})</li>
 * </ul>
 *
 * <p>Both fields are plain strings so the exception can be logged or stored in a
 * run report without holding references to engine objects.
 *
 * @see datamigrator.engine.MigrationOrchestrator
 */
public class MigrateException extends Exception {

    private final String phaseId;
    private final String stage;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new migration exception with phase context.
     *
     * @param message the error message
     * @param phaseId the phase that was executing
     * @param stage the stage where the failure occurred
     */
    public MigrateException(String message, String phaseId, String stage) {
        this(message, phaseId, stage, null);
    }

    /**
     * Creates a new migration exception with phase context and cause.
     *
     * @param message the error message
     * @param phaseId the phase that was executing
     * @param stage the stage where the failure occurred
     * @param cause the underlying cause
     */
    public MigrateException(String message, String phaseId, String stage, Throwable cause) {
        super(message, cause);
        this.phaseId = phaseId;
        this.stage = stage;
    }

    // ---------------- getters ----------------

    /**
     * Returns the id of the phase that was executing.
     *
     * @return the phase id, or null if not set
     */
    public String getPhaseId() {
        return phaseId;
    }

    /**
     * Returns the stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        String base = super.getMessage();
        StringBuilder sb = new StringBuilder(base == null ? "" : base);

        if (phaseId != null) sb.append(" [phase=").append(phaseId).append("]");
        if (stage != null) sb.append(" [stage=").append(stage).append("]");

        return sb.toString();
    }
}
