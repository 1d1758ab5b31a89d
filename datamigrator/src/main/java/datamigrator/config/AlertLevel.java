package datamigrator.config;

/**
 * Minimum severity of events written by {@link datamigrator.alert.MigrationAlertLogger}.
 *
 * <p>Configured with {@code migration.alert.level}.
 * <ul>
 *   <li>{@link #DEBUG} - every event: run and phase start, skip, commit, completion</li>
 *   <li>{@link #WARNING} - rollbacks, validation warnings and failures</li>
 *   <li>{@link #ERROR} - failed phases and runs, failed restores</li>
 * </ul>
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
