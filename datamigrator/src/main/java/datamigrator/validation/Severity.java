package datamigrator.validation;

/**
 * Effect of a failed {@link ValidationRule}.
 */
public enum Severity {
    /** The phase fails and is rolled back if it has a snapshot. */
    BLOCKING,
    /** The failure is reported and logged; the phase continues. */
    WARNING
}
