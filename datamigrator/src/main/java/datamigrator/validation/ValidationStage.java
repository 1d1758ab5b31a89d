package datamigrator.validation;

/**
 * When a {@link ValidationRule} runs.
 */
public enum ValidationStage {
    /** Before the phase touches any row. */
    PRE,
    /** After the transfer, before the tag is committed. */
    POST
}
