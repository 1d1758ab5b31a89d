package datamigrator.transfer;

/**
 * What a transfer does when a single row cannot be mapped.
 */
public enum RowErrorPolicy {
    /** Record the error, skip the row and continue. */
    CONTINUE,
    /** Stop the transfer at the first row error and fail the phase. */
    FAIL_PHASE
}
