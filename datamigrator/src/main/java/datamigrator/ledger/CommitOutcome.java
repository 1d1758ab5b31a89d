package datamigrator.ledger;

/**
 * Result of {@link MigrationLedger#commitTag}.
 *
 * <p>{@link #ALREADY_COMMITTED} is not an error: another run applied the same
 * unit first, and callers treat it as success.
 */
public enum CommitOutcome {
    COMMITTED,
    ALREADY_COMMITTED
}
