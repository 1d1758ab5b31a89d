package datamigrator.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only record of applied migration units.
 *
 * <p>For each (id, scope) pair at most one tag is ever committed. Tags are
 * never changed or removed, so the ledger offers no delete operation.
 * The ledger is the only engine state that outlives a run, and the only
 * resource that needs serialized access: concurrent commits of the same
 * (id, scope) produce exactly one {@link CommitOutcome#COMMITTED}.
 */
public interface MigrationLedger {

    /**
     * Returns true if a tag with the id is committed in the scope.
     */
    boolean hasTag(String id, TagScope scope);

    /**
     * Atomically commits a tag unless one exists.
     *
     * @param id the tag id
     * @param scope the scope
     * @return {@link CommitOutcome#COMMITTED} for the single winner,
     *         {@link CommitOutcome#ALREADY_COMMITTED} otherwise
     */
    CommitOutcome commitTag(String id, TagScope scope);

    /**
     * Looks up a committed tag.
     */
    Optional<MigrationTag> find(String id, TagScope scope);

    /**
     * Returns all tags committed in a scope, in commit order.
     */
    List<MigrationTag> tags(TagScope scope);
}
