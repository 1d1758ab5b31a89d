package datamigrator.rollback;

import datamigrator.ledger.TagScope;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link RollbackSnapshot}s. One snapshot is kept per phase and
 * scope; saving replaces the previous one.
 *
 * <p>Failures are reported as {@link datamigrator.store.StoreException}.
 */
public interface SnapshotStore {

    /** Saves a snapshot durably before returning. */
    void save(RollbackSnapshot snapshot);

    Optional<RollbackSnapshot> find(String phaseId, TagScope scope);

    /** Deletes a snapshot; deleting a missing snapshot does nothing. */
    void delete(String phaseId, TagScope scope);

    /** Returns all stored snapshots. */
    List<RollbackSnapshot> list();
}
