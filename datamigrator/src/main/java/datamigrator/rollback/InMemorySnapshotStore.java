package datamigrator.rollback;

import datamigrator.ledger.TagScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SnapshotStore} held in memory.
 */
public final class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, RollbackSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(RollbackSnapshot snapshot) {
        snapshots.put(snapshot.id(), snapshot);
    }

    @Override
    public Optional<RollbackSnapshot> find(String phaseId, TagScope scope) {
        return Optional.ofNullable(snapshots.get(RollbackSnapshot.idOf(phaseId, scope)));
    }

    @Override
    public void delete(String phaseId, TagScope scope) {
        snapshots.remove(RollbackSnapshot.idOf(phaseId, scope));
    }

    @Override
    public List<RollbackSnapshot> list() {
        return new ArrayList<>(snapshots.values());
    }
}
