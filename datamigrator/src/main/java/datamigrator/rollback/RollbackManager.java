package datamigrator.rollback;

import datamigrator.exceptions.RestoreException;
import datamigrator.ledger.TagScope;
import datamigrator.phase.AffectedRows;
import datamigrator.phase.MigrationPhase;
import datamigrator.row.Row;
import datamigrator.row.RowKey;
import datamigrator.store.RecordStore;
import datamigrator.store.StoreProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Captures before-images ahead of a phase's writes and restores them when the
 * phase has to be undone.
 *
 * <p>{@link #snapshot} reads every affected key, recording absent rows as
 * absent, and persists the snapshot before returning. Only then may the phase
 * write. {@link #restore} replays the captured rows in reverse capture order:
 * rows that existed are written back, rows that did not are deleted. Afterwards
 * the table holds, for every captured key, exactly what it held before the
 * phase, whatever subset of its writes had been applied.
 *
 * <p>A failed restore is never retried here: the snapshot stays persisted and
 * unrestored for the operator.
 *
 * @see SnapshotStore
 */
public class RollbackManager {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    private final SnapshotStore snapshots;
    private final StoreProvider stores;
    private final Clock clock;

    public RollbackManager(SnapshotStore snapshots, StoreProvider stores) {
        this(snapshots, stores, Clock.systemUTC());
    }

    public RollbackManager(SnapshotStore snapshots, StoreProvider stores, Clock clock) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.stores = Objects.requireNonNull(stores, "stores");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SnapshotStore snapshots() {
        return snapshots;
    }

    /**
     * Captures and persists the before-image of every affected row.
     *
     * <p>If an unrestored snapshot of the same phase and scope is still stored,
     * left by a cancelled or crashed run, its before-images predate that run's
     * writes and are kept; only keys it does not cover are read from the store.
     *
     * @param phase the phase about to run
     * @param scope the scope of the run
     * @param affected the rows the phase will touch
     * @return the persisted snapshot
     * @throws datamigrator.store.StoreException if a row cannot be read or the snapshot cannot be saved
     */
    public RollbackSnapshot snapshot(MigrationPhase phase, TagScope scope, AffectedRows affected) {
        RecordStore store = stores.storeFor(scope);
        Optional<RollbackSnapshot> pending = snapshots.find(phase.id(), scope)
                .filter(s -> !s.restored() && s.table().equals(affected.table()));
        List<CapturedRow> captured = new ArrayList<>(affected.size());
        Set<RowKey> covered = new HashSet<>();
        if (pending.isPresent()) {
            for (CapturedRow row : pending.get().capturedRows()) {
                captured.add(row);
                covered.add(row.key());
            }
            log.info("Resuming phase {} in {} on unrestored snapshot {} ({} rows)",
                    phase.id(), scope, pending.get().id(), captured.size());
        }
        for (RowKey key : affected.keys()) {
            if (!covered.add(key)) {
                continue;
            }
            Optional<Row> before = store.get(affected.table(), key);
            captured.add(before.isPresent() ? CapturedRow.present(key, before.get()) : CapturedRow.absent(key));
        }
        Instant capturedAt = pending.map(RollbackSnapshot::capturedAt).orElseGet(clock::instant);
        RollbackSnapshot snapshot = new RollbackSnapshot(phase.id(), scope, affected.table(),
                capturedAt, captured, false);
        snapshots.save(snapshot);
        log.debug("Captured {} rows of {} for phase {} in {}", captured.size(), affected.table(), phase.id(), scope);
        return snapshot;
    }

    /**
     * Restores the captured rows. Restoring an already restored snapshot does nothing.
     *
     * @param snapshot the snapshot to apply
     * @return the number of captured rows replayed
     * @throws RestoreException if any row cannot be restored
     */
    public int restore(RollbackSnapshot snapshot) throws RestoreException {
        if (snapshot.restored()) {
            log.info("Snapshot {} already restored, nothing to do", snapshot.id());
            return 0;
        }
        RecordStore store = stores.storeFor(snapshot.scope());
        List<CapturedRow> rows = snapshot.capturedRows();
        try {
            for (int i = rows.size() - 1; i >= 0; i--) {
                CapturedRow captured = rows.get(i);
                if (captured.existed()) {
                    store.upsert(snapshot.table(), List.of(captured.beforeImage()));
                } else {
                    store.delete(snapshot.table(), captured.key());
                }
            }
            snapshots.save(snapshot.markRestored());
        } catch (RuntimeException e) {
            throw new RestoreException("Failed to restore snapshot " + snapshot.id() + ": " + e.getMessage(),
                    snapshot.id(), e);
        }
        log.info("Restored {} rows of {} from snapshot {}", rows.size(), snapshot.table(), snapshot.id());
        return rows.size();
    }

    /**
     * Restores the persisted snapshot of a phase.
     *
     * @param phaseId the phase id
     * @param scope the scope
     * @return the number of captured rows replayed
     * @throws RestoreException if there is no snapshot or it cannot be applied
     */
    public int restore(String phaseId, TagScope scope) throws RestoreException {
        Optional<RollbackSnapshot> snapshot = snapshots.find(phaseId, scope);
        if (snapshot.isEmpty()) {
            throw new RestoreException("No snapshot for phase " + phaseId + " in " + scope,
                    RollbackSnapshot.idOf(phaseId, scope), null);
        }
        return restore(snapshot.get());
    }

    /**
     * Deletes the snapshot of a phase that committed.
     */
    public void discard(RollbackSnapshot snapshot) {
        snapshots.delete(snapshot.phaseId(), snapshot.scope());
        log.debug("Discarded snapshot {}", snapshot.id());
    }
}
