package datamigrator.rollback;

import datamigrator.ledger.TagScope;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Before-images of every row a phase is about to write, taken so the phase can
 * be undone.
 *
 * <p>A snapshot is persisted before the phase mutates anything, applied only on
 * rollback and discarded once the phase commits. After a successful restore it
 * is kept with {@code restored=true}, which makes a second restore a no-op.
 *
 * @param phaseId the phase the snapshot belongs to
 * @param scope the scope of the run
 * @param table the table the captured rows live in
 * @param capturedAt when the snapshot was taken
 * @param capturedRows before-images in capture order
 * @param restored whether the snapshot has been applied
 */
public record RollbackSnapshot(String phaseId,
                               TagScope scope,
                               String table,
                               Instant capturedAt,
                               List<CapturedRow> capturedRows,
                               boolean restored) {

    public RollbackSnapshot {
        Objects.requireNonNull(phaseId, "phaseId");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(capturedAt, "capturedAt");
        capturedRows = List.copyOf(capturedRows);
    }

    /**
     * Returns the identity of a snapshot: one snapshot exists per phase and scope.
     */
    public static String idOf(String phaseId, TagScope scope) {
        return scope.key() + "/" + phaseId;
    }

    public String id() {
        return idOf(phaseId, scope);
    }

    public RollbackSnapshot markRestored() {
        return new RollbackSnapshot(phaseId, scope, table, capturedAt, capturedRows, true);
    }

    @Override
    public String toString() {
        return "RollbackSnapshot{" + id() + ", table=" + table + ", rows=" + capturedRows.size()
                + ", restored=" + restored + '}';
    }
}
