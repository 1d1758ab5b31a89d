package datamigrator.rollback;

import datamigrator.exceptions.RestoreException;
import datamigrator.ledger.TagScope;
import datamigrator.phase.AffectedRows;
import datamigrator.phase.MigrationPhase;
import datamigrator.phase.PhaseHandler;
import datamigrator.row.MapRow;
import datamigrator.row.Row;
import datamigrator.row.RowKey;
import datamigrator.store.ScriptedRecordStore;
import datamigrator.store.StoreProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("RollbackManager")
class RollbackManagerTest {

    static final TagScope ACME = TagScope.perTenant("acme");
    static final Instant NOW = Instant.parse("2025-01-20T10:00:00Z");

    ScriptedRecordStore store;
    InMemorySnapshotStore snapshots;
    RollbackManager manager;
    MigrationPhase phase;

    @BeforeEach
    void setUp() {
        store = new ScriptedRecordStore();
        store.createTable("customer", "no");
        store.upsert("customer", List.of(
                MapRow.of("no", "C01", "name", "Acme", "grade", 1),
                MapRow.of("no", "C02", "name", "Globex", "grade", 2)));
        snapshots = new InMemorySnapshotStore();
        manager = new RollbackManager(snapshots, StoreProvider.single(store), Clock.fixed(NOW, ZoneOffset.UTC));
        phase = MigrationPhase.builder("regrade").handler(mock(PhaseHandler.class)).build();
    }

    Set<Row> state() {
        return new HashSet<>(store.rows("customer"));
    }

    AffectedRows affected(String... keys) {
        return AffectedRows.of("customer", Arrays.stream(keys).map(RowKey::of).toList());
    }

    @Nested
    @DisplayName("snapshot")
    class Snapshot {

        @Test
        @DisplayName("should capture present and absent rows and persist them")
        void shouldCaptureRows() {
            RollbackSnapshot snapshot = manager.snapshot(phase, ACME, affected("C01", "C03"));

            assertThat(snapshot.capturedRows()).containsExactly(
                    CapturedRow.present(RowKey.of("C01"), MapRow.of("no", "C01", "name", "Acme", "grade", 1)),
                    CapturedRow.absent(RowKey.of("C03")));
            assertThat(snapshot.capturedAt()).isEqualTo(NOW);
            assertThat(snapshot.restored()).isFalse();
            assertThat(snapshots.find("regrade", ACME)).contains(snapshot);
        }

        @Test
        @DisplayName("should capture each key once")
        void shouldCaptureEachKeyOnce() {
            RollbackSnapshot snapshot = manager.snapshot(phase, ACME, affected("C01", "C01", "C02"));

            assertThat(snapshot.capturedRows()).hasSize(2);
        }

        @Test
        @DisplayName("should keep the before-images of an unrestored snapshot when a phase is resumed")
        void shouldKeepUnrestoredBeforeImages() throws Exception {
            Set<Row> before = state();
            manager.snapshot(phase, ACME, affected("C01", "C03"));
            store.upsert("customer", List.of(
                    MapRow.of("no", "C01", "name", "Acme", "grade", 9),
                    MapRow.of("no", "C03", "name", "Initech", "grade", 3)));
            RollbackManager resumed = new RollbackManager(snapshots, StoreProvider.single(store),
                    Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC));

            RollbackSnapshot snapshot = resumed.snapshot(phase, ACME, affected("C01", "C02", "C03"));

            assertThat(snapshot.capturedRows()).containsExactly(
                    CapturedRow.present(RowKey.of("C01"), MapRow.of("no", "C01", "name", "Acme", "grade", 1)),
                    CapturedRow.absent(RowKey.of("C03")),
                    CapturedRow.present(RowKey.of("C02"), MapRow.of("no", "C02", "name", "Globex", "grade", 2)));
            assertThat(snapshot.capturedAt()).isEqualTo(NOW);
            store.upsert("customer", List.of(MapRow.of("no", "C02", "name", "Globex", "grade", 7)));
            resumed.restore(snapshot);
            assertThat(state()).isEqualTo(before);
        }

        @Test
        @DisplayName("should start afresh when the previous snapshot was already restored")
        void shouldReplaceRestoredSnapshot() throws Exception {
            manager.restore(manager.snapshot(phase, ACME, affected("C01")));
            store.upsert("customer", List.of(MapRow.of("no", "C01", "name", "Acme", "grade", 5)));

            RollbackSnapshot snapshot = manager.snapshot(phase, ACME, affected("C01"));

            assertThat(snapshot.restored()).isFalse();
            assertThat(snapshot.capturedRows()).containsExactly(
                    CapturedRow.present(RowKey.of("C01"), MapRow.of("no", "C01", "name", "Acme", "grade", 5)));
        }
    }

    @Nested
    @DisplayName("restore")
    class Restore {

        @Test
        @DisplayName("should bring back overwritten rows and remove inserted ones")
        void shouldRestorePrePhaseState() throws Exception {
            Set<Row> before = state();
            RollbackSnapshot snapshot = manager.snapshot(phase, ACME, affected("C01", "C02", "C03"));
            store.upsert("customer", List.of(
                    MapRow.of("no", "C01", "name", "Acme", "grade", 9),
                    MapRow.of("no", "C03", "name", "Initech", "grade", 3)));
            store.delete("customer", RowKey.of("C02"));

            int restored = manager.restore(snapshot);

            assertThat(restored).isEqualTo(3);
            assertThat(state()).isEqualTo(before);
            assertThat(snapshots.find("regrade", ACME)).get()
                    .extracting(RollbackSnapshot::restored).isEqualTo(true);
        }

        @Test
        @DisplayName("should do nothing the second time")
        void shouldBeIdempotent() throws Exception {
            manager.snapshot(phase, ACME, affected("C01"));
            store.upsert("customer", List.of(MapRow.of("no", "C01", "name", "Changed")));

            assertThat(manager.restore("regrade", ACME)).isEqualTo(1);
            int writes = store.upsertCalls("customer");
            store.upsert("customer", List.of(MapRow.of("no", "C01", "name", "Changed again")));
            assertThat(manager.restore("regrade", ACME)).isZero();

            assertThat(store.upsertCalls("customer")).isEqualTo(writes + 1);
            assertThat(store.get("customer", RowKey.of("C01")).get().get("name")).isEqualTo("Changed again");
        }

        @Test
        @DisplayName("should restore to the same state whatever subset of writes was applied")
        void shouldRestoreAfterPartialWrites() throws Exception {
            Set<Row> before = state();
            RollbackSnapshot snapshot = manager.snapshot(phase, ACME, affected("C01", "C02", "C03", "C04"));
            store.upsert("customer", List.of(MapRow.of("no", "C03", "name", "half done")));

            manager.restore(snapshot);

            assertThat(state()).isEqualTo(before);
        }

        @Test
        @DisplayName("should keep the snapshot unrestored when a write fails")
        void shouldKeepSnapshotWhenRestoreFails() {
            RollbackSnapshot snapshot = manager.snapshot(phase, ACME, affected("C01", "C09"));
            store.failDeletes(true);

            assertThatThrownBy(() -> manager.restore(snapshot))
                    .isInstanceOf(RestoreException.class)
                    .hasMessageContaining("acme")
                    .satisfies(e -> assertThat(((RestoreException) e).getSnapshotId()).isEqualTo(snapshot.id()));
            assertThat(snapshots.find("regrade", ACME)).get()
                    .extracting(RollbackSnapshot::restored).isEqualTo(false);
        }

        @Test
        @DisplayName("should fail when no snapshot exists")
        void shouldFailWithoutSnapshot() {
            assertThatThrownBy(() -> manager.restore("regrade", ACME))
                    .isInstanceOf(RestoreException.class)
                    .hasMessageContaining("No snapshot for phase regrade");
        }

        @Test
        @DisplayName("should drop a discarded snapshot")
        void shouldDiscard() {
            RollbackSnapshot snapshot = manager.snapshot(phase, ACME, affected("C01"));

            manager.discard(snapshot);

            assertThat(snapshots.list()).isEmpty();
        }
    }
}
