package datamigrator.transfer;

import datamigrator.config.MigrationConfig;
import datamigrator.engine.RunContext;
import datamigrator.exceptions.BatchWriteException;
import datamigrator.exceptions.MigrateException;
import datamigrator.exceptions.TransferAbortedException;
import datamigrator.ledger.TagScope;
import datamigrator.mapping.FieldMappingCompiler;
import datamigrator.mapping.MappingRule;
import datamigrator.mapping.TransformFunction;
import datamigrator.mapping.TransformRegistry;
import datamigrator.row.FieldType;
import datamigrator.row.MapRow;
import datamigrator.row.Row;
import datamigrator.row.RowKey;
import datamigrator.row.TableShape;
import datamigrator.store.ScriptedRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("BatchTransferExecutor")
class BatchTransferExecutorTest {

    static final TableShape ORDERS = TableShape.builder("orders")
            .key("id", FieldType.INTEGER)
            .field("amount", FieldType.INTEGER)
            .field("note", FieldType.STRING)
            .build();

    static final TableShape ARCHIVE = TableShape.builder("orders_archive")
            .key("id", FieldType.LONG)
            .field("amount", FieldType.LONG)
            .field("note", FieldType.STRING)
            .build();

    ScriptedRecordStore store;
    FieldMappingCompiler compiler;
    BatchTransferExecutor executor;

    @BeforeEach
    void setUp() {
        store = new ScriptedRecordStore();
        store.createTable(ORDERS.name(), "id").createTable(ARCHIVE.name(), "id");
        TransformRegistry transforms = new TransformRegistry()
                .register("strictNote", TransformFunction.<String, String>of(FieldType.STRING, FieldType.STRING,
                        note -> {
                            if (note.startsWith("!")) {
                                throw new IllegalArgumentException("bad note " + note);
                            }
                            return note;
                        }));
        compiler = new FieldMappingCompiler(transforms);
        executor = new BatchTransferExecutor();
    }

    void seed(int count) {
        List<Row> rows = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            rows.add(MapRow.of("id", i, "amount", i * 10, "note", "order " + i));
        }
        store.upsert(ORDERS.name(), rows);
    }

    TransferJob job(int batchSize, int workers) throws Exception {
        return TransferSpec.builder(ORDERS, ARCHIVE)
                .rule(MappingRule.direct("id"))
                .rule(MappingRule.direct("amount"))
                .rule(MappingRule.transform("note", "note", "strictNote"))
                .batchSize(batchSize)
                .parallelWorkers(workers)
                .build()
                .compile(compiler, 500, 1);
    }

    RunContext context() {
        return new RunContext(1L, TagScope.perTenant("acme"), store, MigrationConfig.DEFAULTS);
    }

    Set<Row> archived() {
        return new HashSet<>(store.rows(ARCHIVE.name()));
    }

    @Nested
    @DisplayName("batching")
    class Batching {

        @ParameterizedTest(name = "batchSize={0} workers={1}")
        @CsvSource({"1, 1", "7, 1", "1000, 1", "1, 4", "7, 3", "1000, 4"})
        @DisplayName("should write the same rows whatever the batch size")
        void shouldWriteSameRowsWhateverBatchSize(int batchSize, int workers) throws Exception {
            seed(50);

            TransferResult result = executor.execute(job(batchSize, workers), RowErrorPolicy.CONTINUE, context(),
                    TransferListener.NOOP);

            Set<Row> expected = new HashSet<>();
            for (int i = 1; i <= 50; i++) {
                expected.add(MapRow.of("id", (long) i, "amount", i * 10L, "note", "order " + i));
            }
            assertThat(archived()).isEqualTo(expected);
            assertThat(result.copied()).isEqualTo(50);
            assertThat(result.batches()).isEqualTo((50 + batchSize - 1) / batchSize);
        }

        @Test
        @DisplayName("should report each flushed batch")
        void shouldReportEachBatch() throws Exception {
            seed(5);
            List<Integer> sizes = new CopyOnWriteArrayList<>();

            executor.execute(job(2, 1), RowErrorPolicy.CONTINUE, context(), new TransferListener() {
                @Override
                public void onBatchFlushed(int batchNumber, int rows) {
                    sizes.add(rows);
                }
            });

            assertThat(sizes).containsExactly(2, 2, 1);
        }

        @Test
        @DisplayName("should deliver batch events on the calling thread in order when writing in parallel")
        void shouldDeliverParallelEventsOnCallingThread() throws Exception {
            seed(20);
            Thread caller = Thread.currentThread();
            List<Integer> numbers = new ArrayList<>();
            List<Thread> threads = new ArrayList<>();

            executor.execute(job(2, 4), RowErrorPolicy.CONTINUE, context(), new TransferListener() {
                @Override
                public void onBatchFlushed(int batchNumber, int rows) {
                    numbers.add(batchNumber);
                    threads.add(Thread.currentThread());
                }
            });

            assertThat(numbers).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
            assertThat(threads).containsOnly(caller);
        }

        @Test
        @DisplayName("should write nothing for an empty source")
        void shouldHandleEmptySource() throws Exception {
            TransferResult result = executor.execute(job(10, 1), RowErrorPolicy.CONTINUE, context(),
                    TransferListener.NOOP);

            assertThat(result.copied()).isZero();
            assertThat(result.batches()).isZero();
            assertThat(store.upsertCalls(ARCHIVE.name())).isZero();
        }
    }

    @Nested
    @DisplayName("row errors")
    class RowErrors {

        @Test
        @DisplayName("should skip failing rows under CONTINUE")
        void shouldSkipFailingRows() throws Exception {
            seed(4);
            store.upsert(ORDERS.name(), List.of(MapRow.of("id", 2, "amount", 20, "note", "!broken")));

            TransferResult result = executor.execute(job(10, 1), RowErrorPolicy.CONTINUE, context(),
                    TransferListener.NOOP);

            assertThat(result.copied()).isEqualTo(3);
            assertThat(result.skipped()).isEqualTo(1);
            assertThat(result.errors()).singleElement().satisfies(e -> {
                assertThat(e.sourceKey()).isEqualTo(RowKey.of(2));
                assertThat(e.message()).contains("bad note !broken");
            });
            assertThat(store.get(ARCHIVE.name(), RowKey.of(2L))).isEmpty();
        }

        @Test
        @DisplayName("should skip a row that maps to no target key and write the rest of its batch")
        void shouldSkipRowWithoutTargetKey() throws Exception {
            TableShape codes = TableShape.builder("order_codes")
                    .key("note", FieldType.STRING)
                    .field("amount", FieldType.LONG)
                    .build();
            store.createTable(codes.name(), "note");
            seed(2);
            store.upsert(ORDERS.name(), List.of(MapRow.of("id", 3, "amount", 30, "note", null)));
            TransferJob job = TransferSpec.builder(ORDERS, codes)
                    .rule(MappingRule.direct("note"))
                    .rule(MappingRule.direct("amount"))
                    .batchSize(10)
                    .build()
                    .compile(compiler, 500, 1);

            TransferResult result = executor.execute(job, RowErrorPolicy.CONTINUE, context(), TransferListener.NOOP);

            assertThat(result.copied()).isEqualTo(2);
            assertThat(result.skipped()).isEqualTo(1);
            assertThat(result.errors()).singleElement().satisfies(e -> {
                assertThat(e.sourceKey()).isEqualTo(RowKey.of(3));
                assertThat(e.message()).contains("key field 'note'");
            });
            assertThat(store.rows(codes.name())).containsExactlyInAnyOrder(
                    MapRow.of("note", "order 1", "amount", 10L),
                    MapRow.of("note", "order 2", "amount", 20L));
        }

        @Test
        @DisplayName("should abort on the first failing row under FAIL_PHASE")
        void shouldAbortUnderFailPhase() throws Exception {
            seed(6);
            store.upsert(ORDERS.name(), List.of(MapRow.of("id", 4, "amount", 40, "note", "!broken")));

            TransferAbortedException e = catchThrowableOfType(() -> executor.execute(job(2, 1),
                    RowErrorPolicy.FAIL_PHASE, context(), TransferListener.NOOP), TransferAbortedException.class);

            assertThat(e.isCancelled()).isFalse();
            assertThat(e.getPartialResult().copied()).isEqualTo(2);
            assertThat(e.getPartialResult().rowErrors()).isEqualTo(1);
            assertThat(store.count(ARCHIVE.name())).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should report the failing batch and what was written before it")
        void shouldReportFailingBatch() throws Exception {
            seed(10);
            store.failUpsert(ARCHIVE.name(), 3);

            BatchWriteException e = catchThrowableOfType(() -> executor.execute(job(2, 1),
                    RowErrorPolicy.CONTINUE, context(), TransferListener.NOOP), BatchWriteException.class);

            assertThat(e.getBatchNumber()).isEqualTo(3);
            assertThat(e.getPartialResult().copied()).isEqualTo(4);
            assertThat(e).hasMessageContaining("batch 3");
            assertThat(store.count(ARCHIVE.name())).isEqualTo(4);
        }

        @Test
        @DisplayName("should wait for batches in flight before reporting a parallel failure")
        void shouldDrainInFlightBatches() throws Exception {
            seed(40);
            store.failUpsert(ARCHIVE.name(), 2);

            catchThrowableOfType(() -> executor.execute(job(4, 4), RowErrorPolicy.CONTINUE, context(),
                    TransferListener.NOOP), BatchWriteException.class);
            int writtenWhenReturned = store.count(ARCHIVE.name());
            Thread.sleep(50);

            assertThat(store.count(ARCHIVE.name())).isEqualTo(writtenWhenReturned);
            assertThat(store.upsertCalls(ARCHIVE.name())).isLessThan(10);
        }

        @Test
        @DisplayName("should fail when the source table is missing")
        void shouldFailOnMissingSource() throws Exception {
            TransferJob job = job(10, 1);
            ScriptedRecordStore empty = new ScriptedRecordStore();
            RunContext ctx = new RunContext(2L, TagScope.global(), empty, MigrationConfig.DEFAULTS);

            MigrateException e = catchThrowableOfType(() -> executor.execute(job, RowErrorPolicy.CONTINUE, ctx,
                    TransferListener.NOOP), MigrateException.class);

            assertThat(e).hasMessageContaining("Failed to read source table orders");
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("should stop before the next batch once cancelled")
        void shouldStopBeforeNextBatch() throws Exception {
            seed(10);
            RunContext ctx = context();

            TransferAbortedException e = catchThrowableOfType(() -> executor.execute(job(3, 1),
                    RowErrorPolicy.CONTINUE, ctx, new TransferListener() {
                        @Override
                        public void onBatchFlushed(int batchNumber, int rows) {
                            if (batchNumber == 2) {
                                ctx.cancel();
                            }
                        }
                    }), TransferAbortedException.class);

            assertThat(e.isCancelled()).isTrue();
            assertThat(e.getPartialResult().batches()).isEqualTo(2);
            assertThat(store.count(ARCHIVE.name())).isEqualTo(6);
        }
    }
}
