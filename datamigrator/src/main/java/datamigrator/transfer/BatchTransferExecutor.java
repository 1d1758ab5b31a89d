package datamigrator.transfer;

import datamigrator.engine.RunContext;
import datamigrator.exceptions.BatchWriteException;
import datamigrator.exceptions.MigrateException;
import datamigrator.exceptions.TransferAbortedException;
import datamigrator.mapping.FieldMappingCompiler;
import datamigrator.row.Row;
import datamigrator.row.RowKey;
import datamigrator.store.RecordStore;
import datamigrator.store.RowCursor;
import datamigrator.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams rows from a source table through compiled mappings into a target
 * table, in batches.
 *
 * <p>The source is read with one cursor, which is always closed. Each mapped
 * row joins the current batch; a full batch is written with a single
 * {@link RecordStore#upsert} call, so repeated or concurrent transfers of the
 * same rows are harmless. A row whose mapping fails becomes a {@link RowError}
 * and is skipped, or aborts the transfer under {@link RowErrorPolicy#FAIL_PHASE}.
 *
 * <p>With {@code parallelWorkers > 1} batches are written on a pool of that many
 * threads and at most that many batches are in flight. Reading, mapping and
 * listener callbacks stay on the calling thread. Whenever the transfer stops early, every batch already
 * in flight is awaited first, so no write happens after this method returns.
 *
 * <p>Written batches are never undone here; undoing them is the job of the
 * rollback manager.
 */
public final class BatchTransferExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchTransferExecutor.class);

    /**
     * Runs a transfer.
     *
     * @param job the compiled job
     * @param policy what to do on a row error
     * @param ctx the run context supplying the store and the cancellation flag
     * @param listener receives batch and row error events
     * @return the transfer result
     * @throws BatchWriteException if a batch write fails
     * @throws TransferAbortedException if the run is cancelled, or on the first
     *         row error under {@link RowErrorPolicy#FAIL_PHASE}
     * @throws MigrateException if the source table cannot be read
     */
    public TransferResult execute(TransferJob job, RowErrorPolicy policy, RunContext ctx, TransferListener listener)
            throws MigrateException {
        log.debug("Starting {} with policy {}", job, policy);
        Execution execution = new Execution(job, ctx.store(), listener);
        try {
            execution.run(policy, ctx);
        } finally {
            execution.close();
        }
        TransferResult result = execution.result();
        log.debug("Finished {}: copied={} skipped={} batches={}",
                job, result.copied(), result.skipped(), result.batches());
        return result;
    }

    /**
     * State of a single {@link #execute} call.
     */
    private static final class Execution {
        private final TransferJob job;
        private final RecordStore store;
        private final TransferListener listener;
        private final ExecutorService pool;
        private final Deque<PendingBatch> inFlight = new ArrayDeque<>();
        private final AtomicLong copied = new AtomicLong();
        private final AtomicInteger batches = new AtomicInteger();
        private final List<RowError> errors = Collections.synchronizedList(new ArrayList<>());

        Execution(TransferJob job, RecordStore store, TransferListener listener) {
            this.job = job;
            this.store = store;
            this.listener = listener;
            this.pool = job.parallelWorkers() > 1 ? newPool(job) : null;
        }

        void run(RowErrorPolicy policy, RunContext ctx) throws MigrateException {
            int batchNumber = 0;
            List<Row> batch = new ArrayList<>(job.batchSize());
            try (RowCursor cursor = store.find(job.sourceTable(), job.filter())) {
                while (cursor.hasNext()) {
                    Row source = cursor.next();
                    Row target;
                    try {
                        target = FieldMappingCompiler.apply(job.mappings(), source);
                        // a row without a target key cannot be upserted
                        job.target().keyOf(target);
                    } catch (RuntimeException e) {
                        RowError error = new RowError(keyOf(source), describe(e), e);
                        errors.add(error);
                        listener.onRowError(error);
                        log.debug("Row error in {}: {}", job.sourceTable(), error);
                        if (policy == RowErrorPolicy.FAIL_PHASE) {
                            awaitAll();
                            throw new TransferAbortedException(
                                    "Row error for key " + error.sourceKey() + ": " + error.message(),
                                    false, result());
                        }
                        continue;
                    }
                    batch.add(target);
                    if (batch.size() == job.batchSize()) {
                        flush(++batchNumber, batch, ctx);
                        batch = new ArrayList<>(job.batchSize());
                    }
                }
                if (!batch.isEmpty()) {
                    flush(++batchNumber, batch, ctx);
                }
                awaitAll();
            } catch (StoreException e) {
                awaitAll();
                throw new MigrateException("Failed to read source table " + job.sourceTable(), e);
            }
        }

        private void flush(int batchNumber, List<Row> rows, RunContext ctx) throws MigrateException {
            if (ctx.isCancelled()) {
                awaitAll();
                throw new TransferAbortedException("Run cancelled before batch " + batchNumber, true, result());
            }
            if (pool == null) {
                write(batchNumber, rows);
                return;
            }
            if (inFlight.size() >= job.parallelWorkers()) {
                awaitOldest();
            }
            inFlight.addLast(new PendingBatch(batchNumber, rows.size(), pool.submit(() -> {
                write(batchNumber, rows);
                return null;
            })));
        }

        private void write(int batchNumber, List<Row> rows) throws BatchWriteException {
            try {
                store.upsert(job.targetTable(), rows);
            } catch (RuntimeException e) {
                throw new BatchWriteException("Failed to write batch " + batchNumber + " to " + job.targetTable(),
                        batchNumber, result(), e);
            }
            copied.addAndGet(rows.size());
            batches.incrementAndGet();
            if (pool == null) {
                listener.onBatchFlushed(batchNumber, rows.size());
            }
        }

        private void awaitOldest() throws MigrateException {
            PendingBatch oldest = inFlight.pollFirst();
            try {
                await(oldest);
            } catch (MigrateException e) {
                awaitAll();
                throw e;
            }
        }

        /**
         * Waits for every batch in flight. Rethrows the failure of the lowest
         * numbered failed batch once nothing is in flight any more.
         */
        private void awaitAll() throws MigrateException {
            MigrateException first = null;
            while (!inFlight.isEmpty()) {
                try {
                    await(inFlight.pollFirst());
                } catch (MigrateException e) {
                    if (first == null) {
                        first = e;
                    } else {
                        first.addSuppressed(e);
                    }
                }
            }
            if (first != null) {
                throw first;
            }
        }

        private void await(PendingBatch pending) throws MigrateException {
            try {
                pending.future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof BatchWriteException) {
                    BatchWriteException bwe = (BatchWriteException) cause;
                    throw new BatchWriteException(bwe.getMessage(), bwe.getBatchNumber(), result(), bwe.getCause());
                }
                throw new BatchWriteException("Batch " + pending.batchNumber + " failed",
                        pending.batchNumber, result(), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransferAbortedException("Interrupted while waiting for batch " + pending.batchNumber,
                        true, result());
            }
            listener.onBatchFlushed(pending.batchNumber, pending.rows);
        }

        void close() {
            if (pool == null) {
                return;
            }
            if (!inFlight.isEmpty()) {
                // only reached when an unexpected exception is already propagating
                log.warn("Abandoning {} in-flight batches of {}", inFlight.size(), job);
                inFlight.forEach(p -> p.future.cancel(true));
                inFlight.clear();
            }
            pool.shutdownNow();
        }

        TransferResult result() {
            List<RowError> copy;
            synchronized (errors) {
                copy = new ArrayList<>(errors);
            }
            return new TransferResult(copied.get(), copy.size(), copy, batches.get());
        }

        private RowKey keyOf(Row source) {
            Object value = source.get(job.source().keyField());
            return value == null ? null : RowKey.of(value);
        }

        private static String describe(RuntimeException e) {
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }

        private static ExecutorService newPool(TransferJob job) {
            AtomicInteger counter = new AtomicInteger();
            return Executors.newFixedThreadPool(job.parallelWorkers(), r -> {
                Thread t = new Thread(r, "migration-batch-" + job.targetTable() + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
    }

    private static final class PendingBatch {
        final int batchNumber;
        final int rows;
        final Future<?> future;

        PendingBatch(int batchNumber, int rows, Future<?> future) {
            this.batchNumber = batchNumber;
            this.rows = rows;
            this.future = future;
        }
    }
}
