package datamigrator.phase;

import datamigrator.engine.RunContext;
import datamigrator.exceptions.BatchWriteException;
import datamigrator.exceptions.MigrateException;
import datamigrator.exceptions.TransferAbortedException;
import datamigrator.row.Row;
import datamigrator.row.RowFilter;
import datamigrator.row.RowKey;
import datamigrator.row.TableShape;
import datamigrator.store.RecordStore;
import datamigrator.store.RowCursor;
import datamigrator.store.StoreException;
import datamigrator.transfer.TransferListener;
import datamigrator.transfer.TransferResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deletes the rows of a table that match a filter, for example legacy rows
 * already copied by an earlier phase.
 *
 * <p>Deletes are grouped into batches of the configured batch size for progress
 * reporting and cancellation; each delete is applied on its own. The result
 * counts deleted rows as copied.
 */
public final class PurgePhaseHandler implements PhaseHandler {

    private final TableShape table;
    private final RowFilter filter;

    public PurgePhaseHandler(TableShape table, RowFilter filter) {
        this.table = Objects.requireNonNull(table, "table");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    @Override
    public AffectedRows affectedRows(MigrationPhase phase, RunContext ctx) throws MigrateException {
        return AffectedRows.of(table.name(), matchingKeys(phase, ctx.store()));
    }

    @Override
    public TransferResult execute(MigrationPhase phase, RunContext ctx, TransferListener listener)
            throws MigrateException {
        List<RowKey> keys = matchingKeys(phase, ctx.store());
        int batchSize = ctx.config().batchSize();
        long deleted = 0;
        int batches = 0;
        for (int from = 0; from < keys.size(); from += batchSize) {
            TransferResult sofar = new TransferResult(deleted, 0, List.of(), batches);
            if (ctx.isCancelled()) {
                throw new TransferAbortedException("Run cancelled before batch " + (batches + 1), true, sofar);
            }
            List<RowKey> batch = keys.subList(from, Math.min(from + batchSize, keys.size()));
            try {
                for (RowKey key : batch) {
                    ctx.store().delete(table.name(), key);
                    deleted++;
                }
            } catch (StoreException e) {
                throw new BatchWriteException("Failed to delete from " + table.name(), batches + 1,
                        new TransferResult(deleted, 0, List.of(), batches), e);
            }
            batches++;
            listener.onBatchFlushed(batches, batch.size());
        }
        return new TransferResult(deleted, 0, List.of(), batches);
    }

    private List<RowKey> matchingKeys(MigrationPhase phase, RecordStore store) throws MigrateException {
        List<RowKey> keys = new ArrayList<>();
        try (RowCursor cursor = store.find(table.name(), filter)) {
            while (cursor.hasNext()) {
                Row row = cursor.next();
                keys.add(table.keyOf(row));
            }
        } catch (StoreException | IllegalArgumentException e) {
            throw new MigrateException("Failed to read " + table.name(), phase.id(),
                    PhaseStatus.TRANSFERRING.name(), e);
        }
        return keys;
    }
}
