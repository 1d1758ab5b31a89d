package datamigrator.phase;

import datamigrator.engine.RunContext;
import datamigrator.exceptions.CompileException;
import datamigrator.exceptions.MigrateException;
import datamigrator.mapping.FieldMapping;
import datamigrator.mapping.FieldMappingCompiler;
import datamigrator.row.Row;
import datamigrator.row.RowKey;
import datamigrator.store.RowCursor;
import datamigrator.store.StoreException;
import datamigrator.transfer.BatchTransferExecutor;
import datamigrator.transfer.TransferJob;
import datamigrator.transfer.TransferListener;
import datamigrator.transfer.TransferResult;
import datamigrator.transfer.TransferSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Copies rows from one table into another through field mappings.
 *
 * <p>The affected rows are the target keys the mappings produce for the
 * filtered source rows; rows whose key cannot be mapped are not written and
 * so are not affected.
 */
public final class TransferPhaseHandler implements PhaseHandler {

    private final TransferSpec spec;
    private final BatchTransferExecutor executor;

    public TransferPhaseHandler(TransferSpec spec) {
        this(spec, new BatchTransferExecutor());
    }

    public TransferPhaseHandler(TransferSpec spec, BatchTransferExecutor executor) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public TransferSpec spec() {
        return spec;
    }

    @Override
    public void compile(MigrationPhase phase, FieldMappingCompiler compiler, RunContext ctx) throws CompileException {
        TransferJob job = spec.compile(compiler, ctx.config().batchSize(), ctx.config().batchWorkers());
        ctx.job(phase.id(), job);
    }

    @Override
    public AffectedRows affectedRows(MigrationPhase phase, RunContext ctx) throws MigrateException {
        TransferJob job = job(phase, ctx);
        FieldMapping keyMapping = null;
        for (FieldMapping mapping : job.mappings()) {
            if (mapping.targetFieldId().equals(job.target().keyField())) {
                keyMapping = mapping;
            }
        }
        if (keyMapping == null) {
            throw new MigrateException("No mapping writes key field " + job.target().keyField(),
                    phase.id(), PhaseStatus.SNAPSHOTTING.name());
        }
        List<RowKey> keys = new ArrayList<>();
        try (RowCursor cursor = ctx.store().find(job.sourceTable(), job.filter())) {
            while (cursor.hasNext()) {
                Row source = cursor.next();
                Object key;
                try {
                    key = keyMapping.valueFor(source);
                } catch (RuntimeException e) {
                    continue; // becomes a row error during the transfer
                }
                if (key != null) {
                    keys.add(RowKey.of(key));
                }
            }
        } catch (StoreException e) {
            throw new MigrateException("Failed to read " + job.sourceTable(), phase.id(),
                    PhaseStatus.SNAPSHOTTING.name(), e);
        }
        return AffectedRows.of(job.targetTable(), keys);
    }

    @Override
    public TransferResult execute(MigrationPhase phase, RunContext ctx, TransferListener listener)
            throws MigrateException {
        return executor.execute(job(phase, ctx), phase.rowErrorPolicy(ctx.config()), ctx, listener);
    }

    private static TransferJob job(MigrationPhase phase, RunContext ctx) throws MigrateException {
        return ctx.job(phase.id()).orElseThrow(() ->
                new MigrateException("Phase was not compiled", phase.id(), PhaseStatus.PENDING.name()));
    }
}
