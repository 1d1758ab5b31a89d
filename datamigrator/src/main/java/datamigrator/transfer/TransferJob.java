package datamigrator.transfer;

import datamigrator.mapping.FieldMapping;
import datamigrator.row.RowFilter;
import datamigrator.row.TableShape;

import java.util.List;

/**
 * A compiled, immutable transfer: what to read, how to map it and how to batch the writes.
 *
 * <p>Created by {@link TransferSpec#compile}. Owned by one phase while it runs.
 */
public final class TransferJob {

    private final TableShape source;
    private final TableShape target;
    private final RowFilter filter;
    private final List<FieldMapping> mappings;
    private final int batchSize;
    private final int parallelWorkers;

    TransferJob(TableShape source, TableShape target, RowFilter filter,
                List<FieldMapping> mappings, int batchSize, int parallelWorkers) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        if (parallelWorkers <= 0) throw new IllegalArgumentException("parallelWorkers must be positive");
        this.source = source;
        this.target = target;
        this.filter = filter;
        this.mappings = List.copyOf(mappings);
        this.batchSize = batchSize;
        this.parallelWorkers = parallelWorkers;
    }

    public String sourceTable() { return source.name(); }

    public String targetTable() { return target.name(); }

    public TableShape source() { return source; }

    public TableShape target() { return target; }

    public RowFilter filter() { return filter; }

    public List<FieldMapping> mappings() { return mappings; }

    public int batchSize() { return batchSize; }

    public int parallelWorkers() { return parallelWorkers; }

    @Override
    public String toString() {
        return "TransferJob{" + sourceTable() + " -> " + targetTable() +
                ", mappings=" + mappings.size() +
                ", batchSize=" + batchSize +
                ", workers=" + parallelWorkers + '}';
    }
}
