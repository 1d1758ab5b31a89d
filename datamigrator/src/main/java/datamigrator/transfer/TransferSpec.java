package datamigrator.transfer;

import datamigrator.exceptions.CompileException;
import datamigrator.mapping.FieldMappingCompiler;
import datamigrator.mapping.MappingRule;
import datamigrator.row.RowFilter;
import datamigrator.row.TableShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a transfer between two tables, before its
 * mapping rules are compiled.
 *
 * <pre>
 * TransferSpec spec = TransferSpec.builder(legacyCustomers, customers)
 *     .filter(row -&gt; !Boolean.TRUE.equals(row.get("deleted")))
 *     .rule(MappingRule.direct("id"))
 *     .rule(MappingRule.transform("revenue", "grade", "revenueToGrade"))
 *     .batchSize(1000)
 *     .build();
 * </pre>
 *
 * <p>A batch size or worker count of 0 means "use the configured default".
 */
public final class TransferSpec {

    private final TableShape source;
    private final TableShape target;
    private final RowFilter filter;
    private final List<MappingRule> rules;
    private final int batchSize;
    private final int parallelWorkers;

    private TransferSpec(Builder b) {
        this.source = b.source;
        this.target = b.target;
        this.filter = b.filter;
        this.rules = List.copyOf(b.rules);
        this.batchSize = b.batchSize;
        this.parallelWorkers = b.parallelWorkers;
    }

    public static Builder builder(TableShape source, TableShape target) {
        return new Builder(source, target);
    }

    public TableShape source() { return source; }

    public TableShape target() { return target; }

    public RowFilter filter() { return filter; }

    public List<MappingRule> rules() { return rules; }

    public int batchSize() { return batchSize; }

    public int parallelWorkers() { return parallelWorkers; }

    /**
     * Compiles the mapping rules and fixes the batch settings.
     *
     * @param compiler the mapping compiler
     * @param defaultBatchSize batch size used when none is set
     * @param defaultWorkers worker count used when none is set
     * @return the immutable job
     * @throws CompileException if the rules do not fit the shapes
     */
    public TransferJob compile(FieldMappingCompiler compiler, int defaultBatchSize, int defaultWorkers)
            throws CompileException {
        return new TransferJob(source, target, filter,
                compiler.compile(source, target, rules),
                batchSize > 0 ? batchSize : defaultBatchSize,
                parallelWorkers > 0 ? parallelWorkers : defaultWorkers);
    }

    /**
     * Builder for {@link TransferSpec}.
     */
    public static final class Builder {
        private final TableShape source;
        private final TableShape target;
        private RowFilter filter = RowFilter.ALL;
        private final List<MappingRule> rules = new ArrayList<>();
        private int batchSize;
        private int parallelWorkers;

        private Builder(TableShape source, TableShape target) {
            this.source = Objects.requireNonNull(source, "source");
            this.target = Objects.requireNonNull(target, "target");
        }

        public Builder filter(RowFilter filter) {
            this.filter = Objects.requireNonNull(filter, "filter");
            return this;
        }

        public Builder rule(MappingRule rule) {
            this.rules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder rules(List<MappingRule> rules) {
            rules.forEach(this::rule);
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 0) throw new IllegalArgumentException("batchSize must not be negative");
            this.batchSize = batchSize;
            return this;
        }

        public Builder parallelWorkers(int workers) {
            if (workers < 0) throw new IllegalArgumentException("parallelWorkers must not be negative");
            this.parallelWorkers = workers;
            return this;
        }

        public TransferSpec build() {
            return new TransferSpec(this);
        }
    }
}
