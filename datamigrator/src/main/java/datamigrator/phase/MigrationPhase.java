package datamigrator.phase;

import datamigrator.config.MigrationConfig;
import datamigrator.transfer.RowErrorPolicy;
import datamigrator.validation.ValidationRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered, named unit of migration work with its own validation and
 * rollback policy.
 *
 * <p>Phases run in increasing {@link #order()}. A phase starts only when every
 * phase in {@link #dependsOn()} has committed or been skipped. Its ledger tag
 * defaults to its id.
 *
 * <pre>
 * MigrationPhase phase = MigrationPhase.builder("copy-grades")
 *     .name("Copy customer grades")
 *     .order(10)
 *     .tagId(TagNames.of("50100", "CustomerGrade", LocalDate.of(2025, 1, 20)))
 *     .rollbackRequired(true)
 *     .handler(new TransferPhaseHandler(spec))
 *     .rule(ValidationRules.noRowErrors())
 *     .build();
 * </pre>
 */
public final class MigrationPhase {

    private final String id;
    private final String name;
    private final int order;
    private final Set<String> dependsOn;
    private final boolean rollbackRequired;
    private final String tagId;
    private final boolean independent;
    private final RowErrorPolicy rowErrorPolicy;
    private final PhaseHandler handler;
    private final List<ValidationRule> rules;

    private MigrationPhase(Builder b) {
        this.id = b.id;
        this.name = b.name != null ? b.name : b.id;
        this.order = b.order;
        this.dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(b.dependsOn));
        this.rollbackRequired = b.rollbackRequired;
        this.tagId = b.tagId != null ? b.tagId : b.id;
        this.independent = b.independent;
        this.rowErrorPolicy = b.rowErrorPolicy;
        this.handler = b.handler;
        this.rules = List.copyOf(b.rules);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() { return id; }

    public String name() { return name; }

    public int order() { return order; }

    public Set<String> dependsOn() { return dependsOn; }

    public boolean rollbackRequired() { return rollbackRequired; }

    /** Returns the ledger key that marks this phase as applied. */
    public String tagId() { return tagId; }

    /** Returns true if the phase still runs after an earlier phase failed. */
    public boolean independent() { return independent; }

    /** Returns the phase's row-error policy, or null to use the configured default. */
    public RowErrorPolicy rowErrorPolicy() { return rowErrorPolicy; }

    public RowErrorPolicy rowErrorPolicy(MigrationConfig config) {
        return rowErrorPolicy != null ? rowErrorPolicy : config.rowErrorPolicy();
    }

    public PhaseHandler handler() { return handler; }

    public List<ValidationRule> rules() { return rules; }

    @Override
    public String toString() {
        return "MigrationPhase{" + id + ", order=" + order + ", tag=" + tagId +
                (dependsOn.isEmpty() ? "" : ", dependsOn=" + dependsOn) +
                (rollbackRequired ? ", rollbackRequired" : "") +
                (independent ? ", independent" : "") + '}';
    }

    /**
     * Builder for {@link MigrationPhase}.
     */
    public static final class Builder {
        private final String id;
        private String name;
        private int order;
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private boolean rollbackRequired;
        private String tagId;
        private boolean independent;
        private RowErrorPolicy rowErrorPolicy;
        private PhaseHandler handler;
        private final List<ValidationRule> rules = new ArrayList<>();

        private Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("phase id must not be blank");
            }
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder dependsOn(String... phaseIds) {
            for (String phaseId : phaseIds) {
                this.dependsOn.add(Objects.requireNonNull(phaseId, "phaseId"));
            }
            return this;
        }

        public Builder rollbackRequired(boolean rollbackRequired) {
            this.rollbackRequired = rollbackRequired;
            return this;
        }

        public Builder tagId(String tagId) {
            this.tagId = tagId;
            return this;
        }

        public Builder independent(boolean independent) {
            this.independent = independent;
            return this;
        }

        public Builder rowErrorPolicy(RowErrorPolicy policy) {
            this.rowErrorPolicy = policy;
            return this;
        }

        public Builder handler(PhaseHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder rule(ValidationRule rule) {
            this.rules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public MigrationPhase build() {
            if (handler == null) {
                throw new IllegalStateException("Phase " + id + " has no handler");
            }
            if (dependsOn.contains(id)) {
                throw new IllegalStateException("Phase " + id + " depends on itself");
            }
            return new MigrationPhase(this);
        }
    }
}
