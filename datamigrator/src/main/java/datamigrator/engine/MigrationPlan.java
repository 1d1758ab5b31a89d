package datamigrator.engine;

import datamigrator.definition.MigrationDefinition;
import datamigrator.exceptions.MigrateException;
import datamigrator.phase.MigrationPhase;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, validated list of phases in execution order.
 *
 * <p>Plans are built using {@link #build(List)}, which validates that:
 * <ul>
 *   <li>phase ids are unique</li>
 *   <li>ledger tag ids are unique</li>
 *   <li>orders are unique</li>
 *   <li>every dependency exists and has a lower order than its dependent</li>
 * </ul>
 * The last rule also rules out dependency cycles.
 */
public final class MigrationPlan {

    private static final MigrationPlan EMPTY = new MigrationPlan(List.of());

    private final List<MigrationPhase> phases;
    private final Map<String, MigrationPhase> byId;

    private MigrationPlan(List<MigrationPhase> phases) {
        this.phases = List.copyOf(phases);
        Map<String, MigrationPhase> index = new LinkedHashMap<>();
        phases.forEach(p -> index.put(p.id(), p));
        this.byId = Map.copyOf(index);
    }

    public static MigrationPlan empty() {
        return EMPTY;
    }

    /** Returns the phases in execution order. */
    public List<MigrationPhase> phases() {
        return phases;
    }

    /**
     * Looks up a phase.
     *
     * @return the phase, or null if the plan has no such phase
     */
    public MigrationPhase phase(String phaseId) {
        return byId.get(phaseId);
    }

    public boolean isEmpty() {
        return phases.isEmpty();
    }

    /**
     * Validates phases and orders them.
     *
     * @param phases the phases, in any order
     * @return the plan
     * @throws MigrateException if validation fails
     */
    public static MigrationPlan build(List<MigrationPhase> phases) throws MigrateException {
        Objects.requireNonNull(phases, "phases");

        Map<String, MigrationPhase> byId = new HashMap<>();
        Map<String, String> phaseByTag = new HashMap<>();
        Map<Integer, String> phaseByOrder = new HashMap<>();

        for (MigrationPhase p : phases) {
            if (byId.putIfAbsent(p.id(), p) != null) {
                throw new MigrateException("Duplicate phase id: " + p.id());
            }
            String other = phaseByTag.putIfAbsent(p.tagId(), p.id());
            if (other != null) {
                throw new MigrateException("Phases " + other + " and " + p.id() + " share tag " + p.tagId());
            }
            other = phaseByOrder.putIfAbsent(p.order(), p.id());
            if (other != null) {
                throw new MigrateException("Phases " + other + " and " + p.id() + " share order " + p.order());
            }
        }

        for (MigrationPhase p : phases) {
            for (String dep : p.dependsOn()) {
                MigrationPhase target = byId.get(dep);
                if (target == null) {
                    throw new MigrateException("Phase " + p.id() + " depends on unknown phase " + dep);
                }
                if (target.order() >= p.order()) {
                    throw new MigrateException("Phase " + p.id() + " (order " + p.order()
                            + ") depends on " + dep + " which does not run earlier (order " + target.order() + ")");
                }
            }
        }

        List<MigrationPhase> ordered = new ArrayList<>(phases);
        ordered.sort(Comparator.comparingInt(MigrationPhase::order));
        return new MigrationPlan(ordered);
    }

    /**
     * Builds a plan from the phases of migration definitions.
     *
     * @param definitions the definitions
     * @param global true for the once-per-deployment phases, false for the per-tenant phases
     * @return the plan
     * @throws MigrateException if the combined phases are invalid
     */
    public static MigrationPlan fromDefinitions(List<MigrationDefinition> definitions, boolean global)
            throws MigrateException {
        List<MigrationPhase> phases = new ArrayList<>();
        for (MigrationDefinition definition : definitions) {
            phases.addAll(global ? definition.globalPhases() : definition.tenantPhases());
        }
        return build(phases);
    }

    @Override
    public String toString() {
        List<String> ids = new ArrayList<>();
        phases.forEach(p -> ids.add(p.id()));
        return "MigrationPlan" + ids;
    }
}
