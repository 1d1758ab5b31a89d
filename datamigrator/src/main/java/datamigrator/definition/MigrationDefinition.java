package datamigrator.definition;

import datamigrator.mapping.TransformRegistry;
import datamigrator.phase.MigrationPhase;

import java.util.List;

/**
 * A component's contribution to an upgrade: the transforms its mappings use and
 * the phases it runs once per deployment and once per tenant.
 *
 * @see MigrationComponent
 */
public interface MigrationDefinition {

    /** Returns the id of the component, used as the first part of its tag names. */
    String componentId();

    /** Registers the transforms the definition's mapping rules refer to. */
    default void registerTransforms(TransformRegistry registry) {
    }

    /** Phases run by {@code runPerGlobal()}. */
    default List<MigrationPhase> globalPhases() {
        return List.of();
    }

    /** Phases run by {@code runPerScope(tenantId)} for every tenant. */
    default List<MigrationPhase> tenantPhases() {
        return List.of();
    }
}
