package datamigrator.engine;

import datamigrator.definition.MigrationDefinition;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Instantiates migration definitions found by classpath scanning.
 *
 * <p>Annotated classes must implement {@link MigrationDefinition} and have a
 * no-arg constructor. Definitions are returned sorted by class name, so the
 * result does not depend on scan order.
 *
 * @see datamigrator.definition.DefinitionScanner
 */
public final class ComponentResolver {

    /**
     * Instantiates every class.
     *
     * @param types classes annotated with {@code @MigrationComponent}
     * @return one instance per class
     * @throws IllegalStateException if a class is invalid or cannot be instantiated
     */
    public List<MigrationDefinition> resolveDefinitions(Set<Class<?>> types) {
        List<Class<?>> sorted = new ArrayList<>(types);
        sorted.sort(Comparator.comparing(Class::getName));
        List<MigrationDefinition> definitions = new ArrayList<>(sorted.size());
        for (Class<?> type : sorted) {
            definitions.add(instantiate(type, MigrationDefinition.class, "@MigrationComponent"));
        }
        return definitions;
    }

    private <T> T instantiate(
            Class<?> type,
            Class<T> expectedInterface,
            String annotationName
    ) {
        if (!expectedInterface.isAssignableFrom(type)) {
            throw new IllegalStateException(
                    annotationName + " must implement " + expectedInterface.getSimpleName()
                            + ": " + type.getName()
            );
        }

        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            return expectedInterface.cast(ctor.newInstance());
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException(
                    type.getName() + " must have a no-arg constructor", e
            );
        } catch (Exception e) {
            throw new IllegalStateException(
                    "Failed to instantiate " + type.getName(), e
            );
        }
    }
}
