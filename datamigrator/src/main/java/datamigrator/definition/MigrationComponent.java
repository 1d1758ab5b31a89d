package datamigrator.definition;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link MigrationDefinition} for discovery by {@link DefinitionScanner}.
 *
 * <p>The annotated class must implement {@code MigrationDefinition} and have a
 * no-arg constructor.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}MigrationComponent
 * public class CustomerGradeUpgrade implements MigrationDefinition {
 *     public String componentId() { return "50100"; }
 *     public List&lt;MigrationPhase&gt; tenantPhases() { ... }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface MigrationComponent {
}
