package datamigrator.exceptions;

import datamigrator.mapping.MappingViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a set of mapping rules cannot be compiled against its source and
 * target table shapes.
 *
 * <p>The exception carries every violation found, not only the first one, so a
 * migration definition can be corrected in a single pass. It is always fatal and
 * is raised before any row is read or written.
 *
 * @see datamigrator.mapping.FieldMappingCompiler
 */
public class CompileException extends MigrateException {

    private final List<MappingViolation> violations;

    public CompileException(String message, List<MappingViolation> violations) {
        super(message + ": " + describe(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Returns all violations found during compilation.
     *
     * @return an immutable, non-empty list of violations
     */
    public List<MappingViolation> getViolations() {
        return violations;
    }

    private static String describe(List<MappingViolation> violations) {
        return violations.stream()
                .map(MappingViolation::toString)
                .collect(Collectors.joining("; "));
    }
}
