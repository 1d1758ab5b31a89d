package datamigrator.mapping;

import datamigrator.exceptions.CompileException;
import datamigrator.row.FieldType;
import datamigrator.row.MapRow;
import datamigrator.row.Row;
import datamigrator.row.TableShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Checks {@link MappingRule}s against source and target shapes and compiles
 * them into {@link FieldMapping}s.
 *
 * <p>Compilation never stops at the first problem: every rule is checked and
 * all violations are reported together in one {@link CompileException}.
 * A rule set compiles only if:
 * <ul>
 *   <li>every referenced source and target field exists in its shape</li>
 *   <li>direct rules copy between identical or losslessly widening types</li>
 *   <li>constant values have the target field's type (null only for non-key fields)</li>
 *   <li>transforms are registered and their declared types fit both fields</li>
 *   <li>no target field is written by more than one rule</li>
 *   <li>the target key field is written</li>
 * </ul>
 */
public final class FieldMappingCompiler {

    private static final Logger log = LoggerFactory.getLogger(FieldMappingCompiler.class);

    private final TransformRegistry transforms;

    public FieldMappingCompiler(TransformRegistry transforms) {
        this.transforms = Objects.requireNonNull(transforms, "transforms");
    }

    /**
     * Compiles rules into mappings, in rule order.
     *
     * @param source the source table shape
     * @param target the target table shape
     * @param rules the rules, one per target field
     * @return the compiled mappings
     * @throws CompileException listing every violation found
     */
    public List<FieldMapping> compile(TableShape source, TableShape target, List<MappingRule> rules)
            throws CompileException {
        List<MappingViolation> violations = new ArrayList<>();
        List<FieldMapping> mappings = new ArrayList<>(rules.size());
        Set<String> written = new HashSet<>();

        if (rules.isEmpty()) {
            violations.add(new MappingViolation(null, null,
                    "no mapping rules for " + source.name() + " -> " + target.name()));
        }

        for (MappingRule rule : rules) {
            String targetField = rule.targetFieldId();
            if (!written.add(targetField)) {
                violations.add(violation(rule, "target field is written by more than one rule"));
            }
            FieldType targetType = target.typeOf(targetField);
            if (targetType == null) {
                violations.add(violation(rule, "target field does not exist in " + target.name()));
            }
            FieldType sourceType = null;
            if (rule.kind() != MappingKind.CONSTANT) {
                sourceType = source.typeOf(rule.sourceFieldId());
                if (sourceType == null) {
                    violations.add(violation(rule, "source field does not exist in " + source.name()));
                }
            }

            FieldMapping compiled = null;
            switch (rule.kind()) {
                case DIRECT:
                    compiled = compileDirect(rule, sourceType, targetType, violations);
                    break;
                case CONSTANT:
                    compiled = compileConstant(rule, target, targetType, violations);
                    break;
                case TRANSFORM:
                    compiled = compileTransform(rule, sourceType, targetType, violations);
                    break;
                default:
                    violations.add(violation(rule, "unsupported mapping kind " + rule.kind()));
            }
            if (compiled != null) {
                mappings.add(compiled);
            }
        }

        if (!written.contains(target.keyField())) {
            violations.add(new MappingViolation(null, target.keyField(),
                    "target key field is not written by any rule"));
        }

        if (!violations.isEmpty()) {
            throw new CompileException("Invalid mapping " + source.name() + " -> " + target.name(), violations);
        }
        log.debug("Compiled {} mappings for {} -> {}", mappings.size(), source.name(), target.name());
        return List.copyOf(mappings);
    }

    /**
     * Maps a source row through compiled mappings.
     *
     * @param mappings the compiled mappings
     * @param source the source row
     * @return a new target row holding exactly the mapped fields
     * @throws RuntimeException if any mapping fails for this row
     */
    public static Row apply(List<FieldMapping> mappings, Row source) {
        Row target = new MapRow();
        for (FieldMapping mapping : mappings) {
            target.set(mapping.targetFieldId(), mapping.valueFor(source));
        }
        return target;
    }

    private FieldMapping compileDirect(MappingRule rule, FieldType sourceType, FieldType targetType,
                                       List<MappingViolation> violations) {
        if (sourceType == null || targetType == null) {
            return null;
        }
        if (!targetType.acceptsLosslessly(sourceType)) {
            violations.add(violation(rule, "incompatible types " + sourceType + " -> " + targetType));
            return null;
        }
        return new FieldMapping(MappingKind.DIRECT, rule.sourceFieldId(), sourceType,
                rule.targetFieldId(), targetType, null, null);
    }

    private FieldMapping compileConstant(MappingRule rule, TableShape target, FieldType targetType,
                                         List<MappingViolation> violations) {
        if (targetType == null) {
            return null;
        }
        Object value = rule.constantValue();
        if (value == null) {
            if (rule.targetFieldId().equals(target.keyField())) {
                violations.add(violation(rule, "null constant for key field"));
                return null;
            }
            return new FieldMapping(MappingKind.CONSTANT, null, null, rule.targetFieldId(), targetType, null, null);
        }
        FieldType valueType;
        try {
            valueType = FieldType.of(value);
        } catch (IllegalArgumentException e) {
            violations.add(violation(rule, "constant of unsupported type " + value.getClass().getName()));
            return null;
        }
        if (!targetType.acceptsLosslessly(valueType)) {
            violations.add(violation(rule, "constant of type " + valueType + " does not fit " + targetType));
            return null;
        }
        return new FieldMapping(MappingKind.CONSTANT, null, null, rule.targetFieldId(), targetType,
                targetType.convert(value), null);
    }

    private FieldMapping compileTransform(MappingRule rule, FieldType sourceType, FieldType targetType,
                                          List<MappingViolation> violations) {
        Optional<TransformFunction> fn = transforms.find(rule.transformName());
        if (fn.isEmpty()) {
            violations.add(violation(rule, "unknown transform '" + rule.transformName() + "'"));
            return null;
        }
        if (sourceType == null || targetType == null) {
            return null;
        }
        TransformFunction transform = fn.get();
        boolean ok = true;
        if (!transform.inputType().acceptsLosslessly(sourceType)) {
            violations.add(violation(rule, "transform '" + rule.transformName() + "' takes "
                    + transform.inputType() + ", source field is " + sourceType));
            ok = false;
        }
        if (!targetType.acceptsLosslessly(transform.outputType())) {
            violations.add(violation(rule, "transform '" + rule.transformName() + "' returns "
                    + transform.outputType() + ", target field is " + targetType));
            ok = false;
        }
        return ok
                ? new FieldMapping(MappingKind.TRANSFORM, rule.sourceFieldId(), sourceType,
                        rule.targetFieldId(), targetType, null, transform)
                : null;
    }

    private static MappingViolation violation(MappingRule rule, String message) {
        return new MappingViolation(rule.sourceFieldId(), rule.targetFieldId(), message);
    }
}
