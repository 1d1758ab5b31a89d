package datamigrator.mapping;

import java.util.Objects;

/**
 * Declarative, uncompiled description of how one target field is produced.
 *
 * <p>Rules are checked against the source and target {@link datamigrator.row.TableShape}
 * by {@link FieldMappingCompiler}, which turns them into {@link FieldMapping}s.
 *
 * @param kind the mapping kind
 * @param sourceFieldId the source field, null for {@link MappingKind#CONSTANT}
 * @param targetFieldId the target field
 * @param constantValue the value written by a constant rule (may be null)
 * @param transformName the registered transform name, for {@link MappingKind#TRANSFORM}
 */
public record MappingRule(MappingKind kind,
                          String sourceFieldId,
                          String targetFieldId,
                          Object constantValue,
                          String transformName) {

    public MappingRule {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(targetFieldId, "targetFieldId");
    }

    public static MappingRule direct(String sourceFieldId, String targetFieldId) {
        return new MappingRule(MappingKind.DIRECT, Objects.requireNonNull(sourceFieldId, "sourceFieldId"),
                targetFieldId, null, null);
    }

    /** Copies a field to a target field of the same name. */
    public static MappingRule direct(String fieldId) {
        return direct(fieldId, fieldId);
    }

    public static MappingRule constant(String targetFieldId, Object value) {
        return new MappingRule(MappingKind.CONSTANT, null, targetFieldId, value, null);
    }

    public static MappingRule transform(String sourceFieldId, String targetFieldId, String transformName) {
        return new MappingRule(MappingKind.TRANSFORM, Objects.requireNonNull(sourceFieldId, "sourceFieldId"),
                targetFieldId, null, Objects.requireNonNull(transformName, "transformName"));
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONSTANT:
                return "constant(" + constantValue + ") -> " + targetFieldId;
            case TRANSFORM:
                return sourceFieldId + " -[" + transformName + "]-> " + targetFieldId;
            default:
                return sourceFieldId + " -> " + targetFieldId;
        }
    }
}
