package datamigrator.mapping;

import datamigrator.row.FieldType;
import datamigrator.row.Row;

/**
 * A compiled mapping: produces the value of one target field from a source row.
 *
 * <p>Instances are immutable and only created by {@link FieldMappingCompiler}
 * after their types were checked. {@link #valueFor(Row)} can still fail for an
 * individual row whose data does not match its declared shape, or whose
 * transform throws; the executor records such failures as row errors.
 */
public final class FieldMapping {

    private final MappingKind kind;
    private final String sourceFieldId;
    private final FieldType sourceType;
    private final String targetFieldId;
    private final FieldType targetType;
    private final Object constantValue;
    private final TransformFunction transform;

    FieldMapping(MappingKind kind, String sourceFieldId, FieldType sourceType,
                 String targetFieldId, FieldType targetType,
                 Object constantValue, TransformFunction transform) {
        this.kind = kind;
        this.sourceFieldId = sourceFieldId;
        this.sourceType = sourceType;
        this.targetFieldId = targetFieldId;
        this.targetType = targetType;
        this.constantValue = constantValue;
        this.transform = transform;
    }

    public MappingKind kind() { return kind; }

    public String sourceFieldId() { return sourceFieldId; }

    public String targetFieldId() { return targetFieldId; }

    public FieldType targetType() { return targetType; }

    public Object constantValue() { return constantValue; }

    public TransformFunction transform() { return transform; }

    /**
     * Computes the target value for a source row.
     *
     * @param source the source row
     * @return the value to write, converted to the target type
     * @throws IllegalArgumentException if the source value or transform result has the wrong type
     * @throws RuntimeException anything the transform throws
     */
    public Object valueFor(Row source) {
        switch (kind) {
            case CONSTANT:
                return constantValue;
            case DIRECT:
                return targetType.convert(sourceValue(source));
            case TRANSFORM:
                Object input = transform.inputType().convert(sourceValue(source));
                Object output = transform.apply(input);
                if (!transform.outputType().accepts(output)) {
                    throw new IllegalArgumentException("Transform for " + targetFieldId + " returned "
                            + output.getClass().getSimpleName() + ", declared " + transform.outputType());
                }
                return targetType.convert(output);
            default:
                throw new IllegalStateException("Unhandled mapping kind " + kind);
        }
    }

    private Object sourceValue(Row source) {
        Object value = source.get(sourceFieldId);
        if (!sourceType.accepts(value)) {
            throw new IllegalArgumentException("Field " + sourceFieldId + " holds "
                    + value.getClass().getSimpleName() + ", declared " + sourceType);
        }
        return value;
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONSTANT:
                return "FieldMapping{constant(" + constantValue + ") -> " + targetFieldId + '}';
            case TRANSFORM:
                return "FieldMapping{" + sourceFieldId + " -[" + transform + "]-> " + targetFieldId + '}';
            default:
                return "FieldMapping{" + sourceFieldId + " -> " + targetFieldId + '}';
        }
    }
}
