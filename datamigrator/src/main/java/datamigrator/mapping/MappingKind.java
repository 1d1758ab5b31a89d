package datamigrator.mapping;

/**
 * How a mapping produces the value of its target field.
 */
public enum MappingKind {
    /** Copy the source field, widening its type if needed. */
    DIRECT,
    /** Write a fixed value. */
    CONSTANT,
    /** Apply a registered {@link TransformFunction} to the source field. */
    TRANSFORM
}
