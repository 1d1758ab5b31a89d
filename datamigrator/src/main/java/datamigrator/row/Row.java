package datamigrator.row;

import java.util.Map;
import java.util.Set;

/**
 * A tabular record: a set of named field values.
 *
 * <p>This is the only record representation the engine works with, which keeps
 * it independent of any concrete storage technology. Field values are
 * instances of the Java classes listed in {@link FieldType}, or null.
 *
 * <p>Two rows are equal when they hold the same fields with equal values.
 *
 * @see MapRow
 */
public interface Row {

    /**
     * Returns the value of a field.
     *
     * @param fieldId the field id
     * @return the value, or null if the field is absent or null
     */
    Object get(String fieldId);

    /**
     * Sets the value of a field, adding the field if absent.
     *
     * @param fieldId the field id
     * @param value the value (may be null)
     */
    void set(String fieldId, Object value);

    /** Returns true if the row holds the field (possibly with a null value). */
    boolean has(String fieldId);

    /** Returns the ids of all fields in insertion order. */
    Set<String> fieldIds();

    /** Returns an independent copy of this row. */
    Row copy();

    /** Returns an unmodifiable view of the row's fields. */
    Map<String, Object> asMap();
}
