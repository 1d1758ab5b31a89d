package datamigrator.row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declared shape of a table: its name, key field and typed fields.
 *
 * <p>Shapes are supplied by migration definitions and used by the
 * {@link datamigrator.mapping.FieldMappingCompiler} to check rules before any
 * row is touched.
 *
 * <pre>
 * TableShape customers = TableShape.builder("customer")
 *     .key("id", FieldType.LONG)
 *     .field("name", FieldType.STRING)
 *     .field("grade", FieldType.STRING)
 *     .build();
 * </pre>
 */
public final class TableShape {

    private final String name;
    private final String keyField;
    private final Map<String, FieldType> fields;

    private TableShape(Builder b) {
        this.name = b.name;
        this.keyField = b.keyField;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Returns the table name. */
    public String name() { return name; }

    /** Returns the id of the key field. */
    public String keyField() { return keyField; }

    /** Returns all fields in declaration order. */
    public Map<String, FieldType> fields() { return fields; }

    public boolean hasField(String fieldId) {
        return fields.containsKey(fieldId);
    }

    /**
     * Returns the type of a field.
     *
     * @param fieldId the field id
     * @return the field type, or null if the shape has no such field
     */
    public FieldType typeOf(String fieldId) {
        return fields.get(fieldId);
    }

    /**
     * Extracts the key of a row of this shape.
     *
     * @param row the row
     * @return the row key
     * @throws IllegalArgumentException if the row has no key value
     */
    public RowKey keyOf(Row row) {
        Object value = row.get(keyField);
        if (value == null) {
            throw new IllegalArgumentException("Row has no value for key field '" + keyField + "' of " + name);
        }
        return RowKey.of(value);
    }

    @Override
    public String toString() {
        return "TableShape{" + name + ", key=" + keyField + ", fields=" + fields + '}';
    }

    /**
     * Builder for {@link TableShape}.
     */
    public static final class Builder {
        private final String name;
        private String keyField;
        private final Map<String, FieldType> fields = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder key(String fieldId, FieldType type) {
            this.keyField = fieldId;
            return field(fieldId, type);
        }

        public Builder field(String fieldId, FieldType type) {
            if (fields.putIfAbsent(Objects.requireNonNull(fieldId, "fieldId"), Objects.requireNonNull(type, "type")) != null) {
                throw new IllegalArgumentException("Duplicate field '" + fieldId + "' in shape " + name);
            }
            return this;
        }

        public TableShape build() {
            if (keyField == null) {
                throw new IllegalStateException("Shape " + name + " has no key field");
            }
            return new TableShape(this);
        }
    }
}
