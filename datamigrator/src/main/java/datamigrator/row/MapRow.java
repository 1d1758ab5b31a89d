package datamigrator.row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link Row} backed by an insertion-ordered map. Not thread-safe.
 */
public final class MapRow implements Row {

    private final Map<String, Object> values;

    public MapRow() {
        this.values = new LinkedHashMap<>();
    }

    public MapRow(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(values);
    }

    /**
     * Creates a row from alternating field ids and values.
     *
     * <pre>
     * Row row = MapRow.of("id", 1, "name", "Alice");
     * </pre>
     *
     * @param fieldsAndValues field id, value, field id, value, ...
     * @return a new row
     * @throws IllegalArgumentException if the argument count is odd or an id is not a string
     */
    public static MapRow of(Object... fieldsAndValues) {
        if (fieldsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected field/value pairs, got " + fieldsAndValues.length + " arguments");
        }
        MapRow row = new MapRow();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            if (!(fieldsAndValues[i] instanceof String)) {
                throw new IllegalArgumentException("Field id at position " + i + " is not a String");
            }
            row.set((String) fieldsAndValues[i], fieldsAndValues[i + 1]);
        }
        return row;
    }

    @Override
    public Object get(String fieldId) {
        return values.get(fieldId);
    }

    @Override
    public void set(String fieldId, Object value) {
        values.put(Objects.requireNonNull(fieldId, "fieldId"), value);
    }

    @Override
    public boolean has(String fieldId) {
        return values.containsKey(fieldId);
    }

    @Override
    public Set<String> fieldIds() {
        return Collections.unmodifiableSet(values.keySet());
    }

    @Override
    public Row copy() {
        return new MapRow(values);
    }

    @Override
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).asMap());
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
