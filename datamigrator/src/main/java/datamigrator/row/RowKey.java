package datamigrator.row;

import java.util.Objects;

/**
 * Identity of a row within a table: the value of the table's key field.
 *
 * @param value the key value (never null)
 */
public record RowKey(Object value) {

    public RowKey {
        Objects.requireNonNull(value, "key value");
    }

    public static RowKey of(Object value) {
        return new RowKey(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
