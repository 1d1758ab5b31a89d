package datamigrator.phase;

import datamigrator.row.RowKey;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * The rows of one table a phase is about to write or delete, as reported by its
 * {@link PhaseHandler} before any write happens.
 *
 * @param table the table the keys belong to
 * @param keys the keys, without duplicates, in the order the phase will touch them
 */
public record AffectedRows(String table, List<RowKey> keys) {

    public AffectedRows {
        Objects.requireNonNull(table, "table");
        keys = List.copyOf(new LinkedHashSet<>(keys));
    }

    public static AffectedRows of(String table, List<RowKey> keys) {
        return new AffectedRows(table, keys);
    }

    public static AffectedRows none(String table) {
        return new AffectedRows(table, new ArrayList<>());
    }

    public int size() {
        return keys.size();
    }
}
