package datamigrator.store;

import datamigrator.row.Row;
import datamigrator.row.RowFilter;
import datamigrator.row.RowKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RecordStore} keeping tables in memory.
 *
 * <p>Each table must be created with its key field before use. Rows are copied
 * on the way in and out, so callers can never alter stored state by mutating a
 * row they hold. Cursors iterate over a copy taken when {@link #find} is called.
 *
 * <p>Thread-safe. Each {@link #upsert} call is applied atomically with respect
 * to other calls on the same table.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    /**
     * Creates an empty table, or does nothing if it exists with the same key field.
     *
     * @param name the table name
     * @param keyField the field holding each row's identity
     * @return this store
     */
    public InMemoryRecordStore createTable(String name, String keyField) {
        Table existing = tables.putIfAbsent(name, new Table(keyField));
        if (existing != null && !existing.keyField.equals(keyField)) {
            throw new StoreException("Table " + name + " already exists with key field " + existing.keyField);
        }
        return this;
    }

    public boolean hasTable(String name) {
        return tables.containsKey(name);
    }

    /** Returns the number of rows in a table. */
    public int count(String table) {
        Table t = table(table);
        synchronized (t) {
            return t.rows.size();
        }
    }

    /** Returns copies of all rows of a table in insertion order. */
    public List<Row> rows(String table) {
        Table t = table(table);
        synchronized (t) {
            List<Row> copy = new ArrayList<>(t.rows.size());
            t.rows.values().forEach(r -> copy.add(r.copy()));
            return copy;
        }
    }

    @Override
    public Optional<Row> get(String table, RowKey key) {
        Table t = table(table);
        synchronized (t) {
            Row row = t.rows.get(key.value());
            return row == null ? Optional.empty() : Optional.of(row.copy());
        }
    }

    @Override
    public RowCursor find(String table, RowFilter filter) {
        Table t = table(table);
        List<Row> matching = new ArrayList<>();
        synchronized (t) {
            for (Row row : t.rows.values()) {
                if (filter.matches(row)) {
                    matching.add(row.copy());
                }
            }
        }
        return RowCursor.of(matching.iterator());
    }

    @Override
    public void upsert(String table, List<Row> rows) {
        Table t = table(table);
        Map<Object, Row> staged = new LinkedHashMap<>();
        for (Row row : rows) {
            Object key = row.get(t.keyField);
            if (key == null) {
                throw new StoreException("Row without key field '" + t.keyField + "' for table " + table + ": " + row);
            }
            staged.put(key, row.copy());
        }
        synchronized (t) {
            t.rows.putAll(staged);
        }
    }

    @Override
    public void delete(String table, RowKey key) {
        Table t = table(table);
        synchronized (t) {
            t.rows.remove(key.value());
        }
    }

    private Table table(String name) {
        Table t = tables.get(name);
        if (t == null) {
            throw new StoreException("Unknown table: " + name);
        }
        return t;
    }

    private static final class Table {
        final String keyField;
        final Map<Object, Row> rows = new LinkedHashMap<>();

        Table(String keyField) {
            this.keyField = keyField;
        }
    }
}
