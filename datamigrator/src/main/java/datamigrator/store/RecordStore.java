package datamigrator.store;

import datamigrator.row.Row;
import datamigrator.row.RowFilter;
import datamigrator.row.RowKey;

import java.util.List;
import java.util.Optional;

/**
 * Tabular record storage the engine reads from and writes to.
 *
 * <p>The engine makes no assumption about the storage technology. Filters are
 * passed to {@link #find} unmodified. Writes have upsert semantics keyed by the
 * row identity of the target table, so repeating a write is harmless.
 *
 * <p>All methods report failures with {@link StoreException}.
 */
public interface RecordStore {

    /**
     * Reads a single row.
     *
     * @param table the table name
     * @param key the row key
     * @return the row, or empty if no row has the key
     */
    Optional<Row> get(String table, RowKey key);

    /**
     * Opens a cursor over the rows of a table that match a filter.
     *
     * @param table the table name
     * @param filter the filter, passed through unmodified
     * @return an open cursor; the caller must close it
     */
    RowCursor find(String table, RowFilter filter);

    /**
     * Inserts or replaces rows. A single call is atomic: either all rows are
     * written or none is.
     *
     * @param table the table name
     * @param rows the rows to write
     */
    void upsert(String table, List<Row> rows);

    /**
     * Deletes a row. Deleting an absent row is not an error.
     *
     * @param table the table name
     * @param key the row key
     */
    void delete(String table, RowKey key);
}
