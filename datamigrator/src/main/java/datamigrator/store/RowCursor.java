package datamigrator.store;

import datamigrator.row.Row;

import java.util.Iterator;

/**
 * Forward-only cursor over the rows returned by {@link RecordStore#find}.
 *
 * <p>Cursors hold store resources and must be closed; use try-with-resources.
 */
public interface RowCursor extends Iterator<Row>, AutoCloseable {

    @Override
    void close();

    /**
     * Wraps an iterator that holds no resources.
     */
    static RowCursor of(Iterator<Row> rows) {
        return new RowCursor() {
            @Override
            public boolean hasNext() {
                return rows.hasNext();
            }

            @Override
            public Row next() {
                return rows.next();
            }

            @Override
            public void close() {
                // nothing to release
            }
        };
    }
}
