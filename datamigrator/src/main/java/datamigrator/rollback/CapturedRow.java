package datamigrator.rollback;

import datamigrator.row.Row;
import datamigrator.row.RowKey;

import java.util.Objects;

/**
 * Before-image of one row, captured ahead of a phase's writes.
 *
 * @param key the row key
 * @param beforeImage the row as it was, or null if no row had the key
 */
public record CapturedRow(RowKey key, Row beforeImage) {

    public CapturedRow {
        Objects.requireNonNull(key, "key");
        beforeImage = beforeImage == null ? null : beforeImage.copy();
    }

    public static CapturedRow present(RowKey key, Row beforeImage) {
        return new CapturedRow(key, Objects.requireNonNull(beforeImage, "beforeImage"));
    }

    public static CapturedRow absent(RowKey key) {
        return new CapturedRow(key, null);
    }

    /** Returns true if a row existed before the phase ran. */
    public boolean existed() {
        return beforeImage != null;
    }
}
