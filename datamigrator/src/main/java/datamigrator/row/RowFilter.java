package datamigrator.row;

/**
 * Predicate selecting the rows a transfer or purge works on.
 *
 * <p>The engine treats filters as opaque: they are handed to the record store
 * unchanged, so a store may translate known filter implementations into its own
 * query language.
 */
@FunctionalInterface
public interface RowFilter {

    /** Filter that matches every row. */
    RowFilter ALL = row -> true;

    boolean matches(Row row);

    default RowFilter and(RowFilter other) {
        return row -> matches(row) && other.matches(row);
    }

    default RowFilter negate() {
        return row -> !matches(row);
    }
}
