package datamigrator.validation;

import datamigrator.exceptions.ValidationException;
import datamigrator.row.RowFilter;
import datamigrator.store.RecordStore;
import datamigrator.store.RowCursor;
import datamigrator.store.StoreException;
import datamigrator.transfer.TransferResult;

import java.util.HashSet;
import java.util.Set;

/**
 * Ready-made validation rules. All are {@link Severity#BLOCKING}; use
 * {@link ValidationRule#withSeverity} to downgrade one to a warning.
 */
public final class ValidationRules {

    private ValidationRules() {}

    /**
     * Pre-check that at most {@code max} rows of a table match a filter.
     */
    public static ValidationRule maxSourceRows(String table, RowFilter filter, long max) {
        return ValidationRule.pre("maxSourceRows(" + table + ")", Severity.BLOCKING, input -> {
            long count = count(input.store(), table, filter);
            if (count > max) {
                throw new ValidationException(count + " rows in " + table + " exceed the limit of " + max);
            }
            return true;
        });
    }

    /**
     * Pre-check that a table can be read.
     */
    public static ValidationRule targetTablePresent(String table) {
        return ValidationRule.pre("targetTablePresent(" + table + ")", Severity.BLOCKING, input -> {
            try (RowCursor cursor = input.store().find(table, RowFilter.ALL)) {
                cursor.hasNext();
                return true;
            } catch (StoreException e) {
                throw new ValidationException("table " + table + " is not available: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Post-check that every source row matching the filter was copied.
     */
    public static ValidationRule rowCountParity(String sourceTable, RowFilter filter) {
        return ValidationRule.post("rowCountParity(" + sourceTable + ")", Severity.BLOCKING, input -> {
            TransferResult result = requireResult(input);
            long expected = count(input.store(), sourceTable, filter);
            if (expected != result.copied()) {
                throw new ValidationException("expected " + expected + " rows from " + sourceTable
                        + ", copied " + result.copied());
            }
            return true;
        });
    }

    /**
     * Post-check that the transfer had no row errors.
     */
    public static ValidationRule noRowErrors() {
        return ValidationRule.post("noRowErrors", Severity.BLOCKING, input -> {
            TransferResult result = requireResult(input);
            if (result.rowErrors() > 0) {
                throw new ValidationException(result.rowErrors() + " row errors, first: " + result.errors().get(0));
            }
            return true;
        });
    }

    /**
     * Post-check that no two rows of a table hold the same non-null value in a field.
     */
    public static ValidationRule noDuplicateValues(String table, String fieldId) {
        return ValidationRule.post("noDuplicateValues(" + table + "." + fieldId + ")", Severity.BLOCKING, input -> {
            Set<Object> seen = new HashSet<>();
            try (RowCursor cursor = input.store().find(table, RowFilter.ALL)) {
                while (cursor.hasNext()) {
                    Object value = cursor.next().get(fieldId);
                    if (value != null && !seen.add(value)) {
                        throw new ValidationException("duplicate value '" + value + "' in " + table + "." + fieldId);
                    }
                }
            }
            return true;
        });
    }

    static long count(RecordStore store, String table, RowFilter filter) {
        long count = 0;
        try (RowCursor cursor = store.find(table, filter)) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
        }
        return count;
    }

    private static TransferResult requireResult(ValidationInput input) throws ValidationException {
        return input.result().orElseThrow(() -> new ValidationException("no transfer result to validate"));
    }
}
