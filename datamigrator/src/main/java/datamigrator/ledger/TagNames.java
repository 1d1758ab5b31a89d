package datamigrator.ledger;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Builds ledger tag ids of the form {@code {componentId}-{featureName}-{yyyyMMdd}},
 * for example {@code 50100-CustomerGrade-20250120}.
 */
public final class TagNames {

    private TagNames() {}

    public static String of(String componentId, String featureName, LocalDate date) {
        Objects.requireNonNull(date, "date");
        return requireToken(componentId, "componentId") + '-'
                + requireToken(featureName, "featureName") + '-'
                + date.format(DateTimeFormatter.BASIC_ISO_DATE);
    }

    private static String requireToken(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                throw new IllegalArgumentException(name + " must not contain whitespace: '" + value + "'");
            }
        }
        return value;
    }
}
