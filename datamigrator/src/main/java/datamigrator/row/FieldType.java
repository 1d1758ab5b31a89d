package datamigrator.row;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Value types a field of a {@link TableShape} can have.
 *
 * <p>Conversions between types are allowed only when they are lossless:
 * <ul>
 *   <li>{@link #INTEGER} widens to {@link #LONG} and {@link #DECIMAL}</li>
 *   <li>{@link #LONG} widens to {@link #DECIMAL}</li>
 *   <li>{@link #DATE} widens to {@link #TIMESTAMP} (start of day, UTC)</li>
 * </ul>
 * Every type converts to itself. All other pairs are incompatible.
 */
public enum FieldType {

    STRING(String.class),
    INTEGER(Integer.class),
    LONG(Long.class),
    DECIMAL(BigDecimal.class),
    BOOLEAN(Boolean.class),
    DATE(LocalDate.class),
    TIMESTAMP(Instant.class);

    private final Class<?> javaType;

    FieldType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /** Returns the Java class values of this type are represented with. */
    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Returns true if a value of type {@code source} can be stored in a field of
     * this type without losing information.
     *
     * @param source the type of the value
     * @return true if the conversion is lossless
     */
    public boolean acceptsLosslessly(FieldType source) {
        if (source == this) return true;
        switch (this) {
            case LONG:
                return source == INTEGER;
            case DECIMAL:
                return source == INTEGER || source == LONG;
            case TIMESTAMP:
                return source == DATE;
            default:
                return false;
        }
    }

    /**
     * Returns true if {@code value} is null or an instance of this type's Java class.
     */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }

    /**
     * Converts a value to this type.
     *
     * @param value the value to convert (may be null)
     * @return the converted value, or null if {@code value} is null
     * @throws IllegalArgumentException if the value's type does not widen to this type
     */
    public Object convert(Object value) {
        if (value == null || javaType.isInstance(value)) {
            return value;
        }
        FieldType source = of(value);
        if (!acceptsLosslessly(source)) {
            throw new IllegalArgumentException(
                    "Cannot convert " + source + " value '" + value + "' to " + this);
        }
        switch (this) {
            case LONG:
                return ((Integer) value).longValue();
            case DECIMAL:
                return BigDecimal.valueOf(((Number) value).longValue());
            case TIMESTAMP:
                return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
            default:
                throw new IllegalStateException("Unhandled conversion " + source + " -> " + this);
        }
    }

    /**
     * Renders a value of this type as text; inverse of {@link #parse(String)}.
     */
    public String format(Object value) {
        if (value == null) return null;
        if (this == DECIMAL) return ((BigDecimal) value).toPlainString();
        return value.toString();
    }

    /**
     * Parses text produced by {@link #format(Object)}.
     */
    public Object parse(String text) {
        if (text == null) return null;
        switch (this) {
            case STRING:
                return text;
            case INTEGER:
                return Integer.valueOf(text);
            case LONG:
                return Long.valueOf(text);
            case DECIMAL:
                return new BigDecimal(text);
            case BOOLEAN:
                return Boolean.valueOf(text);
            case DATE:
                return LocalDate.parse(text);
            case TIMESTAMP:
                return Instant.parse(text);
            default:
                throw new IllegalStateException("Unhandled type " + this);
        }
    }

    /**
     * Infers the field type of a non-null value.
     *
     * @param value the value
     * @return the matching field type
     * @throws IllegalArgumentException if the value's class is not a supported field type
     */
    public static FieldType of(Object value) {
        for (FieldType type : values()) {
            if (type.javaType.isInstance(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "Unsupported field value type: " + (value == null ? "null" : value.getClass().getName()));
    }
}
