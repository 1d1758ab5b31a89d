package datamigrator.mapping;

import datamigrator.row.FieldType;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed value conversion used by {@link MappingKind#TRANSFORM} rules.
 *
 * <p>The declared input and output types let the compiler check a transform
 * against the source and target shapes before any row is read. A function that
 * throws, or returns a value that is not of its output type, produces a row
 * error for the row being mapped.
 */
public interface TransformFunction {

    FieldType inputType();

    FieldType outputType();

    /**
     * Applies the function.
     *
     * @param value a value of {@link #inputType()}, or null
     * @return a value of {@link #outputType()}, or null
     */
    Object apply(Object value);

    /**
     * Creates a transform from a lambda.
     *
     * <pre>
     * TransformFunction grade = TransformFunction.of(FieldType.DECIMAL, FieldType.STRING,
     *     (BigDecimal revenue) -&gt; revenue.compareTo(THRESHOLD) &gt;= 0 ? "GOLD" : "STANDARD");
     * </pre>
     */
    @SuppressWarnings("unchecked")
    static <I, O> TransformFunction of(FieldType inputType, FieldType outputType, Function<I, O> fn) {
        Objects.requireNonNull(inputType, "inputType");
        Objects.requireNonNull(outputType, "outputType");
        Objects.requireNonNull(fn, "fn");
        return new TransformFunction() {
            @Override
            public FieldType inputType() {
                return inputType;
            }

            @Override
            public FieldType outputType() {
                return outputType;
            }

            @Override
            public Object apply(Object value) {
                return fn.apply((I) value);
            }

            @Override
            public String toString() {
                return "TransformFunction{" + inputType + " -> " + outputType + '}';
            }
        };
    }
}
