package datamigrator.validation;

/**
 * Predicate evaluated by a {@link ValidationRule}.
 *
 * <p>Returning false fails the rule. Throwing fails it too, with the
 * exception's message; {@link datamigrator.exceptions.ValidationException} is
 * the conventional way to report a failure with details.
 */
@FunctionalInterface
public interface ValidationCheck {

    boolean check(ValidationInput input) throws Exception;
}
