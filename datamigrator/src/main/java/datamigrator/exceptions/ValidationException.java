package datamigrator.exceptions;

/**
 * Exception a validation check may throw when it cannot reach a verdict.
 *
 * <p>The validation gate records a thrown exception as a failure of the rule,
 * using the exception message, and applies the rule's severity to it.
 *
 * @see datamigrator.validation.ValidationCheck
 * @see datamigrator.validation.ValidationGate
 */
public class ValidationException extends Exception {

    /** Creates a new validation exception with no message. */
    public ValidationException() { super(); }

    /**
     * Creates a new validation exception with the specified message.
     *
     * @param message a description of the validation failure
     */
    public ValidationException(String message) { super(message); }

    /**
     * Creates a new validation exception with the specified message and cause.
     *
     * @param message a description of the validation failure
     * @param cause the underlying exception that caused the validation to fail
     */
    public ValidationException(String message, Throwable cause) { super(message, cause); }
}
