package datamigrator.validation;

/**
 * A validation rule that did not pass.
 *
 * @param phaseId the validated phase
 * @param rule the rule name
 * @param stage when the rule ran
 * @param severity the rule severity
 * @param message why it failed
 * @param error the exception the check threw, or null
 */
public record ValidationFailure(String phaseId,
                                String rule,
                                ValidationStage stage,
                                Severity severity,
                                String message,
                                Throwable error) {

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    @Override
    public String toString() {
        return severity + " " + stage + " " + rule + ": " + message;
    }
}
