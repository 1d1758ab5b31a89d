package datamigrator.validation;

import java.util.Objects;

/**
 * A named check attached to a phase, run before or after its transfer.
 *
 * <p>Use {@link ValidationRules} for the common checks.
 */
public final class ValidationRule {

    private final String name;
    private final ValidationStage stage;
    private final Severity severity;
    private final ValidationCheck check;

    private ValidationRule(String name, ValidationStage stage, Severity severity, ValidationCheck check) {
        this.name = Objects.requireNonNull(name, "name");
        this.stage = Objects.requireNonNull(stage, "stage");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.check = Objects.requireNonNull(check, "check");
    }

    public static ValidationRule of(String name, ValidationStage stage, Severity severity, ValidationCheck check) {
        return new ValidationRule(name, stage, severity, check);
    }

    public static ValidationRule pre(String name, Severity severity, ValidationCheck check) {
        return new ValidationRule(name, ValidationStage.PRE, severity, check);
    }

    public static ValidationRule post(String name, Severity severity, ValidationCheck check) {
        return new ValidationRule(name, ValidationStage.POST, severity, check);
    }

    /** Returns a copy of this rule with another severity. */
    public ValidationRule withSeverity(Severity severity) {
        return new ValidationRule(name, stage, severity, check);
    }

    public String name() { return name; }

    public ValidationStage stage() { return stage; }

    public Severity severity() { return severity; }

    public ValidationCheck check() { return check; }

    @Override
    public String toString() {
        return "ValidationRule{" + name + ", " + stage + ", " + severity + '}';
    }
}
