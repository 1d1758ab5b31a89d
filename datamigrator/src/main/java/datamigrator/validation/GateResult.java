package datamigrator.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of running the rules of one stage.
 *
 * @param stage the stage that ran
 * @param failures every failed rule, in rule order
 */
public record GateResult(ValidationStage stage, List<ValidationFailure> failures) {

    public GateResult {
        failures = List.copyOf(failures);
    }

    public static GateResult passed(ValidationStage stage) {
        return new GateResult(stage, List.of());
    }

    /** Returns true if no blocking rule failed. */
    public boolean passed() {
        return failures.stream().noneMatch(ValidationFailure::isBlocking);
    }

    public List<ValidationFailure> blocking() {
        return failures.stream().filter(ValidationFailure::isBlocking).collect(Collectors.toList());
    }

    public List<ValidationFailure> warnings() {
        return failures.stream().filter(f -> !f.isBlocking()).collect(Collectors.toList());
    }

    /** Joins the blocking failures into one message. */
    public String describeBlocking() {
        return blocking().stream().map(ValidationFailure::toString).collect(Collectors.joining("; "));
    }
}
