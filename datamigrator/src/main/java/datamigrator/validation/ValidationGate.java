package datamigrator.validation;

import datamigrator.engine.RunContext;
import datamigrator.engine.TimeoutExecutor;
import datamigrator.exceptions.MigrationTimeoutException;
import datamigrator.phase.MigrationPhase;
import datamigrator.transfer.TransferResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a phase's validation rules before and after its transfer.
 *
 * <p>All rules of the requested stage run, in declaration order, even after a
 * failure, so the result lists everything that is wrong. Each rule is
 * isolated: a rule that returns false, throws, or exceeds the configured
 * timeout becomes a {@link ValidationFailure} with its severity.
 *
 * <h2>Usage:</h2>
 * <pre>
 * ValidationGate gate = new ValidationGate(Duration.ofSeconds(30));
 * GateResult pre = gate.runPre(phase, ctx);
 * if (!pre.passed()) {
 *     // fail the phase
 * }
 * </pre>
 */
public class ValidationGate {

    private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);

    private final Duration checkTimeout;

    /**
     * @param checkTimeout timeout per check, or zero for none
     */
    public ValidationGate(Duration checkTimeout) {
        this.checkTimeout = checkTimeout;
    }

    public GateResult runPre(MigrationPhase phase, RunContext ctx) {
        return run(ValidationStage.PRE, new ValidationInput(phase, ctx, null));
    }

    public GateResult runPost(MigrationPhase phase, RunContext ctx, TransferResult result) {
        return run(ValidationStage.POST, new ValidationInput(phase, ctx, result));
    }

    private GateResult run(ValidationStage stage, ValidationInput input) {
        String phaseId = input.phase().id();
        List<ValidationFailure> failures = new ArrayList<>();
        for (ValidationRule rule : input.phase().rules()) {
            if (rule.stage() != stage) {
                continue;
            }
            ValidationFailure failure = evaluate(phaseId, rule, input);
            if (failure != null) {
                log.debug("Phase {} {} rule {} failed: {}", phaseId, stage, rule.name(), failure.message());
                failures.add(failure);
            }
        }
        return new GateResult(stage, failures);
    }

    private ValidationFailure evaluate(String phaseId, ValidationRule rule, ValidationInput input) {
        String operation = "validation " + phaseId + "/" + rule.name();
        try {
            boolean ok = TimeoutExecutor.executeWithTimeout(operation, checkTimeout,
                    () -> rule.check().check(input));
            return ok ? null : failure(phaseId, rule, "returned false", null);
        } catch (MigrationTimeoutException e) {
            return failure(phaseId, rule, "timed out after " + e.getTimeout().toMillis() + " ms", e);
        } catch (Exception e) {
            return failure(phaseId, rule, "threw: " + e.getMessage(), e);
        }
    }

    private static ValidationFailure failure(String phaseId, ValidationRule rule, String message, Throwable error) {
        return new ValidationFailure(phaseId, rule.name(), rule.stage(), rule.severity(), message, error);
    }
}
