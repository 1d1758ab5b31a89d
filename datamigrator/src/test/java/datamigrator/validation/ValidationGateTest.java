package datamigrator.validation;

import datamigrator.config.MigrationConfig;
import datamigrator.engine.RunContext;
import datamigrator.exceptions.ValidationException;
import datamigrator.ledger.TagScope;
import datamigrator.phase.MigrationPhase;
import datamigrator.phase.PhaseHandler;
import datamigrator.row.MapRow;
import datamigrator.row.RowFilter;
import datamigrator.row.RowKey;
import datamigrator.store.InMemoryRecordStore;
import datamigrator.transfer.RowError;
import datamigrator.transfer.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("ValidationGate")
class ValidationGateTest {

    InMemoryRecordStore store;
    RunContext ctx;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        store.createTable("customer", "no");
        store.upsert("customer", List.of(
                MapRow.of("no", "C01", "grade", 1),
                MapRow.of("no", "C02", "grade", 2),
                MapRow.of("no", "C03", "grade", 2)));
        ctx = new RunContext(1, TagScope.perTenant("acme"), store, MigrationConfig.DEFAULTS);
    }

    static MigrationPhase phase(ValidationRule... rules) {
        MigrationPhase.Builder builder = MigrationPhase.builder("regrade").handler(mock(PhaseHandler.class));
        for (ValidationRule rule : rules) {
            builder.rule(rule);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("evaluating rules")
    class Evaluating {

        @Test
        @DisplayName("should pass when every rule holds")
        void shouldPass() {
            GateResult result = new ValidationGate(Duration.ZERO)
                    .runPre(phase(ValidationRule.pre("ok", Severity.BLOCKING, input -> true)), ctx);

            assertThat(result.passed()).isTrue();
            assertThat(result.failures()).isEmpty();
        }

        @Test
        @DisplayName("should record a rule returning false")
        void shouldRecordFalse() {
            GateResult result = new ValidationGate(Duration.ZERO)
                    .runPre(phase(ValidationRule.pre("never", Severity.BLOCKING, input -> false)), ctx);

            assertThat(result.passed()).isFalse();
            assertThat(result.blocking()).singleElement()
                    .satisfies(f -> {
                        assertThat(f.phaseId()).isEqualTo("regrade");
                        assertThat(f.rule()).isEqualTo("never");
                        assertThat(f.stage()).isEqualTo(ValidationStage.PRE);
                        assertThat(f.message()).isEqualTo("returned false");
                    });
        }

        @Test
        @DisplayName("should turn a thrown exception into a failure")
        void shouldRecordThrown() {
            GateResult result = new ValidationGate(Duration.ZERO).runPre(phase(
                    ValidationRule.pre("explodes", Severity.BLOCKING, input -> {
                        throw new ValidationException("grade table locked");
                    })), ctx);

            assertThat(result.blocking()).singleElement()
                    .satisfies(f -> {
                        assertThat(f.message()).isEqualTo("threw: grade table locked");
                        assertThat(f.error()).isInstanceOf(ValidationException.class);
                    });
        }

        @Test
        @DisplayName("should fail a rule that runs past the timeout")
        void shouldTimeOut() {
            GateResult result = new ValidationGate(Duration.ofMillis(100)).runPre(phase(
                    ValidationRule.pre("slow", Severity.BLOCKING, input -> {
                        Thread.sleep(5_000);
                        return true;
                    })), ctx);

            assertThat(result.blocking()).singleElement()
                    .satisfies(f -> assertThat(f.message()).isEqualTo("timed out after 100 ms"));
        }

        @Test
        @DisplayName("should run every rule in order even after a failure")
        void shouldRunAllRulesInOrder() {
            List<String> ran = new ArrayList<>();
            GateResult result = new ValidationGate(Duration.ZERO).runPre(phase(
                    ValidationRule.pre("first", Severity.BLOCKING, input -> ran.add("first") && false),
                    ValidationRule.post("post-only", Severity.BLOCKING, input -> ran.add("post-only")),
                    ValidationRule.pre("second", Severity.WARNING, input -> ran.add("second") && false),
                    ValidationRule.pre("third", Severity.BLOCKING, input -> ran.add("third"))), ctx);

            assertThat(ran).containsExactly("first", "second", "third");
            assertThat(result.failures()).extracting(ValidationFailure::rule).containsExactly("first", "second");
        }

        @Test
        @DisplayName("should pass with only warnings")
        void shouldPassWithWarnings() {
            GateResult result = new ValidationGate(Duration.ZERO).runPre(phase(
                    ValidationRule.pre("soft", Severity.WARNING, input -> false)), ctx);

            assertThat(result.passed()).isTrue();
            assertThat(result.warnings()).extracting(ValidationFailure::rule).containsExactly("soft");
            assertThat(result.describeBlocking()).isEmpty();
        }
    }

    @Nested
    @DisplayName("ready-made rules")
    class ReadyMadeRules {

        ValidationGate gate = new ValidationGate(Duration.ZERO);

        @Test
        @DisplayName("should check the source row limit")
        void shouldCheckSourceRowLimit() {
            RowFilter graded = row -> Integer.valueOf(2).equals(row.get("grade"));

            assertThat(gate.runPre(phase(ValidationRules.maxSourceRows("customer", graded, 2)), ctx).passed()).isTrue();
            assertThat(gate.runPre(phase(ValidationRules.maxSourceRows("customer", RowFilter.ALL, 2)), ctx)
                    .describeBlocking()).contains("3 rows in customer exceed the limit of 2");
        }

        @Test
        @DisplayName("should report a missing table")
        void shouldReportMissingTable() {
            GateResult result = gate.runPre(phase(ValidationRules.targetTablePresent("customer_grade")), ctx);

            assertThat(result.describeBlocking()).contains("table customer_grade is not available");
        }

        @Test
        @DisplayName("should compare copied rows with the source count")
        void shouldCheckRowCountParity() {
            MigrationPhase phase = phase(ValidationRules.rowCountParity("customer", RowFilter.ALL));

            assertThat(gate.runPost(phase, ctx, new TransferResult(3, 0, List.of(), 1)).passed()).isTrue();
            assertThat(gate.runPost(phase, ctx, new TransferResult(2, 1, List.of(), 1)).describeBlocking())
                    .contains("expected 3 rows from customer, copied 2");
        }

        @Test
        @DisplayName("should fail on row errors")
        void shouldCheckRowErrors() {
            TransferResult result = new TransferResult(2, 1,
                    List.of(new RowError(RowKey.of("C02"), "bad grade", null)), 1);

            assertThat(gate.runPost(phase(ValidationRules.noRowErrors()), ctx, result).describeBlocking())
                    .contains("1 row errors");
        }

        @Test
        @DisplayName("should find duplicate values")
        void shouldFindDuplicates() {
            assertThat(gate.runPost(phase(ValidationRules.noDuplicateValues("customer", "no")), ctx,
                    TransferResult.empty()).passed()).isTrue();
            assertThat(gate.runPost(phase(ValidationRules.noDuplicateValues("customer", "grade")), ctx,
                    TransferResult.empty()).describeBlocking()).contains("duplicate value '2' in customer.grade");
        }

        @Test
        @DisplayName("should downgrade a rule to a warning")
        void shouldDowngrade() {
            GateResult result = gate.runPost(phase(ValidationRules.noRowErrors().withSeverity(Severity.WARNING)), ctx,
                    new TransferResult(0, 1, List.of(new RowError(null, "no key", null)), 0));

            assertThat(result.passed()).isTrue();
            assertThat(result.warnings()).hasSize(1);
        }
    }
}
