package upgrade.components;

import datamigrator.definition.MigrationComponent;
import datamigrator.definition.MigrationDefinition;
import datamigrator.ledger.TagNames;
import datamigrator.mapping.MappingRule;
import datamigrator.mapping.TransformFunction;
import datamigrator.mapping.TransformRegistry;
import datamigrator.phase.MigrationPhase;
import datamigrator.phase.PurgePhaseHandler;
import datamigrator.phase.TransferPhaseHandler;
import datamigrator.row.FieldType;
import datamigrator.row.TableShape;
import datamigrator.transfer.RowErrorPolicy;
import datamigrator.transfer.TransferSpec;
import datamigrator.validation.Severity;
import datamigrator.validation.ValidationRules;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Replaces the legacy customer table by a graded one.
 *
 * <p>Once per deployment the grade levels are copied from the setup table. For
 * every tenant the legacy customers are then graded by revenue into
 * {@code customer_grade}, and blocked legacy customers are purged.
 */
@MigrationComponent
public class CustomerGradeUpgrade implements MigrationDefinition {

    public static final String COMPONENT_ID = "50100";
    public static final LocalDate RELEASED = LocalDate.of(2025, 1, 20);

    public static final TableShape GRADE_LEVEL_SETUP = TableShape.builder("grade_level_setup")
            .key("code", FieldType.STRING)
            .field("min_revenue", FieldType.DECIMAL)
            .field("description", FieldType.STRING)
            .build();

    public static final TableShape GRADE_LEVEL = TableShape.builder("grade_level")
            .key("code", FieldType.STRING)
            .field("min_revenue", FieldType.DECIMAL)
            .field("description", FieldType.STRING)
            .build();

    public static final TableShape LEGACY_CUSTOMER = TableShape.builder("legacy_customer")
            .key("no", FieldType.STRING)
            .field("name", FieldType.STRING)
            .field("revenue", FieldType.DECIMAL)
            .field("since", FieldType.DATE)
            .field("blocked", FieldType.BOOLEAN)
            .build();

    public static final TableShape CUSTOMER_GRADE = TableShape.builder("customer_grade")
            .key("customer_no", FieldType.STRING)
            .field("name", FieldType.STRING)
            .field("grade", FieldType.STRING)
            .field("customer_since", FieldType.TIMESTAMP)
            .field("origin", FieldType.STRING)
            .build();

    static final BigDecimal GOLD = new BigDecimal("100000");
    static final BigDecimal SILVER = new BigDecimal("10000");

    @Override
    public String componentId() {
        return COMPONENT_ID;
    }

    @Override
    public void registerTransforms(TransformRegistry registry) {
        registry.register("revenueToGrade", TransformFunction.of(FieldType.DECIMAL, FieldType.STRING,
                (BigDecimal revenue) -> grade(revenue)));
    }

    /**
     * Grades a yearly revenue.
     *
     * @throws IllegalArgumentException for a negative revenue
     */
    static String grade(BigDecimal revenue) {
        if (revenue == null) {
            return null;
        }
        if (revenue.signum() < 0) {
            throw new IllegalArgumentException("negative revenue " + revenue.toPlainString());
        }
        if (revenue.compareTo(GOLD) >= 0) return "GOLD";
        if (revenue.compareTo(SILVER) >= 0) return "SILVER";
        return "STANDARD";
    }

    @Override
    public List<MigrationPhase> globalPhases() {
        TransferSpec levels = TransferSpec.builder(GRADE_LEVEL_SETUP, GRADE_LEVEL)
                .rule(MappingRule.direct("code"))
                .rule(MappingRule.direct("min_revenue"))
                .rule(MappingRule.direct("description"))
                .build();
        return List.of(MigrationPhase.builder("copy-grade-levels")
                .name("Copy grade levels")
                .order(10)
                .tagId(TagNames.of(COMPONENT_ID, "GradeLevels", RELEASED))
                .rollbackRequired(true)
                .handler(new TransferPhaseHandler(levels))
                .rule(ValidationRules.targetTablePresent(GRADE_LEVEL.name()))
                .rule(ValidationRules.noRowErrors())
                .build());
    }

    @Override
    public List<MigrationPhase> tenantPhases() {
        TransferSpec grades = TransferSpec.builder(LEGACY_CUSTOMER, CUSTOMER_GRADE)
                .rule(MappingRule.direct("no", "customer_no"))
                .rule(MappingRule.direct("name"))
                .rule(MappingRule.transform("revenue", "grade", "revenueToGrade"))
                .rule(MappingRule.direct("since", "customer_since"))
                .rule(MappingRule.constant("origin", "legacy"))
                .build();
        MigrationPhase copy = MigrationPhase.builder("copy-customer-grades")
                .name("Grade legacy customers")
                .order(10)
                .tagId(TagNames.of(COMPONENT_ID, "CustomerGrade", RELEASED))
                .rollbackRequired(true)
                .rowErrorPolicy(RowErrorPolicy.CONTINUE)
                .handler(new TransferPhaseHandler(grades))
                .rule(ValidationRules.targetTablePresent(CUSTOMER_GRADE.name()))
                .rule(ValidationRules.noRowErrors().withSeverity(Severity.WARNING))
                .rule(ValidationRules.noDuplicateValues(CUSTOMER_GRADE.name(), "customer_no"))
                .build();
        MigrationPhase purge = MigrationPhase.builder("purge-blocked-customers")
                .name("Purge blocked legacy customers")
                .order(20)
                .dependsOn(copy.id())
                .tagId(TagNames.of(COMPONENT_ID, "PurgeBlocked", RELEASED))
                .rollbackRequired(true)
                .handler(new PurgePhaseHandler(LEGACY_CUSTOMER, row -> Boolean.TRUE.equals(row.get("blocked"))))
                .build();
        return List.of(copy, purge);
    }
}
