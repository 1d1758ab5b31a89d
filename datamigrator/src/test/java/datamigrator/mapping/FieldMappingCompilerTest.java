package datamigrator.mapping;

import datamigrator.exceptions.CompileException;
import datamigrator.row.FieldType;
import datamigrator.row.MapRow;
import datamigrator.row.Row;
import datamigrator.row.TableShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("FieldMappingCompiler")
class FieldMappingCompilerTest {

    static final TableShape SOURCE = TableShape.builder("legacy_customer")
            .key("no", FieldType.STRING)
            .field("name", FieldType.STRING)
            .field("grade", FieldType.INTEGER)
            .field("credit", FieldType.DECIMAL)
            .field("since", FieldType.DATE)
            .build();

    static final TableShape TARGET = TableShape.builder("customer_grade")
            .key("no", FieldType.STRING)
            .field("name", FieldType.STRING)
            .field("grade", FieldType.LONG)
            .field("gradeCode", FieldType.STRING)
            .field("credit", FieldType.INTEGER)
            .field("since", FieldType.TIMESTAMP)
            .field("status", FieldType.STRING)
            .build();

    TransformRegistry transforms;
    FieldMappingCompiler compiler;

    @BeforeEach
    void setUp() {
        transforms = new TransformRegistry()
                .register("gradeCode", TransformFunction.<Integer, String>of(FieldType.INTEGER, FieldType.STRING,
                        grade -> "G" + grade))
                .register("upper", TransformFunction.<String, String>of(FieldType.STRING, FieldType.STRING,
                        String::toUpperCase));
        compiler = new FieldMappingCompiler(transforms);
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("should compile direct, constant and transform rules in order")
        void shouldCompileAllKinds() throws Exception {
            List<FieldMapping> mappings = compiler.compile(SOURCE, TARGET, List.of(
                    MappingRule.direct("no"),
                    MappingRule.direct("grade"),
                    MappingRule.transform("grade", "gradeCode", "gradeCode"),
                    MappingRule.constant("status", "MIGRATED")));

            assertThat(mappings).extracting(FieldMapping::targetFieldId)
                    .containsExactly("no", "grade", "gradeCode", "status");
            assertThat(mappings).extracting(FieldMapping::kind)
                    .containsExactly(MappingKind.DIRECT, MappingKind.DIRECT, MappingKind.TRANSFORM, MappingKind.CONSTANT);
        }

        @Test
        @DisplayName("should name the field pair of an incompatible direct mapping")
        void shouldRejectIncompatibleDirect() {
            CompileException e = catchThrowableOfType(() -> compiler.compile(SOURCE, TARGET, List.of(
                    MappingRule.direct("no"),
                    MappingRule.direct("credit"))), CompileException.class);

            assertThat(e.getViolations()).singleElement().satisfies(v -> {
                assertThat(v.sourceFieldId()).isEqualTo("credit");
                assertThat(v.targetFieldId()).isEqualTo("credit");
                assertThat(v.message()).isEqualTo("incompatible types DECIMAL -> INTEGER");
            });
            assertThat(e).hasMessageContaining("credit -> credit: incompatible types DECIMAL -> INTEGER");
        }

        @Test
        @DisplayName("should collect every violation at once")
        void shouldCollectAllViolations() {
            CompileException e = catchThrowableOfType(() -> compiler.compile(SOURCE, TARGET, List.of(
                    MappingRule.direct("name"),
                    MappingRule.direct("name"),
                    MappingRule.direct("missing", "status"),
                    MappingRule.direct("grade", "nowhere"),
                    MappingRule.transform("name", "gradeCode", "nope"),
                    MappingRule.constant("credit", "ten"))), CompileException.class);

            assertThat(e.getViolations()).extracting(MappingViolation::message).containsExactly(
                    "target field is written by more than one rule",
                    "source field does not exist in legacy_customer",
                    "target field does not exist in customer_grade",
                    "unknown transform 'nope'",
                    "constant of type STRING does not fit INTEGER",
                    "target key field is not written by any rule");
        }

        @Test
        @DisplayName("should reject transforms whose types do not fit")
        void shouldRejectMismatchedTransform() {
            CompileException e = catchThrowableOfType(() -> compiler.compile(SOURCE, TARGET, List.of(
                    MappingRule.direct("no"),
                    MappingRule.transform("name", "grade", "gradeCode"))), CompileException.class);

            assertThat(e.getViolations()).extracting(MappingViolation::message).containsExactly(
                    "transform 'gradeCode' takes INTEGER, source field is STRING",
                    "transform 'gradeCode' returns STRING, target field is LONG");
        }

        @Test
        @DisplayName("should reject a null constant for the key field")
        void shouldRejectNullKeyConstant() {
            assertThatThrownBy(() -> compiler.compile(SOURCE, TARGET, List.of(MappingRule.constant("no", null))))
                    .isInstanceOf(CompileException.class)
                    .hasMessageContaining("null constant for key field");
        }

        @Test
        @DisplayName("should reject an empty rule list")
        void shouldRejectEmptyRules() {
            assertThatThrownBy(() -> compiler.compile(SOURCE, TARGET, List.of()))
                    .isInstanceOf(CompileException.class)
                    .hasMessageContaining("no mapping rules");
        }
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("should produce exactly the mapped fields with widened values")
        void shouldMapRow() throws Exception {
            List<FieldMapping> mappings = compiler.compile(SOURCE, TARGET, List.of(
                    MappingRule.direct("no"),
                    MappingRule.transform("name", "name", "upper"),
                    MappingRule.direct("grade"),
                    MappingRule.direct("since"),
                    MappingRule.constant("status", "MIGRATED")));
            Row source = MapRow.of("no", "C01", "name", "acme", "grade", 3,
                    "credit", new BigDecimal("10.50"), "since", LocalDate.of(2020, 5, 1));

            Row target = FieldMappingCompiler.apply(mappings, source);

            assertThat(target).isEqualTo(MapRow.of("no", "C01", "name", "ACME", "grade", 3L,
                    "since", Instant.parse("2020-05-01T00:00:00Z"), "status", "MIGRATED"));
        }

        @Test
        @DisplayName("should pass nulls through")
        void shouldPassNullsThrough() throws Exception {
            List<FieldMapping> mappings = compiler.compile(SOURCE, TARGET, List.of(
                    MappingRule.direct("no"),
                    MappingRule.direct("grade")));

            Row target = FieldMappingCompiler.apply(mappings, MapRow.of("no", "C01"));

            assertThat(target.has("grade")).isTrue();
            assertThat(target.get("grade")).isNull();
        }

        @Test
        @DisplayName("should fail a row whose value does not match its declared type")
        void shouldFailMistypedRow() throws Exception {
            List<FieldMapping> mappings = compiler.compile(SOURCE, TARGET, List.of(
                    MappingRule.direct("no"),
                    MappingRule.direct("grade")));

            assertThatThrownBy(() -> FieldMappingCompiler.apply(mappings, MapRow.of("no", "C01", "grade", "three")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
