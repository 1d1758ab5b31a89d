package datamigrator.row;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MapRow and TableShape")
class MapRowTest {

    static final TableShape SHAPE = TableShape.builder("customer")
            .key("no", FieldType.STRING)
            .field("name", FieldType.STRING)
            .build();

    @Test
    @DisplayName("should copy independently")
    void shouldCopyIndependently() {
        MapRow row = MapRow.of("no", "C01", "name", "Acme");

        Row copy = row.copy();
        copy.set("name", "Globex");

        assertThat(row.get("name")).isEqualTo("Acme");
        assertThat(copy).isNotEqualTo(row);
    }

    @Test
    @DisplayName("should tell a null field from a missing one")
    void shouldDistinguishNullFromMissing() {
        MapRow row = MapRow.of("no", "C01", "name", null);

        assertThat(row.has("name")).isTrue();
        assertThat(row.has("city")).isFalse();
        assertThat(row.fieldIds()).containsExactly("no", "name");
    }

    @Test
    @DisplayName("should reject odd argument lists")
    void shouldRejectOddArguments() {
        assertThatThrownBy(() -> MapRow.of("no")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should read the key of a row")
    void shouldReadKey() {
        assertThat(SHAPE.keyOf(MapRow.of("no", "C01"))).isEqualTo(RowKey.of("C01"));
        assertThat(SHAPE.typeOf("name")).isEqualTo(FieldType.STRING);
        assertThat(SHAPE.typeOf("city")).isNull();
        assertThatThrownBy(() -> SHAPE.keyOf(MapRow.of("name", "Acme")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should combine filters")
    void shouldCombineFilters() {
        RowFilter active = row -> Boolean.TRUE.equals(row.get("active"));
        RowFilter named = row -> row.get("name") != null;

        assertThat(active.and(named).matches(MapRow.of("active", true, "name", "x"))).isTrue();
        assertThat(active.and(named).matches(MapRow.of("active", true))).isFalse();
        assertThat(active.negate().matches(MapRow.of("active", false))).isTrue();
        assertThat(RowFilter.ALL.matches(new MapRow())).isTrue();
    }
}
