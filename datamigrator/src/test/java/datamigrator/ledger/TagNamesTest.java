package datamigrator.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TagNames and TagScope")
class TagNamesTest {

    @Test
    @DisplayName("should join component, feature and date")
    void shouldJoinParts() {
        assertThat(TagNames.of("50100", "CustomerGrade", LocalDate.of(2025, 1, 20)))
                .isEqualTo("50100-CustomerGrade-20250120");
    }

    @Test
    @DisplayName("should reject whitespace in tag parts")
    void shouldRejectWhitespace() {
        assertThatThrownBy(() -> TagNames.of("50100", "Customer Grade", LocalDate.of(2025, 1, 20)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("featureName");
    }

    @Test
    @DisplayName("should parse its own scope keys")
    void shouldParseScopeKeys() {
        assertThat(TagScope.fromKey(TagScope.global().key())).isEqualTo(TagScope.global());
        assertThat(TagScope.fromKey("tenant:acme")).isEqualTo(TagScope.perTenant("acme"));
        assertThatThrownBy(() -> TagScope.fromKey("company:acme")).isInstanceOf(IllegalArgumentException.class);
    }
}
