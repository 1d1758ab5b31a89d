package upgrade.components;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CustomerGradeUpgrade")
class CustomerGradeUpgradeTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "0, STANDARD",
            "9999.99, STANDARD",
            "10000, SILVER",
            "99999.99, SILVER",
            "100000, GOLD",
            "2500000, GOLD"
    })
    @DisplayName("should grade by revenue")
    void shouldGradeByRevenue(BigDecimal revenue, String grade) {
        assertThat(CustomerGradeUpgrade.grade(revenue)).isEqualTo(grade);
    }

    @Test
    @DisplayName("should reject a negative revenue")
    void shouldRejectNegativeRevenue() {
        assertThatThrownBy(() -> CustomerGradeUpgrade.grade(new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(CustomerGradeUpgrade.grade(null)).isNull();
    }

    @Test
    @DisplayName("should make purging depend on grading")
    void shouldOrderTenantPhases() {
        CustomerGradeUpgrade upgrade = new CustomerGradeUpgrade();

        assertThat(upgrade.tenantPhases().get(1).dependsOn()).containsExactly("copy-customer-grades");
        assertThat(upgrade.tenantPhases()).allMatch(p -> p.rollbackRequired());
        assertThat(upgrade.globalPhases()).singleElement()
                .satisfies(p -> assertThat(p.tagId()).isEqualTo("50100-GradeLevels-20250120"));
    }
}
