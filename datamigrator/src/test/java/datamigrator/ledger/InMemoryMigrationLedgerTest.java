package datamigrator.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryMigrationLedger")
class InMemoryMigrationLedgerTest {

    static final TagScope ACME = TagScope.perTenant("acme");

    @Test
    @DisplayName("should report a tag only after it is committed")
    void shouldReportCommittedTag() {
        InMemoryMigrationLedger ledger = new InMemoryMigrationLedger(
                Clock.fixed(Instant.parse("2025-01-20T10:00:00Z"), ZoneOffset.UTC));

        assertThat(ledger.hasTag("50100-CustomerGrade-20250120", ACME)).isFalse();
        assertThat(ledger.commitTag("50100-CustomerGrade-20250120", ACME)).isEqualTo(CommitOutcome.COMMITTED);

        assertThat(ledger.hasTag("50100-CustomerGrade-20250120", ACME)).isTrue();
        assertThat(ledger.find("50100-CustomerGrade-20250120", ACME)).get()
                .extracting(MigrationTag::appliedAt).isEqualTo(Instant.parse("2025-01-20T10:00:00Z"));
    }

    @Test
    @DisplayName("should keep scopes apart")
    void shouldKeepScopesApart() {
        InMemoryMigrationLedger ledger = new InMemoryMigrationLedger();
        ledger.commitTag("tag", ACME);

        assertThat(ledger.hasTag("tag", TagScope.perTenant("globex"))).isFalse();
        assertThat(ledger.hasTag("tag", TagScope.global())).isFalse();
        assertThat(ledger.commitTag("tag", ACME)).isEqualTo(CommitOutcome.ALREADY_COMMITTED);
    }

    @Test
    @DisplayName("should list tags of a scope in commit order")
    void shouldListTagsInCommitOrder() {
        InMemoryMigrationLedger ledger = new InMemoryMigrationLedger();
        ledger.commitTag("b", ACME);
        ledger.commitTag("a", ACME);
        ledger.commitTag("c", TagScope.global());

        assertThat(ledger.tags(ACME)).extracting(MigrationTag::id).containsExactly("b", "a");
    }

    @Test
    @DisplayName("should let exactly one concurrent committer win")
    void shouldLetOneCommitterWin() throws Exception {
        InMemoryMigrationLedger ledger = new InMemoryMigrationLedger();

        List<CommitOutcome> outcomes = LedgerRace.commitConcurrently(() -> ledger, "tag", ACME, 16);

        assertThat(outcomes).filteredOn(o -> o == CommitOutcome.COMMITTED).hasSize(1);
        assertThat(outcomes).filteredOn(o -> o == CommitOutcome.ALREADY_COMMITTED).hasSize(15);
        assertThat(ledger.tags(ACME)).hasSize(1);
    }
}
