package upgrade;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UpgradeMain")
class UpgradeMainTest {

    @TempDir
    Path tempDir;

    Path config;
    ByteArrayOutputStream output;

    @BeforeEach
    void writeConfig() throws IOException {
        config = tempDir.resolve("migration.yml");
        Files.writeString(config, String.join("\n",
                "migration:",
                "  batch:",
                "    size: 2",
                "  alert:",
                "    level: ERROR",
                "  ledger:",
                "    file: " + tempDir.resolve("ledger.tsv"),
                "  snapshot:",
                "    dir: " + tempDir.resolve("snapshots"),
                ""));
        output = new ByteArrayOutputStream();
    }

    int run(DemoStores stores, String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = config.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return UpgradeMain.run(withConfig, stores, new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("tenant command")
    class Tenant {

        @Test
        @DisplayName("should grade customers and purge blocked ones")
        void shouldUpgradeTenant() {
            DemoStores stores = new DemoStores();

            int code = run(stores, "tenant", "acme");

            assertThat(code).isEqualTo(UpgradeMain.OK);
            assertThat(stores.tenant("acme").count("customer_grade")).isEqualTo(4);
            assertThat(stores.tenant("acme").count("legacy_customer")).isEqualTo(3);
            assertThat(output())
                    .contains("\"scope\":\"tenant:acme\"")
                    .contains("\"id\":\"copy-customer-grades\",\"status\":\"COMMITTED\"")
                    .contains("\"key\":\"C40000\",\"message\":\"negative revenue -120.00\"");
        }

        @Test
        @DisplayName("should skip every phase on a second invocation")
        void shouldSkipOnSecondInvocation() {
            run(new DemoStores(), "tenant", "acme");
            DemoStores restarted = new DemoStores();

            int code = run(restarted, "tenant", "acme");

            assertThat(code).isEqualTo(UpgradeMain.OK);
            assertThat(restarted.tenant("acme").count("customer_grade")).isZero();
            assertThat(output()).contains("\"id\":\"purge-blocked-customers\",\"status\":\"SKIPPED\"");
        }

        @Test
        @DisplayName("should run each tenant on its own database")
        void shouldRunSeveralTenants() {
            DemoStores stores = new DemoStores();

            assertThat(run(stores, "tenant", "acme", "globex")).isEqualTo(UpgradeMain.OK);

            assertThat(stores.tenant("acme").count("customer_grade")).isEqualTo(4);
            assertThat(stores.tenant("globex").count("customer_grade")).isEqualTo(4);
        }
    }

    @Test
    @DisplayName("should copy grade levels once per deployment")
    void shouldRunGlobalPhases() {
        DemoStores stores = new DemoStores();

        assertThat(run(stores, "global")).isEqualTo(UpgradeMain.OK);

        assertThat(stores.system().count("grade_level")).isEqualTo(3);
        assertThat(output()).contains("\"scope\":\"global\"");
    }

    @Test
    @DisplayName("should list committed tags of a tenant")
    void shouldListTags() {
        run(new DemoStores(), "tenant", "acme");
        output.reset();

        assertThat(run(new DemoStores(), "tags", "acme")).isEqualTo(UpgradeMain.OK);

        assertThat(output())
                .contains("50100-CustomerGrade-20250120")
                .contains("50100-PurgeBlocked-20250120");
    }

    @Test
    @DisplayName("should refuse to roll back a committed phase")
    void shouldRefuseRollbackOfCommittedPhase() {
        run(new DemoStores(), "tenant", "acme");

        assertThat(run(new DemoStores(), "rollback", "copy-customer-grades", "acme")).isEqualTo(UpgradeMain.FAILED);
    }

    @Test
    @DisplayName("should print usage for unknown or incomplete commands")
    void shouldPrintUsage() {
        assertThat(run(new DemoStores())).isEqualTo(UpgradeMain.USAGE);
        assertThat(run(new DemoStores(), "tenant")).isEqualTo(UpgradeMain.USAGE);
        assertThat(run(new DemoStores(), "upgrade-everything")).isEqualTo(UpgradeMain.USAGE);
        assertThat(output()).contains(UpgradeMain.usage());
    }

    @Test
    @DisplayName("should fail when the config file is missing")
    void shouldFailOnMissingConfig() {
        int code = UpgradeMain.run(new String[]{"--config", tempDir.resolve("absent.yml").toString(), "global"},
                new DemoStores(), new PrintStream(output, true, StandardCharsets.UTF_8));

        assertThat(code).isEqualTo(UpgradeMain.FAILED);
    }
}
