package upgrade;

import datamigrator.config.MigrationConfig;
import datamigrator.config.MigrationConfigLoader;
import datamigrator.engine.MigrationOrchestrator;
import datamigrator.engine.RunReport;
import datamigrator.exceptions.MigrateException;
import datamigrator.exceptions.RestoreException;
import datamigrator.ledger.MigrationTag;
import datamigrator.ledger.TagScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Upgrade tooling entry point: runs the migration definitions found in
 * {@code upgrade.components} against the demo databases.
 *
 * <h2>Commands:</h2>
 * <ul>
 *   <li>{@code global} - run the once-per-deployment phases</li>
 *   <li>{@code tenant <id>...} - run the per-tenant phases for each tenant, in order</li>
 *   <li>{@code rollback <phase> [<tenant>]} - restore the snapshot of a phase that did not commit</li>
 *   <li>{@code tags [<tenant>]} - list the tags in the ledger</li>
 * </ul>
 * {@code --config <file>} loads the configuration from a file instead of the classpath.
 *
 * <p>Each run prints its report as JSON. The exit code is 0 when every run
 * succeeded, 1 when a run failed and 2 on a usage error.
 *
 * <h2>Usage:</h2>
 * <pre>
 * java -jar upgrade-demo.jar global
 * java -jar upgrade-demo.jar tenant acme globex
 * java -jar upgrade-demo.jar --config /etc/upgrade/migration.yml tags acme
 * </pre>
 */
public class UpgradeMain {

    private static final Logger log = LoggerFactory.getLogger(UpgradeMain.class);

    static final String COMPONENT_PACKAGE = "upgrade.components";

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, new DemoStores(), System.out));
    }

    static int run(String[] args, DemoStores stores, PrintStream out) {
        List<String> rest = new ArrayList<>(Arrays.asList(args));
        MigrationConfig config;
        try {
            config = loadConfig(rest);
        } catch (IOException e) {
            log.error("Cannot read configuration", e);
            return FAILED;
        }
        if (rest.isEmpty()) {
            out.println(usage());
            return USAGE;
        }

        MigrationOrchestrator orchestrator;
        try {
            orchestrator = MigrationOrchestrator.builder()
                    .config(config)
                    .stores(stores)
                    .scan(COMPONENT_PACKAGE)
                    .progressReporter(new LoggingProgressReporter())
                    .build();
        } catch (MigrateException e) {
            log.error("Invalid migration definitions", e);
            return FAILED;
        }

        String command = rest.remove(0);
        switch (command) {
            case "global":
                return print(out, orchestrator.runPerGlobal());
            case "tenant":
                if (rest.isEmpty()) {
                    out.println(usage());
                    return USAGE;
                }
                int code = OK;
                for (String tenantId : rest) {
                    if (print(out, orchestrator.runPerScope(tenantId)) != OK) {
                        code = FAILED;
                    }
                }
                return code;
            case "rollback":
                if (rest.isEmpty() || rest.size() > 2) {
                    out.println(usage());
                    return USAGE;
                }
                return rollback(orchestrator, rest.get(0), scope(rest.size() == 2 ? rest.get(1) : null), out);
            case "tags":
                if (rest.size() > 1) {
                    out.println(usage());
                    return USAGE;
                }
                for (MigrationTag tag : orchestrator.ledger().tags(scope(rest.isEmpty() ? null : rest.get(0)))) {
                    out.println(tag.id() + "\t" + tag.appliedAt());
                }
                return OK;
            default:
                out.println(usage());
                return USAGE;
        }
    }

    private static MigrationConfig loadConfig(List<String> args) throws IOException {
        int i = args.indexOf("--config");
        if (i < 0) {
            return MigrationConfigLoader.load();
        }
        if (i + 1 >= args.size()) {
            throw new IOException("--config needs a file");
        }
        Path file = Path.of(args.get(i + 1));
        args.remove(i + 1);
        args.remove(i);
        return MigrationConfigLoader.loadFromFile(file);
    }

    private static TagScope scope(String tenantId) {
        return tenantId == null ? TagScope.global() : TagScope.perTenant(tenantId);
    }

    private static int rollback(MigrationOrchestrator orchestrator, String phaseId, TagScope scope, PrintStream out) {
        try {
            int restored = orchestrator.rollbackPhase(phaseId, scope);
            out.println("Restored " + restored + " rows of " + phaseId + " in " + scope);
            return OK;
        } catch (RestoreException e) {
            log.error("Rollback of {} in {} failed", phaseId, scope, e);
            return FAILED;
        }
    }

    private static int print(PrintStream out, RunReport report) {
        out.println(ReportJson.toJson(report));
        return report.overallSuccess() ? OK : FAILED;
    }

    static String usage() {
        return "usage: upgrade [--config <file>] global | tenant <id>... | rollback <phase> [<tenant>] | tags [<tenant>]";
    }
}
