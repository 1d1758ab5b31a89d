package datamigrator.config;

import datamigrator.transfer.RowErrorPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migration.properties} on the classpath</li>
 *   <li>{@code migration.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file values. Use the {@code migration.} prefix
 * (e.g. {@code -Dmigration.batch.size=1000}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.batch.size} - rows per batch (default 500)</li>
 *   <li>{@code migration.batch.workers} - parallel flush workers (default 1)</li>
 *   <li>{@code migration.row.error.policy} - CONTINUE or FAIL_PHASE</li>
 *   <li>{@code migration.timeout.validation} - seconds per validation check, 0 for none</li>
 *   <li>{@code migration.history.size} - number of run reports kept</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 *   <li>{@code migration.ledger.file} - path of the file ledger</li>
 *   <li>{@code migration.snapshot.dir} - directory of the YAML snapshot store</li>
 * </ul>
 *
 * <p>Invalid values are logged and the default is kept.
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (migration.properties or migration.yml).
     * @throws MigrationConfigException if no config file found
     */
    public static MigrationConfig load() {
        InputStream is = getResource("migration.properties");
        if (is != null) {
            return loadProperties(is, "migration.properties");
        }

        is = getResource("migration.yml");
        if (is != null) {
            return loadYaml(is, "migration.yml");
        }

        throw new MigrationConfigException(
                "Config file required: migration.properties or migration.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the file cannot be parsed
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException | IllegalArgumentException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException | YAMLException | ClassCastException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getInt(props, "migration.batch.size").ifPresent(v -> {
            if (v > 0) b.batchSize(v);
            else log.warn("Invalid batch.size: {}", v);
        });
        getInt(props, "migration.batch.workers").ifPresent(v -> {
            if (v > 0) b.batchWorkers(v);
            else log.warn("Invalid batch.workers: {}", v);
        });

        getString(props, "migration.row.error.policy").ifPresent(v -> {
            try {
                b.rowErrorPolicy(RowErrorPolicy.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid row.error.policy: {}", v);
            }
        });

        getLong(props, "migration.timeout.validation").ifPresent(b::validationTimeoutSeconds);

        getInt(props, "migration.history.size").ifPresent(v -> {
            if (v > 0) b.historySize(v);
        });

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        getString(props, "migration.ledger.file").filter(v -> !v.isEmpty()).map(Path::of).ifPresent(b::ledgerFile);
        getString(props, "migration.snapshot.dir").filter(v -> !v.isEmpty()).map(Path::of).ifPresent(b::snapshotDir);

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
