package datamigrator.config;

import datamigrator.transfer.RowErrorPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Central configuration for migration runs.
 *
 * <p>Holds the engine-wide defaults:
 * <ul>
 *   <li>batch size and parallel flush workers of the transfer executor</li>
 *   <li>default row-error policy for phases that do not set one</li>
 *   <li>timeout per validation check</li>
 *   <li>run history size and alert level</li>
 *   <li>optional ledger file and snapshot directory, used by tooling that
 *       wires durable stores from configuration</li>
 * </ul>
 *
 * <p>Load it from {@code migration.properties} or {@code migration.yml} with
 * {@link MigrationConfigLoader}, or build it directly.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    public static final MigrationConfig DEFAULTS = builder().build();

    private final int batchSize;
    private final int batchWorkers;
    private final RowErrorPolicy rowErrorPolicy;
    private final Duration validationTimeout;
    private final int historySize;
    private final AlertLevel alertLevel;
    private final Path ledgerFile;
    private final Path snapshotDir;

    private MigrationConfig(Builder b) {
        this.batchSize = b.batchSize;
        this.batchWorkers = b.batchWorkers;
        this.rowErrorPolicy = b.rowErrorPolicy;
        this.validationTimeout = b.validationTimeout;
        this.historySize = b.historySize;
        this.alertLevel = b.alertLevel;
        this.ledgerFile = b.ledgerFile;
        this.snapshotDir = b.snapshotDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the batch size used when a transfer does not set its own. */
    public int batchSize() { return batchSize; }

    /** Returns the number of batches flushed in parallel; 1 means sequential. */
    public int batchWorkers() { return batchWorkers; }

    /** Returns the row-error policy for phases that do not set one. */
    public RowErrorPolicy rowErrorPolicy() { return rowErrorPolicy; }

    /** Returns the timeout per validation check, or zero for none. */
    public Duration validationTimeout() { return validationTimeout; }

    /** Returns the number of run reports kept in the history. */
    public int historySize() { return historySize; }

    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the ledger file, or null if not configured. */
    public Path ledgerFile() { return ledgerFile; }

    /** Returns the snapshot directory, or null if not configured. */
    public Path snapshotDir() { return snapshotDir; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "batchSize=" + batchSize +
                ", batchWorkers=" + batchWorkers +
                ", rowErrorPolicy=" + rowErrorPolicy +
                ", validationTimeout=" + validationTimeout.toSeconds() + "s" +
                ", historySize=" + historySize +
                ", alertLevel=" + alertLevel +
                ", ledgerFile=" + ledgerFile +
                ", snapshotDir=" + snapshotDir +
                '}';
    }

    /**
     * Builder for {@link MigrationConfig}.
     */
    public static final class Builder {
        private int batchSize = 500;
        private int batchWorkers = 1;
        private RowErrorPolicy rowErrorPolicy = RowErrorPolicy.CONTINUE;
        private Duration validationTimeout = Duration.ZERO;
        private int historySize = 10;
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private Path ledgerFile;
        private Path snapshotDir;

        public Builder batchSize(int size) {
            if (size <= 0) throw new IllegalArgumentException("batchSize must be positive");
            this.batchSize = size;
            return this;
        }

        public Builder batchWorkers(int workers) {
            if (workers <= 0) throw new IllegalArgumentException("batchWorkers must be positive");
            this.batchWorkers = workers;
            return this;
        }

        public Builder rowErrorPolicy(RowErrorPolicy policy) {
            this.rowErrorPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder validationTimeout(Duration timeout) {
            this.validationTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder validationTimeoutSeconds(long seconds) {
            return validationTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder historySize(int size) {
            if (size <= 0) throw new IllegalArgumentException("historySize must be positive");
            this.historySize = size;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = Objects.requireNonNull(level, "level");
            return this;
        }

        public Builder ledgerFile(Path file) {
            this.ledgerFile = file;
            return this;
        }

        public Builder snapshotDir(Path dir) {
            this.snapshotDir = dir;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
