package datamigrator.engine;

import datamigrator.config.MigrationConfig;
import datamigrator.ledger.TagScope;
import datamigrator.phase.PhaseStatus;
import datamigrator.rollback.RollbackSnapshot;
import datamigrator.store.RecordStore;
import datamigrator.transfer.TransferJob;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one migration run, passed explicitly to every component taking part in it.
 *
 * <p>Holds the run id, the scope, the store resolved for the scope, the
 * configuration, the jobs compiled for its phases, the status each phase
 * reached and the snapshots taken so far.
 * A context lives exactly as long as its run; nothing in it is shared between
 * runs.
 *
 * <p>{@link #cancel()} may be called from any thread. The transfer executor
 * checks the flag between batches.
 */
public final class RunContext {

    private final long runId;
    private final TagScope scope;
    private final RecordStore store;
    private final MigrationConfig config;
    private final long startedAtNanos;
    private final Map<String, PhaseStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, RollbackSnapshot> snapshots = new LinkedHashMap<>();
    private final Map<String, TransferJob> jobs = new ConcurrentHashMap<>();
    private volatile boolean cancelled;

    public RunContext(long runId, TagScope scope, RecordStore store, MigrationConfig config) {
        this.runId = runId;
        this.scope = Objects.requireNonNull(scope, "scope");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.startedAtNanos = System.nanoTime();
    }

    /** Unique identifier of this run within the orchestrator. */
    public long runId() {
        return runId;
    }

    public TagScope scope() {
        return scope;
    }

    /** The store every phase of this run reads and writes. */
    public RecordStore store() {
        return store;
    }

    public MigrationConfig config() {
        return config;
    }

    /** Timestamp (in nanos) when this run started. */
    public long startedAtNanos() {
        return startedAtNanos;
    }

    /**
     * Requests cancellation. The current phase stops at the next batch boundary
     * and keeps the state it reached; no rollback is performed.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Returns the status a phase has reached in this run.
     *
     * @return the status, or {@link PhaseStatus#PENDING} if the phase has not started
     */
    public PhaseStatus status(String phaseId) {
        return statuses.getOrDefault(phaseId, PhaseStatus.PENDING);
    }

    /** Returns all phase statuses recorded so far. */
    public Map<String, PhaseStatus> statuses() {
        return Collections.unmodifiableMap(statuses);
    }

    void status(String phaseId, PhaseStatus status) {
        statuses.put(phaseId, status);
    }

    /** Returns the transfer job compiled for a phase in this run, if any. */
    public Optional<TransferJob> job(String phaseId) {
        return Optional.ofNullable(jobs.get(phaseId));
    }

    /** Records the transfer job compiled for a phase. */
    public void job(String phaseId, TransferJob job) {
        jobs.put(phaseId, Objects.requireNonNull(job, "job"));
    }

    /** Returns the snapshot taken for a phase in this run, if any. */
    public synchronized Optional<RollbackSnapshot> snapshot(String phaseId) {
        return Optional.ofNullable(snapshots.get(phaseId));
    }

    synchronized void snapshot(String phaseId, RollbackSnapshot snapshot) {
        if (snapshot == null) {
            snapshots.remove(phaseId);
        } else {
            snapshots.put(phaseId, snapshot);
        }
    }
}
