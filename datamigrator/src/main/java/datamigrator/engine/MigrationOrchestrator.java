package datamigrator.engine;

import datamigrator.alert.MigrationAlertLogger;
import datamigrator.config.MigrationConfig;
import datamigrator.config.MigrationConfigLoader;
import datamigrator.definition.DefinitionScanner;
import datamigrator.definition.MigrationDefinition;
import datamigrator.exceptions.BatchWriteException;
import datamigrator.exceptions.CompileException;
import datamigrator.exceptions.MigrateException;
import datamigrator.exceptions.RestoreException;
import datamigrator.exceptions.TransferAbortedException;
import datamigrator.history.RunHistory;
import datamigrator.ledger.CommitOutcome;
import datamigrator.ledger.FileMigrationLedger;
import datamigrator.ledger.InMemoryMigrationLedger;
import datamigrator.ledger.MigrationLedger;
import datamigrator.ledger.TagScope;
import datamigrator.mapping.FieldMappingCompiler;
import datamigrator.mapping.TransformRegistry;
import datamigrator.metrics.MigrationMetrics;
import datamigrator.metrics.MigrationMetricsCollector;
import datamigrator.metrics.NoopProgressReporter;
import datamigrator.metrics.ProgressReporter;
import datamigrator.phase.AffectedRows;
import datamigrator.phase.MigrationPhase;
import datamigrator.phase.PhaseEvent;
import datamigrator.phase.PhaseListener;
import datamigrator.phase.PhaseStatus;
import datamigrator.rollback.InMemorySnapshotStore;
import datamigrator.rollback.RollbackManager;
import datamigrator.rollback.RollbackSnapshot;
import datamigrator.rollback.SnapshotStore;
import datamigrator.rollback.YamlSnapshotStore;
import datamigrator.store.StoreProvider;
import datamigrator.transfer.RowError;
import datamigrator.transfer.TransferListener;
import datamigrator.transfer.TransferResult;
import datamigrator.validation.GateResult;
import datamigrator.validation.Severity;
import datamigrator.validation.ValidationFailure;
import datamigrator.validation.ValidationGate;
import datamigrator.validation.ValidationStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the phases of a plan for one scope, end to end:
 * <ol>
 *   <li>compile every phase's mappings; a compile error aborts the run before any write</li>
 *   <li>for each phase in order:
 *     <ul>
 *       <li>skip it if its tag is already in the ledger</li>
 *       <li>fail it if a dependency neither committed nor was skipped</li>
 *       <li>signal the phase listeners</li>
 *       <li>run the pre-validation rules</li>
 *       <li>snapshot the affected rows if the phase requires rollback</li>
 *       <li>transfer</li>
 *       <li>run the post-validation rules</li>
 *       <li>commit the ledger tag, last</li>
 *       <li>OR restore the snapshot if anything after the snapshot failed</li>
 *     </ul>
 *   </li>
 *   <li>return a {@link RunReport}</li>
 * </ol>
 *
 * <p>After a phase fails, later phases run only if they are marked independent.
 * A failed restore stops the run. Cancelling the {@link RunContext} stops the
 * current phase at the next batch boundary and leaves the remaining phases
 * PENDING; nothing is rolled back.
 *
 * <p>The orchestrator keeps no per-run state; runs for different scopes may
 * execute concurrently on different threads. Two runs for the same scope are
 * not coordinated beyond the ledger's atomic commit.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationOrchestrator orchestrator = MigrationOrchestrator.builder()
 *     .config(MigrationConfigLoader.load())
 *     .stores(tenants::storeFor)
 *     .scan("com.acme.upgrade")
 *     .build();
 *
 * orchestrator.runPerGlobal();
 * for (String tenant : tenants.ids()) {
 *     RunReport report = orchestrator.runPerScope(tenant);
 * }
 * </pre>
 */
public final class MigrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

    // run id generator
    private static final AtomicLong RUN_COUNTER = new AtomicLong(1L);

    private final MigrationConfig config;
    private final MigrationPlan globalPlan;
    private final MigrationPlan tenantPlan;
    private final StoreProvider stores;
    private final MigrationLedger ledger;
    private final RollbackManager rollbacks;
    private final FieldMappingCompiler compiler;
    private final ValidationGate gate;
    private final ProgressReporter reporter;
    private final List<PhaseListener> listeners = new CopyOnWriteArrayList<>();
    private final RunHistory history;

    private MigrationOrchestrator(Builder b, MigrationPlan globalPlan, MigrationPlan tenantPlan) {
        this.config = b.config;
        this.globalPlan = globalPlan;
        this.tenantPlan = tenantPlan;
        this.stores = b.stores;
        this.ledger = b.ledger != null ? b.ledger : defaultLedger(b.config);
        SnapshotStore snapshots = b.snapshots != null ? b.snapshots : defaultSnapshots(b.config);
        this.rollbacks = new RollbackManager(snapshots, b.stores);
        this.compiler = new FieldMappingCompiler(b.transforms);
        this.gate = new ValidationGate(b.config.validationTimeout());
        this.reporter = b.reporter != null ? b.reporter : NoopProgressReporter.INSTANCE;
        this.listeners.addAll(b.listeners);
        this.history = new RunHistory(b.config.historySize());

        MigrationAlertLogger.setAlertLevel(b.config.alertLevel());
        log.debug("Orchestrator ready: global={} tenant={} config={}", globalPlan, tenantPlan, config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public MigrationConfig config() {
        return config;
    }

    public MigrationLedger ledger() {
        return ledger;
    }

    public RollbackManager rollbacks() {
        return rollbacks;
    }

    public RunHistory history() {
        return history;
    }

    /**
     * Returns the plan run for a scope: the global plan for the global scope,
     * the per-tenant plan otherwise.
     */
    public MigrationPlan plan(TagScope scope) {
        return scope.isGlobal() ? globalPlan : tenantPlan;
    }

    public MigrationOrchestrator addListener(PhaseListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public MigrationOrchestrator removeListener(PhaseListener listener) {
        listeners.remove(listener);
        return this;
    }

    /**
     * Runs the per-tenant plan for one tenant.
     *
     * @param tenantId the tenant
     * @return the run report
     */
    public RunReport runPerScope(String tenantId) {
        return run(newContext(TagScope.perTenant(tenantId)));
    }

    /**
     * Runs the once-per-deployment plan.
     *
     * @return the run report
     */
    public RunReport runPerGlobal() {
        return run(newContext(TagScope.global()));
    }

    /**
     * Creates the context of a new run without starting it, so the caller
     * holds a handle to {@link RunContext#cancel()} the run from another thread.
     */
    public RunContext newContext(TagScope scope) {
        return new RunContext(RUN_COUNTER.getAndIncrement(), scope, stores.storeFor(scope), config);
    }

    /**
     * Runs the plan of the context's scope.
     *
     * @param ctx a context created by {@link #newContext(TagScope)}
     * @return the run report
     */
    public RunReport run(RunContext ctx) {
        MigrationPlan plan = plan(ctx.scope());
        String scope = ctx.scope().key();
        MigrationMetricsCollector collector = new MigrationMetricsCollector().start(ctx.runId());
        collector.phaseCount(plan.phases().size());

        Map<String, PhaseResult> results = new LinkedHashMap<>();
        plan.phases().forEach(p -> results.put(p.id(), PhaseResult.pending(p.id())));

        MigrationAlertLogger.runStarted(ctx.runId(), scope, plan.phases().size());

        try {
            for (MigrationPhase phase : plan.phases()) {
                phase.handler().compile(phase, compiler, ctx);
            }
        } catch (CompileException e) {
            log.error("Run #{} for {} did not start: {}", ctx.runId(), scope, e.getMessage());
            return finish(ctx, results, collector, false, e.getMessage());
        }

        boolean halted = false;
        boolean restoreFailed = false;
        boolean cancelled = false;

        for (MigrationPhase phase : plan.phases()) {
            if (ctx.isCancelled()) {
                cancelled = true;
                MigrationAlertLogger.runCancelled(ctx.runId(), scope, phase.id());
                break;
            }
            if (halted && !phase.independent()) {
                log.debug("Run #{}: not starting {} after an earlier failure", ctx.runId(), phase.id());
                continue;
            }

            PhaseExecution execution = new PhaseExecution(plan, phase, ctx);
            PhaseResult result = collector.timed(phase.id(), execution::run);
            results.put(phase.id(), result);

            collector.rowsTransferred(result.rowsTransferred());
            collector.rowErrors(result.rowErrorCount());
            collector.batchesFlushed(execution.batches);

            if (result.restoreFailed()) {
                restoreFailed = true;
                break;
            }
            if (execution.cancelled) {
                cancelled = true;
                MigrationAlertLogger.runCancelled(ctx.runId(), scope, phase.id());
                break;
            }
            if (result.failed() && !phase.independent()) {
                halted = true;
            }
        }

        String error = restoreFailed ? "restore failed, store needs operator attention"
                : cancelled ? "cancelled" : null;
        return finish(ctx, results, collector, restoreFailed, error);
    }

    private RunReport finish(RunContext ctx,
                             Map<String, PhaseResult> results,
                             MigrationMetricsCollector collector,
                             boolean restoreFailed,
                             String error) {
        MigrationMetrics metrics = collector.finish();
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - ctx.startedAtNanos());
        boolean success = error == null && results.values().stream().allMatch(r -> r.status().isDone());
        RunReport report = new RunReport(ctx.runId(), ctx.scope(), new ArrayList<>(results.values()),
                success, durationMs, restoreFailed, ctx.isCancelled(), error, metrics);

        if (success) {
            MigrationAlertLogger.runCompleted(ctx.runId(), ctx.scope().key(), durationMs, report.rowsTransferred());
        } else {
            MigrationAlertLogger.runFailed(ctx.runId(), ctx.scope().key(),
                    error != null ? error : "one or more phases failed", durationMs);
        }
        log.info(report.summary());

        history.add(report);
        try {
            reporter.runFinished(report);
        } catch (RuntimeException e) {
            log.warn("Progress reporter failed on run #{}: {}", ctx.runId(), e.getMessage(), e);
        }
        return report;
    }

    /**
     * Restores the persisted snapshot of a phase that failed or was cancelled.
     *
     * <p>Restoring an already restored snapshot does nothing.
     *
     * @param phaseId the phase
     * @param scope the scope it ran in
     * @return the number of captured rows replayed
     * @throws RestoreException if the phase committed, has no snapshot, or the restore fails
     */
    public int rollbackPhase(String phaseId, TagScope scope) throws RestoreException {
        MigrationPhase phase = plan(scope).phase(phaseId);
        if (phase != null && ledger.hasTag(phase.tagId(), scope)) {
            throw new RestoreException("Phase " + phaseId + " is committed in " + scope,
                    RollbackSnapshot.idOf(phaseId, scope), null);
        }
        int rows = rollbacks.restore(phaseId, scope);
        log.info("Operator rollback of {} in {} replayed {} rows", phaseId, scope, rows);
        return rows;
    }

    /**
     * Runs one phase through its state machine.
     */
    private final class PhaseExecution {

        private final MigrationPlan plan;
        private final MigrationPhase phase;
        private final RunContext ctx;
        private final long startNanos = System.nanoTime();
        private final List<ValidationFailure> failures = new ArrayList<>();

        private PhaseStatus status = PhaseStatus.PENDING;
        private TransferResult transfer = TransferResult.empty();
        private String error;
        private boolean restoreFailed;
        private boolean cancelled;
        private int batches;

        PhaseExecution(MigrationPlan plan, MigrationPhase phase, RunContext ctx) {
            this.plan = plan;
            this.phase = phase;
            this.ctx = ctx;
        }

        PhaseResult run() {
            if (ledger.hasTag(phase.tagId(), ctx.scope())) {
                transition(PhaseStatus.SKIPPED);
                MigrationAlertLogger.phaseSkipped(ctx.runId(), phase.id(), phase.tagId());
                return result();
            }

            for (String dep : phase.dependsOn()) {
                if (!dependencyMet(dep)) {
                    failures.add(new ValidationFailure(phase.id(), "dependsOn", ValidationStage.PRE,
                            Severity.BLOCKING, "dependency " + dep + " is " + ctx.status(dep), null));
                    fail("unmet dependency " + dep);
                    return result();
                }
            }

            MigrationAlertLogger.phaseStarted(ctx.runId(), phase.id());
            List<PhaseListener> notified = new ArrayList<>();
            String refusal = null;
            for (PhaseListener listener : listeners) {
                try {
                    listener.beforePhase(new PhaseEvent(ctx, phase, status, null));
                    notified.add(listener);
                } catch (MigrateException | RuntimeException e) {
                    refusal = e.getMessage();
                    break;
                }
            }
            if (refusal != null) {
                fail("refused by listener: " + refusal);
            } else {
                execute();
            }

            PhaseResult result = result();
            for (PhaseListener listener : notified) {
                try {
                    listener.afterPhase(new PhaseEvent(ctx, phase, status, result));
                } catch (MigrateException | RuntimeException e) {
                    log.warn("Phase listener failed after {}: {}", phase.id(), e.getMessage(), e);
                }
            }
            return result;
        }

        private boolean dependencyMet(String dep) {
            if (ctx.status(dep).isDone()) {
                return true;
            }
            MigrationPhase depPhase = plan.phase(dep);
            return depPhase != null && ledger.hasTag(depPhase.tagId(), ctx.scope());
        }

        private void execute() {
            transition(PhaseStatus.VALIDATING);
            GateResult pre = gate.runPre(phase, ctx);
            record(pre);
            if (!pre.passed()) {
                fail("pre-validation failed: " + pre.describeBlocking());
                return;
            }

            RollbackSnapshot snapshot = null;
            if (phase.rollbackRequired()) {
                transition(PhaseStatus.SNAPSHOTTING);
                try {
                    AffectedRows affected = phase.handler().affectedRows(phase, ctx);
                    snapshot = rollbacks.snapshot(phase, ctx.scope(), affected);
                    ctx.snapshot(phase.id(), snapshot);
                } catch (MigrateException | RuntimeException e) {
                    fail("snapshot failed: " + e.getMessage());
                    return;
                }
            }

            transition(PhaseStatus.TRANSFERRING);
            try {
                transfer = phase.handler().execute(phase, ctx, new Progress());
            } catch (TransferAbortedException e) {
                transfer = e.getPartialResult();
                if (e.isCancelled()) {
                    cancelled = true;
                    error = e.getMessage();
                    log.warn("Phase {} cancelled in {}, snapshot kept", phase.id(), status);
                    return;
                }
                failAfterWrites(snapshot, e.getMessage());
                return;
            } catch (BatchWriteException e) {
                transfer = e.getPartialResult();
                failAfterWrites(snapshot, e.getMessage());
                return;
            } catch (MigrateException | RuntimeException e) {
                failAfterWrites(snapshot, "transfer failed: " + e.getMessage());
                return;
            }
            batches = transfer.batches();

            transition(PhaseStatus.POST_VALIDATING);
            GateResult post = gate.runPost(phase, ctx, transfer);
            record(post);
            if (!post.passed()) {
                failAfterWrites(snapshot, "post-validation failed: " + post.describeBlocking());
                return;
            }

            try {
                CommitOutcome outcome = ledger.commitTag(phase.tagId(), ctx.scope());
                if (outcome == CommitOutcome.ALREADY_COMMITTED) {
                    log.info("Tag {} was committed concurrently in {}", phase.tagId(), ctx.scope());
                }
            } catch (RuntimeException e) {
                failAfterWrites(snapshot, "ledger commit failed: " + e.getMessage());
                return;
            }
            transition(PhaseStatus.COMMITTED);

            if (snapshot != null) {
                try {
                    rollbacks.discard(snapshot);
                    ctx.snapshot(phase.id(), null);
                } catch (RuntimeException e) {
                    log.warn("Phase {} committed but its snapshot {} could not be discarded: {}",
                            phase.id(), snapshot.id(), e.getMessage());
                }
            }
            MigrationAlertLogger.phaseCommitted(ctx.runId(), phase.id(), phase.tagId(), transfer.copied(),
                    elapsedMs());
        }

        private void record(GateResult gateResult) {
            failures.addAll(gateResult.failures());
            for (ValidationFailure warning : gateResult.warnings()) {
                MigrationAlertLogger.validationWarning(ctx.runId(), phase.id(), warning.rule(), warning.message());
            }
        }

        private void failAfterWrites(RollbackSnapshot snapshot, String reason) {
            batches = transfer.batches();
            if (snapshot == null) {
                fail(reason);
                return;
            }
            transition(PhaseStatus.ROLLING_BACK);
            MigrationAlertLogger.rollbackTriggered(ctx.runId(), phase.id(), reason);
            try {
                int restored = rollbacks.restore(snapshot);
                ctx.snapshot(phase.id(), snapshot.markRestored());
                MigrationAlertLogger.rollbackCompleted(ctx.runId(), phase.id(), restored, true);
                fail(reason);
            } catch (RestoreException e) {
                restoreFailed = true;
                MigrationAlertLogger.rollbackCompleted(ctx.runId(), phase.id(), 0, false);
                fail(reason + "; " + e.getMessage());
            }
        }

        private void fail(String reason) {
            String stage = status.name();
            transition(PhaseStatus.FAILED);
            error = reason;
            MigrationAlertLogger.phaseFailed(ctx.runId(), phase.id(), stage, reason);
        }

        private void transition(PhaseStatus to) {
            if (!status.canTransitionTo(to)) {
                throw new IllegalStateException("Phase " + phase.id() + " cannot go from " + status + " to " + to);
            }
            PhaseStatus from = status;
            status = to;
            ctx.status(phase.id(), to);
            try {
                reporter.phaseStateChanged(ctx.runId(), phase.id(), from, to);
            } catch (RuntimeException e) {
                log.warn("Progress reporter failed on {} {} -> {}: {}", phase.id(), from, to, e.getMessage());
            }
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }

        private PhaseResult result() {
            List<RowError> rowErrors = transfer.errors();
            return new PhaseResult(phase.id(), status, transfer.copied(), rowErrors, failures, error,
                    elapsedMs(), restoreFailed);
        }

        /**
         * Forwards transfer progress to the reporter.
         */
        private final class Progress implements TransferListener {

            @Override
            public void onBatchFlushed(int batchNumber, int rows) {
                try {
                    reporter.batchFlushed(ctx.runId(), phase.id(), batchNumber, rows);
                } catch (RuntimeException e) {
                    log.warn("Progress reporter failed on batch {} of {}: {}", batchNumber, phase.id(), e.getMessage());
                }
            }

            @Override
            public void onRowError(RowError rowError) {
                log.debug("Phase {} row {} skipped: {}", phase.id(), rowError.sourceKey(), rowError.message());
            }
        }
    }

    /**
     * Builder for {@link MigrationOrchestrator}.
     */
    public static final class Builder {
        private MigrationConfig config = MigrationConfig.DEFAULTS;
        private StoreProvider stores;
        private MigrationLedger ledger;
        private SnapshotStore snapshots;
        private TransformRegistry transforms = new TransformRegistry();
        private MigrationPlan globalPlan;
        private MigrationPlan tenantPlan;
        private final List<MigrationDefinition> definitions = new ArrayList<>();
        private final List<PhaseListener> listeners = new ArrayList<>();
        private ProgressReporter reporter;

        private Builder() {}

        public Builder config(MigrationConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Loads the configuration from the classpath.
         *
         * @see MigrationConfigLoader#load()
         */
        public Builder loadConfig() {
            return config(MigrationConfigLoader.load());
        }

        public Builder stores(StoreProvider stores) {
            this.stores = stores;
            return this;
        }

        /** Defaults to a file ledger at {@code migration.ledger.file}, or an in-memory ledger. */
        public Builder ledger(MigrationLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        /** Defaults to YAML files under {@code migration.snapshot.dir}, or memory. */
        public Builder snapshots(SnapshotStore snapshots) {
            this.snapshots = snapshots;
            return this;
        }

        public Builder transforms(TransformRegistry transforms) {
            this.transforms = Objects.requireNonNull(transforms, "transforms");
            return this;
        }

        public Builder globalPlan(MigrationPlan plan) {
            this.globalPlan = plan;
            return this;
        }

        public Builder tenantPlan(MigrationPlan plan) {
            this.tenantPlan = plan;
            return this;
        }

        /**
         * Adds migration definitions. Their phases form the plans and their
         * transforms are registered at build time.
         */
        public Builder definitions(List<MigrationDefinition> definitions) {
            this.definitions.addAll(definitions);
            return this;
        }

        public Builder definition(MigrationDefinition definition) {
            this.definitions.add(Objects.requireNonNull(definition, "definition"));
            return this;
        }

        /**
         * Adds the definitions annotated with {@code @MigrationComponent} in a package.
         *
         * @throws datamigrator.exceptions.DefinitionNotFoundException if there are none
         */
        public Builder scan(String packagePrefix) {
            return scan(null, packagePrefix);
        }

        public Builder scan(ClassLoader classLoader, String packagePrefix) {
            return definitions(new ComponentResolver()
                    .resolveDefinitions(DefinitionScanner.scan(classLoader, packagePrefix)));
        }

        public Builder listener(PhaseListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder progressReporter(ProgressReporter reporter) {
            this.reporter = reporter;
            return this;
        }

        /**
         * @throws MigrateException if a plan is invalid
         * @throws IllegalStateException if no store provider is set, or plans
         *         are given both directly and through definitions
         */
        public MigrationOrchestrator build() throws MigrateException {
            if (stores == null) {
                throw new IllegalStateException("A store provider is required");
            }
            MigrationPlan global = globalPlan;
            MigrationPlan tenant = tenantPlan;
            if (!definitions.isEmpty()) {
                if (global != null || tenant != null) {
                    throw new IllegalStateException("Plans are given both directly and through definitions");
                }
                for (MigrationDefinition definition : definitions) {
                    definition.registerTransforms(transforms);
                }
                try {
                    global = MigrationPlan.fromDefinitions(definitions, true);
                    tenant = MigrationPlan.fromDefinitions(definitions, false);
                } catch (MigrateException e) {
                    throw new MigrateException("Failed to build migration plan", e);
                }
            }
            return new MigrationOrchestrator(this,
                    global != null ? global : MigrationPlan.empty(),
                    tenant != null ? tenant : MigrationPlan.empty());
        }
    }

    private static MigrationLedger defaultLedger(MigrationConfig config) {
        return config.ledgerFile() != null ? new FileMigrationLedger(config.ledgerFile()) : new InMemoryMigrationLedger();
    }

    private static SnapshotStore defaultSnapshots(MigrationConfig config) {
        return config.snapshotDir() != null ? new YamlSnapshotStore(config.snapshotDir()) : new InMemorySnapshotStore();
    }
}
