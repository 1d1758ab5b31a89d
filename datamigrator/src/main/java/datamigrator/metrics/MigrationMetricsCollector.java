package datamigrator.metrics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects JVM and row metrics during a migration run using JMX.
 *
 * <p>This collector tracks:
 * <ul>
 *   <li>Heap memory usage (before and after)</li>
 *   <li>CPU load (before, after, and peak)</li>
 *   <li>Per-phase timing using {@link #timed(String, ThrowingSupplier)}</li>
 *   <li>Rows transferred, row errors and flushed batches</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector();
 * collector.start(runId);
 *
 * PhaseResult result = collector.timed("copy-grades", () -&gt; runPhase(phase));
 * collector.rowsTransferred(result.rowsTransferred());
 *
 * MigrationMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>One collector serves one run at a time; it is not thread-safe.
 *
 * @see MigrationMetrics
 */
public final class MigrationMetricsCollector {

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final int availableProcessors = Runtime.getRuntime().availableProcessors();

    private final Map<String, Long> phaseDurations = new LinkedHashMap<>();
    private MigrationMetrics.Builder builder;

    private Instant startTime;
    private double cpuLoadPeak;
    private long rowsTransferred;
    private long rowErrors;
    private long batchesFlushed;

    /**
     * Starts metrics collection for a new run.
     *
     * @param runId the run identifier
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(long runId) {
        this.startTime = Instant.now();
        this.phaseDurations.clear();
        this.rowsTransferred = 0;
        this.rowErrors = 0;
        this.batchesFlushed = 0;
        this.builder = MigrationMetrics.builder();

        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        double cpuLoad = getCpuLoad();
        this.cpuLoadPeak = cpuLoad;

        builder.runId(runId)
               .startTime(startTime)
               .heapBefore(heap.getUsed(), heap.getCommitted(), heap.getMax())
               .nonHeapUsedBefore(memoryBean.getNonHeapMemoryUsage().getUsed())
               .cpuLoadBefore(cpuLoad)
               .availableProcessors(availableProcessors);

        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(String phaseId, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            phaseDurations.put(phaseId, Duration.ofNanos(System.nanoTime() - start).toMillis());
            sampleCpu();
        }
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(String phaseId, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            phaseDurations.put(phaseId, Duration.ofNanos(System.nanoTime() - start).toMillis());
            sampleCpu();
        }
    }

    /** Adds to the number of rows written. */
    public MigrationMetricsCollector rowsTransferred(long count) {
        rowsTransferred += count;
        return this;
    }

    /** Adds to the number of row errors. */
    public MigrationMetricsCollector rowErrors(long count) {
        rowErrors += count;
        return this;
    }

    /** Adds to the number of flushed batches. */
    public MigrationMetricsCollector batchesFlushed(long count) {
        batchesFlushed += count;
        return this;
    }

    public MigrationMetricsCollector phaseCount(int count) {
        builder.phaseCount(count);
        return this;
    }

    /**
     * Finishes metrics collection and returns the final metrics.
     *
     * @return the collected run metrics
     */
    public MigrationMetrics finish() {
        Instant endTime = Instant.now();
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        double cpuLoadAfter = getCpuLoad();

        return builder
                .endTime(endTime)
                .heapAfter(heap.getUsed(), heap.getCommitted(), heap.getMax())
                .nonHeapUsedAfter(memoryBean.getNonHeapMemoryUsage().getUsed())
                .cpuLoadAfter(cpuLoadAfter)
                .cpuLoadPeak(Math.max(cpuLoadPeak, cpuLoadAfter))
                .phaseDurations(phaseDurations)
                .rowsTransferred(rowsTransferred)
                .rowErrors(rowErrors)
                .batchesFlushed(batchesFlushed)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }

    private void sampleCpu() {
        double current = getCpuLoad();
        if (current > cpuLoadPeak) {
            cpuLoadPeak = current;
        }
    }

    private double getCpuLoad() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            double load = sunBean.getCpuLoad();
            if (load >= 0) return load;
            load = sunBean.getProcessCpuLoad();
            if (load >= 0) return load;
        }
        double loadAvg = osBean.getSystemLoadAverage();
        return loadAvg >= 0 ? Math.min(1.0, loadAvg / availableProcessors) : -1;
    }
}
