package datamigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one migration run.
 *
 * <p>Captures:
 * <ul>
 *   <li>Timing information (total duration, per-phase durations)</li>
 *   <li>Memory metrics (heap usage before/after)</li>
 *   <li>CPU metrics (load before/after/peak)</li>
 *   <li>Row counts (transferred, row errors) and flushed batches</li>
 * </ul>
 *
 * <p>Use {@link #summary()} for a human-readable summary, or {@link #toMap()}
 * for serialization.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        long runId,
        Instant startTime,
        Instant endTime,
        MemoryMetrics memoryBefore,
        MemoryMetrics memoryAfter,
        CpuMetrics cpu,
        Map<String, Long> phaseDurations,
        long totalDurationMs,
        long rowsTransferred,
        long rowErrors,
        long batchesFlushed,
        int phaseCount
) {

    /**
     * Memory usage snapshot.
     *
     * @param heapUsed bytes of heap memory in use
     * @param heapCommitted bytes of heap memory committed
     * @param heapMax maximum heap size in bytes
     * @param nonHeapUsed bytes of non-heap memory in use
     */
    public record MemoryMetrics(long heapUsed, long heapCommitted, long heapMax, long nonHeapUsed) {
        public String heapSummary() {
            return String.format(Locale.ROOT, "%s / %s (max %s)",
                    formatBytes(heapUsed), formatBytes(heapCommitted), formatBytes(heapMax));
        }
    }

    /**
     * CPU usage metrics.
     *
     * @param before CPU load before the run (0.0-1.0)
     * @param after CPU load after the run (0.0-1.0)
     * @param peak peak CPU load sampled between phases (0.0-1.0)
     * @param processors number of available processors
     */
    public record CpuMetrics(double before, double after, double peak, int processors) {
        public String summary() {
            return String.format(Locale.ROOT, "%.1f%% -> %.1f%% (peak: %.1f%%)", before * 100, after * 100, peak * 100);
        }
    }

    /**
     * Returns the change in heap memory usage during the run.
     *
     * @return heap delta in bytes (positive means increase)
     */
    public long heapDelta() {
        return memoryAfter.heapUsed - memoryBefore.heapUsed;
    }

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a phase.
     *
     * @param phaseId the phase to query
     * @return duration in milliseconds, or 0 if the phase was not timed
     */
    public long phaseDuration(String phaseId) {
        return phaseDurations.getOrDefault(phaseId, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Run #%d in %dms | Heap: %s (delta: %s) | CPU: %s | Rows: %d transferred, %d errors in %d batches",
                runId, totalDurationMs, memoryAfter.heapSummary(), formatBytes(heapDelta()),
                cpu.summary(), rowsTransferred, rowErrors, batchesFlushed);
    }

    /**
     * Converts the metrics to a flat map.
     *
     * @return a map containing all metric values
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("heapUsedBefore", memoryBefore.heapUsed);
        map.put("heapUsedAfter", memoryAfter.heapUsed);
        map.put("heapDelta", heapDelta());
        map.put("cpuLoadBefore", cpu.before);
        map.put("cpuLoadAfter", cpu.after);
        map.put("cpuLoadPeak", cpu.peak);
        map.put("rowsTransferred", rowsTransferred);
        map.put("rowErrors", rowErrors);
        map.put("batchesFlushed", batchesFlushed);
        map.put("phaseCount", phaseCount);
        phaseDurations.forEach((phaseId, duration) -> map.put("phase." + phaseId + ".durationMs", duration));
        return map;
    }

    private static String formatBytes(long bytes) {
        if (Math.abs(bytes) < 1024) return bytes + "B";
        if (Math.abs(bytes) < 1024 * 1024) return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
        if (Math.abs(bytes) < 1024 * 1024 * 1024) return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024));
        return String.format(Locale.ROOT, "%.2fGB", bytes / (1024.0 * 1024 * 1024));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing {@link MigrationMetrics} instances.
     */
    public static class Builder {
        private long runId;
        private Instant startTime;
        private Instant endTime;
        private long heapUsedBefore, heapCommittedBefore, heapMaxBefore, nonHeapUsedBefore;
        private long heapUsedAfter, heapCommittedAfter, heapMaxAfter, nonHeapUsedAfter;
        private double cpuBefore, cpuAfter, cpuPeak;
        private int processors;
        private final Map<String, Long> phaseDurations = new LinkedHashMap<>();
        private long totalDurationMs;
        private long rowsTransferred, rowErrors, batchesFlushed;
        private int phaseCount;

        public Builder runId(long id) { this.runId = id; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder heapBefore(long used, long committed, long max) {
            this.heapUsedBefore = used;
            this.heapCommittedBefore = committed;
            this.heapMaxBefore = max;
            return this;
        }

        public Builder heapAfter(long used, long committed, long max) {
            this.heapUsedAfter = used;
            this.heapCommittedAfter = committed;
            this.heapMaxAfter = max;
            return this;
        }

        public Builder nonHeapUsedBefore(long v) { this.nonHeapUsedBefore = v; return this; }
        public Builder nonHeapUsedAfter(long v) { this.nonHeapUsedAfter = v; return this; }
        public Builder cpuLoadBefore(double v) { this.cpuBefore = v; return this; }
        public Builder cpuLoadAfter(double v) { this.cpuAfter = v; return this; }
        public Builder cpuLoadPeak(double v) { this.cpuPeak = v; return this; }
        public Builder availableProcessors(int v) { this.processors = v; return this; }

        public Builder phaseDurations(Map<String, Long> durations) {
            this.phaseDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder rowsTransferred(long v) { this.rowsTransferred = v; return this; }
        public Builder rowErrors(long v) { this.rowErrors = v; return this; }
        public Builder batchesFlushed(long v) { this.batchesFlushed = v; return this; }
        public Builder phaseCount(int v) { this.phaseCount = v; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(
                    runId, startTime, endTime,
                    new MemoryMetrics(heapUsedBefore, heapCommittedBefore, heapMaxBefore, nonHeapUsedBefore),
                    new MemoryMetrics(heapUsedAfter, heapCommittedAfter, heapMaxAfter, nonHeapUsedAfter),
                    new CpuMetrics(cpuBefore, cpuAfter, cpuPeak, processors),
                    Collections.unmodifiableMap(new LinkedHashMap<>(phaseDurations)),
                    totalDurationMs, rowsTransferred, rowErrors, batchesFlushed, phaseCount
            );
        }
    }
}
