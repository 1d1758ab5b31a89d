package datamigrator.history;

import datamigrator.engine.RunReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe, bounded list of the most recent runs of one orchestrator.
 *
 * <p>The bound comes from {@code migration.history.size}; the oldest entries
 * are dropped first.
 */
public final class RunHistory {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<RunHistoryEntry> entries = new ArrayList<>();
    private volatile int maxSize;

    public RunHistory(int maxSize) {
        setMaxSize(maxSize);
    }

    public void add(RunReport report) {
        lock.writeLock().lock();
        try {
            entries.add(0, RunHistoryEntry.of(report));
            trim();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Set the maximum number of entries to keep.
     *
     * @throws IllegalArgumentException if size is not positive
     */
    public void setMaxSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + size);
        }
        lock.writeLock().lock();
        try {
            this.maxSize = size;
            trim();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    /** Returns the entries, most recent first. */
    public List<RunHistoryEntry> entries() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns the report of the most recent run. */
    public Optional<RunReport> last() {
        lock.readLock().lock();
        try {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0).report());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void trim() {
        while (entries.size() > maxSize) {
            entries.remove(entries.size() - 1);
        }
    }
}
