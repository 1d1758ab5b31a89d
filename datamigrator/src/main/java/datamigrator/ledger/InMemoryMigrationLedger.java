package datamigrator.ledger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MigrationLedger} held in memory. Durable only for the lifetime of the
 * process; intended for tests and single-process tools.
 */
public final class InMemoryMigrationLedger implements MigrationLedger {

    private final Map<String, Entry> tags = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryMigrationLedger() {
        this(Clock.systemUTC());
    }

    public InMemoryMigrationLedger(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean hasTag(String id, TagScope scope) {
        return tags.containsKey(key(id, scope));
    }

    @Override
    public CommitOutcome commitTag(String id, TagScope scope) {
        Entry entry = new Entry(new MigrationTag(id, scope, clock.instant()), sequence.incrementAndGet());
        return tags.putIfAbsent(key(id, scope), entry) == null
                ? CommitOutcome.COMMITTED
                : CommitOutcome.ALREADY_COMMITTED;
    }

    @Override
    public Optional<MigrationTag> find(String id, TagScope scope) {
        Entry entry = tags.get(key(id, scope));
        return entry == null ? Optional.empty() : Optional.of(entry.tag);
    }

    @Override
    public List<MigrationTag> tags(TagScope scope) {
        List<Entry> entries = new ArrayList<>();
        for (Entry e : tags.values()) {
            if (e.tag.scope().equals(scope)) {
                entries.add(e);
            }
        }
        entries.sort(Comparator.comparingLong(e -> e.seq));
        List<MigrationTag> result = new ArrayList<>(entries.size());
        entries.forEach(e -> result.add(e.tag));
        return result;
    }

    private static String key(String id, TagScope scope) {
        return scope.key() + '\t' + Objects.requireNonNull(id, "id");
    }

    private static final class Entry {
        final MigrationTag tag;
        final long seq;

        Entry(MigrationTag tag, long seq) {
            this.tag = tag;
            this.seq = seq;
        }
    }
}
