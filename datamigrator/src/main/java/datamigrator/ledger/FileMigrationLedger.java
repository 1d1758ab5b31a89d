package datamigrator.ledger;

import datamigrator.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link MigrationLedger} persisted in an append-only text file.
 *
 * <p>Each line holds one tag: {@code appliedAt TAB scopeKey TAB id}. Lines are
 * only ever appended.
 *
 * <p>Commits are serialized twice: by a lock shared by every ledger instance
 * of this JVM that uses the same file, and by an exclusive {@link FileLock} that
 * serializes separate processes. Under both locks the file is re-read, so the
 * existence check and the append form one atomic step. Appends are forced to
 * disk before the commit returns.
 *
 * <p>I/O failures are reported as {@link StoreException}.
 */
public final class FileMigrationLedger implements MigrationLedger {

    private static final Logger log = LoggerFactory.getLogger(FileMigrationLedger.class);

    private static final Map<Path, ReentrantLock> FILE_LOCKS = new ConcurrentHashMap<>();

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock;

    public FileMigrationLedger(Path file) {
        this(file, Clock.systemUTC());
    }

    public FileMigrationLedger(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lock = FILE_LOCKS.computeIfAbsent(this.file, p -> new ReentrantLock());
    }

    public Path file() {
        return file;
    }

    @Override
    public boolean hasTag(String id, TagScope scope) {
        return find(id, scope).isPresent();
    }

    @Override
    public CommitOutcome commitTag(String id, TagScope scope) {
        requireValidId(id);
        lock.lock();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                for (MigrationTag tag : parse(readAll(channel))) {
                    if (tag.id().equals(id) && tag.scope().equals(scope)) {
                        log.debug("Tag {} already committed in {}", id, scope);
                        return CommitOutcome.ALREADY_COMMITTED;
                    }
                }
                Instant now = clock.instant();
                String line = now + "\t" + scope.key() + "\t" + id + "\n";
                channel.position(channel.size());
                ByteBuffer buf = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
                while (buf.hasRemaining()) {
                    channel.write(buf);
                }
                channel.force(true);
                log.debug("Committed tag {} in {} to {}", id, scope, file);
                return CommitOutcome.COMMITTED;
            }
        } catch (IOException e) {
            throw new StoreException("Failed to commit tag " + id + " to ledger " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<MigrationTag> find(String id, TagScope scope) {
        for (MigrationTag tag : readTags()) {
            if (tag.id().equals(id) && tag.scope().equals(scope)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<MigrationTag> tags(TagScope scope) {
        List<MigrationTag> result = new ArrayList<>();
        for (MigrationTag tag : readTags()) {
            if (tag.scope().equals(scope)) {
                result.add(tag);
            }
        }
        return result;
    }

    private List<MigrationTag> readTags() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StoreException("Failed to read ledger " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private static String readAll(FileChannel channel) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate((int) channel.size());
        channel.position(0);
        while (buf.hasRemaining() && channel.read(buf) >= 0) {
            // keep reading until full
        }
        return new String(buf.array(), 0, buf.position(), StandardCharsets.UTF_8);
    }

    private List<MigrationTag> parse(String content) {
        List<MigrationTag> tags = new ArrayList<>();
        int lineNo = 0;
        for (String line : content.split("\n")) {
            lineNo++;
            if (line.isEmpty()) continue;
            String[] parts = line.split("\t", 3);
            if (parts.length != 3) {
                log.warn("Ignoring malformed ledger line {} in {}: {}", lineNo, file, line);
                continue;
            }
            try {
                tags.add(new MigrationTag(parts[2], TagScope.fromKey(parts[1]), Instant.parse(parts[0])));
            } catch (DateTimeParseException | IllegalArgumentException e) {
                log.warn("Ignoring malformed ledger line {} in {}: {}", lineNo, file, e.getMessage());
            }
        }
        return tags;
    }

    private static void requireValidId(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isEmpty() || id.indexOf('\t') >= 0 || id.indexOf('\n') >= 0 || id.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Tag id must be non-empty without tabs or line breaks: '" + id + "'");
        }
    }
}
