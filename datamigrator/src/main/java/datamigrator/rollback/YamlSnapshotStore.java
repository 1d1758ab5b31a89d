package datamigrator.rollback;

import datamigrator.ledger.TagScope;
import datamigrator.row.FieldType;
import datamigrator.row.MapRow;
import datamigrator.row.Row;
import datamigrator.row.RowKey;
import datamigrator.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SnapshotStore} writing one YAML document per snapshot into a directory.
 *
 * <p>Each field value is written as a {@code {type, value}} pair, the value being
 * the {@link FieldType#format text form} of the typed value, so snapshots
 * restore with their exact Java types:
 * <pre>
 * phaseId: copy-grades
 * scope: tenant:acme
 * table: customer
 * capturedAt: '2025-01-20T10:15:30Z'
 * restored: false
 * rows:
 * - key: {type: LONG, value: '1'}
 *   before:
 *     id: {type: LONG, value: '1'}
 *     grade: {type: STRING, value: SILVER}
 * - key: {type: LONG, value: '7'}
 *   before: null
 * </pre>
 *
 * <p>Files are written to a temporary file first and then moved into place, so
 * a crash never leaves a half-written snapshot behind.
 */
public final class YamlSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(YamlSnapshotStore.class);

    private static final String SUFFIX = ".yml";

    private final Path directory;

    public YamlSnapshotStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void save(RollbackSnapshot snapshot) {
        Path file = fileFor(snapshot.phaseId(), snapshot.scope());
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, "snapshot", ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                yaml().dump(encode(snapshot), writer);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved {} to {}", snapshot, file);
        } catch (IOException e) {
            throw new StoreException("Failed to save snapshot " + snapshot.id() + " to " + file, e);
        }
    }

    @Override
    public Optional<RollbackSnapshot> find(String phaseId, TagScope scope) {
        Path file = fileFor(phaseId, scope);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public void delete(String phaseId, TagScope scope) {
        Path file = fileFor(phaseId, scope);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StoreException("Failed to delete snapshot " + file, e);
        }
    }

    @Override
    public List<RollbackSnapshot> list() {
        List<RollbackSnapshot> result = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return result;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                result.add(read(file));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list snapshots in " + directory, e);
        }
        return result;
    }

    private Path fileFor(String phaseId, TagScope scope) {
        return directory.resolve(URLEncoder.encode(scope.key(), StandardCharsets.UTF_8)
                + "__" + URLEncoder.encode(phaseId, StandardCharsets.UTF_8) + SUFFIX);
    }

    private RollbackSnapshot read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, Object> doc = yaml().load(reader);
            return decode(doc);
        } catch (IOException | YAMLException | ClassCastException | IllegalArgumentException e) {
            throw new StoreException("Failed to read snapshot " + file, e);
        }
    }

    private static Yaml yaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options);
    }

    private static Map<String, Object> encode(RollbackSnapshot snapshot) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("phaseId", snapshot.phaseId());
        doc.put("scope", snapshot.scope().key());
        doc.put("table", snapshot.table());
        doc.put("capturedAt", snapshot.capturedAt().toString());
        doc.put("restored", snapshot.restored());
        List<Map<String, Object>> rows = new ArrayList<>();
        for (CapturedRow captured : snapshot.capturedRows()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", encodeValue(captured.key().value()));
            if (captured.existed()) {
                Map<String, Object> before = new LinkedHashMap<>();
                captured.beforeImage().asMap().forEach((field, value) -> before.put(field, encodeValue(value)));
                entry.put("before", before);
            } else {
                entry.put("before", null);
            }
            rows.add(entry);
        }
        doc.put("rows", rows);
        return doc;
    }

    @SuppressWarnings("unchecked")
    private static RollbackSnapshot decode(Map<String, Object> doc) {
        List<CapturedRow> rows = new ArrayList<>();
        List<Map<String, Object>> entries = (List<Map<String, Object>>) doc.get("rows");
        if (entries != null) {
            for (Map<String, Object> entry : entries) {
                RowKey key = RowKey.of(decodeValue(entry.get("key")));
                Map<String, Object> before = (Map<String, Object>) entry.get("before");
                if (before == null) {
                    rows.add(CapturedRow.absent(key));
                } else {
                    Row row = new MapRow();
                    before.forEach((field, value) -> row.set(field, decodeValue(value)));
                    rows.add(CapturedRow.present(key, row));
                }
            }
        }
        return new RollbackSnapshot(
                (String) doc.get("phaseId"),
                TagScope.fromKey((String) doc.get("scope")),
                (String) doc.get("table"),
                Instant.parse(String.valueOf(doc.get("capturedAt"))),
                rows,
                Boolean.TRUE.equals(doc.get("restored")));
    }

    private static Map<String, Object> encodeValue(Object value) {
        if (value == null) {
            return null;
        }
        FieldType type = FieldType.of(value);
        Map<String, Object> pair = new LinkedHashMap<>();
        pair.put("type", type.name());
        pair.put("value", type.format(value));
        return pair;
    }

    @SuppressWarnings("unchecked")
    private static Object decodeValue(Object encoded) {
        if (encoded == null) {
            return null;
        }
        Map<String, Object> pair = (Map<String, Object>) encoded;
        FieldType type = FieldType.valueOf(String.valueOf(pair.get("type")));
        Object value = pair.get("value");
        return value == null ? null : type.parse(String.valueOf(value));
    }
}
