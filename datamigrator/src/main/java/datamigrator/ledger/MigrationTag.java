package datamigrator.ledger;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable marker proving a migration unit was applied in a scope.
 *
 * @param id the tag id, see {@link TagNames}
 * @param scope the scope the tag was committed in
 * @param appliedAt when the tag was committed
 */
public record MigrationTag(String id, TagScope scope, Instant appliedAt) {

    public MigrationTag {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(appliedAt, "appliedAt");
    }
}
