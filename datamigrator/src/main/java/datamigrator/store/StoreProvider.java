package datamigrator.store;

import datamigrator.ledger.TagScope;

/**
 * Resolves the record store a run works against.
 *
 * <p>Deployments that keep one database per tenant return a different store
 * for each per-tenant {@link TagScope}.
 */
@FunctionalInterface
public interface StoreProvider {

    RecordStore storeFor(TagScope scope);

    /**
     * Returns a provider that uses one store for every scope.
     */
    static StoreProvider single(RecordStore store) {
        return scope -> store;
    }
}
