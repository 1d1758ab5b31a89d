package datamigrator.ledger;

import java.util.Objects;

/**
 * Granularity at which a migration tag is tracked: once per deployment
 * (global) or once per tenant.
 *
 * @param tenantId the tenant id, or null for the global scope
 */
public record TagScope(String tenantId) {

    private static final TagScope GLOBAL = new TagScope(null);

    public TagScope {
        if (tenantId != null) {
            if (tenantId.isBlank()) {
                throw new IllegalArgumentException("tenantId must not be blank");
            }
            if (tenantId.indexOf('\t') >= 0 || tenantId.indexOf('\n') >= 0 || tenantId.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("tenantId must not contain tabs or line breaks: " + tenantId);
            }
        }
    }

    public static TagScope global() {
        return GLOBAL;
    }

    public static TagScope perTenant(String tenantId) {
        return new TagScope(Objects.requireNonNull(tenantId, "tenantId"));
    }

    public boolean isGlobal() {
        return tenantId == null;
    }

    /**
     * Returns a stable text form: {@code global} or {@code tenant:<id>}.
     */
    public String key() {
        return isGlobal() ? "global" : "tenant:" + tenantId;
    }

    /**
     * Parses the output of {@link #key()}.
     *
     * @throws IllegalArgumentException if the text is not a scope key
     */
    public static TagScope fromKey(String key) {
        if ("global".equals(key)) {
            return GLOBAL;
        }
        if (key != null && key.startsWith("tenant:")) {
            return perTenant(key.substring("tenant:".length()));
        }
        throw new IllegalArgumentException("Not a scope key: " + key);
    }

    @Override
    public String toString() {
        return key();
    }
}
