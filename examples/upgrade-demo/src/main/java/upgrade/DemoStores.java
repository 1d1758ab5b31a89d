package upgrade;

import datamigrator.ledger.TagScope;
import datamigrator.row.MapRow;
import datamigrator.store.InMemoryRecordStore;
import datamigrator.store.RecordStore;
import datamigrator.store.StoreProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static upgrade.components.CustomerGradeUpgrade.CUSTOMER_GRADE;
import static upgrade.components.CustomerGradeUpgrade.GRADE_LEVEL;
import static upgrade.components.CustomerGradeUpgrade.GRADE_LEVEL_SETUP;
import static upgrade.components.CustomerGradeUpgrade.LEGACY_CUSTOMER;

/**
 * One in-memory database per tenant plus a system database for the global
 * scope, each seeded with sample legacy data on first use.
 */
public final class DemoStores implements StoreProvider {

    private static final Logger log = LoggerFactory.getLogger(DemoStores.class);

    private final InMemoryRecordStore system = seedSystem(new InMemoryRecordStore());
    private final Map<String, InMemoryRecordStore> tenants = new ConcurrentHashMap<>();

    @Override
    public RecordStore storeFor(TagScope scope) {
        return scope.isGlobal() ? system : tenant(scope.tenantId());
    }

    public InMemoryRecordStore system() {
        return system;
    }

    public InMemoryRecordStore tenant(String tenantId) {
        return tenants.computeIfAbsent(tenantId, DemoStores::seedTenant);
    }

    private static InMemoryRecordStore seedSystem(InMemoryRecordStore store) {
        store.createTable(GRADE_LEVEL_SETUP.name(), GRADE_LEVEL_SETUP.keyField());
        store.createTable(GRADE_LEVEL.name(), GRADE_LEVEL.keyField());
        store.upsert(GRADE_LEVEL_SETUP.name(), List.of(
                MapRow.of("code", "GOLD", "min_revenue", new BigDecimal("100000"), "description", "Key account"),
                MapRow.of("code", "SILVER", "min_revenue", new BigDecimal("10000"), "description", "Regular"),
                MapRow.of("code", "STANDARD", "min_revenue", BigDecimal.ZERO, "description", "Occasional")));
        return store;
    }

    private static InMemoryRecordStore seedTenant(String tenantId) {
        InMemoryRecordStore store = new InMemoryRecordStore();
        store.createTable(LEGACY_CUSTOMER.name(), LEGACY_CUSTOMER.keyField());
        store.createTable(CUSTOMER_GRADE.name(), CUSTOMER_GRADE.keyField());
        store.upsert(LEGACY_CUSTOMER.name(), List.of(
                customer("C10000", "Adatum Corporation", "250000.00", LocalDate.of(2012, 4, 2), false),
                customer("C20000", "Trey Research", "48200.50", LocalDate.of(2016, 9, 14), false),
                customer("C30000", "School of Fine Art", "3100.00", LocalDate.of(2019, 1, 7), true),
                customer("C40000", "Alpine Ski House", "-120.00", LocalDate.of(2020, 11, 30), false),
                customer("C50000", "Relecloud", "9999.99", LocalDate.of(2021, 6, 1), true)));
        log.debug("Seeded demo data for tenant {}", tenantId);
        return store;
    }

    private static MapRow customer(String no, String name, String revenue, LocalDate since, boolean blocked) {
        return MapRow.of("no", no, "name", name, "revenue", new BigDecimal(revenue),
                "since", since, "blocked", blocked);
    }
}
