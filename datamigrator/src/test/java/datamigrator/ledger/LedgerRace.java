package datamigrator.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Commits one tag from many threads at once.
 */
final class LedgerRace {

    private LedgerRace() {}

    static List<CommitOutcome> commitConcurrently(Supplier<MigrationLedger> ledgers, String id, TagScope scope,
                                                  int threads) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CommitOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                MigrationLedger ledger = ledgers.get();
                futures.add(pool.submit(() -> {
                    start.await();
                    return ledger.commitTag(id, scope);
                }));
            }
            start.countDown();
            List<CommitOutcome> outcomes = new ArrayList<>();
            for (Future<CommitOutcome> f : futures) {
                outcomes.add(f.get());
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }
}
