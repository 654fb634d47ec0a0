package io.devicerelay.billing;

import io.devicerelay.config.DeviceRelayConfig;
import io.devicerelay.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class RelayBillingTest {
    // 2023-11-14T22:13:20Z
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void chargeDebitsAtomicallyAndRefusesWhenBroke() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-billing-");
        try {
            SqliteCreditLedger ledger = openLedger(root);
            RelayBilling billing = new RelayBilling(ledger, 10, 0, 20);
            billing.grant("user-1", 25, NOW);

            Assertions.assertEquals(new RelayBilling.Charge(true, 10), billing.charge("user-1", "cmd-1", NOW));
            Assertions.assertEquals(new RelayBilling.Charge(true, 10), billing.charge("user-1", "cmd-2", NOW));
            Assertions.assertEquals(new RelayBilling.Charge(false, 10), billing.charge("user-1", "cmd-3", NOW));
            Assertions.assertEquals(5, billing.balance("user-1"));

            Assertions.assertEquals(new RelayBilling.Charge(false, 10), billing.charge("nobody", "cmd-4", NOW));
            Assertions.assertEquals(0, billing.balance("nobody"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void refundReturnsExactlyTheCharge() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-refund-");
        try {
            SqliteCreditLedger ledger = openLedger(root);
            RelayBilling billing = new RelayBilling(ledger, 7, 0, 20);
            billing.grant("user-1", 20, NOW);
            billing.charge("user-1", "cmd-1", NOW);
            billing.charge("user-1", "cmd-2", NOW);

            Assertions.assertEquals(7, billing.refund("user-1", "cmd-1", 7, NOW + 1));
            Assertions.assertEquals(0, billing.refund("user-1", "cmd-free", 0, NOW + 1));
            Assertions.assertEquals(13, billing.balance("user-1"));

            UsageStats stats = billing.usageStats("user-1", NOW + 2);
            Assertions.assertEquals(2, stats.totalCommands());
            Assertions.assertEquals(7, stats.totalCreditsUsed());
            Assertions.assertEquals(2, stats.commandsToday());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void compensationIsRecordedSeparatelyFromRefund() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-compensate-");
        try {
            SqliteCreditLedger ledger = openLedger(root);
            RelayBilling billing = new RelayBilling(ledger, 10, 0, 20);
            billing.grant("user-1", 10, NOW);
            billing.charge("user-1", "cmd-1", NOW);
            billing.compensate("user-1", "cmd-1", 10, NOW + 1);

            Assertions.assertEquals(10, billing.balance("user-1"));
            Assertions.assertEquals(0, billing.usageStats("user-1", NOW + 2).totalCreditsUsed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void freeCommandsAreCountedPerUtcDay() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-free-tier-");
        try {
            SqliteCreditLedger ledger = openLedger(root);
            RelayBilling billing = new RelayBilling(ledger, 10, 2, 20);

            Assertions.assertEquals(new RelayBilling.Charge(true, 0), billing.charge("user-1", "cmd-1", NOW));
            Assertions.assertEquals(new RelayBilling.Charge(true, 0), billing.charge("user-1", "cmd-2", NOW + 1));
            Assertions.assertEquals(new RelayBilling.Charge(false, 10), billing.charge("user-1", "cmd-3", NOW + 2));

            long nextDay = NOW + 24L * 60L * 60L * 1000L;
            Assertions.assertEquals(new RelayBilling.Charge(true, 0), billing.charge("user-1", "cmd-4", nextDay));
            Assertions.assertEquals(1, billing.usageStats("user-1", nextDay).commandsToday());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentChargesNeverExceedTheFreeQuota() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-free-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            SqliteCreditLedger ledger = openLedger(root);
            RelayBilling billing = new RelayBilling(ledger, 10, 2, 20);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<RelayBilling.Charge>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String commandId = "cmd-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return billing.charge("user-1", commandId, NOW);
                }));
            }
            start.countDown();
            int free = 0;
            for (Future<RelayBilling.Charge> future : futures) {
                RelayBilling.Charge charge = future.get(30, TimeUnit.SECONDS);
                if (charge.accepted()) {
                    Assertions.assertEquals(0, charge.credits());
                    free++;
                } else {
                    Assertions.assertEquals(10, charge.credits());
                }
            }
            Assertions.assertEquals(2, free);
            Assertions.assertEquals(2, billing.usageStats("user-1", NOW).totalCommands());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void pendingLimitAndDayBoundary() {
        RelayBilling billing = new RelayBilling(null, 10, 0, 3);
        Assertions.assertFalse(billing.atPendingLimit(2));
        Assertions.assertTrue(billing.atPendingLimit(3));
        Assertions.assertEquals(1_699_920_000_000L, RelayBilling.startOfDayUtc(NOW));
    }

    private static SqliteCreditLedger openLedger(Path root) {
        Database db = new Database(DeviceRelayConfig.fromRoot(root.toString()));
        db.init();
        return new SqliteCreditLedger(db);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
