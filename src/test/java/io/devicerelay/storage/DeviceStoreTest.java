package io.devicerelay.storage;

import io.devicerelay.config.DeviceRelayConfig;
import io.devicerelay.model.DeviceRecord;
import io.devicerelay.security.DeviceTokens;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

final class DeviceStoreTest {
    private static final long NOW = 1_700_000_000_000L;
    private static final long CODE_TTL = 10L * 60L * 1000L;

    @Test
    void pairingRegistersDeviceAndConsumesCode() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-pairing-");
        try {
            DeviceStore store = openStore(root);
            DeviceStore.PairingCode code = store.issuePairingCode("user-1", () -> "123456", CODE_TTL, NOW);
            Assertions.assertEquals("123456", code.code());
            Assertions.assertEquals(NOW + CODE_TTL, code.expiresAtMs());

            String tokenHash = DeviceTokens.hash("dr_token_1");
            DeviceStore.PairingOutcome outcome = store.completePairing("123456",
                    new DeviceStore.DeviceRegistration("Work Laptop", "LAPTOP", "darwin", List.of("shell", "file", "bogus")),
                    tokenHash, 5, NOW + 1);
            Assertions.assertTrue(outcome.success());
            Assertions.assertEquals("user-1", outcome.userId());

            DeviceRecord device = store.findByTokenHash(tokenHash).orElseThrow();
            Assertions.assertEquals(outcome.deviceId(), device.deviceId());
            Assertions.assertEquals("Work Laptop", device.deviceName());
            Assertions.assertEquals("laptop", device.deviceType());
            Assertions.assertEquals(List.of("shell", "file"), device.capabilities());
            Assertions.assertTrue(device.online());
            Assertions.assertTrue(store.findByName("user-1", "work laptop").isPresent());
            Assertions.assertTrue(store.findByName("user-2", "Work Laptop").isEmpty());

            DeviceStore.PairingOutcome reused = store.completePairing("123456",
                    new DeviceStore.DeviceRegistration("Other", null, null, null), DeviceTokens.hash("dr_token_2"), 5, NOW + 2);
            Assertions.assertFalse(reused.success());
            Assertions.assertEquals("invalid_or_expired_code", reused.error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void activeCodeIsReusedUntilItExpires() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-pair-code-");
        try {
            DeviceStore store = openStore(root);
            Iterator<String> codes = List.of("111111", "111111", "222222", "333333").iterator();
            Assertions.assertEquals("111111", store.issuePairingCode("user-1", codes::next, CODE_TTL, NOW).code());
            Assertions.assertEquals("111111", store.issuePairingCode("user-1", codes::next, CODE_TTL, NOW + 1).code());
            // 111111 is still active for user-1, so user-2 gets the next free code
            Assertions.assertEquals("222222", store.issuePairingCode("user-2", codes::next, CODE_TTL, NOW + 2).code());
            Assertions.assertEquals("333333", store.issuePairingCode("user-1", codes::next, CODE_TTL, NOW + CODE_TTL + 1).code());

            DeviceStore.PairingOutcome expired = store.completePairing("111111",
                    new DeviceStore.DeviceRegistration("pc", "desktop", "linux", List.of()), DeviceTokens.hash("t"), 5,
                    NOW + CODE_TTL + 2);
            Assertions.assertEquals("invalid_or_expired_code", expired.error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void duplicateNamesAndDeviceLimitAreRefused() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-device-limit-");
        try {
            DeviceStore store = openStore(root);
            pair(store, "100001", "desk", 2);
            pair(store, "100002", "laptop", 2);

            store.issuePairingCode("user-1", () -> "100003", CODE_TTL, NOW);
            DeviceStore.PairingOutcome limited = store.completePairing("100003",
                    new DeviceStore.DeviceRegistration("phone", "mobile", "ios", List.of()), DeviceTokens.hash("t3"), 2, NOW);
            Assertions.assertEquals("device_limit_reached", limited.error());

            DeviceStore.PairingOutcome duplicate = store.completePairing("100003",
                    new DeviceStore.DeviceRegistration("DESK", "desktop", "linux", List.of()), DeviceTokens.hash("t4"), 5, NOW);
            Assertions.assertEquals("duplicate_device_name", duplicate.error());

            DeviceStore.PairingOutcome blank = store.completePairing("100003",
                    new DeviceStore.DeviceRegistration("  ", "desktop", "linux", List.of()), DeviceTokens.hash("t5"), 5, NOW);
            Assertions.assertEquals("missing_device_name", blank.error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void heartbeatOfflineAndRemoval() throws Exception {
        Path root = Files.createTempDirectory("devicerelay-test-heartbeat-");
        try {
            DeviceStore store = openStore(root);
            DeviceRecord desk = pair(store, "100001", "desk", 5);
            DeviceRecord laptop = pair(store, "100002", "laptop", 5);

            store.markSeen(desk.deviceId(), NOW + 60_000);
            Assertions.assertEquals(1, store.markOffline(NOW + 30_000));
            List<DeviceRecord> devices = store.listDevices("user-1");
            Assertions.assertEquals(2, devices.size());
            Assertions.assertTrue(devices.stream().filter(d -> d.deviceId().equals(desk.deviceId())).findFirst().orElseThrow().online());
            Assertions.assertFalse(devices.stream().filter(d -> d.deviceId().equals(laptop.deviceId())).findFirst().orElseThrow().online());

            Assertions.assertFalse(store.remove("user-2", desk.deviceId()));
            Assertions.assertTrue(store.remove("user-1", desk.deviceId()));
            Assertions.assertTrue(store.findByTokenHash(DeviceTokens.hash("token-desk")).isEmpty());
            Assertions.assertEquals(1, store.listDevices("user-1").size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static DeviceRecord pair(DeviceStore store, String code, String name, int maxDevices) {
        store.issuePairingCode("user-1", () -> code, CODE_TTL, NOW);
        String tokenHash = DeviceTokens.hash("token-" + name);
        DeviceStore.PairingOutcome outcome = store.completePairing(code,
                new DeviceStore.DeviceRegistration(name, "desktop", "linux", List.of("shell")), tokenHash, maxDevices, NOW);
        Assertions.assertTrue(outcome.success(), outcome.error());
        return store.findByTokenHash(tokenHash).orElseThrow();
    }

    private static DeviceStore openStore(Path root) {
        Database db = new Database(DeviceRelayConfig.fromRoot(root.toString()));
        db.init();
        return new DeviceStore(db);
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
