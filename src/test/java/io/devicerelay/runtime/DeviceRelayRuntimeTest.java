package io.devicerelay.runtime;

import io.devicerelay.billing.UsageStats;
import io.devicerelay.config.RelaySettings;
import io.devicerelay.model.ClaimedCommand;
import io.devicerelay.model.CommandPayload;
import io.devicerelay.model.CommandStatus;
import io.devicerelay.model.CommandType;
import io.devicerelay.model.DeviceRecord;
import io.devicerelay.model.ExecutionLogEntry;
import io.devicerelay.model.RiskLevel;
import io.devicerelay.security.EncryptedBlob;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class DeviceRelayRuntimeTest {

    @Test
    void destructiveShellIsBlockedWithoutChargeOrQueue() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-blocked-")) {
            DeviceRelayRuntime rt = fx.runtime;
            fx.pair("user-1", "laptop");
            rt.grantCredits("user-1", 100);

            DeviceRelayRuntime.SendOutcome out = rt.send("user-1", "laptop", "rm -rf /");

            Assertions.assertFalse(out.success());
            Assertions.assertTrue(out.blocked());
            Assertions.assertNull(out.commandId());
            Assertions.assertEquals(0, out.creditsCharged());
            Assertions.assertTrue(out.safetyWarning().startsWith("Blocked: "));
            Assertions.assertEquals(100, rt.balance("user-1"));
            Assertions.assertTrue(rt.getRecentCommands("user-1", 10).isEmpty());
            Assertions.assertEquals(0, rt.usageStats("user-1").totalCommands());
        }
    }

    @Test
    void fileReadInsideWorkspaceRunsThroughFullLifecycle() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-lifecycle-")) {
            DeviceRelayRuntime rt = fx.runtime;
            String token = fx.pair("user-1", "laptop");
            DeviceRecord device = fx.device(token);
            rt.grantCredits("user-1", 100);

            DeviceRelayRuntime.SendOutcome sent = rt.send("user-1", "Laptop", "read ~/notes.txt");
            Assertions.assertTrue(sent.success());
            Assertions.assertFalse(sent.confirmationRequired());
            Assertions.assertEquals(CommandStatus.PENDING, sent.status());
            Assertions.assertEquals(RiskLevel.LOW, sent.riskLevel());
            Assertions.assertEquals(10, sent.creditsCharged());
            Assertions.assertEquals(90, rt.balance("user-1"));

            List<ClaimedCommand> claimed = rt.delivery().poll(device);
            Assertions.assertEquals(1, claimed.size());
            ClaimedCommand cmd = claimed.get(0);
            Assertions.assertEquals(sent.commandId(), cmd.commandId());
            CommandPayload payload = rt.codec()
                    .decryptJson(cmd.encryptedCommand(), cmd.iv(), cmd.authTag(), CommandPayload.class)
                    .orElseThrow();
            Assertions.assertEquals(CommandType.FILE_READ, payload.type());
            Assertions.assertEquals("~/notes.txt", payload.command());
            Assertions.assertEquals(CommandStatus.DELIVERED,
                    rt.getCommandResult(sent.commandId(), "user-1").orElseThrow().status());

            Assertions.assertTrue(rt.delivery().progress(device, cmd.commandId(), "started", "reading file", null));
            Assertions.assertEquals(CommandStatus.EXECUTING,
                    rt.getCommandResult(sent.commandId(), "user-1").orElseThrow().status());

            EncryptedBlob result = rt.codec().encrypt("buy milk");
            Assertions.assertTrue(rt.delivery().submitResult(device, cmd.commandId(),
                    result.ciphertext(), result.iv(), result.authTag(), "1 line", "completed"));

            DeviceRelayRuntime.CommandResultView view = rt.getCommandResult(sent.commandId().substring(0, 8), "user-1")
                    .orElseThrow();
            Assertions.assertEquals(CommandStatus.COMPLETED, view.status());
            Assertions.assertEquals("buy milk", view.output());
            Assertions.assertEquals("1 line", view.resultSummary());
            Assertions.assertFalse(view.decryptFailed());
            Assertions.assertEquals("laptop", view.deviceName());

            List<String> events = rt.getExecutionLog(sent.commandId(), "user-1").orElseThrow().entries().stream()
                    .map(ExecutionLogEntry::event).toList();
            Assertions.assertEquals(List.of("created", "delivered", "started"), events);
            Assertions.assertEquals(90, rt.balance("user-1"));
            Assertions.assertEquals(CommandStatus.COMPLETED, rt.getRecentCommands("user-1", 5).get(0).status());
        }
    }

    @Test
    void shellAwaitsConfirmationAndRejectRefundsCharge() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-reject-")) {
            DeviceRelayRuntime rt = fx.runtime;
            DeviceRecord device = fx.device(fx.pair("user-1", "laptop"));
            rt.grantCredits("user-1", 100);

            DeviceRelayRuntime.SendOutcome sent = rt.send("user-1", "laptop", "git pull");
            Assertions.assertTrue(sent.success());
            Assertions.assertTrue(sent.confirmationRequired());
            Assertions.assertEquals(CommandStatus.AWAITING_CONFIRMATION, sent.status());
            Assertions.assertEquals(RiskLevel.HIGH, sent.riskLevel());
            Assertions.assertTrue(sent.safetyWarning().contains("confirm " + sent.commandId().substring(0, 8)));
            Assertions.assertEquals(90, rt.balance("user-1"));
            Assertions.assertEquals(0, rt.delivery().heartbeat(device));

            DeviceRelayRuntime.ActionOutcome rejected = rt.reject(sent.commandId().substring(0, 8), "user-1");
            Assertions.assertTrue(rejected.success());
            Assertions.assertEquals(10, rejected.refundedCredits());
            Assertions.assertEquals(100, rt.balance("user-1"));

            DeviceRelayRuntime.ActionOutcome again = rt.reject(sent.commandId(), "user-1");
            Assertions.assertFalse(again.success());
            Assertions.assertEquals(0, again.refundedCredits());
            Assertions.assertEquals(CommandStatus.CANCELLED, again.status());
            Assertions.assertEquals(100, rt.balance("user-1"));
            Assertions.assertFalse(rt.confirm(sent.commandId(), "user-1").success());
            Assertions.assertTrue(rt.delivery().poll(device).isEmpty());
        }
    }

    @Test
    void confirmByPrefixQueuesTheCommand() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-confirm-")) {
            DeviceRelayRuntime rt = fx.runtime;
            DeviceRecord device = fx.device(fx.pair("user-1", "laptop"));
            rt.grantCredits("user-1", 100);
            DeviceRelayRuntime.SendOutcome sent = rt.send("user-1", "laptop", "npm test");

            Assertions.assertFalse(rt.confirm(sent.commandId().substring(0, 8), "user-2").success());
            DeviceRelayRuntime.ActionOutcome confirmed = rt.confirm(sent.commandId().substring(0, 8), "user-1");
            Assertions.assertTrue(confirmed.success());
            Assertions.assertEquals(CommandStatus.PENDING, confirmed.status());
            Assertions.assertEquals(1, rt.delivery().heartbeat(device));
            Assertions.assertEquals(sent.commandId(), rt.delivery().poll(device).get(0).commandId());
            Assertions.assertFalse(rt.reject(sent.commandId(), "user-1").success());
            Assertions.assertEquals(90, rt.balance("user-1"));
        }
    }

    @Test
    void expiredAndFailedCommandsAreNotRefunded() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-no-refund-")) {
            DeviceRelayRuntime rt = fx.runtime;
            DeviceRecord device = fx.device(fx.pair("user-1", "laptop"));
            rt.grantCredits("user-1", 100);

            DeviceRelayRuntime.SendOutcome failing = rt.send("user-1", "laptop", "screenshot");
            ClaimedCommand claimed = rt.delivery().poll(device).get(0);
            Assertions.assertTrue(rt.delivery().submitResult(device, claimed.commandId(), null, null, null,
                    "no display", "failed"));
            Assertions.assertEquals(CommandStatus.FAILED,
                    rt.getCommandResult(failing.commandId(), "user-1").orElseThrow().status());

            DeviceRelayRuntime.SendOutcome awaiting = rt.send("user-1", "laptop", "git status");
            fx.clock.advance(rt.settings().commandTtlMs() + 1);
            DeviceRelayRuntime.ActionOutcome late = rt.reject(awaiting.commandId(), "user-1");
            Assertions.assertFalse(late.success());
            Assertions.assertEquals(CommandStatus.EXPIRED, late.status());
            Assertions.assertEquals(80, rt.balance("user-1"));

            DeviceRelayRuntime.MaintenanceOutcome sweep = rt.runMaintenance();
            Assertions.assertEquals(1, sweep.expiredCommands());
            Assertions.assertEquals(1, sweep.devicesMarkedOffline());
            Assertions.assertEquals(80, rt.balance("user-1"));
            UsageStats stats = rt.usageStats("user-1");
            Assertions.assertEquals(2, stats.totalCommands());
            Assertions.assertEquals(20, stats.totalCreditsUsed());
        }
    }

    @Test
    void sendRefusesUnknownDeviceBrokeUserAndFullQueue() throws Exception {
        RelaySettings settings = RelaySettings.defaults()
                .withEncryptionSecret("fixture-secret")
                .withPolling(200L, 20L)
                .withBilling(10, 0, 2);
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-refusals-", settings)) {
            DeviceRelayRuntime rt = fx.runtime;
            fx.pair("user-1", "laptop");

            Assertions.assertEquals("device_not_found", rt.send("user-1", "phone", "clipboard").error());
            Assertions.assertEquals("insufficient_credits", rt.send("user-1", "laptop", "clipboard").error());
            Assertions.assertTrue(rt.getRecentCommands("user-1", 10).isEmpty());

            rt.grantCredits("user-1", 100);
            Assertions.assertTrue(rt.send("user-1", "laptop", "clipboard").success());
            Assertions.assertTrue(rt.send("user-1", "laptop", "screenshot").success());
            DeviceRelayRuntime.SendOutcome full = rt.send("user-1", "laptop", "clipboard");
            Assertions.assertEquals("too_many_pending", full.error());
            Assertions.assertEquals(80, rt.balance("user-1"));

            Assertions.assertThrows(IllegalArgumentException.class, () -> rt.send("user-1", "laptop", "  "));
            Assertions.assertThrows(IllegalArgumentException.class, () -> rt.send(" ", "laptop", "ls"));
        }
    }

    @Test
    void sendToOfflineDeviceFailsWithoutCharge() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-offline-")) {
            DeviceRelayRuntime rt = fx.runtime;
            DeviceRecord device = fx.device(fx.pair("user-1", "laptop"));
            rt.grantCredits("user-1", 100);
            fx.clock.advance(rt.settings().offlineAfterMs() * 2);
            Assertions.assertEquals(1, rt.runMaintenance().devicesMarkedOffline());

            DeviceRelayRuntime.SendOutcome offline = rt.send("user-1", "laptop", "screenshot");
            Assertions.assertFalse(offline.success());
            Assertions.assertEquals("device_offline", offline.error());
            Assertions.assertTrue(offline.message().contains("offline"));
            Assertions.assertEquals(100, rt.balance("user-1"));
            Assertions.assertTrue(rt.getRecentCommands("user-1", 10).isEmpty());
            Assertions.assertEquals(0, rt.usageStats("user-1").totalCommands());

            rt.delivery().heartbeat(device);
            DeviceRelayRuntime.SendOutcome back = rt.send("user-1", "laptop", "screenshot");
            Assertions.assertTrue(back.success());
            Assertions.assertEquals(90, rt.balance("user-1"));
        }
    }

    @Test
    void stalledExecutingCommandsExpireAndReleasePendingSlots() throws Exception {
        RelaySettings settings = RelaySettings.defaults()
                .withEncryptionSecret("fixture-secret")
                .withPolling(200L, 20L)
                .withBilling(10, 0, 2);
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-stalled-", settings)) {
            DeviceRelayRuntime rt = fx.runtime;
            DeviceRecord device = fx.device(fx.pair("user-1", "laptop"));
            rt.grantCredits("user-1", 100);
            DeviceRelayRuntime.SendOutcome first = rt.send("user-1", "laptop", "screenshot");
            DeviceRelayRuntime.SendOutcome second = rt.send("user-1", "laptop", "screenshot");
            for (ClaimedCommand claimed : rt.delivery().poll(device)) {
                Assertions.assertTrue(rt.delivery().progress(device, claimed.commandId(), "started", "capturing", null));
            }
            Assertions.assertEquals("too_many_pending", rt.send("user-1", "laptop", "clipboard").error());

            fx.clock.advance(rt.settings().commandTtlMs() + 1);
            Assertions.assertEquals(CommandStatus.EXPIRED,
                    rt.getCommandResult(first.commandId(), "user-1").orElseThrow().status());
            Assertions.assertFalse(rt.delivery().submitResult(device, first.commandId(), null, null, null,
                    "too late", "completed"));
            Assertions.assertFalse(rt.cancel(second.commandId(), "user-1").success());

            DeviceRelayRuntime.MaintenanceOutcome sweep = rt.runMaintenance();
            Assertions.assertEquals(2, sweep.expiredCommands());
            Assertions.assertEquals(CommandStatus.EXPIRED,
                    rt.getCommandResult(second.commandId(), "user-1").orElseThrow().status());

            rt.delivery().heartbeat(device);
            Assertions.assertTrue(rt.send("user-1", "laptop", "clipboard").success());
            Assertions.assertEquals(70, rt.balance("user-1"));
        }
    }

    @Test
    void usersCannotSeeOrChangeEachOthersCommands() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-isolation-")) {
            DeviceRelayRuntime rt = fx.runtime;
            fx.pair("user-1", "laptop");
            fx.pair("user-2", "laptop");
            rt.grantCredits("user-1", 100);
            DeviceRelayRuntime.SendOutcome sent = rt.send("user-1", "laptop", "clipboard");

            Assertions.assertTrue(rt.getCommandResult(sent.commandId(), "user-2").isEmpty());
            Assertions.assertTrue(rt.getExecutionLog(sent.commandId(), "user-2").isEmpty());
            Assertions.assertFalse(rt.cancel(sent.commandId(), "user-2").success());
            Assertions.assertTrue(rt.getRecentCommands("user-2", 10).isEmpty());
            Assertions.assertTrue(rt.cancel(sent.commandId(), "user-1").success());
        }
    }

    @Test
    void removingDeviceCancelsItsQueue() throws Exception {
        try (RelayFixture fx = RelayFixture.open("devicerelay-test-remove-")) {
            DeviceRelayRuntime rt = fx.runtime;
            String token = fx.pair("user-1", "laptop");
            rt.grantCredits("user-1", 100);
            DeviceRelayRuntime.SendOutcome queued = rt.send("user-1", "laptop", "clipboard");
            DeviceRelayRuntime.SendOutcome awaiting = rt.send("user-1", "laptop", "uptime");

            Assertions.assertTrue(rt.removeDevice("user-1", "LAPTOP"));
            Assertions.assertTrue(rt.delivery().authenticate(token).isEmpty());
            Assertions.assertTrue(rt.listDevices("user-1").isEmpty());
            Assertions.assertEquals(CommandStatus.CANCELLED, rt.getCommandResult(queued.commandId(), "user-1").orElseThrow().status());
            Assertions.assertEquals(CommandStatus.CANCELLED, rt.getCommandResult(awaiting.commandId(), "user-1").orElseThrow().status());
            Assertions.assertEquals("laptop", rt.getRecentCommands("user-1", 1).get(0).deviceName());
            Assertions.assertFalse(rt.removeDevice("user-1", "laptop"));
        }
    }
}
