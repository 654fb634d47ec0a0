package io.devicerelay.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class CommandStatusTest {
    private static final long EXPIRES = 1_000L;

    @Test
    void overdueUnclaimedCommandsReadAsExpired() {
        Assertions.assertEquals(CommandStatus.EXPIRED,
                CommandStatus.effective(CommandStatus.AWAITING_CONFIRMATION, false, EXPIRES, EXPIRES + 1));
        Assertions.assertEquals(CommandStatus.EXPIRED,
                CommandStatus.effective(CommandStatus.PENDING, false, EXPIRES, EXPIRES + 1));
        Assertions.assertEquals(CommandStatus.PENDING,
                CommandStatus.effective(CommandStatus.PENDING, false, EXPIRES, EXPIRES));
    }

    @Test
    void claimedCommandsExpireLikeQueuedOnes() {
        Assertions.assertEquals(CommandStatus.DELIVERED,
                CommandStatus.effective(CommandStatus.PENDING, true, EXPIRES, EXPIRES));
        Assertions.assertEquals(CommandStatus.EXECUTING,
                CommandStatus.effective(CommandStatus.EXECUTING, true, EXPIRES, EXPIRES));
        Assertions.assertEquals(CommandStatus.EXPIRED,
                CommandStatus.effective(CommandStatus.PENDING, true, EXPIRES, EXPIRES + 1));
        Assertions.assertEquals(CommandStatus.EXPIRED,
                CommandStatus.effective(CommandStatus.EXECUTING, true, EXPIRES, EXPIRES + 10_000));
    }

    @Test
    void terminalStatusesAreKept() {
        for (CommandStatus status : CommandStatus.values()) {
            if (status.terminal()) {
                Assertions.assertEquals(status, CommandStatus.effective(status, false, EXPIRES, EXPIRES + 1));
            }
        }
        Assertions.assertFalse(CommandStatus.DELIVERED.terminal());
    }

    @Test
    void wireNamesRoundTripAndDeviceOutcomeDefaultsToCompleted() {
        Assertions.assertEquals("awaiting_confirmation", CommandStatus.AWAITING_CONFIRMATION.wireName());
        Assertions.assertEquals(CommandStatus.AWAITING_CONFIRMATION, CommandStatus.fromWire(" Awaiting_Confirmation "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CommandStatus.fromWire(""));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CommandStatus.fromWire("done"));

        Assertions.assertEquals(CommandStatus.FAILED, CommandStatus.fromDeviceOutcome("FAILED"));
        Assertions.assertEquals(CommandStatus.COMPLETED, CommandStatus.fromDeviceOutcome("completed"));
        Assertions.assertEquals(CommandStatus.COMPLETED, CommandStatus.fromDeviceOutcome(null));
        Assertions.assertEquals(CommandStatus.COMPLETED, CommandStatus.fromDeviceOutcome("partial"));
    }
}
