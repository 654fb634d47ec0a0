package io.devicerelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.devicerelay.model.ClaimedCommand;
import io.devicerelay.model.CommandRecord;
import io.devicerelay.model.CommandStatus;
import io.devicerelay.model.ExecutionLogEntry;
import io.devicerelay.model.RiskLevel;
import io.devicerelay.security.EncryptedBlob;
import io.devicerelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Command rows and their execution log.
 *
 * <p>Every state change is a conditional UPDATE whose WHERE clause restates the expected
 * current state, ownership included, so a change applies at most once and a caller that does
 * not own the command changes nothing. Operations return a negative outcome instead of
 * throwing when the command is absent, not owned, terminal or overdue. A claimed command is
 * overdue like any other: a device that reports after {@code expires_at_ms} is refused.
 */
public final class CommandStore {
    private static final Pattern ID_PREFIX = Pattern.compile("^[0-9a-fA-F-]{4,36}$");
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final String SELECT_COLUMNS = """
            command_id,user_id,target_device_id,target_device_name,encrypted_command,iv,auth_tag,status,priority,
            risk_level,safety_warnings,command_preview,encrypted_result,result_iv,result_auth_tag,result_summary,
            credits_charged,created_at_ms,delivered_at_ms,completed_at_ms,expires_at_ms
            """;
    // Overdue rows stay non-terminal in storage until the sweep runs; this keeps them out of every transition.
    private static final String NOT_OVERDUE = "expires_at_ms>=?";

    private final Database database;

    public CommandStore(Database database) {
        this.database = database;
    }

    public void insert(NewCommand cmd) {
        insertWithinLimit(cmd, Integer.MAX_VALUE);
    }

    /**
     * Inserts the command unless its owner already has {@code maxUnfinished} live commands.
     * The count and the insert share one IMMEDIATE transaction, so concurrent senders cannot
     * both take the last slot.
     *
     * @return false when the limit is reached; nothing is written in that case
     */
    public boolean insertWithinLimit(NewCommand cmd, int maxUnfinished) {
        String sql = """
                INSERT INTO commands(command_id,user_id,target_device_id,target_device_name,encrypted_command,iv,auth_tag,
                status,priority,risk_level,safety_warnings,command_preview,credits_charged,created_at_ms,expires_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        return inTransaction("Failed to insert command", c -> {
            if (maxUnfinished < Integer.MAX_VALUE && countUnfinished(c, cmd.userId(), cmd.nowMs()) >= maxUnfinished) {
                return false;
            }
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, cmd.commandId());
                ps.setString(2, cmd.userId());
                ps.setString(3, cmd.targetDeviceId());
                ps.setString(4, cmd.targetDeviceName());
                ps.setString(5, cmd.payload().ciphertext());
                ps.setString(6, cmd.payload().iv());
                ps.setString(7, cmd.payload().authTag());
                ps.setString(8, cmd.status().wireName());
                ps.setInt(9, cmd.priority());
                ps.setString(10, cmd.riskLevel().wireName());
                ps.setString(11, Jsons.toCompactJson(cmd.safetyWarnings()));
                ps.setString(12, cmd.commandPreview());
                ps.setInt(13, cmd.creditsCharged());
                ps.setLong(14, cmd.nowMs());
                ps.setLong(15, cmd.expiresAtMs());
                ps.setLong(16, cmd.nowMs());
                ps.executeUpdate();
            }
            appendEvent(c, cmd.commandId(), "created", "Command created as " + cmd.status().wireName(), null, cmd.nowMs());
            return true;
        });
    }

    /**
     * Resolves a full id or an id prefix to the most recent command of {@code userId} that
     * matches. Other users' commands are never candidates.
     */
    public Optional<String> resolveId(String userId, String idOrPrefix) {
        if (idOrPrefix == null || !ID_PREFIX.matcher(idOrPrefix.trim()).matches()) {
            return Optional.empty();
        }
        String prefix = idOrPrefix.trim().toLowerCase(Locale.ROOT);
        String sql = "SELECT command_id FROM commands WHERE user_id=? AND command_id LIKE ? ORDER BY created_at_ms DESC, command_id DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setString(2, prefix + "%");
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to resolve command id", e);
        }
    }

    public boolean confirm(String commandId, String userId, long nowMs) {
        String sql = "UPDATE commands SET status='pending',updated_at_ms=? WHERE command_id=? AND user_id=? AND status='awaiting_confirmation' AND expires_at_ms>=?";
        return inTransaction("Failed to confirm command", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setLong(1, nowMs);
                ps.setString(2, commandId);
                ps.setString(3, userId);
                ps.setLong(4, nowMs);
                if (ps.executeUpdate() != 1) {
                    return false;
                }
            }
            appendEvent(c, commandId, "confirmed_by_user", "Operator confirmed the command", null, nowMs);
            return true;
        });
    }

    /**
     * Cancels a command still awaiting confirmation. Only the call that performs the transition
     * gets a {@link Rejection} back, carrying the credits to refund.
     */
    public Optional<Rejection> reject(String commandId, String userId, long nowMs) {
        String select = "SELECT credits_charged FROM commands WHERE command_id=? AND user_id=?";
        String update = "UPDATE commands SET status='cancelled',completed_at_ms=?,updated_at_ms=? WHERE command_id=? AND user_id=? AND status='awaiting_confirmation' AND expires_at_ms>=?";
        return inTransaction("Failed to reject command", c -> {
            int credits;
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, commandId);
                ps.setString(2, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<Rejection>empty();
                    }
                    credits = rs.getInt(1);
                }
            }
            try (PreparedStatement ps = c.prepareStatement(update)) {
                ps.setLong(1, nowMs);
                ps.setLong(2, nowMs);
                ps.setString(3, commandId);
                ps.setString(4, userId);
                ps.setLong(5, nowMs);
                if (ps.executeUpdate() != 1) {
                    return Optional.<Rejection>empty();
                }
            }
            appendEvent(c, commandId, "rejected_by_user", "Operator rejected the command", null, nowMs);
            return Optional.of(new Rejection(commandId, credits));
        });
    }

    public boolean cancel(String commandId, String userId, long nowMs) {
        String sql = "UPDATE commands SET status='cancelled',completed_at_ms=?,updated_at_ms=? WHERE command_id=? AND user_id=? AND status IN ('pending','awaiting_confirmation') AND "
                + NOT_OVERDUE;
        return inTransaction("Failed to cancel command", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setLong(1, nowMs);
                ps.setLong(2, nowMs);
                ps.setString(3, commandId);
                ps.setString(4, userId);
                ps.setLong(5, nowMs);
                if (ps.executeUpdate() != 1) {
                    return false;
                }
            }
            appendEvent(c, commandId, "cancelled_by_user", "Operator cancelled the command", null, nowMs);
            return true;
        });
    }

    /**
     * Claims up to {@code limit} deliverable commands for {@code deviceId}, highest priority
     * first and oldest first within a priority. Candidates are read and claimed in one
     * IMMEDIATE transaction, each by a compare-and-set on an unset claim token, so concurrent
     * pollers never receive the same command.
     */
    public List<ClaimedCommand> claim(String deviceId, int limit, long nowMs) {
        String select = """
                SELECT command_id,encrypted_command,iv,auth_tag,priority,created_at_ms FROM commands
                WHERE target_device_id=? AND status='pending' AND claim_token IS NULL AND expires_at_ms>=?
                ORDER BY priority DESC, created_at_ms ASC, command_id ASC LIMIT ?
                """;
        String claim = "UPDATE commands SET claim_token=?,delivered_at_ms=?,updated_at_ms=? WHERE command_id=? AND target_device_id=? AND status='pending' AND claim_token IS NULL";
        return inTransaction("Failed to claim commands", c -> {
            List<ClaimedCommand> candidates = new ArrayList<>();
            try (PreparedStatement s = c.prepareStatement(select)) {
                s.setString(1, deviceId);
                s.setLong(2, nowMs);
                s.setInt(3, Math.max(1, limit));
                try (ResultSet rs = s.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(new ClaimedCommand(
                                rs.getString("command_id"),
                                rs.getString("encrypted_command"),
                                rs.getString("iv"),
                                rs.getString("auth_tag"),
                                rs.getInt("priority"),
                                rs.getLong("created_at_ms")));
                    }
                }
            }
            List<ClaimedCommand> out = new ArrayList<>();
            try (PreparedStatement up = c.prepareStatement(claim)) {
                for (ClaimedCommand cand : candidates) {
                    up.setString(1, UUID.randomUUID().toString());
                    up.setLong(2, nowMs);
                    up.setLong(3, nowMs);
                    up.setString(4, cand.commandId());
                    up.setString(5, deviceId);
                    if (up.executeUpdate() == 1) {
                        out.add(cand);
                    }
                }
            }
            for (ClaimedCommand claimed : out) {
                appendEvent(c, claimed.commandId(), "delivered", "Delivered to device", null, nowMs);
            }
            return out;
        });
    }

    /**
     * Appends a progress entry reported by the target device. The first entry moves a
     * delivered command to {@code executing}.
     */
    public boolean appendProgress(String commandId, String deviceId, String event, String message, String data, long nowMs) {
        String select = "SELECT status,claim_token,expires_at_ms FROM commands WHERE command_id=? AND target_device_id=?";
        String start = "UPDATE commands SET status='executing',updated_at_ms=? WHERE command_id=? AND status='pending' AND claim_token IS NOT NULL";
        return inTransaction("Failed to append progress", c -> {
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, commandId);
                ps.setString(2, deviceId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return false;
                    }
                    CommandStatus status = CommandStatus.fromWire(rs.getString("status"));
                    if (status.terminal() || rs.getString("claim_token") == null || nowMs > rs.getLong("expires_at_ms")) {
                        return false;
                    }
                }
            }
            try (PreparedStatement ps = c.prepareStatement(start)) {
                ps.setLong(1, nowMs);
                ps.setString(2, commandId);
                ps.executeUpdate();
            }
            appendEvent(c, commandId, event, message, data, nowMs);
            return true;
        });
    }

    /**
     * Records the device's result and moves the command to its terminal state. Accepted once,
     * only from the target device, and only for a command that device has claimed.
     */
    public boolean submitResult(String commandId, String deviceId, ResultSubmission result, long nowMs) {
        String sql = """
                UPDATE commands SET status=?,encrypted_result=?,result_iv=?,result_auth_tag=?,result_summary=?,
                completed_at_ms=?,updated_at_ms=?
                WHERE command_id=? AND target_device_id=? AND status IN ('pending','executing') AND claim_token IS NOT NULL
                AND expires_at_ms>=?
                """;
        return inTransaction("Failed to store command result", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, result.outcome().wireName());
                ps.setString(2, result.encryptedResult());
                ps.setString(3, result.resultIv());
                ps.setString(4, result.resultAuthTag());
                ps.setString(5, result.resultSummary());
                ps.setLong(6, nowMs);
                ps.setLong(7, nowMs);
                ps.setString(8, commandId);
                ps.setString(9, deviceId);
                ps.setLong(10, nowMs);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public Optional<CommandRecord> find(String commandId, String userId) {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM commands WHERE command_id=? AND user_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, commandId);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to read command", e);
        }
    }

    public List<CommandRecord> recent(String userId, int limit) {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM commands WHERE user_id=? ORDER BY created_at_ms DESC, command_id DESC LIMIT ?";
        List<CommandRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRecord(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to list recent commands", e);
        }
    }

    public List<ExecutionLogEntry> executionLog(String commandId) {
        String sql = "SELECT seq,timestamp_ms,event,message,data FROM command_events WHERE command_id=? ORDER BY seq ASC";
        List<ExecutionLogEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, commandId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ExecutionLogEntry(
                            rs.getInt("seq"),
                            rs.getLong("timestamp_ms"),
                            rs.getString("event"),
                            rs.getString("message"),
                            rs.getString("data")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to read execution log", e);
        }
    }

    public int countClaimable(String deviceId, long nowMs) {
        String sql = "SELECT COUNT(*) FROM commands WHERE target_device_id=? AND status='pending' AND claim_token IS NULL AND expires_at_ms>=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, deviceId);
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to count pending commands", e);
        }
    }

    public int countUnfinished(String userId, long nowMs) {
        try (Connection c = database.openConnection()) {
            return countUnfinished(c, userId, nowMs);
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to count unfinished commands", e);
        }
    }

    private static int countUnfinished(Connection c, String userId, long nowMs) throws SQLException {
        String sql = "SELECT COUNT(*) FROM commands WHERE user_id=? AND status IN ('awaiting_confirmation','pending','executing') AND "
                + NOT_OVERDUE;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /**
     * Persists {@code expired} for every overdue non-terminal command, claimed or not, so a
     * device that stopped reporting releases the user's pending slot. Never refunds.
     */
    public int expireOverdue(long nowMs) {
        String select = """
                SELECT command_id FROM commands WHERE expires_at_ms<? AND
                status IN ('awaiting_confirmation','pending','executing')
                """;
        String update = """
                UPDATE commands SET status='expired',completed_at_ms=?,updated_at_ms=? WHERE command_id=? AND expires_at_ms<? AND
                status IN ('awaiting_confirmation','pending','executing')
                """;
        return transitionMatching("Failed to expire commands", select, update, nowMs, nowMs,
                "expired", "Command expired before it finished");
    }

    /**
     * Cancels every non-terminal command addressed to a removed device.
     */
    public int cancelForDevice(String deviceId, long nowMs) {
        String select = "SELECT command_id FROM commands WHERE target_device_id=? AND status IN ('awaiting_confirmation','pending','executing')";
        String update = "UPDATE commands SET status='cancelled',completed_at_ms=?,updated_at_ms=? WHERE command_id=? AND status IN ('awaiting_confirmation','pending','executing')";
        return inTransaction("Failed to cancel commands of removed device", c -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, deviceId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
            }
            int changed = 0;
            try (PreparedStatement up = c.prepareStatement(update)) {
                for (String id : ids) {
                    up.setLong(1, nowMs);
                    up.setLong(2, nowMs);
                    up.setString(3, id);
                    if (up.executeUpdate() == 1) {
                        appendEvent(c, id, "device_removed", "Target device was removed", null, nowMs);
                        changed++;
                    }
                }
            }
            return changed;
        });
    }

    private int transitionMatching(String failure, String select, String update, long selectArg, long nowMs,
                                   String event, String message) {
        return inTransaction(failure, c -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setLong(1, selectArg);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
            }
            int changed = 0;
            try (PreparedStatement up = c.prepareStatement(update)) {
                for (String id : ids) {
                    up.setLong(1, nowMs);
                    up.setLong(2, nowMs);
                    up.setString(3, id);
                    up.setLong(4, selectArg);
                    if (up.executeUpdate() == 1) {
                        appendEvent(c, id, event, message, null, nowMs);
                        changed++;
                    }
                }
            }
            return changed;
        });
    }

    private static void appendEvent(Connection c, String commandId, String event, String message, String data, long nowMs)
            throws SQLException {
        String sql = """
                INSERT INTO command_events(command_id,seq,timestamp_ms,event,message,data)
                VALUES(?,(SELECT COALESCE(MAX(seq),0)+1 FROM command_events WHERE command_id=?),?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, commandId);
            ps.setString(2, commandId);
            ps.setLong(3, nowMs);
            ps.setString(4, event == null || event.isBlank() ? "progress" : event.trim());
            ps.setString(5, message == null ? "" : message);
            ps.setString(6, data);
            ps.executeUpdate();
        }
    }

    private static CommandRecord readRecord(ResultSet rs) throws SQLException {
        long delivered = rs.getLong("delivered_at_ms");
        Long deliveredAt = rs.wasNull() ? null : delivered;
        long completed = rs.getLong("completed_at_ms");
        Long completedAt = rs.wasNull() ? null : completed;
        return new CommandRecord(
                rs.getString("command_id"),
                rs.getString("user_id"),
                rs.getString("target_device_id"),
                rs.getString("target_device_name"),
                rs.getString("encrypted_command"),
                rs.getString("iv"),
                rs.getString("auth_tag"),
                CommandStatus.fromWire(rs.getString("status")),
                rs.getInt("priority"),
                RiskLevel.fromWire(rs.getString("risk_level")),
                readWarnings(rs.getString("safety_warnings")),
                rs.getString("command_preview"),
                rs.getString("encrypted_result"),
                rs.getString("result_iv"),
                rs.getString("result_auth_tag"),
                rs.getString("result_summary"),
                rs.getInt("credits_charged"),
                rs.getLong("created_at_ms"),
                deliveredAt,
                completedAt,
                rs.getLong("expires_at_ms")
        );
    }

    private static List<String> readWarnings(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(Jsons.mapper().readValue(raw, STRING_LIST));
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt safety_warnings column", e);
        }
    }

    private <T> T inTransaction(String failure, SqlWork<T> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RelayStoreException(failure, e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    public record NewCommand(
            String commandId,
            String userId,
            String targetDeviceId,
            String targetDeviceName,
            EncryptedBlob payload,
            CommandStatus status,
            int priority,
            RiskLevel riskLevel,
            List<String> safetyWarnings,
            String commandPreview,
            int creditsCharged,
            long nowMs,
            long expiresAtMs
    ) {
    }

    public record Rejection(String commandId, int creditsCharged) {
    }

    public record ResultSubmission(
            String encryptedResult,
            String resultIv,
            String resultAuthTag,
            String resultSummary,
            CommandStatus outcome
    ) {
        public ResultSubmission {
            if (outcome != CommandStatus.COMPLETED && outcome != CommandStatus.FAILED) {
                throw new IllegalArgumentException("Result outcome must be completed or failed");
            }
        }
    }
}
