package io.devicerelay.billing;

import io.devicerelay.storage.Database;
import io.devicerelay.storage.RelayStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

public final class SqliteCreditLedger implements CreditLedger {
    private static final String ENSURE_ACCOUNT =
            "INSERT OR IGNORE INTO users(user_id,credits,created_at_ms,updated_at_ms) VALUES(?,0,?,?)";
    private static final String RECORD_USAGE =
            "INSERT INTO credit_usage(user_id,command_id,credits,action,created_at_ms) VALUES(?,?,?,?,?)";

    private final Database database;

    public SqliteCreditLedger(Database database) {
        this.database = database;
    }

    @Override
    public Debit debitCommand(String userId, String commandId, int cost, int freePerDay, long freeSinceMs, long nowMs) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be >= 0");
        }
        String debit = "UPDATE users SET credits=credits-?,updated_at_ms=? WHERE user_id=? AND credits>=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                ensureAccount(c, userId, nowMs);
                int credits = freePerDay > 0 && countCharges(c, userId, freeSinceMs) < freePerDay ? 0 : cost;
                if (credits > 0) {
                    try (PreparedStatement ps = c.prepareStatement(debit)) {
                        ps.setInt(1, credits);
                        ps.setLong(2, nowMs);
                        ps.setString(3, userId);
                        ps.setInt(4, credits);
                        if (ps.executeUpdate() != 1) {
                            c.rollback();
                            return new Debit(false, credits);
                        }
                    }
                }
                recordUsage(c, userId, commandId, credits, UsageAction.COMMAND, nowMs);
                c.commit();
                return new Debit(true, credits);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to debit credits", e);
        }
    }

    @Override
    public void credit(String userId, String commandId, int credits, UsageAction action, long nowMs) {
        if (credits <= 0) {
            return;
        }
        if (action == UsageAction.COMMAND) {
            throw new IllegalArgumentException("credit action must be refund or compensation");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                ensureAccount(c, userId, nowMs);
                addCredits(c, userId, credits, nowMs);
                recordUsage(c, userId, commandId, credits, action, nowMs);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to credit " + action.wireName(), e);
        }
    }

    @Override
    public void grant(String userId, int credits, long nowMs) {
        if (credits <= 0) {
            throw new IllegalArgumentException("credits must be > 0");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                ensureAccount(c, userId, nowMs);
                addCredits(c, userId, credits, nowMs);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to grant credits", e);
        }
    }

    @Override
    public int balance(String userId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT credits FROM users WHERE user_id=?")) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to read balance", e);
        }
    }

    @Override
    public UsageStats usageStats(String userId, long sinceMs) {
        String sql = """
                SELECT
                  COALESCE(SUM(CASE WHEN action='command' THEN 1 ELSE 0 END),0) AS total_commands,
                  COALESCE(SUM(CASE WHEN action='command' THEN credits ELSE -credits END),0) AS net_credits,
                  COALESCE(SUM(CASE WHEN action='command' AND created_at_ms>=? THEN 1 ELSE 0 END),0) AS today
                FROM credit_usage WHERE user_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, sinceMs);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new UsageStats(0, 0, 0);
                }
                return new UsageStats(rs.getInt("total_commands"), rs.getInt("net_credits"), rs.getInt("today"));
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to read usage stats", e);
        }
    }

    private static int countCharges(Connection c, String userId, long sinceMs) throws SQLException {
        String sql = "SELECT COUNT(*) FROM credit_usage WHERE user_id=? AND action='command' AND created_at_ms>=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setLong(2, sinceMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static void ensureAccount(Connection c, String userId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(ENSURE_ACCOUNT)) {
            ps.setString(1, userId);
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        }
    }

    private static void addCredits(Connection c, String userId, int credits, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE users SET credits=credits+?,updated_at_ms=? WHERE user_id=?")) {
            ps.setInt(1, credits);
            ps.setLong(2, nowMs);
            ps.setString(3, userId);
            ps.executeUpdate();
        }
    }

    private static void recordUsage(Connection c, String userId, String commandId, int credits, UsageAction action,
                                    long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(RECORD_USAGE)) {
            ps.setString(1, userId);
            ps.setString(2, commandId);
            ps.setInt(3, credits);
            ps.setString(4, action.wireName());
            ps.setLong(5, nowMs);
            ps.executeUpdate();
        }
    }
}
