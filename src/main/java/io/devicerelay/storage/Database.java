package io.devicerelay.storage;

import io.devicerelay.config.DeviceRelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Owns the SQLite file: directories, schema and connection pragmas.
 *
 * <p>Every connection starts transactions in IMMEDIATE mode, so a transaction that reads
 * and then writes holds the write lock from its first statement.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final int BUSY_TIMEOUT_MS = 5000;

    private final DeviceRelayConfig config;
    private final String jdbcUrl;

    public Database(DeviceRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
        log.debug("Database ready at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        props.setProperty("transaction_mode", "IMMEDIATE");
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RelayStoreException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS users (
                        user_id TEXT PRIMARY KEY,
                        credits INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS credit_usage (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        user_id TEXT NOT NULL,
                        command_id TEXT,
                        credits INTEGER NOT NULL,
                        action TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_credit_usage_user ON credit_usage(user_id, created_at_ms)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS pairing_codes (
                        code TEXT PRIMARY KEY,
                        user_id TEXT NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        used INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_pairing_codes_user ON pairing_codes(user_id, used, expires_at_ms)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS devices (
                        device_id TEXT PRIMARY KEY,
                        user_id TEXT NOT NULL,
                        device_name TEXT NOT NULL,
                        device_name_key TEXT NOT NULL,
                        device_type TEXT NOT NULL,
                        platform TEXT NOT NULL DEFAULT '',
                        token_hash TEXT NOT NULL UNIQUE,
                        is_online INTEGER NOT NULL DEFAULT 0,
                        last_seen_at_ms INTEGER,
                        capabilities TEXT NOT NULL DEFAULT '[]',
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(user_id, device_name_key)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS commands (
                        command_id TEXT PRIMARY KEY,
                        user_id TEXT NOT NULL,
                        target_device_id TEXT NOT NULL,
                        target_device_name TEXT NOT NULL,
                        encrypted_command TEXT NOT NULL,
                        iv TEXT NOT NULL,
                        auth_tag TEXT NOT NULL,
                        status TEXT NOT NULL,
                        priority INTEGER NOT NULL DEFAULT 0,
                        risk_level TEXT NOT NULL,
                        safety_warnings TEXT NOT NULL DEFAULT '[]',
                        command_preview TEXT NOT NULL DEFAULT '',
                        encrypted_result TEXT,
                        result_iv TEXT,
                        result_auth_tag TEXT,
                        result_summary TEXT,
                        credits_charged INTEGER NOT NULL DEFAULT 0,
                        claim_token TEXT,
                        created_at_ms INTEGER NOT NULL,
                        delivered_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        expires_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE INDEX IF NOT EXISTS idx_commands_claim
                    ON commands(target_device_id, status, priority DESC, created_at_ms ASC)
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_commands_user ON commands(user_id, created_at_ms DESC)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS command_events (
                        command_id TEXT NOT NULL,
                        seq INTEGER NOT NULL,
                        timestamp_ms INTEGER NOT NULL,
                        event TEXT NOT NULL,
                        message TEXT NOT NULL DEFAULT '',
                        data TEXT,
                        PRIMARY KEY(command_id, seq),
                        FOREIGN KEY(command_id) REFERENCES commands(command_id)
                    )
                    """);
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to initialize schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA foreign_keys=ON");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
