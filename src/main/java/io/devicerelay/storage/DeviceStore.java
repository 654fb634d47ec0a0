package io.devicerelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.devicerelay.model.DeviceRecord;
import io.devicerelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Pairing codes and paired devices. Device tokens are stored as SHA-256 hashes only, so
 * lookups take the hash of the presented token.
 */
public final class DeviceStore {
    public static final Set<String> DEVICE_TYPES = Set.of("desktop", "laptop", "server", "mobile", "tablet", "other");
    public static final Set<String> CAPABILITIES = Set.of(
            "shell", "file", "browser", "clipboard", "screenshot", "audio", "notification");
    private static final List<String> DEFAULT_CAPABILITIES = List.of("shell", "file");
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final String DEVICE_COLUMNS =
            "device_id,user_id,device_name,device_type,platform,is_online,last_seen_at_ms,capabilities,created_at_ms";

    private final Database database;

    public DeviceStore(Database database) {
        this.database = database;
    }

    /**
     * Returns the user's active pairing code, issuing a new one from {@code codeSupplier} when
     * none is active.
     */
    public PairingCode issuePairingCode(String userId, Supplier<String> codeSupplier, long ttlMs, long nowMs) {
        String active = "SELECT code,expires_at_ms FROM pairing_codes WHERE user_id=? AND used=0 AND expires_at_ms>=? ORDER BY expires_at_ms DESC LIMIT 1";
        String purge = "DELETE FROM pairing_codes WHERE code=? AND (used=1 OR expires_at_ms<?)";
        String taken = "SELECT 1 FROM pairing_codes WHERE code=?";
        String insert = "INSERT INTO pairing_codes(code,user_id,expires_at_ms,used,created_at_ms) VALUES(?,?,?,0,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(active)) {
                    ps.setString(1, userId);
                    ps.setLong(2, nowMs);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            PairingCode existing = new PairingCode(rs.getString("code"), rs.getLong("expires_at_ms"));
                            c.commit();
                            return existing;
                        }
                    }
                }
                for (int attempt = 0; attempt < 20; attempt++) {
                    String code = codeSupplier.get();
                    try (PreparedStatement ps = c.prepareStatement(purge)) {
                        ps.setString(1, code);
                        ps.setLong(2, nowMs);
                        ps.executeUpdate();
                    }
                    try (PreparedStatement ps = c.prepareStatement(taken)) {
                        ps.setString(1, code);
                        try (ResultSet rs = ps.executeQuery()) {
                            if (rs.next()) {
                                continue;
                            }
                        }
                    }
                    long expiresAt = nowMs + ttlMs;
                    try (PreparedStatement ps = c.prepareStatement(insert)) {
                        ps.setString(1, code);
                        ps.setString(2, userId);
                        ps.setLong(3, expiresAt);
                        ps.setLong(4, nowMs);
                        ps.executeUpdate();
                    }
                    c.commit();
                    return new PairingCode(code, expiresAt);
                }
                throw new IllegalStateException("Could not allocate a free pairing code");
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to issue pairing code", e);
        }
    }

    /**
     * Consumes a pairing code and registers the device under the code's owner.
     */
    public PairingOutcome completePairing(String code, DeviceRegistration registration, String tokenHash,
                                          int maxDevicesPerUser, long nowMs) {
        String name = registration.deviceName() == null ? "" : registration.deviceName().trim();
        if (name.isEmpty()) {
            return PairingOutcome.failed("missing_device_name");
        }
        String lookup = "SELECT user_id FROM pairing_codes WHERE code=? AND used=0 AND expires_at_ms>=?";
        String count = "SELECT COUNT(*) FROM devices WHERE user_id=?";
        String duplicate = "SELECT 1 FROM devices WHERE user_id=? AND device_name_key=?";
        String consume = "UPDATE pairing_codes SET used=1 WHERE code=? AND used=0";
        String insert = """
                INSERT INTO devices(device_id,user_id,device_name,device_name_key,device_type,platform,token_hash,
                is_online,last_seen_at_ms,capabilities,created_at_ms) VALUES(?,?,?,?,?,?,?,1,?,?,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                String userId;
                try (PreparedStatement ps = c.prepareStatement(lookup)) {
                    ps.setString(1, code == null ? "" : code.trim());
                    ps.setLong(2, nowMs);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            c.rollback();
                            return PairingOutcome.failed("invalid_or_expired_code");
                        }
                        userId = rs.getString(1);
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(count)) {
                    ps.setString(1, userId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next() && rs.getInt(1) >= maxDevicesPerUser) {
                            c.rollback();
                            return PairingOutcome.failed("device_limit_reached");
                        }
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(duplicate)) {
                    ps.setString(1, userId);
                    ps.setString(2, nameKey(name));
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            c.rollback();
                            return PairingOutcome.failed("duplicate_device_name");
                        }
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(consume)) {
                    ps.setString(1, code.trim());
                    if (ps.executeUpdate() != 1) {
                        c.rollback();
                        return PairingOutcome.failed("invalid_or_expired_code");
                    }
                }
                String deviceId = UUID.randomUUID().toString();
                try (PreparedStatement ps = c.prepareStatement(insert)) {
                    ps.setString(1, deviceId);
                    ps.setString(2, userId);
                    ps.setString(3, name);
                    ps.setString(4, nameKey(name));
                    ps.setString(5, normalizeType(registration.deviceType()));
                    ps.setString(6, registration.platform() == null ? "" : registration.platform().trim());
                    ps.setString(7, tokenHash);
                    ps.setLong(8, nowMs);
                    ps.setString(9, Jsons.toCompactJson(normalizeCapabilities(registration.capabilities())));
                    ps.setLong(10, nowMs);
                    ps.executeUpdate();
                }
                c.commit();
                return PairingOutcome.paired(userId, deviceId);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to complete pairing", e);
        }
    }

    public Optional<DeviceRecord> findByTokenHash(String tokenHash) {
        return queryOne("SELECT " + DEVICE_COLUMNS + " FROM devices WHERE token_hash=?", tokenHash);
    }

    public Optional<DeviceRecord> findByName(String userId, String deviceName) {
        if (deviceName == null || deviceName.isBlank()) {
            return Optional.empty();
        }
        return queryOne("SELECT " + DEVICE_COLUMNS + " FROM devices WHERE user_id=? AND device_name_key=?",
                userId, nameKey(deviceName));
    }

    public List<DeviceRecord> listDevices(String userId) {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE user_id=? ORDER BY created_at_ms ASC, device_name ASC";
        List<DeviceRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readDevice(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to list devices", e);
        }
    }

    public boolean remove(String userId, String deviceId) {
        return update("DELETE FROM devices WHERE user_id=? AND device_id=?", "Failed to remove device",
                ps -> {
                    ps.setString(1, userId);
                    ps.setString(2, deviceId);
                }) == 1;
    }

    public void markSeen(String deviceId, long nowMs) {
        update("UPDATE devices SET is_online=1,last_seen_at_ms=? WHERE device_id=?", "Failed to record heartbeat",
                ps -> {
                    ps.setLong(1, nowMs);
                    ps.setString(2, deviceId);
                });
    }

    public int markOffline(long silentSinceMs) {
        return update("UPDATE devices SET is_online=0 WHERE is_online=1 AND (last_seen_at_ms IS NULL OR last_seen_at_ms<?)",
                "Failed to mark devices offline",
                ps -> ps.setLong(1, silentSinceMs));
    }

    private int update(String sql, String failure, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RelayStoreException(failure, e);
        }
    }

    private Optional<DeviceRecord> queryOne(String sql, String... args) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setString(i + 1, args[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readDevice(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RelayStoreException("Failed to read device", e);
        }
    }

    private static DeviceRecord readDevice(ResultSet rs) throws SQLException {
        long seen = rs.getLong("last_seen_at_ms");
        Long lastSeen = rs.wasNull() ? null : seen;
        List<String> capabilities;
        try {
            capabilities = List.copyOf(Jsons.mapper().readValue(rs.getString("capabilities"), STRING_LIST));
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt capabilities column", e);
        }
        return new DeviceRecord(
                rs.getString("device_id"),
                rs.getString("user_id"),
                rs.getString("device_name"),
                rs.getString("device_type"),
                rs.getString("platform"),
                rs.getInt("is_online") == 1,
                lastSeen,
                capabilities,
                rs.getLong("created_at_ms")
        );
    }

    private static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeType(String raw) {
        String type = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return DEVICE_TYPES.contains(type) ? type : "other";
    }

    private static List<String> normalizeCapabilities(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return DEFAULT_CAPABILITIES;
        }
        Set<String> out = new LinkedHashSet<>();
        for (String value : raw) {
            String cap = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
            if (CAPABILITIES.contains(cap)) {
                out.add(cap);
            }
        }
        return out.isEmpty() ? DEFAULT_CAPABILITIES : List.copyOf(out);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record PairingCode(String code, long expiresAtMs) {
    }

    public record DeviceRegistration(String deviceName, String deviceType, String platform, List<String> capabilities) {
    }

    public record PairingOutcome(boolean success, String userId, String deviceId, String error) {
        static PairingOutcome paired(String userId, String deviceId) {
            return new PairingOutcome(true, userId, deviceId, null);
        }

        static PairingOutcome failed(String error) {
            return new PairingOutcome(false, null, null, error);
        }
    }
}
