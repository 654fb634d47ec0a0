package io.devicerelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.devicerelay.security.SensitiveDataMasker;
import io.devicerelay.util.Hashing;
import io.devicerelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, and an
 * HMAC of its own hash when a signing secret is configured, so edits and truncation in the
 * middle of the file are detectable with {@link #verifyChain()}.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this(auditFile, signingSecret, Clock.systemUTC());
    }

    /** Rows are stamped from {@code clock}, the same clock the store timestamps come from. */
    public AuditLogger(Path auditFile, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            Files.write(auditFile, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("user_id", event.userId());
        row.put("command_id", event.commandId());
        row.put("device_id", event.deviceId());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes every row hash and link. Returns the 1-based line of the first broken row, or
     * zero when the chain is intact.
     */
    @SuppressWarnings("unchecked")
    public synchronized int verifyChain() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log", e);
        }
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.tryParse(line).orElse(null);
            if (node == null || !node.isObject()) {
                return lineNo;
            }
            Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            String hash = String.valueOf(row.remove("hash"));
            row.remove("signature");
            if (!expectedPrev.equals(row.get("prev_hash")) || !hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                return lineNo;
            }
            expectedPrev = hash;
        }
        return 0;
    }

    private String loadLastHash() {
        String last = "";
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log: " + auditFile, e);
        }
        if (last.isBlank()) {
            return "";
        }
        JsonNode node = Jsons.tryParse(last).orElse(null);
        if (node == null) {
            log.warn("Last audit row in {} is not JSON; starting a new chain", auditFile);
            return "";
        }
        return node.path("hash").asText("");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String userId,
            String commandId,
            String deviceId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent operator(String action, String userId, String commandId, String result,
                                          Map<String, Object> details) {
            return new AuditEvent(action, "operator", userId, commandId, null, result,
                    details == null ? Map.of() : details);
        }

        public static AuditEvent device(String action, String userId, String deviceId, String commandId, String result,
                                        Map<String, Object> details) {
            return new AuditEvent(action, "device", userId, commandId, deviceId, result,
                    details == null ? Map.of() : details);
        }
    }
}
