package io.devicerelay.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.devicerelay.config.RelaySettings;
import io.devicerelay.model.ClaimedCommand;
import io.devicerelay.model.DeviceRecord;
import io.devicerelay.runtime.DeliveryProtocol;
import io.devicerelay.storage.DeviceStore;
import io.devicerelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON endpoints devices talk to. Device routes require {@code Authorization: Bearer <token>}
 * and reject an unknown token with 401 before anything else is read.
 */
public final class RelayApiServer {
    private static final Logger log = LoggerFactory.getLogger(RelayApiServer.class);
    private static final String PREFIX = "/api/relay";
    private static final int MAX_BODY_BYTES = 1024 * 1024;

    private final DeliveryProtocol delivery;
    private final RelaySettings settings;
    private HttpServer server;
    private ExecutorService executor;

    public RelayApiServer(DeliveryProtocol delivery, RelaySettings settings) {
        this.delivery = delivery;
        this.settings = settings;
    }

    /**
     * Binds and starts serving. Pass port 0 for an ephemeral port.
     *
     * @return the bound port
     */
    public synchronized int start(String host, int port) throws IOException {
        if (server != null) {
            throw new IllegalStateException("server already started");
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(host, port), 0);
        route(created, "/pair", "POST", false, this::handlePair);
        route(created, "/poll", "GET", true, this::handlePoll);
        route(created, "/result", "POST", true, this::handleResult);
        route(created, "/heartbeat", "POST", true, this::handleHeartbeat);
        route(created, "/devices", "GET", true, this::handleDevices);
        route(created, "/device", "DELETE", true, this::handleRemoveDevice);
        route(created, "/progress", "POST", true, this::handleProgress);
        created.createContext("/", exchange -> {
            try {
                writeJson(exchange, Map.of("error", "not_found"), 404);
            } finally {
                exchange.close();
            }
        });
        AtomicInteger threadIds = new AtomicInteger();
        executor = Executors.newFixedThreadPool(settings.httpThreads(), r -> {
            Thread t = new Thread(r, "relay-http-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        created.setExecutor(executor);
        created.start();
        server = created;
        int bound = created.getAddress().getPort();
        log.info("Relay API listening on {}:{}", host, bound);
        return bound;
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(0);
        // Interrupts waiting long-polls; they return an empty result.
        executor.shutdownNow();
        server = null;
        executor = null;
        log.info("Relay API stopped");
    }

    private void route(HttpServer target, String path, String method, boolean deviceAuth, Handler handler) {
        String fullPath = PREFIX + path;
        target.createContext(fullPath, exchange -> {
            try {
                applyCors(exchange);
                if (!fullPath.equals(exchange.getRequestURI().getPath())) {
                    writeJson(exchange, Map.of("error", "not_found"), 404);
                    return;
                }
                String requestMethod = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
                if ("OPTIONS".equals(requestMethod)) {
                    exchange.sendResponseHeaders(204, -1);
                    return;
                }
                if (!method.equals(requestMethod)) {
                    exchange.getResponseHeaders().set("Allow", method + ", OPTIONS");
                    writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                    return;
                }
                DeviceRecord device = null;
                if (deviceAuth) {
                    Optional<DeviceRecord> authenticated = delivery.authenticate(bearerToken(exchange));
                    if (authenticated.isEmpty()) {
                        writeJson(exchange, Map.of("error", "invalid_device_token"), 401);
                        return;
                    }
                    device = authenticated.get();
                }
                handler.handle(exchange, device);
            } catch (Exception e) {
                log.error("Unhandled failure on {} {}", exchange.getRequestMethod(), fullPath, e);
                writeJson(exchange, Map.of("error", "internal_error"), 500);
            } finally {
                exchange.close();
            }
        });
    }

    private void handlePair(HttpExchange exchange, DeviceRecord ignored) throws IOException {
        JsonNode body = readJsonBody(exchange);
        if (body == null) {
            return;
        }
        String code = body.path("code").asText("").trim();
        JsonNode deviceNode = body.path("device");
        String deviceName = deviceNode.path("deviceName").asText("").trim();
        if (code.isEmpty() || deviceName.isEmpty()) {
            writeJson(exchange, Map.of("error", "missing_fields", "required", List.of("code", "device.deviceName")), 400);
            return;
        }
        List<String> capabilities = new ArrayList<>();
        for (JsonNode cap : deviceNode.path("capabilities")) {
            capabilities.add(cap.asText(""));
        }
        DeliveryProtocol.PairResponse response = delivery.pair(code, new DeviceStore.DeviceRegistration(
                deviceName,
                deviceNode.path("deviceType").asText("other"),
                deviceNode.path("platform").asText(""),
                capabilities));
        if (!response.success()) {
            writeJson(exchange, Map.of("success", false, "error", response.error()), 400);
            return;
        }
        writeJson(exchange, Map.of(
                "success", true,
                "deviceToken", response.deviceToken(),
                "deviceId", response.deviceId()), 200);
    }

    private void handlePoll(HttpExchange exchange, DeviceRecord device) throws IOException {
        List<Map<String, Object>> commands = new ArrayList<>();
        for (ClaimedCommand c : delivery.poll(device)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("commandId", c.commandId());
            row.put("encryptedCommand", c.encryptedCommand());
            row.put("iv", c.iv());
            row.put("authTag", c.authTag());
            row.put("priority", c.priority());
            row.put("createdAt", Instant.ofEpochMilli(c.createdAtMs()).toString());
            commands.add(row);
        }
        writeJson(exchange, Map.of("commands", commands), 200);
    }

    private void handleResult(HttpExchange exchange, DeviceRecord device) throws IOException {
        JsonNode body = readJsonBody(exchange);
        if (body == null) {
            return;
        }
        String commandId = body.path("commandId").asText("").trim();
        if (commandId.isEmpty()) {
            writeJson(exchange, Map.of("error", "missing_fields", "required", List.of("commandId")), 400);
            return;
        }
        boolean stored = delivery.submitResult(device, commandId,
                body.path("encryptedResult").asText(null),
                body.path("resultIv").asText(null),
                body.path("resultAuthTag").asText(null),
                body.path("resultSummary").asText(null),
                body.path("status").asText("completed"));
        writeJson(exchange, Map.of("success", stored), 200);
    }

    private void handleHeartbeat(HttpExchange exchange, DeviceRecord device) throws IOException {
        int pending = delivery.heartbeat(device);
        writeJson(exchange, Map.of("ok", true, "pendingCommands", pending), 200);
    }

    private void handleDevices(HttpExchange exchange, DeviceRecord device) throws IOException {
        List<Map<String, Object>> devices = new ArrayList<>();
        for (DeviceRecord d : delivery.devices(device)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", d.deviceId());
            row.put("deviceName", d.deviceName());
            row.put("deviceType", d.deviceType());
            row.put("platform", d.platform());
            row.put("isOnline", d.online());
            row.put("lastSeenAt", d.lastSeenAtMs() == null ? null : Instant.ofEpochMilli(d.lastSeenAtMs()).toString());
            row.put("capabilities", d.capabilities());
            devices.add(row);
        }
        writeJson(exchange, Map.of("devices", devices), 200);
    }

    private void handleRemoveDevice(HttpExchange exchange, DeviceRecord device) throws IOException {
        String name = queryParam(exchange, "name");
        if (name == null || name.isBlank()) {
            writeJson(exchange, Map.of("error", "missing_fields", "required", List.of("name")), 400);
            return;
        }
        writeJson(exchange, Map.of("success", delivery.removeDevice(device.userId(), name)), 200);
    }

    private void handleProgress(HttpExchange exchange, DeviceRecord device) throws IOException {
        JsonNode body = readJsonBody(exchange);
        if (body == null) {
            return;
        }
        String commandId = body.path("commandId").asText("").trim();
        String event = body.path("event").asText("").trim();
        if (commandId.isEmpty() || event.isEmpty()) {
            writeJson(exchange, Map.of("error", "missing_fields", "required", List.of("commandId", "event")), 400);
            return;
        }
        JsonNode dataNode = body.path("data");
        String data = null;
        if (dataNode.isTextual()) {
            data = dataNode.asText();
        } else if (!dataNode.isMissingNode() && !dataNode.isNull()) {
            data = Jsons.toCompactJson(dataNode);
        }
        boolean stored = delivery.progress(device, commandId, event, body.path("message").asText(""), data);
        writeJson(exchange, Map.of("success", stored), 200);
    }

    /**
     * Reads the body as a JSON object, answering 400 itself and returning null when it is not one.
     */
    private static JsonNode readJsonBody(HttpExchange exchange) throws IOException {
        byte[] raw;
        try (InputStream in = exchange.getRequestBody()) {
            raw = in.readNBytes(MAX_BODY_BYTES + 1);
        }
        if (raw.length > MAX_BODY_BYTES) {
            writeJson(exchange, Map.of("error", "body_too_large"), 413);
            return null;
        }
        Optional<JsonNode> parsed = Jsons.tryParse(new String(raw, StandardCharsets.UTF_8));
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            writeJson(exchange, Map.of("error", "invalid_json"), 400);
            return null;
        }
        return parsed.get();
    }

    private static String bearerToken(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (value.length() < 7 || !value.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        String token = value.substring(7).trim();
        return token.isEmpty() ? null : token;
    }

    private static String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            String k = idx >= 0 ? pair.substring(0, idx) : pair;
            if (key.equals(URLDecoder.decode(k, StandardCharsets.UTF_8))) {
                return idx >= 0 ? URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }

    private void applyCors(HttpExchange exchange) {
        String origin = exchange.getRequestHeaders().getFirst("Origin");
        List<String> allowed = settings.allowedOrigins();
        if (origin == null || origin.isBlank()) {
            return;
        }
        if (allowed.contains("*") || allowed.contains(origin)) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", allowed.contains("*") ? "*" : origin);
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Authorization, Content-Type");
            exchange.getResponseHeaders().set("Access-Control-Max-Age", "600");
            exchange.getResponseHeaders().add("Vary", "Origin");
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange, DeviceRecord device) throws IOException;
    }
}
