package io.devicerelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class DeviceRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "devicerelay-settings.json";
    public static final String ENCRYPTION_KEY_ENV = "DEVICERELAY_ENCRYPTION_KEY";

    private final Path rootDir;

    public DeviceRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static DeviceRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new DeviceRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("devicerelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
