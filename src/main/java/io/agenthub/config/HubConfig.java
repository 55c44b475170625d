package io.agenthub.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class HubConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "agenthub-settings.json";

    private final Path rootDir;
    private final HubSettings settings;

    public HubConfig(Path rootDir, HubSettings settings) {
        this.rootDir = rootDir;
        this.settings = settings == null ? HubSettings.defaults() : settings;
    }

    public static HubConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new HubConfig(base, HubSettings.load(base.resolve(SETTINGS_FILE)));
    }

    public HubConfig withSettings(HubSettings replacement) {
        return new HubConfig(rootDir, replacement);
    }

    public Path rootDir() {
        return rootDir;
    }

    public HubSettings settings() {
        return settings;
    }

    public Path dbFile() {
        return rootDir.resolve("agenthub.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
