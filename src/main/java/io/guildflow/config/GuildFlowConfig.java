package io.guildflow.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class GuildFlowConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "guildflow-settings.json";

    private final Path rootDir;

    public GuildFlowConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static GuildFlowConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new GuildFlowConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path storeDir() {
        return rootDir.resolve("store");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
