package io.llmc.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String CONFIG_DIR_ENV = "LLMC_CONFIG_DIR";

    private ConfigPaths() {
    }

    public static Path baseDir() {
        String override = System.getenv(CONFIG_DIR_ENV);
        if (override != null && !override.isBlank()) {
            return expandHome(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".llmc");
    }

    public static Path defaultConfigPath() {
        return baseDir().resolve("config.json");
    }

    public static Path credentialsPath(Path configPath) {
        return siblingOf(configPath, "keys.json");
    }

    public static Path modelsCachePath(Path configPath) {
        return siblingOf(configPath, "models-cache.json");
    }

    public static Path usageDbPath(Path configPath) {
        return siblingOf(configPath, "usage.db");
    }

    public static Path chatLogDbPath(Path configPath) {
        return siblingOf(configPath, "logs.db");
    }

    public static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    private static Path siblingOf(Path configPath, String fileName) {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent == null ? Path.of(fileName) : parent.resolve(fileName);
    }
}
