package io.llmc.core.http;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public record TransportSettings(
    Duration connectTimeout,
    Duration requestTimeout,
    Duration idleTimeout,
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    int maxConcurrentPerProvider,
    boolean insecureSkipTlsVerify
) {
    public static final String INSECURE_TLS_ENV = "LLMC_INSECURE_SKIP_TLS_VERIFY";

    public TransportSettings {
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(120) : requestTimeout;
        idleTimeout = idleTimeout == null ? Duration.ofSeconds(60) : idleTimeout;
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff == null ? Duration.ofMillis(250) : initialBackoff;
        maxBackoff = maxBackoff == null ? Duration.ofSeconds(2) : maxBackoff;
        maxConcurrentPerProvider = Math.max(1, maxConcurrentPerProvider);
    }

    public static TransportSettings defaults() {
        return new TransportSettings(null, null, null, 3, null, null, 16, false);
    }

    public static TransportSettings fromEnvironment(Map<String, String> env) {
        TransportSettings defaults = defaults();
        return new TransportSettings(
            defaults.connectTimeout(),
            seconds(env.get("LLMC_REQUEST_TIMEOUT_SECONDS"), defaults.requestTimeout()),
            seconds(env.get("LLMC_IDLE_TIMEOUT_SECONDS"), defaults.idleTimeout()),
            integer(env.get("LLMC_MAX_ATTEMPTS"), defaults.maxAttempts()),
            defaults.initialBackoff(),
            defaults.maxBackoff(),
            integer(env.get("LLMC_MAX_CONCURRENT_PER_PROVIDER"), defaults.maxConcurrentPerProvider()),
            truthy(env.get(INSECURE_TLS_ENV))
        );
    }

    public TransportSettings withMaxAttempts(int attempts) {
        return new TransportSettings(connectTimeout, requestTimeout, idleTimeout, attempts, initialBackoff, maxBackoff,
            maxConcurrentPerProvider, insecureSkipTlsVerify);
    }

    public TransportSettings withBackoff(Duration initial, Duration max) {
        return new TransportSettings(connectTimeout, requestTimeout, idleTimeout, maxAttempts, initial, max,
            maxConcurrentPerProvider, insecureSkipTlsVerify);
    }

    public TransportSettings withIdleTimeout(Duration idle) {
        return new TransportSettings(connectTimeout, requestTimeout, idle, maxAttempts, initialBackoff, maxBackoff,
            maxConcurrentPerProvider, insecureSkipTlsVerify);
    }

    public TransportSettings withMaxConcurrentPerProvider(int limit) {
        return new TransportSettings(connectTimeout, requestTimeout, idleTimeout, maxAttempts, initialBackoff, maxBackoff,
            limit, insecureSkipTlsVerify);
    }

    public TransportSettings withInsecureSkipTlsVerify(boolean insecure) {
        return new TransportSettings(connectTimeout, requestTimeout, idleTimeout, maxAttempts, initialBackoff, maxBackoff,
            maxConcurrentPerProvider, insecure);
    }

    private static boolean truthy(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return "1".equals(value) || "true".equals(value) || "yes".equals(value);
    }

    private static Duration seconds(String raw, Duration fallback) {
        try {
            return raw == null || raw.isBlank() ? fallback : Duration.ofSeconds(Long.parseLong(raw.trim()));
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static int integer(String raw, int fallback) {
        try {
            return raw == null || raw.isBlank() ? fallback : Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }
}
