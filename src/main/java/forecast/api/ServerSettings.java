package forecast.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Server and service limits, read from the environment.
 * <ul>
 *   <li>{@code PORT} (7000)</li>
 *   <li>{@code FORECAST_TIMEOUT_MS} (30000)</li>
 *   <li>{@code FORECAST_WORKERS} (available processors)</li>
 *   <li>{@code FORECAST_MAX_PERIODS} (365)</li>
 * </ul>
 */
public final class ServerSettings {

    private static final Logger log = LoggerFactory.getLogger(ServerSettings.class);

    public static final int DEFAULT_PORT = 7000;
    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_MAX_PERIODS = 365;

    private final int port;
    private final long timeoutMillis;
    private final int workers;
    private final int maxPeriods;

    public ServerSettings(int port, long timeoutMillis, int workers, int maxPeriods) {
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeout must be positive");
        if (workers <= 0) throw new IllegalArgumentException("workers must be positive");
        if (maxPeriods <= 0) throw new IllegalArgumentException("max periods must be positive");
        this.port = port;
        this.timeoutMillis = timeoutMillis;
        this.workers = workers;
        this.maxPeriods = maxPeriods;
    }

    public static ServerSettings defaults() {
        return new ServerSettings(DEFAULT_PORT, DEFAULT_TIMEOUT_MS,
                Runtime.getRuntime().availableProcessors(), DEFAULT_MAX_PERIODS);
    }

    public static ServerSettings fromEnvironment() {
        return from(System.getenv());
    }

    static ServerSettings from(Map<String, String> env) {
        return new ServerSettings(
                (int) read(env, "PORT", DEFAULT_PORT),
                read(env, "FORECAST_TIMEOUT_MS", DEFAULT_TIMEOUT_MS),
                (int) read(env, "FORECAST_WORKERS", Runtime.getRuntime().availableProcessors()),
                (int) read(env, "FORECAST_MAX_PERIODS", DEFAULT_MAX_PERIODS));
    }

    private static long read(Map<String, String> env, String key, long def) {
        String v = env.get(key);
        if (v == null || v.isBlank()) return def;
        try {
            long parsed = Long.parseLong(v.trim());
            if (parsed > 0) return parsed;
            log.warn("Ignoring non-positive {}={}, using {}", key, v, def);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {}={}, using {}", key, v, def);
        }
        return def;
    }

    public int getPort() { return port; }
    public long getTimeoutMillis() { return timeoutMillis; }
    public int getWorkers() { return workers; }
    public int getMaxPeriods() { return maxPeriods; }
}
