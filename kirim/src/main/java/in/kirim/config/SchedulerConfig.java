package in.kirim.config;

import in.kirim.util.Env;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Process wide settings, read once at startup.
 *
 * All values come from environment variables (or the system property of the
 * same name). {@link in.kirim.bootstrap.StartupConfigValidator} rejects an
 * unusable combination before anything is started.
 *
 * @param port                   HTTP listen port
 * @param dataDir                directory holding the per-tenant JSON documents
 * @param logDir                 directory holding the per-tenant log files
 * @param timezone               zone id used for calendar rules, delivery windows and local date-times
 * @param gatewayUrl             base URL of the messaging gateway
 * @param gatewayToken           bearer token for the gateway, empty for none
 * @param readinessPollSeconds   how often a tenant's session status is polled
 * @param readyWaitSeconds       how long a firing waits for the session before it is skipped
 * @param sendReadyWaitSeconds   how long a single send attempt waits for the session
 * @param sendMaxRetries         retries after the first failed send attempt
 * @param sendBackoffSeconds     base of the linear backoff between attempts
 * @param defaultCountryCode     prefix replacing a leading 0 in phone numbers
 * @param bootstrapDelayMillis   pause before tenants found on disk are restored
 * @param timerThreadsPerTenant  size of each tenant's timer pool
 */
public record SchedulerConfig(
    int port,
    Path dataDir,
    Path logDir,
    String timezone,
    String gatewayUrl,
    String gatewayToken,
    int readinessPollSeconds,
    int readyWaitSeconds,
    int sendReadyWaitSeconds,
    int sendMaxRetries,
    int sendBackoffSeconds,
    String defaultCountryCode,
    long bootstrapDelayMillis,
    int timerThreadsPerTenant
) {
    public static final String DEFAULT_TIMEZONE = "Asia/Jakarta";

    public static SchedulerConfig fromEnv() {
        return new SchedulerConfig(
            Env.getInt("PORT", 8080),
            Path.of(Env.get("DATA_DIR", "./data")),
            Path.of(Env.get("LOG_DIR", "./logs")),
            Env.get("TZ", DEFAULT_TIMEZONE),
            Env.get("GATEWAY_URL", "http://localhost:3001"),
            Env.get("GATEWAY_TOKEN", ""),
            Env.getInt("READINESS_POLL_SECONDS", 5),
            Env.getInt("READY_WAIT_SECONDS", 90),
            Env.getInt("SEND_READY_WAIT_SECONDS", 60),
            Env.getInt("SEND_MAX_RETRIES", 3),
            Env.getInt("SEND_BACKOFF_SECONDS", 3),
            Env.get("DEFAULT_COUNTRY_CODE", "62"),
            Env.getLong("BOOTSTRAP_DELAY_MS", 1500),
            Env.getInt("TIMER_THREADS_PER_TENANT", 2)
        );
    }

    /**
     * Defaults with the given directories; used by tests and embedded setups.
     */
    public static SchedulerConfig defaults(Path dataDir, Path logDir) {
        return new SchedulerConfig(8080, dataDir, logDir, DEFAULT_TIMEZONE,
            "http://localhost:3001", "", 5, 90, 60, 3, 3, "62", 1500, 2);
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public URI gatewayUri() {
        return URI.create(gatewayUrl.endsWith("/")
            ? gatewayUrl.substring(0, gatewayUrl.length() - 1)
            : gatewayUrl);
    }

    public Duration readyWait() {
        return Duration.ofSeconds(readyWaitSeconds);
    }

    public Duration sendReadyWait() {
        return Duration.ofSeconds(sendReadyWaitSeconds);
    }

    public Duration readinessPollInterval() {
        return Duration.ofSeconds(readinessPollSeconds);
    }
}
