package in.kirim.bootstrap;

import in.kirim.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before any tenant is restored. A bad setting is a hard gate: the
 * process refuses to start rather than schedule against the wrong clock or
 * write documents into a directory it cannot use.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate configuration and prepare the data and log directories.
     *
     * @throws IllegalStateException listing every problem found
     */
    public static void validate(SchedulerConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> problems = new ArrayList<>();

        if (config.port() < 1 || config.port() > 65535) {
            problems.add("PORT must be between 1 and 65535, got " + config.port());
        }

        try {
            ZoneId zone = ZoneId.of(config.timezone());
            log.info("✓ Time zone {}", zone);
        } catch (DateTimeException e) {
            problems.add("TZ is not a known zone id: " + config.timezone());
        }

        try {
            URI uri = URI.create(config.gatewayUrl());
            if (uri.getScheme() == null || !uri.getScheme().startsWith("http") || uri.getHost() == null) {
                problems.add("GATEWAY_URL must be an absolute http(s) URL, got " + config.gatewayUrl());
            } else {
                log.info("✓ Messaging gateway {}", uri);
            }
        } catch (IllegalArgumentException e) {
            problems.add("GATEWAY_URL is malformed: " + config.gatewayUrl());
        }

        if (config.sendMaxRetries() < 0) {
            problems.add("SEND_MAX_RETRIES must be >= 0");
        }
        if (config.sendBackoffSeconds() < 0) {
            problems.add("SEND_BACKOFF_SECONDS must be >= 0");
        }
        if (config.readinessPollSeconds() < 1) {
            problems.add("READINESS_POLL_SECONDS must be >= 1");
        }
        if (config.readyWaitSeconds() < 0 || config.sendReadyWaitSeconds() < 0) {
            problems.add("READY_WAIT_SECONDS and SEND_READY_WAIT_SECONDS must be >= 0");
        }
        if (config.timerThreadsPerTenant() < 1) {
            problems.add("TIMER_THREADS_PER_TENANT must be >= 1");
        }
        if (config.defaultCountryCode() == null || !config.defaultCountryCode().matches("\\d{1,4}")) {
            problems.add("DEFAULT_COUNTRY_CODE must be 1-4 digits");
        }

        checkWritableDirectory("DATA_DIR", config.dataDir(), problems);
        checkWritableDirectory("LOG_DIR", config.logDir(), problems);

        if (!problems.isEmpty()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: system refuses to start\n  - " + String.join("\n  - ", problems));
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void checkWritableDirectory(String name, Path dir, List<String> problems) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            problems.add(name + " cannot be created: " + dir + " (" + e.getMessage() + ")");
            return;
        }
        if (!Files.isWritable(dir)) {
            problems.add(name + " is not writable: " + dir);
        } else {
            log.info("✓ {} {}", name, dir.toAbsolutePath());
        }
    }

    private StartupConfigValidator() {}
}
