package in.kirim.service.logs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.stream.Stream;

/**
 * Read access to the per-tenant log files written by the sifting appender
 * ({@code <logDir>/kirim-<tenantId>.log}).
 */
public final class TenantLogService {
    private static final Logger log = LoggerFactory.getLogger(TenantLogService.class);

    public static final int DEFAULT_LINES = 300;
    public static final int MIN_LINES = 50;
    public static final int MAX_LINES = 2000;
    public static final String NO_LOGS = "No logs yet.";

    private final Path logDir;

    public TenantLogService(Path logDir) {
        this.logDir = logDir;
    }

    public Path fileFor(String tenantId) {
        return logDir.resolve("kirim-" + tenantId + ".log");
    }

    /**
     * Clamp a requested line count. Null or unparsable input gives the default.
     */
    public static int clampLines(String requested) {
        if (requested == null || requested.isBlank()) {
            return DEFAULT_LINES;
        }
        int lines;
        try {
            lines = Integer.parseInt(requested.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_LINES;
        }
        return Math.max(MIN_LINES, Math.min(MAX_LINES, lines));
    }

    /**
     * Last {@code lines} lines of the tenant's log, or {@link #NO_LOGS}.
     */
    public String tail(String tenantId, int lines) throws IOException {
        Path file = fileFor(tenantId);
        if (!Files.exists(file)) {
            return NO_LOGS;
        }
        Deque<String> window = new ArrayDeque<>(lines);
        try (Stream<String> stream = Files.lines(file, StandardCharsets.UTF_8)) {
            stream.forEach(line -> {
                if (window.size() == lines) {
                    window.pollFirst();
                }
                window.addLast(line);
            });
        }
        return window.isEmpty() ? NO_LOGS : String.join("\n", window);
    }

    /**
     * Truncate the tenant's log file. A missing file is left missing.
     */
    public void clear(String tenantId) throws IOException {
        Path file = fileFor(tenantId);
        if (Files.exists(file)) {
            Files.write(file, new byte[0], StandardOpenOption.TRUNCATE_EXISTING);
            log.info("Log of tenant {} cleared", tenantId);
        }
    }
}
