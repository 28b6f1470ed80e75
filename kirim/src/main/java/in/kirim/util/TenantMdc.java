package in.kirim.util;

import org.slf4j.MDC;

/**
 * Tenant tagging for log lines.
 *
 * The logback configuration routes every event carrying the {@value #KEY}
 * MDC entry to that tenant's own log file.
 */
public final class TenantMdc {

    public static final String KEY = "tenant";

    public static MDC.MDCCloseable open(String tenantId) {
        return MDC.putCloseable(KEY, tenantId);
    }

    /**
     * Wrap a task so it runs tagged with the tenant, whatever thread picks it up.
     */
    public static Runnable wrap(String tenantId, Runnable task) {
        return () -> {
            try (MDC.MDCCloseable ignored = open(tenantId)) {
                task.run();
            }
        };
    }

    private TenantMdc() {}
}
