package in.kirim.infrastructure.metrics;

import in.kirim.domain.job.RetireReason;

import java.time.Duration;

/**
 * Scheduler and dispatch metrics, labelled by tenant.
 *
 * Every method defaults to a no-op so callers that do not care about
 * metrics (tests, embedded use) can pass {@link #NOOP}.
 */
public interface DispatchMetrics {

    DispatchMetrics NOOP = new DispatchMetrics() {};

    /**
     * Record the final outcome of one recipient's delivery.
     *
     * @param tenantId Tenant id
     * @param success  Whether an attempt succeeded
     * @param elapsed  Time from first attempt to outcome, backoff included
     */
    default void recordSend(String tenantId, boolean success, Duration elapsed) {}

    /**
     * Record a retry after a failed attempt.
     *
     * @param attemptNumber the attempt that failed (1, 2, 3...)
     */
    default void recordRetry(String tenantId, int attemptNumber) {}

    /**
     * Record what a timer firing resolved to (queued, deferred, retired, stale, fault).
     */
    default void recordFiring(String tenantId, String outcome) {}

    default void recordRetirement(String tenantId, RetireReason reason) {}

    default void setQueueDepth(String tenantId, int depth) {}

    default void setArmedJobs(String tenantId, int count) {}

    default void setTenantReady(String tenantId, boolean ready) {}

    /**
     * Drop the gauges of a destroyed tenant.
     */
    default void removeTenant(String tenantId) {}
}
