package in.kirim.messaging;

import in.kirim.util.TenantMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Polls a session's readiness and reports changes.
 *
 * Features:
 * - Periodic probe on a dedicated daemon thread
 * - Callback only when the state flips, never on repeats
 * - A failing probe counts as not ready
 *
 * Usage:
 * <pre>
 * ReadinessMonitor monitor = new ReadinessMonitor(
 *     "shop1",
 *     Duration.ofSeconds(5),
 *     () -> gateway.fetchReady(),
 *     ready -> client.setReady(ready));
 * monitor.start();
 * ...
 * monitor.stop();
 * </pre>
 */
public class ReadinessMonitor {

    private static final Logger log = LoggerFactory.getLogger(ReadinessMonitor.class);

    private final String tenantId;
    private final Duration pollInterval;
    private final Callable<Boolean> probe;
    private final Consumer<Boolean> changeCallback;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean running = false;
    private volatile Boolean lastState;
    private volatile Instant lastChange;
    private volatile int consecutiveFailures;

    public ReadinessMonitor(String tenantId, Duration pollInterval,
                            Callable<Boolean> probe, Consumer<Boolean> changeCallback) {
        this.tenantId = tenantId;
        this.pollInterval = pollInterval;
        this.probe = probe;
        this.changeCallback = changeCallback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "readiness-" + tenantId);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}] Readiness monitor already running", tenantId);
            return;
        }
        log.info("[{}] Starting readiness monitor (poll every {}s)", tenantId, pollInterval.getSeconds());
        running = true;
        pollTask = scheduler.scheduleWithFixedDelay(
            TenantMdc.wrap(tenantId, this::poll), 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[{}] Stopping readiness monitor", tenantId);
        running = false;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one probe now. Package-visible for tests.
     */
    void poll() {
        boolean ready;
        try {
            ready = Boolean.TRUE.equals(probe.call());
            consecutiveFailures = 0;
        } catch (Exception e) {
            consecutiveFailures++;
            if (consecutiveFailures == 1) {
                log.warn("[{}] Readiness probe failed: {}", tenantId, e.getMessage());
            } else {
                log.debug("[{}] Readiness probe failed {} times in a row", tenantId, consecutiveFailures);
            }
            ready = false;
        }
        report(ready);
    }

    /**
     * Record an externally observed state (e.g. after logout).
     */
    public void report(boolean ready) {
        Boolean previous;
        synchronized (this) {
            previous = lastState;
            if (previous != null && previous == ready) {
                return;
            }
            lastState = ready;
            lastChange = Instant.now();
        }
        // First observation of "not ready" is not a change worth reporting
        if (previous == null && !ready) {
            return;
        }
        try {
            changeCallback.accept(ready);
        } catch (Exception e) {
            log.error("[{}] Readiness callback failed", tenantId, e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isReady() {
        return Boolean.TRUE.equals(lastState);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Instant getLastChange() {
        return lastChange;
    }
}
