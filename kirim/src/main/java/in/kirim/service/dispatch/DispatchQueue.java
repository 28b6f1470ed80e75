package in.kirim.service.dispatch;

import in.kirim.infrastructure.metrics.DispatchMetrics;
import in.kirim.util.TenantMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Per-tenant FIFO of dispatch tasks with a single worker.
 *
 * SINGLE SENDER PER TENANT:
 * Tasks run one at a time, in enqueue order, on one dedicated thread. Jobs
 * that fire together are flattened into one ordered send stream, so sends of
 * different jobs never interleave.
 *
 * The worker drains the queue until it is empty and then goes idle;
 * {@link #enqueue} wakes it again.
 */
public final class DispatchQueue {
    private static final Logger log = LoggerFactory.getLogger(DispatchQueue.class);

    private final String tenantId;
    private final ExecutorService worker;
    private final DispatchMetrics metrics;

    private final Deque<DispatchTask> pending = new ArrayDeque<>();
    private boolean running;
    private boolean closed;

    public DispatchQueue(String tenantId, DispatchMetrics metrics) {
        this.tenantId = tenantId;
        this.metrics = metrics;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, "dispatch-" + tenantId);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Append a task and start the worker if it is idle.
     *
     * @return false if the queue is closed
     */
    public boolean enqueue(DispatchTask task) {
        int depth;
        synchronized (this) {
            if (closed) {
                log.warn("Queue closed, dropping task for job id={}", task.jobId());
                return false;
            }
            pending.addLast(task);
            depth = pending.size();
            if (running) {
                metrics.setQueueDepth(tenantId, depth);
                log.debug("Queued job id={} behind {} task(s)", task.jobId(), depth - 1);
                return true;
            }
            running = true;
        }
        metrics.setQueueDepth(tenantId, depth);
        try {
            worker.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                running = false;
                pending.remove(task);
            }
            log.warn("Dispatch worker rejected job id={}: {}", task.jobId(), e.getMessage());
            return false;
        }
        return true;
    }

    private void drain() {
        boolean drained = false;
        try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
            while (true) {
                DispatchTask task;
                int depth;
                synchronized (this) {
                    task = pending.pollFirst();
                    if (task == null) {
                        running = false;
                        drained = true;
                        return;
                    }
                    depth = pending.size();
                }
                metrics.setQueueDepth(tenantId, depth);
                runTask(task);
            }
        } finally {
            if (!drained) {
                // worker died on an Error; let the next enqueue restart it
                synchronized (this) {
                    running = false;
                }
            }
        }
    }

    private void runTask(DispatchTask task) {
        DispatchReport report;
        try {
            report = task.work().get();
        } catch (RuntimeException e) {
            log.error("Dispatch task for job id={} failed", task.jobId(), e);
            report = DispatchReport.failed(task.jobId(), e);
        }
        try {
            task.completion().accept(report);
        } catch (RuntimeException e) {
            log.error("Completion of job id={} failed", task.jobId(), e);
        }
    }

    public synchronized int size() {
        return pending.size();
    }

    /**
     * True while the worker is draining (a task may be in flight).
     */
    public synchronized boolean isBusy() {
        return running;
    }

    /**
     * Discard waiting tasks and stop the worker. An in-flight task is
     * interrupted.
     */
    public void shutdown() {
        int discarded;
        synchronized (this) {
            closed = true;
            discarded = pending.size();
            pending.clear();
        }
        if (discarded > 0) {
            log.info("Discarded {} queued dispatch task(s) for tenant {}", discarded, tenantId);
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dispatch worker for tenant {} did not stop in time", tenantId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        metrics.setQueueDepth(tenantId, 0);
    }
}
