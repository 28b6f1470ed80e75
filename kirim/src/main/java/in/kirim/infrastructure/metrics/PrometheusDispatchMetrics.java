package in.kirim.infrastructure.metrics;

import in.kirim.domain.job.RetireReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of DispatchMetrics.
 *
 * Key Metrics:
 * - kirim_sends_total{tenant, status} - Recipient deliveries by outcome
 * - kirim_send_duration_seconds{tenant} - Delivery time including retries
 * - kirim_send_retries_total{tenant, attempt} - Retries after failed attempts
 * - kirim_firings_total{tenant, outcome} - Timer firings by outcome
 * - kirim_retirements_total{tenant, reason} - Jobs leaving the schedule
 * - kirim_queue_depth{tenant} - Dispatch tasks waiting
 * - kirim_armed_jobs{tenant} - Jobs with a live timer
 * - kirim_tenant_ready{tenant} - Messaging session state (1=ready)
 */
public class PrometheusDispatchMetrics implements DispatchMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusDispatchMetrics.class);

    private final CollectorRegistry registry;

    private final Counter sendCounter;
    private final Histogram sendDuration;
    private final Counter retryCounter;
    private final Counter firingCounter;
    private final Counter retirementCounter;
    private final Gauge queueDepth;
    private final Gauge armedJobs;
    private final Gauge tenantReady;

    public PrometheusDispatchMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusDispatchMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.sendCounter = Counter.build()
            .name("kirim_sends_total")
            .help("Recipient deliveries by final outcome")
            .labelNames("tenant", "status")
            .register(registry);

        this.sendDuration = Histogram.build()
            .name("kirim_send_duration_seconds")
            .help("Time to deliver to one recipient, retries and backoff included")
            .labelNames("tenant")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0, 60.0, 120.0)
            .register(registry);

        this.retryCounter = Counter.build()
            .name("kirim_send_retries_total")
            .help("Send retries after a failed attempt")
            .labelNames("tenant", "attempt")
            .register(registry);

        this.firingCounter = Counter.build()
            .name("kirim_firings_total")
            .help("Timer firings by outcome")
            .labelNames("tenant", "outcome")
            .register(registry);

        this.retirementCounter = Counter.build()
            .name("kirim_retirements_total")
            .help("Jobs removed from the schedule")
            .labelNames("tenant", "reason")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("kirim_queue_depth")
            .help("Dispatch tasks waiting in the tenant queue")
            .labelNames("tenant")
            .register(registry);

        this.armedJobs = Gauge.build()
            .name("kirim_armed_jobs")
            .help("Jobs with a live timer")
            .labelNames("tenant")
            .register(registry);

        this.tenantReady = Gauge.build()
            .name("kirim_tenant_ready")
            .help("Messaging session ready (1) or not (0)")
            .labelNames("tenant")
            .register(registry);

        log.info("Prometheus dispatch metrics initialized");
    }

    @Override
    public void recordSend(String tenantId, boolean success, Duration elapsed) {
        sendCounter.labels(tenantId, success ? "ok" : "failed").inc();
        sendDuration.labels(tenantId).observe(elapsed.toMillis() / 1000.0);
    }

    @Override
    public void recordRetry(String tenantId, int attemptNumber) {
        retryCounter.labels(tenantId, String.valueOf(attemptNumber)).inc();
    }

    @Override
    public void recordFiring(String tenantId, String outcome) {
        firingCounter.labels(tenantId, outcome).inc();
    }

    @Override
    public void recordRetirement(String tenantId, RetireReason reason) {
        retirementCounter.labels(tenantId, reason.label()).inc();
    }

    @Override
    public void setQueueDepth(String tenantId, int depth) {
        queueDepth.labels(tenantId).set(depth);
    }

    @Override
    public void setArmedJobs(String tenantId, int count) {
        armedJobs.labels(tenantId).set(count);
    }

    @Override
    public void setTenantReady(String tenantId, boolean ready) {
        tenantReady.labels(tenantId).set(ready ? 1 : 0);
    }

    @Override
    public void removeTenant(String tenantId) {
        queueDepth.remove(tenantId);
        armedJobs.remove(tenantId);
        tenantReady.remove(tenantId);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
