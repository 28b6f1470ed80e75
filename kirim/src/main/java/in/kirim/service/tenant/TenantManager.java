package in.kirim.service.tenant;

import in.kirim.config.SchedulerConfig;
import in.kirim.domain.common.JobValidationException;
import in.kirim.domain.common.ValidationErrorCode;
import in.kirim.domain.job.Addresses;
import in.kirim.domain.job.Job;
import in.kirim.domain.job.RetireReason;
import in.kirim.infrastructure.metrics.DispatchMetrics;
import in.kirim.messaging.IncomingMessage;
import in.kirim.messaging.MessagingClient;
import in.kirim.messaging.MessagingClientFactory;
import in.kirim.messaging.MessagingException;
import in.kirim.messaging.MessagingListener;
import in.kirim.repository.JobRepository;
import in.kirim.repository.JobStore;
import in.kirim.repository.RecentEntriesRepository;
import in.kirim.service.dispatch.DispatchQueue;
import in.kirim.service.dispatch.RecipientDispatcher;
import in.kirim.service.dispatch.RetryBackoff;
import in.kirim.service.dispatch.Sleeper;
import in.kirim.service.schedule.JobScheduler;
import in.kirim.service.schedule.RecurrenceCalculator;
import in.kirim.util.TenantMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Registry of live tenants.
 *
 * {@link #ensure} builds a tenant's bundle (store, queue, scheduler, client)
 * on first use and connects its client; every job is re-armed each time the
 * client reports ready. {@link #destroy} tears the bundle down and deletes
 * the tenant's documents.
 *
 * Replies from recipients are matched against stop keywords here.
 */
public final class TenantManager {
    private static final Logger log = LoggerFactory.getLogger(TenantManager.class);

    private static final Pattern TENANT_ID = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private final SchedulerConfig config;
    private final JobRepository jobRepository;
    private final RecentEntriesRepository recentRepository;
    private final MessagingClientFactory clientFactory;
    private final DispatchMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Addresses addresses;
    private final RecurrenceCalculator recurrence;
    private final RetryBackoff backoff;

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();

    public TenantManager(SchedulerConfig config, JobRepository jobRepository,
                         RecentEntriesRepository recentRepository, MessagingClientFactory clientFactory,
                         DispatchMetrics metrics, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.jobRepository = jobRepository;
        this.recentRepository = recentRepository;
        this.clientFactory = clientFactory;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        this.addresses = new Addresses(config.defaultCountryCode());
        this.recurrence = new RecurrenceCalculator(config.zone());

        Duration base = Duration.ofSeconds(config.sendBackoffSeconds());
        this.backoff = RetryBackoff.builder()
            .baseDelay(base)
            .maxDelay(base.multipliedBy(Math.max(1, config.sendMaxRetries())))
            .maxRetries(config.sendMaxRetries())
            .build();
    }

    public static boolean isValidTenantId(String tenantId) {
        return tenantId != null && TENANT_ID.matcher(tenantId).matches();
    }

    /**
     * Return the tenant, creating and connecting it on first use.
     *
     * @throws JobValidationException for an unusable tenant id
     */
    public Tenant ensure(String tenantId) {
        if (!isValidTenantId(tenantId)) {
            throw new JobValidationException(ValidationErrorCode.TENANT_ID_INVALID, String.valueOf(tenantId));
        }
        Tenant tenant = tenants.computeIfAbsent(tenantId, this::createTenant);
        if (tenant.markStarted()) {
            try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
                log.info("Connecting messaging client for tenant {}", tenantId);
                tenant.client().connect();
            }
        }
        return tenant;
    }

    public Optional<Tenant> find(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    /**
     * Stop everything of a tenant and delete its stored jobs and recent entries.
     */
    public void destroy(String tenantId) {
        if (!isValidTenantId(tenantId)) {
            throw new JobValidationException(ValidationErrorCode.TENANT_ID_INVALID, String.valueOf(tenantId));
        }
        try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
            Tenant tenant = tenants.remove(tenantId);
            if (tenant != null) {
                close(tenant);
                try {
                    tenant.client().destroy();
                } catch (MessagingException e) {
                    log.warn("Messaging client of tenant {} did not shut down cleanly: {}", tenantId, e.getMessage());
                }
            }
            jobRepository.deleteCollection(tenantId);
            recentRepository.delete(tenantId);
            metrics.removeTenant(tenantId);
            log.info("Tenant {} destroyed", tenantId);
        }
    }

    /**
     * Cancel every timer and log the client out. Jobs stay stored and are
     * re-armed when the client becomes ready again.
     */
    public void logout(String tenantId) throws MessagingException {
        Tenant tenant = ensure(tenantId);
        try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
            tenant.scheduler().cancelAll();
            tenant.client().logout();
            log.info("Tenant {} logged out", tenantId);
        }
    }

    /**
     * Tenants in memory plus tenants with a stored job document.
     */
    public List<String> listTenantIds() {
        TreeSet<String> ids = new TreeSet<>(tenants.keySet());
        ids.addAll(jobRepository.listTenantIds());
        return List.copyOf(ids);
    }

    /**
     * Ensure every tenant that has stored jobs. One failing tenant does not
     * stop the others.
     *
     * @return number of tenants started
     */
    public int bootstrap() {
        int started = 0;
        for (String tenantId : jobRepository.listTenantIds()) {
            if (!isValidTenantId(tenantId)) {
                log.warn("Ignoring job document with unusable tenant id '{}'", tenantId);
                continue;
            }
            try {
                ensure(tenantId);
                started++;
            } catch (RuntimeException e) {
                log.error("Bootstrap of tenant {} failed", tenantId, e);
            }
        }
        log.info("Bootstrap finished: {} tenant(s) started", started);
        return started;
    }

    /**
     * Retire every job of the tenant whose stop keyword occurs in a reply
     * from one of its recipients.
     *
     * @return number of jobs retired
     */
    public int handleIncoming(String tenantId, IncomingMessage message) {
        Tenant tenant = tenants.get(tenantId);
        if (tenant == null || message.fromMe()) {
            return 0;
        }
        String from = addresses.normalize(message.from());
        String body = message.body() == null ? "" : message.body().toLowerCase(Locale.ROOT);

        int retired = 0;
        for (Job job : tenant.scheduler().jobs()) {
            if (!job.hasStopKeyword() || !job.sendsTo(from)) continue;
            if (!body.contains(job.stopKeyword().toLowerCase(Locale.ROOT))) continue;

            log.warn("STOP repeat id={} (reply from {} contains keyword '{}')", job.id(), from, job.stopKeyword());
            if (tenant.scheduler().retire(job.id(), RetireReason.STOP_KEYWORD)) {
                retired++;
            }
        }
        return retired;
    }

    /**
     * Stop every tenant without deleting anything.
     */
    public void shutdown() {
        log.info("Shutting down {} tenant(s)", tenants.size());
        for (Tenant tenant : tenants.values()) {
            close(tenant);
        }
        tenants.clear();
    }

    private Tenant createTenant(String tenantId) {
        try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
            JobStore store = JobStore.load(tenantId, jobRepository);
            MessagingClient client = clientFactory.create(tenantId);
            DispatchQueue queue = new DispatchQueue(tenantId, metrics);
            RecipientDispatcher dispatcher = new RecipientDispatcher(tenantId, client, backoff,
                config.readyWait(), config.sendReadyWait(), sleeper, clock, metrics);
            JobScheduler scheduler = new JobScheduler(tenantId, store, queue, dispatcher, recurrence,
                clock, config.timerThreadsPerTenant(), metrics);

            Tenant tenant = new Tenant(tenantId, store, queue, scheduler, client);
            client.addListener(new TenantEvents(tenant));
            log.info("Tenant {} created with {} stored job(s)", tenantId, store.size());
            return tenant;
        }
    }

    private void close(Tenant tenant) {
        tenant.scheduler().shutdown();
        tenant.queue().shutdown();
        metrics.setTenantReady(tenant.tenantId(), false);
    }

    /**
     * Reactions to a tenant's messaging client.
     */
    private final class TenantEvents implements MessagingListener {
        private final Tenant tenant;

        TenantEvents(Tenant tenant) {
            this.tenant = tenant;
        }

        @Override
        public void onReady(String tenantId) {
            try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
                log.info("Session READY for tenant {}, re-arming jobs", tenantId);
                metrics.setTenantReady(tenantId, true);
                if (tenants.get(tenantId) == tenant) {
                    tenant.scheduler().rescheduleAll();
                }
            }
        }

        @Override
        public void onNotReady(String tenantId, String reason) {
            try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
                log.warn("Session not ready for tenant {}: {}", tenantId, reason);
                metrics.setTenantReady(tenantId, false);
            }
        }

        @Override
        public void onIncomingMessage(String tenantId, IncomingMessage message) {
            try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
                handleIncoming(tenantId, message);
            }
        }
    }
}
