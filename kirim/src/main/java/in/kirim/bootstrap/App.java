package in.kirim.bootstrap;

import in.kirim.config.SchedulerConfig;
import in.kirim.domain.job.Addresses;
import in.kirim.domain.job.JobIdGenerator;
import in.kirim.infrastructure.metrics.PrometheusDispatchMetrics;
import in.kirim.infrastructure.metrics.PrometheusMetricsHandler;
import in.kirim.messaging.GatewayMessagingClient;
import in.kirim.repository.FileJobRepository;
import in.kirim.repository.FileRecentEntriesRepository;
import in.kirim.service.dispatch.Sleeper;
import in.kirim.service.logs.TenantLogService;
import in.kirim.service.tenant.TenantManager;
import in.kirim.service.validation.JobRequestValidator;
import in.kirim.service.validation.RecipientParser;
import in.kirim.transport.http.JobHandlers;
import in.kirim.transport.http.TenantHandlers;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Kirim scheduler entry point.
 *
 * Wires:
 * - File-backed job and recent-entries documents (one per tenant)
 * - Tenant manager (timer pool, dispatch queue and messaging client per tenant)
 * - Undertow HTTP API and Prometheus /metrics
 * - Delayed bootstrap of every tenant with stored jobs
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Kirim scheduler starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        SchedulerConfig config = SchedulerConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("Refusing to start: {}", e.getMessage());
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusDispatchMetrics metrics = new PrometheusDispatchMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Repository layer
        // ═══════════════════════════════════════════════════════════════
        Addresses addresses = new Addresses(config.defaultCountryCode());
        FileJobRepository jobRepository = new FileJobRepository(config.dataDir(), config.zone(), addresses);
        FileRecentEntriesRepository recentRepository = new FileRecentEntriesRepository(config.dataDir());
        log.info("✓ Job documents under {}", config.dataDir().toAbsolutePath());

        // ═══════════════════════════════════════════════════════════════
        // Tenant manager
        // ═══════════════════════════════════════════════════════════════
        Clock clock = Clock.system(config.zone());
        TenantManager tenantManager = new TenantManager(config, jobRepository, recentRepository,
            GatewayMessagingClient.factory(config), metrics, clock, Sleeper.SYSTEM);
        log.info("✓ Tenant manager ready (gateway {})", config.gatewayUri());

        // ═══════════════════════════════════════════════════════════════
        // HTTP handlers
        // ═══════════════════════════════════════════════════════════════
        JobRequestValidator validator = new JobRequestValidator(
            new RecipientParser(addresses), config.zone(), new JobIdGenerator(clock), clock);
        JobHandlers jobHandlers = new JobHandlers(tenantManager, validator, recentRepository);
        TenantHandlers tenantHandlers = new TenantHandlers(tenantManager, recentRepository,
            new TenantLogService(config.logDir()));
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes(jobHandlers, tenantHandlers, metricsHandler))
            .build();
        server.start();
        log.info("✓ HTTP API started on http://localhost:{}/", config.port());

        // ═══════════════════════════════════════════════════════════════
        // Bootstrap stored tenants (after the listener is up)
        // ═══════════════════════════════════════════════════════════════
        ScheduledExecutorService bootstrapExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bootstrap");
            t.setDaemon(true);
            return t;
        });
        bootstrapExecutor.schedule(tenantManager::bootstrap, config.bootstrapDelayMillis(), TimeUnit.MILLISECONDS);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            bootstrapExecutor.shutdownNow();
            server.stop();
            tenantManager.shutdown();
            log.info("✓ Shutdown complete");
        }, "shutdown"));
    }

    /**
     * Full HTTP handler chain: CORS, then blocking dispatch, then routes.
     */
    public static HttpHandler routes(JobHandlers jobs, TenantHandlers tenants, HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", tenants::health)
            // Tenants
            .get("/api/tenants", tenants::list)
            .post("/api/tenants/{tenantId}/init", tenants::init)
            .get("/api/tenants/{tenantId}/status", tenants::status)
            .post("/api/tenants/{tenantId}/logout", tenants::logout)
            .delete("/api/tenants/{tenantId}", tenants::destroy)
            .post("/api/tenants/{tenantId}/inbound", tenants::inbound)
            .get("/api/tenants/{tenantId}/recent", tenants::recent)
            .delete("/api/tenants/{tenantId}/recent", tenants::clearRecent)
            .get("/api/tenants/{tenantId}/logs", tenants::logs)
            .delete("/api/tenants/{tenantId}/logs", tenants::clearLogs)
            // Jobs
            .post("/api/tenants/{tenantId}/jobs", jobs::create)
            .get("/api/tenants/{tenantId}/jobs", jobs::list)
            .put("/api/tenants/{tenantId}/jobs/{jobId}", jobs::update)
            .delete("/api/tenants/{tenantId}/jobs/{jobId}", jobs::delete)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Kirim scheduler\n\n" +
                    "Tenants: GET /api/tenants, POST /api/tenants/{id}/init, GET /api/tenants/{id}/status\n" +
                    "Jobs:    GET|POST /api/tenants/{id}/jobs, PUT|DELETE /api/tenants/{id}/jobs/{jobId}\n" +
                    "Health:  GET /api/health, GET /metrics\n"
                );
            });

        // Handlers touch files and the gateway, so they run on worker threads
        HttpHandler blocking = new BlockingHandler(routes);

        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                blocking.handleRequest(exchange);
            }
        };
    }
}
