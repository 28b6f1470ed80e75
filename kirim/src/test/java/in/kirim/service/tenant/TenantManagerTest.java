package in.kirim.service.tenant;

import in.kirim.config.SchedulerConfig;
import in.kirim.domain.common.JobValidationException;
import in.kirim.domain.job.Job;
import in.kirim.domain.job.JobState;
import in.kirim.domain.job.Recipient;
import in.kirim.domain.job.RepeatPolicy;
import in.kirim.infrastructure.metrics.DispatchMetrics;
import in.kirim.messaging.IncomingMessage;
import in.kirim.repository.RecentEntriesRepository;
import in.kirim.testing.FakeMessagingClient;
import in.kirim.testing.InMemoryJobRepository;
import in.kirim.testing.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for TenantManager.
 *
 * Tests:
 * - Lazy creation and single connect per tenant
 * - Re-arm on every ready transition
 * - Stop keyword handling of inbound replies
 * - Logout, destroy and bootstrap
 */
@ExtendWith(MockitoExtension.class)
class TenantManagerTest {

    @TempDir
    Path tempDir;

    @Mock
    private RecentEntriesRepository recent;

    private final Clock clock = Clock.systemUTC();
    private final Map<String, FakeMessagingClient> clients = new ConcurrentHashMap<>();
    private InMemoryJobRepository repository;
    private TenantManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository();
        SchedulerConfig config = SchedulerConfig.defaults(tempDir.resolve("data"), tempDir.resolve("logs"));
        manager = new TenantManager(config, repository, recent,
            tenantId -> clients.computeIfAbsent(tenantId, id -> new FakeMessagingClient(id, false)),
            DispatchMetrics.NOOP, clock, new RecordingSleeper());
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private Job futureJob(long id, String stopKeyword) {
        Instant now = clock.instant();
        return Job.builder()
            .id(id)
            .recipients(List.of(new Recipient("628111", "promo"), new Recipient("628222", "promo")))
            .anchorTime(now.plus(Duration.ofHours(1)))
            .repeatPolicy(RepeatPolicy.INTERVAL_HOURS)
            .intervalN(1)
            .remainingRuns(5)
            .repeatUntil(now.plus(Duration.ofDays(365)))
            .stopKeyword(stopKeyword)
            .build();
    }

    @Test
    void testEnsureCreatesOnceAndConnectsOnce() {
        Tenant first = manager.ensure("acme");
        Tenant second = manager.ensure("acme");

        assertSame(first, second);
        assertEquals(1, clients.get("acme").connects());
        assertTrue(manager.find("acme").isPresent());
        assertTrue(manager.find("other").isEmpty());
    }

    @Test
    void testInvalidTenantIdRejected() {
        assertThrows(JobValidationException.class, () -> manager.ensure("../etc"));
        assertThrows(JobValidationException.class, () -> manager.ensure(""));
        assertFalse(TenantManager.isValidTenantId(null));
        assertTrue(TenantManager.isValidTenantId("shop_01-b"));
    }

    @Test
    @DisplayName("every ready transition re-arms the stored jobs")
    void testReadyTriggersReschedule() throws Exception {
        repository.seed("acme", List.of(futureJob(1L, null)));
        Tenant tenant = manager.ensure("acme");
        FakeMessagingClient client = clients.get("acme");

        assertTrue(tenant.scheduler().stateOf(1L).isEmpty(), "Nothing armed before the session is ready");

        client.setReady(true);
        assertEquals(JobState.ARMED, tenant.scheduler().stateOf(1L).orElseThrow());

        manager.logout("acme");
        assertTrue(tenant.scheduler().stateOf(1L).isEmpty(), "Logout cancels timers");
        assertEquals(1, tenant.scheduler().jobs().size(), "Logout keeps jobs");
        assertEquals(1, client.logouts());

        client.setReady(true);
        assertEquals(JobState.ARMED, tenant.scheduler().stateOf(1L).orElseThrow(), "Re-armed on reconnect");
    }

    @Test
    void testStopKeywordRetiresJob() {
        repository.seed("acme", List.of(futureJob(1L, "STOP"), futureJob(2L, null)));
        Tenant tenant = manager.ensure("acme");
        clients.get("acme").setReady(true);

        clients.get("acme").deliverIncoming(new IncomingMessage("+62 8111", "please stop sending", false));

        assertTrue(tenant.scheduler().find(1L).isEmpty(), "Job with matching keyword is retired");
        assertTrue(tenant.scheduler().stateOf(1L).isEmpty(), "and its timer cancelled");
        assertTrue(tenant.scheduler().find(2L).isPresent(), "Job without keyword is untouched");
    }

    @Test
    void testStopKeywordIgnoresOwnAndForeignMessages() {
        repository.seed("acme", List.of(futureJob(1L, "stop")));
        manager.ensure("acme");

        assertEquals(0, manager.handleIncoming("acme", new IncomingMessage("628111", "STOP", true)),
            "Own messages never stop a job");
        assertEquals(0, manager.handleIncoming("acme", new IncomingMessage("628999", "STOP", false)),
            "Sender must be a recipient of the job");
        assertEquals(0, manager.handleIncoming("acme", new IncomingMessage("628111", "thanks", false)),
            "Body must contain the keyword");
        assertEquals(1, manager.handleIncoming("acme", new IncomingMessage("08111", "Stop!", false)),
            "Local number form matches after normalization");
    }

    @Test
    void testDestroyDeletesDocuments() {
        repository.seed("acme", List.of(futureJob(1L, null)));
        manager.ensure("acme");

        manager.destroy("acme");

        assertTrue(manager.find("acme").isEmpty());
        assertTrue(repository.readCollection("acme").isEmpty());
        assertFalse(manager.listTenantIds().contains("acme"));
        assertTrue(clients.get("acme").isDestroyed());
        verify(recent).delete("acme");
    }

    @Test
    void testBootstrapStartsStoredTenants() {
        repository.seed("alpha", List.of(futureJob(1L, null)));
        repository.seed("beta", List.of(futureJob(2L, null)));
        repository.seed("bad id!", List.of(futureJob(3L, null)));

        assertEquals(2, manager.bootstrap());
        assertTrue(manager.find("alpha").isPresent());
        assertTrue(manager.find("beta").isPresent());
        assertEquals(1, clients.get("alpha").connects());
    }

    @Test
    void testListTenantIdsIsSortedUnion() {
        repository.seed("zeta", List.of());
        manager.ensure("alpha");

        assertEquals(List.of("alpha", "zeta"), manager.listTenantIds());
    }

    @Test
    void testStatus() {
        repository.seed("acme", List.of(futureJob(1L, null), futureJob(2L, null)));
        Tenant tenant = manager.ensure("acme");
        clients.get("acme").setReady(true);

        TenantStatus status = tenant.status();

        assertEquals("acme", status.tenantId());
        assertTrue(status.ready());
        assertEquals(2, status.scheduledCount());
        assertEquals(2, status.armedCount());
        assertEquals(0, status.queueLength());
    }
}
