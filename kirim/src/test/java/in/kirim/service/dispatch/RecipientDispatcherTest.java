package in.kirim.service.dispatch;

import in.kirim.domain.job.Job;
import in.kirim.domain.job.Recipient;
import in.kirim.infrastructure.metrics.DispatchMetrics;
import in.kirim.testing.FakeMessagingClient;
import in.kirim.testing.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for RecipientDispatcher.
 *
 * Tests:
 * - Retry backoff per recipient and continuation after give-up
 * - Dispatch gap and jitter
 * - Bounded wait for readiness
 */
@ExtendWith(MockitoExtension.class)
class RecipientDispatcherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-07T05:00:00Z"), ZoneOffset.UTC);

    @Mock
    private DispatchMetrics metrics;

    private FakeMessagingClient client;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        client = new FakeMessagingClient("acme", true);
        sleeper = new RecordingSleeper();
    }

    private RecipientDispatcher dispatcher(Duration readyWait) {
        return new RecipientDispatcher("acme", client, RetryBackoff.defaults(),
            readyWait, Duration.ofSeconds(3), sleeper, CLOCK, metrics);
    }

    private static Job job(int gap, Recipient... recipients) {
        return Job.builder()
            .id(7L)
            .anchorTime(CLOCK.instant())
            .recipients(List.of(recipients))
            .dispatchGapSeconds(gap)
            .build();
    }

    @Test
    void testSendsInOrderWithGap() {
        Job job = job(2, new Recipient("628111", "hi A"), new Recipient("628222", "hi B"));

        DispatchReport report = dispatcher(Duration.ofSeconds(90)).dispatch(job);

        assertEquals(DispatchReport.Outcome.COMPLETED, report.outcome());
        assertEquals(2, report.deliveredCount());
        assertEquals(List.of(new FakeMessagingClient.Sent("628111", "hi A"),
            new FakeMessagingClient.Sent("628222", "hi B")), client.sent());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2)), sleeper.sleeps());
        verify(metrics, times(2)).recordSend(eq("acme"), eq(true), any());
    }

    @Test
    @DisplayName("failing recipient gets 1 + 3 attempts with 3s, 6s, 9s waits, then the next recipient still goes out")
    void testRetryThenContinue() {
        client.failAlways("628111");
        Job job = job(2, new Recipient("628111", "x"), new Recipient("628222", "y"));

        DispatchReport report = dispatcher(Duration.ofSeconds(90)).dispatch(job);

        assertEquals(List.of(
            Duration.ofSeconds(3), Duration.ofSeconds(6), Duration.ofSeconds(9),
            Duration.ofSeconds(2),
            Duration.ofSeconds(2)), sleeper.sleeps());
        assertTrue(sleeper.total().compareTo(Duration.ofSeconds(20)) >= 0);

        RecipientResult failed = report.results().get(0);
        assertFalse(failed.delivered());
        assertEquals(4, failed.attempts());
        assertNotNull(failed.lastError());

        assertTrue(report.results().get(1).delivered(), "Second recipient is attempted after the first gives up");
        assertEquals(1, client.sent().size());
        verify(metrics, times(3)).recordRetry(eq("acme"), anyInt());
        verify(metrics).recordSend(eq("acme"), eq(false), any());
    }

    @Test
    void testTransientFailureRecovers() {
        client.failNext("628111", 1);

        DispatchReport report = dispatcher(Duration.ofSeconds(90)).dispatch(job(0, new Recipient("628111", "x")));

        assertTrue(report.results().get(0).delivered());
        assertEquals(2, report.results().get(0).attempts());
        assertEquals(List.of(Duration.ofSeconds(3)), sleeper.sleeps());
    }

    @Test
    void testNotReadySkipsFiring() {
        client = new FakeMessagingClient("acme", false);

        DispatchReport report = dispatcher(Duration.ofSeconds(5)).dispatch(job(2, new Recipient("628111", "x")));

        assertEquals(DispatchReport.Outcome.NOT_READY, report.outcome());
        assertFalse(report.attempted());
        assertTrue(client.sent().isEmpty());
        assertEquals(5, sleeper.sleeps().size(), "Polled once per second for the whole wait");
    }

    @Test
    void testBecomesReadyDuringWait() {
        client = new FakeMessagingClient("acme", false);
        int[] polls = {0};
        sleeper.onSleep(() -> {
            if (++polls[0] == 3) client.setReady(true);
        });

        DispatchReport report = dispatcher(Duration.ofSeconds(90)).dispatch(job(0, new Recipient("628111", "x")));

        assertEquals(DispatchReport.Outcome.COMPLETED, report.outcome());
        assertEquals(1, client.sent().size());
    }

    @Test
    void testJitterWithinBounds() {
        Job job = Job.builder()
            .id(8L)
            .anchorTime(CLOCK.instant())
            .recipients(List.of(new Recipient("628111", "x")))
            .dispatchGapSeconds(0)
            .randomDelayMinSeconds(4)
            .randomDelayMaxSeconds(6)
            .build();

        for (int i = 0; i < 20; i++) {
            sleeper = new RecordingSleeper();
            dispatcher(Duration.ofSeconds(90)).dispatch(job);
            Duration jitter = sleeper.sleeps().get(0);
            assertTrue(jitter.getSeconds() >= 4 && jitter.getSeconds() <= 6, "jitter " + jitter);
        }
    }

    @Test
    void testRandomBetween() {
        assertEquals(0, RecipientDispatcher.randomBetween(0, 0));
        assertEquals(5, RecipientDispatcher.randomBetween(5, 2), "max below min collapses to min");
        assertEquals(0, RecipientDispatcher.randomBetween(-3, -1));
        for (int i = 0; i < 50; i++) {
            int v = RecipientDispatcher.randomBetween(1, 3);
            assertTrue(v >= 1 && v <= 3);
        }
    }
}
