package in.kirim.messaging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReadinessMonitor.
 *
 * Tests:
 * - Callback fires only when the state flips
 * - Initial "not ready" is silent
 * - Probe failures count as not ready and are tallied
 * - Background polling picks up a ready session
 */
class ReadinessMonitorTest {

    private ReadinessMonitor monitor;

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.stop();
        }
    }

    @Test
    void testCallbackOnlyOnChange() {
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        AtomicBoolean ready = new AtomicBoolean(true);
        monitor = new ReadinessMonitor("acme", Duration.ofSeconds(60), ready::get, changes::add);

        monitor.poll();
        monitor.poll();
        ready.set(false);
        monitor.poll();
        monitor.poll();
        ready.set(true);
        monitor.poll();

        assertEquals(List.of(true, false, true), changes, "Only flips should be reported");
        assertTrue(monitor.isReady());
        assertNotNull(monitor.getLastChange());
    }

    @Test
    void testInitialNotReadyIsSilent() {
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        monitor = new ReadinessMonitor("acme", Duration.ofSeconds(60), () -> false, changes::add);

        monitor.poll();

        assertTrue(changes.isEmpty(), "First not-ready observation should not be reported");
        assertFalse(monitor.isReady());
    }

    @Test
    void testProbeFailureCountsAsNotReady() {
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        AtomicBoolean fail = new AtomicBoolean(false);
        monitor = new ReadinessMonitor("acme", Duration.ofSeconds(60), () -> {
            if (fail.get()) {
                throw new MessagingException("gateway down");
            }
            return true;
        }, changes::add);

        monitor.poll();
        fail.set(true);
        monitor.poll();
        monitor.poll();

        assertEquals(List.of(true, false), changes);
        assertEquals(2, monitor.getConsecutiveFailures(), "Failures should be counted");

        fail.set(false);
        monitor.poll();
        assertEquals(0, monitor.getConsecutiveFailures(), "Success should reset the failure count");
    }

    @Test
    void testReportOverridesState() {
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        monitor = new ReadinessMonitor("acme", Duration.ofSeconds(60), () -> true, changes::add);

        monitor.poll();
        monitor.report(false);

        assertEquals(List.of(true, false), changes);
        assertFalse(monitor.isReady());
    }

    @Test
    void testCallbackFailureDoesNotStopMonitor() {
        monitor = new ReadinessMonitor("acme", Duration.ofSeconds(60), () -> true, ready -> {
            throw new IllegalStateException("listener broke");
        });

        assertDoesNotThrow(() -> monitor.poll());
        assertTrue(monitor.isReady(), "State should still be recorded");
    }

    @Test
    void testBackgroundPolling() throws InterruptedException {
        CountDownLatch readyLatch = new CountDownLatch(1);
        monitor = new ReadinessMonitor("acme", Duration.ofMillis(20), () -> true, ready -> {
            if (ready) {
                readyLatch.countDown();
            }
        });

        monitor.start();
        assertTrue(monitor.isRunning());
        assertTrue(readyLatch.await(2, TimeUnit.SECONDS), "Background poll should report ready");

        monitor.stop();
        assertFalse(monitor.isRunning());
    }
}
