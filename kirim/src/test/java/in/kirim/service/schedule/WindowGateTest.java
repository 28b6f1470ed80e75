package in.kirim.service.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WindowGate.
 *
 * Tests:
 * - Same-day and overnight windows
 * - Delay until the window opens
 * - Missing or malformed bounds mean no restriction
 */
class WindowGateTest {

    @Test
    void testSameDayWindow() {
        assertTrue(WindowGate.inWindow(LocalTime.of(9, 0), "08:00", "17:00"));
        assertTrue(WindowGate.inWindow(LocalTime.of(17, 0, 59), "08:00", "17:00"), "End minute is inclusive");
        assertFalse(WindowGate.inWindow(LocalTime.of(7, 59), "08:00", "17:00"));
        assertFalse(WindowGate.inWindow(LocalTime.of(17, 1), "08:00", "17:00"));
    }

    @Test
    void testOvernightWindow() {
        assertTrue(WindowGate.inWindow(LocalTime.of(23, 30), "22:00", "06:00"));
        assertTrue(WindowGate.inWindow(LocalTime.of(3, 0), "22:00", "06:00"));
        assertFalse(WindowGate.inWindow(LocalTime.of(10, 0), "22:00", "06:00"));
    }

    @Test
    void testDelayUntilOvernightWindow() {
        Duration delay = WindowGate.delayUntilWindow(LocalTime.of(10, 0), "22:00", "06:00");
        assertEquals(Duration.ofHours(12), delay);
    }

    @Test
    void testDelayWrapsToTomorrow() {
        Duration delay = WindowGate.delayUntilWindow(LocalTime.of(18, 30), "08:00", "17:00");
        assertEquals(Duration.ofHours(13).plusMinutes(30), delay);
    }

    @Test
    void testDelayIsZeroInsideWindow() {
        assertEquals(Duration.ZERO, WindowGate.delayUntilWindow(LocalTime.of(12, 0), "08:00", "17:00"));
    }

    @Test
    void testDelayAlwaysLandsInsideWindow() {
        String[][] windows = {{"08:00", "17:00"}, {"22:00", "06:00"}, {"00:00", "00:30"}, {"23:59", "00:01"}};
        for (String[] w : windows) {
            for (int second = 0; second < 86_400; second += 317) {
                LocalTime now = LocalTime.ofSecondOfDay(second);
                Duration delay = WindowGate.delayUntilWindow(now, w[0], w[1]);
                LocalTime opened = now.plus(delay);
                assertTrue(WindowGate.inWindow(opened, w[0], w[1]),
                    "window " + w[0] + "-" + w[1] + " from " + now + " lands at " + opened);
                assertTrue(delay.compareTo(Duration.ofDays(1)) <= 0);
            }
        }
    }

    @Test
    void testMissingOrInvalidBoundsAreUnrestricted() {
        LocalTime now = LocalTime.of(3, 0);
        assertTrue(WindowGate.inWindow(now, null, null));
        assertTrue(WindowGate.inWindow(now, "08:00", null));
        assertTrue(WindowGate.inWindow(now, "8am", "17:00"));
        assertTrue(WindowGate.inWindow(now, "25:00", "17:00"));
        assertEquals(Duration.ZERO, WindowGate.delayUntilWindow(now, "xx", "17:00"));
    }

    @Test
    void testParseMinutes() {
        assertEquals(8 * 60 + 5, WindowGate.parseMinutes("8:05").orElseThrow());
        assertEquals(23 * 60 + 59, WindowGate.parseMinutes(" 23:59 ").orElseThrow());
        assertTrue(WindowGate.parseMinutes("24:00").isEmpty());
        assertTrue(WindowGate.parseMinutes("12:60").isEmpty());
        assertTrue(WindowGate.parseMinutes("1200").isEmpty());
        assertFalse(WindowGate.isValid(""));
    }
}
