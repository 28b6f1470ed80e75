package in.kirim.service.schedule;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Daily delivery window check at minute resolution.
 *
 * A window is a pair of "HH:mm" strings. A missing or unparsable bound means
 * no restriction. start &gt; end is an overnight window (22:00-06:00).
 */
public final class WindowGate {

    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final int MINUTES_PER_DAY = 24 * 60;

    /**
     * Parse "HH:mm" into minutes after midnight.
     */
    public static Optional<Integer> parseMinutes(String hhmm) {
        if (hhmm == null) return Optional.empty();
        Matcher m = HH_MM.matcher(hhmm.trim());
        if (!m.matches()) return Optional.empty();
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        if (hours > 23 || minutes > 59) return Optional.empty();
        return Optional.of(hours * 60 + minutes);
    }

    public static boolean isValid(String hhmm) {
        return parseMinutes(hhmm).isPresent();
    }

    public static boolean inWindow(LocalTime now, String start, String end) {
        Optional<Integer> s = parseMinutes(start);
        Optional<Integer> e = parseMinutes(end);
        if (s.isEmpty() || e.isEmpty()) return true;
        return inWindow(now.getHour() * 60 + now.getMinute(), s.get(), e.get());
    }

    /**
     * Time until the window opens; zero when already inside.
     */
    public static Duration delayUntilWindow(LocalTime now, String start, String end) {
        if (inWindow(now, start, end)) return Duration.ZERO;

        int startSecond = parseMinutes(start).orElseThrow() * 60;
        int delta = startSecond - now.toSecondOfDay();
        if (delta <= 0) {
            delta += MINUTES_PER_DAY * 60;
        }
        return Duration.ofSeconds(delta);
    }

    private static boolean inWindow(int minuteOfDay, int start, int end) {
        if (start <= end) {
            return minuteOfDay >= start && minuteOfDay <= end;
        }
        return minuteOfDay >= start || minuteOfDay <= end;
    }

    private WindowGate() {}
}
