package in.kirim.service.schedule;

import in.kirim.domain.job.RepeatPolicy;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Wall-clock recurrence: a time of day, optionally pinned to a weekday or a
 * day of month, repeating every {@code monthStep} months counted from the
 * anchor month.
 *
 * Months that lack the day of month are skipped, never clamped.
 */
public record CalendarRule(
    RepeatPolicy policy,
    LocalTime timeOfDay,
    DayOfWeek dayOfWeek,
    int dayOfMonth,
    int monthStep,
    YearMonth anchorMonth,
    ZoneId zone
) {
    private static final int MAX_MONTH_CANDIDATES = 120;

    public static CalendarRule of(Instant anchor, RepeatPolicy policy, int intervalN, ZoneId zone) {
        ZonedDateTime a = anchor.atZone(zone);
        LocalTime time = a.toLocalTime().truncatedTo(ChronoUnit.SECONDS);
        switch (policy) {
            case DAILY:
                return new CalendarRule(policy, time, null, 0, 0, null, zone);
            case WEEKLY:
                return new CalendarRule(policy, time, a.getDayOfWeek(), 0, 0, null, zone);
            case MONTHLY:
                return new CalendarRule(policy, time, null, a.getDayOfMonth(), 1, YearMonth.from(a), zone);
            case INTERVAL_MONTHS:
                return new CalendarRule(policy, time, null, a.getDayOfMonth(), Math.max(1, intervalN),
                    YearMonth.from(a), zone);
            default:
                throw new IllegalArgumentException(policy.code() + " is not a calendar policy");
        }
    }

    /**
     * First occurrence strictly after {@code after} that is also not before
     * {@code notBefore} (the anchor; may itself be the occurrence).
     */
    public Instant next(Instant after, Instant notBefore) {
        boolean anchorBound = notBefore != null && notBefore.isAfter(after);
        Instant lower = anchorBound ? notBefore : after;
        LocalDate from = lower.atZone(zone).toLocalDate();

        if (dayOfMonth == 0) {
            for (int i = 0; i <= 14; i++) {
                LocalDate day = from.plusDays(i);
                if (dayOfWeek != null && day.getDayOfWeek() != dayOfWeek) continue;
                Instant candidate = at(day);
                if (accepts(candidate, lower, anchorBound)) return candidate;
            }
        } else {
            YearMonth month = firstAlignedMonth(YearMonth.from(from));
            for (int i = 0; i < MAX_MONTH_CANDIDATES; i++, month = month.plusMonths(monthStep)) {
                if (!month.isValidDay(dayOfMonth)) continue;
                Instant candidate = at(month.atDay(dayOfMonth));
                if (accepts(candidate, lower, anchorBound)) return candidate;
            }
        }
        throw new IllegalStateException("calendar search exhausted for " + describe());
    }

    /**
     * Cron-style description (sec min hour dom month dow), for logs.
     */
    public String describe() {
        String hms = timeOfDay.getSecond() + " " + timeOfDay.getMinute() + " " + timeOfDay.getHour();
        switch (policy) {
            case WEEKLY:
                return hms + " * * " + (dayOfWeek.getValue() % 7);
            case MONTHLY:
                return hms + " " + dayOfMonth + " * *";
            case INTERVAL_MONTHS:
                return hms + " " + dayOfMonth + " " + anchorMonth.getMonthValue() + "/" + monthStep + " *";
            default:
                return hms + " * * *";
        }
    }

    private YearMonth firstAlignedMonth(YearMonth from) {
        long elapsed = anchorMonth.until(from, ChronoUnit.MONTHS);
        if (elapsed <= 0) return anchorMonth;
        long steps = (elapsed + monthStep - 1) / monthStep;
        return anchorMonth.plusMonths(steps * monthStep);
    }

    private Instant at(LocalDate day) {
        return ZonedDateTime.of(day, timeOfDay, zone).toInstant();
    }

    private static boolean accepts(Instant candidate, Instant lower, boolean inclusive) {
        return inclusive ? !candidate.isBefore(lower) : candidate.isAfter(lower);
    }
}
