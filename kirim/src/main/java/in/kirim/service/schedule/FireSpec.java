package in.kirim.service.schedule;

import java.time.Instant;

/**
 * Result of a recurrence computation: when the timer should fire next, and
 * for calendar policies the rule that produced it.
 */
public record FireSpec(Kind kind, Instant at, CalendarRule rule) {

    public enum Kind {
        /** Single firing at the anchor. */
        ONE_SHOT,
        /** Exact cadence from the anchor; {@code at} is persisted as nextRunAt. */
        FIXED_PERIOD,
        /** Wall-clock rule; recomputed from the rule on every re-arm. */
        CALENDAR
    }

    public static FireSpec oneShot(Instant at) {
        return new FireSpec(Kind.ONE_SHOT, at, null);
    }

    public static FireSpec fixedPeriod(Instant at) {
        return new FireSpec(Kind.FIXED_PERIOD, at, null);
    }

    public static FireSpec calendar(CalendarRule rule, Instant at) {
        return new FireSpec(Kind.CALENDAR, at, rule);
    }

    public boolean persistsNextRun() {
        return kind == Kind.FIXED_PERIOD;
    }

    @Override
    public String toString() {
        return rule == null ? kind + "@" + at : kind + "@" + at + " [" + rule.describe() + "]";
    }
}
