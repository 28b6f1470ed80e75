package in.kirim.service.schedule;

import in.kirim.domain.job.Job;
import in.kirim.domain.job.RepeatPolicy;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Next fire time of a job. Pure: depends only on its arguments and the zone.
 *
 * Fixed periods are anchored: every fire time is anchor + k × period, so the
 * cadence is reproducible from the persisted anchor and nextRunAt alone and
 * a restart catches up with exactly one firing instead of drifting.
 */
public final class RecurrenceCalculator {

    private final ZoneId zone;

    public RecurrenceCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Fire time used when (re)arming a job. A persisted nextRunAt wins for
     * fixed periods, even when it lies in the past.
     */
    public FireSpec computeNextFire(Job job, Instant now) {
        return computeNextFire(job.anchorTime(), job.repeatPolicy(), job.intervalN(), job.nextRunAt(), now);
    }

    /**
     * Fire time after a completed firing: ignores the nextRunAt just consumed.
     */
    public FireSpec computeFollowingFire(Job job, Instant now) {
        return computeNextFire(job.anchorTime(), job.repeatPolicy(), job.intervalN(), null, now);
    }

    public FireSpec computeNextFire(Instant anchor, RepeatPolicy policy, Integer intervalN,
                                    Instant previousNextRun, Instant now) {
        if (anchor == null) {
            throw new IllegalArgumentException("anchor time is required");
        }
        int n = intervalN == null || intervalN < 1 ? 1 : intervalN;

        if (policy == RepeatPolicy.ONCE) {
            return FireSpec.oneShot(anchor);
        }
        if (policy.isFixedPeriod()) {
            if (previousNextRun != null) {
                return FireSpec.fixedPeriod(previousNextRun);
            }
            return FireSpec.fixedPeriod(nextOnCadence(anchor, policy.period(n), now));
        }
        CalendarRule rule = CalendarRule.of(anchor, policy, n, zone);
        return FireSpec.calendar(rule, rule.next(now, anchor));
    }

    /**
     * anchor if it is still ahead, otherwise the first anchor + k × period
     * strictly after now.
     */
    public static Instant nextOnCadence(Instant anchor, Duration period, Instant now) {
        if (anchor.isAfter(now)) {
            return anchor;
        }
        long periodMs = period.toMillis();
        long elapsedMs = Duration.between(anchor, now).toMillis();
        long steps = elapsedMs / periodMs + 1;
        return anchor.plusMillis(steps * periodMs);
    }

    public ZoneId zone() {
        return zone;
    }
}
