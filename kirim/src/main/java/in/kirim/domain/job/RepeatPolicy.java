package in.kirim.domain.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * How a job recurs after its anchor time.
 *
 * Fixed-period policies step in exact multiples of a duration from the
 * anchor. Calendar policies follow wall-clock time in the configured zone.
 */
public enum RepeatPolicy {
    ONCE("once", null),

    // Calendar rules at the anchor's time of day
    DAILY("daily", null),
    WEEKLY("weekly", null),
    MONTHLY("monthly", null),
    INTERVAL_MONTHS("interval_months", ChronoUnit.MONTHS),

    // Fixed periods of N units
    INTERVAL_SECONDS("interval_seconds", ChronoUnit.SECONDS),
    INTERVAL_MINUTES("interval_minutes", ChronoUnit.MINUTES),
    INTERVAL_HOURS("interval_hours", ChronoUnit.HOURS),
    INTERVAL_DAYS("interval_days", ChronoUnit.DAYS);

    private final String code;
    private final ChronoUnit unit;

    RepeatPolicy(String code, ChronoUnit unit) {
        this.code = code;
        this.unit = unit;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static RepeatPolicy fromCode(String code) {
        if (code == null || code.isBlank()) {
            return ONCE;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (RepeatPolicy policy : values()) {
            if (policy.code.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown repeat policy: " + code);
    }

    /**
     * True when the policy needs an interval count N.
     */
    public boolean requiresInterval() {
        return unit != null;
    }

    /**
     * True for the policies that step by an exact duration.
     */
    public boolean isFixedPeriod() {
        return unit != null && unit != ChronoUnit.MONTHS;
    }

    public boolean isCalendar() {
        return this == DAILY || this == WEEKLY || this == MONTHLY || this == INTERVAL_MONTHS;
    }

    /**
     * Period of N units for a fixed-period policy.
     */
    public Duration period(int n) {
        if (!isFixedPeriod()) {
            throw new IllegalStateException(code + " has no fixed period");
        }
        return unit.getDuration().multipliedBy(Math.max(1, n));
    }
}
