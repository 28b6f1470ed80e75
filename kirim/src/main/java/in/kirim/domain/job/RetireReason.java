package in.kirim.domain.job;

import java.util.Locale;

/**
 * Why a job left the schedule for good.
 */
public enum RetireReason {
    ONCE_COMPLETED,
    RUNS_EXHAUSTED,
    UNTIL_PASSED,
    STOP_KEYWORD,
    DELETED;

    /**
     * Lower-case label used in logs and metrics.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
