package in.kirim.domain.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Runtime state of a job's timer.
 *
 * Flow: ARMED → FIRING → QUEUED → ARMED (next occurrence) or RETIRED.
 * FIRING → FIRING is a delivery-window deferral re-checking the job.
 * A job without a timer (never armed, or its firing failed) has no state.
 */
public enum JobState {
    ARMED,
    FIRING,
    QUEUED,
    RETIRED;

    private Set<JobState> next;

    static {
        ARMED.next = EnumSet.of(FIRING, RETIRED);
        FIRING.next = EnumSet.of(FIRING, QUEUED, RETIRED);
        QUEUED.next = EnumSet.of(ARMED, RETIRED);
        RETIRED.next = EnumSet.noneOf(JobState.class);
    }

    public boolean canTransitionTo(JobState target) {
        return next.contains(target);
    }

    public boolean isInFlight() {
        return this == FIRING || this == QUEUED;
    }

    public boolean isTerminal() {
        return this == RETIRED;
    }
}
