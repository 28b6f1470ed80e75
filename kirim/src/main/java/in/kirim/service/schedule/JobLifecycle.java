package in.kirim.service.schedule;

import in.kirim.domain.job.Job;
import in.kirim.domain.job.RetireReason;
import in.kirim.service.dispatch.DispatchReport;

import java.time.Instant;
import java.util.Optional;

/**
 * Retire-or-rearm decisions of the job state machine, free of timers and I/O.
 */
public final class JobLifecycle {

    /**
     * What to do once a firing's dispatch has finished.
     *
     * @param retireReason set when the job leaves the schedule
     * @param decrement    true when the firing counts against remainingRuns
     */
    public record Completion(RetireReason retireReason, boolean decrement) {
        public boolean retires() {
            return retireReason != null;
        }
    }

    /**
     * Terminal conditions checked when a timer elapses, against the stored job.
     */
    public static Optional<RetireReason> terminalAtFire(Job job, Instant now) {
        if (job.untilPassed(now)) {
            return Optional.of(RetireReason.UNTIL_PASSED);
        }
        if (job.runsExhausted()) {
            return Optional.of(RetireReason.RUNS_EXHAUSTED);
        }
        return Optional.empty();
    }

    /**
     * Decision after dispatch. A firing skipped because the session never
     * became ready does not count as a run.
     */
    public static Completion onCompletion(Job job, DispatchReport report, Instant now) {
        if (job.isOnce()) {
            return new Completion(RetireReason.ONCE_COMPLETED, false);
        }
        boolean decrement = report.attempted() && job.remainingRuns() != null;
        if (decrement && job.remainingRuns() - 1 <= 0) {
            return new Completion(RetireReason.RUNS_EXHAUSTED, true);
        }
        if (job.untilPassed(now)) {
            return new Completion(RetireReason.UNTIL_PASSED, decrement);
        }
        return new Completion(null, decrement);
    }

    /**
     * True when the next computed fire time is already beyond repeatUntil.
     */
    public static boolean beyondUntil(Job job, Instant nextFire) {
        return job.repeatUntil() != null && nextFire.isAfter(job.repeatUntil());
    }

    public static Job decremented(Job job) {
        if (job.remainingRuns() == null) return job;
        return job.withRemainingRuns(Math.max(0, job.remainingRuns() - 1));
    }

    private JobLifecycle() {}
}
