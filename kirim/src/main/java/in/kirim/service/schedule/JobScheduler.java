package in.kirim.service.schedule;

import in.kirim.domain.job.Job;
import in.kirim.domain.job.JobState;
import in.kirim.domain.job.RetireReason;
import in.kirim.infrastructure.metrics.DispatchMetrics;
import in.kirim.repository.JobStore;
import in.kirim.service.dispatch.DispatchQueue;
import in.kirim.service.dispatch.DispatchReport;
import in.kirim.service.dispatch.DispatchTask;
import in.kirim.service.dispatch.RecipientDispatcher;
import in.kirim.util.TenantMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Owns the timers of one tenant's jobs and drives each job through
 * ARMED → FIRING → QUEUED → ARMED | RETIRED.
 *
 * FIRING: the timer elapsed. Terminal conditions are re-checked against the
 * stored job (it may have been updated after arming). Outside the delivery
 * window the firing waits on a new timer and re-checks everything when it
 * elapses.
 *
 * QUEUED: the dispatch task is on the tenant queue. Fixed-period jobs have
 * their next cadence point persisted on entering this state, so a re-arm
 * during dispatch never replays the firing. The completion decrements the
 * run counter, then retires the job or re-arms it.
 * A completion for a job that was deleted meanwhile changes nothing.
 *
 * ISOLATION:
 * An exception inside a firing is logged and leaves that job without a timer
 * until the next {@link #rescheduleAll()}. Other jobs and tenants are not
 * affected.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final String tenantId;
    private final JobStore store;
    private final DispatchQueue queue;
    private final RecipientDispatcher dispatcher;
    private final RecurrenceCalculator recurrence;
    private final Clock clock;
    private final DispatchMetrics metrics;
    private final ScheduledThreadPoolExecutor timers;
    private final TimerArena arena = new TimerArena();

    public JobScheduler(String tenantId, JobStore store, DispatchQueue queue,
                        RecipientDispatcher dispatcher, RecurrenceCalculator recurrence,
                        Clock clock, int timerThreads, DispatchMetrics metrics) {
        this.tenantId = tenantId;
        this.store = store;
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.recurrence = recurrence;
        this.clock = clock;
        this.metrics = metrics;

        AtomicInteger threadSeq = new AtomicInteger();
        this.timers = new ScheduledThreadPoolExecutor(Math.max(1, timerThreads), runnable -> {
            Thread t = new Thread(runnable, "timer-" + tenantId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timers.setRemoveOnCancelPolicy(true);
    }

    // ═══════════════════════════════════════════════════════════════
    // CRUD
    // ═══════════════════════════════════════════════════════════════

    /**
     * Persist a validated new job and arm it.
     *
     * @return the stored job, empty if it retired on arming (repeatUntil
     *         before its first fire time)
     */
    public Optional<Job> create(Job job) {
        store.insert(job);
        log.info("Schedule created id={} repeat={}", job.id(), job.repeatPolicy().code());
        if (!arm(job)) {
            return Optional.empty();
        }
        return store.find(job.id());
    }

    /**
     * Patch the stored job under the store lock and re-arm it. A firing
     * already in flight finishes but no longer re-arms the old timer.
     *
     * @param patch applied to the current record; may throw to reject the change
     * @return the stored job, empty if the id is unknown
     */
    public Optional<Job> update(long jobId, UnaryOperator<Job> patch) {
        Optional<Job> updated = store.update(jobId, patch);
        if (updated.isEmpty()) {
            return Optional.empty();
        }
        Job job = updated.get();
        log.info("Schedule updated id={} repeat={}", job.id(), job.repeatPolicy().code());
        arm(job);
        return store.find(jobId);
    }

    /**
     * Cancel the timer synchronously and delete the job.
     */
    public boolean delete(long jobId) {
        boolean hadTimer = arena.cancel(jobId);
        boolean removed = store.remove(jobId);
        if (removed) {
            log.info("Schedule deleted id={} (timer {})", jobId, hadTimer ? "cancelled" : "none");
            metrics.recordRetirement(tenantId, RetireReason.DELETED);
        }
        publishArmed();
        return removed;
    }

    public List<Job> jobs() {
        return store.all();
    }

    public Optional<Job> find(long jobId) {
        return store.find(jobId);
    }

    // ═══════════════════════════════════════════════════════════════
    // ARMING
    // ═══════════════════════════════════════════════════════════════

    /**
     * (Re)arm a job: cancel its previous timer, compute the next fire time,
     * persist it for fixed-period jobs and install the timer.
     *
     * @return false if the job retired or vanished instead of being armed
     */
    public boolean arm(Job job) {
        Instant now = clock.instant();
        FireSpec spec = recurrence.computeNextFire(job, now);

        if (JobLifecycle.beyondUntil(job, spec.at())) {
            log.info("Next fire {} of job id={} is after repeatUntil {}", spec.at(), job.id(), job.repeatUntil());
            retire(job.id(), RetireReason.UNTIL_PASSED);
            return false;
        }

        if (spec.persistsNextRun() && !spec.at().equals(job.nextRunAt())) {
            Optional<Job> stored = store.update(job.id(), j -> j.withNextRunAt(spec.at()));
            if (stored.isEmpty()) {
                log.debug("Job id={} vanished before arming", job.id());
                return false;
            }
        }

        long delayMs = Math.max(0, Duration.between(now, spec.at()).toMillis());
        arena.arm(job.id(), spec.at(), generation ->
            timers.schedule(() -> onTimer(job.id(), generation), delayMs, TimeUnit.MILLISECONDS));
        publishArmed();
        log.info("Armed job id={} next={} ({})", job.id(), spec.at(), spec.kind());
        return true;
    }

    /**
     * Re-arm every stored job that is not currently firing or queued.
     *
     * @return number of jobs armed
     */
    public int rescheduleAll() {
        int armed = 0;
        List<Job> all = store.all();
        for (Job job : all) {
            Optional<JobState> state = arena.stateOf(job.id());
            if (state.isPresent() && state.get().isInFlight()) {
                log.debug("Job id={} is {}, leaving it alone", job.id(), state.get());
                continue;
            }
            try {
                if (arm(job)) {
                    armed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to arm job id={}", job.id(), e);
            }
        }
        log.info("Rescheduled {} of {} jobs", armed, all.size());
        return armed;
    }

    /**
     * Cancel every timer, keeping the jobs stored.
     */
    public int cancelAll() {
        int cancelled = arena.cancelAll();
        publishArmed();
        log.info("Cancelled {} timers", cancelled);
        return cancelled;
    }

    /**
     * Take a job off the schedule for good: cancel its timer and delete it.
     */
    public boolean retire(long jobId, RetireReason reason) {
        arena.cancel(jobId);
        boolean removed = store.remove(jobId);
        publishArmed();
        if (removed) {
            log.info("Retired job id={} reason={}", jobId, reason.label());
            metrics.recordRetirement(tenantId, reason);
        }
        return removed;
    }

    public Optional<JobState> stateOf(long jobId) {
        return arena.stateOf(jobId);
    }

    public Optional<Instant> nextFireAt(long jobId) {
        return arena.fireAt(jobId);
    }

    public int armedCount() {
        return arena.count(JobState.ARMED);
    }

    public void shutdown() {
        arena.cancelAll();
        timers.shutdownNow();
        try {
            if (!timers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Timer pool of tenant {} did not stop in time", tenantId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        metrics.setArmedJobs(tenantId, 0);
    }

    // ═══════════════════════════════════════════════════════════════
    // FIRING
    // ═══════════════════════════════════════════════════════════════

    private void onTimer(long jobId, long generation) {
        try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
            try {
                if (!arena.transition(jobId, generation, JobState.FIRING)) {
                    log.debug("Stale timer for job id={} ignored", jobId);
                    metrics.recordFiring(tenantId, "stale");
                    return;
                }
                publishArmed();
                fire(jobId, generation);
            } catch (RuntimeException e) {
                fault(jobId, generation, e);
            }
        }
    }

    private void fire(long jobId, long generation) {
        Optional<Job> current = store.find(jobId);
        if (current.isEmpty()) {
            log.warn("Timer fired for job id={} which no longer exists", jobId);
            arena.release(jobId, generation);
            metrics.recordFiring(tenantId, "stale");
            return;
        }
        Job job = current.get();
        Instant now = clock.instant();

        Optional<RetireReason> terminal = JobLifecycle.terminalAtFire(job, now);
        if (terminal.isPresent()) {
            log.debug("Job id={} reached {} before firing", jobId, terminal.get().label());
            metrics.recordFiring(tenantId, "retired");
            retire(jobId, terminal.get());
            return;
        }

        LocalTime localNow = now.atZone(recurrence.zone()).toLocalTime();
        if (!WindowGate.inWindow(localNow, job.windowStart(), job.windowEnd())) {
            Duration wait = WindowGate.delayUntilWindow(localNow, job.windowStart(), job.windowEnd());
            log.info("Outside window {}-{}, deferring job id={} by {}s",
                job.windowStart(), job.windowEnd(), jobId, wait.getSeconds());
            metrics.recordFiring(tenantId, "deferred");
            arena.defer(jobId, generation, now.plus(wait), () ->
                timers.schedule(() -> onDeferred(jobId, generation), wait.toMillis(), TimeUnit.MILLISECONDS));
            return;
        }

        if (!arena.transition(jobId, generation, JobState.QUEUED)) {
            log.debug("Job id={} re-armed while firing, dropping this firing", jobId);
            return;
        }
        if (job.repeatPolicy().isFixedPeriod()) {
            // The consumed nextRunAt must not survive a re-arm during dispatch
            Instant following = recurrence.computeFollowingFire(job, now).at();
            if (store.update(jobId, j -> j.withNextRunAt(following)).isEmpty()) {
                arena.release(jobId, generation);
                return;
            }
        }
        boolean accepted = queue.enqueue(new DispatchTask(jobId, now,
            () -> runDispatch(jobId),
            report -> onDispatchComplete(jobId, generation, report)));
        if (accepted) {
            log.info("Fire job id={} queued (queue length {})", jobId, queue.size());
            metrics.recordFiring(tenantId, "queued");
        } else {
            arena.release(jobId, generation);
            metrics.recordFiring(tenantId, "dropped");
        }
    }

    private void onDeferred(long jobId, long generation) {
        try (MDC.MDCCloseable ignored = TenantMdc.open(tenantId)) {
            try {
                if (!arena.transition(jobId, generation, JobState.FIRING)) {
                    log.debug("Deferred firing of job id={} superseded", jobId);
                    return;
                }
                fire(jobId, generation);
            } catch (RuntimeException e) {
                fault(jobId, generation, e);
            }
        }
    }

    private DispatchReport runDispatch(long jobId) {
        Optional<Job> current = store.find(jobId);
        if (current.isEmpty()) {
            log.info("Job id={} deleted while queued, nothing to send", jobId);
            return DispatchReport.stale(jobId);
        }
        return dispatcher.dispatch(current.get());
    }

    /**
     * Runs on the dispatch worker once the task has finished.
     */
    private void onDispatchComplete(long jobId, long generation, DispatchReport report) {
        try {
            completeFiring(jobId, generation, report);
        } catch (RuntimeException e) {
            fault(jobId, generation, e);
        }
    }

    private void completeFiring(long jobId, long generation, DispatchReport report) {
        Optional<Job> current = store.find(jobId);
        if (current.isEmpty()) {
            log.info("Job id={} no longer exists after dispatch ({}), nothing to update",
                jobId, report.outcome());
            arena.release(jobId, generation);
            return;
        }

        Instant now = clock.instant();
        JobLifecycle.Completion completion = JobLifecycle.onCompletion(current.get(), report, now);
        if (completion.retires()) {
            retire(jobId, completion.retireReason());
            return;
        }

        Optional<Job> counted = completion.decrement()
            ? store.update(jobId, JobLifecycle::decremented)
            : current;
        if (counted.isEmpty()) {
            arena.release(jobId, generation);
            return;
        }
        if (completion.decrement()) {
            log.debug("Job id={} remainingRuns={}", jobId, counted.get().remainingRuns());
        }

        if (!arena.isCurrent(jobId, generation)) {
            log.debug("Job id={} was re-armed during dispatch, keeping the new timer", jobId);
            return;
        }

        Job next = counted.get();
        if (next.repeatPolicy().isFixedPeriod()
                && (next.nextRunAt() == null || !next.nextRunAt().isAfter(now))) {
            // Dispatch overran the cadence point stored at queue time
            FireSpec following = recurrence.computeFollowingFire(next, now);
            Optional<Job> stored = store.update(jobId, j -> j.withNextRunAt(following.at()));
            if (stored.isEmpty()) {
                arena.release(jobId, generation);
                return;
            }
            next = stored.get();
        }
        if (arena.transition(jobId, generation, JobState.ARMED)) {
            arm(next);
        }
    }

    private void fault(long jobId, long generation, RuntimeException e) {
        log.error("Firing of job id={} failed; its timer stays off until the next reschedule", jobId, e);
        arena.release(jobId, generation);
        metrics.recordFiring(tenantId, "fault");
        publishArmed();
    }

    private void publishArmed() {
        metrics.setArmedJobs(tenantId, armedCount());
    }
}
