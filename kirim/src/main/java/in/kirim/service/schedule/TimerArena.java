package in.kirim.service.schedule;

import in.kirim.domain.job.JobState;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * The timers of one tenant, keyed by job id.
 *
 * Every arm gets a fresh generation number. Timer callbacks carry the
 * generation they were scheduled with and are ignored once it is no longer
 * current, so an update or reschedule never leaves two live timers for a job.
 * Only {@link JobScheduler} touches the arena; all access is under its lock.
 */
final class TimerArena {

    private static final class Handle {
        final long generation;
        JobState state;
        ScheduledFuture<?> future;
        Instant fireAt;

        Handle(long generation, Instant fireAt) {
            this.generation = generation;
            this.state = JobState.ARMED;
            this.fireAt = fireAt;
        }
    }

    private final Map<Long, Handle> handles = new HashMap<>();
    private long generationSeq;

    /**
     * Cancel any existing timer and install a new one. The scheduling
     * function receives the new generation; it runs under the arena lock so
     * a zero-delay timer cannot observe the arena before the handle exists.
     */
    synchronized long arm(long jobId, Instant fireAt, LongFunction<ScheduledFuture<?>> schedule) {
        cancel(jobId);
        long generation = ++generationSeq;
        Handle handle = new Handle(generation, fireAt);
        handles.put(jobId, handle);
        try {
            handle.future = schedule.apply(generation);
        } catch (RuntimeException e) {
            handles.remove(jobId);
            throw e;
        }
        return generation;
    }

    /**
     * Move a current handle to a new state.
     *
     * @return false when the generation is stale (job re-armed or cancelled meanwhile)
     * @throws IllegalStateException when the transition is not allowed
     */
    synchronized boolean transition(long jobId, long generation, JobState target) {
        Handle handle = handles.get(jobId);
        if (handle == null || handle.generation != generation) {
            return false;
        }
        if (!handle.state.canTransitionTo(target)) {
            throw new IllegalStateException(
                "Illegal transition " + handle.state + " -> " + target + " for job " + jobId);
        }
        handle.state = target;
        return true;
    }

    /**
     * Replace the timer of a FIRING handle that waits for its delivery window.
     */
    synchronized boolean defer(long jobId, long generation, Instant fireAt,
                               Supplier<ScheduledFuture<?>> schedule) {
        Handle handle = handles.get(jobId);
        if (handle == null || handle.generation != generation) {
            return false;
        }
        handle.fireAt = fireAt;
        handle.future = schedule.get();
        return true;
    }

    synchronized boolean isCurrent(long jobId, long generation) {
        Handle handle = handles.get(jobId);
        return handle != null && handle.generation == generation;
    }

    /**
     * Drop the handle of a generation that ended without re-arming.
     */
    synchronized void release(long jobId, long generation) {
        Handle handle = handles.get(jobId);
        if (handle != null && handle.generation == generation) {
            handles.remove(jobId);
        }
    }

    /**
     * Cancel the timer of a job synchronously.
     *
     * @return true if a handle existed
     */
    synchronized boolean cancel(long jobId) {
        Handle handle = handles.remove(jobId);
        if (handle == null) {
            return false;
        }
        handle.state = JobState.RETIRED;
        if (handle.future != null) {
            handle.future.cancel(false);
        }
        return true;
    }

    synchronized int cancelAll() {
        int count = handles.size();
        for (Handle handle : handles.values()) {
            handle.state = JobState.RETIRED;
            if (handle.future != null) {
                handle.future.cancel(false);
            }
        }
        handles.clear();
        return count;
    }

    synchronized Optional<JobState> stateOf(long jobId) {
        Handle handle = handles.get(jobId);
        return handle == null ? Optional.empty() : Optional.of(handle.state);
    }

    synchronized Optional<Instant> fireAt(long jobId) {
        Handle handle = handles.get(jobId);
        return handle == null ? Optional.empty() : Optional.ofNullable(handle.fireAt);
    }

    synchronized int count(JobState state) {
        int n = 0;
        for (Handle handle : handles.values()) {
            if (handle.state == state) n++;
        }
        return n;
    }
}
