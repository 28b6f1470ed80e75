package in.kirim.service.dispatch;

import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * One queued unit of work: send a job's recipient list, then report back.
 *
 * @param jobId      job being dispatched
 * @param enqueuedAt when the firing handed it to the queue
 * @param work       the sending itself; must not throw
 * @param completion receives the report on the worker thread
 */
public record DispatchTask(
    long jobId,
    Instant enqueuedAt,
    Supplier<DispatchReport> work,
    Consumer<DispatchReport> completion
) {}
