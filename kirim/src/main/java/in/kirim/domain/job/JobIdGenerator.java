package in.kirim.domain.job;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-derived job ids: epoch millis, bumped by one when two jobs are
 * created in the same millisecond, so ids are unique and strictly increasing
 * within the process.
 */
public final class JobIdGenerator {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public JobIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public long next() {
        long now = clock.millis();
        return last.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
