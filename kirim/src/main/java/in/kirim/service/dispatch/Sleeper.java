package in.kirim.service.dispatch;

import java.time.Duration;

/**
 * Blocking pause used by the dispatch worker. Replaced in tests to observe
 * gaps and backoff without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
