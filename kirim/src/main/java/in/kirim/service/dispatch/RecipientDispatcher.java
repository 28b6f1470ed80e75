package in.kirim.service.dispatch;

import in.kirim.domain.job.Job;
import in.kirim.domain.job.Recipient;
import in.kirim.infrastructure.metrics.DispatchMetrics;
import in.kirim.messaging.MessagingClient;
import in.kirim.messaging.MessagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sends one job's recipient list, in order, through the tenant's client.
 *
 * Per recipient: optional jitter, then up to {@link RetryBackoff#maxAttempts()}
 * attempts, then the job's gap. A recipient whose retries are exhausted is
 * recorded and skipped; the rest of the list still goes out. While the session
 * is not ready the worker waits (bounded) instead of spending attempts.
 */
public final class RecipientDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RecipientDispatcher.class);

    private static final Duration READY_POLL = Duration.ofSeconds(1);

    private final String tenantId;
    private final MessagingClient client;
    private final RetryBackoff backoff;
    private final Duration readyWait;
    private final Duration sendReadyWait;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DispatchMetrics metrics;

    public RecipientDispatcher(String tenantId, MessagingClient client, RetryBackoff backoff,
                               Duration readyWait, Duration sendReadyWait,
                               Sleeper sleeper, Clock clock, DispatchMetrics metrics) {
        this.tenantId = tenantId;
        this.client = client;
        this.backoff = backoff;
        this.readyWait = readyWait;
        this.sendReadyWait = sendReadyWait;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Send to every recipient of the job. Never throws.
     */
    public DispatchReport dispatch(Job job) {
        List<RecipientResult> results = new ArrayList<>();
        try {
            if (!awaitReady(readyWait)) {
                log.warn("Session not ready after {}s, skipping firing of job id={}",
                    readyWait.getSeconds(), job.id());
                return DispatchReport.notReady(job.id());
            }

            log.info("Start sending job id={} recipients={}", job.id(), job.recipients().size());
            for (Recipient recipient : job.recipients()) {
                int jitter = randomBetween(job.randomDelayMinSeconds(), job.randomDelayMaxSeconds());
                if (jitter > 0) {
                    log.debug("Jitter {}s before {}", jitter, recipient.address());
                    sleeper.sleep(Duration.ofSeconds(jitter));
                }

                results.add(sendWithRetry(recipient));

                if (job.dispatchGapSeconds() > 0) {
                    sleeper.sleep(Duration.ofSeconds(job.dispatchGapSeconds()));
                }
            }
            DispatchReport report = DispatchReport.completed(job.id(), results);
            log.info("Finished job id={} delivered={}/{}", job.id(), report.deliveredCount(), results.size());
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatch of job id={} interrupted after {} recipients", job.id(), results.size());
            return DispatchReport.interrupted(job.id(), results);
        }
    }

    private RecipientResult sendWithRetry(Recipient recipient) throws InterruptedException {
        String address = recipient.address();
        Instant start = clock.instant();
        String lastError = null;

        for (int attempt = 1; attempt <= backoff.maxAttempts(); attempt++) {
            try {
                if (!client.isReady()) {
                    log.warn("Session not ready, waiting before attempt {} -> {}", attempt, address);
                    if (!awaitReady(sendReadyWait)) {
                        throw new MessagingException("Client not ready (timeout)");
                    }
                }

                log.info("Sending attempt {}/{} -> {} (len={})",
                    attempt, backoff.maxAttempts(), address, recipient.message().length());
                if (!client.send(address, recipient.message())) {
                    throw new MessagingException("Transport reported failure");
                }

                log.info("SEND OK -> {}", address);
                metrics.recordSend(tenantId, true, Duration.between(start, clock.instant()));
                return RecipientResult.delivered(address, attempt);
            } catch (MessagingException | RuntimeException e) {
                lastError = e.getMessage();
                log.error("SEND FAIL attempt {} -> {}: {}", attempt, address, lastError);
                if (backoff.shouldRetry(attempt)) {
                    metrics.recordRetry(tenantId, attempt);
                    sleeper.sleep(backoff.delayAfterFailure(attempt));
                }
            }
        }

        log.error("GIVE UP sending -> {} after {} attempts", address, backoff.maxAttempts());
        metrics.recordSend(tenantId, false, Duration.between(start, clock.instant()));
        return RecipientResult.failed(address, backoff.maxAttempts(), lastError);
    }

    private boolean awaitReady(Duration timeout) throws InterruptedException {
        long polls = Math.max(0, timeout.toMillis() / READY_POLL.toMillis());
        for (long i = 0; i < polls; i++) {
            if (client.isReady()) {
                return true;
            }
            sleeper.sleep(READY_POLL);
        }
        return client.isReady();
    }

    static int randomBetween(int min, int max) {
        int lo = Math.max(0, min);
        int hi = Math.max(0, max);
        if (hi <= lo) {
            return lo;
        }
        return ThreadLocalRandom.current().nextInt(lo, hi + 1);
    }
}
