package in.kirim.service.dispatch;

import java.util.List;

/**
 * What one dispatch task did. Never thrown; handed to the completion callback.
 */
public record DispatchReport(long jobId, Outcome outcome, List<RecipientResult> results, String detail) {

    public enum Outcome {
        /** Every recipient was processed (delivered or retries exhausted). */
        COMPLETED,
        /** The session never became ready; nothing was sent. */
        NOT_READY,
        /** The job disappeared before its turn in the queue. */
        STALE,
        /** The worker was interrupted mid-task (tenant shutting down). */
        INTERRUPTED,
        /** The task itself failed unexpectedly. */
        FAILED
    }

    public DispatchReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static DispatchReport completed(long jobId, List<RecipientResult> results) {
        return new DispatchReport(jobId, Outcome.COMPLETED, results, null);
    }

    public static DispatchReport notReady(long jobId) {
        return new DispatchReport(jobId, Outcome.NOT_READY, List.of(), "messaging session not ready");
    }

    public static DispatchReport stale(long jobId) {
        return new DispatchReport(jobId, Outcome.STALE, List.of(), "job no longer exists");
    }

    public static DispatchReport interrupted(long jobId, List<RecipientResult> partial) {
        return new DispatchReport(jobId, Outcome.INTERRUPTED, partial, "interrupted");
    }

    public static DispatchReport failed(long jobId, Throwable error) {
        return new DispatchReport(jobId, Outcome.FAILED, List.of(), String.valueOf(error));
    }

    /**
     * True when the firing counts as a run: a delivery was attempted.
     */
    public boolean attempted() {
        return outcome == Outcome.COMPLETED || outcome == Outcome.INTERRUPTED || outcome == Outcome.FAILED;
    }

    public int deliveredCount() {
        int n = 0;
        for (RecipientResult r : results) {
            if (r.delivered()) n++;
        }
        return n;
    }
}
