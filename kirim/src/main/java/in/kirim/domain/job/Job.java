package in.kirim.domain.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A scheduled outbound message job, as persisted in the tenant's document.
 *
 * Immutable; the scheduler replaces the stored value when the run counter or
 * the persisted next fire time moves.
 *
 * @param id                     creation timestamp in epoch millis, unique and increasing
 * @param recipients             ordered, de-duplicated destinations
 * @param targetsText            raw target lines as entered, kept for editing
 * @param defaultMessage         message used by lines without their own text
 * @param anchorTime             first fire time; base for all recurrence arithmetic
 * @param repeatPolicy           recurrence policy
 * @param intervalN              N for the interval policies, null otherwise
 * @param repeatUntil            no firing happens after this instant (null = unbounded)
 * @param remainingRuns          attempted firings left (null = unbounded)
 * @param stopKeyword            a reply containing this text retires the job (null = none)
 * @param windowStart            delivery window start "HH:mm" (null = unrestricted)
 * @param windowEnd              delivery window end "HH:mm" (null = unrestricted)
 * @param dispatchGapSeconds     pause after each recipient
 * @param randomDelayMinSeconds  lower jitter bound before each recipient
 * @param randomDelayMaxSeconds  upper jitter bound before each recipient
 * @param nextRunAt              persisted next fire time of a fixed-period job
 * @param createdAt              creation instant
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
    @JsonProperty("id") long id,
    @JsonProperty("recipients") List<Recipient> recipients,
    @JsonProperty("targetsText") String targetsText,
    @JsonProperty("defaultMessage") String defaultMessage,
    @JsonProperty("anchorTime") Instant anchorTime,
    @JsonProperty("repeatPolicy") RepeatPolicy repeatPolicy,
    @JsonProperty("intervalN") Integer intervalN,
    @JsonProperty("repeatUntil") Instant repeatUntil,
    @JsonProperty("remainingRuns") Integer remainingRuns,
    @JsonProperty("stopKeyword") String stopKeyword,
    @JsonProperty("windowStart") String windowStart,
    @JsonProperty("windowEnd") String windowEnd,
    @JsonProperty("dispatchGapSeconds") int dispatchGapSeconds,
    @JsonProperty("randomDelayMinSeconds") int randomDelayMinSeconds,
    @JsonProperty("randomDelayMaxSeconds") int randomDelayMaxSeconds,
    @JsonProperty("nextRunAt") Instant nextRunAt,
    @JsonProperty("createdAt") Instant createdAt
) {
    public static final int DEFAULT_GAP_SECONDS = 2;

    public Job {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        repeatPolicy = repeatPolicy == null ? RepeatPolicy.ONCE : repeatPolicy;
        stopKeyword = stopKeyword == null || stopKeyword.isBlank() ? null : stopKeyword.trim();
    }

    @JsonIgnore
    public boolean isOnce() {
        return repeatPolicy == RepeatPolicy.ONCE;
    }

    @JsonIgnore
    public boolean hasStopKeyword() {
        return stopKeyword != null;
    }

    @JsonIgnore
    public boolean runsExhausted() {
        return remainingRuns != null && remainingRuns <= 0;
    }

    @JsonIgnore
    public boolean untilPassed(Instant now) {
        return repeatUntil != null && now.isAfter(repeatUntil);
    }

    /**
     * True when one of the recipients has the given normalized address.
     */
    public boolean sendsTo(String address) {
        for (Recipient recipient : recipients) {
            if (recipient.address().equals(address)) {
                return true;
            }
        }
        return false;
    }

    public Job withNextRunAt(Instant next) {
        return toBuilder().nextRunAt(next).build();
    }

    public Job withRemainingRuns(Integer runs) {
        return toBuilder().remainingRuns(runs).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id).recipients(recipients).targetsText(targetsText).defaultMessage(defaultMessage)
            .anchorTime(anchorTime).repeatPolicy(repeatPolicy).intervalN(intervalN)
            .repeatUntil(repeatUntil).remainingRuns(remainingRuns).stopKeyword(stopKeyword)
            .windowStart(windowStart).windowEnd(windowEnd)
            .dispatchGapSeconds(dispatchGapSeconds)
            .randomDelayMinSeconds(randomDelayMinSeconds).randomDelayMaxSeconds(randomDelayMaxSeconds)
            .nextRunAt(nextRunAt).createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Job.
     */
    public static class Builder {
        private long id;
        private List<Recipient> recipients = List.of();
        private String targetsText;
        private String defaultMessage;
        private Instant anchorTime;
        private RepeatPolicy repeatPolicy = RepeatPolicy.ONCE;
        private Integer intervalN;
        private Instant repeatUntil;
        private Integer remainingRuns;
        private String stopKeyword;
        private String windowStart;
        private String windowEnd;
        private int dispatchGapSeconds = DEFAULT_GAP_SECONDS;
        private int randomDelayMinSeconds;
        private int randomDelayMaxSeconds;
        private Instant nextRunAt;
        private Instant createdAt;

        public Builder id(long id) { this.id = id; return this; }
        public Builder recipients(List<Recipient> recipients) { this.recipients = recipients; return this; }
        public Builder targetsText(String targetsText) { this.targetsText = targetsText; return this; }
        public Builder defaultMessage(String defaultMessage) { this.defaultMessage = defaultMessage; return this; }
        public Builder anchorTime(Instant anchorTime) { this.anchorTime = anchorTime; return this; }
        public Builder repeatPolicy(RepeatPolicy repeatPolicy) { this.repeatPolicy = repeatPolicy; return this; }
        public Builder intervalN(Integer intervalN) { this.intervalN = intervalN; return this; }
        public Builder repeatUntil(Instant repeatUntil) { this.repeatUntil = repeatUntil; return this; }
        public Builder remainingRuns(Integer remainingRuns) { this.remainingRuns = remainingRuns; return this; }
        public Builder stopKeyword(String stopKeyword) { this.stopKeyword = stopKeyword; return this; }
        public Builder windowStart(String windowStart) { this.windowStart = windowStart; return this; }
        public Builder windowEnd(String windowEnd) { this.windowEnd = windowEnd; return this; }
        public Builder dispatchGapSeconds(int seconds) { this.dispatchGapSeconds = seconds; return this; }
        public Builder randomDelayMinSeconds(int seconds) { this.randomDelayMinSeconds = seconds; return this; }
        public Builder randomDelayMaxSeconds(int seconds) { this.randomDelayMaxSeconds = seconds; return this; }
        public Builder nextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public Job build() {
            return new Job(id, recipients, targetsText, defaultMessage, anchorTime, repeatPolicy,
                intervalN, repeatUntil, remainingRuns, stopKeyword, windowStart, windowEnd,
                dispatchGapSeconds, randomDelayMinSeconds, randomDelayMaxSeconds, nextRunAt, createdAt);
        }
    }
}
