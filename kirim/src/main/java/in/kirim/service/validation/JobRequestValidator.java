package in.kirim.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import in.kirim.domain.common.JobValidationException;
import in.kirim.domain.common.ValidationErrorCode;
import in.kirim.domain.job.Job;
import in.kirim.domain.job.JobIdGenerator;
import in.kirim.domain.job.Recipient;
import in.kirim.domain.job.RepeatPolicy;
import in.kirim.service.schedule.WindowGate;
import in.kirim.util.Timestamps;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns job request bodies into valid {@link Job}s.
 *
 * Everything the scheduler relies on is checked here: a non-empty recipient
 * list, a parsable anchor, a known repeat type, an interval &gt;= 1 where one is
 * needed, a run count &gt;= 1, HH:mm windows. Violations raise
 * {@link JobValidationException}.
 *
 * Numbers may arrive as JSON numbers or numeric strings (form posts). Negative
 * gap and delay values are clamped to 0.
 */
public final class JobRequestValidator {

    private final RecipientParser parser;
    private final ZoneId zone;
    private final JobIdGenerator ids;
    private final Clock clock;

    public JobRequestValidator(RecipientParser parser, ZoneId zone, JobIdGenerator ids, Clock clock) {
        this.parser = parser;
        this.zone = zone;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Build a new job from a create request.
     */
    public Job validateCreate(JsonNode body) {
        requireObject(body);

        String targetsText = text(body, "targetsText")
            .orElseThrow(() -> new JobValidationException(ValidationErrorCode.TARGETS_REQUIRED));
        String defaultMessage = text(body, "defaultMessage").orElse("");
        List<Recipient> recipients = recipients(targetsText, defaultMessage);

        String datetime = text(body, "datetime", "datetimeISO")
            .orElseThrow(() -> new JobValidationException(ValidationErrorCode.DATETIME_REQUIRED));
        Instant anchor = instant(datetime, ValidationErrorCode.DATETIME_INVALID);

        RepeatPolicy policy = policy(text(body, "repeatType").orElse(null));
        Integer interval = null;
        if (policy.requiresInterval()) {
            interval = positive(body, ValidationErrorCode.INTERVAL_INVALID, "intervalValue", "intervalMinutes")
                .orElseThrow(() -> new JobValidationException(ValidationErrorCode.INTERVAL_INVALID));
        }

        Instant until = text(body, "repeatUntil", "repeatUntilISO")
            .map(v -> instant(v, ValidationErrorCode.REPEAT_UNTIL_INVALID))
            .orElse(null);
        Integer runs = positive(body, ValidationErrorCode.REPEAT_COUNT_INVALID, "repeatCount").orElse(null);

        String windowStart = window(body, "windowStart");
        String windowEnd = window(body, "windowEnd");

        return Job.builder()
            .id(ids.next())
            .recipients(recipients)
            .targetsText(targetsText)
            .defaultMessage(defaultMessage)
            .anchorTime(anchor)
            .repeatPolicy(policy)
            .intervalN(interval)
            .repeatUntil(until)
            .remainingRuns(runs)
            .stopKeyword(text(body, "stopOnReplyKeyword").orElse(null))
            .windowStart(windowStart)
            .windowEnd(windowEnd)
            .dispatchGapSeconds(nonNegative(body, "gapSeconds").orElse(Job.DEFAULT_GAP_SECONDS))
            .randomDelayMinSeconds(nonNegative(body, "randomDelayMinSeconds").orElse(0))
            .randomDelayMaxSeconds(nonNegative(body, "randomDelayMaxSeconds").orElse(0))
            .createdAt(clock.instant())
            .build();
    }

    /**
     * Apply a partial update. Only fields present in the patch change; an
     * empty or null value clears an optional field. A change of repeat type,
     * interval or anchor drops the persisted nextRunAt so the cadence is
     * computed afresh.
     */
    public Job applyUpdate(Job current, JsonNode patch) {
        requireObject(patch);
        Job.Builder b = current.toBuilder();
        boolean cadenceChanged = false;

        if (patch.has("targetsText") || patch.has("defaultMessage")) {
            String targetsText = patch.has("targetsText")
                ? text(patch, "targetsText").orElseThrow(
                    () -> new JobValidationException(ValidationErrorCode.TARGETS_REQUIRED))
                : current.targetsText();
            String defaultMessage = patch.has("defaultMessage")
                ? text(patch, "defaultMessage").orElse("")
                : current.defaultMessage();
            b.recipients(recipients(targetsText, defaultMessage))
                .targetsText(targetsText)
                .defaultMessage(defaultMessage);
        }

        if (patch.has("datetime") || patch.has("datetimeISO")) {
            String datetime = text(patch, "datetime", "datetimeISO")
                .orElseThrow(() -> new JobValidationException(ValidationErrorCode.DATETIME_REQUIRED));
            Instant anchor = instant(datetime, ValidationErrorCode.DATETIME_INVALID);
            cadenceChanged |= !anchor.equals(current.anchorTime());
            b.anchorTime(anchor);
        }

        RepeatPolicy policy = current.repeatPolicy();
        if (patch.has("repeatType")) {
            policy = policy(text(patch, "repeatType").orElse(null));
            cadenceChanged |= policy != current.repeatPolicy();
            b.repeatPolicy(policy);
        }

        Integer interval = current.intervalN();
        if (patch.has("intervalValue") || patch.has("intervalMinutes")) {
            interval = positive(patch, ValidationErrorCode.INTERVAL_INVALID, "intervalValue", "intervalMinutes")
                .orElse(null);
        }
        if (policy.requiresInterval()) {
            if (interval == null) {
                throw new JobValidationException(ValidationErrorCode.INTERVAL_INVALID);
            }
        } else {
            interval = null;
        }
        cadenceChanged |= !Objects.equals(interval, current.intervalN());
        b.intervalN(interval);

        if (patch.has("repeatUntil") || patch.has("repeatUntilISO")) {
            b.repeatUntil(text(patch, "repeatUntil", "repeatUntilISO")
                .map(v -> instant(v, ValidationErrorCode.REPEAT_UNTIL_INVALID))
                .orElse(null));
        }
        if (patch.has("repeatCount")) {
            b.remainingRuns(positive(patch, ValidationErrorCode.REPEAT_COUNT_INVALID, "repeatCount").orElse(null));
        }
        if (patch.has("windowStart")) {
            b.windowStart(window(patch, "windowStart"));
        }
        if (patch.has("windowEnd")) {
            b.windowEnd(window(patch, "windowEnd"));
        }
        if (patch.has("gapSeconds")) {
            b.dispatchGapSeconds(nonNegative(patch, "gapSeconds").orElse(Job.DEFAULT_GAP_SECONDS));
        }
        if (patch.has("randomDelayMinSeconds")) {
            b.randomDelayMinSeconds(nonNegative(patch, "randomDelayMinSeconds").orElse(0));
        }
        if (patch.has("randomDelayMaxSeconds")) {
            b.randomDelayMaxSeconds(nonNegative(patch, "randomDelayMaxSeconds").orElse(0));
        }
        if (patch.has("stopOnReplyKeyword")) {
            b.stopKeyword(text(patch, "stopOnReplyKeyword").orElse(null));
        }

        if (cadenceChanged) {
            b.nextRunAt(null);
        }
        return b.build();
    }

    private List<Recipient> recipients(String targetsText, String defaultMessage) {
        List<Recipient> recipients = parser.parse(targetsText, defaultMessage);
        if (recipients.isEmpty()) {
            throw new JobValidationException(ValidationErrorCode.NO_VALID_RECIPIENTS);
        }
        return recipients;
    }

    private Instant instant(String text, ValidationErrorCode code) {
        return Timestamps.parse(text, zone)
            .orElseThrow(() -> new JobValidationException(code, text));
    }

    private static RepeatPolicy policy(String code) {
        try {
            return RepeatPolicy.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException(ValidationErrorCode.REPEAT_TYPE_INVALID, code);
        }
    }

    private static String window(JsonNode node, String field) {
        Optional<String> value = text(node, field);
        if (value.isEmpty()) {
            return null;
        }
        if (!WindowGate.isValid(value.get())) {
            throw new JobValidationException(ValidationErrorCode.WINDOW_INVALID, field + "=" + value.get());
        }
        return value.get();
    }

    private static void requireObject(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new JobValidationException(ValidationErrorCode.BODY_INVALID);
        }
    }

    /**
     * First of the given fields holding non-blank text, trimmed.
     */
    static Optional<String> text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) continue;
            String s = value.isTextual() ? value.asText().trim() : value.toString().trim();
            if (!s.isEmpty()) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    private static Optional<Integer> positive(JsonNode node, ValidationErrorCode code, String... fields) {
        Optional<Integer> value = wholeNumber(node, code, fields);
        if (value.isPresent() && value.get() < 1) {
            throw new JobValidationException(code, String.valueOf(value.get()));
        }
        return value;
    }

    private static Optional<Integer> nonNegative(JsonNode node, String field) {
        return wholeNumber(node, ValidationErrorCode.DELAY_INVALID, field).map(v -> Math.max(0, v));
    }

    private static Optional<Integer> wholeNumber(JsonNode node, ValidationErrorCode code, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) continue;
            double number;
            if (value.isNumber()) {
                number = value.asDouble();
            } else {
                String s = value.asText().trim();
                if (s.isEmpty()) continue;
                try {
                    number = Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    throw new JobValidationException(code, field + "=" + s);
                }
            }
            if (!Double.isFinite(number) || Math.abs(number) > Integer.MAX_VALUE) {
                throw new JobValidationException(code, field + "=" + value.asText());
            }
            return Optional.of((int) Math.floor(number));
        }
        return Optional.empty();
    }
}
