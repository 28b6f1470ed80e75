package in.kirim.domain.common;

/**
 * Reasons a job request is rejected at the API boundary.
 */
public enum ValidationErrorCode {
    // Recipients
    TARGETS_REQUIRED("targetsText is required"),
    NO_VALID_RECIPIENTS("No valid targets/messages found. Use: target | message, or set a default message."),

    // Timing
    DATETIME_REQUIRED("datetime is required"),
    DATETIME_INVALID("datetime is not a valid ISO date-time"),
    REPEAT_UNTIL_INVALID("repeatUntil is not a valid ISO date-time"),

    // Recurrence
    REPEAT_TYPE_INVALID("repeatType is not supported"),
    INTERVAL_INVALID("intervalValue must be a whole number >= 1"),
    REPEAT_COUNT_INVALID("repeatCount must be a whole number >= 1"),

    // Delivery
    WINDOW_INVALID("windowStart and windowEnd must be HH:mm"),
    DELAY_INVALID("gap and random delay values must be whole numbers"),

    // Addressing
    TENANT_ID_INVALID("tenantId may only contain letters, digits, '-' and '_' (max 64)"),
    BODY_INVALID("Request body must be a JSON object");

    private final String message;

    ValidationErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
