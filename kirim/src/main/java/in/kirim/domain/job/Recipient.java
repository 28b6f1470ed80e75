package in.kirim.domain.job;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One destination of a job and the text sent to it.
 *
 * @param address normalized phone number or group id
 * @param message message body for this address
 */
public record Recipient(
    @JsonProperty("address") String address,
    @JsonProperty("message") String message
) {}
