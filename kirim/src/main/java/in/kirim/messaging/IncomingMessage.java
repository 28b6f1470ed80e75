package in.kirim.messaging;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message received by a tenant's session.
 *
 * @param from   sender address as reported by the transport
 * @param body   message text
 * @param fromMe true for messages sent by the tenant's own account
 */
public record IncomingMessage(
    @JsonProperty("from") String from,
    @JsonProperty("body") String body,
    @JsonProperty("fromMe") boolean fromMe
) {}
