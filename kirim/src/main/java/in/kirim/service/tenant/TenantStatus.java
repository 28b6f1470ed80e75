package in.kirim.service.tenant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of a tenant for the status endpoint.
 */
public record TenantStatus(
    @JsonProperty("tenantId") String tenantId,
    @JsonProperty("ready") boolean ready,
    @JsonProperty("scheduledCount") int scheduledCount,
    @JsonProperty("armedCount") int armedCount,
    @JsonProperty("queueLength") int queueLength
) {}
