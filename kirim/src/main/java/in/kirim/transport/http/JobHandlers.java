package in.kirim.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.kirim.domain.common.JobValidationException;
import in.kirim.domain.job.Job;
import in.kirim.repository.RecentEntriesRepository;
import in.kirim.service.schedule.JobScheduler;
import in.kirim.service.tenant.Tenant;
import in.kirim.service.tenant.TenantManager;
import in.kirim.service.validation.JobRequestValidator;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static in.kirim.transport.http.HttpResponses.MAPPER;
import static in.kirim.transport.http.HttpResponses.badRequest;
import static in.kirim.transport.http.HttpResponses.notFound;
import static in.kirim.transport.http.HttpResponses.pathParam;
import static in.kirim.transport.http.HttpResponses.readBody;
import static in.kirim.transport.http.HttpResponses.sendError;
import static in.kirim.transport.http.HttpResponses.sendOk;
import static in.kirim.transport.http.HttpResponses.success;

/**
 * HTTP handlers for scheduled jobs.
 *
 * Provides REST API for:
 * - POST   /api/tenants/{tenantId}/jobs         - Create and arm a job
 * - GET    /api/tenants/{tenantId}/jobs         - List jobs with lifecycle state and next fire
 * - PUT    /api/tenants/{tenantId}/jobs/{jobId} - Partial update, re-armed
 * - DELETE /api/tenants/{tenantId}/jobs/{jobId} - Cancel and delete
 */
public final class JobHandlers {
    private static final Logger log = LoggerFactory.getLogger(JobHandlers.class);

    private static final String ERROR_NOT_FOUND = "job not found";

    private final TenantManager tenants;
    private final JobRequestValidator validator;
    private final RecentEntriesRepository recent;

    public JobHandlers(TenantManager tenants, JobRequestValidator validator, RecentEntriesRepository recent) {
        this.tenants = tenants;
        this.validator = validator;
        this.recent = recent;
    }

    public void create(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            String tenantId = pathParam(ex, "tenantId");
            try {
                Tenant tenant = tenants.ensure(tenantId);
                Job job = validator.validateCreate(readBody(body));
                Optional<Job> stored = tenant.scheduler().create(job);
                recent.remember(tenantId, job.targetsText(), job.defaultMessage());

                ObjectNode response = success();
                response.set("job", MAPPER.valueToTree(stored.orElse(job)));
                if (stored.isEmpty()) {
                    response.put("retired", true)
                        .put("message", "repeatUntil is before the first fire time; the job was not scheduled");
                }
                sendOk(ex, response);
                log.info("POST /api/tenants/{}/jobs → 200 (id={}, {} recipient(s){})",
                    tenantId, job.id(), job.recipients().size(), stored.isEmpty() ? ", retired" : "");

            } catch (JobValidationException e) {
                log.warn("Rejected job for tenant {}: {}", tenantId, e.getMessage());
                badRequest(ex, e.getMessage());
            } catch (JsonProcessingException e) {
                badRequest(ex, "invalid JSON body");
            } catch (Exception e) {
                log.error("Failed to create job for tenant {}: {}", tenantId, e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to create job: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    public void list(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        try {
            JobScheduler scheduler = tenants.ensure(tenantId).scheduler();
            ArrayNode jobs = MAPPER.createArrayNode();
            for (Job job : scheduler.jobs()) {
                ObjectNode node = MAPPER.valueToTree(job);
                scheduler.stateOf(job.id()).ifPresent(state -> node.put("state", state.name()));
                scheduler.nextFireAt(job.id()).ifPresent(at -> node.put("nextFireAt", at.toString()));
                jobs.add(node);
            }
            ObjectNode response = success();
            response.set("jobs", jobs);
            sendOk(exchange, response);

        } catch (JobValidationException e) {
            badRequest(exchange, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to list jobs of tenant {}: {}", tenantId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to list jobs: " + e.getMessage());
        }
    }

    public void update(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            String tenantId = pathParam(ex, "tenantId");
            try {
                JobScheduler scheduler = tenants.ensure(tenantId).scheduler();
                Optional<Long> id = jobId(ex);
                if (id.isEmpty()) {
                    notFound(ex, ERROR_NOT_FOUND);
                    return;
                }
                JsonNode patch = readBody(body);
                Optional<Job> updated = scheduler.update(id.get(), current -> validator.applyUpdate(current, patch));
                if (updated.isEmpty()) {
                    notFound(ex, ERROR_NOT_FOUND);
                    return;
                }
                Job job = updated.get();
                recent.remember(tenantId, job.targetsText(), job.defaultMessage());

                ObjectNode response = success();
                response.set("job", MAPPER.valueToTree(job));
                sendOk(ex, response);
                log.info("PUT /api/tenants/{}/jobs/{} → 200", tenantId, job.id());

            } catch (JobValidationException e) {
                log.warn("Rejected update for tenant {}: {}", tenantId, e.getMessage());
                badRequest(ex, e.getMessage());
            } catch (JsonProcessingException e) {
                badRequest(ex, "invalid JSON body");
            } catch (Exception e) {
                log.error("Failed to update job of tenant {}: {}", tenantId, e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to update job: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    public void delete(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        try {
            JobScheduler scheduler = tenants.ensure(tenantId).scheduler();
            Optional<Long> id = jobId(exchange);
            if (id.isEmpty() || !scheduler.delete(id.get())) {
                notFound(exchange, ERROR_NOT_FOUND);
                return;
            }
            sendOk(exchange, success());
            log.info("DELETE /api/tenants/{}/jobs/{} → 200", tenantId, id.get());

        } catch (JobValidationException e) {
            badRequest(exchange, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to delete job of tenant {}: {}", tenantId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to delete job: " + e.getMessage());
        }
    }

    private static Optional<Long> jobId(HttpServerExchange exchange) {
        try {
            return Optional.of(Long.parseLong(pathParam(exchange, "jobId")));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
