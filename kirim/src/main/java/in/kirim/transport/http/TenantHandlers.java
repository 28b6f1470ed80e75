package in.kirim.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.kirim.domain.common.JobValidationException;
import in.kirim.messaging.IncomingMessage;
import in.kirim.messaging.MessagingException;
import in.kirim.repository.RecentEntriesRepository;
import in.kirim.service.logs.TenantLogService;
import in.kirim.service.tenant.Tenant;
import in.kirim.service.tenant.TenantManager;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static in.kirim.transport.http.HttpResponses.MAPPER;
import static in.kirim.transport.http.HttpResponses.badRequest;
import static in.kirim.transport.http.HttpResponses.pathParam;
import static in.kirim.transport.http.HttpResponses.queryParam;
import static in.kirim.transport.http.HttpResponses.readBody;
import static in.kirim.transport.http.HttpResponses.sendError;
import static in.kirim.transport.http.HttpResponses.sendOk;
import static in.kirim.transport.http.HttpResponses.sendText;
import static in.kirim.transport.http.HttpResponses.success;

/**
 * HTTP handlers for tenant lifecycle, inbound messages, recent entries,
 * logs and health.
 */
public final class TenantHandlers {
    private static final Logger log = LoggerFactory.getLogger(TenantHandlers.class);

    private final TenantManager tenants;
    private final RecentEntriesRepository recent;
    private final TenantLogService logs;

    public TenantHandlers(TenantManager tenants, RecentEntriesRepository recent, TenantLogService logs) {
        this.tenants = tenants;
        this.recent = recent;
        this.logs = logs;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode().put("status", "ok");
        ObjectNode ready = health.putObject("tenants");
        for (String tenantId : tenants.listTenantIds()) {
            ready.put(tenantId, tenants.find(tenantId).map(t -> t.client().isReady()).orElse(false));
        }
        sendOk(exchange, health);
    }

    /**
     * GET /api/tenants
     */
    public void list(HttpServerExchange exchange) {
        ObjectNode response = success();
        ArrayNode ids = response.putArray("tenants");
        tenants.listTenantIds().forEach(ids::add);
        sendOk(exchange, response);
    }

    /**
     * POST /api/tenants/{tenantId}/init
     */
    public void init(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        try {
            tenants.ensure(tenantId);
            sendOk(exchange, success().put("tenantId", tenantId));
        } catch (JobValidationException e) {
            badRequest(exchange, e.getMessage());
        }
    }

    /**
     * GET /api/tenants/{tenantId}/status
     */
    public void status(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        try {
            Tenant tenant = tenants.ensure(tenantId);
            sendOk(exchange, MAPPER.valueToTree(tenant.status()));
        } catch (JobValidationException e) {
            badRequest(exchange, e.getMessage());
        }
    }

    /**
     * POST /api/tenants/{tenantId}/logout
     */
    public void logout(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        try {
            tenants.logout(tenantId);
            sendOk(exchange, success().put("message", "Logged out " + tenantId));
        } catch (JobValidationException e) {
            badRequest(exchange, e.getMessage());
        } catch (MessagingException e) {
            log.error("Logout of tenant {} failed: {}", tenantId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Logout failed: " + e.getMessage());
        }
    }

    /**
     * DELETE /api/tenants/{tenantId}
     */
    public void destroy(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        try {
            tenants.destroy(tenantId);
            sendOk(exchange, success().put("message", "Tenant " + tenantId + " deleted"));
        } catch (JobValidationException e) {
            badRequest(exchange, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Delete of tenant {} failed: {}", tenantId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Delete failed: " + e.getMessage());
        }
    }

    /**
     * POST /api/tenants/{tenantId}/inbound
     *
     * Webhook of the messaging gateway: {from, body, fromMe}.
     */
    public void inbound(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            String tenantId = pathParam(ex, "tenantId");
            try {
                JsonNode node = readBody(body);
                String from = node.path("from").asText("").trim();
                if (from.isEmpty()) {
                    badRequest(ex, "from is required");
                    return;
                }
                IncomingMessage message = new IncomingMessage(from,
                    node.path("body").asText(""), node.path("fromMe").asBoolean(false));
                tenants.ensure(tenantId).client().deliverIncoming(message);
                sendOk(ex, success());

            } catch (JobValidationException e) {
                badRequest(ex, e.getMessage());
            } catch (JsonProcessingException e) {
                badRequest(ex, "invalid JSON body");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /api/tenants/{tenantId}/recent
     */
    public void recent(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        if (!TenantManager.isValidTenantId(tenantId)) {
            badRequest(exchange, "invalid tenant id");
            return;
        }
        sendOk(exchange, MAPPER.valueToTree(recent.load(tenantId)));
    }

    /**
     * DELETE /api/tenants/{tenantId}/recent
     */
    public void clearRecent(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        if (!TenantManager.isValidTenantId(tenantId)) {
            badRequest(exchange, "invalid tenant id");
            return;
        }
        recent.delete(tenantId);
        sendOk(exchange, success());
    }

    /**
     * GET /api/tenants/{tenantId}/logs?lines=N
     */
    public void logs(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        if (!TenantManager.isValidTenantId(tenantId)) {
            badRequest(exchange, "invalid tenant id");
            return;
        }
        try {
            sendText(exchange, logs.tail(tenantId, TenantLogService.clampLines(queryParam(exchange, "lines"))));
        } catch (IOException e) {
            log.error("Failed to read log of tenant {}: {}", tenantId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read logs: " + e.getMessage());
        }
    }

    /**
     * DELETE /api/tenants/{tenantId}/logs
     */
    public void clearLogs(HttpServerExchange exchange) {
        String tenantId = pathParam(exchange, "tenantId");
        if (!TenantManager.isValidTenantId(tenantId)) {
            badRequest(exchange, "invalid tenant id");
            return;
        }
        try {
            logs.clear(tenantId);
            sendOk(exchange, success());
        } catch (IOException e) {
            log.error("Failed to clear log of tenant {}: {}", tenantId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to clear logs: " + e.getMessage());
        }
    }
}
