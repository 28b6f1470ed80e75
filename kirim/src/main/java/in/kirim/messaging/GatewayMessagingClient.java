package in.kirim.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.kirim.config.SchedulerConfig;
import in.kirim.domain.job.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Messaging client backed by an HTTP session gateway.
 *
 * Endpoints, relative to the gateway base URL:
 * <pre>
 * POST   /sessions/{tenant}/connect
 * GET    /sessions/{tenant}/status     -> {"ready": true|false}
 * POST   /sessions/{tenant}/messages   {"to": "...@c.us", "text": "..."}
 * POST   /sessions/{tenant}/logout
 * DELETE /sessions/{tenant}
 * </pre>
 * Inbound messages are pushed to the service's webhook and handed in through
 * {@link #deliverIncoming}.
 */
public final class GatewayMessagingClient implements MessagingClient {
    private static final Logger log = LoggerFactory.getLogger(GatewayMessagingClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String tenantId;
    private final URI sessionUri;
    private final String token;
    private final HttpClient httpClient;
    private final ReadinessMonitor monitor;
    private final List<MessagingListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean ready = false;

    public GatewayMessagingClient(String tenantId, URI gatewayUri, String token,
                                  Duration pollInterval, HttpClient httpClient) {
        this.tenantId = tenantId;
        this.sessionUri = URI.create(gatewayUri + "/sessions/"
            + URLEncoder.encode(tenantId, StandardCharsets.UTF_8));
        this.token = token == null ? "" : token;
        this.httpClient = httpClient;
        this.monitor = new ReadinessMonitor(tenantId, pollInterval, this::fetchReady, this::onReadinessChange);
    }

    /**
     * Factory creating one gateway client per tenant from the process config.
     */
    public static MessagingClientFactory factory(SchedulerConfig config) {
        HttpClient shared = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        return tenantId -> new GatewayMessagingClient(tenantId, config.gatewayUri(),
            config.gatewayToken(), config.readinessPollInterval(), shared);
    }

    @Override
    public String tenantId() {
        return tenantId;
    }

    @Override
    public void connect() {
        try {
            HttpResponse<String> response = call("POST", "/connect", null);
            if (!isSuccess(response)) {
                log.warn("Gateway refused connect for tenant {}: HTTP {}", tenantId, response.statusCode());
            } else {
                log.info("Session connect requested for tenant {}", tenantId);
            }
        } catch (MessagingException e) {
            log.warn("Session connect failed for tenant {}: {} (will keep polling)", tenantId, e.getMessage());
        }
        monitor.start();
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public boolean send(String address, String text) throws MessagingException {
        ObjectNode payload = MAPPER.createObjectNode()
            .put("to", Addresses.toChatId(address))
            .put("text", text);
        HttpResponse<String> response = call("POST", "/messages", payload);
        if (!isSuccess(response)) {
            throw new MessagingException("Gateway rejected send: HTTP " + response.statusCode()
                + (response.body() == null || response.body().isBlank() ? "" : " " + response.body()));
        }
        return true;
    }

    @Override
    public void addListener(MessagingListener listener) {
        listeners.add(listener);
    }

    @Override
    public void deliverIncoming(IncomingMessage message) {
        for (MessagingListener listener : listeners) {
            listener.onIncomingMessage(tenantId, message);
        }
    }

    @Override
    public void logout() throws MessagingException {
        HttpResponse<String> response = call("POST", "/logout", null);
        monitor.report(false);
        if (!isSuccess(response)) {
            throw new MessagingException("Gateway rejected logout: HTTP " + response.statusCode());
        }
        log.info("Session logged out for tenant {}", tenantId);
    }

    @Override
    public void destroy() throws MessagingException {
        monitor.stop();
        ready = false;
        HttpResponse<String> response = call("DELETE", "", null);
        if (!isSuccess(response) && response.statusCode() != 404) {
            throw new MessagingException("Gateway rejected session delete: HTTP " + response.statusCode());
        }
        log.info("Session destroyed for tenant {}", tenantId);
    }

    /**
     * Readiness probe used by the monitor.
     */
    boolean fetchReady() throws MessagingException {
        HttpResponse<String> response = call("GET", "/status", null);
        if (!isSuccess(response)) {
            throw new MessagingException("Status HTTP " + response.statusCode());
        }
        try {
            JsonNode json = MAPPER.readTree(response.body());
            return json.path("ready").asBoolean(false);
        } catch (IOException e) {
            throw new MessagingException("Unreadable status response", e);
        }
    }

    private void onReadinessChange(boolean nowReady) {
        ready = nowReady;
        for (MessagingListener listener : listeners) {
            if (nowReady) {
                listener.onReady(tenantId);
            } else {
                listener.onNotReady(tenantId, "session not ready");
            }
        }
    }

    private HttpResponse<String> call(String method, String path, JsonNode body) throws MessagingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(sessionUri + path))
            .timeout(REQUEST_TIMEOUT)
            .header("Accept", "application/json");
        if (!token.isEmpty()) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body.toString()));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MessagingException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException(method + " " + path + " interrupted", e);
        }
    }

    private static boolean isSuccess(HttpResponse<String> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }
}
