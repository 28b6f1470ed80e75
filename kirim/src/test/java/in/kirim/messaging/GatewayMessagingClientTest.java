package in.kirim.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests GatewayMessagingClient against an in-process fake gateway.
 *
 * Tests:
 * - Send posts chat id and text with the bearer token
 * - Rejected send raises MessagingException
 * - Status polling flips readiness and notifies listeners
 * - Logout reports not ready; destroy tolerates a missing session
 */
class GatewayMessagingClientTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow gateway;
    private URI gatewayUri;
    private GatewayMessagingClient client;

    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<JsonNode> sentBodies = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final AtomicBoolean sessionReady = new AtomicBoolean(false);
    private final AtomicInteger sendStatus = new AtomicInteger(200);
    private final AtomicInteger deleteStatus = new AtomicInteger(200);

    @BeforeEach
    void setUp() {
        gateway = Undertow.builder()
            .addHttpListener(0, "127.0.0.1")
            .setHandler(new BlockingHandler(Handlers.routing()
                .post("/sessions/{tenant}/connect", ex -> respond(ex, 200, "{}"))
                .get("/sessions/{tenant}/status",
                    ex -> respond(ex, 200, "{\"ready\":" + sessionReady.get() + "}"))
                .post("/sessions/{tenant}/messages", ex -> {
                    sentBodies.add(MAPPER.readTree(readBody(ex)));
                    respond(ex, sendStatus.get(), sendStatus.get() == 200 ? "{}" : "quota exceeded");
                })
                .post("/sessions/{tenant}/logout", ex -> respond(ex, 200, "{}"))
                .delete("/sessions/{tenant}", ex -> respond(ex, deleteStatus.get(), "{}"))))
            .build();
        gateway.start();
        int port = ((InetSocketAddress) gateway.getListenerInfo().get(0).getAddress()).getPort();
        gatewayUri = URI.create("http://127.0.0.1:" + port);

        client = new GatewayMessagingClient("acme", gatewayUri, "secret",
            Duration.ofMillis(50), HttpClient.newHttpClient());
    }

    @AfterEach
    void tearDown() throws Exception {
        client.destroy();
        gateway.stop();
    }

    private void respond(HttpServerExchange exchange, int status, String body) {
        requests.add(exchange.getRequestMethod() + " " + exchange.getRequestPath());
        authHeaders.add(String.valueOf(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION)));
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(body);
    }

    private static String readBody(HttpServerExchange exchange) throws IOException {
        try (InputStream in = exchange.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testSendPostsChatIdAndText() throws Exception {
        assertTrue(client.send("628111", "hello"));

        assertEquals(1, sentBodies.size());
        assertEquals("628111@c.us", sentBodies.get(0).path("to").asText(), "Phone address should get chat suffix");
        assertEquals("hello", sentBodies.get(0).path("text").asText());
        assertTrue(requests.contains("POST /sessions/acme/messages"));
        assertTrue(authHeaders.contains("Bearer secret"), "Token should be sent as bearer");
    }

    @Test
    void testRejectedSendThrows() {
        sendStatus.set(429);

        MessagingException e = assertThrows(MessagingException.class, () -> client.send("628111", "hello"));
        assertTrue(e.getMessage().contains("429"), "Status should be in the message: " + e.getMessage());
        assertTrue(e.getMessage().contains("quota exceeded"));
    }

    @Test
    void testPollingReportsReadiness() throws Exception {
        CountDownLatch readyLatch = new CountDownLatch(1);
        CountDownLatch notReadyLatch = new CountDownLatch(1);
        client.addListener(new MessagingListener() {
            @Override
            public void onReady(String tenantId) {
                readyLatch.countDown();
            }

            @Override
            public void onNotReady(String tenantId, String reason) {
                notReadyLatch.countDown();
            }

            @Override
            public void onIncomingMessage(String tenantId, IncomingMessage message) {
            }
        });

        client.connect();
        assertTrue(requests.contains("POST /sessions/acme/connect"));
        assertFalse(client.isReady());

        sessionReady.set(true);
        assertTrue(readyLatch.await(3, TimeUnit.SECONDS), "Ready status should be picked up");
        assertTrue(client.isReady());

        client.logout();
        assertTrue(notReadyLatch.await(3, TimeUnit.SECONDS), "Logout should report not ready");
        assertTrue(requests.contains("POST /sessions/acme/logout"));
    }

    @Test
    void testDeliverIncomingReachesListeners() {
        List<IncomingMessage> received = new CopyOnWriteArrayList<>();
        client.addListener(new MessagingListener() {
            @Override
            public void onReady(String tenantId) {
            }

            @Override
            public void onNotReady(String tenantId, String reason) {
            }

            @Override
            public void onIncomingMessage(String tenantId, IncomingMessage message) {
                received.add(message);
            }
        });

        client.deliverIncoming(new IncomingMessage("628111@c.us", "stop", false));

        assertEquals(1, received.size());
        assertEquals("stop", received.get(0).body());
    }

    @Test
    void testDestroyToleratesMissingSession() throws Exception {
        deleteStatus.set(404);

        assertDoesNotThrow(() -> client.destroy());
        assertTrue(requests.contains("DELETE /sessions/acme"));
        assertFalse(client.isReady());
    }

    @Test
    void testDestroyRejectedThrows() {
        deleteStatus.set(500);

        assertThrows(MessagingException.class, () -> client.destroy());
        deleteStatus.set(200);
    }

    @Test
    void testUnreachableGatewayRaisesMessagingException() {
        GatewayMessagingClient offline = new GatewayMessagingClient("acme", URI.create("http://127.0.0.1:1"),
            "", Duration.ofSeconds(60), HttpClient.newHttpClient());

        assertThrows(MessagingException.class, () -> offline.send("628111", "hello"));
        assertThrows(MessagingException.class, offline::fetchReady);
    }
}
