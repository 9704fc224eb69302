package com.lmspush.destination;

import com.lmspush.content.ContentFixtures;
import com.lmspush.content.ContentRecord;
import com.lmspush.content.Grade;
import com.lmspush.statement.ActivityStatement;
import com.lmspush.statement.StatementGenerator;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Adapters on the production delivery client, against a real local HTTP endpoint.
 */
class DeliveryRestClientTest {

    private HttpServer server;
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String reply = "";

    private RestClient restClient;
    private ContentRecord content;
    private ActivityStatement statement;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();

        DeliveryProperties properties = new DeliveryProperties(Duration.ofSeconds(1), Duration.ofSeconds(2), "1.0.3");
        restClient = new DestinationConfiguration().deliveryRestClient(RestClients.jsonBuilder(), properties);
        content = ContentFixtures.essay(Grade.A, "science");
        statement = new StatementGenerator(Clock.systemUTC()).generate(content);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Rejected credential is fatal even when the response body is not JSON")
    void unauthorized_isFatal() {
        status = 401;
        reply = "invalid token";

        DeliveryOutcome outcome = webhook().deliver(statement, content, destination("/hook", "expired"));

        DeliveryOutcome.FatalFailure failure = assertInstanceOf(DeliveryOutcome.FatalFailure.class, outcome);
        assertEquals("Webhook push failed with HTTP 401: invalid token", failure.reason());
        assertEquals(1, bodies.size());
    }

    @Test
    void unauthorizedWithoutBody_isFatal() {
        status = 401;

        DeliveryOutcome outcome = recordStore().deliver(statement, content, destination("/xapi", "expired"));

        DeliveryOutcome.FatalFailure failure = assertInstanceOf(DeliveryOutcome.FatalFailure.class, outcome);
        assertTrue(failure.reason().startsWith("LRS push failed with HTTP 401"));
    }

    @Test
    void serverError_isRetryable() {
        status = 503;
        reply = "maintenance";

        DeliveryOutcome outcome = webhook().deliver(statement, content, destination("/hook", null));

        assertEquals(new DeliveryOutcome.RetryableFailure("Webhook push failed with HTTP 503: maintenance"), outcome);
    }

    @Test
    void success_isDelivered() {
        status = 200;
        reply = "[\"" + statement.id() + "\"]";

        DeliveryOutcome outcome = recordStore().deliver(statement, content, destination("/xapi", "token"));

        assertEquals(new DeliveryOutcome.Delivered(200), outcome);
        assertTrue(bodies.get(0).contains("\"mbox\":\"mailto:ada@example.edu\""));
    }

    @Test
    void refusedConnection_isRetryable() {
        DestinationConfig closed = new DestinationConfig("closed", DestinationKind.WEBHOOK,
            "http://127.0.0.1:1/hook", null, null);

        assertInstanceOf(DeliveryOutcome.RetryableFailure.class, webhook().deliver(statement, content, closed));
    }

    private WebhookAdapter webhook() {
        return new WebhookAdapter(restClient, Clock.systemUTC());
    }

    private RecordStoreAdapter recordStore() {
        return new RecordStoreAdapter(restClient, "1.0.3");
    }

    private DestinationConfig destination(String path, String token) {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + path;
        return new DestinationConfig("local", DestinationKind.WEBHOOK, endpoint, token, null);
    }
}
