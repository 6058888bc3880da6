package com.presentos.core.forward;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.presentos.core.config.RouterProperties;
import com.presentos.core.metrics.RouterMetrics;
import com.presentos.core.model.DownstreamResponse;
import com.presentos.core.model.HandlerKind;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DownstreamForwarderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedContentType = new AtomicReference<>();

    private HttpServer server;
    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private RouterProperties properties;
    private DownstreamForwarder forwarder;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/ok", exchange -> {
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            receivedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            byte[] bytes = "{\"htmlLink\":\"https://calendar.example/e/1\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.createContext("/broken", exchange -> {
            exchange.getRequestBody().readAllBytes();
            byte[] bytes = "quota exceeded".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(429, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.createContext("/hang", exchange -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.createContext("/stall", exchange -> {
            exchange.getRequestBody().readAllBytes();
            exchange.sendResponseHeaders(200, 100);
            exchange.getResponseBody().write("{\"ok".getBytes(StandardCharsets.UTF_8));
            exchange.getResponseBody().flush();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.start();

        registry = new SimpleMeterRegistry();
        properties = new RouterProperties();
        forwarder = new DownstreamForwarder(properties, new RouterMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private ObjectNode payload() {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", "Call Aayush");
        node.put("task_id", "page-1");
        return node;
    }

    @Test
    @DisplayName("Posts the payload as JSON and returns the handler's response verbatim")
    void forwardsJson() throws Exception {
        properties.getHandlers().getCalendar().setUrl(url("/ok"));

        DownstreamResponse response = forwarder.forward(HandlerKind.CALENDAR, payload());

        assertTrue(response.isSuccess());
        assertEquals(HandlerKind.CALENDAR, response.handler());
        assertEquals("{\"htmlLink\":\"https://calendar.example/e/1\"}", response.body());
        assertEquals("application/json", receivedContentType.get());
        assertEquals("page-1", mapper.readTree(receivedBody.get()).get("task_id").asText());
        assertEquals(1, registry.find("presentos.forward.duration")
                .tag("handler", "CALENDAR").tag("outcome", "success").timer().count());
    }

    @Test
    @DisplayName("Non-2xx responses are returned as-is, not thrown")
    void nonSuccessStatus() {
        properties.getHandlers().getResearch().setUrl(url("/broken"));

        DownstreamResponse response = forwarder.forward(HandlerKind.RESEARCH, payload());

        assertFalse(response.isSuccess());
        assertEquals(429, response.status());
        assertEquals("quota exceeded", response.body());
    }

    @Test
    @DisplayName("A hanging handler yields a 500 response within the configured timeout")
    void hangingHandlerTimesOut() {
        properties.getHandlers().getMessaging().setUrl(url("/hang"));
        properties.getHandlers().getMessaging().setTimeoutSeconds(1);

        long start = System.currentTimeMillis();
        DownstreamResponse response = forwarder.forward(HandlerKind.MESSAGING, payload());
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(DownstreamForwarder.FAILURE_STATUS, response.status());
        assertTrue(response.body().contains("timed out"), response.body());
        assertTrue(elapsed < 4_000, "took " + elapsed + "ms");
    }

    @Test
    @DisplayName("A handler that sends headers and then stalls the body still times out")
    void stalledBodyTimesOut() {
        properties.getHandlers().getMessaging().setUrl(url("/stall"));
        properties.getHandlers().getMessaging().setTimeoutSeconds(1);

        long start = System.currentTimeMillis();
        DownstreamResponse response = forwarder.forward(HandlerKind.MESSAGING, payload());
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(DownstreamForwarder.FAILURE_STATUS, response.status());
        assertTrue(response.body().contains("timed out"), response.body());
        assertTrue(elapsed < 4_000, "took " + elapsed + "ms");
        assertEquals(1, registry.find("presentos.forward.duration")
                .tag("handler", "MESSAGING").tag("outcome", "error").timer().count());
    }

    @Test
    @DisplayName("Unconfigured handler yields a 500 response without a network call")
    void unconfiguredHandler() {
        DownstreamResponse response = forwarder.forward(HandlerKind.EMAIL, payload());

        assertEquals(DownstreamForwarder.FAILURE_STATUS, response.status());
        assertTrue(response.body().contains("not configured"));
        assertNull(receivedBody.get());
    }

    @Test
    @DisplayName("Unreachable handler yields a 500 response")
    void unreachableHandler() {
        properties.getHandlers().getExperience().setUrl("http://127.0.0.1:1/experience");

        DownstreamResponse response = forwarder.forward(HandlerKind.EXPERIENCE, payload());

        assertEquals(DownstreamForwarder.FAILURE_STATUS, response.status());
        assertEquals(1, registry.find("presentos.forward.duration")
                .tag("handler", "EXPERIENCE").tag("outcome", "error").timer().count());
    }
}
