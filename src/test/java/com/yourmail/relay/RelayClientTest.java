package com.yourmail.relay;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.yourmail.config.server.RelayConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RelayClient.
 * <p>
 * MockWebServer plays the peer server; the relay target is "localhost" on the mock port.
 */
class RelayClientTest {

    private MockWebServer mockWebServer;
    private RelayClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        Map<String, Object> map = new HashMap<>();
        map.put("port", mockWebServer.getPort());
        map.put("timeoutSeconds", 2);
        client = new RelayClient("mail.test", new RelayConfig(map),
                Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void postsPayload() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"success\":true,\"status\":\"delivered\",\"id\":1}"));

        RelayResult result = client.sendMessage("alice@mail.test", "bob@localhost", "Hi", "Body", "localhost");

        assertTrue(result.isSuccess());
        assertTrue(result.isAttempted());

        RecordedRequest request = mockWebServer.takeRequest(2, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertEquals("/federation/relay", request.getPath());
        assertTrue(request.getHeader("Content-Type").startsWith("application/json"));

        JsonObject json = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
        assertEquals("alice@mail.test", json.get("from").getAsString());
        assertEquals("bob@localhost", json.get("to").getAsString());
        assertEquals("Hi", json.get("subject").getAsString());
        assertEquals("Body", json.get("body").getAsString());
        assertEquals("2024-01-01T12:00:00Z", json.get("timestamp").getAsString());
    }

    @Test
    void ownHostIsNoOp() {
        RelayResult result = client.sendMessage("alice@mail.test", "bob@mail.test", "Hi", "Body", "MAIL.TEST");

        assertTrue(result.isSuccess());
        assertFalse(result.isAttempted());
        assertEquals(0, mockWebServer.getRequestCount());
    }

    @Test
    void serverErrorIsFailure() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));

        RelayResult result = client.sendMessage("alice@mail.test", "bob@localhost", "Hi", "Body", "localhost");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("500"));
    }

    @Test
    void unreachableIsFailure() throws IOException {
        mockWebServer.shutdown();

        RelayResult result = client.sendMessage("alice@mail.test", "bob@localhost", "Hi", "Body", "localhost");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("Relay failed"));
    }

    @Test
    void blankTargetIsFailure() {
        assertFalse(client.sendMessage("a@mail.test", "b@x", "Hi", "Body", " ").isSuccess());
    }
}
