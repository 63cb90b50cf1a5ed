package com.yourmail.endpoints;

import com.yourmail.config.server.EndpointConfig;
import com.yourmail.util.Json;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Abstract base class for HTTP endpoints.
 *
 * <p>Provides common functionality including:
 * <ul>
 *   <li>HTTP server lifecycle with configurable port</li>
 *   <li>Response generation utilities for JSON, plain text and binary content</li>
 *   <li>The JSON error envelope shared by all API routes</li>
 * </ul>
 */
public abstract class HttpEndpoint {
    private static final Logger log = LogManager.getLogger(HttpEndpoint.class);

    /**
     * HTTP Authentication handler for securing endpoints.
     */
    protected HttpAuth auth;

    /**
     * Embedded HTTP server instance.
     */
    protected HttpServer server;

    /**
     * Starts the HTTP endpoint with the given configuration.
     *
     * @param config EndpointConfig containing port settings.
     * @throws IOException If an I/O error occurs during server startup.
     */
    public abstract void start(EndpointConfig config) throws IOException;

    /**
     * Stops the HTTP endpoint.
     *
     * @param delaySeconds Seconds to wait for in-flight exchanges.
     */
    public void stop(int delaySeconds) {
        if (server != null) {
            server.stop(delaySeconds);
            log.info("Stopped HTTP endpoint on port {}", server.getAddress().getPort());
        }
    }

    /**
     * Gets the bound port.
     *
     * @return Port or -1 if not started.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Sends a JSON response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param json     JSON payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendJson(HttpExchange exchange, int code, String json) throws IOException {
        sendBytes(exchange, code, "application/json; charset=utf-8", json.getBytes(StandardCharsets.UTF_8));
        log.debug("Sent JSON response: status={}", code);
    }

    /**
     * Serializes an object and sends it as JSON.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param payload  Object to serialize.
     * @throws IOException If an I/O error occurs.
     */
    void sendJson(HttpExchange exchange, int code, Object payload) throws IOException {
        sendJson(exchange, code, Json.toJson(payload));
    }

    /**
     * Sends the JSON error envelope.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param error    Machine readable error code.
     * @param message  Human readable message.
     * @throws IOException If an I/O error occurs.
     */
    void sendJsonError(HttpExchange exchange, int code, String error, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message);
        sendJson(exchange, code, body);
    }

    /**
     * Sends a plain text response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param text     Plain text payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendText(HttpExchange exchange, int code, String text) throws IOException {
        sendBytes(exchange, code, "text/plain; charset=utf-8", text.getBytes(StandardCharsets.UTF_8));
        log.debug("Sent text response: status={}", code);
    }

    /**
     * Sends a response with the specified HTTP status code, content type, and payload.
     *
     * @param exchange    HTTP exchange.
     * @param code        HTTP status code.
     * @param contentType Content-Type header value.
     * @param bytes       Response payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendBytes(HttpExchange exchange, int code, String contentType, byte[] bytes) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, bytes.length);
    }

    /**
     * Sends a method not allowed response unless the request uses one of the given methods.
     *
     * @param exchange HTTP exchange.
     * @param methods  Allowed methods.
     * @return True if the method is allowed.
     * @throws IOException If an I/O error occurs.
     */
    boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        for (String method : methods) {
            if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(", ", methods));
        sendJsonError(exchange, 405, "method_not_allowed", "Method not allowed");
        return false;
    }
}
