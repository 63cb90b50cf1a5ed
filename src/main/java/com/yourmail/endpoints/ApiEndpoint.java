package com.yourmail.endpoints;

import com.google.gson.JsonParseException;
import com.yourmail.config.server.EndpointConfig;
import com.yourmail.delivery.AttachmentUpload;
import com.yourmail.delivery.MessageSubmission;
import com.yourmail.delivery.SubmissionResult;
import com.yourmail.delivery.SubmitRequest;
import com.yourmail.delivery.UnknownRecipientException;
import com.yourmail.delivery.ValidationException;
import com.yourmail.hub.FanoutHub;
import com.yourmail.hub.Subscription;
import com.yourmail.identity.Account;
import com.yourmail.metrics.MetricsRegistry;
import com.yourmail.relay.RelayMessage;
import com.yourmail.store.Attachment;
import com.yourmail.store.AttachmentStore;
import com.yourmail.store.Message;
import com.yourmail.store.PersistenceException;
import com.yourmail.store.ThreadStore;
import com.yourmail.util.Json;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Request based API endpoint.
 *
 * <p>Endpoints:
 * <ul>
 *   <li><b>GET /api/health</b> - Liveness, no authentication.</li>
 *   <li><b>GET /api/messages</b> - Inbox roots, {@code limit} and {@code offset} query parameters.</li>
 *   <li><b>GET /api/messages/sent</b> - Sent messages, newest first.</li>
 *   <li><b>GET /api/messages/unread-count</b> - Unread count.</li>
 *   <li><b>POST /api/messages/{id}/read</b> - Mark read, recipient only.</li>
 *   <li><b>GET /api/messages/{id}/attachments</b> - Attachment metadata.</li>
 *   <li><b>POST /api/send</b> - Send a message as JSON or multipart/form-data with {@code attachments} files.</li>
 *   <li><b>GET /api/threads/{threadId}</b> - Thread messages the caller sent or received.</li>
 *   <li><b>GET /api/attachments/{id}</b> - Attachment download.</li>
 *   <li><b>GET /api/sse/inbox</b> - Live inbox event stream.</li>
 *   <li><b>POST /federation/relay</b> - Inbound relay from other servers, no authentication.</li>
 *   <li><b>GET /metrics</b> - Prometheus scrape.</li>
 * </ul>
 *
 * <p>Errors use the envelope {@code {"success":false,"error":code,"message":text}}.
 */
public class ApiEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(ApiEndpoint.class);

    static final String VERSION = "1.0.0";

    private final MessageSubmission submission;
    private final ThreadStore store;
    private final AttachmentStore attachments;
    private final FanoutHub hub;
    private final long maxRequestBytes;

    private ExecutorService executor;
    private int defaultLimit = 50;
    private int maxLimit = 100;

    /**
     * Constructs a new ApiEndpoint instance.
     *
     * @param submission      Message submission.
     * @param store           Thread store.
     * @param attachments     Attachment store.
     * @param hub             Fan-out hub.
     * @param auth            Caller authentication.
     * @param maxRequestBytes Largest accepted request body.
     */
    public ApiEndpoint(MessageSubmission submission, ThreadStore store, AttachmentStore attachments,
                       FanoutHub hub, HttpAuth auth, long maxRequestBytes) {
        this.submission = submission;
        this.store = store;
        this.attachments = attachments;
        this.hub = hub;
        this.auth = auth;
        this.maxRequestBytes = maxRequestBytes;
    }

    /**
     * Starts the API endpoint.
     *
     * @param config EndpointConfig containing port and paging settings.
     * @throws IOException If an I/O error occurs during server startup.
     */
    @Override
    public void start(EndpointConfig config) throws IOException {
        defaultLimit = config.getDefaultLimit();
        maxLimit = config.getMaxLimit();

        server = HttpServer.create(new InetSocketAddress(config.getPort(8080)), config.getBacklog());

        server.createContext("/api/health", this::handleHealth);
        server.createContext("/api/messages", this::handleMessages);
        server.createContext("/api/send", this::handleSend);
        server.createContext("/api/threads/", this::handleThread);
        server.createContext("/api/attachments/", this::handleAttachment);
        server.createContext("/api/sse/inbox", this::handleInboxStream);
        server.createContext("/federation/relay", this::handleRelay);
        server.createContext("/metrics", this::handleMetrics);

        // Event streams hold their worker for the life of the connection.
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();

        log.info("API endpoint available at http://localhost:{}/api/", getPort());
        log.info("Inbox event stream available at http://localhost:{}/api/sse/inbox", getPort());
        log.info("Relay endpoint available at http://localhost:{}/federation/relay", getPort());
    }

    @Override
    public void stop(int delaySeconds) {
        super.stop(delaySeconds);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Handles GET /api/health.
     */
    void handleHealth(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now());
        body.put("version", VERSION);
        sendJson(exchange, 200, body);
    }

    /**
     * Routes everything under /api/messages.
     */
    void handleMessages(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String[] segments = StringUtils.removeStart(path, "/api/messages").split("/");
        // segments[0] is empty for paths below /api/messages.
        if (segments.length > 0 && !segments[0].isEmpty()) {
            sendJsonError(exchange, 404, "not_found", "Not found");
            return;
        }

        Optional<Account> caller = authenticate(exchange, false);
        if (caller.isEmpty()) {
            return;
        }

        try {
            if (segments.length <= 1) {
                if (allowMethods(exchange, "GET")) {
                    handleInbox(exchange, caller.get());
                }
            } else if (segments.length == 2 && segments[1].equals("sent")) {
                if (allowMethods(exchange, "GET")) {
                    handleSent(exchange, caller.get());
                }
            } else if (segments.length == 2 && segments[1].equals("unread-count")) {
                if (allowMethods(exchange, "GET")) {
                    int count = store.unreadCount(caller.get().getId());
                    sendJson(exchange, 200, Collections.singletonMap("unread_count", count));
                }
            } else if (segments.length == 3 && segments[2].equals("read")) {
                if (allowMethods(exchange, "POST", "PUT")) {
                    handleMarkRead(exchange, caller.get(), segments[1]);
                }
            } else if (segments.length == 3 && segments[2].equals("attachments")) {
                if (allowMethods(exchange, "GET")) {
                    handleAttachmentList(exchange, caller.get(), segments[1]);
                }
            } else {
                sendJsonError(exchange, 404, "not_found", "Not found");
            }
        } catch (PersistenceException e) {
            sendJsonError(exchange, 500, "database_error", "Storage failure");
        }
    }

    private void handleInbox(HttpExchange exchange, Account caller) throws IOException, PersistenceException {
        Map<String, String> query = ApiEndpointUtils.parseQuery(exchange.getRequestURI());
        int limit = ApiEndpointUtils.intParam(query, "limit", defaultLimit, 1, maxLimit);
        int offset = ApiEndpointUtils.intParam(query, "offset", 0, 0, Integer.MAX_VALUE);
        sendJson(exchange, 200, store.getInboxRoots(caller.getId(), limit, offset));
    }

    private void handleSent(HttpExchange exchange, Account caller) throws IOException, PersistenceException {
        Map<String, String> query = ApiEndpointUtils.parseQuery(exchange.getRequestURI());
        int limit = ApiEndpointUtils.intParam(query, "limit", defaultLimit, 1, maxLimit);
        int offset = ApiEndpointUtils.intParam(query, "offset", 0, 0, Integer.MAX_VALUE);
        sendJson(exchange, 200, store.getSent(caller.getId(), limit, offset));
    }

    private void handleMarkRead(HttpExchange exchange, Account caller, String idSegment) throws IOException, PersistenceException {
        Optional<Long> id = ApiEndpointUtils.parseId(idSegment);
        if (id.isEmpty()) {
            sendJsonError(exchange, 400, "invalid_message_id", "Invalid message id");
            return;
        }

        Optional<Message> message = store.getMessage(id.get());
        if (message.isEmpty()) {
            sendJsonError(exchange, 404, "message_not_found", "Message not found");
            return;
        }
        if (message.get().getToUserId() == null || message.get().getToUserId() != caller.getId()) {
            sendJsonError(exchange, 403, "forbidden", "Only the recipient can mark a message read");
            return;
        }

        store.markRead(id.get());
        hub.notifyUnreadCount(caller.getId());
        sendJson(exchange, 200, Collections.singletonMap("status", "success"));
    }

    private void handleAttachmentList(HttpExchange exchange, Account caller, String idSegment) throws IOException, PersistenceException {
        Optional<Long> id = ApiEndpointUtils.parseId(idSegment);
        Optional<Message> message = id.isPresent() ? store.getMessage(id.get()) : Optional.empty();
        if (message.isEmpty()) {
            sendJsonError(exchange, 404, "message_not_found", "Message not found");
            return;
        }
        if (!isParticipant(message.get(), caller)) {
            sendJsonError(exchange, 403, "forbidden", "Access denied");
            return;
        }
        sendJson(exchange, 200, attachments.list(message.get().getId()));
    }

    /**
     * Handles POST /api/send.
     */
    void handleSend(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "POST")) {
            return;
        }
        Optional<Account> caller = authenticate(exchange, false);
        if (caller.isEmpty()) {
            return;
        }

        SubmitRequest request;
        List<AttachmentUpload> uploads = new ArrayList<>();
        try {
            byte[] body = ApiEndpointUtils.readBody(exchange.getRequestBody(), maxRequestBytes);
            String contentType = StringUtils.defaultString(exchange.getRequestHeaders().getFirst("Content-Type"));

            if (contentType.toLowerCase().startsWith("multipart/form-data")) {
                MultipartForm form = MultipartForm.parse(body, contentType);
                request = new SubmitRequest()
                        .setTo(form.getField("to"))
                        .setSubject(form.getField("subject"))
                        .setBody(form.getField("body"))
                        .setHtml(Boolean.parseBoolean(form.getField("is_html")))
                        .setThreadId(StringUtils.trimToNull(form.getField("thread_id")))
                        .setParentId(parseParentId(form.getField("parent_id")));
                uploads.addAll(form.getFiles("attachments"));
            } else {
                request = Json.gson().fromJson(new String(body, StandardCharsets.UTF_8), SubmitRequest.class);
                if (request == null) {
                    throw new ValidationException("invalid_json", "Request body is empty");
                }
            }
        } catch (JsonParseException e) {
            sendJsonError(exchange, 400, "invalid_json", "Invalid JSON: " + e.getMessage());
            return;
        } catch (ValidationException e) {
            sendJsonError(exchange, 400, e.getCode(), e.getMessage());
            return;
        } catch (IOException e) {
            sendJsonError(exchange, 400, "invalid_request", e.getMessage());
            return;
        }

        try {
            SubmissionResult result = submission.submit(caller.get(), request, uploads, "api");

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("message", "Message sent successfully");
            response.put("id", result.getMessage().getId());
            response.put("thread_id", result.getMessage().getThreadId());
            if (result.getAttachmentsTotal() > 0) {
                Map<String, Object> counts = new LinkedHashMap<>();
                counts.put("processed", result.getAttachmentsProcessed());
                counts.put("total", result.getAttachmentsTotal());
                response.put("attachments", counts);
            }
            if (!result.getWarnings().isEmpty()) {
                response.put("warnings", result.getWarnings());
            }
            sendJson(exchange, 200, response);
        } catch (ValidationException e) {
            sendJsonError(exchange, 400, e.getCode(), e.getMessage());
        } catch (PersistenceException e) {
            sendJsonError(exchange, 500, "database_error", "Failed to save message");
        }
    }

    private static Long parseParentId(String value) throws ValidationException {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        return ApiEndpointUtils.parseId(value.trim())
                .orElseThrow(() -> new ValidationException("invalid_parent_id", "Invalid parent id: " + value));
    }

    /**
     * Handles GET /api/threads/{threadId}.
     */
    void handleThread(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        Optional<Account> caller = authenticate(exchange, false);
        if (caller.isEmpty()) {
            return;
        }

        String threadId = StringUtils.removeStart(exchange.getRequestURI().getPath(), "/api/threads/");
        if (threadId.isBlank() || threadId.contains("/")) {
            sendJsonError(exchange, 400, "invalid_thread_id", "Invalid thread id");
            return;
        }

        try {
            List<Message> visible = store.getThread(threadId).stream()
                    .filter(m -> isParticipant(m, caller.get()))
                    .collect(Collectors.toList());
            if (visible.isEmpty()) {
                sendJsonError(exchange, 404, "thread_not_found", "Thread not found");
                return;
            }
            sendJson(exchange, 200, visible);
        } catch (PersistenceException e) {
            sendJsonError(exchange, 500, "database_error", "Storage failure");
        }
    }

    /**
     * Handles GET /api/attachments/{id}.
     */
    void handleAttachment(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        Optional<Account> caller = authenticate(exchange, false);
        if (caller.isEmpty()) {
            return;
        }

        Optional<Long> id = ApiEndpointUtils.parseId(
                StringUtils.removeStart(exchange.getRequestURI().getPath(), "/api/attachments/"));
        if (id.isEmpty()) {
            sendJsonError(exchange, 400, "invalid_attachment_id", "Invalid attachment id");
            return;
        }

        try {
            Optional<Attachment> attachment = attachments.get(id.get());
            if (attachment.isEmpty()) {
                sendJsonError(exchange, 404, "attachment_not_found", "Attachment not found");
                return;
            }
            Optional<Message> message = store.getMessage(attachment.get().getMessageId());
            if (message.isEmpty() || !isParticipant(message.get(), caller.get())) {
                sendJsonError(exchange, 403, "forbidden", "Access denied");
                return;
            }

            String name = attachment.get().getOriginalName().replace("\"", "");
            exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"" + name + "\"");
            sendBytes(exchange, 200, attachment.get().getContentType(), attachment.get().getData());
        } catch (PersistenceException e) {
            sendJsonError(exchange, 500, "database_error", "Storage failure");
        }
    }

    /**
     * Handles GET /api/sse/inbox.
     * <p>The exchange worker stays on this connection, draining the subscription until the client goes away.
     */
    void handleInboxStream(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        Optional<Account> caller = authenticate(exchange, true);
        if (caller.isEmpty()) {
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("X-Accel-Buffering", "no");
        exchange.sendResponseHeaders(200, 0);

        Subscription subscription = hub.subscribe(caller.get().getId(), new HttpEventSink(exchange));
        log.info("Event stream opened for {}", caller.get().getUsername());
        try {
            hub.greet(subscription);
        } catch (IOException e) {
            log.debug("Event stream for {} closed during greeting: {}", caller.get().getUsername(), e.getMessage());
            hub.unsubscribe(subscription);
            return;
        }

        subscription.pump();
        log.info("Event stream closed for {}", caller.get().getUsername());
    }

    /**
     * Handles POST /federation/relay.
     */
    void handleRelay(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "POST")) {
            return;
        }

        try {
            byte[] body = ApiEndpointUtils.readBody(exchange.getRequestBody(), maxRequestBytes);
            RelayMessage relayed = Json.gson().fromJson(new String(body, StandardCharsets.UTF_8), RelayMessage.class);
            Message message = submission.acceptRelayed(relayed);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("status", "delivered");
            response.put("id", message.getId());
            sendJson(exchange, 200, response);
        } catch (JsonParseException e) {
            sendJsonError(exchange, 400, "invalid_json", "Invalid JSON: " + e.getMessage());
        } catch (UnknownRecipientException e) {
            sendJsonError(exchange, 404, e.getCode(), e.getMessage());
        } catch (ValidationException e) {
            sendJsonError(exchange, 400, e.getCode(), e.getMessage());
        } catch (PersistenceException e) {
            sendJsonError(exchange, 500, "database_error", "Failed to save message");
        }
    }

    /**
     * Handles GET /metrics.
     */
    void handleMetrics(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            sendText(exchange, 503, "Metrics not initialized");
            return;
        }
        sendBytes(exchange, 200, "text/plain; version=0.0.4; charset=utf-8",
                registry.scrape().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Resolves the caller, sending 401 or 500 if that fails.
     */
    private Optional<Account> authenticate(HttpExchange exchange, boolean allowQueryToken) throws IOException {
        try {
            Optional<Account> caller = auth.authenticate(exchange, allowQueryToken);
            if (caller.isEmpty()) {
                auth.sendAuthRequired(exchange);
            }
            return caller;
        } catch (PersistenceException e) {
            sendJsonError(exchange, 500, "user_lookup_failed", "Failed to look up user");
            return Optional.empty();
        }
    }

    private static boolean isParticipant(Message message, Account account) {
        return (message.getFromUserId() != null && message.getFromUserId() == account.getId())
                || (message.getToUserId() != null && message.getToUserId() == account.getId());
    }
}
