package com.yourmail.relay;

import com.yourmail.config.server.RelayConfig;
import com.yourmail.metrics.MailMetrics;
import com.yourmail.util.Json;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort relay to other servers.
 *
 * <p>Each call makes at most one HTTP POST with bounded timeouts.
 * <br>Failures are returned, never thrown, and never retried.
 */
public class RelayClient {
    private static final Logger log = LogManager.getLogger(RelayClient.class);

    private static final MediaType APPLICATION_JSON = MediaType.parse("application/json; charset=utf-8");
    static final String RELAY_PATH = "federation/relay";

    private final String hostname;
    private final String scheme;
    private final int port;
    private final OkHttpClient httpClient;
    private final Clock clock;

    /**
     * Constructs a new RelayClient instance.
     *
     * @param hostname This server's hostname.
     * @param config   Relay configuration.
     */
    public RelayClient(String hostname, RelayConfig config) {
        this(hostname, config, Clock.systemUTC());
    }

    /**
     * Constructs a new RelayClient instance with given clock.
     *
     * @param hostname This server's hostname.
     * @param config   Relay configuration.
     * @param clock    Clock used for payload timestamps.
     */
    public RelayClient(String hostname, RelayConfig config, Clock clock) {
        this.hostname = hostname;
        this.scheme = config.getScheme();
        this.port = config.getPort();
        this.clock = clock;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(config.getTimeoutSeconds() * 2L, TimeUnit.SECONDS)
                .build();
        log.debug("Relay client initialized for {}://<host>:{}", scheme, port);
    }

    /**
     * Relays a message to another server.
     *
     * @param from       Sender address.
     * @param to         Recipient address.
     * @param subject    Subject.
     * @param body       Body.
     * @param targetHost Recipient domain.
     * @return RelayResult.
     */
    public RelayResult sendMessage(String from, String to, String subject, String body, String targetHost) {
        if (targetHost == null || targetHost.isBlank()) {
            return RelayResult.failure("No target host");
        }
        if (targetHost.equalsIgnoreCase(hostname)) {
            log.debug("Relay target {} is this server, skipping", targetHost);
            return RelayResult.local();
        }

        HttpUrl url;
        try {
            url = new HttpUrl.Builder()
                    .scheme(scheme)
                    .host(targetHost)
                    .port(port)
                    .addPathSegments(RELAY_PATH)
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid relay target {}: {}", targetHost, e.getMessage());
            MailMetrics.incrementRelay("failure");
            return RelayResult.failure("Invalid relay target " + targetHost);
        }

        RelayMessage payload = new RelayMessage(from, to, subject, body, clock.instant());
        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(Json.toJson(payload), APPLICATION_JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                log.info("Relayed message to {} via {}", to, url);
                MailMetrics.incrementRelay("success");
                return RelayResult.delivered();
            }

            log.warn("Relay to {} rejected with status {}", url, response.code());
            MailMetrics.incrementRelay("failure");
            return RelayResult.failure("Relay server returned status " + response.code());
        } catch (IOException e) {
            log.warn("Relay to {} failed: {}", url, e.getMessage());
            MailMetrics.incrementRelay("failure");
            return RelayResult.failure("Relay failed: " + e.getMessage());
        }
    }
}
