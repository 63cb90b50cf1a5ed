package com.yourmail.main;

import com.yourmail.config.server.ServerConfig;
import com.yourmail.db.Schema;
import com.yourmail.db.SharedDataSource;
import com.yourmail.delivery.MessageSubmission;
import com.yourmail.endpoints.ApiEndpoint;
import com.yourmail.endpoints.HttpAuth;
import com.yourmail.hub.FanoutHub;
import com.yourmail.identity.ConfigTokenVerifier;
import com.yourmail.identity.SqlIdentityResolver;
import com.yourmail.metrics.MailMetrics;
import com.yourmail.metrics.MetricsRegistry;
import com.yourmail.relay.RelayClient;
import com.yourmail.session.SessionContext;
import com.yourmail.session.SessionListener;
import com.yourmail.store.PersistenceException;
import com.yourmail.store.SqlAttachmentStore;
import com.yourmail.store.SqlThreadStore;
import com.zaxxer.hikari.HikariDataSource;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.sql.SQLException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main server class for the YourMail server.
 *
 * <p>Loads configuration, migrates the database, seeds accounts and wires the shared services.
 * <br>Then starts the session protocol listener and the HTTP API.
 *
 * <p>The server is started by calling the static {@link #run(String)} method with the path
 * to the configuration directory.
 *
 * @see SessionListener
 * @see ApiEndpoint
 * @see Foundation
 */
public class Server extends Foundation {

    private static SessionListener listener;
    private static ExecutorService listenerExecutor;
    private static ApiEndpoint api;
    private static FanoutHub hub;

    /**
     * Initializes and starts the server.
     *
     * @param path The directory path containing the configuration files.
     * @throws ConfigurationException If there is an issue with the configuration or startup.
     */
    public static void run(String path) throws ConfigurationException {
        init(path); // Initialize foundation configuration.
        registerShutdownHook(); // Register shutdown hook for graceful termination.

        ServerConfig serverConfig = Config.getServer();

        MetricsRegistry.initialize();
        MailMetrics.initialize();

        HikariDataSource dataSource = SharedDataSource.getDataSource();
        SqlIdentityResolver identities = new SqlIdentityResolver(dataSource, serverConfig.getHostname());
        try {
            Schema.migrate(dataSource);
            identities.seed(serverConfig.getUsers().getList());
        } catch (SQLException | PersistenceException e) {
            log.fatal("Unable to prepare database: {}", e.getMessage());
            throw new ConfigurationException("Unable to prepare database: " + e.getMessage());
        }

        SqlThreadStore store = new SqlThreadStore(dataSource);
        SqlAttachmentStore attachments = new SqlAttachmentStore(dataSource);

        hub = new FanoutHub(serverConfig.getHub(), store);
        hub.start();

        RelayClient relay = null;
        if (serverConfig.getRelay().isEnabled()) {
            relay = new RelayClient(serverConfig.getHostname(), serverConfig.getRelay());
        } else {
            log.info("Relay disabled, non-local recipients will only be stored");
        }

        MessageSubmission submission = new MessageSubmission(identities, store, attachments, hub, relay,
                serverConfig.getMaxAttachmentBytes());

        // Session protocol listener.
        if (serverConfig.getSessionPort() != 0) {
            listener = new SessionListener(
                    serverConfig.getSessionPort(),
                    serverConfig.getBind(),
                    serverConfig.getListener(),
                    new SessionContext(serverConfig.getHostname(), identities, store, submission)
            );
            listenerExecutor = Executors.newSingleThreadExecutor();
            listenerExecutor.submit(listener::listen);
        }

        // HTTP API.
        try {
            HttpAuth auth = new HttpAuth(identities,
                    new ConfigTokenVerifier(serverConfig.getUsers().getTokens(), identities),
                    serverConfig.getHostname());
            api = new ApiEndpoint(submission, store, attachments, hub, auth,
                    serverConfig.getMaxAttachmentBytes() * 2);
            api.start(serverConfig.getApi());
        } catch (IOException e) {
            log.fatal("Unable to start API endpoint: {}", e.getMessage());
            throw new ConfigurationException("Unable to start API endpoint: " + e.getMessage());
        }

        log.info("YourMail started for {}", serverConfig.getHostname());
    }

    /**
     * Registers a shutdown hook to ensure graceful termination of the server.
     */
    private static void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(Server::shutdown));
    }

    /**
     * Stops listener, API, hub and database pool in that order.
     */
    static void shutdown() {
        log.info("Service is shutting down.");

        if (listener != null) {
            try {
                listener.serverShutdown();
            } catch (IOException e) {
                log.error("Error shutting down listener on port {}: {}", listener.getPort(), e.getMessage());
            }
        }

        if (listenerExecutor != null) {
            listenerExecutor.shutdown();
            try {
                if (!listenerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    listenerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                listenerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        if (api != null) {
            api.stop(1);
        }
        if (hub != null) {
            hub.close();
        }
        SharedDataSource.close();

        log.info("Shutdown complete.");
    }
}
