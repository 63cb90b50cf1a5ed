package com.yourmail.main;

import com.yourmail.config.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>ServerConfig holds listener, API, database, relay, hub and seed user settings.
 *
 * @see ServerConfig
 */
public class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Server configuration.
     */
    private static ServerConfig server = new ServerConfig();

    /**
     * Gets server config.
     *
     * @return ServerConfig.
     */
    public static ServerConfig getServer() {
        return server;
    }

    /**
     * Init server config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initServer(String path) throws IOException {
        server = new ServerConfig(path);
        log.debug("Loaded server file: {}", path);
    }

    /**
     * Replaces server config.
     *
     * @param config ServerConfig instance.
     */
    public static void setServer(ServerConfig config) {
        server = config;
    }
}
