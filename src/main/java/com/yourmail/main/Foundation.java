package com.yourmail.main;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration bootstrap shared by runnables.
 */
public abstract class Foundation {

    /**
     * Logger instance.
     */
    protected static final Logger log = LogManager.getLogger(Foundation.class);

    /**
     * Server configuration file name.
     */
    public static final String SERVER_FILE = "server.json5";

    /**
     * Loads configuration from directory.
     *
     * @param path Directory path.
     * @throws ConfigurationException Missing directory or unreadable configuration.
     */
    public static void init(String path) throws ConfigurationException {
        Path dir = Paths.get(path);
        if (!Files.isDirectory(dir)) {
            throw new ConfigurationException("Configuration directory not found: " + path);
        }

        Path file = dir.resolve(SERVER_FILE);
        if (!Files.isReadable(file)) {
            throw new ConfigurationException("Server configuration not found: " + file);
        }

        try {
            Config.initServer(file.toString());
        } catch (IOException e) {
            log.error("Unable to read {}: {}", file, e.getMessage());
            throw new ConfigurationException("Unable to read " + file + ": " + e.getMessage());
        }
    }
}
