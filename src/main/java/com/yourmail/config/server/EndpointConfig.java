package com.yourmail.config.server;

import com.yourmail.config.BasicConfig;

import java.util.Map;

/**
 * HTTP endpoint configuration.
 *
 * <p>This class provides type safe access to the API endpoint port and settings.
 * <p>Caller identity is resolved per request, see {@code HttpAuth}.
 */
public class EndpointConfig extends BasicConfig {

    /**
     * Constructs a new EndpointConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets the port number for this endpoint.
     *
     * @param defaultPort Default port to use if not configured.
     * @return Port number.
     */
    public int getPort(int defaultPort) {
        return Math.toIntExact(getLongProperty("port", (long) defaultPort));
    }

    /**
     * Gets the socket backlog for the embedded HTTP server.
     *
     * @return Backlog size.
     */
    public int getBacklog() {
        return Math.toIntExact(getLongProperty("backlog", 10L));
    }

    /**
     * Gets the default page size for inbox and sent listings.
     *
     * @return Page size.
     */
    public int getDefaultLimit() {
        return Math.toIntExact(getLongProperty("defaultLimit", 50L));
    }

    /**
     * Gets the largest page size a caller may request.
     *
     * @return Page size.
     */
    public int getMaxLimit() {
        return Math.toIntExact(getLongProperty("maxLimit", 100L));
    }
}
