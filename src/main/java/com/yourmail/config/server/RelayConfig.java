package com.yourmail.config.server;

import com.yourmail.config.BasicConfig;

import java.util.Map;

/**
 * Relay client configuration.
 *
 * <p>Controls where and how outbound relay requests are made to other servers.
 */
public class RelayConfig extends BasicConfig {

    /**
     * Constructs a new RelayConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public RelayConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Is relay enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets remote relay endpoint port.
     *
     * @return Port number.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 8080L));
    }

    /**
     * Gets URL scheme.
     *
     * @return Scheme, http by default.
     */
    public String getScheme() {
        return getStringProperty("scheme", "http");
    }

    /**
     * Gets connect, read and write timeout.
     *
     * @return Time in seconds.
     */
    public int getTimeoutSeconds() {
        return Math.toIntExact(getLongProperty("timeoutSeconds", 10L));
    }
}
