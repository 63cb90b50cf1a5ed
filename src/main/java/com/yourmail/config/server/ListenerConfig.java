package com.yourmail.config.server;

import com.yourmail.config.BasicConfig;

import java.util.Map;

/**
 * Listener configuration for the session protocol port.
 *
 * <p>This class provides type safe access to listener thread pool and socket settings.
 */
public class ListenerConfig extends BasicConfig {

    /**
     * Constructs a new ListenerConfig instance.
     */
    public ListenerConfig() {
        super();
    }

    /**
     * Constructs a new ListenerConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ListenerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets backlog size.
     *
     * @return Backlog size.
     */
    public int getBacklog() {
        return Math.toIntExact(getLongProperty("backlog", 25L));
    }

    /**
     * Gets minimum pool size.
     *
     * @return Thread pool min size.
     */
    public int getMinimumPoolSize() {
        return Math.toIntExact(getLongProperty("minimumPoolSize", 1L));
    }

    /**
     * Gets maximum pool size.
     *
     * @return Thread pool max size.
     */
    public int getMaximumPoolSize() {
        return Math.toIntExact(getLongProperty("maximumPoolSize", 50L));
    }

    /**
     * Gets thread keep alive time.
     *
     * @return Time in seconds.
     */
    public int getThreadKeepAliveTime() {
        return Math.toIntExact(getLongProperty("threadKeepAliveTime", 60L));
    }

    /**
     * Gets socket read timeout.
     * <p>Idle sessions are closed after this many seconds, 0 waits forever.
     *
     * @return Time in seconds.
     */
    public int getReadTimeout() {
        return Math.toIntExact(getLongProperty("readTimeout", 300L));
    }

    /**
     * Gets transactions limit.
     * <p>This defines how many commands will be processed before breaking the session loop.
     *
     * @return Transactions limit.
     */
    public int getTransactionsLimit() {
        return Math.toIntExact(getLongProperty("transactionsLimit", 1000L));
    }
}
