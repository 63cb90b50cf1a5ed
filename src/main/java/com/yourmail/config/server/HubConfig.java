package com.yourmail.config.server;

import com.yourmail.config.BasicConfig;

import java.util.Map;

/**
 * Fan-out hub configuration.
 */
public class HubConfig extends BasicConfig {

    /**
     * Constructs a new HubConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public HubConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets the liveness sweep interval.
     *
     * @return Time in seconds.
     */
    public long getKeepaliveSeconds() {
        return getLongProperty("keepaliveSeconds", 30L);
    }

    /**
     * Gets the per subscription event queue capacity.
     * <p>A subscriber that falls this far behind is dropped.
     *
     * @return Queue capacity.
     */
    public int getQueueCapacity() {
        return Math.toIntExact(getLongProperty("queueCapacity", 256L));
    }

    /**
     * Gets the dispatch pool size used for derived notifications.
     *
     * @return Thread count.
     */
    public int getDispatchThreads() {
        return Math.toIntExact(getLongProperty("dispatchThreads", 2L));
    }

    /**
     * Gets the dispatch pool queue capacity.
     *
     * @return Queue capacity.
     */
    public int getDispatchQueueCapacity() {
        return Math.toIntExact(getLongProperty("dispatchQueueCapacity", 1000L));
    }

    /**
     * Gets how long shutdown waits for pending dispatch work.
     *
     * @return Time in seconds.
     */
    public long getShutdownSeconds() {
        return getLongProperty("shutdownSeconds", 5L);
    }
}
