package com.yourmail.config.server;

import com.yourmail.config.BasicConfig;

import java.util.Map;

/**
 * Database configuration.
 *
 * <p>The thread store, identities and attachments share one SQLite database.
 */
public class DatabaseConfig extends BasicConfig {

    /**
     * Constructs a new DatabaseConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public DatabaseConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets JDBC URL.
     *
     * @return JDBC URL string.
     */
    public String getJdbcUrl() {
        return getStringProperty("jdbcUrl", "jdbc:sqlite:yourmail.db");
    }

    /**
     * Gets maximum pool size.
     *
     * @return Pool size.
     */
    public int getMaximumPoolSize() {
        return Math.toIntExact(getLongProperty("maximumPoolSize", 8L));
    }

    /**
     * Gets busy timeout for locked database writes.
     *
     * @return Time in milliseconds.
     */
    public long getBusyTimeout() {
        return getLongProperty("busyTimeout", 5000L);
    }
}
