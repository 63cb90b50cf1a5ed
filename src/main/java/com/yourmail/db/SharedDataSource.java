package com.yourmail.db;

import com.yourmail.config.server.DatabaseConfig;
import com.yourmail.main.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SharedDataSource provides a lazily-initialized HikariDataSource singleton based on
 * the database section of the server configuration.
 *
 * <p>Usage: call SharedDataSource.getDataSource() to obtain the shared HikariDataSource.
 * Call SharedDataSource.close() on shutdown to release resources.
 */
public final class SharedDataSource {
    private static final Logger log = LogManager.getLogger(SharedDataSource.class);
    private static volatile HikariDataSource ds;

    private SharedDataSource() {
        // static utility
    }

    public static synchronized HikariDataSource getDataSource() {
        if (ds == null) {
            try {
                ds = create(Config.getServer().getDatabase());
            } catch (Exception e) {
                log.error("Failed to initialize shared datasource: {}", e.getMessage());
                throw e;
            }
        }
        return ds;
    }

    /**
     * Builds a new pool for the given database settings.
     * <p>Each pooled connection gets the busy timeout so concurrent writers wait instead of failing.
     * <br>Transactions begin IMMEDIATE so a read inside a write transaction never has to upgrade its lock.
     *
     * @param config Database configuration.
     * @return HikariDataSource instance.
     */
    public static HikariDataSource create(DatabaseConfig config) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(config.getJdbcUrl());
        cfg.setMaximumPoolSize(config.getMaximumPoolSize());
        cfg.setConnectionInitSql("PRAGMA busy_timeout = " + config.getBusyTimeout());
        cfg.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        cfg.setPoolName("YourMailPool");

        HikariDataSource dataSource = new HikariDataSource(cfg);
        log.info("Initialized HikariDataSource: {}", config.getJdbcUrl());
        return dataSource;
    }

    public static synchronized void close() {
        if (ds != null) {
            try {
                ds.close();
                log.info("Closed shared HikariDataSource");
            } catch (Exception e) {
                log.warn("Error closing shared DataSource: {}", e.getMessage());
            } finally {
                ds = null;
            }
        }
    }
}
