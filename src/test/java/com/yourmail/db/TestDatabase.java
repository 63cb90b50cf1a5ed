package com.yourmail.db;

import com.yourmail.config.server.DatabaseConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * File backed SQLite pools for tests.
 */
public final class TestDatabase {

    private TestDatabase() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Creates a migrated pool under the given directory.
     *
     * @param dir Temporary directory.
     * @return HikariDataSource instance.
     * @throws SQLException Migration failure.
     */
    public static HikariDataSource create(Path dir) throws SQLException {
        Map<String, Object> map = new HashMap<>();
        map.put("jdbcUrl", "jdbc:sqlite:" + dir.resolve("test.db"));
        map.put("maximumPoolSize", 4);

        HikariDataSource dataSource = SharedDataSource.create(new DatabaseConfig(map));
        Schema.migrate(dataSource);
        return dataSource;
    }

    /**
     * Clock that moves one second forward on every read.
     */
    public static class TickingClock extends Clock {
        private final AtomicLong seconds;

        public TickingClock(Instant start) {
            this.seconds = new AtomicLong(start.getEpochSecond());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochSecond(seconds.getAndIncrement());
        }
    }
}
