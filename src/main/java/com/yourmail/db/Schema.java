package com.yourmail.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database schema bootstrap.
 *
 * <p>Creates tables and indexes if missing and switches the journal to WAL.
 * <p>Safe to run on every startup.
 */
public final class Schema {
    private static final Logger log = LogManager.getLogger(Schema.class);

    private static final String[] STATEMENTS = {
            "CREATE TABLE IF NOT EXISTS users ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "username TEXT UNIQUE NOT NULL, "
                    + "email TEXT UNIQUE NOT NULL, "
                    + "password_hash TEXT NOT NULL, "
                    + "created_at INTEGER NOT NULL)",

            "CREATE TABLE IF NOT EXISTS messages ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "from_user_id INTEGER, "
                    + "to_user_id INTEGER, "
                    + "from_address TEXT NOT NULL, "
                    + "to_address TEXT NOT NULL, "
                    + "subject TEXT NOT NULL, "
                    + "body TEXT NOT NULL, "
                    + "is_html INTEGER NOT NULL DEFAULT 0, "
                    + "thread_id TEXT NOT NULL, "
                    + "parent_id INTEGER, "
                    + "read_status INTEGER NOT NULL DEFAULT 0, "
                    + "created_at INTEGER NOT NULL)",

            "CREATE TABLE IF NOT EXISTS attachments ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "message_id INTEGER NOT NULL, "
                    + "filename TEXT NOT NULL, "
                    + "original_name TEXT NOT NULL, "
                    + "content_type TEXT NOT NULL, "
                    + "file_size INTEGER NOT NULL, "
                    + "file_data BLOB NOT NULL, "
                    + "created_at INTEGER NOT NULL)",

            "CREATE INDEX IF NOT EXISTS idx_messages_to_user ON messages(to_user_id)",
            "CREATE INDEX IF NOT EXISTS idx_messages_from_user ON messages(from_user_id)",
            "CREATE INDEX IF NOT EXISTS idx_messages_thread ON messages(thread_id)",
            "CREATE INDEX IF NOT EXISTS idx_messages_parent ON messages(parent_id)",
            "CREATE INDEX IF NOT EXISTS idx_messages_created ON messages(created_at)",
            "CREATE INDEX IF NOT EXISTS idx_attachments_message ON attachments(message_id)"
    };

    private Schema() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Creates the schema.
     *
     * @param dataSource DataSource instance.
     * @throws SQLException Unable to create the schema.
     */
    public static void migrate(DataSource dataSource) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode = WAL");
            for (String sql : STATEMENTS) {
                statement.execute(sql);
            }
        }
        log.info("Database schema ready");
    }
}
