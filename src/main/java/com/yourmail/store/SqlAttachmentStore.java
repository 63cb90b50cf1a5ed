package com.yourmail.store;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQL backed attachment store.
 *
 * <p>Bytes live in a BLOB column next to their metadata.
 */
public class SqlAttachmentStore implements AttachmentStore {
    private static final Logger log = LogManager.getLogger(SqlAttachmentStore.class);

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private static final String COLUMNS = "id, message_id, filename, original_name, content_type, file_size, created_at";

    private final DataSource dataSource;
    private final Clock clock;

    public SqlAttachmentStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public SqlAttachmentStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Attachment save(long messageId, String originalName, String contentType, byte[] data) throws PersistenceException {
        Instant now = clock.instant();
        String name = StringUtils.defaultIfBlank(originalName, "attachment");
        String type = StringUtils.defaultIfBlank(contentType, DEFAULT_CONTENT_TYPE);
        String filename = now.getEpochSecond() + "_" + name;

        try (Connection c = dataSource.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("INSERT INTO attachments "
                    + "(message_id, filename, original_name, content_type, file_size, file_data, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                ps.setLong(1, messageId);
                ps.setString(2, filename);
                ps.setString(3, name);
                ps.setString(4, type);
                ps.setLong(5, data.length);
                ps.setBytes(6, data);
                ps.setLong(7, now.toEpochMilli());
                ps.executeUpdate();
            }

            long id;
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                id = rs.getLong(1);
            }

            log.debug("Stored attachment id={} message={} name={} bytes={}", id, messageId, name, data.length);
            return new Attachment()
                    .setId(id)
                    .setMessageId(messageId)
                    .setFilename(filename)
                    .setOriginalName(name)
                    .setContentType(type)
                    .setSize(data.length)
                    .setCreatedAt(Instant.ofEpochMilli(now.toEpochMilli()));
        } catch (SQLException e) {
            log.error("Unable to store attachment {} for message {}: {}", name, messageId, e.getMessage());
            throw new PersistenceException("Unable to store attachment " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Attachment> list(long messageId) throws PersistenceException {
        List<Attachment> attachments = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS
                     + " FROM attachments WHERE message_id = ? ORDER BY id")) {
            ps.setLong(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    attachments.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to list attachments for message " + messageId, e);
        }
        return attachments;
    }

    @Override
    public Optional<Attachment> get(long id) throws PersistenceException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS
                     + ", file_data FROM attachments WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs).setData(rs.getBytes("file_data")));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to load attachment " + id, e);
        }
    }

    private static Attachment map(ResultSet rs) throws SQLException {
        return new Attachment()
                .setId(rs.getLong("id"))
                .setMessageId(rs.getLong("message_id"))
                .setFilename(rs.getString("filename"))
                .setOriginalName(rs.getString("original_name"))
                .setContentType(rs.getString("content_type"))
                .setSize(rs.getLong("file_size"))
                .setCreatedAt(Instant.ofEpochMilli(rs.getLong("created_at")));
    }
}
