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
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQL backed thread store.
 *
 * <p>Creation runs in a single transaction so a failed create leaves nothing behind.
 * <p>Inbox roots are computed per query from the messages table, nothing is cached.
 */
public class SqlThreadStore implements ThreadStore {
    private static final Logger log = LogManager.getLogger(SqlThreadStore.class);

    private static final String SELECT = "SELECT m.id, m.from_user_id, m.to_user_id, m.from_address, m.to_address, "
            + "m.subject, m.body, m.is_html, m.thread_id, m.parent_id, m.read_status, m.created_at, "
            + "(SELECT COUNT(*) FROM attachments a WHERE a.message_id = m.id) AS attachment_count "
            + "FROM messages m ";

    private static final String INSERT = "INSERT INTO messages (from_user_id, to_user_id, from_address, to_address, "
            + "subject, body, is_html, thread_id, parent_id, read_status, created_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?)";

    private static final String INBOX_ROOTS = "SELECT r.rep_id, r.thread_id FROM ("
            + "SELECT m.thread_id, MIN(m.id) AS rep_id, "
            + "(SELECT MAX(t.created_at) FROM messages t WHERE t.thread_id = m.thread_id) AS last_activity "
            + "FROM messages m WHERE m.to_user_id = ? GROUP BY m.thread_id) r "
            + "ORDER BY r.last_activity DESC, r.rep_id DESC LIMIT ? OFFSET ?";

    private final DataSource dataSource;
    private final Clock clock;

    /**
     * Constructs a new SqlThreadStore instance.
     *
     * @param dataSource DataSource instance.
     */
    public SqlThreadStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    /**
     * Constructs a new SqlThreadStore instance with given clock.
     *
     * @param dataSource DataSource instance.
     * @param clock      Clock used for creation times.
     */
    public SqlThreadStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Message createMessage(MessageDraft draft) throws PersistenceException {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                String threadId = resolveThreadId(c, draft);
                long id = insert(c, draft, threadId);
                Message message = load(c, id)
                        .orElseThrow(() -> new SQLException("Inserted message " + id + " not found"));
                c.commit();

                log.debug("Stored message id={} thread={} parent={}", id, threadId, draft.getParentId());
                return message;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Unable to store message to {}: {}", draft.getTo(), e.getMessage());
            throw new PersistenceException("Unable to store message: " + e.getMessage(), e);
        }
    }

    /**
     * Decides the thread of a new message.
     * <p>An existing parent wins over any supplied thread id.
     */
    private String resolveThreadId(Connection c, MessageDraft draft) throws SQLException {
        String hint = StringUtils.trimToNull(draft.getThreadId());
        Long parentId = draft.getParentId();

        if (parentId == null) {
            return hint != null ? hint : ThreadIds.next();
        }

        Optional<String> parentThread = parentThreadId(c, parentId);
        if (parentThread.isPresent()) {
            if (hint != null && !hint.equals(parentThread.get())) {
                log.warn("Thread id {} does not match parent {} thread {}, using parent thread",
                        hint, parentId, parentThread.get());
            }
            return parentThread.get();
        }

        log.warn("Parent message {} not found, accepting as dangling reply", parentId);
        return hint != null ? hint : ThreadIds.next();
    }

    private Optional<String> parentThreadId(Connection c, long parentId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT thread_id FROM messages WHERE id = ?")) {
            ps.setLong(1, parentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    private long insert(Connection c, MessageDraft draft, String threadId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT)) {
            setNullableLong(ps, 1, draft.getFromUserId());
            setNullableLong(ps, 2, draft.getToUserId());
            ps.setString(3, draft.getFrom());
            ps.setString(4, draft.getTo());
            ps.setString(5, StringUtils.defaultString(draft.getSubject()));
            ps.setString(6, StringUtils.defaultString(draft.getBody()));
            ps.setInt(7, draft.isHtml() ? 1 : 0);
            ps.setString(8, threadId);
            setNullableLong(ps, 9, draft.getParentId());
            ps.setLong(10, clock.instant().toEpochMilli());
            ps.executeUpdate();
        }

        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("No row id after insert");
            }
            return rs.getLong(1);
        }
    }

    @Override
    public Optional<Message> getMessage(long id) throws PersistenceException {
        try (Connection c = dataSource.getConnection()) {
            return load(c, id);
        } catch (SQLException e) {
            throw failure("load message " + id, e);
        }
    }

    @Override
    public List<Message> getThread(String threadId) throws PersistenceException {
        try (Connection c = dataSource.getConnection()) {
            return thread(c, threadId);
        } catch (SQLException e) {
            throw failure("load thread " + threadId, e);
        }
    }

    @Override
    public List<Message> getInboxRoots(long accountId, int limit, int offset) throws PersistenceException {
        List<Message> roots = new ArrayList<>();
        try (Connection c = dataSource.getConnection()) {
            List<Long> reps = new ArrayList<>();
            List<String> threads = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(INBOX_ROOTS)) {
                ps.setLong(1, accountId);
                ps.setInt(2, limit);
                ps.setInt(3, offset);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        reps.add(rs.getLong("rep_id"));
                        threads.add(rs.getString("thread_id"));
                    }
                }
            }

            for (int i = 0; i < reps.size(); i++) {
                long repId = reps.get(i);
                List<Message> members = thread(c, threads.get(i));

                Message root = null;
                List<Message> replies = new ArrayList<>();
                for (Message member : members) {
                    if (member.getId() == repId) {
                        root = member;
                    } else {
                        replies.add(member);
                    }
                }

                if (root == null) {
                    log.warn("Inbox representative {} vanished from thread {}", repId, threads.get(i));
                    continue;
                }
                if (members.size() > 1) {
                    root.setReplies(replies);
                }
                roots.add(root);
            }
        } catch (SQLException e) {
            throw failure("load inbox for account " + accountId, e);
        }
        return roots;
    }

    @Override
    public List<Message> getSent(long accountId, int limit, int offset) throws PersistenceException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(SELECT
                     + "WHERE m.from_user_id = ? ORDER BY m.created_at DESC, m.id DESC LIMIT ? OFFSET ?")) {
            ps.setLong(1, accountId);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            return list(ps);
        } catch (SQLException e) {
            throw failure("load sent for account " + accountId, e);
        }
    }

    @Override
    public boolean markRead(long id) throws PersistenceException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE messages SET read_status = 1 WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("mark message " + id + " read", e);
        }
    }

    @Override
    public int unreadCount(long accountId) throws PersistenceException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(*) FROM messages WHERE to_user_id = ? AND read_status = 0")) {
            ps.setLong(1, accountId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw failure("count unread for account " + accountId, e);
        }
    }

    private Optional<Message> load(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT + "WHERE m.id = ?")) {
            ps.setLong(1, id);
            List<Message> found = list(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        }
    }

    private List<Message> thread(Connection c, String threadId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT
                + "WHERE m.thread_id = ? ORDER BY m.created_at ASC, m.id ASC")) {
            ps.setString(1, threadId);
            return list(ps);
        }
    }

    private List<Message> list(PreparedStatement ps) throws SQLException {
        List<Message> messages = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                messages.add(map(rs));
            }
        }
        return messages;
    }

    private static Message map(ResultSet rs) throws SQLException {
        return new Message()
                .setId(rs.getLong("id"))
                .setFromUserId(getNullableLong(rs, "from_user_id"))
                .setToUserId(getNullableLong(rs, "to_user_id"))
                .setFrom(rs.getString("from_address"))
                .setTo(rs.getString("to_address"))
                .setSubject(rs.getString("subject"))
                .setBody(rs.getString("body"))
                .setHtml(rs.getInt("is_html") != 0)
                .setThreadId(rs.getString("thread_id"))
                .setParentId(getNullableLong(rs, "parent_id"))
                .setRead(rs.getInt("read_status") != 0)
                .setCreatedAt(Instant.ofEpochMilli(rs.getLong("created_at")).truncatedTo(ChronoUnit.MILLIS))
                .setAttachmentCount(rs.getInt("attachment_count"));
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static PersistenceException failure(String action, SQLException e) {
        log.error("Unable to {}: {}", action, e.getMessage());
        return new PersistenceException("Unable to " + action + ": " + e.getMessage(), e);
    }
}
