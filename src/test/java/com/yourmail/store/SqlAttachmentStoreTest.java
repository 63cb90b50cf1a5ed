package com.yourmail.store;

import com.yourmail.db.TestDatabase;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlAttachmentStoreTest {

    @TempDir
    Path dir;

    private HikariDataSource dataSource;
    private SqlThreadStore messages;
    private SqlAttachmentStore attachments;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestDatabase.create(dir);
        messages = new SqlThreadStore(dataSource);
        attachments = new SqlAttachmentStore(dataSource,
                Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    private Message message() throws PersistenceException {
        return messages.createMessage(new MessageDraft()
                .setFromUserId(1L)
                .setToUserId(2L)
                .setFrom("alice@example.test")
                .setTo("bob@example.test")
                .setSubject("Files")
                .setBody("See attached"));
    }

    @Test
    void saveAndLoad() throws PersistenceException {
        Message message = message();
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);

        Attachment saved = attachments.save(message.getId(), "notes.txt", "text/plain", data);
        assertEquals("1704067200_notes.txt", saved.getFilename());
        assertEquals(5, saved.getSize());

        Attachment loaded = attachments.get(saved.getId()).orElseThrow();
        assertEquals("notes.txt", loaded.getOriginalName());
        assertEquals("text/plain", loaded.getContentType());
        assertArrayEquals(data, loaded.getData());

        assertEquals(1, messages.getMessage(message.getId()).orElseThrow().getAttachmentCount());
    }

    @Test
    void defaultsContentType() throws PersistenceException {
        Message message = message();
        Attachment saved = attachments.save(message.getId(), "blob", null, new byte[]{1, 2, 3});
        assertEquals("application/octet-stream", saved.getContentType());
    }

    @Test
    void listOmitsData() throws PersistenceException {
        Message message = message();
        attachments.save(message.getId(), "a.txt", "text/plain", new byte[]{1});
        attachments.save(message.getId(), "b.txt", "text/plain", new byte[]{2});

        List<Attachment> list = attachments.list(message.getId());
        assertEquals(2, list.size());
        assertEquals("a.txt", list.get(0).getOriginalName());
        assertNull(list.get(0).getData());
    }

    @Test
    void missingAttachment() throws PersistenceException {
        assertTrue(attachments.get(42L).isEmpty());
        assertTrue(attachments.list(42L).isEmpty());
    }
}
