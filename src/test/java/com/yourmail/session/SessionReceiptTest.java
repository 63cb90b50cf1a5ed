package com.yourmail.session;

import com.yourmail.config.server.UserConfig;
import com.yourmail.db.TestDatabase;
import com.yourmail.delivery.MessageSubmission;
import com.yourmail.hub.FanoutHub;
import com.yourmail.config.server.HubConfig;
import com.yourmail.identity.SqlIdentityResolver;
import com.yourmail.session.connection.ConnectionMock;
import com.yourmail.store.Message;
import com.yourmail.store.MessageDraft;
import com.yourmail.store.SqlAttachmentStore;
import com.yourmail.store.SqlThreadStore;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionReceiptTest {

    @TempDir
    Path dir;

    private HikariDataSource dataSource;
    private SqlThreadStore store;
    private FanoutHub hub;
    private SessionContext context;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestDatabase.create(dir);
        SqlIdentityResolver identities = new SqlIdentityResolver(dataSource, "example.test");
        identities.seed(List.of(
                new UserConfig(Map.of("name", "alice", "pass", "alice123")),
                new UserConfig(Map.of("name", "bob", "pass", "bob123")),
                new UserConfig(Map.of("name", "dave", "pass", "correct horse battery"))
        ));

        store = new SqlThreadStore(dataSource, new TestDatabase.TickingClock(Instant.parse("2024-03-01T08:30:00Z")));
        hub = new FanoutHub(new HubConfig(new HashMap<>()), store);
        MessageSubmission submission = new MessageSubmission(identities, store, new SqlAttachmentStore(dataSource),
                hub, null, 1024);
        context = new SessionContext("example.test", identities, store, submission);
    }

    @AfterEach
    void tearDown() {
        hub.close();
        dataSource.close();
    }

    private List<String> run(String... lines) {
        ConnectionMock connection = new ConnectionMock(context, lines);
        new SessionReceipt(connection).run();
        return connection.getLines();
    }

    @Test
    void greetingAndQuit() {
        List<String> out = run("QUIT", "HELP");

        assertEquals(List.of("220 example.test YourMail ready", "221 Goodbye"), out);
    }

    @Test
    void unknownCommandKeepsSession() {
        List<String> out = run("FOO bar", "", "quit");

        assertEquals("500 Unknown command: FOO", out.get(1));
        assertEquals("221 Goodbye", out.get(2));
    }

    @Test
    void authenticationRequired() {
        List<String> out = run("SEND bob@example.test", "LIST", "READ 1", "QUIT");

        assertEquals(ProtocolResponses.AUTH_REQUIRED_530, out.get(1));
        assertEquals(ProtocolResponses.AUTH_REQUIRED_530, out.get(2));
        assertEquals(ProtocolResponses.AUTH_REQUIRED_530, out.get(3));
    }

    @Test
    void connect() {
        List<String> out = run("CONNECT alice", "CONNECT alice nope", "CONNECT alice alice123", "QUIT");

        assertEquals(ProtocolResponses.CONNECT_USAGE_501, out.get(1));
        assertEquals("535 Authentication failed", out.get(2));
        assertEquals("250 Hello alice, authenticated", out.get(3));
    }

    @Test
    void connectPasswordWithSpaces() {
        List<String> out = run("CONNECT dave correct horse", "CONNECT dave correct horse battery", "QUIT");

        assertEquals("535 Authentication failed", out.get(1));
        assertEquals("250 Hello dave, authenticated", out.get(2));
    }

    @Test
    void composeAndSend() throws Exception {
        List<String> out = run(
                "CONNECT alice alice123",
                "SEND bob@example.test",
                "SUBJECT Lunch plans",
                "BODY See you at noon",
                "QUIT");

        assertEquals("250 Recipient set to bob@example.test", out.get(2));
        assertEquals("250 Subject set", out.get(3));
        assertTrue(out.get(4).matches("250 \\d+"), out.get(4));

        long id = Long.parseLong(out.get(4).substring(4));
        Message stored = store.getMessage(id).orElseThrow();
        assertEquals("alice@example.test", stored.getFrom());
        assertEquals("bob@example.test", stored.getTo());
        assertEquals("Lunch plans", stored.getSubject());
        assertEquals("See you at noon", stored.getBody());
        assertNotNull(stored.getToUserId());
    }

    @Test
    void outOfOrderCommands() {
        List<String> out = run(
                "CONNECT alice alice123",
                "SUBJECT Early",
                "BODY Early",
                "SEND bob@example.test",
                "BODY Still early",
                "SUBJECT",
                "QUIT");

        assertEquals(ProtocolResponses.NEED_RECIPIENT_503, out.get(2));
        assertEquals(ProtocolResponses.NEED_SUBJECT_503, out.get(3));
        assertEquals(ProtocolResponses.NEED_SUBJECT_503, out.get(5));
        assertEquals(ProtocolResponses.SUBJECT_USAGE_501, out.get(6));
    }

    @Test
    void composeResetsAfterBody() {
        List<String> out = run(
                "CONNECT alice alice123",
                "SEND bob@example.test",
                "SUBJECT One",
                "BODY First",
                "BODY Second",
                "QUIT");

        assertEquals(ProtocolResponses.NEED_SUBJECT_503, out.get(5));
    }

    @Test
    void invalidRecipient() {
        List<String> out = run("CONNECT alice alice123", "SEND", "SEND nobody", "QUIT");

        assertEquals(ProtocolResponses.SEND_USAGE_501, out.get(2));
        assertEquals("501 Invalid recipient address: nobody", out.get(3));
    }

    @Test
    void listAndRead() throws Exception {
        store.createMessage(new MessageDraft()
                .setFromUserId(1L)
                .setToUserId(2L)
                .setFrom("alice@example.test")
                .setTo("bob@example.test")
                .setSubject("Notes")
                .setBody("line one\n.hidden dot\nend"));

        List<String> out = run("CONNECT bob bob123", "LIST", "READ 1", "READ 2", "READ x", "QUIT");

        assertEquals("250 1", out.get(2));
        assertEquals("1. From: alice@example.test | Subject: Notes | unread | 2024-03-01 08:30", out.get(3));
        assertEquals("250 Message content", out.get(4));
        assertEquals("From: alice@example.test", out.get(5));
        assertEquals("To: bob@example.test", out.get(6));
        assertEquals("Subject: Notes", out.get(7));
        assertEquals("Date: 2024-03-01 08:30:00", out.get(8));
        assertEquals("", out.get(9));
        assertEquals("line one", out.get(10));
        assertEquals("..hidden dot", out.get(11));
        assertEquals("end", out.get(12));
        assertEquals(".", out.get(13));
        assertEquals("501 No such message: 2", out.get(14));
        assertEquals(ProtocolResponses.READ_USAGE_501, out.get(15));

        assertEquals(0, store.unreadCount(2L));
    }

    @Test
    void emptyList() {
        List<String> out = run("CONNECT bob bob123", "LIST", "QUIT");
        assertEquals("250 0", out.get(2));
        assertEquals("221 Goodbye", out.get(3));
    }

    @Test
    void help() {
        List<String> out = run("HELP", "QUIT");

        assertEquals("214 Available commands", out.get(1));
        assertTrue(out.contains("  CONNECT <username> <password> - Authenticate"));
        assertTrue(out.contains("  READ <number> - Read a message from the list"));
    }

    @Test
    void endOfStreamEndsSession() {
        List<String> out = run("HELP");
        assertTrue(out.size() > 1);
    }
}
