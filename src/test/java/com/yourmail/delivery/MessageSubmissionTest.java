package com.yourmail.delivery;

import com.yourmail.hub.FanoutHub;
import com.yourmail.identity.Account;
import com.yourmail.identity.IdentityResolver;
import com.yourmail.relay.RelayClient;
import com.yourmail.relay.RelayMessage;
import com.yourmail.relay.RelayResult;
import com.yourmail.store.AttachmentStore;
import com.yourmail.store.Message;
import com.yourmail.store.MessageDraft;
import com.yourmail.store.PersistenceException;
import com.yourmail.store.ThreadStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MessageSubmissionTest {

    private static final Account ALICE = new Account(1L, "alice", "alice@mail.test");
    private static final Account BOB = new Account(2L, "bob", "bob@mail.test");

    private IdentityResolver identities;
    private ThreadStore store;
    private AttachmentStore attachments;
    private FanoutHub hub;
    private RelayClient relay;
    private MessageSubmission submission;

    @BeforeEach
    void setUp() throws Exception {
        identities = mock(IdentityResolver.class);
        store = mock(ThreadStore.class);
        attachments = mock(AttachmentStore.class);
        hub = mock(FanoutHub.class);
        relay = mock(RelayClient.class);

        when(identities.getHostname()).thenReturn("mail.test");
        when(identities.resolve(anyString())).thenReturn(Optional.empty());
        when(identities.resolve("bob@mail.test")).thenReturn(Optional.of(BOB));
        when(store.createMessage(any(MessageDraft.class))).thenAnswer(invocation -> {
            MessageDraft draft = invocation.getArgument(0);
            return new Message()
                    .setId(10L)
                    .setFromUserId(draft.getFromUserId())
                    .setToUserId(draft.getToUserId())
                    .setFrom(draft.getFrom())
                    .setTo(draft.getTo())
                    .setSubject(draft.getSubject())
                    .setBody(draft.getBody())
                    .setThreadId("thread")
                    .setParentId(draft.getParentId())
                    .setCreatedAt(Instant.now());
        });

        submission = new MessageSubmission(identities, store, attachments, hub, relay, 8);
    }

    private SubmitRequest request(String to) {
        return new SubmitRequest().setTo(to).setSubject("Hello").setBody("Hi there");
    }

    @Test
    void localRecipientNotifiesHub() throws Exception {
        SubmissionResult result = submission.submit(ALICE, request("bob@mail.test"), null, "api");

        assertTrue(result.isLocal());
        assertTrue(result.getWarnings().isEmpty());
        assertEquals("alice@mail.test", result.getMessage().getFrom());
        assertEquals(2L, result.getMessage().getToUserId());
        verify(hub).notifyNewMessage(result.getMessage());
        verifyNoInteractions(relay);
    }

    @Test
    void remoteRecipientRelaysOnce() throws Exception {
        when(relay.sendMessage(anyString(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(RelayResult.delivered());

        SubmissionResult result = submission.submit(ALICE, request("carol@other.test"), null, "api");

        assertFalse(result.isLocal());
        assertTrue(result.getWarnings().isEmpty());
        assertNull(result.getMessage().getToUserId());
        verify(relay, times(1)).sendMessage("alice@mail.test", "carol@other.test", "Hello", "Hi there", "other.test");
        verify(hub, never()).notifyNewMessage(any());
    }

    @Test
    void relayFailureIsWarning() throws Exception {
        when(relay.sendMessage(anyString(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(RelayResult.failure("Relay server returned status 500"));

        SubmissionResult result = submission.submit(ALICE, request("carol@other.test"), null, "api");

        assertEquals(List.of("Message saved locally but relay to other.test failed: Relay server returned status 500"),
                result.getWarnings());
        verify(store, times(1)).createMessage(any());
    }

    @Test
    void unknownLocalUserIsWarning() throws Exception {
        when(relay.sendMessage(anyString(), anyString(), anyString(), anyString(), eq("mail.test")))
                .thenReturn(RelayResult.local());

        SubmissionResult result = submission.submit(ALICE, request("zed@mail.test"), null, "session");

        assertFalse(result.isLocal());
        assertEquals(List.of("Recipient zed@mail.test is not a user on this server"), result.getWarnings());
    }

    @Test
    void relayDisabledIsWarning() throws Exception {
        submission = new MessageSubmission(identities, store, attachments, hub, null, 8);

        SubmissionResult result = submission.submit(ALICE, request("carol@other.test"), null, "api");

        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("relay is disabled"));
    }

    @Test
    void validation() throws Exception {
        ValidationException missingTo = assertThrows(ValidationException.class,
                () -> submission.submit(ALICE, request(" "), null, "api"));
        assertEquals("missing_recipient", missingTo.getCode());

        ValidationException missingSubject = assertThrows(ValidationException.class,
                () -> submission.submit(ALICE, request("bob@mail.test").setSubject(""), null, "api"));
        assertEquals("missing_subject", missingSubject.getCode());

        ValidationException invalid = assertThrows(ValidationException.class,
                () -> submission.submit(ALICE, request("not-an-address"), null, "api"));
        assertEquals("invalid_email", invalid.getCode());

        verify(store, never()).createMessage(any());
    }

    @Test
    void threadingFieldsPassThrough() throws Exception {
        submission.submit(ALICE, request("bob@mail.test").setThreadId("t-1").setParentId(5L).setHtml(true),
                Collections.emptyList(), "api");

        ArgumentCaptor<MessageDraft> captor = ArgumentCaptor.forClass(MessageDraft.class);
        verify(store).createMessage(captor.capture());
        assertEquals("t-1", captor.getValue().getThreadId());
        assertEquals(5L, captor.getValue().getParentId());
        assertTrue(captor.getValue().isHtml());
        assertEquals(1L, captor.getValue().getFromUserId());
    }

    @Test
    void attachmentProblemsAreWarnings() throws Exception {
        when(attachments.save(eq(10L), eq("broken.bin"), any(), any())).thenThrow(new PersistenceException("disk full"));

        List<AttachmentUpload> uploads = List.of(
                new AttachmentUpload("ok.txt", "text/plain", new byte[]{1, 2}),
                new AttachmentUpload("big.bin", null, new byte[9]),
                new AttachmentUpload("broken.bin", null, new byte[1])
        );
        SubmissionResult result = submission.submit(ALICE, request("bob@mail.test"), uploads, "api");

        assertEquals(1, result.getAttachmentsProcessed());
        assertEquals(3, result.getAttachmentsTotal());
        assertEquals(2, result.getWarnings().size());
        assertEquals(1, result.getMessage().getAttachmentCount());
        verify(attachments).save(10L, "ok.txt", "text/plain", new byte[]{1, 2});
    }

    @Test
    void acceptRelayedStoresAndNotifies() throws Exception {
        Message message = submission.acceptRelayed(
                new RelayMessage("carol@other.test", "bob@mail.test", "Hi", "From afar", Instant.now()));

        assertEquals(2L, message.getToUserId());
        assertNull(message.getFromUserId());
        assertEquals("carol@other.test", message.getFrom());
        verify(hub).notifyNewMessage(message);
    }

    @Test
    void acceptRelayedRejects() {
        ValidationException empty = assertThrows(ValidationException.class,
                () -> submission.acceptRelayed(new RelayMessage()));
        assertEquals("invalid_request", empty.getCode());

        ValidationException wrongDomain = assertThrows(ValidationException.class,
                () -> submission.acceptRelayed(new RelayMessage("c@other.test", "bob@elsewhere.test", "s", "b", null)));
        assertEquals("recipient_not_on_server", wrongDomain.getCode());

        UnknownRecipientException unknown = assertThrows(UnknownRecipientException.class,
                () -> submission.acceptRelayed(new RelayMessage("c@other.test", "zed@mail.test", "s", "b", null)));
        assertEquals("user_not_found", unknown.getCode());
    }
}
