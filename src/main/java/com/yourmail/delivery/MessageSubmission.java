package com.yourmail.delivery;

import com.yourmail.hub.FanoutHub;
import com.yourmail.identity.Account;
import com.yourmail.identity.IdentityResolver;
import com.yourmail.identity.MailAddress;
import com.yourmail.metrics.MailMetrics;
import com.yourmail.relay.RelayClient;
import com.yourmail.relay.RelayMessage;
import com.yourmail.relay.RelayResult;
import com.yourmail.store.AttachmentStore;
import com.yourmail.store.Message;
import com.yourmail.store.MessageDraft;
import com.yourmail.store.PersistenceException;
import com.yourmail.store.ThreadStore;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point for storing new messages.
 *
 * <p>Session BODY commands, HTTP sends and inbound relays all pass through here so every path applies
 * the same validation, threading, notification and relay rules.
 * <ol>
 *     <li>Validate recipient and subject.</li>
 *     <li>Resolve the recipient to a local account or not.</li>
 *     <li>Store the message.</li>
 *     <li>Store attachments, each failure becoming a warning.</li>
 *     <li>Notify the recipient's live subscribers, or relay to the recipient's server.</li>
 * </ol>
 */
public class MessageSubmission {
    private static final Logger log = LogManager.getLogger(MessageSubmission.class);

    private final IdentityResolver identities;
    private final ThreadStore store;
    private final AttachmentStore attachments;
    private final FanoutHub hub;
    private final RelayClient relay;
    private final long maxAttachmentBytes;

    /**
     * Constructs a new MessageSubmission instance.
     *
     * @param identities         Identity resolver.
     * @param store              Thread store.
     * @param attachments        Attachment store.
     * @param hub                Fan-out hub.
     * @param relay              Relay client, null disables relay.
     * @param maxAttachmentBytes Largest accepted attachment.
     */
    public MessageSubmission(IdentityResolver identities, ThreadStore store, AttachmentStore attachments,
                             FanoutHub hub, RelayClient relay, long maxAttachmentBytes) {
        this.identities = identities;
        this.store = store;
        this.attachments = attachments;
        this.hub = hub;
        this.relay = relay;
        this.maxAttachmentBytes = maxAttachmentBytes;
    }

    /**
     * Submits a message from a local account.
     *
     * @param sender  Authenticated sender.
     * @param request Submission.
     * @param uploads Attachments, may be empty.
     * @param source  Ingress path name for metrics.
     * @return SubmissionResult.
     * @throws ValidationException  Rejected input, nothing stored.
     * @throws PersistenceException Storage or lookup failure, nothing stored.
     */
    public SubmissionResult submit(Account sender, SubmitRequest request, List<AttachmentUpload> uploads, String source)
            throws ValidationException, PersistenceException {
        String to = StringUtils.trimToEmpty(request.getTo());
        if (to.isEmpty()) {
            throw new ValidationException("missing_recipient", "Recipient email is required");
        }
        if (StringUtils.isBlank(request.getSubject())) {
            throw new ValidationException("missing_subject", "Subject is required");
        }
        MailAddress address = MailAddress.parse(to)
                .orElseThrow(() -> new ValidationException("invalid_email", "Invalid recipient email format: " + to));

        Optional<Account> recipient = identities.resolve(to);
        String from = sender.getAddress(identities.getHostname());

        Message message = store.createMessage(new MessageDraft()
                .setFromUserId(sender.getId())
                .setToUserId(recipient.map(Account::getId).orElse(null))
                .setFrom(from)
                .setTo(to)
                .setSubject(request.getSubject())
                .setBody(StringUtils.defaultString(request.getBody()))
                .setHtml(request.isHtml())
                .setThreadId(request.getThreadId())
                .setParentId(request.getParentId()));
        MailMetrics.incrementMessageStored(source);
        log.info("Stored message {} from {} to {} via {}", message.getId(), from, to, source);

        List<String> warnings = new ArrayList<>();
        List<AttachmentUpload> files = uploads != null ? uploads : Collections.emptyList();
        int processed = storeAttachments(message, files, warnings);
        if (processed > 0) {
            message.setAttachmentCount(processed);
        }

        if (recipient.isPresent()) {
            hub.notifyNewMessage(message);
        } else {
            relay(message, address, warnings);
        }

        return new SubmissionResult(message, warnings, processed, files.size(), recipient.isPresent());
    }

    /**
     * Accepts a message pushed by another server.
     *
     * @param relayed Relay payload.
     * @return Stored message.
     * @throws ValidationException  Malformed payload or recipient not hosted here.
     * @throws PersistenceException Storage or lookup failure.
     */
    public Message acceptRelayed(RelayMessage relayed) throws ValidationException, PersistenceException {
        if (relayed == null || StringUtils.isAnyBlank(relayed.getFrom(), relayed.getTo())) {
            throw new ValidationException("invalid_request", "Sender and recipient are required");
        }
        MailAddress address = MailAddress.parse(relayed.getTo())
                .orElseThrow(() -> new ValidationException("invalid_email", "Invalid recipient email format"));
        if (!address.getDomain().equalsIgnoreCase(identities.getHostname())) {
            throw new ValidationException("recipient_not_on_server", "Recipient domain does not match this server");
        }

        Account recipient = identities.resolve(relayed.getTo())
                .orElseThrow(() -> new UnknownRecipientException(relayed.getTo()));

        Message message = store.createMessage(new MessageDraft()
                .setToUserId(recipient.getId())
                .setFrom(relayed.getFrom())
                .setTo(relayed.getTo())
                .setSubject(StringUtils.defaultString(relayed.getSubject()))
                .setBody(StringUtils.defaultString(relayed.getBody())));
        MailMetrics.incrementMessageStored("relay");
        log.info("Accepted relayed message {} from {} to {}", message.getId(), relayed.getFrom(), relayed.getTo());

        hub.notifyNewMessage(message);
        return message;
    }

    private int storeAttachments(Message message, List<AttachmentUpload> files, List<String> warnings) {
        int processed = 0;
        for (AttachmentUpload file : files) {
            String name = StringUtils.defaultIfBlank(file.getFilename(), "attachment");
            if (file.getData() == null) {
                warnings.add("Attachment " + name + " has no content");
                continue;
            }
            if (file.getData().length > maxAttachmentBytes) {
                warnings.add("Attachment " + name + " exceeds " + maxAttachmentBytes + " bytes");
                continue;
            }
            try {
                attachments.save(message.getId(), name, file.getContentType(), file.getData());
                processed++;
            } catch (PersistenceException e) {
                log.warn("Attachment {} for message {} not stored: {}", name, message.getId(), e.getMessage());
                warnings.add("Failed to store attachment " + name);
            }
        }
        return processed;
    }

    private void relay(Message message, MailAddress address, List<String> warnings) {
        if (relay == null) {
            warnings.add("Recipient " + address + " is not local and relay is disabled");
            return;
        }

        RelayResult result = relay.sendMessage(message.getFrom(), message.getTo(), message.getSubject(),
                message.getBody(), address.getDomain());
        if (!result.isSuccess()) {
            warnings.add("Message saved locally but relay to " + address.getDomain() + " failed: " + result.getMessage());
        } else if (!result.isAttempted()) {
            warnings.add("Recipient " + address + " is not a user on this server");
        }
    }
}
