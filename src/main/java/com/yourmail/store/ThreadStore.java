package com.yourmail.store;

import java.util.List;
import java.util.Optional;

/**
 * Threaded message store.
 *
 * <p>Persists messages and owns thread identity.
 * <ul>
 *     <li>No thread hint and no parent hint starts a new thread.</li>
 *     <li>A reply to an existing parent always joins the parent's thread.</li>
 *     <li>A supplied thread id is used as is when there is no existing parent.</li>
 * </ul>
 *
 * @see SqlThreadStore
 */
public interface ThreadStore {

    /**
     * Stores a new message and returns it as persisted.
     *
     * @param draft Message draft.
     * @return Stored message with id, thread id and creation time.
     * @throws PersistenceException Nothing was stored.
     */
    Message createMessage(MessageDraft draft) throws PersistenceException;

    /**
     * Gets a message by id.
     *
     * @param id Message id.
     * @return Optional of Message.
     * @throws PersistenceException Storage failure.
     */
    Optional<Message> getMessage(long id) throws PersistenceException;

    /**
     * Gets all messages in a thread, oldest first with ties broken by id.
     *
     * @param threadId Thread id.
     * @return List of Message, empty if unknown.
     * @throws PersistenceException Storage failure.
     */
    List<Message> getThread(String threadId) throws PersistenceException;

    /**
     * Gets one representative per thread addressed to the account, most recently active thread first.
     * <p>The representative is the earliest message in the thread addressed to the account.
     * <br>Its replies hold the rest of the thread when the thread has more than one message.
     *
     * @param accountId Recipient account id.
     * @param limit     Maximum representatives.
     * @param offset    Representatives to skip.
     * @return List of Message.
     * @throws PersistenceException Storage failure.
     */
    List<Message> getInboxRoots(long accountId, int limit, int offset) throws PersistenceException;

    /**
     * Gets messages sent by the account, newest first.
     *
     * @param accountId Sender account id.
     * @param limit     Maximum messages.
     * @param offset    Messages to skip.
     * @return List of Message.
     * @throws PersistenceException Storage failure.
     */
    List<Message> getSent(long accountId, int limit, int offset) throws PersistenceException;

    /**
     * Marks a message read.
     * <p>Idempotent.
     *
     * @param id Message id.
     * @return True if the message exists.
     * @throws PersistenceException Storage failure.
     */
    boolean markRead(long id) throws PersistenceException;

    /**
     * Counts unread messages addressed to the account.
     *
     * @param accountId Recipient account id.
     * @return Count.
     * @throws PersistenceException Storage failure.
     */
    int unreadCount(long accountId) throws PersistenceException;
}
