package com.yourmail.store;

import java.util.List;
import java.util.Optional;

/**
 * Attachment byte storage keyed by message id.
 *
 * @see SqlAttachmentStore
 */
public interface AttachmentStore {

    /**
     * Stores an attachment for a message.
     *
     * @param messageId    Owning message id.
     * @param originalName File name as uploaded.
     * @param contentType  MIME type, defaults to application/octet-stream when blank.
     * @param data         Content bytes.
     * @return Stored attachment metadata.
     * @throws PersistenceException Unable to store.
     */
    Attachment save(long messageId, String originalName, String contentType, byte[] data) throws PersistenceException;

    /**
     * Lists attachment metadata for a message.
     *
     * @param messageId Message id.
     * @return List of Attachment without data.
     * @throws PersistenceException Storage failure.
     */
    List<Attachment> list(long messageId) throws PersistenceException;

    /**
     * Gets an attachment with its bytes.
     *
     * @param id Attachment id.
     * @return Optional of Attachment.
     * @throws PersistenceException Storage failure.
     */
    Optional<Attachment> get(long id) throws PersistenceException;
}
