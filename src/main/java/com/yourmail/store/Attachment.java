package com.yourmail.store;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;

/**
 * Stored attachment metadata.
 *
 * <p>Bytes are only loaded for downloads and are never serialized.
 */
public class Attachment {

    private long id;

    @SerializedName("message_id")
    private long messageId;

    private String filename;

    @SerializedName("original_name")
    private String originalName;

    @SerializedName("content_type")
    private String contentType;

    @SerializedName("file_size")
    private long size;

    @SerializedName("created_at")
    private Instant createdAt;

    private transient byte[] data;

    public long getId() {
        return id;
    }

    public Attachment setId(long id) {
        this.id = id;
        return this;
    }

    public long getMessageId() {
        return messageId;
    }

    public Attachment setMessageId(long messageId) {
        this.messageId = messageId;
        return this;
    }

    /**
     * Gets stored file name.
     *
     * @return Name prefixed with the upload time in epoch seconds.
     */
    public String getFilename() {
        return filename;
    }

    public Attachment setFilename(String filename) {
        this.filename = filename;
        return this;
    }

    public String getOriginalName() {
        return originalName;
    }

    public Attachment setOriginalName(String originalName) {
        this.originalName = originalName;
        return this;
    }

    public String getContentType() {
        return contentType;
    }

    public Attachment setContentType(String contentType) {
        this.contentType = contentType;
        return this;
    }

    public long getSize() {
        return size;
    }

    public Attachment setSize(long size) {
        this.size = size;
        return this;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Attachment setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    /**
     * Gets content bytes.
     *
     * @return Byte array or null when only metadata was loaded.
     */
    public byte[] getData() {
        return data;
    }

    public Attachment setData(byte[] data) {
        this.data = data;
        return this;
    }
}
