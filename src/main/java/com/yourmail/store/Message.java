package com.yourmail.store;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored message.
 *
 * <p>Messages are immutable once stored except for the read flag.
 * <p>Field names are serialized in snake case for the HTTP and event stream boundaries.
 * <br>Null fields are left out, so replies and attachment count only appear when present.
 */
public class Message {

    private long id;

    @SerializedName("from_user_id")
    private Long fromUserId;

    @SerializedName("to_user_id")
    private Long toUserId;

    private String from;
    private String to;
    private String subject;
    private String body;

    @SerializedName("is_html")
    private boolean html;

    @SerializedName("thread_id")
    private String threadId;

    @SerializedName("parent_id")
    private Long parentId;

    private boolean read;

    @SerializedName("timestamp")
    private Instant createdAt;

    private List<Message> replies;

    @SerializedName("attachment_count")
    private Integer attachmentCount;

    public long getId() {
        return id;
    }

    public Message setId(long id) {
        this.id = id;
        return this;
    }

    /**
     * Gets sender account id.
     *
     * @return Account id or null for relayed mail.
     */
    public Long getFromUserId() {
        return fromUserId;
    }

    public Message setFromUserId(Long fromUserId) {
        this.fromUserId = fromUserId;
        return this;
    }

    /**
     * Gets recipient account id.
     *
     * @return Account id or null when the recipient is not local.
     */
    public Long getToUserId() {
        return toUserId;
    }

    public Message setToUserId(Long toUserId) {
        this.toUserId = toUserId;
        return this;
    }

    public String getFrom() {
        return from;
    }

    public Message setFrom(String from) {
        this.from = from;
        return this;
    }

    public String getTo() {
        return to;
    }

    public Message setTo(String to) {
        this.to = to;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public Message setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getBody() {
        return body;
    }

    public Message setBody(String body) {
        this.body = body;
        return this;
    }

    /**
     * Is body rich text.
     *
     * @return Boolean.
     */
    public boolean isHtml() {
        return html;
    }

    public Message setHtml(boolean html) {
        this.html = html;
        return this;
    }

    public String getThreadId() {
        return threadId;
    }

    public Message setThreadId(String threadId) {
        this.threadId = threadId;
        return this;
    }

    public Long getParentId() {
        return parentId;
    }

    public Message setParentId(Long parentId) {
        this.parentId = parentId;
        return this;
    }

    public boolean isRead() {
        return read;
    }

    public Message setRead(boolean read) {
        this.read = read;
        return this;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Message setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    /**
     * Gets other members of this message's thread.
     * <p>Only populated on inbox roots.
     *
     * @return List of Message, empty if none.
     */
    public List<Message> getReplies() {
        return replies != null ? replies : new ArrayList<>();
    }

    public Message setReplies(List<Message> replies) {
        this.replies = replies == null || replies.isEmpty() ? null : replies;
        return this;
    }

    public int getAttachmentCount() {
        return attachmentCount != null ? attachmentCount : 0;
    }

    public Message setAttachmentCount(int attachmentCount) {
        this.attachmentCount = attachmentCount > 0 ? attachmentCount : null;
        return this;
    }

    @Override
    public String toString() {
        return "Message{id=" + id + ", threadId=" + threadId + ", parentId=" + parentId + "}";
    }
}
