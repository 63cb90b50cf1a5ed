package com.yourmail.store;

/**
 * Input for {@link ThreadStore#createMessage(MessageDraft)}.
 *
 * <p>Thread and parent ids are hints, the store decides the final thread.
 */
public class MessageDraft {

    private Long fromUserId;
    private Long toUserId;
    private String from;
    private String to;
    private String subject;
    private String body;
    private boolean html;
    private String threadId;
    private Long parentId;

    public Long getFromUserId() {
        return fromUserId;
    }

    public MessageDraft setFromUserId(Long fromUserId) {
        this.fromUserId = fromUserId;
        return this;
    }

    public Long getToUserId() {
        return toUserId;
    }

    public MessageDraft setToUserId(Long toUserId) {
        this.toUserId = toUserId;
        return this;
    }

    public String getFrom() {
        return from;
    }

    public MessageDraft setFrom(String from) {
        this.from = from;
        return this;
    }

    public String getTo() {
        return to;
    }

    public MessageDraft setTo(String to) {
        this.to = to;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public MessageDraft setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getBody() {
        return body;
    }

    public MessageDraft setBody(String body) {
        this.body = body;
        return this;
    }

    public boolean isHtml() {
        return html;
    }

    public MessageDraft setHtml(boolean html) {
        this.html = html;
        return this;
    }

    public String getThreadId() {
        return threadId;
    }

    public MessageDraft setThreadId(String threadId) {
        this.threadId = threadId;
        return this;
    }

    public Long getParentId() {
        return parentId;
    }

    public MessageDraft setParentId(Long parentId) {
        this.parentId = parentId;
        return this;
    }
}
