package com.yourmail.delivery;

import com.google.gson.annotations.SerializedName;

/**
 * Message submission as received from a client.
 *
 * <p>Thread and parent ids are optional threading hints.
 */
public class SubmitRequest {

    private String to;
    private String subject;
    private String body;

    @SerializedName("is_html")
    private boolean html;

    @SerializedName("thread_id")
    private String threadId;

    @SerializedName("parent_id")
    private Long parentId;

    public String getTo() {
        return to;
    }

    public SubmitRequest setTo(String to) {
        this.to = to;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public SubmitRequest setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getBody() {
        return body;
    }

    public SubmitRequest setBody(String body) {
        this.body = body;
        return this;
    }

    public boolean isHtml() {
        return html;
    }

    public SubmitRequest setHtml(boolean html) {
        this.html = html;
        return this;
    }

    public String getThreadId() {
        return threadId;
    }

    public SubmitRequest setThreadId(String threadId) {
        this.threadId = threadId;
        return this;
    }

    public Long getParentId() {
        return parentId;
    }

    public SubmitRequest setParentId(Long parentId) {
        this.parentId = parentId;
        return this;
    }
}
