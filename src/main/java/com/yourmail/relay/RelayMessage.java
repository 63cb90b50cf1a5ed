package com.yourmail.relay;

import java.time.Instant;

/**
 * Relay payload exchanged between servers.
 */
public class RelayMessage {

    private String from;
    private String to;
    private String subject;
    private String body;
    private Instant timestamp;

    public RelayMessage() {
    }

    public RelayMessage(String from, String to, String subject, String body, Instant timestamp) {
        this.from = from;
        this.to = to;
        this.subject = subject;
        this.body = body;
        this.timestamp = timestamp;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
