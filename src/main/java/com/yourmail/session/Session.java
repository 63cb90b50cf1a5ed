package com.yourmail.session;

import com.yourmail.identity.Account;

import java.util.UUID;

/**
 * Per-connection session state.
 *
 * <p>Owned by exactly one connection and never shared.
 */
public class Session {

    private final String uid = UUID.randomUUID().toString();
    private String remoteAddress;
    private Account account;
    private ComposeState compose = ComposeState.EMPTY;
    private String recipient;
    private String subject;

    /**
     * Gets session unique id, used in logs.
     *
     * @return String.
     */
    public String getUID() {
        return uid;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public Session setRemoteAddress(String remoteAddress) {
        this.remoteAddress = remoteAddress;
        return this;
    }

    /**
     * Gets authenticated account.
     *
     * @return Account or null before CONNECT.
     */
    public Account getAccount() {
        return account;
    }

    public Session setAccount(Account account) {
        this.account = account;
        return this;
    }

    public boolean isAuthenticated() {
        return account != null;
    }

    public ComposeState getCompose() {
        return compose;
    }

    public Session setCompose(ComposeState compose) {
        this.compose = compose;
        return this;
    }

    public String getRecipient() {
        return recipient;
    }

    public Session setRecipient(String recipient) {
        this.recipient = recipient;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public Session setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    /**
     * Drops any partially composed message.
     *
     * @return Self.
     */
    public Session resetCompose() {
        compose = ComposeState.EMPTY;
        recipient = null;
        subject = null;
        return this;
    }
}
