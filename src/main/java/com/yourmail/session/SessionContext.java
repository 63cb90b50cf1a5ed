package com.yourmail.session;

import com.yourmail.delivery.MessageSubmission;
import com.yourmail.identity.IdentityResolver;
import com.yourmail.store.ThreadStore;

/**
 * Shared services available to command processors.
 */
public class SessionContext {

    private final String hostname;
    private final IdentityResolver identities;
    private final ThreadStore store;
    private final MessageSubmission submission;

    /**
     * Constructs a new SessionContext instance.
     *
     * @param hostname   Server hostname.
     * @param identities Identity resolver.
     * @param store      Thread store.
     * @param submission Message submission.
     */
    public SessionContext(String hostname, IdentityResolver identities, ThreadStore store, MessageSubmission submission) {
        this.hostname = hostname;
        this.identities = identities;
        this.store = store;
        this.submission = submission;
    }

    public String getHostname() {
        return hostname;
    }

    public IdentityResolver getIdentities() {
        return identities;
    }

    public ThreadStore getStore() {
        return store;
    }

    public MessageSubmission getSubmission() {
        return submission;
    }
}
