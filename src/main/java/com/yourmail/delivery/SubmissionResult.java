package com.yourmail.delivery;

import com.yourmail.store.Message;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a successful submission.
 *
 * <p>The message is stored. Warnings describe relay or attachment problems that did not abort it.
 */
public class SubmissionResult {

    private final Message message;
    private final List<String> warnings;
    private final int attachmentsProcessed;
    private final int attachmentsTotal;
    private final boolean local;

    public SubmissionResult(Message message, List<String> warnings, int attachmentsProcessed, int attachmentsTotal, boolean local) {
        this.message = message;
        this.warnings = Collections.unmodifiableList(warnings);
        this.attachmentsProcessed = attachmentsProcessed;
        this.attachmentsTotal = attachmentsTotal;
        this.local = local;
    }

    public Message getMessage() {
        return message;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public int getAttachmentsProcessed() {
        return attachmentsProcessed;
    }

    public int getAttachmentsTotal() {
        return attachmentsTotal;
    }

    /**
     * Was the recipient a local account.
     *
     * @return Boolean.
     */
    public boolean isLocal() {
        return local;
    }
}
