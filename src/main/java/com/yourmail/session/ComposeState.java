package com.yourmail.session;

import java.util.Optional;

/**
 * Message composition progress within a session.
 *
 * <p>SEND always restarts composition. SUBJECT needs a recipient. BODY needs a subject and ends composition.
 */
public enum ComposeState {
    EMPTY,
    HAVE_RECIPIENT,
    HAVE_SUBJECT;

    /**
     * Transition on SEND.
     *
     * @return Next state.
     */
    public ComposeState onSend() {
        return HAVE_RECIPIENT;
    }

    /**
     * Transition on SUBJECT.
     *
     * @return Next state, empty if out of sequence.
     */
    public Optional<ComposeState> onSubject() {
        return this == EMPTY ? Optional.empty() : Optional.of(HAVE_SUBJECT);
    }

    /**
     * Transition on BODY.
     *
     * @return Next state, empty if out of sequence.
     */
    public Optional<ComposeState> onBody() {
        return this == HAVE_SUBJECT ? Optional.of(EMPTY) : Optional.empty();
    }
}
