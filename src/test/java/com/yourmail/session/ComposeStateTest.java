package com.yourmail.session;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ComposeStateTest {

    @Test
    void sendAlwaysRestarts() {
        for (ComposeState state : ComposeState.values()) {
            assertEquals(ComposeState.HAVE_RECIPIENT, state.onSend());
        }
    }

    @Test
    void subjectNeedsRecipient() {
        assertEquals(Optional.empty(), ComposeState.EMPTY.onSubject());
        assertEquals(Optional.of(ComposeState.HAVE_SUBJECT), ComposeState.HAVE_RECIPIENT.onSubject());
        assertEquals(Optional.of(ComposeState.HAVE_SUBJECT), ComposeState.HAVE_SUBJECT.onSubject());
    }

    @Test
    void bodyNeedsSubject() {
        assertEquals(Optional.empty(), ComposeState.EMPTY.onBody());
        assertEquals(Optional.empty(), ComposeState.HAVE_RECIPIENT.onBody());
        assertEquals(Optional.of(ComposeState.EMPTY), ComposeState.HAVE_SUBJECT.onBody());
    }
}
