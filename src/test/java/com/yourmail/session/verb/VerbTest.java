package com.yourmail.session.verb;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerbTest {

    @Test
    void commandIsCaseInsensitive() {
        Verb verb = new Verb("subject  Weekly   report ");

        assertEquals("SUBJECT", verb.getCommand());
        assertEquals("Weekly   report", verb.getArguments());
        assertArrayEquals(new String[]{"Weekly", "report"}, verb.getParts());
        assertEquals("subject  Weekly   report ", verb.getLine());
    }

    @Test
    void limitedPartsKeepTail() {
        Verb verb = new Verb("CONNECT dave correct horse  battery");

        assertArrayEquals(new String[]{"dave", "correct horse  battery"}, verb.getParts(2));
        assertArrayEquals(new String[]{"dave"}, new Verb("CONNECT dave").getParts(2));
    }

    @Test
    void bareCommand() {
        Verb verb = new Verb("QUIT");

        assertEquals("QUIT", verb.getCommand());
        assertEquals("", verb.getArguments());
        assertEquals(0, verb.getParts().length);
    }
}
