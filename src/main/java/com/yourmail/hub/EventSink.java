package com.yourmail.hub;

import java.io.IOException;

/**
 * Output side of a live subscriber connection.
 *
 * <p>Writes must flush so a broken peer surfaces as an {@link IOException} on the write that hits it.
 */
public interface EventSink {

    /**
     * Writes and flushes a frame.
     *
     * @param frame Frame text.
     * @throws IOException Peer gone or stalled.
     */
    void write(String frame) throws IOException;

    /**
     * Releases the underlying connection.
     */
    void close();
}
