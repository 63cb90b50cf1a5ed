package com.yourmail.hub;

/**
 * Server-Sent Events framing.
 */
public final class EventFrames {

    /**
     * Comment frame written by the liveness sweep.
     */
    public static final String KEEPALIVE = ": ping\n\n";

    private EventFrames() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Builds an event frame.
     *
     * @param kind Event kind.
     * @param json Single line JSON payload.
     * @return Frame text.
     */
    public static String event(EventKind kind, String json) {
        return "event: " + kind.getWireName() + "\ndata: " + json + "\n\n";
    }
}
