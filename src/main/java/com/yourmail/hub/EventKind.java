package com.yourmail.hub;

/**
 * Event stream event kinds and their wire names.
 */
public enum EventKind {
    CONNECTED("connected"),
    NEW_MESSAGE("new-message"),
    UNREAD_COUNT("unread-count");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Gets the name written on the event line.
     *
     * @return Wire name.
     */
    public String getWireName() {
        return wireName;
    }
}
