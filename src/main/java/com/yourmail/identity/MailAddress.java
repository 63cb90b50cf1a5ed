package com.yourmail.identity;

import java.util.Optional;

/**
 * Parsed local@domain address.
 *
 * <p>Valid addresses contain exactly one at sign with non-empty text on both sides.
 */
public final class MailAddress {

    private final String local;
    private final String domain;

    private MailAddress(String local, String domain) {
        this.local = local;
        this.domain = domain;
    }

    /**
     * Parses an address.
     *
     * @param address Address string.
     * @return Optional of MailAddress, empty if malformed.
     */
    public static Optional<MailAddress> parse(String address) {
        if (address == null) {
            return Optional.empty();
        }
        String trimmed = address.trim();
        int at = trimmed.indexOf('@');
        if (at <= 0 || at != trimmed.lastIndexOf('@') || at == trimmed.length() - 1) {
            return Optional.empty();
        }
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(new MailAddress(trimmed.substring(0, at), trimmed.substring(at + 1)));
    }

    public String getLocal() {
        return local;
    }

    public String getDomain() {
        return domain;
    }

    @Override
    public String toString() {
        return local + "@" + domain;
    }
}
