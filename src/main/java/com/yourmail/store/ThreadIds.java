package com.yourmail.store;

import org.apache.commons.codec.binary.Hex;

import java.security.SecureRandom;

/**
 * Thread identifier generator.
 *
 * <p>Ids are 128 random bits encoded as 32 lowercase hex characters.
 */
public final class ThreadIds {

    private static final SecureRandom random = new SecureRandom();

    private ThreadIds() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Mints a new thread id.
     *
     * @return Hex string.
     */
    public static String next() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}
