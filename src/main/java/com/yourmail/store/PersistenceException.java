package com.yourmail.store;

/**
 * Storage failure.
 *
 * <p>Thrown when the database rejects or cannot complete an operation.
 * <br>Nothing is partially written when this is thrown from a create.
 */
public class PersistenceException extends Exception {

    /**
     * Constructs a new PersistenceException.
     *
     * @param message Error message.
     */
    public PersistenceException(String message) {
        super(message);
    }

    /**
     * Constructs a new PersistenceException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
