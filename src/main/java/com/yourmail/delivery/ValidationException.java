package com.yourmail.delivery;

/**
 * Rejected input.
 *
 * <p>Carries a machine readable code for API clients alongside the human message.
 * <br>Raised before anything reaches the store.
 */
public class ValidationException extends Exception {

    private final String code;

    /**
     * Constructs a new ValidationException.
     *
     * @param code    Error code, e.g. invalid_email.
     * @param message Error message.
     */
    public ValidationException(String code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Gets error code.
     *
     * @return Code string.
     */
    public String getCode() {
        return code;
    }
}
