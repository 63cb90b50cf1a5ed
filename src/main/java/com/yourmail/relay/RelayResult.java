package com.yourmail.relay;

/**
 * Outcome of a relay attempt.
 */
public class RelayResult {

    private final boolean success;
    private final boolean attempted;
    private final String message;

    private RelayResult(boolean success, boolean attempted, String message) {
        this.success = success;
        this.attempted = attempted;
        this.message = message;
    }

    /**
     * Remote server accepted the message.
     *
     * @return RelayResult.
     */
    public static RelayResult delivered() {
        return new RelayResult(true, true, "delivered");
    }

    /**
     * Target is this server, nothing sent.
     *
     * @return RelayResult.
     */
    public static RelayResult local() {
        return new RelayResult(true, false, "local");
    }

    /**
     * Relay failed.
     *
     * @param message Failure description.
     * @return RelayResult.
     */
    public static RelayResult failure(String message) {
        return new RelayResult(false, true, message);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Was a request sent.
     *
     * @return Boolean.
     */
    public boolean isAttempted() {
        return attempted;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "RelayResult{success=" + success + ", message=" + message + "}";
    }
}
