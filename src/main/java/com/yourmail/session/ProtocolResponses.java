package com.yourmail.session;

/**
 * Session protocol response strings.
 *
 * <p>Formatted with {@link String#format(String, Object...)} where they carry placeholders.
 * <br>Line endings are added by the connection.
 */
public final class ProtocolResponses {

    private ProtocolResponses() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Greeting sent on connect.
     */
    public static final String GREETING_220 = "220 %s YourMail ready";

    /**
     * Help header.
     */
    public static final String HELP_214 = "214 Available commands";

    /**
     * Goodbye.
     */
    public static final String CLOSING_221 = "221 Goodbye";

    /**
     * Successful CONNECT.
     */
    public static final String AUTHENTICATED_250 = "250 Hello %s, authenticated";

    /**
     * Recipient accepted.
     */
    public static final String RECIPIENT_250 = "250 Recipient set to %s";

    /**
     * Subject accepted.
     */
    public static final String SUBJECT_250 = "250 Subject set";

    /**
     * Message stored, carries the new message id.
     */
    public static final String STORED_250 = "250 %d";

    /**
     * Inbox listing header, carries the number of lines that follow.
     */
    public static final String LIST_250 = "250 %d";

    /**
     * Message content header.
     */
    public static final String CONTENT_250 = "250 Message content";

    /**
     * Store or lookup failure on a read path.
     */
    public static final String LOCAL_ERROR_451 = "451 Temporary failure, try again later";

    /**
     * Unknown command.
     */
    public static final String UNRECOGNIZED_500 = "500 Unknown command: %s";

    public static final String CONNECT_USAGE_501 = "501 Usage: CONNECT <username> <password>";
    public static final String SEND_USAGE_501 = "501 Usage: SEND <address>";
    public static final String INVALID_ADDRESS_501 = "501 Invalid recipient address: %s";
    public static final String SUBJECT_USAGE_501 = "501 Usage: SUBJECT <text>";
    public static final String READ_USAGE_501 = "501 Usage: READ <number>";
    public static final String NO_SUCH_MESSAGE_501 = "501 No such message: %s";

    /**
     * SUBJECT before SEND.
     */
    public static final String NEED_RECIPIENT_503 = "503 Bad sequence, use SEND first";

    /**
     * BODY before SUBJECT.
     */
    public static final String NEED_SUBJECT_503 = "503 Bad sequence, use SUBJECT first";

    /**
     * Command needs an authenticated session.
     */
    public static final String AUTH_REQUIRED_530 = "530 Not authenticated, use CONNECT first";

    /**
     * Bad credentials.
     */
    public static final String AUTH_FAILED_535 = "535 Authentication failed";

    /**
     * Submission rejected or storage failure.
     */
    public static final String NOT_STORED_550 = "550 Message not stored: %s";
}
