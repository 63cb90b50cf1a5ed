package com.yourmail.delivery;

/**
 * Relayed message for a user this server does not have.
 */
public class UnknownRecipientException extends ValidationException {

    public UnknownRecipientException(String address) {
        super("user_not_found", "Recipient " + address + " not found on this server");
    }
}
