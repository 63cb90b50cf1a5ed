package com.yourmail.session.command;

import com.yourmail.identity.MailAddress;
import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.Session;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;

import java.io.IOException;

/**
 * SEND command processor.
 * <p>Starts composing a message to the given address, discarding any draft in progress.
 */
public class SendCommand extends CommandProcessor {

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);
        if (!requireAuth(connection)) {
            return true;
        }

        String address = verb.getArguments();
        if (address.isEmpty()) {
            connection.write(ProtocolResponses.SEND_USAGE_501);
            return true;
        }
        if (MailAddress.parse(address).isEmpty()) {
            connection.write(String.format(ProtocolResponses.INVALID_ADDRESS_501, address));
            return true;
        }

        Session session = connection.getSession();
        session.resetCompose()
                .setRecipient(address)
                .setCompose(session.getCompose().onSend());
        connection.write(String.format(ProtocolResponses.RECIPIENT_250, address));
        return true;
    }

    @Override
    public String getHelp() {
        return "SEND <address> - Start a message";
    }
}
