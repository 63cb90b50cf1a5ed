package com.yourmail.session.command;

import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;

import java.io.IOException;

/**
 * QUIT command processor.
 */
public class QuitCommand extends CommandProcessor {

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);

        connection.write(ProtocolResponses.CLOSING_221);
        connection.close();

        return false;
    }

    @Override
    public String getHelp() {
        return "QUIT - Disconnect";
    }
}
