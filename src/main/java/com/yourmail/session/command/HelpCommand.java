package com.yourmail.session.command;

import com.yourmail.session.Commands;
import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;

import java.io.IOException;

/**
 * HELP command processor.
 */
public class HelpCommand extends CommandProcessor {

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);

        connection.write(ProtocolResponses.HELP_214);
        for (String help : Commands.getHelp()) {
            connection.write("  " + help);
        }
        return true;
    }

    @Override
    public String getHelp() {
        return "HELP - Show this help";
    }
}
