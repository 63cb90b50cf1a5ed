package com.yourmail.session.command;

import com.yourmail.session.ComposeState;
import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.Session;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;

import java.io.IOException;
import java.util.Optional;

/**
 * SUBJECT command processor.
 */
public class SubjectCommand extends CommandProcessor {

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);
        if (!requireAuth(connection)) {
            return true;
        }

        Session session = connection.getSession();
        Optional<ComposeState> next = session.getCompose().onSubject();
        if (next.isEmpty()) {
            connection.write(ProtocolResponses.NEED_RECIPIENT_503);
            return true;
        }
        if (verb.getArguments().isEmpty()) {
            connection.write(ProtocolResponses.SUBJECT_USAGE_501);
            return true;
        }

        session.setSubject(verb.getArguments()).setCompose(next.get());
        connection.write(ProtocolResponses.SUBJECT_250);
        return true;
    }

    @Override
    public String getHelp() {
        return "SUBJECT <text> - Set the subject";
    }
}
