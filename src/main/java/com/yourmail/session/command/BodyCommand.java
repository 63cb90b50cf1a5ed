package com.yourmail.session.command;

import com.yourmail.delivery.SubmissionResult;
import com.yourmail.delivery.SubmitRequest;
import com.yourmail.delivery.ValidationException;
import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.Session;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;
import com.yourmail.store.PersistenceException;

import java.io.IOException;
import java.util.Collections;

/**
 * BODY command processor.
 * <p>Submits the composed message. The draft is cleared whether or not it was stored.
 */
public class BodyCommand extends CommandProcessor {

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);
        if (!requireAuth(connection)) {
            return true;
        }

        Session session = connection.getSession();
        if (session.getCompose().onBody().isEmpty()) {
            connection.write(ProtocolResponses.NEED_SUBJECT_503);
            return true;
        }

        SubmitRequest request = new SubmitRequest()
                .setTo(session.getRecipient())
                .setSubject(session.getSubject())
                .setBody(verb.getArguments());
        session.resetCompose();

        try {
            SubmissionResult result = connection.getContext().getSubmission()
                    .submit(session.getAccount(), request, Collections.emptyList(), "session");
            for (String warning : result.getWarnings()) {
                log.warn("{} message {}: {}", session.getUID(), result.getMessage().getId(), warning);
            }
            connection.write(String.format(ProtocolResponses.STORED_250, result.getMessage().getId()));
        } catch (ValidationException e) {
            connection.write(String.format(ProtocolResponses.NOT_STORED_550, e.getMessage()));
        } catch (PersistenceException e) {
            connection.write(String.format(ProtocolResponses.NOT_STORED_550, "storage failure"));
        }
        return true;
    }

    @Override
    public String getHelp() {
        return "BODY <text> - Set the body and send";
    }
}
