package com.yourmail.session.command;

import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Session command processor.
 *
 * <p>One instance per processed command.
 */
public abstract class CommandProcessor {
    protected static final Logger log = LogManager.getLogger(CommandProcessor.class);

    /**
     * Processes a command.
     *
     * @param connection Connection instance.
     * @param verb       Verb instance.
     * @return False to end the session.
     * @throws IOException Unable to communicate.
     */
    public boolean process(Connection connection, Verb verb) throws IOException {
        log.debug("{} processing {}", connection.getSession().getUID(), verb.getCommand());
        return true;
    }

    /**
     * Writes the not authenticated response if the session has no account.
     *
     * @param connection Connection instance.
     * @return True if the session is authenticated.
     * @throws IOException Unable to communicate.
     */
    protected boolean requireAuth(Connection connection) throws IOException {
        if (!connection.getSession().isAuthenticated()) {
            connection.write(ProtocolResponses.AUTH_REQUIRED_530);
            return false;
        }
        return true;
    }

    /**
     * Gets the one line description shown by HELP.
     *
     * @return String.
     */
    public abstract String getHelp();
}
