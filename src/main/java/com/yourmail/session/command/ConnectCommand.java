package com.yourmail.session.command;

import com.yourmail.identity.Account;
import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;
import com.yourmail.store.PersistenceException;

import java.io.IOException;
import java.util.Optional;

/**
 * CONNECT command processor.
 * <p>Authenticates the session. A failed attempt leaves the session as it was.
 */
public class ConnectCommand extends CommandProcessor {

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);

        String[] parts = verb.getParts(2);
        if (parts.length != 2) {
            connection.write(ProtocolResponses.CONNECT_USAGE_501);
            return true;
        }

        try {
            Optional<Account> account = connection.getContext().getIdentities().authenticate(parts[0], parts[1]);
            if (account.isEmpty()) {
                log.info("{} authentication failed for {}", connection.getSession().getUID(), parts[0]);
                connection.write(ProtocolResponses.AUTH_FAILED_535);
                return true;
            }

            connection.getSession().setAccount(account.get()).resetCompose();
            log.info("{} authenticated as {}", connection.getSession().getUID(), account.get().getUsername());
            connection.write(String.format(ProtocolResponses.AUTHENTICATED_250, account.get().getUsername()));
        } catch (PersistenceException e) {
            connection.write(ProtocolResponses.LOCAL_ERROR_451);
        }
        return true;
    }

    @Override
    public String getHelp() {
        return "CONNECT <username> <password> - Authenticate";
    }
}
