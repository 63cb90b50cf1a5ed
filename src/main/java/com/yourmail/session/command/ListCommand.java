package com.yourmail.session.command;

import com.yourmail.session.ProtocolResponses;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;
import com.yourmail.store.Message;
import com.yourmail.store.PersistenceException;

import java.io.IOException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * LIST command processor.
 * <p>Prints the inbox, one line per thread.
 */
public class ListCommand extends CommandProcessor {

    /**
     * Inbox page size for LIST and READ.
     */
    public static final int PAGE_SIZE = 20;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);
        if (!requireAuth(connection)) {
            return true;
        }

        List<Message> inbox;
        try {
            inbox = connection.getContext().getStore()
                    .getInboxRoots(connection.getSession().getAccount().getId(), PAGE_SIZE, 0);
        } catch (PersistenceException e) {
            connection.write(ProtocolResponses.LOCAL_ERROR_451);
            return true;
        }

        connection.write(String.format(ProtocolResponses.LIST_250, inbox.size()));
        for (int i = 0; i < inbox.size(); i++) {
            Message message = inbox.get(i);
            connection.write(String.format("%d. From: %s | Subject: %s | %s | %s",
                    i + 1,
                    message.getFrom(),
                    message.getSubject(),
                    message.isRead() ? "read" : "unread",
                    DATE.format(message.getCreatedAt())));
        }
        return true;
    }

    @Override
    public String getHelp() {
        return "LIST - List inbox";
    }
}
