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
 * READ command processor.
 * <p>Prints the n-th inbox message and marks it read.
 * <br>Body lines starting with a dot are dot-stuffed and a lone dot ends the content.
 */
public class ReadCommand extends CommandProcessor {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    @Override
    public boolean process(Connection connection, Verb verb) throws IOException {
        super.process(connection, verb);
        if (!requireAuth(connection)) {
            return true;
        }

        int index;
        try {
            index = Integer.parseInt(verb.getArguments());
        } catch (NumberFormatException e) {
            connection.write(ProtocolResponses.READ_USAGE_501);
            return true;
        }

        Message message;
        try {
            List<Message> inbox = connection.getContext().getStore()
                    .getInboxRoots(connection.getSession().getAccount().getId(), ListCommand.PAGE_SIZE, 0);
            if (index < 1 || index > inbox.size()) {
                connection.write(String.format(ProtocolResponses.NO_SUCH_MESSAGE_501, verb.getArguments()));
                return true;
            }
            message = inbox.get(index - 1);
            connection.getContext().getStore().markRead(message.getId());
        } catch (PersistenceException e) {
            connection.write(ProtocolResponses.LOCAL_ERROR_451);
            return true;
        }

        connection.write(ProtocolResponses.CONTENT_250);
        connection.write("From: " + message.getFrom());
        connection.write("To: " + message.getTo());
        connection.write("Subject: " + message.getSubject());
        connection.write("Date: " + DATE.format(message.getCreatedAt()));
        connection.write("");
        for (String line : message.getBody().split("\r?\n", -1)) {
            connection.write(line.startsWith(".") ? "." + line : line);
        }
        connection.write(".");
        return true;
    }

    @Override
    public String getHelp() {
        return "READ <number> - Read a message from the list";
    }
}
