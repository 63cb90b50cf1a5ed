package com.yourmail.session;

import com.yourmail.config.server.ListenerConfig;
import com.yourmail.metrics.MailMetrics;
import com.yourmail.session.command.CommandProcessor;
import com.yourmail.session.connection.Connection;
import com.yourmail.session.verb.Verb;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.Socket;
import java.util.Optional;

/**
 * Session receipt runnable.
 *
 * <p>A new instance is constructed for every socket connection the server receives.
 */
public class SessionReceipt implements Runnable {
    private static final Logger log = LogManager.getLogger(SessionReceipt.class);

    /**
     * Connection instance.
     */
    protected Connection connection;

    /**
     * Listener config instance.
     */
    private ListenerConfig config = new ListenerConfig();

    /**
     * Constructs a new SessionReceipt instance with given Connection instance.
     * <p>For testing purposes.
     *
     * @param connection Connection instance.
     */
    SessionReceipt(Connection connection) {
        this.connection = connection;
    }

    /**
     * Constructs a new SessionReceipt instance with given socket.
     *
     * @param socket  Inbound socket.
     * @param config  Listener configuration instance.
     * @param context Shared services.
     * @throws IOException Unable to initialize streams.
     */
    public SessionReceipt(Socket socket, ListenerConfig config, SessionContext context) throws IOException {
        this.config = config;
        socket.setSoTimeout(config.getReadTimeout() * 1000);
        connection = new Connection(socket, context);
    }

    /**
     * Session runner.
     * <p>Greets the client then processes commands until QUIT, end of stream or the transactions limit.
     * <p>Unknown commands get an error and the loop carries on.
     */
    public void run() {
        try {
            connection.write(String.format(ProtocolResponses.GREETING_220, connection.getContext().getHostname()));
            MailMetrics.incrementSessionStart();

            for (int i = 0; i < config.getTransactionsLimit(); i++) {
                String read = connection.read();
                if (read == null) {
                    log.debug("{} end of stream", connection.getSession().getUID());
                    break;
                }
                if (read.isBlank()) {
                    continue;
                }

                Verb verb = new Verb(read);
                Optional<CommandProcessor> processor = Commands.getProcessor(verb.getCommand());
                if (processor.isEmpty()) {
                    connection.write(String.format(ProtocolResponses.UNRECOGNIZED_500, verb.getCommand()));
                    continue;
                }

                if (!processor.get().process(connection, verb)) {
                    break;
                }
            }
        } catch (IOException e) {
            log.info("{} connection ended: {}", connection.getSession().getUID(), e.getMessage());
        } finally {
            connection.close();
            log.debug("{} closed", connection.getSession().getUID());
        }
    }

    /**
     * Gets connection.
     *
     * @return Connection instance.
     */
    public Connection getConnection() {
        return connection;
    }
}
