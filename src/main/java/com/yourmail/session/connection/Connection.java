package com.yourmail.session.connection;

import com.yourmail.session.Session;
import com.yourmail.session.SessionContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Session protocol connection.
 *
 * <p>Reads CRLF or LF terminated lines and writes CRLF terminated responses.
 * <br>Holds the per-connection {@link Session} and the shared {@link SessionContext}.
 */
public class Connection {
    private static final Logger log = LogManager.getLogger(Connection.class);

    private static final byte[] CRLF = {'\r', '\n'};

    private final Socket socket;
    private final BufferedReader reader;
    private final OutputStream outputStream;
    private final Session session = new Session();
    private final SessionContext context;

    /**
     * Constructs a new Connection instance over a socket.
     *
     * @param socket  Accepted socket.
     * @param context Shared services.
     * @throws IOException Unable to open streams.
     */
    public Connection(Socket socket, SessionContext context) throws IOException {
        this(socket, socket.getInputStream(), socket.getOutputStream(), context);
        session.setRemoteAddress(socket.getInetAddress().getHostAddress() + ":" + socket.getPort());
    }

    /**
     * Constructs a new Connection instance over streams.
     * <p>For testing purposes.
     *
     * @param inputStream  Input stream.
     * @param outputStream Output stream.
     * @param context      Shared services.
     */
    protected Connection(InputStream inputStream, OutputStream outputStream, SessionContext context) {
        this(null, inputStream, outputStream, context);
        session.setRemoteAddress("local");
    }

    private Connection(Socket socket, InputStream inputStream, OutputStream outputStream, SessionContext context) {
        this.socket = socket;
        this.reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        this.outputStream = outputStream;
        this.context = context;
    }

    public Session getSession() {
        return session;
    }

    public SessionContext getContext() {
        return context;
    }

    /**
     * Reads one line.
     *
     * @return Line without its ending, null at end of stream.
     * @throws IOException Unable to read.
     */
    public String read() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            log.trace("{} << {}", session.getUID(), line);
        }
        return line;
    }

    /**
     * Writes one response line and flushes.
     *
     * @param line Line without ending.
     * @throws IOException Unable to write.
     */
    public void write(String line) throws IOException {
        outputStream.write(line.getBytes(StandardCharsets.UTF_8));
        outputStream.write(CRLF);
        outputStream.flush();
        log.trace("{} >> {}", session.getUID(), line);
    }

    /**
     * Closes the connection.
     */
    public void close() {
        try {
            if (socket != null) {
                socket.close();
            } else {
                outputStream.close();
            }
        } catch (IOException e) {
            log.debug("Error closing connection {}: {}", session.getUID(), e.getMessage());
        }
    }

    /**
     * Is the underlying socket closed.
     *
     * @return Boolean, always false for stream connections.
     */
    public boolean isClosed() {
        return socket != null && socket.isClosed();
    }
}
