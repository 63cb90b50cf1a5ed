package com.yourmail.session;

import com.yourmail.config.server.ListenerConfig;
import com.yourmail.metrics.MailMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Session protocol socket listener.
 * <p>Runs a {@link ServerSocket} bound to the configured interface and port.
 * <p>Each accepted connection is handled by a {@link SessionReceipt} on a pooled thread.
 *
 * @see SessionReceipt
 */
public class SessionListener {
    private static final Logger log = LogManager.getLogger(SessionListener.class);

    /**
     * The underlying server socket that listens for incoming connections.
     */
    private ServerSocket listener;

    /**
     * Thread pool for handling client connections.
     */
    private final ThreadPoolExecutor executor;

    /**
     * Flag to indicate a server shutdown is in progress.
     */
    private volatile boolean serverShutdown = false;

    private final int port;
    private final String bind;
    private final ListenerConfig config;
    private final SessionContext context;

    /**
     * Constructs a new SessionListener instance.
     *
     * @param port    The port number to listen on, 0 picks a free port.
     * @param bind    The network interface address to bind to.
     * @param config  Listener settings.
     * @param context Shared services for sessions.
     */
    public SessionListener(int port, String bind, ListenerConfig config, SessionContext context) {
        this.port = port;
        this.bind = bind;
        this.config = config;
        this.context = context;

        this.executor = new ThreadPoolExecutor(
                config.getMinimumPoolSize(),
                config.getMaximumPoolSize(),
                config.getThreadKeepAliveTime(), TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * Binds the server socket.
     *
     * @throws IOException Unable to bind.
     */
    public synchronized void bind() throws IOException {
        if (listener == null) {
            listener = new ServerSocket(port, config.getBacklog(), InetAddress.getByName(bind));
            log.info("Listening to [{}]:{}", bind, listener.getLocalPort());
        }
    }

    /**
     * Starts the listener.
     * <p>Binds if needed then accepts connections until shutdown.
     */
    public void listen() {
        try {
            bind();
            acceptConnection();

        } catch (IOException e) {
            log.fatal("Error listening: {}", e.getMessage());

        } finally {
            try {
                if (listener != null && !listener.isClosed()) {
                    listener.close();
                    log.info("Closed listener for port {}.", port);
                }
            } catch (IOException e) {
                log.info("Listener for port {} already closed.", port);
            }
            executor.shutdown();
        }
    }

    /**
     * Accepts incoming connections in a loop until a shutdown is initiated.
     */
    private void acceptConnection() {
        try {
            do {
                Socket sock = listener.accept();
                log.info("Accepted connection from {}:{} on port {}.", sock.getInetAddress().getHostAddress(), sock.getPort(), getPort());

                executor.submit(() -> {
                    try {
                        new SessionReceipt(sock, config, context).run();

                    } catch (Exception e) {
                        MailMetrics.incrementSessionException(e.getClass().getSimpleName());
                        log.error("Session unexpected exception: {}", e.getMessage());
                    }
                    return null;
                });
            } while (!serverShutdown);

        } catch (SocketException e) {
            if (!serverShutdown) {
                log.info("Error in socket exchange: {}", e.getMessage());
            }
        } catch (IOException e) {
            log.info("Error reading/writing: {}", e.getMessage());
        }
    }

    /**
     * Initiates a graceful shutdown of the listener.
     *
     * @throws IOException If an I/O error occurs when closing the socket.
     */
    public void serverShutdown() throws IOException {
        serverShutdown = true;
        if (listener != null) {
            listener.close();
        }
        executor.shutdown();
    }

    /**
     * Gets the bound port.
     *
     * @return Bound port, or the configured port before binding.
     */
    public int getPort() {
        return listener != null ? listener.getLocalPort() : port;
    }

    /**
     * Gets the number of currently active session threads.
     *
     * @return The number of active threads.
     */
    public int getActiveThreads() {
        return executor.getActiveCount();
    }
}
