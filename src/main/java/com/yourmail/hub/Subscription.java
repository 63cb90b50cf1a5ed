package com.yourmail.hub;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live subscription handle.
 *
 * <p>Events and keepalives are queued by the hub and written by the connection's own worker in {@link #pump()},
 * so sink I/O never runs on a notifier's thread or on the hub's sweep.
 * <p>Once a pump has started only the pump closes the sink, on its way out.
 */
public class Subscription {
    private static final Logger log = LogManager.getLogger(Subscription.class);

    private static final String STOP = "";

    private final long accountId;
    private final EventSink sink;
    private final BlockingQueue<String> queue;
    private final FanoutHub hub;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean pumping = new AtomicBoolean(false);
    private final AtomicBoolean sinkClosed = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile long lastSeen = System.currentTimeMillis();

    Subscription(long accountId, EventSink sink, int capacity, FanoutHub hub) {
        this.accountId = accountId;
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.hub = hub;
    }

    public long getAccountId() {
        return accountId;
    }

    /**
     * Checks if nothing was written for longer than the given age.
     *
     * @param now    Current epoch milliseconds.
     * @param maxAge Maximum age in milliseconds.
     * @return Boolean.
     */
    boolean isStale(long now, long maxAge) {
        return now - lastSeen > maxAge;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Queues a frame without blocking.
     *
     * @param frame Frame text.
     * @return False if the queue is full or the subscription closed.
     */
    boolean offer(String frame) {
        return !closed.get() && queue.offer(frame);
    }

    /**
     * Writes a frame directly, bypassing the queue.
     * <p>Used for the greeting, on the same worker that later runs the pump.
     *
     * @param frame Frame text.
     * @throws IOException Peer gone.
     */
    void write(String frame) throws IOException {
        if (closed.get()) {
            throw new IOException("Subscription closed");
        }
        sink.write(frame);
        lastSeen = System.currentTimeMillis();
    }

    /**
     * Drains queued events to the sink until the subscription closes or a write fails.
     * <p>Blocks the calling thread, which should be the connection's worker.
     */
    public void pump() {
        pumping.set(true);
        try {
            while (!closed.get()) {
                String frame = queue.poll(1, TimeUnit.SECONDS);
                if (frame == null || frame.isEmpty()) {
                    continue;
                }
                write(frame);
            }
        } catch (IOException e) {
            log.debug("Subscriber for account {} went away: {}", accountId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            hub.unsubscribe(this);
            closeSink();
            done.countDown();
        }
    }

    /**
     * Waits for the pump to exit.
     *
     * @param timeout Timeout.
     * @param unit    Time unit.
     * @return True if the pump exited.
     * @throws InterruptedException Interrupted while waiting.
     */
    public boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    /**
     * Closes the subscription.
     * <p>Only the first call has effect. A running pump is woken and closes the sink itself,
     * otherwise the sink is closed here.
     */
    void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            queue.offer(STOP);
            if (!pumping.get()) {
                closeSink();
            }
        }
    }

    private void closeSink() {
        if (sinkClosed.compareAndSet(false, true)) {
            sink.close();
        }
    }
}
