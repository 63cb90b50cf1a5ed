package com.yourmail.hub;

import com.yourmail.config.server.HubConfig;
import com.yourmail.metrics.MailMetrics;
import com.yourmail.store.Message;
import com.yourmail.store.PersistenceException;
import com.yourmail.store.ThreadStore;
import com.yourmail.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-account registry of live subscribers.
 *
 * <p>The registry is guarded by a single reader/writer lock owned by this class.
 * <br>Notifiers take a snapshot under the read lock and hand frames to subscriber queues outside it,
 * so no sink I/O ever happens while the lock is held.
 *
 * <p>Derived unread-count events are computed on a bounded dispatch pool owned by the hub.
 * <br>A scheduled sweep queues a keepalive for every subscriber. Subscribers whose pump fails the write,
 * whose queue is full or that wrote nothing for two keepalive periods are dropped.
 *
 * @see Subscription
 */
public class FanoutHub implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(FanoutHub.class);

    private final Map<Long, List<Subscription>> subscribers = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ThreadStore store;
    private final int queueCapacity;
    private final long keepaliveSeconds;
    private final long shutdownSeconds;
    private final ThreadPoolExecutor dispatch;
    private final ScheduledExecutorService sweeper;

    private volatile boolean closed = false;

    /**
     * Constructs a new FanoutHub instance.
     *
     * @param config Hub configuration.
     * @param store  Thread store used for unread counts.
     */
    public FanoutHub(HubConfig config, ThreadStore store) {
        this.store = store;
        this.queueCapacity = config.getQueueCapacity();
        this.keepaliveSeconds = config.getKeepaliveSeconds();
        this.shutdownSeconds = config.getShutdownSeconds();

        this.dispatch = new ThreadPoolExecutor(
                config.getDispatchThreads(),
                config.getDispatchThreads(),
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(config.getDispatchQueueCapacity()),
                (task, executor) -> log.warn("Dispatch queue full, dropping derived notification")
        );
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "hub-keepalive");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the liveness sweep.
     */
    public void start() {
        sweeper.scheduleAtFixedRate(this::sweep, keepaliveSeconds, keepaliveSeconds, TimeUnit.SECONDS);
        log.info("Fan-out hub started, keepalive every {} seconds", keepaliveSeconds);
    }

    /**
     * Registers a subscriber for an account.
     *
     * @param accountId Account id.
     * @param sink      Output sink.
     * @return Subscription handle.
     * @throws IOException Hub is closed.
     */
    public Subscription subscribe(long accountId, EventSink sink) throws IOException {
        Subscription subscription = new Subscription(accountId, sink, queueCapacity, this);

        lock.writeLock().lock();
        try {
            if (closed) {
                throw new IOException("Hub is closed");
            }
            subscribers.computeIfAbsent(accountId, k -> new ArrayList<>()).add(subscription);
        } finally {
            lock.writeLock().unlock();
        }

        MailMetrics.subscriptionAdded();
        log.debug("Subscribed account {}", accountId);
        return subscription;
    }

    /**
     * Removes a subscriber and closes it.
     * <p>Idempotent. The account entry goes with its last subscriber.
     *
     * @param subscription Subscription handle.
     */
    public void unsubscribe(Subscription subscription) {
        boolean removed = false;

        lock.writeLock().lock();
        try {
            List<Subscription> list = subscribers.get(subscription.getAccountId());
            if (list != null) {
                removed = list.remove(subscription);
                if (list.isEmpty()) {
                    subscribers.remove(subscription.getAccountId());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        subscription.close();
        if (removed) {
            MailMetrics.subscriptionRemoved();
            log.debug("Unsubscribed account {}", subscription.getAccountId());
        }
    }

    /**
     * Sends the greeting and initial unread count straight to a new subscriber.
     *
     * @param subscription Subscription handle.
     * @throws IOException Peer gone.
     */
    public void greet(Subscription subscription) throws IOException {
        Map<String, Object> hello = Collections.singletonMap("message", "Connected to inbox updates");
        subscription.write(EventFrames.event(EventKind.CONNECTED, Json.toJson(hello)));

        try {
            int count = store.unreadCount(subscription.getAccountId());
            subscription.write(EventFrames.event(EventKind.UNREAD_COUNT, countJson(count)));
        } catch (PersistenceException e) {
            log.warn("Unable to compute initial unread count for account {}: {}",
                    subscription.getAccountId(), e.getMessage());
        }
    }

    /**
     * Queues an event for every subscriber of an account.
     * <p>Never blocks on subscriber I/O. A subscriber whose queue is full is dropped.
     *
     * @param accountId Account id.
     * @param kind      Event kind.
     * @param payload   Payload object, or a JSON string passed through as is.
     * @return Number of subscribers the event was queued for.
     */
    public int notify(long accountId, EventKind kind, Object payload) {
        List<Subscription> snapshot = snapshot(accountId);
        if (snapshot.isEmpty()) {
            return 0;
        }

        String frame = EventFrames.event(kind, payload instanceof String ? (String) payload : Json.toJson(payload));
        int delivered = 0;
        for (Subscription subscription : snapshot) {
            if (subscription.offer(frame)) {
                delivered++;
            } else {
                log.debug("Dropping stalled subscriber for account {}", accountId);
                unsubscribe(subscription);
            }
        }
        return delivered;
    }

    /**
     * Announces a newly stored message to its recipient.
     * <p>The recipient's unread count follows on the dispatch pool.
     *
     * @param message Stored message with a local recipient.
     */
    public void notifyNewMessage(Message message) {
        if (message.getToUserId() == null) {
            return;
        }
        long accountId = message.getToUserId();
        if (notify(accountId, EventKind.NEW_MESSAGE, message) > 0) {
            notifyUnreadCount(accountId);
        }
    }

    /**
     * Recomputes and pushes an account's unread count on the dispatch pool.
     *
     * @param accountId Account id.
     */
    public void notifyUnreadCount(long accountId) {
        if (closed || !hasSubscribers(accountId)) {
            return;
        }
        try {
            dispatch.execute(() -> {
                try {
                    int count = store.unreadCount(accountId);
                    notify(accountId, EventKind.UNREAD_COUNT, countJson(count));
                } catch (PersistenceException e) {
                    log.warn("Unable to compute unread count for account {}: {}", accountId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Dispatch pool shut down, skipping unread count for account {}", accountId);
        }
    }

    /**
     * Queues a keepalive for every subscriber, dropping stale and stalled ones.
     * <p>Never touches a sink.
     */
    void sweep() {
        sweep(System.currentTimeMillis());
    }

    void sweep(long now) {
        long maxAge = TimeUnit.SECONDS.toMillis(keepaliveSeconds * 2);
        for (Subscription subscription : snapshotAll()) {
            if (subscription.isStale(now, maxAge)) {
                log.debug("Dropping stale subscriber for account {}", subscription.getAccountId());
                unsubscribe(subscription);
            } else if (!subscription.offer(EventFrames.KEEPALIVE)) {
                log.debug("Keepalive not queued for account {}, dropping subscriber", subscription.getAccountId());
                unsubscribe(subscription);
            }
        }
    }

    /**
     * Checks if an account has any live subscriber.
     *
     * @param accountId Account id.
     * @return Boolean.
     */
    public boolean hasSubscribers(long accountId) {
        return !snapshot(accountId).isEmpty();
    }

    /**
     * Counts live subscribers for an account.
     *
     * @param accountId Account id.
     * @return Count.
     */
    public int subscriberCount(long accountId) {
        return snapshot(accountId).size();
    }

    /**
     * Counts accounts with at least one live subscriber.
     *
     * @return Count.
     */
    public int accountCount() {
        lock.readLock().lock();
        try {
            return subscribers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stops the sweep, drains pending dispatch work and closes every subscriber.
     */
    @Override
    public void close() {
        List<Subscription> all;
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lock.writeLock().unlock();
        }

        sweeper.shutdownNow();
        dispatch.shutdown();
        try {
            if (!dispatch.awaitTermination(shutdownSeconds, TimeUnit.SECONDS)) {
                log.warn("Dispatch pool did not drain in {} seconds", shutdownSeconds);
                dispatch.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatch.shutdownNow();
            Thread.currentThread().interrupt();
        }

        all = snapshotAll();
        for (Subscription subscription : all) {
            unsubscribe(subscription);
        }
        log.info("Fan-out hub closed, released {} subscribers", all.size());
    }

    private List<Subscription> snapshot(long accountId) {
        lock.readLock().lock();
        try {
            List<Subscription> list = subscribers.get(accountId);
            return list == null ? Collections.emptyList() : new ArrayList<>(list);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Subscription> snapshotAll() {
        List<Subscription> all = new ArrayList<>();
        lock.readLock().lock();
        try {
            subscribers.values().forEach(all::addAll);
        } finally {
            lock.readLock().unlock();
        }
        return all;
    }

    private static String countJson(int count) {
        return Json.toJson(Collections.singletonMap("count", count));
    }
}
