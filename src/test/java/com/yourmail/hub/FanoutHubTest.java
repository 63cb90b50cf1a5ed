package com.yourmail.hub;

import com.yourmail.config.server.HubConfig;
import com.yourmail.store.Message;
import com.yourmail.store.ThreadStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FanoutHubTest {

    private ThreadStore store;
    private FanoutHub hub;
    private ExecutorService pumps;

    @BeforeEach
    void setUp() throws Exception {
        store = mock(ThreadStore.class);
        when(store.unreadCount(anyLong())).thenReturn(3);

        Map<String, Object> map = new HashMap<>();
        map.put("keepaliveSeconds", 60);
        map.put("queueCapacity", 2);
        hub = new FanoutHub(new HubConfig(map), store);
        pumps = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        hub.close();
        pumps.shutdownNow();
    }

    private Message message(long id, long to) {
        return new Message()
                .setId(id)
                .setFromUserId(1L)
                .setToUserId(to)
                .setFrom("alice@example.test")
                .setTo("bob@example.test")
                .setSubject("Hello")
                .setBody("Hi")
                .setThreadId("t1")
                .setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void greetSendsConnectedThenCount() throws Exception {
        RecordingSink sink = new RecordingSink();
        Subscription subscription = hub.subscribe(2L, sink);

        hub.greet(subscription);

        List<String> frames = sink.getFrames();
        assertEquals(2, frames.size());
        assertEquals("event: connected\ndata: {\"message\":\"Connected to inbox updates\"}\n\n", frames.get(0));
        assertEquals("event: unread-count\ndata: {\"count\":3}\n\n", frames.get(1));
    }

    @Test
    void newMessageThenUnreadCount() throws Exception {
        RecordingSink sink = new RecordingSink();
        Subscription subscription = hub.subscribe(2L, sink);
        pumps.submit(subscription::pump);

        hub.notifyNewMessage(message(7L, 2L));

        List<String> frames = sink.await(2, 5, TimeUnit.SECONDS);
        assertEquals(2, frames.size());
        assertTrue(frames.get(0).startsWith("event: new-message\ndata: {\"id\":7,"), frames.get(0));
        assertEquals("event: unread-count\ndata: {\"count\":3}\n\n", frames.get(1));
    }

    @Test
    void eventsOnlyReachTheirAccount() throws Exception {
        RecordingSink bob = new RecordingSink();
        RecordingSink carol = new RecordingSink();
        hub.subscribe(2L, bob);
        hub.subscribe(3L, carol);

        assertEquals(1, hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":1}"));
        assertEquals(0, hub.notify(4L, EventKind.UNREAD_COUNT, "{\"count\":1}"));
    }

    @Test
    void everySubscriberOfAnAccountReceives() throws Exception {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        Subscription a = hub.subscribe(2L, first);
        Subscription b = hub.subscribe(2L, second);
        pumps.submit(a::pump);
        pumps.submit(b::pump);

        assertEquals(2, hub.notify(2L, EventKind.NEW_MESSAGE, message(1L, 2L)));
        assertEquals(1, first.await(1, 5, TimeUnit.SECONDS).size());
        assertEquals(1, second.await(1, 5, TimeUnit.SECONDS).size());
    }

    @Test
    void recipientWithoutAccountIsIgnored() {
        Message remote = message(1L, 2L).setToUserId(null);
        hub.notifyNewMessage(remote);
        assertEquals(0, hub.accountCount());
    }

    @Test
    void lastUnsubscribeRemovesAccount() throws Exception {
        Subscription a = hub.subscribe(2L, new RecordingSink());
        Subscription b = hub.subscribe(2L, new RecordingSink());
        assertEquals(2, hub.subscriberCount(2L));

        hub.unsubscribe(a);
        assertEquals(1, hub.accountCount());
        hub.unsubscribe(a);
        assertEquals(1, hub.subscriberCount(2L));

        hub.unsubscribe(b);
        assertEquals(0, hub.accountCount());
        assertFalse(hub.hasSubscribers(2L));
    }

    @Test
    void stalledSubscriberIsDropped() throws Exception {
        RecordingSink sink = new RecordingSink();
        Subscription subscription = hub.subscribe(2L, sink);

        // Nothing drains the queue, capacity is two.
        assertEquals(1, hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":1}"));
        assertEquals(1, hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":2}"));
        assertEquals(0, hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":3}"));

        assertTrue(subscription.isClosed());
        assertTrue(sink.isClosed());
        assertFalse(hub.hasSubscribers(2L));
    }

    @Test
    void sweepDropsFailedSubscribers() throws Exception {
        RecordingSink healthy = new RecordingSink();
        RecordingSink broken = new RecordingSink().setFailing(true);
        Subscription a = hub.subscribe(2L, healthy);
        Subscription b = hub.subscribe(2L, broken);
        pumps.submit(a::pump);
        pumps.submit(b::pump);

        hub.sweep();

        assertEquals(List.of(EventFrames.KEEPALIVE), healthy.await(1, 5, TimeUnit.SECONDS));
        assertTrue(b.awaitDone(5, TimeUnit.SECONDS));
        assertEquals(1, hub.subscriberCount(2L));
        assertTrue(broken.isClosed());
    }

    @Test
    void blockedSinkDoesNotHoldUpSweep() throws Exception {
        BlockingSink blocked = new BlockingSink();
        RecordingSink broken = new RecordingSink().setFailing(true);
        Subscription a = hub.subscribe(2L, blocked);
        Subscription b = hub.subscribe(3L, broken);
        pumps.submit(a::pump);
        pumps.submit(b::pump);

        hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":1}");
        assertTrue(blocked.awaitWriting(5, TimeUnit.SECONDS));

        Future<?> sweep = pumps.submit(() -> hub.sweep());
        sweep.get(3, TimeUnit.SECONDS);

        assertTrue(b.awaitDone(5, TimeUnit.SECONDS));
        assertFalse(hub.hasSubscribers(3L));
        assertTrue(hub.hasSubscribers(2L));

        // Nothing written for longer than two keepalive periods.
        sweep = pumps.submit(() -> hub.sweep(System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(121)));
        sweep.get(3, TimeUnit.SECONDS);

        assertFalse(hub.hasSubscribers(2L));
        assertTrue(a.isClosed());
        assertFalse(blocked.isClosed());

        blocked.release();
        assertTrue(a.awaitDone(5, TimeUnit.SECONDS));
        assertTrue(blocked.isClosed());
    }

    @Test
    void notifierDoesNotCloseBlockedSink() throws Exception {
        BlockingSink blocked = new BlockingSink();
        Subscription subscription = hub.subscribe(2L, blocked);
        pumps.submit(subscription::pump);

        hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":1}");
        assertTrue(blocked.awaitWriting(5, TimeUnit.SECONDS));

        // Pump is stuck on the first frame, capacity is two.
        assertEquals(1, hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":2}"));
        assertEquals(1, hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":3}"));
        assertEquals(0, hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":4}"));

        assertTrue(subscription.isClosed());
        assertFalse(hub.hasSubscribers(2L));
        assertFalse(blocked.isClosed());

        blocked.release();
        assertTrue(subscription.awaitDone(5, TimeUnit.SECONDS));
        assertTrue(blocked.isClosed());
    }

    @Test
    void pumpExitsWhenWriteFails() throws Exception {
        RecordingSink sink = new RecordingSink().setFailing(true);
        Subscription subscription = hub.subscribe(2L, sink);
        pumps.submit(subscription::pump);

        hub.notify(2L, EventKind.UNREAD_COUNT, "{\"count\":1}");

        assertTrue(subscription.awaitDone(5, TimeUnit.SECONDS));
        assertFalse(hub.hasSubscribers(2L));
    }

    @Test
    void closeReleasesPumps() throws Exception {
        Subscription subscription = hub.subscribe(2L, new RecordingSink());
        pumps.submit(subscription::pump);

        hub.close();

        assertTrue(subscription.awaitDone(5, TimeUnit.SECONDS));
        assertEquals(0, hub.accountCount());
        assertThrows(java.io.IOException.class, () -> hub.subscribe(2L, new RecordingSink()));
    }
}
