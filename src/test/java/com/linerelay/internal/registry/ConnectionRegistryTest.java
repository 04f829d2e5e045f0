package com.linerelay.internal.registry;

import com.linerelay.internal.event.RecordingEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionRegistryTest {

    private RecordingEventListener events;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        events = new RecordingEventListener();
        registry = new ConnectionRegistry(events);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void registerThenContains() {
        RecordingWriteChannel channel = new RecordingWriteChannel();
        assertEquals(Optional.empty(), registry.register(100, channel));
        assertTrue(registry.contains(100));
        assertEquals(1, registry.size());
    }

    @Test
    void negativeIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(-1, new RecordingWriteChannel()));
    }

    @Test
    void collidingRegisterOverwritesAndKeepsOneEntry() {
        RecordingWriteChannel first = new RecordingWriteChannel();
        RecordingWriteChannel second = new RecordingWriteChannel();
        registry.register(100, first);

        Optional<WriteChannel> displaced = registry.register(100, second);

        assertSame(first, displaced.orElseThrow());
        assertFalse(first.isClosed(), "displaced channel is left to its owner");
        assertEquals(1, registry.size());
        registry.sendTo(100, bytes("x\n"));
        assertEquals("x\n", second.text());
        assertEquals("", first.text());
        assertEquals(List.of("collision 100"), events.events);
    }

    @Test
    void deregisterAbsentIsNoOp() {
        assertFalse(registry.deregister(42));
        assertEquals(0, registry.size());
    }

    @Test
    void conditionalDeregisterIgnoresStaleChannel() {
        RecordingWriteChannel stale = new RecordingWriteChannel();
        RecordingWriteChannel current = new RecordingWriteChannel();
        registry.register(100, stale);
        registry.register(100, current);

        assertFalse(registry.deregister(100, stale));
        assertTrue(registry.contains(100));
        assertTrue(registry.deregister(100, current));
        assertFalse(registry.contains(100));
    }

    @Test
    void sendToClassifiesOutcome() {
        RecordingWriteChannel ok = new RecordingWriteChannel();
        registry.register(1, ok);
        registry.register(2, RecordingWriteChannel.failing());

        assertEquals(SendResult.DELIVERED, registry.sendTo(1, bytes("hi\n")));
        assertEquals(SendResult.WRITE_FAILED, registry.sendTo(2, bytes("hi\n")));
        assertEquals(SendResult.NOT_CONNECTED, registry.sendTo(3, bytes("hi\n")));
        assertEquals("hi\n", ok.text());
    }

    @Test
    void writeFailureDoesNotDeregister() {
        registry.register(2, RecordingWriteChannel.failing());
        registry.sendTo(2, bytes("hi\n"));
        registry.broadcast(1, bytes("MESSAGE:1 hi\n"));
        assertTrue(registry.contains(2));
        assertEquals(List.of("write-failure 2", "write-failure 2"), events.events);
    }

    @Test
    void broadcastSendsAckToSenderAndPayloadToOthers() {
        RecordingWriteChannel sender = new RecordingWriteChannel();
        RecordingWriteChannel peerA = new RecordingWriteChannel();
        RecordingWriteChannel peerB = new RecordingWriteChannel();
        registry.register(100, sender);
        registry.register(200, peerA);
        registry.register(300, peerB);

        BroadcastReport report = registry.broadcast(100, bytes("MESSAGE:100 hello\n"));

        assertEquals(List.of("ACK:MESSAGE"), sender.lines());
        assertEquals(List.of("MESSAGE:100 hello"), peerA.lines());
        assertEquals(List.of("MESSAGE:100 hello"), peerB.lines());
        assertEquals(2, report.deliveredToPeers());
        assertEquals(0, report.failures());
        assertEquals(SendResult.DELIVERED, report.resultFor(100));
        assertEquals(100, report.getSenderId());
        assertEquals(List.of(100, 200, 300), new ArrayList<>(report.getResults().keySet()));
        assertThrows(UnsupportedOperationException.class,
              () -> report.getResults().put(400, SendResult.DELIVERED));
    }

    @Test
    void failingPeerDoesNotStopTheSweep() {
        RecordingWriteChannel a = RecordingWriteChannel.failing();
        RecordingWriteChannel b = new RecordingWriteChannel();
        RecordingWriteChannel c = new RecordingWriteChannel();
        RecordingWriteChannel sender = new RecordingWriteChannel();
        registry.register(1, a);
        registry.register(2, b);
        registry.register(3, c);
        registry.register(4, sender);

        BroadcastReport report = registry.broadcast(4, bytes("MESSAGE:4 x\n"));

        assertEquals(SendResult.WRITE_FAILED, report.resultFor(1));
        assertEquals(List.of("MESSAGE:4 x"), b.lines());
        assertEquals(List.of("MESSAGE:4 x"), c.lines());
        assertEquals(List.of("ACK:MESSAGE"), sender.lines());
        assertEquals(1, report.failures());
    }

    @Test
    void failingSenderStillDeliversToPeers() {
        registry.register(1, RecordingWriteChannel.failing());
        RecordingWriteChannel peer = new RecordingWriteChannel();
        registry.register(2, peer);

        BroadcastReport report = registry.broadcast(1, bytes("MESSAGE:1 x\n"));

        assertEquals(SendResult.WRITE_FAILED, report.resultFor(1));
        assertEquals(List.of("MESSAGE:1 x"), peer.lines());
    }

    @Test
    void deregisteredIdReceivesNothingAndCanRegisterAgain() {
        RecordingWriteChannel old = new RecordingWriteChannel();
        RecordingWriteChannel sender = new RecordingWriteChannel();
        registry.register(100, old);
        registry.register(200, sender);
        registry.deregister(100);

        registry.broadcast(200, bytes("MESSAGE:200 x\n"));
        assertEquals(0, old.attempts());

        RecordingWriteChannel fresh = new RecordingWriteChannel();
        assertEquals(Optional.empty(), registry.register(100, fresh));
        registry.broadcast(200, bytes("MESSAGE:200 y\n"));
        assertEquals(List.of("MESSAGE:200 y"), fresh.lines());
        assertFalse(events.events.contains("collision 100"));
    }

    @Test
    void connectionIdsAreSorted() {
        registry.register(300, new RecordingWriteChannel());
        registry.register(100, new RecordingWriteChannel());
        registry.register(200, new RecordingWriteChannel());
        assertEquals(List.of(100, 200, 300), registry.connectionIds());
    }

    @Test
    void closeAllClosesAndClears() {
        RecordingWriteChannel a = new RecordingWriteChannel();
        RecordingWriteChannel b = new RecordingWriteChannel();
        registry.register(1, a);
        registry.register(2, b);

        registry.closeAll();

        assertTrue(a.isClosed());
        assertTrue(b.isClosed());
        assertEquals(0, registry.size());
    }

    @Test
    void concurrentRegistrationsKeepOneEntryPerId() throws Exception {
        int threads = 8;
        int idsPerThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int id = 0; id < idsPerThread; id++) {
                        registry.register(id, new RecordingWriteChannel());
                        registry.broadcast(id, bytes("MESSAGE:" + id + " x\n"));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(idsPerThread, registry.size());
    }
}
