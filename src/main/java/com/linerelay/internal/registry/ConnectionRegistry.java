package com.linerelay.internal.registry;

import com.linerelay.internal.event.RelayEventListener;
import com.linerelay.internal.protocol.RelayProtocol;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection id -> write channel for every live client.
 *
 * Every operation runs under this object's monitor, including the whole
 * broadcast sweep, so fan-out writes are serialized and a slow peer delays
 * the rest of the sweep.
 */
@Slf4j
public class ConnectionRegistry {

    private final Map<Integer, WriteChannel> channels = new LinkedHashMap<>();
    private final RelayEventListener events;

    public ConnectionRegistry() {
        this(RelayEventListener.NO_OP);
    }

    public ConnectionRegistry(RelayEventListener events) {
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Registers {@code channel} under {@code id}. An existing entry for the same
     * id is overwritten; the displaced channel is returned and left open.
     */
    public synchronized Optional<WriteChannel> register(int id, WriteChannel channel) {
        requireValidId(id);
        Objects.requireNonNull(channel, "channel");
        WriteChannel previous = channels.put(id, channel);
        if (previous != null && previous != channel) {
            events.onIdentifierCollision(id);
        }
        return Optional.ofNullable(previous);
    }

    /** Removes {@code id}; returns false if it was not registered. */
    public synchronized boolean deregister(int id) {
        return channels.remove(id) != null;
    }

    /**
     * Removes {@code id} only while it still maps to {@code channel}, so a task
     * whose id was taken over by a newer connection leaves that entry alone.
     */
    public synchronized boolean deregister(int id, WriteChannel channel) {
        return channels.remove(id, channel);
    }

    public synchronized SendResult sendTo(int id, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        WriteChannel channel = channels.get(id);
        if (channel == null) {
            return SendResult.NOT_CONNECTED;
        }
        return write(id, channel, bytes);
    }

    /**
     * Sends {@code payload} to every registered connection except the sender,
     * and the acknowledgement token to the sender. A failed write is reported
     * and the sweep moves on.
     */
    public synchronized BroadcastReport broadcast(int senderId, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        LinkedHashMap<Integer, SendResult> results = new LinkedHashMap<>();
        for (Map.Entry<Integer, WriteChannel> entry : channels.entrySet()) {
            int id = entry.getKey();
            byte[] bytes = id == senderId ? RelayProtocol.ack() : payload;
            results.put(id, write(id, entry.getValue(), bytes));
        }
        log.trace("Broadcast from {} swept {} connections", senderId, results.size());
        return new BroadcastReport(senderId, results);
    }

    public synchronized boolean contains(int id) {
        return channels.containsKey(id);
    }

    public synchronized int size() {
        return channels.size();
    }

    /** Sorted snapshot of the registered ids. */
    public synchronized List<Integer> connectionIds() {
        List<Integer> ids = new ArrayList<>(channels.keySet());
        Collections.sort(ids);
        return ids;
    }

    /** Closes and removes every channel; used on server shutdown. */
    public synchronized void closeAll() {
        for (Map.Entry<Integer, WriteChannel> entry : channels.entrySet()) {
            try {
                entry.getValue().close();
            } catch (IOException e) {
                log.debug("Closing channel for client_id {} failed: {}", entry.getKey(), e.getMessage());
            }
        }
        channels.clear();
    }

    private SendResult write(int id, WriteChannel channel, byte[] bytes) {
        try {
            channel.write(bytes);
            return SendResult.DELIVERED;
        } catch (IOException | RuntimeException e) {
            events.onWriteFailure(id, e);
            return SendResult.WRITE_FAILED;
        }
    }

    static void requireValidId(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Connection id must not be negative: " + id);
        }
    }
}
