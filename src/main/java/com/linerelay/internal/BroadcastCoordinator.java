package com.linerelay.internal;

import com.linerelay.internal.event.RelayEventListener;
import com.linerelay.internal.protocol.MessageEnvelope;
import com.linerelay.internal.protocol.RelayProtocol;
import com.linerelay.internal.registry.BroadcastReport;
import com.linerelay.internal.registry.ConnectionRegistry;
import com.linerelay.internal.registry.SendResult;
import com.linerelay.internal.registry.WriteChannel;

import java.util.Objects;

/**
 * Per-connection protocol on top of the {@link ConnectionRegistry}: login,
 * relaying one line at a time, and removal once the connection's read side
 * fails or ends.
 */
public class BroadcastCoordinator {

    private final ConnectionRegistry registry;
    private final RelayEventListener events;

    public BroadcastCoordinator(ConnectionRegistry registry, RelayEventListener events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    /**
     * Registers the channel and sends {@code LOGIN:<id>} to that connection only.
     *
     * @return the result of the login write; a failed write leaves the
     *         connection registered
     * @throws IllegalStateException if the id vanished between register and send
     */
    public SendResult login(int connectionId, WriteChannel channel) {
        registry.register(connectionId, channel);
        events.onConnected(connectionId);
        SendResult result = registry.sendTo(connectionId, RelayProtocol.login(connectionId));
        if (result == SendResult.NOT_CONNECTED) {
            throw new IllegalStateException("client_id " + connectionId + " missing right after registration");
        }
        return result;
    }

    /** Relays one inbound line; empty lines are relayed too. */
    public BroadcastReport relay(int senderId, String line) {
        MessageEnvelope envelope = new MessageEnvelope(senderId, line);
        events.onMessage(envelope.getSenderId(), envelope.getText());
        return registry.broadcast(envelope.getSenderId(), envelope.toWire());
    }

    /**
     * Removes the connection if {@code channel} is still the one registered for
     * it. Pending writes are not drained.
     *
     * @param cause the read failure, or {@code null} for a clean end of stream
     */
    public boolean disconnect(int connectionId, WriteChannel channel, Exception cause) {
        if (cause != null) {
            events.onReadFailure(connectionId, cause);
        }
        boolean removed = registry.deregister(connectionId, channel);
        if (removed) {
            events.onDisconnected(connectionId);
        }
        return removed;
    }
}
