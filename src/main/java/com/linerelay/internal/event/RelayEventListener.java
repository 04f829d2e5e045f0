package com.linerelay.internal.event;

/**
 * Receives connection and failure events from the relay core. The core only
 * detects these; how they surface (logs, metrics) is up to the implementation.
 * Implementations are called from connection threads, sometimes while the
 * registry lock is held, so they must not block or call back into the registry.
 */
public interface RelayEventListener {

    default void onConnected(int connectionId) {
    }

    default void onDisconnected(int connectionId) {
    }

    default void onMessage(int senderId, String text) {
    }

    default void onWriteFailure(int connectionId, Exception cause) {
    }

    default void onReadFailure(int connectionId, Exception cause) {
    }

    default void onIdentifierCollision(int connectionId) {
    }

    RelayEventListener NO_OP = new RelayEventListener() {
    };
}
