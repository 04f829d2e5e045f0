package com.linerelay.internal.event;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingRelayEventListener implements RelayEventListener {

    @Override
    public void onConnected(int connectionId) {
        log.info("[LOGIN] client_id {} registered", connectionId);
    }

    @Override
    public void onDisconnected(int connectionId) {
        log.info("[CLOSE] client_id {} removed", connectionId);
    }

    @Override
    public void onMessage(int senderId, String text) {
        log.debug("message {} {}", senderId, text);
    }

    @Override
    public void onWriteFailure(int connectionId, Exception cause) {
        log.warn("Failed to send data to client_id {}: {}", connectionId, cause.getMessage());
    }

    @Override
    public void onReadFailure(int connectionId, Exception cause) {
        log.info("[READ] read failed for client_id {}: {}", connectionId, cause.getMessage());
    }

    @Override
    public void onIdentifierCollision(int connectionId) {
        log.warn("client_id {} was already registered, replacing its channel", connectionId);
    }
}
