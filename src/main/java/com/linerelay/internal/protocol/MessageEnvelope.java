package com.linerelay.internal.protocol;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * One inbound line together with the connection it came from. Built once per
 * line and consumed by a single broadcast.
 */
@Getter
@ToString
public final class MessageEnvelope {
    private final int senderId;
    private final String text;

    public MessageEnvelope(int senderId, String text) {
        if (senderId < 0) {
            throw new IllegalArgumentException("Connection id must not be negative: " + senderId);
        }
        this.senderId = senderId;
        this.text = Objects.requireNonNull(text, "text");
    }

    /** Wire form delivered to every peer other than the sender. */
    public byte[] toWire() {
        return RelayProtocol.message(senderId, text);
    }
}
