package com.linerelay.internal.registry;

/** Outcome of writing to one registered connection. */
public enum SendResult {
    DELIVERED,
    NOT_CONNECTED,
    WRITE_FAILED
}
