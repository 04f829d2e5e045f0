package com.linerelay.internal;

public enum ConnectionState {
    CONNECTING,
    LOGGED_IN,
    CLOSED
}
