package com.linerelay.internal.protocol;

import java.nio.charset.StandardCharsets;

/**
 * Wire format of the relay:
 *  - server -> client on join:              LOGIN:&lt;id&gt;\n
 *  - server -> every peer except sender:    MESSAGE:&lt;id&gt; &lt;text&gt;\n
 *  - server -> sender for each line:        ACK:MESSAGE\n
 *
 * Client -> server is any \n-terminated UTF-8 line.
 */
public final class RelayProtocol {

    public static final String LOGIN_PREFIX = "LOGIN:";
    public static final String MESSAGE_PREFIX = "MESSAGE:";
    public static final String ACK = "ACK:MESSAGE";
    public static final char LINE_DELIMITER = '\n';

    private static final byte[] ACK_BYTES = (ACK + LINE_DELIMITER).getBytes(StandardCharsets.UTF_8);

    private RelayProtocol() {
    }

    public static byte[] login(int connectionId) {
        return (LOGIN_PREFIX + connectionId + LINE_DELIMITER).getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] message(int senderId, String text) {
        return (MESSAGE_PREFIX + senderId + " " + text + LINE_DELIMITER).getBytes(StandardCharsets.UTF_8);
    }

    // fresh copy, callers may hand it to a channel that keeps the array
    public static byte[] ack() {
        return ACK_BYTES.clone();
    }
}
