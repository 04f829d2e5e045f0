package com.linerelay.internal.registry;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-connection results of one broadcast sweep, in sweep order.
 */
@Getter
@ToString
public final class BroadcastReport {
    private final int senderId;
    private final Map<Integer, SendResult> results;

    BroadcastReport(int senderId, LinkedHashMap<Integer, SendResult> results) {
        this.senderId = senderId;
        this.results = Collections.unmodifiableMap(results);
    }

    public SendResult resultFor(int connectionId) {
        return results.getOrDefault(connectionId, SendResult.NOT_CONNECTED);
    }

    /** Number of peers (sender excluded) the message was written to. */
    public int deliveredToPeers() {
        int count = 0;
        for (Map.Entry<Integer, SendResult> e : results.entrySet()) {
            if (e.getKey() != senderId && e.getValue() == SendResult.DELIVERED) {
                count++;
            }
        }
        return count;
    }

    public int failures() {
        int count = 0;
        for (SendResult r : results.values()) {
            if (r == SendResult.WRITE_FAILED) {
                count++;
            }
        }
        return count;
    }
}
