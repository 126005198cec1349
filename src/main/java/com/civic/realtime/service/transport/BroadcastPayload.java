package com.civic.realtime.service.transport;

import java.util.Map;

/**
 * Broadcast message sent over a channel, e.g. the heartbeat ping.
 */
public record BroadcastPayload(String type, String event, Map<String, Object> payload) {

    public static final String BROADCAST = "broadcast";

    public BroadcastPayload {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static BroadcastPayload broadcast(String event, Map<String, Object> payload) {
        return new BroadcastPayload(BROADCAST, event, payload);
    }
}
