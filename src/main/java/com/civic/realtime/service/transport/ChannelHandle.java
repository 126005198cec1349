package com.civic.realtime.service.transport;

import com.civic.realtime.service.model.ChangeEvent;

import java.util.Map;
import java.util.function.Consumer;

/**
 * A transport channel. Created by {@link RealtimeTransport#channel(String)} and
 * released through {@link RealtimeTransport#removeChannel(ChannelHandle)}.
 */
public interface ChannelHandle {

    /**
     * Gets the channel name.
     */
    String name();

    /**
     * Registers a row-change listener. Delivery is at-least-once and ordered per record.
     *
     * @param table    the table to listen to
     * @param filter   row-level filter expression, or null for every row
     * @param callback receives raw change events
     * @return this channel
     */
    ChannelHandle onChange(String table, String filter, Consumer<ChangeEvent<Map<String, Object>>> callback);

    /**
     * Opens the channel; the listener receives every subsequent status change.
     *
     * @param listener status callback
     * @return this channel
     */
    ChannelHandle subscribe(ChannelStatusListener listener);

    /**
     * Sends a broadcast message over the channel.
     *
     * @param payload the message
     */
    void send(BroadcastPayload payload);
}
