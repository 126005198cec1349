package com.civic.realtime.service.transport;

/**
 * The hosted publish/subscribe backend the realtime layer consumes.
 *
 * Only the connection manager opens and releases channels.
 */
public interface RealtimeTransport {

    /**
     * Creates a channel with the given name.
     *
     * @param name channel name
     * @return a new, not yet subscribed channel
     * @throws TransportException if the channel cannot be created
     */
    ChannelHandle channel(String name);

    /**
     * Releases a channel and its transport resources.
     *
     * @param handle the channel to release
     * @throws TransportException if the transport fails to release it
     */
    void removeChannel(ChannelHandle handle);
}
