package com.civic.realtime.service.transport;

/**
 * Receives status changes of a single channel.
 */
@FunctionalInterface
public interface ChannelStatusListener {

    /**
     * @param status the new channel status
     * @param error  the transport error, when the status carries one; may be null
     */
    void onStatus(ChannelStatus status, Throwable error);
}
