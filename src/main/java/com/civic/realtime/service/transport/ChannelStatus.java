package com.civic.realtime.service.transport;

/**
 * Channel status values reported by the transport's subscribe callback.
 */
public enum ChannelStatus {
    SUBSCRIBED,
    CHANNEL_ERROR,
    TIMED_OUT,
    CLOSED
}
