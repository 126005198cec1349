package com.civic.realtime.service.config;

import com.civic.realtime.service.connection.RealtimeException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the realtime distribution layer.
 *
 * Every value is a per-manager default; nothing here is a hard-coded constant.
 * Invalid values fail when the manager is constructed, not at first use.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "realtime")
public class RealtimeConfig {

    /**
     * Event deduplication settings.
     */
    private Dedup dedup = new Dedup();

    /**
     * Client-side rate limiting settings.
     */
    private RateLimit rateLimit = new RateLimit();

    /**
     * Reconnection backoff settings.
     */
    private Reconnect reconnect = new Reconnect();

    /**
     * Heartbeat settings.
     */
    private Heartbeat heartbeat = new Heartbeat();

    /**
     * Consumer dispatch settings.
     */
    private Dispatch dispatch = new Dispatch();

    /**
     * Validates every group.
     *
     * @throws RealtimeException with code INVALID_CONFIGURATION
     */
    public void validate() {
        dedup.validate();
        rateLimit.validate();
        reconnect.validate();
        heartbeat.validate();
        dispatch.validate();
    }

    @Getter
    @Setter
    public static class Dedup {

        /**
         * Enable event deduplication.
         */
        private boolean enabled = true;

        /**
         * Window within which identical events collapse into one delivery.
         */
        private long windowMs = 2000;

        /**
         * Map size above which stale entries are swept.
         */
        private int evictionThreshold = 1000;

        /**
         * Entries older than windowMs times this multiplier are swept.
         */
        private int evictionHorizonMultiplier = 5;

        /**
         * Record column holding the row identifier.
         */
        private String idField = "id";

        public void validate() {
            require(windowMs > 0, "realtime.dedup.window-ms must be positive");
            require(evictionThreshold > 0, "realtime.dedup.eviction-threshold must be positive");
            require(evictionHorizonMultiplier >= 1, "realtime.dedup.eviction-horizon-multiplier must be at least 1");
            require(idField != null && !idField.isBlank(), "realtime.dedup.id-field is required");
        }
    }

    @Getter
    @Setter
    public static class RateLimit {

        /**
         * Events admitted per window. Zero rejects everything.
         */
        private int eventsPerSecond = 10;

        /**
         * Window length in milliseconds.
         */
        private long windowMs = 1000;

        /**
         * Keep one window per scope instead of a single global one.
         */
        private boolean perScope = true;

        public void validate() {
            require(eventsPerSecond >= 0, "realtime.rate-limit.events-per-second must not be negative");
            require(windowMs > 0, "realtime.rate-limit.window-ms must be positive");
        }
    }

    @Getter
    @Setter
    public static class Reconnect {

        private long baseDelayMs = 1000;

        private long maxDelayMs = 30000;

        private int maxAttempts = 5;

        /**
         * Upper bound of the random offset added to each delay.
         */
        private long maxJitterMs = 1000;

        /**
         * Time a resubscribed channel has to acknowledge before the attempt counts as failed.
         */
        private long ackTimeoutMs = 10000;

        public void validate() {
            require(baseDelayMs >= 0, "realtime.reconnect.base-delay-ms must not be negative");
            require(maxDelayMs >= baseDelayMs, "realtime.reconnect.max-delay-ms must be >= base-delay-ms");
            require(maxAttempts >= 1, "realtime.reconnect.max-attempts must be at least 1");
            require(maxJitterMs >= 0, "realtime.reconnect.max-jitter-ms must not be negative");
            require(ackTimeoutMs > 0, "realtime.reconnect.ack-timeout-ms must be positive");
        }
    }

    @Getter
    @Setter
    public static class Heartbeat {

        private boolean enabled = true;

        private long intervalMs = 30000;

        private String channelName = "heartbeat";

        public void validate() {
            require(intervalMs > 0, "realtime.heartbeat.interval-ms must be positive");
            require(channelName != null && !channelName.isBlank(), "realtime.heartbeat.channel-name is required");
        }
    }

    @Getter
    @Setter
    public static class Dispatch {

        /**
         * Capacity of each subscription's mailbox; overflow is dropped and counted.
         */
        private int queueCapacity = 256;

        /**
         * Threads draining subscription mailboxes.
         */
        private int threadCount = 2;

        public void validate() {
            require(queueCapacity > 0, "realtime.dispatch.queue-capacity must be positive");
            require(threadCount > 0, "realtime.dispatch.thread-count must be positive");
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw RealtimeException.invalidConfiguration(message);
        }
    }
}
