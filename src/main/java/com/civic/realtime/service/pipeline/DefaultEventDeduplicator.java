package com.civic.realtime.service.pipeline;

import com.civic.realtime.service.config.RealtimeConfig;
import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.model.ChangeEventKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Default implementation of EventDeduplicator.
 *
 * A soft cache of key -> last sighting. A duplicate does not refresh its
 * sighting, so a steady stream of redeliveries cannot extend the window.
 * Stale entries are swept opportunistically on insert once the map grows past
 * the eviction threshold; no timer thread is involved.
 */
@Slf4j
public class DefaultEventDeduplicator implements EventDeduplicator {

    private final MetricsAggregator metrics;
    private final Clock clock;
    private final long windowMs;
    private final int evictionThreshold;
    private final long evictionHorizonMs;

    private final Map<DedupKey, Long> lastSeen = new HashMap<>();

    public DefaultEventDeduplicator(RealtimeConfig.Dedup config, MetricsAggregator metrics, Clock clock) {
        config.validate();
        this.metrics = metrics;
        this.clock = clock;
        this.windowMs = config.getWindowMs();
        this.evictionThreshold = config.getEvictionThreshold();
        this.evictionHorizonMs = config.getWindowMs() * config.getEvictionHorizonMultiplier();
    }

    @Override
    public synchronized boolean isDuplicate(String scopeId, String table, ChangeEventKind kind, String recordId) {
        long now = clock.millis();
        DedupKey key = new DedupKey(scopeId, table, kind, recordId);

        Long previous = lastSeen.get(key);
        if (previous != null && now - previous < windowMs) {
            metrics.recordDeduplicated();
            log.debug("Duplicate event skipped: {}", key);
            return true;
        }

        lastSeen.put(key, now);
        if (lastSeen.size() > evictionThreshold) {
            evictOlderThan(now - evictionHorizonMs);
        }
        return false;
    }

    @Override
    public synchronized void clearScope(String scopeId) {
        lastSeen.keySet().removeIf(key -> key.scopeId().equals(scopeId));
        log.debug("Cleared deduplication state for scope: {}", scopeId);
    }

    @Override
    public synchronized void clearAll() {
        lastSeen.clear();
        log.info("Cleared all deduplication state");
    }

    @Override
    public synchronized int size() {
        return lastSeen.size();
    }

    private void evictOlderThan(long cutoffMs) {
        int before = lastSeen.size();
        Iterator<Map.Entry<DedupKey, Long>> it = lastSeen.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() < cutoffMs) {
                it.remove();
            }
        }
        log.debug("Dedup sweep evicted {} of {} entries", before - lastSeen.size(), before);
    }

    private record DedupKey(String scopeId, String table, ChangeEventKind kind, String recordId) {

        @Override
        public String toString() {
            return scopeId + "/" + table + ":" + kind + ":" + recordId;
        }
    }
}
