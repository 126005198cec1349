package com.civic.realtime.service.pipeline;

import com.civic.realtime.service.config.RealtimeConfig;
import com.civic.realtime.service.metrics.MetricsAggregator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Fixed-window counter per scope.
 *
 * Windows reset lazily on the next admission check once they have elapsed.
 * Bursts up to the limit are accepted; no smoothing is attempted.
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    private final MetricsAggregator metrics;
    private final Clock clock;
    private final long windowMs;

    private final Map<String, RateWindow> windows = new HashMap<>();

    public FixedWindowRateLimiter(RealtimeConfig.RateLimit config, MetricsAggregator metrics, Clock clock) {
        config.validate();
        this.metrics = metrics;
        this.clock = clock;
        this.windowMs = config.getWindowMs();
    }

    @Override
    public synchronized boolean shouldAdmit(String scope, int limitPerWindow) {
        if (limitPerWindow < 0) {
            throw new IllegalArgumentException("Rate limit must not be negative: " + limitPerWindow);
        }
        long now = clock.millis();
        RateWindow window = windows.computeIfAbsent(scope, s -> new RateWindow(now));

        if (now - window.startedAtMs >= windowMs) {
            window.count = 0;
            window.startedAtMs = now;
        }

        if (window.count >= limitPerWindow) {
            metrics.recordRateLimited();
            log.debug("Rate limited event for scope {} ({} per {} ms)", scope, limitPerWindow, windowMs);
            return false;
        }

        window.count++;
        return true;
    }

    @Override
    public synchronized void clear(String scope) {
        windows.remove(scope);
    }

    private static final class RateWindow {
        long startedAtMs;
        int count;

        RateWindow(long startedAtMs) {
            this.startedAtMs = startedAtMs;
        }
    }
}
