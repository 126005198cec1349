package com.civic.realtime.service.pipeline;

/**
 * Admission control protecting event consumers from bursts.
 */
public interface RateLimiter {

    /**
     * Decides whether one more event may be admitted for the given scope.
     *
     * @param scope the logical source (a scope id, or a shared global key)
     * @param limitPerWindow events admitted per window; zero rejects everything
     * @return true if admitted
     * @throws IllegalArgumentException if the limit is negative
     */
    boolean shouldAdmit(String scope, int limitPerWindow);

    /**
     * Forgets the window of a scope.
     *
     * @param scope the logical source
     */
    void clear(String scope);
}
