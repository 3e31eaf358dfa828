package com.tripplanner.routing.util;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Allows at most {@code maxCalls} acquisitions within any rolling window.
 */
public class SlidingWindowRateLimiter {

    private final int maxCalls;
    private final long windowMillis;
    private final Clock clock;
    private final Deque<Long> calls = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxCalls, Duration window, Clock clock) {
        if (maxCalls <= 0 || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate limit needs positive calls and window");
        }
        this.maxCalls = maxCalls;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        while (!calls.isEmpty() && now - calls.peekFirst() >= windowMillis) {
            calls.pollFirst();
        }
        if (calls.size() >= maxCalls) {
            return false;
        }
        calls.addLast(now);
        return true;
    }
}
