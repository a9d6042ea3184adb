package com.balancebeam.core.ratelimit;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import com.balancebeam.spi.RateLimitDecision;
import com.balancebeam.spi.RateLimiterStrategy;

/**
 * Fixed window rate limiter.
 * <p>
 * Every identity gets a counter that resets once a full window has elapsed
 * since the window was opened. A request is denied when it pushes the counter
 * past the limit. A limit of 0 disables the limiter.
 * </p>
 */
public class FixedWindowRateLimiter implements RateLimiterStrategy {

    private final int limit;
    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock();
    // Entries are never evicted; the set of client IPs is expected to stay small.
    private final Map<String, Window> windows = new HashMap<>();

    private static final class Window {
        long start;
        int count;

        Window(long start) {
            this.start = start;
        }
    }

    public FixedWindowRateLimiter(int limit, Duration window) {
        this(limit, window, System::nanoTime);
    }

    /**
     * Creates a limiter with an explicit clock.
     *
     * @param limit     Allowed requests per window; 0 disables limiting.
     * @param window    Window length, must be positive.
     * @param nanoClock Monotonic clock in nanoseconds.
     */
    public FixedWindowRateLimiter(int limit, Duration window, LongSupplier nanoClock) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive: " + window);
        }
        this.limit = limit;
        this.windowNanos = window.toNanos();
        this.nanoClock = nanoClock;
    }

    @Override
    public RateLimitDecision checkAndRecord(String identity) {
        if (limit == 0) {
            return RateLimitDecision.ALLOWED;
        }
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            Window window = windows.computeIfAbsent(identity, k -> new Window(now));
            if (now - window.start >= windowNanos) {
                window.start = now;
                window.count = 0;
            }
            if (window.count <= limit) {
                window.count++;
            }
            return window.count > limit ? RateLimitDecision.DENIED : RateLimitDecision.ALLOWED;
        } finally {
            lock.unlock();
        }
    }

    public int getLimit() {
        return limit;
    }

    int trackedIdentities() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }
}
