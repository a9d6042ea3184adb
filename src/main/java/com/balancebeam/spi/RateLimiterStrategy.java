package com.balancebeam.spi;

/**
 * Strategy interface for per-client rate limiting.
 * Implementations are shared by all connection handlers and must be
 * thread-safe.
 */
public interface RateLimiterStrategy {
    /**
     * Records one request for the identity and decides whether it may proceed.
     *
     * @param identity The client identity (its IP address).
     * @return {@link RateLimitDecision#ALLOWED} or
     *         {@link RateLimitDecision#DENIED}.
     */
    RateLimitDecision checkAndRecord(String identity);
}
