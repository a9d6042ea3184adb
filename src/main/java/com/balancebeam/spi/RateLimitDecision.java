package com.balancebeam.spi;

/**
 * Outcome of a rate limit check.
 */
public enum RateLimitDecision {
    ALLOWED,
    DENIED
}
