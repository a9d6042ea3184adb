package com.balancebeam.spi;

import com.balancebeam.config.RateLimitConfig;

/**
 * Service Provider Interface (SPI) for plugging in rate limiting algorithms.
 * Third-party plugins should implement this interface and register it in
 * META-INF/services/com.balancebeam.spi.RateLimiterProvider.
 */
public interface RateLimiterProvider {
    /**
     * Retrieves the algorithm name this provider supports.
     * <p>
     * This corresponds to the 'rateLimit.algorithm' field in the configuration
     * and the --rate-limiter option. Matching ignores case and treats '-' and
     * '_' alike.
     * </p>
     *
     * @return The supported algorithm name.
     */
    String getType();

    /**
     * Creates a new limiter.
     *
     * @param config The rate limit configuration.
     * @return A ready-to-use, thread-safe limiter.
     */
    RateLimiterStrategy create(RateLimitConfig config);
}
