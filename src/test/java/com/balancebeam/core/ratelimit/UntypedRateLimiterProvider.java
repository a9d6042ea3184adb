package com.balancebeam.core.ratelimit;

import com.balancebeam.config.RateLimitConfig;
import com.balancebeam.spi.RateLimiterProvider;
import com.balancebeam.spi.RateLimiterStrategy;

/**
 * Test plugin that reports no type. Listed first in META-INF/services.
 */
public class UntypedRateLimiterProvider implements RateLimiterProvider {

    @Override
    public String getType() {
        return null;
    }

    @Override
    public RateLimiterStrategy create(RateLimitConfig config) {
        throw new IllegalStateException("an untyped provider is never selected");
    }
}
