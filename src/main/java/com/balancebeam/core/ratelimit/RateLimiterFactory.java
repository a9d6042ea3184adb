package com.balancebeam.core.ratelimit;

import java.time.Duration;
import java.util.Optional;
import java.util.ServiceLoader;

import com.balancebeam.config.RateLimitConfig;
import com.balancebeam.core.constants.RateLimiterType;
import com.balancebeam.core.exceptions.ConfigException;
import com.balancebeam.spi.RateLimiterProvider;
import com.balancebeam.spi.RateLimiterStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the rate limiter named in the configuration.
 * Built-in algorithms are tried first, then {@link RateLimiterProvider}
 * implementations discovered through {@link ServiceLoader}.
 */
public class RateLimiterFactory {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterFactory.class);

    private RateLimiterFactory() {
        // Utility class
    }

    /**
     * Creates a rate limiter.
     *
     * @param config The rate limit configuration.
     * @return A new rate limiter.
     * @throws ConfigException If no built-in algorithm or provider matches.
     */
    public static RateLimiterStrategy create(RateLimitConfig config) {
        String algorithm = config.getAlgorithm();
        Optional<RateLimiterType> builtIn = RateLimiterType.fromName(algorithm);
        if (builtIn.isPresent()) {
            switch (builtIn.get()) {
                case FIXED_WINDOW:
                    return new FixedWindowRateLimiter(config.getMaxRequestsPerMinute(),
                            Duration.ofSeconds(config.getWindowSeconds()));
                default:
                    throw new ConfigException("Unsupported rate limiter: " + algorithm);
            }
        }

        if (algorithm != null && !algorithm.isBlank()) {
            String wanted = RateLimiterType.normalize(algorithm);
            ServiceLoader<RateLimiterProvider> loader = ServiceLoader.load(RateLimiterProvider.class);
            for (RateLimiterProvider provider : loader) {
                String type = provider.getType();
                if (type == null) {
                    log.warn("Ignoring rate limiter provider {} without a type", provider.getClass().getName());
                    continue;
                }
                if (RateLimiterType.normalize(type).equals(wanted)) {
                    log.info("Using rate limiter '{}' from provider {}", algorithm, provider.getClass().getName());
                    return provider.create(config);
                }
            }
        }
        throw new ConfigException("Unknown rate limiter: " + algorithm);
    }
}
