package com.balancebeam.core.constants;

import java.util.Locale;
import java.util.Optional;

/**
 * Built-in rate limiting algorithms. Algorithms not listed here are resolved
 * through {@link com.balancebeam.spi.RateLimiterProvider}.
 */
public enum RateLimiterType {
    /**
     * Counts requests in discrete, non-overlapping windows of fixed length.
     * Default.
     */
    FIXED_WINDOW;

    /**
     * Resolves a configured algorithm name. Matching ignores case and treats
     * {@code -} and {@code _} alike, so {@code fixed-window} and
     * {@code FIXED_WINDOW} are the same algorithm.
     *
     * @param name The configured name.
     * @return The built-in type, or empty if the name is not built in.
     */
    public static Optional<RateLimiterType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        for (RateLimiterType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Normalizes an algorithm name for comparison.
     *
     * @param name The raw name.
     * @return Upper-case name with dashes replaced by underscores.
     */
    public static String normalize(String name) {
        return name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
