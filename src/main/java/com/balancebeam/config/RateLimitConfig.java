package com.balancebeam.config;

/**
 * Configuration for per-client rate limiting.
 */
public class RateLimitConfig {
    /** Maximum requests per client IP per window. 0 disables rate limiting. */
    private int maxRequestsPerMinute = 0;

    /**
     * Algorithm name. {@code fixed_window} is built in; other names are looked
     * up through {@link com.balancebeam.spi.RateLimiterProvider}.
     */
    private String algorithm = "fixed_window";

    /** Window length in seconds. */
    private int windowSeconds = 60;

    /** Status code answered to denied requests. */
    private int denialStatus = 429;

    public int getMaxRequestsPerMinute() {
        return maxRequestsPerMinute;
    }

    public void setMaxRequestsPerMinute(int maxRequestsPerMinute) {
        this.maxRequestsPerMinute = maxRequestsPerMinute;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getDenialStatus() {
        return denialStatus;
    }

    public void setDenialStatus(int denialStatus) {
        this.denialStatus = denialStatus;
    }
}
