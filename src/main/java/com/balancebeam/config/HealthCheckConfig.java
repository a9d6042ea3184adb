package com.balancebeam.config;

/**
 * Configuration for active health checks.
 */
public class HealthCheckConfig {
    /** Seconds between probe cycles. 0 disables active health checks. */
    private int interval = 10;

    /** Path requested from every upstream on each probe. */
    private String path = "/";

    /** Connect and read timeout for a single probe in milliseconds. 0 means none. */
    private int timeout = 0;

    public int getInterval() {
        return interval;
    }

    public void setInterval(int interval) {
        this.interval = interval;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    /**
     * Checks whether the probe schedule should run at all.
     *
     * @return true if the interval is positive.
     */
    public boolean isEnabled() {
        return interval > 0;
    }
}
