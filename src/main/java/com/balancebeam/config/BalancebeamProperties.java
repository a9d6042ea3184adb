package com.balancebeam.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.balancebeam.core.exceptions.ConfigException;
import com.balancebeam.core.http.HttpCodec;
import com.balancebeam.core.upstream.UpstreamAddress;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for the load balancer.
 * Maps to the top-level structure of the YAML configuration file; command-line
 * options are applied on top.
 */
public class BalancebeamProperties {
    /** Address to listen on, {@code host:port}. */
    private String bind = "0.0.0.0:1100";

    /** Upstream servers, {@code host:port} each. At least one is required. */
    private List<String> upstreams = new ArrayList<>();

    /** Upstream connect timeout in milliseconds. 0 means none. */
    private int connectTimeout = 0;

    /** Read timeout for client and upstream sockets in milliseconds. 0 means none. */
    private int readTimeout = 0;

    /** Largest request or response body relayed, in bytes. */
    private int maxBodySize = HttpCodec.DEFAULT_MAX_BODY_SIZE;

    /** Active health check configuration. */
    private HealthCheckConfig healthCheck = new HealthCheckConfig();

    /** Rate limiting configuration. */
    private RateLimitConfig rateLimit = new RateLimitConfig();

    /** Administration and metrics configuration. */
    private AdminConfig admin = new AdminConfig();

    public String getBind() {
        return bind;
    }

    public void setBind(String bind) {
        this.bind = bind;
    }

    public List<String> getUpstreams() {
        return upstreams == null ? null : Collections.unmodifiableList(upstreams);
    }

    public void setUpstreams(List<String> upstreams) {
        this.upstreams = upstreams == null ? null : new ArrayList<>(upstreams);
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getMaxBodySize() {
        return maxBodySize;
    }

    public void setMaxBodySize(int maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public HealthCheckConfig getHealthCheck() {
        return healthCheck;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setHealthCheck(HealthCheckConfig healthCheck) {
        this.healthCheck = healthCheck;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RateLimitConfig getRateLimit() {
        return rateLimit;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setRateLimit(RateLimitConfig rateLimit) {
        this.rateLimit = rateLimit;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    /**
     * Parses the configured upstream list.
     *
     * @return Upstream addresses in configuration order.
     * @throws ConfigException If an address is malformed.
     */
    public List<UpstreamAddress> upstreamAddresses() {
        List<UpstreamAddress> addresses = new ArrayList<>();
        if (upstreams != null) {
            for (String upstream : upstreams) {
                UpstreamAddress address = UpstreamAddress.parse(upstream);
                if (address.port() == 0) {
                    throw new ConfigException("Upstream port must not be 0: " + upstream);
                }
                addresses.add(address);
            }
        }
        return addresses;
    }

    /**
     * Parses the listening address.
     *
     * @return The bind address.
     * @throws ConfigException If the address is malformed.
     */
    public UpstreamAddress bindAddress() {
        return UpstreamAddress.parse(bind);
    }

    /**
     * Checks the configuration for values the proxy cannot run with.
     *
     * @throws ConfigException Describing the first problem found.
     */
    public void validate() {
        if (upstreams == null || upstreams.isEmpty()) {
            throw new ConfigException(
                    "At least one upstream server must be specified using the --upstream option.");
        }
        bindAddress();
        upstreamAddresses();
        if (connectTimeout < 0 || readTimeout < 0) {
            throw new ConfigException("Timeouts must not be negative");
        }
        if (maxBodySize <= 0) {
            throw new ConfigException("maxBodySize must be positive: " + maxBodySize);
        }
        if (healthCheck == null || rateLimit == null || admin == null) {
            throw new ConfigException("healthCheck, rateLimit and admin sections must not be null");
        }
        validateHealthCheck();
        validateRateLimit();
    }

    private void validateHealthCheck() {
        if (healthCheck.getInterval() < 0) {
            throw new ConfigException("Health check interval must not be negative: " + healthCheck.getInterval());
        }
        if (healthCheck.getTimeout() < 0) {
            throw new ConfigException("Health check timeout must not be negative: " + healthCheck.getTimeout());
        }
        String path = healthCheck.getPath();
        if (path == null || !path.startsWith("/") || path.contains(" ")) {
            throw new ConfigException("Health check path must start with '/' and contain no spaces: " + path);
        }
    }

    private void validateRateLimit() {
        if (rateLimit.getMaxRequestsPerMinute() < 0) {
            throw new ConfigException(
                    "maxRequestsPerMinute must not be negative: " + rateLimit.getMaxRequestsPerMinute());
        }
        if (rateLimit.getWindowSeconds() <= 0) {
            throw new ConfigException("Rate limit window must be positive: " + rateLimit.getWindowSeconds());
        }
        if (rateLimit.getDenialStatus() < 400 || rateLimit.getDenialStatus() > 599) {
            throw new ConfigException("Denial status must be a 4xx or 5xx code: " + rateLimit.getDenialStatus());
        }
        if (rateLimit.getAlgorithm() == null || rateLimit.getAlgorithm().isBlank()) {
            throw new ConfigException("Rate limiter algorithm must not be empty");
        }
    }
}
