package com.balancebeam.config;

/**
 * Configuration for the administration server (pool health and metrics).
 */
public class AdminConfig {
    private boolean enabled = false;
    private int port = 9090;
    /** Bind address for the admin server. Defaults to loopback for security. */
    private String bindAddress = "127.0.0.1";

    /**
     * Checks if the admin server is enabled.
     * 
     * @return true if enabled, false otherwise.
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Sets whether the admin server is enabled.
     * 
     * @param enabled true to enable, false to disable.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }
}
