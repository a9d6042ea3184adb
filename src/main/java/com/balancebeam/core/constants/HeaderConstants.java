package com.balancebeam.core.constants;

/**
 * Common HTTP header names used by the load balancer.
 */
public enum HeaderConstants {
    /** The Standard HTTP Host header. */
    HOST("Host"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Media type of the entity body. */
    CONTENT_TYPE("Content-Type"),
    /** Type of encoding used to transfer the entity. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Chain of client addresses the request passed through. */
    X_FORWARDED_FOR("X-Forwarded-For");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the standard string value of the header.
     * 
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }
}
