package com.balancebeam.core.exceptions;

/**
 * Thrown by the router when no upstream in the pool is currently alive.
 * Terminal for the client session that triggered the routing attempt.
 */
public class AllUpstreamsDeadException extends ProxyException {
    /**
     * Constructs a new AllUpstreamsDeadException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public AllUpstreamsDeadException(String message) {
        super(message);
    }
}
