package com.balancebeam.core.utils;

import java.net.Socket;
import java.net.SocketException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common socket and stream helpers.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /**
     * Returns the textual IP address of the socket's remote peer.
     *
     * @param socket A connected socket.
     * @return e.g. {@code 127.0.0.1}.
     */
    public static String remoteIp(Socket socket) {
        return socket.getInetAddress().getHostAddress();
    }

    /**
     * Applies a read timeout to a socket. Zero leaves reads unbounded.
     *
     * @param socket    The socket.
     * @param timeoutMs Timeout in milliseconds, 0 for none.
     * @param name      Name of the socket for logging.
     */
    public static void applyReadTimeout(Socket socket, int timeoutMs, String name) {
        try {
            socket.setSoTimeout(Math.max(timeoutMs, 0));
        } catch (SocketException e) {
            log.debug("Failed to set read timeout on {}: {}", name, e.getMessage());
        }
    }

    /**
     * Safely closes a resource without throwing exceptions.
     * 
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     * 
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
