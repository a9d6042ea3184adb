package com.balancebeam.core.upstream;

import com.balancebeam.core.exceptions.ConfigException;

/**
 * A {@code host:port} pair naming an upstream server or a listening address.
 *
 * @param host Host name or IP literal (IPv6 literals without brackets).
 * @param port TCP port in the range 1..65535 (0 allowed for listening).
 */
public record UpstreamAddress(String host, int port) {

    /**
     * Parses {@code host:port}. IPv6 literals are written in brackets, e.g.
     * {@code [::1]:8080}.
     *
     * @param value The address text.
     * @return The parsed address.
     * @throws ConfigException If the text is not a valid address.
     */
    public static UpstreamAddress parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Address must not be empty");
        }
        String text = value.trim();
        int colon = text.lastIndexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new ConfigException("Address must be in host:port form: " + value);
        }
        String host = text.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        } else if (host.contains(":")) {
            throw new ConfigException("IPv6 addresses must be enclosed in brackets: " + value);
        }
        if (host.isEmpty()) {
            throw new ConfigException("Address is missing a host: " + value);
        }
        int port;
        try {
            port = Integer.parseInt(text.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid port in address: " + value, e);
        }
        if (port < 0 || port > 65535) {
            throw new ConfigException("Port out of range in address: " + value);
        }
        return new UpstreamAddress(host, port);
    }

    @Override
    public String toString() {
        return host.contains(":") ? "[" + host + "]:" + port : host + ":" + port;
    }
}
