package com.balancebeam.core.http;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A parsed HTTP/1.x request. Headers are mutable so the proxy can extend
 * {@code X-Forwarded-For} before forwarding; everything else is fixed.
 */
public class HttpRequest {

    private final String method;
    private final String target;
    private final String version;
    private final HttpHeaders headers;
    private final byte[] body;

    /**
     * Creates a request.
     *
     * @param method  Request method, e.g. {@code GET}.
     * @param target  Request target as sent on the request line.
     * @param version Protocol version, e.g. {@code HTTP/1.1}.
     * @param headers Header fields.
     * @param body    Raw body bytes (chunked framing included when present).
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HttpRequest(String method, String target, String version, HttpHeaders headers, byte[] body) {
        this.method = method;
        this.target = target;
        this.version = version;
        this.headers = headers;
        this.body = body;
    }

    public String getMethod() {
        return method;
    }

    public String getTarget() {
        return target;
    }

    public String getVersion() {
        return version;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public HttpHeaders getHeaders() {
        return headers;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    /**
     * Formats the request line for logging.
     *
     * @return e.g. {@code GET /index.html HTTP/1.1}.
     */
    public String requestLine() {
        return method + " " + target + " " + version;
    }
}
