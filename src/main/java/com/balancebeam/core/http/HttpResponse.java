package com.balancebeam.core.http;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A parsed or synthesized HTTP/1.x response.
 */
public class HttpResponse {

    private final String version;
    private final int status;
    private final String reason;
    private final HttpHeaders headers;
    private final byte[] body;

    /**
     * Creates a response.
     *
     * @param version Protocol version, e.g. {@code HTTP/1.1}.
     * @param status  Three-digit status code.
     * @param reason  Reason phrase, possibly empty.
     * @param headers Header fields.
     * @param body    Raw body bytes (chunked framing included when present).
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HttpResponse(String version, int status, String reason, HttpHeaders headers, byte[] body) {
        this.version = version;
        this.status = status;
        this.reason = reason;
        this.headers = headers;
        this.body = body;
    }

    public String getVersion() {
        return version;
    }

    public int getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
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
     * Formats the status line for logging.
     *
     * @return e.g. {@code HTTP/1.1 200 OK}.
     */
    public String statusLine() {
        return reason.isEmpty() ? version + " " + status : version + " " + status + " " + reason;
    }
}
