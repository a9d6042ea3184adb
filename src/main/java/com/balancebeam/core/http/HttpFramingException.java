package com.balancebeam.core.http;

import com.balancebeam.core.exceptions.ProtocolException;

/**
 * Thrown when bytes read from a socket cannot be framed into an HTTP message.
 * The {@link Kind} decides how the connection handler reacts.
 */
public class HttpFramingException extends ProtocolException {

    /**
     * Framing failure categories and the status a client sees for each.
     */
    public enum Kind {
        /** The stream ended before a complete request head was read. */
        INCOMPLETE_REQUEST(400),
        /** The request line or a header line could not be parsed. */
        MALFORMED_REQUEST(400),
        /** A Content-Length header is not a non-negative integer. */
        INVALID_CONTENT_LENGTH(400),
        /** The body is shorter than the announced Content-Length. */
        CONTENT_LENGTH_MISMATCH(400),
        /** The announced or chunked request body exceeds the size limit. */
        REQUEST_BODY_TOO_LARGE(413),
        /** The stream ended before a complete response head was read. */
        INCOMPLETE_RESPONSE(502),
        /** The status line or a header line of a response could not be parsed. */
        MALFORMED_RESPONSE(502),
        /** The response body exceeds the size limit. */
        RESPONSE_BODY_TOO_LARGE(502),
        /** The underlying socket failed. */
        CONNECTION_ERROR(503);

        private final int status;

        Kind(int status) {
            this.status = status;
        }

        /**
         * Status code answered to the client for this failure.
         *
         * @return HTTP status code.
         */
        public int status() {
            return status;
        }
    }

    private final Kind kind;
    private final int byteCount;
    private final long unreadBodyBytes;

    /**
     * Creates a framing exception.
     *
     * @param kind    The failure category.
     * @param message Detail message (logged, never sent to clients).
     */
    public HttpFramingException(Kind kind, String message) {
        this(kind, 0, message, null);
    }

    /**
     * Creates a framing exception for a stream that ended early.
     *
     * @param kind      The failure category.
     * @param byteCount Number of bytes consumed before the stream ended.
     * @param message   Detail message.
     */
    public HttpFramingException(Kind kind, int byteCount, String message) {
        this(kind, byteCount, message, null);
    }

    /**
     * Creates a framing exception caused by a transport failure.
     *
     * @param kind    The failure category.
     * @param message Detail message.
     * @param cause   The I/O failure.
     */
    public HttpFramingException(Kind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    /**
     * Creates a framing exception for a body that was announced but left on
     * the stream.
     *
     * @param kind            The failure category.
     * @param message         Detail message.
     * @param unreadBodyBytes Announced body length still waiting on the stream.
     */
    public HttpFramingException(Kind kind, String message, long unreadBodyBytes) {
        this(kind, 0, message, null, unreadBodyBytes);
    }

    private HttpFramingException(Kind kind, int byteCount, String message, Throwable cause) {
        this(kind, byteCount, message, cause, -1);
    }

    private HttpFramingException(Kind kind, int byteCount, String message, Throwable cause, long unreadBodyBytes) {
        super(message, cause);
        this.kind = kind;
        this.byteCount = byteCount;
        this.unreadBodyBytes = unreadBodyBytes;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Bytes consumed before an incomplete message ended. Zero for a peer that
     * closed cleanly between messages.
     *
     * @return Byte count.
     */
    public int getByteCount() {
        return byteCount;
    }

    /**
     * Length of a refused body that is still unread on the stream.
     *
     * @return Byte count, or -1 when unknown (the stream cannot be resynced).
     */
    public long getUnreadBodyBytes() {
        return unreadBodyBytes;
    }
}
