package com.balancebeam.core.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import com.balancebeam.core.constants.HeaderConstants;
import com.balancebeam.core.http.HttpFramingException.Kind;

/**
 * Reads and writes HTTP/1.x messages on blocking streams.
 * <p>
 * Input streams should be buffered by the caller; heads are consumed one byte
 * at a time so that nothing past the end of a message is read.
 * </p>
 */
public final class HttpCodec {

    private HttpCodec() {
        // Utility class
    }

    /** Maximum size of a request or response head, request line included. */
    public static final int MAX_HEADERS_SIZE = 8000;

    /** Maximum number of header lines in one message. */
    public static final int MAX_NUM_HEADERS = 32;

    /** Default maximum body size in bytes. */
    public static final int DEFAULT_MAX_BODY_SIZE = 10_000_000;

    private static final String HTTP_1_1 = "HTTP/1.1";
    private static final String CRLF = "\r\n";
    private static final Pattern TOKEN = Pattern.compile("[!#$%&'*+.^_`|~0-9A-Za-z-]+");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern VERSION = Pattern.compile("HTTP/1\\.[01]");
    private static final Pattern STATUS = Pattern.compile("[0-9]{3}");

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(200, "OK"), Map.entry(201, "Created"),
            Map.entry(204, "No Content"), Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"), Map.entry(304, "Not Modified"),
            Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(413, "Payload Too Large"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    /**
     * Reads one request from the stream.
     *
     * @param in          Client input stream.
     * @param maxBodySize Largest accepted body in bytes.
     * @return The parsed request.
     * @throws HttpFramingException If the bytes do not form a valid request or
     *                              the stream fails.
     */
    public static HttpRequest readRequest(InputStream in, int maxBodySize) {
        List<String> head = readHead(in, Kind.INCOMPLETE_REQUEST, Kind.MALFORMED_REQUEST);

        String[] parts = head.get(0).split(" ", -1);
        if (parts.length != 3 || !TOKEN.matcher(parts[0]).matches() || parts[1].isEmpty()
                || !VERSION.matcher(parts[2]).matches()) {
            throw new HttpFramingException(Kind.MALFORMED_REQUEST, "Malformed request line: " + head.get(0));
        }
        HttpHeaders headers = parseHeaders(head, Kind.MALFORMED_REQUEST);

        byte[] body;
        if (isChunked(headers)) {
            body = readChunkedBody(in, maxBodySize, Kind.REQUEST_BODY_TOO_LARGE, Kind.MALFORMED_REQUEST);
            // the body is consumed first so the connection stays in sync for the next request
            if (headers.contains(HeaderConstants.CONTENT_LENGTH.getValue())) {
                throw new HttpFramingException(Kind.MALFORMED_REQUEST,
                        "Request carries both Transfer-Encoding: chunked and Content-Length");
            }
        } else {
            long length = contentLength(headers);
            if (length > maxBodySize) {
                throw new HttpFramingException(Kind.REQUEST_BODY_TOO_LARGE,
                        "Request body of " + length + " bytes exceeds limit of " + maxBodySize, length);
            }
            body = length > 0 ? readExactly(in, (int) length) : new byte[0];
        }
        return new HttpRequest(parts[0], parts[1], parts[2], headers, body);
    }

    /**
     * Writes a request to the stream exactly as it was parsed.
     *
     * @param request The request.
     * @param out     Upstream output stream.
     * @throws IOException If the write fails.
     */
    public static void writeRequest(HttpRequest request, OutputStream out) throws IOException {
        writeMessage(request.requestLine(), request.getHeaders(), request.getBody(), out);
    }

    /**
     * Reads one response from the stream.
     *
     * @param in            Upstream input stream.
     * @param requestMethod Method of the request being answered; a {@code HEAD}
     *                      response never carries a body.
     * @param maxBodySize   Largest accepted body in bytes.
     * @return The parsed response.
     * @throws HttpFramingException If the bytes do not form a valid response or
     *                              the stream fails.
     */
    public static HttpResponse readResponse(InputStream in, String requestMethod, int maxBodySize) {
        List<String> head = readHead(in, Kind.INCOMPLETE_RESPONSE, Kind.MALFORMED_RESPONSE);

        String statusLine = head.get(0);
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || !VERSION.matcher(parts[0]).matches() || !STATUS.matcher(parts[1]).matches()) {
            throw new HttpFramingException(Kind.MALFORMED_RESPONSE, "Malformed status line: " + statusLine);
        }
        int status = Integer.parseInt(parts[1]);
        String reason = parts.length == 3 ? parts[2].trim() : "";
        HttpHeaders headers = parseHeaders(head, Kind.MALFORMED_RESPONSE);

        byte[] body = new byte[0];
        if (mayHaveBody(requestMethod, status)) {
            if (isChunked(headers)) {
                body = readChunkedBody(in, maxBodySize, Kind.RESPONSE_BODY_TOO_LARGE, Kind.MALFORMED_RESPONSE);
            } else if (headers.contains(HeaderConstants.CONTENT_LENGTH.getValue())) {
                long length = contentLength(headers);
                if (length > maxBodySize) {
                    throw new HttpFramingException(Kind.RESPONSE_BODY_TOO_LARGE,
                            "Response body of " + length + " bytes exceeds limit of " + maxBodySize);
                }
                body = length > 0 ? readExactly(in, (int) length) : body;
            } else {
                body = readToEnd(in, maxBodySize);
            }
        }
        return new HttpResponse(parts[0], status, reason, headers, body);
    }

    /**
     * Writes a response to the stream exactly as it was parsed.
     *
     * @param response The response.
     * @param out      Client output stream.
     * @throws IOException If the write fails.
     */
    public static void writeResponse(HttpResponse response, OutputStream out) throws IOException {
        writeMessage(response.statusLine(), response.getHeaders(), response.getBody(), out);
    }

    /**
     * Builds a minimal plain-text response for a status the proxy generates
     * itself. The body only names the status.
     *
     * @param status HTTP status code.
     * @return A response with {@code Content-Type} and {@code Content-Length}.
     */
    public static HttpResponse errorResponse(int status) {
        String reason = reasonPhrase(status);
        byte[] body = ("HTTP " + status + " " + reason).trim().getBytes(StandardCharsets.US_ASCII);
        HttpHeaders headers = new HttpHeaders();
        headers.add(HeaderConstants.CONTENT_TYPE.getValue(), "text/plain");
        headers.add(HeaderConstants.CONTENT_LENGTH.getValue(), String.valueOf(body.length));
        return new HttpResponse(HTTP_1_1, status, reason, headers, body);
    }

    /**
     * Looks up the standard reason phrase for a status code.
     *
     * @param status HTTP status code.
     * @return The reason phrase, or an empty string when unknown.
     */
    public static String reasonPhrase(int status) {
        return REASON_PHRASES.getOrDefault(status, "");
    }

    private static void writeMessage(String startLine, HttpHeaders headers, byte[] body, OutputStream out)
            throws IOException {
        StringBuilder sb = new StringBuilder(256);
        sb.append(startLine).append(CRLF);
        for (HttpHeaders.Field field : headers) {
            sb.append(field.name()).append(": ").append(field.value()).append(CRLF);
        }
        sb.append(CRLF);
        out.write(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (body.length > 0) {
            out.write(body);
        }
        out.flush();
    }

    /**
     * Reads a message head: the start line and header lines up to the blank
     * line. Empty lines before the start line are skipped.
     */
    private static List<String> readHead(InputStream in, Kind incomplete, Kind malformed) {
        List<String> lines = new ArrayList<>();
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        int total = 0;
        try {
            while (true) {
                int c = in.read();
                if (c == -1) {
                    throw new HttpFramingException(incomplete, total,
                            "Stream closed after " + total + " bytes of message head");
                }
                if (++total > MAX_HEADERS_SIZE) {
                    throw new HttpFramingException(malformed,
                            "Message head exceeds " + MAX_HEADERS_SIZE + " bytes");
                }
                if (c != '\n') {
                    line.write(c);
                    continue;
                }
                String text = stripCr(line.toString(StandardCharsets.ISO_8859_1));
                line.reset();
                if (text.isEmpty()) {
                    if (lines.isEmpty()) {
                        continue;
                    }
                    return lines;
                }
                lines.add(text);
                if (lines.size() > MAX_NUM_HEADERS + 1) {
                    throw new HttpFramingException(malformed,
                            "Too many headers (exceeds limit of " + MAX_NUM_HEADERS + ")");
                }
            }
        } catch (IOException e) {
            throw new HttpFramingException(Kind.CONNECTION_ERROR, "Error reading message head", e);
        }
    }

    private static HttpHeaders parseHeaders(List<String> head, Kind malformed) {
        HttpHeaders headers = new HttpHeaders();
        for (int i = 1; i < head.size(); i++) {
            String line = head.get(i);
            int idx = line.indexOf(':');
            if (idx <= 0 || !TOKEN.matcher(line.substring(0, idx)).matches()) {
                throw new HttpFramingException(malformed, "Malformed header line: " + line);
            }
            headers.add(line.substring(0, idx), line.substring(idx + 1).trim());
        }
        return headers;
    }

    private static boolean isChunked(HttpHeaders headers) {
        String te = headers.get(HeaderConstants.TRANSFER_ENCODING.getValue());
        return te != null && te.toLowerCase(Locale.ROOT).contains("chunked");
    }

    /**
     * Parses Content-Length. Repeated headers must agree. Absent means zero.
     */
    private static long contentLength(HttpHeaders headers) {
        long length = 0;
        Long seen = null;
        for (String value : headers.getAll(HeaderConstants.CONTENT_LENGTH.getValue())) {
            if (!DIGITS.matcher(value).matches() || value.length() > 18) {
                throw new HttpFramingException(Kind.INVALID_CONTENT_LENGTH, "Invalid Content-Length: " + value);
            }
            length = Long.parseLong(value);
            if (seen != null && seen != length) {
                throw new HttpFramingException(Kind.INVALID_CONTENT_LENGTH, "Conflicting Content-Length headers");
            }
            seen = length;
        }
        return length;
    }

    private static boolean mayHaveBody(String requestMethod, int status) {
        return !"HEAD".equalsIgnoreCase(requestMethod) && status >= 200 && status != 204 && status != 304;
    }

    private static byte[] readExactly(InputStream in, int length) {
        try {
            byte[] body = in.readNBytes(length);
            if (body.length < length) {
                throw new HttpFramingException(Kind.CONTENT_LENGTH_MISMATCH,
                        "Expected " + length + " body bytes but stream ended after " + body.length);
            }
            return body;
        } catch (IOException e) {
            throw new HttpFramingException(Kind.CONNECTION_ERROR, "Error reading message body", e);
        }
    }

    private static byte[] readToEnd(InputStream in, int maxBodySize) {
        try {
            byte[] body = in.readNBytes(maxBodySize + 1);
            if (body.length > maxBodySize) {
                throw new HttpFramingException(Kind.RESPONSE_BODY_TOO_LARGE,
                        "Response body exceeds limit of " + maxBodySize);
            }
            return body;
        } catch (IOException e) {
            throw new HttpFramingException(Kind.CONNECTION_ERROR, "Error reading message body", e);
        }
    }

    /**
     * Skips a body the proxy refused to read, so the next message on the
     * stream starts at the right byte.
     *
     * @param in    Client input stream.
     * @param count Number of bytes to skip.
     * @throws IOException If the stream fails or ends first.
     */
    public static void discard(InputStream in, long count) throws IOException {
        in.skipNBytes(count);
    }

    /**
     * Reads a chunked body and returns it with its framing intact, so it can be
     * forwarded byte for byte. Chunk lines, extensions and trailers count
     * towards the limit together with the data; framing gets
     * {@link #MAX_HEADERS_SIZE} bytes of slack on top of {@code maxBodySize}.
     */
    private static byte[] readChunkedBody(InputStream in, int maxBodySize, Kind tooLarge, Kind malformed) {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        long rawLimit = maxBodySize + (long) MAX_HEADERS_SIZE;
        long dataBytes = 0;
        try {
            while (true) {
                String sizeLine = readRawLine(in, raw, malformed);
                checkRawSize(raw, rawLimit, tooLarge);
                int semicolon = sizeLine.indexOf(';');
                String hex = (semicolon >= 0 ? sizeLine.substring(0, semicolon) : sizeLine).trim();
                long size;
                try {
                    size = Long.parseLong(hex, 16);
                } catch (NumberFormatException e) {
                    throw new HttpFramingException(malformed, "Invalid chunk size: " + sizeLine);
                }
                if (size < 0) {
                    throw new HttpFramingException(malformed, "Invalid chunk size: " + sizeLine);
                }
                if (size == 0) {
                    // trailer section ends with an empty line
                    while (!readRawLine(in, raw, malformed).isEmpty()) {
                        checkRawSize(raw, rawLimit, tooLarge);
                    }
                    checkRawSize(raw, rawLimit, tooLarge);
                    return raw.toByteArray();
                }
                if (size > maxBodySize - dataBytes || size > rawLimit - raw.size()) {
                    throw new HttpFramingException(tooLarge, "Chunked body exceeds limit of " + maxBodySize);
                }
                dataBytes += size;
                byte[] chunk = in.readNBytes((int) size);
                if (chunk.length < size) {
                    throw new HttpFramingException(malformed, "Stream ended inside a chunk");
                }
                raw.write(chunk);
                if (!readRawLine(in, raw, malformed).isEmpty()) {
                    throw new HttpFramingException(malformed, "Missing CRLF after chunk data");
                }
                checkRawSize(raw, rawLimit, tooLarge);
            }
        } catch (IOException e) {
            throw new HttpFramingException(Kind.CONNECTION_ERROR, "Error reading chunked body", e);
        }
    }

    private static void checkRawSize(ByteArrayOutputStream raw, long rawLimit, Kind tooLarge) {
        if (raw.size() > rawLimit) {
            throw new HttpFramingException(tooLarge,
                    "Chunked body with framing exceeds " + rawLimit + " bytes");
        }
    }

    /**
     * Reads one line, copying its raw bytes (terminator included) to
     * {@code sink}, and returns the text without the terminator.
     */
    private static String readRawLine(InputStream in, ByteArrayOutputStream sink, Kind malformed)
            throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(16);
        int c;
        while ((c = in.read()) != -1) {
            sink.write(c);
            if (c == '\n') {
                return stripCr(line.toString(StandardCharsets.ISO_8859_1));
            }
            if (line.size() >= MAX_HEADERS_SIZE) {
                throw new HttpFramingException(malformed, "Chunk line too long");
            }
            line.write(c);
        }
        throw new HttpFramingException(malformed, "Stream ended inside chunked body");
    }

    private static String stripCr(String text) {
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
