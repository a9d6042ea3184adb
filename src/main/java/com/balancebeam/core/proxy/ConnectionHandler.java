package com.balancebeam.core.proxy;

import java.io.IOException;
import java.net.Socket;

import com.balancebeam.core.constants.HeaderConstants;
import com.balancebeam.core.exceptions.AllUpstreamsDeadException;
import com.balancebeam.core.http.HttpCodec;
import com.balancebeam.core.http.HttpFramingException;
import com.balancebeam.core.http.HttpRequest;
import com.balancebeam.core.http.HttpResponse;
import com.balancebeam.core.upstream.UpstreamConnection;
import com.balancebeam.core.upstream.UpstreamRouter;
import com.balancebeam.spi.RateLimitDecision;
import com.balancebeam.spi.RateLimiterStrategy;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays requests from one client connection to its upstream.
 * <p>
 * The session is routed once, then requests are read, rate limited, tagged
 * with {@code X-Forwarded-For}, forwarded and answered strictly one after
 * another until the client hangs up or the upstream fails. Client framing
 * errors are answered with 4xx and the session keeps going; upstream errors
 * are answered with 502 and end the session.
 * </p>
 * A single handler instance serves all connections of a {@link ProxyServer}.
 */
public class ConnectionHandler {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    private static final int HTTP_BAD_GATEWAY = 502;

    /** Largest refused Content-Length body skipped to keep a connection usable. */
    static final long MAX_DISCARD_BYTES = 100_000_000L;

    private final UpstreamRouter router;
    private final RateLimiterStrategy rateLimiter;
    private final int maxBodySize;
    private final int denialStatus;
    private final Counter requestsTotal;
    private final Counter requestsRateLimited;

    /**
     * Creates a handler.
     *
     * @param router        Routes each new session to an upstream.
     * @param rateLimiter   Per-client limiter.
     * @param maxBodySize   Largest request or response body relayed.
     * @param denialStatus  Status answered to rate-limited requests.
     * @param meterRegistry Registry for request counters.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ConnectionHandler(UpstreamRouter router, RateLimiterStrategy rateLimiter, int maxBodySize,
            int denialStatus, MeterRegistry meterRegistry) {
        this.router = router;
        this.rateLimiter = rateLimiter;
        this.maxBodySize = maxBodySize;
        this.denialStatus = denialStatus;
        this.requestsTotal = Counter.builder("balancebeam.requests.total")
                .description("Requests read from clients")
                .register(meterRegistry);
        this.requestsRateLimited = Counter.builder("balancebeam.requests.rate_limited")
                .description("Requests denied by the rate limiter")
                .register(meterRegistry);
    }

    /**
     * Serves one client connection until it terminates. The socket is closed
     * on return.
     *
     * @param client The accepted client socket.
     * @throws IOException If the client socket streams cannot be obtained.
     */
    public void handle(Socket client) throws IOException {
        try (ClientSession session = new ClientSession(client)) {
            log.info("Connection received from {}", session.getClientIp());
            try {
                session.bind(router.route());
            } catch (AllUpstreamsDeadException e) {
                log.error("Cannot serve {}: {}", session.getClientIp(), e.getMessage());
                sendResponse(session, HttpCodec.errorResponse(HTTP_BAD_GATEWAY));
                return;
            }
            serve(session);
        }
    }

    private void serve(ClientSession session) {
        while (true) {
            HttpRequest request;
            try {
                request = HttpCodec.readRequest(session.getClientIn(), maxBodySize);
            } catch (HttpFramingException e) {
                if (!answerFramingError(session, e)) {
                    return;
                }
                continue;
            }
            requestsTotal.increment();

            if (!processRequest(session, request)) {
                return;
            }
        }
    }

    /**
     * Reacts to a request that could not be read.
     *
     * @return True if the session should keep serving.
     */
    private boolean answerFramingError(ClientSession session, HttpFramingException e) {
        switch (e.getKind()) {
            case INCOMPLETE_REQUEST:
                if (e.getByteCount() == 0) {
                    log.debug("Client {} finished sending requests. Shutting down connection",
                            session.getClientIp());
                    return false;
                }
                break;
            case CONNECTION_ERROR:
                log.info("Error reading request from client {}: {}", session.getClientIp(), e.getMessage());
                return false;
            case REQUEST_BODY_TOO_LARGE:
                return answerOversizedBody(session, e);
            default:
                break;
        }
        log.debug("Error parsing request from {}: {} ({})", session.getClientIp(), e.getKind(), e.getMessage());
        return sendResponse(session, HttpCodec.errorResponse(e.getKind().status()));
    }

    /**
     * Sends 413, then skips the refused body so the next request parses. A
     * chunked body of unknown length, or one above {@link #MAX_DISCARD_BYTES},
     * ends the session instead.
     */
    private boolean answerOversizedBody(ClientSession session, HttpFramingException e) {
        log.debug("Refusing request body from {}: {}", session.getClientIp(), e.getMessage());
        if (!sendResponse(session, HttpCodec.errorResponse(e.getKind().status()))) {
            return false;
        }
        long unread = e.getUnreadBodyBytes();
        if (unread < 0 || unread > MAX_DISCARD_BYTES) {
            log.info("Closing connection from {} after refusing a body that cannot be skipped",
                    session.getClientIp());
            return false;
        }
        try {
            HttpCodec.discard(session.getClientIn(), unread);
            return true;
        } catch (IOException ex) {
            log.info("Client {} went away while its refused body was skipped: {}",
                    session.getClientIp(), ex.getMessage());
            return false;
        }
    }

    /**
     * Rate limits, forwards and answers one request.
     *
     * @return True if the session should keep serving.
     */
    private boolean processRequest(ClientSession session, HttpRequest request) {
        String clientIp = session.getClientIp();
        UpstreamConnection upstream = session.getUpstream();
        log.info("{} -> {}: {}", clientIp, upstream.getAddress(), request.requestLine());

        if (rateLimiter.checkAndRecord(clientIp) == RateLimitDecision.DENIED) {
            requestsRateLimited.increment();
            log.warn("Rate limit exceeded for {}", clientIp);
            return sendResponse(session, HttpCodec.errorResponse(denialStatus));
        }

        request.getHeaders().extend(HeaderConstants.X_FORWARDED_FOR.getValue(), clientIp);

        try {
            HttpCodec.writeRequest(request, upstream.getOutputStream());
        } catch (IOException e) {
            log.error("Failed to send request to upstream {}: {}", upstream.getAddress(), e.getMessage());
            sendResponse(session, HttpCodec.errorResponse(HTTP_BAD_GATEWAY));
            return false;
        }
        log.debug("Forwarded request to upstream {}", upstream.getAddress());

        HttpResponse response;
        try {
            response = HttpCodec.readResponse(upstream.getInputStream(), request.getMethod(), maxBodySize);
        } catch (HttpFramingException e) {
            log.error("Error reading response from upstream {}: {} ({})", upstream.getAddress(), e.getKind(),
                    e.getMessage());
            sendResponse(session, HttpCodec.errorResponse(HTTP_BAD_GATEWAY));
            return false;
        }

        if (!sendResponse(session, response)) {
            return false;
        }
        log.debug("Forwarded response to client {}", clientIp);
        return true;
    }

    /**
     * Writes a response to the client.
     *
     * @return False if the client could not be written to.
     */
    private boolean sendResponse(ClientSession session, HttpResponse response) {
        log.info("{} <- {}", session.getClientIp(), response.statusLine());
        try {
            HttpCodec.writeResponse(response, session.getClientOut());
            return true;
        } catch (IOException e) {
            log.warn("Failed to send response to client {}: {}", session.getClientIp(), e.getMessage());
            return false;
        }
    }
}
