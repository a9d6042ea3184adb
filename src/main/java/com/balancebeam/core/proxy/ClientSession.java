package com.balancebeam.core.proxy;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

import com.balancebeam.core.upstream.UpstreamConnection;
import com.balancebeam.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * One client connection and the upstream connection it was routed to.
 * The upstream is chosen once and reused for every request on the session.
 */
public class ClientSession implements Closeable {

    private final Socket client;
    private final String clientIp;
    private final InputStream clientIn;
    private final OutputStream clientOut;
    private UpstreamConnection upstream;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ClientSession(Socket client) throws IOException {
        this.client = client;
        this.clientIp = IoUtils.remoteIp(client);
        this.clientIn = new BufferedInputStream(client.getInputStream());
        this.clientOut = client.getOutputStream();
    }

    public String getClientIp() {
        return clientIp;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getClientIn() {
        return clientIn;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public OutputStream getClientOut() {
        return clientOut;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public UpstreamConnection getUpstream() {
        return upstream;
    }

    /**
     * Binds the session to its upstream. Called once, right after routing.
     *
     * @param upstream The routed upstream connection.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void bind(UpstreamConnection upstream) {
        if (this.upstream != null) {
            throw new IllegalStateException(
                    "Session for " + clientIp + " is already bound to " + this.upstream.getAddress());
        }
        this.upstream = upstream;
    }

    /**
     * Closes the upstream connection (if any) and the client socket.
     */
    @Override
    public void close() {
        IoUtils.closeQuietly(upstream);
        IoUtils.closeQuietly(client, "client socket " + clientIp);
    }
}
