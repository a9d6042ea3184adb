package com.balancebeam.core.upstream;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

import com.balancebeam.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A connected upstream socket together with the pool index it was routed to.
 */
public class UpstreamConnection implements Closeable {

    private final int index;
    private final UpstreamAddress address;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    /**
     * Wraps a connected socket.
     *
     * @param index   Index of the upstream in the registry.
     * @param address Address of the upstream.
     * @param socket  Connected socket.
     * @throws IOException If the socket streams cannot be obtained.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public UpstreamConnection(int index, UpstreamAddress address, Socket socket) throws IOException {
        this.index = index;
        this.address = address;
        this.socket = socket;
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    public int getIndex() {
        return index;
    }

    public UpstreamAddress getAddress() {
        return address;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getInputStream() {
        return in;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public OutputStream getOutputStream() {
        return out;
    }

    @Override
    public void close() {
        IoUtils.closeQuietly(socket, "upstream socket " + address);
    }
}
