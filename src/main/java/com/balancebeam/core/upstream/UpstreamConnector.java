package com.balancebeam.core.upstream;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import com.balancebeam.core.utils.IoUtils;

/**
 * Opens plain TCP connections to upstream servers.
 */
public class UpstreamConnector {

    private final int connectTimeout;
    private final int readTimeout;

    /**
     * Creates a connector.
     *
     * @param connectTimeout Connect timeout in milliseconds, 0 for none.
     * @param readTimeout    Read timeout applied to connected sockets in
     *                       milliseconds, 0 for none.
     */
    public UpstreamConnector(int connectTimeout, int readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    /**
     * Connects to an upstream.
     * 
     * @param address Upstream address.
     * @return Connected socket.
     * @throws IOException If connection fails.
     */
    public Socket connect(UpstreamAddress address) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(address.host(), address.port()), Math.max(connectTimeout, 0));
            socket.setTcpNoDelay(true);
            IoUtils.applyReadTimeout(socket, readTimeout, "upstream socket");
            return socket;
        } catch (IOException e) {
            IoUtils.closeQuietly(socket, "upstream socket");
            throw e;
        }
    }
}
