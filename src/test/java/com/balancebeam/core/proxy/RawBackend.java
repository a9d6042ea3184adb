package com.balancebeam.core.proxy;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.balancebeam.core.http.HttpCodec;
import com.balancebeam.core.http.HttpFramingException;
import com.balancebeam.core.http.HttpRequest;

/**
 * Minimal upstream for relay tests. Answers every request on a connection
 * with the same raw bytes and records what it received.
 */
class RawBackend implements AutoCloseable {

    private final ServerSocket server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<HttpRequest> received = new CopyOnWriteArrayList<>();
    private volatile byte[] reply;
    private volatile boolean hangUpInsteadOfReplying;

    RawBackend(String reply) throws IOException {
        this.reply = reply.getBytes(StandardCharsets.ISO_8859_1);
        this.server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        executor.submit(this::acceptLoop);
    }

    static RawBackend replying(String body) throws IOException {
        return new RawBackend("HTTP/1.1 200 OK\r\nContent-Length: " + body.length() + "\r\n\r\n" + body);
    }

    int port() {
        return server.getLocalPort();
    }

    String address() {
        return "127.0.0.1:" + port();
    }

    List<HttpRequest> received() {
        return received;
    }

    void hangUpInsteadOfReplying() {
        this.hangUpInsteadOfReplying = true;
    }

    private void acceptLoop() {
        while (!server.isClosed()) {
            try {
                Socket socket = server.accept();
                executor.submit(() -> serve(socket));
            } catch (IOException e) {
                return;
            }
        }
    }

    private void serve(Socket socket) {
        try (socket) {
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();
            while (true) {
                HttpRequest request = HttpCodec.readRequest(in, HttpCodec.DEFAULT_MAX_BODY_SIZE);
                received.add(request);
                if (hangUpInsteadOfReplying) {
                    return;
                }
                out.write(reply);
                out.flush();
            }
        } catch (HttpFramingException | IOException e) {
            // peer went away
        }
    }

    @Override
    public void close() throws IOException {
        server.close();
        executor.shutdownNow();
    }
}
