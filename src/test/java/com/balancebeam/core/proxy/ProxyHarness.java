package com.balancebeam.core.proxy;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import com.balancebeam.config.BalancebeamProperties;
import com.balancebeam.core.http.HttpCodec;
import com.balancebeam.core.http.HttpResponse;
import com.balancebeam.core.upstream.UpstreamConnector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs a {@link ProxyServer} on an ephemeral loopback port and talks to it
 * over raw sockets.
 */
class ProxyHarness implements AutoCloseable {

    final ProxyServer server;
    final MeterRegistry meters = new SimpleMeterRegistry();
    private final Thread thread;

    ProxyHarness(BalancebeamProperties props) {
        this(props, new UpstreamConnector(2000, 5000));
    }

    ProxyHarness(BalancebeamProperties props, UpstreamConnector connector) {
        props.setBind("127.0.0.1:0");
        props.validate();
        this.server = new ProxyServer(props, meters, connector, new Random());
        this.thread = new Thread(server::start, "proxy-under-test");
        thread.setDaemon(true);
        thread.start();
        assertThat(server.awaitBind(5, TimeUnit.SECONDS)).isTrue();
    }

    static BalancebeamProperties propsFor(String... upstreams) {
        BalancebeamProperties props = new BalancebeamProperties();
        props.setUpstreams(List.of(upstreams));
        props.getHealthCheck().setInterval(0);
        return props;
    }

    Client connect() throws IOException {
        return new Client(new Socket("127.0.0.1", server.getLocalPort()));
    }

    @Override
    public void close() throws InterruptedException {
        server.stop();
        thread.join(5000);
    }

    static class Client implements AutoCloseable {
        final Socket socket;
        final InputStream in;
        final OutputStream out;

        Client(Socket socket) throws IOException {
            this.socket = socket;
            socket.setSoTimeout(10_000);
            this.in = new BufferedInputStream(socket.getInputStream());
            this.out = socket.getOutputStream();
        }

        void send(String raw) throws IOException {
            out.write(raw.getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
        }

        HttpResponse read(String method) {
            return HttpCodec.readResponse(in, method, HttpCodec.DEFAULT_MAX_BODY_SIZE);
        }

        HttpResponse get(String path) throws IOException {
            send("GET " + path + " HTTP/1.1\r\nHost: test\r\n\r\n");
            return read("GET");
        }

        String body(HttpResponse response) {
            return new String(response.getBody(), StandardCharsets.ISO_8859_1);
        }

        /** True once the proxy has closed its side of the connection. */
        boolean closedByPeer() throws IOException {
            return in.read() == -1;
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
