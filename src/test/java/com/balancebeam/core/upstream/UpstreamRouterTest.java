package com.balancebeam.core.upstream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.Socket;
import java.util.List;
import java.util.Random;

import com.balancebeam.core.exceptions.AllUpstreamsDeadException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UpstreamRouterTest {

    private static final UpstreamAddress DEAD = new UpstreamAddress("127.0.0.1", 1);
    private static final UpstreamAddress LIVE = new UpstreamAddress("127.0.0.1", 2);

    private UpstreamConnector connector;
    private SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        connector = mock(UpstreamConnector.class);
        meters = new SimpleMeterRegistry();
    }

    private static Socket connectedSocket() throws IOException {
        Socket socket = mock(Socket.class);
        when(socket.getInputStream()).thenReturn(InputStream.nullInputStream());
        when(socket.getOutputStream()).thenReturn(OutputStream.nullOutputStream());
        return socket;
    }

    /** Draws index 0 first so the dead upstream is always tried once. */
    private static Random firstDrawDead() {
        return new Random(1) {
            private boolean first = true;

            @Override
            public int nextInt(int bound) {
                if (first) {
                    first = false;
                    return 0;
                }
                return super.nextInt(bound);
            }
        };
    }

    @Test
    void allDeadFailsWithoutConnecting() throws IOException {
        UpstreamRegistry registry = new UpstreamRegistry(List.of(DEAD, LIVE));
        registry.setDead(0);
        registry.setDead(1);
        UpstreamRouter router = new UpstreamRouter(registry, connector, new Random(), meters);

        assertThatThrownBy(router::route)
                .isInstanceOf(AllUpstreamsDeadException.class)
                .hasMessage("All upstream servers are dead");
        verify(connector, never()).connect(any());
    }

    @Test
    void failedConnectMarksUpstreamDeadAndFailsOver() throws IOException {
        UpstreamRegistry registry = new UpstreamRegistry(List.of(DEAD, LIVE));
        when(connector.connect(DEAD)).thenThrow(new ConnectException("Connection refused"));
        Socket socket = connectedSocket();
        when(connector.connect(LIVE)).thenReturn(socket);
        UpstreamRouter router = new UpstreamRouter(registry, connector, firstDrawDead(), meters);

        for (int i = 0; i < 20; i++) {
            try (UpstreamConnection connection = router.route()) {
                assertThat(connection.getIndex()).isEqualTo(1);
                assertThat(connection.getAddress()).isEqualTo(LIVE);
            }
        }

        assertThat(registry.isAlive(0)).isFalse();
        assertThat(registry.isAlive(1)).isTrue();
        verify(connector, times(1)).connect(DEAD);
        verify(connector, times(20)).connect(LIVE);
    }

    @Test
    void exhaustingThePoolEndsWithAllDead() throws IOException {
        UpstreamRegistry registry = new UpstreamRegistry(List.of(DEAD, LIVE));
        when(connector.connect(any())).thenThrow(new ConnectException("Connection refused"));
        UpstreamRouter router = new UpstreamRouter(registry, connector, new Random(), meters);

        assertThatThrownBy(router::route).isInstanceOf(AllUpstreamsDeadException.class);

        assertThat(registry.allDead()).isTrue();
        verify(connector, times(1)).connect(DEAD);
        verify(connector, times(1)).connect(LIVE);
        assertThat(meters.get("balancebeam.upstream.connect.failures").counter().count()).isEqualTo(2.0);
    }
}
