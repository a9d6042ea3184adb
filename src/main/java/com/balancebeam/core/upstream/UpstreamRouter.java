package com.balancebeam.core.upstream;

import java.io.IOException;
import java.net.Socket;
import java.util.OptionalInt;
import java.util.Random;

import com.balancebeam.core.exceptions.AllUpstreamsDeadException;
import com.balancebeam.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects a live upstream at random and connects to it, failing over to
 * another upstream whenever a connect attempt fails.
 */
public class UpstreamRouter {

    private static final Logger log = LoggerFactory.getLogger(UpstreamRouter.class);

    private final UpstreamRegistry registry;
    private final UpstreamConnector connector;
    private final Random random;
    private final Counter connectFailures;

    /**
     * Creates a router.
     *
     * @param registry      Shared upstream pool state.
     * @param connector     Opens sockets to upstreams.
     * @param random        Source of randomness for selection.
     * @param meterRegistry Registry for the connect-failure counter.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public UpstreamRouter(UpstreamRegistry registry, UpstreamConnector connector, Random random,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.connector = connector;
        this.random = random;
        this.connectFailures = Counter.builder("balancebeam.upstream.connect.failures")
                .description("Connect attempts to upstreams that failed and marked the upstream dead")
                .register(meterRegistry);
    }

    /**
     * Connects to a live upstream. Every upstream that refuses the connection
     * is marked dead before the next draw; the loop ends on the first
     * successful connect or when the pool is exhausted.
     *
     * @return A connection to the chosen upstream.
     * @throws AllUpstreamsDeadException If no upstream is alive.
     */
    public UpstreamConnection route() {
        while (true) {
            OptionalInt selected = registry.selectLive(random);
            if (selected.isEmpty()) {
                throw new AllUpstreamsDeadException("All upstream servers are dead");
            }
            int idx = selected.getAsInt();
            UpstreamAddress address = registry.address(idx);

            Socket socket = null;
            try {
                socket = connector.connect(address);
                return new UpstreamConnection(idx, address, socket);
            } catch (IOException e) {
                IoUtils.closeQuietly(socket, "upstream socket");
                connectFailures.increment();
                log.warn("Failed to connect to upstream {}: {}. Marking it dead", address, e.getMessage());
                registry.setDead(idx);
            }
        }
    }
}
