package com.balancebeam.core.proxy;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.balancebeam.config.BalancebeamProperties;
import com.balancebeam.config.HealthCheckConfig;
import com.balancebeam.core.ratelimit.RateLimiterFactory;
import com.balancebeam.core.upstream.HealthChecker;
import com.balancebeam.core.upstream.UpstreamAddress;
import com.balancebeam.core.upstream.UpstreamConnector;
import com.balancebeam.core.upstream.UpstreamRegistry;
import com.balancebeam.core.upstream.UpstreamRouter;
import com.balancebeam.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The load balancer's listening server.
 * Owns the upstream pool, the rate limiter and the health checker, and hands
 * every accepted connection to the shared {@link ConnectionHandler} on a
 * cached thread pool.
 */
public class ProxyServer {
    private static final Logger log = LoggerFactory.getLogger(ProxyServer.class);

    private final BalancebeamProperties properties;

    /** Micrometer registry for metrics. */
    private final MeterRegistry meterRegistry;

    /** Shared alive/dead state of the upstream pool. */
    private final UpstreamRegistry upstreams;

    private final ConnectionHandler handler;

    /** Null when active health checks are disabled. */
    private final HealthChecker healthChecker;

    /** Executor for handling client tasks, one task per connection. */
    private final ExecutorService executor;

    /** Set of active client sockets for graceful shutdown. */
    private final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    /** The main server socket listening for incoming connections. */
    private volatile ServerSocket serverSocket;

    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Meter liveGauge;

    /**
     * Latch released once {@code serverSocket.bind()} has completed (successfully
     * or not). Lets the launcher fail fast when the port is taken.
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    /**
     * True if the last call to {@link #start()} successfully bound the server
     * socket.
     */
    private volatile boolean bindSuccess = false;

    /**
     * Creates a server with plain TCP connectors and a fresh random source.
     *
     * @param properties    Validated configuration.
     * @param meterRegistry The Micrometer meter registry.
     */
    public ProxyServer(BalancebeamProperties properties, MeterRegistry meterRegistry) {
        this(properties, meterRegistry,
                new UpstreamConnector(properties.getConnectTimeout(), properties.getReadTimeout()), new Random());
    }

    /**
     * Creates a server with an explicit upstream connector and random source.
     *
     * @param properties    Validated configuration.
     * @param meterRegistry The Micrometer meter registry.
     * @param connector     Opens relay connections to upstreams.
     * @param random        Source of randomness for upstream selection.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyServer(BalancebeamProperties properties, MeterRegistry meterRegistry, UpstreamConnector connector,
            Random random) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.upstreams = new UpstreamRegistry(properties.upstreamAddresses());

        UpstreamRouter router = new UpstreamRouter(upstreams, connector, random, meterRegistry);
        this.handler = new ConnectionHandler(router, RateLimiterFactory.create(properties.getRateLimit()),
                properties.getMaxBodySize(), properties.getRateLimit().getDenialStatus(), meterRegistry);

        HealthCheckConfig healthCheck = properties.getHealthCheck();
        if (healthCheck.isEnabled()) {
            UpstreamConnector probeConnector = new UpstreamConnector(healthCheck.getTimeout(),
                    healthCheck.getTimeout());
            this.healthChecker = new HealthChecker(upstreams, probeConnector, healthCheck.getPath(),
                    healthCheck.getInterval(), meterRegistry);
        } else {
            this.healthChecker = null;
        }

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "client-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.totalConnections = Counter.builder("balancebeam.connections.total")
                .description("Total number of accepted connections")
                .register(meterRegistry);

        this.connectionErrors = Counter.builder("balancebeam.connections.errors")
                .description("Total number of connection errors")
                .register(meterRegistry);

        this.liveGauge = Gauge.builder("balancebeam.upstreams.live", upstreams, UpstreamRegistry::liveCount)
                .description("Upstreams currently considered alive")
                .register(meterRegistry);
    }

    /**
     * Starts the proxy server. Binds to the configured address, starts the
     * health checker and enters the accept loop. Blocks until {@link #stop()}.
     */
    public void start() {
        try {
            UpstreamAddress bind = properties.bindAddress();
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(bind.host(), bind.port()));
            bindSuccess = true;
            bindLatch.countDown();
            log.info("Listening for requests on {} ({} upstream(s))", bind, upstreams.size());

            if (healthChecker != null) {
                healthChecker.start();
            } else {
                log.info("Active health checks disabled");
            }

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("Could not bind to {}: {}", properties.getBind(), e.getMessage(), e);
        }
    }

    /**
     * Accepts and processes the next incoming client connection.
     * 
     * @return {@code true} to continue the accept loop, {@code false} if the loop
     *         should terminate.
     */
    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("Accept error on {}: {}", properties.getBind(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("I/O error during accept on {}: {}", properties.getBind(), e.getMessage());
            return true;
        }
    }

    /**
     * Waits for the server to finish binding to its port.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void processClient(Socket client) {
        String remoteAddr = IoUtils.remoteIp(client);
        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
        } catch (SocketException e) {
            log.debug("Failed to configure client socket: {}", e.getMessage());
        }
        IoUtils.applyReadTimeout(client, properties.getReadTimeout(), "client socket");

        activeSockets.add(client);
        try {
            executor.submit(() -> {
                try {
                    handler.handle(client);
                } catch (Exception e) {
                    connectionErrors.increment();
                    log.error("Unexpected error handling client {}: {}", remoteAddr, e.getMessage(), e);
                } finally {
                    activeSockets.remove(client);
                    IoUtils.closeQuietly(client, "client socket");
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Server is stopping, dropping client {}", remoteAddr);
            activeSockets.remove(client);
            IoUtils.closeQuietly(client, "client socket");
        }
    }

    /**
     * Stops the proxy server. Closes the server socket and all active client
     * connections and stops the health checker.
     */
    public void stop() {
        log.info("Stopping load balancer on {}...", properties.getBind());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("Failed to close server socket: {}", e.getMessage(), e);
        }

        if (healthChecker != null) {
            healthChecker.stop();
        }

        // Close all active client connections to unblock IO
        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        meterRegistry.remove(liveGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Client executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Port the server is bound to. Useful when the configuration asked for
     * port 0.
     *
     * @return The local port, or -1 if not bound.
     */
    public int getLocalPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public UpstreamRegistry getUpstreams() {
        return upstreams;
    }
}
