package com.balancebeam.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.balancebeam.config.AdminConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private final AdminConfig config;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;

    public MetricsService(AdminConfig config) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = config;
    }

    /**
     * Starts the admin server if it is enabled.
     *
     * @param healthy Reports whether at least one upstream is alive; drives
     *                {@code /health}.
     */
    public synchronized void startAdminServer(BooleanSupplier healthy) {
        if (!config.isEnabled() || adminServer != null) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            // Health check endpoint
            adminServer.createContext("/health", exchange -> {
                boolean up = healthy.getAsBoolean();
                respond(exchange, up ? 200 : 503, up ? "OK" : "NO LIVE UPSTREAMS");
            });

            // Metrics endpoint (Prometheus format)
            adminServer.createContext("/metrics", exchange -> respond(exchange, 200, registry.scrape()));

            adminExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "admin-http");
                t.setDaemon(true);
                return t;
            });
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", getAdminPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
            adminServer = null;
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Port the admin server listens on.
     *
     * @return The bound port, or -1 if the admin server is not running.
     */
    public synchronized int getAdminPort() {
        return adminServer == null ? -1 : adminServer.getAddress().getPort();
    }

    public synchronized void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
