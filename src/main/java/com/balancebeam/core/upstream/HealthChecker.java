package com.balancebeam.core.upstream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.net.Socket;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.balancebeam.core.constants.HeaderConstants;
import com.balancebeam.core.http.HttpCodec;
import com.balancebeam.core.http.HttpFramingException;
import com.balancebeam.core.http.HttpHeaders;
import com.balancebeam.core.http.HttpRequest;
import com.balancebeam.core.http.HttpResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically probes every upstream and writes the results into the
 * {@link UpstreamRegistry}.
 * <p>
 * Each cycle sends {@code GET <path>} over a fresh connection to every
 * upstream. Only a 200 response counts as alive. Probes run without holding
 * the registry lock; the complete result vector is then applied in one write.
 * </p>
 */
public class HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private static final int HTTP_OK = 200;

    private final UpstreamRegistry registry;
    private final UpstreamConnector connector;
    private final String path;
    private final long intervalSeconds;
    private final Counter probesAlive;
    private final Counter probesDead;
    private ScheduledExecutorService scheduler;

    /**
     * Creates a health checker.
     *
     * @param registry        Shared upstream pool state.
     * @param connector       Opens probe connections (carries the probe
     *                        timeout).
     * @param path            Request path for probes.
     * @param intervalSeconds Delay between cycles in seconds; must be positive.
     * @param meterRegistry   Registry for probe counters.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HealthChecker(UpstreamRegistry registry, UpstreamConnector connector, String path, long intervalSeconds,
            MeterRegistry meterRegistry) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("Health check interval must be positive: " + intervalSeconds);
        }
        this.registry = registry;
        this.connector = connector;
        this.path = path;
        this.intervalSeconds = intervalSeconds;
        this.probesAlive = Counter.builder("balancebeam.healthcheck.probes")
                .tag("result", "alive")
                .description("Active health check probes by outcome")
                .register(meterRegistry);
        this.probesDead = Counter.builder("balancebeam.healthcheck.probes")
                .tag("result", "dead")
                .description("Active health check probes by outcome")
                .register(meterRegistry);
    }

    /**
     * Starts the probe schedule. The first cycle runs one interval after start.
     * Calling start twice has no effect.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-check");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runCycleSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Active health checks every {}s on path {} for {} upstream(s)", intervalSeconds, path,
                registry.size());
    }

    /**
     * Stops the probe schedule.
     */
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Probes every upstream once and applies the results.
     */
    public void runCycle() {
        boolean[] results = new boolean[registry.size()];
        for (int i = 0; i < results.length; i++) {
            results[i] = probe(registry.address(i));
            if (results[i]) {
                probesAlive.increment();
            } else {
                probesDead.increment();
            }
        }
        registry.applyProbeResults(results);
        log.debug("Health check cycle complete: {}/{} upstream(s) alive", registry.liveCount(), results.length);
    }

    /**
     * Scheduled entry point. An exception escaping a scheduled task would
     * cancel all future cycles, so everything is caught here.
     */
    private void runCycleSafely() {
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Health check cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Sends one probe request.
     *
     * @param address The upstream to probe.
     * @return True if the upstream answered 200.
     */
    boolean probe(UpstreamAddress address) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HeaderConstants.HOST.getValue(), address.toString());
        headers.add(HeaderConstants.CONNECTION.getValue(), "close");
        HttpRequest request = new HttpRequest("GET", path, "HTTP/1.1", headers, new byte[0]);

        try (Socket socket = connector.connect(address)) {
            HttpCodec.writeRequest(request, socket.getOutputStream());
            HttpResponse response = HttpCodec.readResponse(new BufferedInputStream(socket.getInputStream()),
                    request.getMethod(), HttpCodec.DEFAULT_MAX_BODY_SIZE);
            if (response.getStatus() != HTTP_OK) {
                log.warn("Health check failed for upstream {} (Status: {})", address, response.getStatus());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Health check error for upstream {}: {}", address, e.getMessage());
            return false;
        } catch (HttpFramingException e) {
            log.warn("Health check got an unreadable response from upstream {}: {}", address, e.getMessage());
            return false;
        }
    }
}
