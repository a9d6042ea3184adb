package com.balancebeam;

import com.balancebeam.config.BalancebeamProperties;
import com.balancebeam.core.exceptions.ConfigException;
import com.balancebeam.core.exceptions.ProxyException;
import com.balancebeam.core.proxy.ProxyServer;
import com.balancebeam.core.services.MetricsService;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Balancebeam load balancer.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "balancebeam", mixinStandardHelpOptions = true, version = "1.0.0", description = "Fun with load balancing")
public class BalancebeamApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BalancebeamApplication.class);

    private static final long BIND_TIMEOUT_SECONDS = 10;

    /**
     * Optional path to a YAML configuration file. Command-line options override
     * its values.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)")
    private String configPath;

    @Option(names = { "-b", "--bind" }, description = "IP/port to bind to (default: 0.0.0.0:1100)")
    private String bind;

    @Option(names = { "-u", "--upstream" }, description = "Upstream host to forward requests to")
    private List<String> upstreams = new ArrayList<>();

    @Option(names = "--active-health-check-interval",
            description = "Perform active health checks on this interval (in seconds, 0 = off; default: 10)")
    private Integer activeHealthCheckInterval;

    @Option(names = "--active-health-check-path",
            description = "Path to send request to for active health checks (default: /)")
    private String activeHealthCheckPath;

    @Option(names = "--max-requests-per-minute",
            description = "Maximum number of requests to accept per IP per minute (0 = unlimited; default: 0)")
    private Integer maxRequestsPerMinute;

    @Option(names = "--rate-limiter",
            description = "The rate limit algorithm to apply if the maximum is above 0 (default: fixed_window)")
    private String rateLimiter;

    private ProxyServer proxyServer;
    private MetricsService metricsService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     * 
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new BalancebeamApplication()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Loads and validates the configuration, starts the load balancer and blocks
     * until shutdown.
     * 
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Balancebeam...");

            BalancebeamProperties props = loadConfig(configPath);
            applyOverrides(props);
            props.validate();

            this.metricsService = new MetricsService(props.getAdmin());
            this.proxyServer = new ProxyServer(props, metricsService.getRegistry());

            Thread serverThread = new Thread(proxyServer::start, "proxy-server");
            serverThread.start();
            if (!proxyServer.awaitBind(BIND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new ProxyException("Could not bind to " + props.getBind());
            }

            ProxyServer server = proxyServer;
            metricsService.startAdminServer(() -> !server.getUpstreams().allDead());

            if (System.getProperty("balancebeam.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Copies the options given on the command line over the loaded
     * configuration.
     *
     * @param props Configuration loaded from YAML or defaults.
     */
    void applyOverrides(BalancebeamProperties props) {
        if (bind != null) {
            props.setBind(bind);
        }
        if (upstreams != null && !upstreams.isEmpty()) {
            props.setUpstreams(upstreams);
        }
        if (activeHealthCheckInterval != null) {
            props.getHealthCheck().setInterval(activeHealthCheckInterval);
        }
        if (activeHealthCheckPath != null) {
            props.getHealthCheck().setPath(activeHealthCheckPath);
        }
        if (maxRequestsPerMinute != null) {
            props.getRateLimit().setMaxRequestsPerMinute(maxRequestsPerMinute);
        }
        if (rateLimiter != null) {
            props.getRateLimit().setAlgorithm(rateLimiter);
        }
    }

    /**
     * Stops the load balancer and the admin server.
     * Also unregisters the shutdown hook to prevent leaks in test environments.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Balancebeam...");

            unregisterShutdownHook();

            if (proxyServer != null) {
                proxyServer.stop();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    /**
     * Unregisters the JVM shutdown hook safely.
     */
    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress: {}", e.getMessage());
            }
        }
    }

    ProxyServer getProxyServer() {
        return proxyServer;
    }

    MetricsService getMetricsService() {
        return metricsService;
    }

    /**
     * Loads the configuration from the specified path or classpath. Without a
     * path the built-in defaults are used.
     * 
     * @param path Path to the configuration file, may be null.
     * @return Loaded properties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    static BalancebeamProperties loadConfig(String path) {
        if (path == null) {
            return new BalancebeamProperties();
        }
        Yaml yaml = new Yaml(new Constructor(BalancebeamProperties.class, new LoaderOptions()));

        // 1. Try absolute/relative path
        BalancebeamProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        // 2. Try classpath
        BalancebeamProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    /**
     * Attempts to load YAML configuration from a file on disk.
     * 
     * @param yaml SnakeYAML instance.
     * @param path File path.
     * @return Properties if the file exists, null otherwise.
     */
    private static BalancebeamProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    /**
     * Attempts to load YAML configuration from a classpath resource.
     * 
     * @param yaml SnakeYAML instance.
     * @param path Resource path.
     * @return Properties if the resource exists, null otherwise.
     */
    private static BalancebeamProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = BalancebeamApplication.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    /** An empty YAML document loads as null. */
    private static BalancebeamProperties orDefaults(BalancebeamProperties loaded) {
        return loaded != null ? loaded : new BalancebeamProperties();
    }
}
