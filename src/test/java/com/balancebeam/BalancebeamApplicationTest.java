package com.balancebeam;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.balancebeam.config.BalancebeamProperties;
import com.balancebeam.core.exceptions.ConfigException;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class BalancebeamApplicationTest {

    @BeforeAll
    static void noShutdownHook() {
        System.setProperty("balancebeam.no-shutdown-hook", "true");
        System.setProperty("picocli.ansi", "false");
    }

    private static int freePort() throws Exception {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    @Test
    void main_withHelpOption_returnsZero() {
        int exitCode = new CommandLine(new BalancebeamApplication()).execute("--help");
        assertThat(exitCode).isZero();
    }

    @Test
    void call_withoutUpstreams_returnsError() {
        int exitCode = new CommandLine(new BalancebeamApplication()).execute("--bind", "127.0.0.1:0");
        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withUnknownRateLimiter_returnsError() {
        int exitCode = new CommandLine(new BalancebeamApplication()).execute("--bind", "127.0.0.1:0",
                "--upstream", "127.0.0.1:9", "--rate-limiter", "token_bucket");
        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withPortInUse_returnsError() throws Exception {
        try (ServerSocket taken = new ServerSocket(0)) {
            int exitCode = new CommandLine(new BalancebeamApplication()).execute(
                    "--bind", "0.0.0.0:" + taken.getLocalPort(), "--upstream", "127.0.0.1:9");
            assertThat(exitCode).isEqualTo(1);
        }
    }

    @Test
    void call_withInvalidYaml_returnsError() throws Exception {
        Path configFile = Files.createTempFile("balancebeam-bad", ".yml");
        Files.writeString(configFile, "upstreams: [unclosed");
        try {
            int exitCode = new CommandLine(new BalancebeamApplication()).execute("-c", configFile.toString());
            assertThat(exitCode).isEqualTo(1);
        } finally {
            Files.deleteIfExists(configFile);
        }
    }

    @Test
    void loadConfig_missingFile_throws() {
        assertThatThrownBy(() -> BalancebeamApplication.loadConfig("does-not-exist.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void commandLineOverridesYaml() throws Exception {
        Path configFile = Files.createTempFile("balancebeam", ".yml");
        Files.writeString(configFile, "upstreams:\n  - \"10.0.0.1:80\"\nhealthCheck:\n  interval: 30\n");
        try {
            BalancebeamApplication app = new BalancebeamApplication();
            new CommandLine(app).parseArgs("-c", configFile.toString(), "-u", "10.0.0.2:80",
                    "--active-health-check-path", "/ping", "--max-requests-per-minute", "7");
            BalancebeamProperties props = BalancebeamApplication.loadConfig(configFile.toString());

            app.applyOverrides(props);

            assertThat(props.getUpstreams()).containsExactly("10.0.0.2:80");
            assertThat(props.getHealthCheck().getInterval()).isEqualTo(30);
            assertThat(props.getHealthCheck().getPath()).isEqualTo("/ping");
            assertThat(props.getRateLimit().getMaxRequestsPerMinute()).isEqualTo(7);
        } finally {
            Files.deleteIfExists(configFile);
        }
    }

    @Test
    void call_withValidOptions_servesUntilStopped() throws Exception {
        WireMockServer backend = new WireMockServer(wireMockConfig().dynamicPort().bindAddress("127.0.0.1"));
        backend.start();
        backend.stubFor(get(urlEqualTo("/")).willReturn(
                aResponse().withStatus(200).withHeader("Content-Length", "6").withBody("hello\n")));
        int port = freePort();
        BalancebeamApplication app = new BalancebeamApplication();
        CommandLine cmd = new CommandLine(app);
        Thread appThread = new Thread(() -> cmd.execute("--bind", "127.0.0.1:" + port,
                "--upstream", "127.0.0.1:" + backend.port(), "--active-health-check-interval", "0"));
        appThread.setDaemon(true);
        appThread.start();
        try {
            await().atMost(Duration.ofSeconds(10)).until(() -> app.getProxyServer() != null
                    && app.getProxyServer().getLocalPort() == port);

            try (Socket s = new Socket("127.0.0.1", port);
                    PrintWriter out = new PrintWriter(s.getOutputStream(), true, StandardCharsets.US_ASCII);
                    BufferedReader in = new BufferedReader(
                            new InputStreamReader(s.getInputStream(), StandardCharsets.US_ASCII))) {
                out.print("GET / HTTP/1.1\r\nHost: 127.0.0.1\r\n\r\n");
                out.flush();

                assertThat(in.readLine()).isEqualTo("HTTP/1.1 200 OK");
                String line;
                while ((line = in.readLine()) != null && !line.isEmpty()) {
                    // consume headers
                }
                assertThat(in.readLine()).isEqualTo("hello");
            }
        } finally {
            app.stop();
            await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
            backend.stop();
        }
    }
}
