package com.balancebeam.config;

import java.util.ArrayList;
import java.util.List;

import com.balancebeam.core.exceptions.ConfigException;
import com.balancebeam.core.upstream.UpstreamAddress;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BalancebeamPropertiesTest {

    private static BalancebeamProperties valid() {
        BalancebeamProperties props = new BalancebeamProperties();
        props.setUpstreams(List.of("127.0.0.1:8080"));
        return props;
    }

    @Test
    void defaults() {
        BalancebeamProperties props = new BalancebeamProperties();

        assertThat(props.getBind()).isEqualTo("0.0.0.0:1100");
        assertThat(props.getUpstreams()).isEmpty();
        assertThat(props.getHealthCheck().getInterval()).isEqualTo(10);
        assertThat(props.getHealthCheck().getPath()).isEqualTo("/");
        assertThat(props.getRateLimit().getMaxRequestsPerMinute()).isZero();
        assertThat(props.getRateLimit().getAlgorithm()).isEqualTo("fixed_window");
        assertThat(props.getRateLimit().getWindowSeconds()).isEqualTo(60);
        assertThat(props.getRateLimit().getDenialStatus()).isEqualTo(429);
        assertThat(props.getMaxBodySize()).isEqualTo(10_000_000);
        assertThat(props.getAdmin().isEnabled()).isFalse();
    }

    @Test
    void upstreamListIsCopied() {
        List<String> upstreams = new ArrayList<>(List.of("a:1"));
        BalancebeamProperties props = new BalancebeamProperties();
        props.setUpstreams(upstreams);
        upstreams.add("b:2");

        assertThat(props.getUpstreams()).containsExactly("a:1");
        assertThat(props.upstreamAddresses()).containsExactly(new UpstreamAddress("a", 1));
    }

    @Test
    void validConfigurationPasses() {
        valid().validate();
    }

    @Test
    void requiresAtLeastOneUpstream() {
        assertThatThrownBy(() -> new BalancebeamProperties().validate())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("At least one upstream");
    }

    @Test
    void rejectsMalformedAddresses() {
        BalancebeamProperties badUpstream = valid();
        badUpstream.setUpstreams(List.of("localhost"));
        assertThatThrownBy(badUpstream::validate).isInstanceOf(ConfigException.class);

        BalancebeamProperties zeroPort = valid();
        zeroPort.setUpstreams(List.of("localhost:0"));
        assertThatThrownBy(zeroPort::validate).isInstanceOf(ConfigException.class);

        BalancebeamProperties badBind = valid();
        badBind.setBind("0.0.0.0");
        assertThatThrownBy(badBind::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsInvalidHealthCheckSettings() {
        BalancebeamProperties negative = valid();
        negative.getHealthCheck().setInterval(-1);
        assertThatThrownBy(negative::validate).isInstanceOf(ConfigException.class);

        BalancebeamProperties relativePath = valid();
        relativePath.getHealthCheck().setPath("health");
        assertThatThrownBy(relativePath::validate).isInstanceOf(ConfigException.class);

        BalancebeamProperties emptyPath = valid();
        emptyPath.getHealthCheck().setPath("");
        assertThatThrownBy(emptyPath::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void zeroIntervalDisablesHealthChecks() {
        BalancebeamProperties props = valid();
        props.getHealthCheck().setInterval(0);

        props.validate();

        assertThat(props.getHealthCheck().isEnabled()).isFalse();
    }

    @Test
    void rejectsInvalidRateLimitSettings() {
        BalancebeamProperties negative = valid();
        negative.getRateLimit().setMaxRequestsPerMinute(-5);
        assertThatThrownBy(negative::validate).isInstanceOf(ConfigException.class);

        BalancebeamProperties window = valid();
        window.getRateLimit().setWindowSeconds(0);
        assertThatThrownBy(window::validate).isInstanceOf(ConfigException.class);

        BalancebeamProperties status = valid();
        status.getRateLimit().setDenialStatus(200);
        assertThatThrownBy(status::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsInvalidLimits() {
        BalancebeamProperties body = valid();
        body.setMaxBodySize(0);
        assertThatThrownBy(body::validate).isInstanceOf(ConfigException.class);

        BalancebeamProperties timeout = valid();
        timeout.setReadTimeout(-1);
        assertThatThrownBy(timeout::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void bindsFromYaml() {
        String yaml = "bind: \"127.0.0.1:2000\"\n"
                + "upstreams:\n"
                + "  - \"10.0.0.1:80\"\n"
                + "  - \"10.0.0.2:80\"\n"
                + "healthCheck:\n"
                + "  interval: 5\n"
                + "  path: /status\n"
                + "rateLimit:\n"
                + "  maxRequestsPerMinute: 30\n"
                + "admin:\n"
                + "  enabled: true\n"
                + "  port: 9191\n";

        BalancebeamProperties props = new Yaml(new Constructor(BalancebeamProperties.class, new LoaderOptions()))
                .load(yaml);

        props.validate();
        assertThat(props.getBind()).isEqualTo("127.0.0.1:2000");
        assertThat(props.upstreamAddresses()).hasSize(2);
        assertThat(props.getHealthCheck().getInterval()).isEqualTo(5);
        assertThat(props.getHealthCheck().getPath()).isEqualTo("/status");
        assertThat(props.getRateLimit().getMaxRequestsPerMinute()).isEqualTo(30);
        assertThat(props.getRateLimit().getAlgorithm()).isEqualTo("fixed_window");
        assertThat(props.getAdmin().isEnabled()).isTrue();
        assertThat(props.getAdmin().getPort()).isEqualTo(9191);
    }
}
