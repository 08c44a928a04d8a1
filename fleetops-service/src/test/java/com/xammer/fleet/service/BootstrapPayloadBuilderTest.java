package com.xammer.fleet.service;

import com.xammer.fleet.domain.BootstrapPayload;
import com.xammer.fleet.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BootstrapPayloadBuilderTest {

    private static final String TEMPLATE = "{\"agent\":{\"run_as_user\":\"root\"},\"logs\":{\"logs_collected\":{\"files\":"
            + "{\"collect_list\":[{\"file_path\":\"/var/log/messages\",\"log_stream_name\":\"PLACEHOLDER_HOSTNAME\"}]}}}}";

    private final BootstrapPayloadBuilder builder = new BootstrapPayloadBuilder("PLACEHOLDER_HOSTNAME");

    @Test
    void embedsTemplateVerbatimAndSubstitutesAtBoot() {
        BootstrapPayload payload = builder.build("web", TEMPLATE);

        assertThat(payload.asText()).contains(TEMPLATE);
        assertThat(payload.getTokenOccurrences()).isEqualTo(1);
        assertThat(payload.renderMonitoringConfig("ip-10-0-1-23"))
                .contains("\"log_stream_name\":\"ip-10-0-1-23\"")
                .doesNotContain("PLACEHOLDER_HOSTNAME");
    }

    @Test
    void bootScriptSubstitutesShortHostnameInWrittenConfig() {
        String script = builder.build("web", TEMPLATE).asText();

        assertThat(script).startsWith("#!/bin/bash\n");
        assertThat(script).contains("cat > /tmp/cw-config.json <<'CWC'");
        assertThat(script).contains("hostval=\"$(hostname -s)\"");
        assertThat(script).contains("sed -i \"s/PLACEHOLDER_HOSTNAME/${hostval}/g\" /tmp/cw-config.json || true");
        assertThat(script).contains("-c file:/tmp/cw-config.json -s || true");
    }

    @Test
    void bootScriptNamesFleetLogGroupAndServesHealthEndpoint() {
        String script = builder.build("web", TEMPLATE).asText();

        assertThat(script).contains("log_group_name = /ec2/web/messages");
        assertThat(script).contains("listen 80 default_server;");
        assertThat(script).contains("location / { return 200 'ok'; }");
    }

    @Test
    void missingTokenStillBuildsPayload() {
        BootstrapPayload payload = builder.build("web", "{\"agent\":{}}");

        assertThat(payload.hasHostnameToken()).isFalse();
        assertThat(payload.renderMonitoringConfig("ip-10-0-1-23")).isEqualTo("{\"agent\":{}}");
    }

    @Test
    void repeatedTokenIsSubstitutedEverywhere() {
        BootstrapPayload payload = builder.build("web", "PLACEHOLDER_HOSTNAME/PLACEHOLDER_HOSTNAME");

        assertThat(payload.getTokenOccurrences()).isEqualTo(2);
        assertThat(payload.renderMonitoringConfig("ip-1")).isEqualTo("ip-1/ip-1");
    }

    @Test
    void encodedFormDecodesToScript() {
        BootstrapPayload payload = builder.build("web", TEMPLATE);

        String decoded = new String(Base64.getDecoder().decode(payload.encoded()), StandardCharsets.UTF_8);
        assertThat(decoded).isEqualTo(payload.asText());
    }

    @Test
    void payloadIsImmutable() {
        BootstrapPayload payload = builder.build("web", TEMPLATE);
        byte[] copy = payload.getRawContent();
        copy[0] = 'X';

        assertThat(payload.asText()).startsWith("#!");
    }

    @Test
    void countsNonOverlappingOccurrences() {
        assertThat(BootstrapPayloadBuilder.countOccurrences("aaaa", "aa")).isEqualTo(2);
        assertThat(BootstrapPayloadBuilder.countOccurrences("", "aa")).isZero();
        assertThat(BootstrapPayloadBuilder.countOccurrences("abc", "")).isZero();
    }

    @Test
    void rejectsHostnameTokensThatWouldBreakTheSedExpression() {
        assertThatThrownBy(() -> new BootstrapPayloadBuilder("HOST/NAME"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("HOST/NAME");
        assertThatThrownBy(() -> new BootstrapPayloadBuilder("a&b")).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new BootstrapPayloadBuilder("HOST.*")).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new BootstrapPayloadBuilder("")).isInstanceOf(InvalidConfigurationException.class);
        assertThat(new BootstrapPayloadBuilder("MY_HOST_1").getHostnameToken()).isEqualTo("MY_HOST_1");
    }
}
