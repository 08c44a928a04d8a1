package com.xammer.fleet.service;

import com.xammer.fleet.domain.BootstrapPayload;
import com.xammer.fleet.exception.InvalidConfigurationException;
import com.xammer.fleet.util.AwsResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Packages the monitoring-agent config template into the instance boot script.
 * The template is embedded verbatim; the hostname token is replaced by the instance itself at boot.
 * Every install step in the script is best-effort.
 */
@Service
public class BootstrapPayloadBuilder {

    private static final Logger logger = LoggerFactory.getLogger(BootstrapPayloadBuilder.class);

    static final String CONFIG_PATH = "/tmp/cw-config.json";
    static final String CONFIG_DELIMITER = "CWC";
    // the token is spliced into a sed expression at boot
    private static final Pattern HOSTNAME_TOKEN = Pattern.compile("[A-Za-z0-9_]+");

    private final String hostnameToken;

    public BootstrapPayloadBuilder(@Value("${fleet.bootstrap.hostname-token:PLACEHOLDER_HOSTNAME}") String hostnameToken) {
        if (hostnameToken == null || !HOSTNAME_TOKEN.matcher(hostnameToken).matches()) {
            throw new InvalidConfigurationException("fleet.bootstrap.hostname-token must match "
                    + HOSTNAME_TOKEN.pattern() + ", got '" + hostnameToken + "'");
        }
        this.hostnameToken = hostnameToken;
    }

    public String getHostnameToken() {
        return hostnameToken;
    }

    public BootstrapPayload build(String fleetName, String monitoringConfigTemplate) {
        String template = monitoringConfigTemplate == null ? "" : monitoringConfigTemplate;
        int occurrences = countOccurrences(template, hostnameToken);
        if (occurrences == 0) {
            logger.info("Bootstrap: monitoring config for fleet {} has no {} token, it will boot unchanged",
                    fleetName, hostnameToken);
        } else if (occurrences > 1) {
            logger.warn("Bootstrap: monitoring config for fleet {} contains {} {} tokens, all will be substituted",
                    fleetName, occurrences, hostnameToken);
        }
        if (template.lines().anyMatch(CONFIG_DELIMITER::equals)) {
            logger.warn("Bootstrap: monitoring config for fleet {} contains the heredoc delimiter line '{}'",
                    fleetName, CONFIG_DELIMITER);
        }

        String script = renderScript(fleetName, template);
        return new BootstrapPayload(script.getBytes(StandardCharsets.UTF_8), template, hostnameToken, occurrences);
    }

    private String renderScript(String fleetName, String template) {
        StringBuilder sb = new StringBuilder();
        sb.append("#!/bin/bash\n");
        sb.append("set -uo pipefail\n");
        sb.append("set -x\n\n");

        sb.append("cat > ").append(CONFIG_PATH).append(" <<'").append(CONFIG_DELIMITER).append("'\n");
        sb.append(template);
        if (!template.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(CONFIG_DELIMITER).append("\n\n");

        sb.append("hostval=\"$(hostname -s)\"\n");
        sb.append("sed -i \"s/").append(hostnameToken).append("/${hostval}/g\" ").append(CONFIG_PATH).append(" || true\n\n");

        sb.append("if command -v yum >/dev/null 2>&1; then\n");
        sb.append("  yum update -y || true\n");
        sb.append("  yum install -y nginx amazon-cloudwatch-agent || true\n");
        sb.append("elif command -v dnf >/dev/null 2>&1; then\n");
        sb.append("  dnf upgrade -y || true\n");
        sb.append("  dnf install -y nginx amazon-cloudwatch-agent || true\n");
        sb.append("fi\n\n");

        sb.append("if command -v systemctl >/dev/null 2>&1; then\n");
        sb.append("  systemctl enable --now amazon-ssm-agent || true\n");
        sb.append("  systemctl enable --now nginx || true\n");
        sb.append("fi\n\n");

        sb.append("mkdir -p /etc/awslogs/config || true\n");
        sb.append("cat > /etc/awslogs/config/var-log-messages.conf <<'AWSLOG' || true\n");
        sb.append("[/var/log/messages]\n");
        sb.append("file = /var/log/messages\n");
        sb.append("log_group_name = ").append(AwsResourceNames.logGroup(fleetName)).append('\n');
        sb.append("log_stream_name = {instance_id}\n");
        sb.append("datetime_format = %b %d %H:%M:%S\n");
        sb.append("AWSLOG\n\n");

        sb.append("if systemctl list-units --type=service --all | grep -q awslogs; then\n");
        sb.append("  systemctl restart awslogsd || systemctl restart awslogs || true\n");
        sb.append("fi\n\n");

        sb.append("if [ -x /opt/aws/amazon-cloudwatch-agent/bin/amazon-cloudwatch-agent-ctl ]; then\n");
        sb.append("  /opt/aws/amazon-cloudwatch-agent/bin/amazon-cloudwatch-agent-ctl -a fetch-config -m ec2 -c file:")
                .append(CONFIG_PATH).append(" -s || true\n");
        sb.append("fi\n\n");

        sb.append("mkdir -p /etc/nginx/conf.d || true\n");
        sb.append("cat > /etc/nginx/conf.d/00-http.conf <<'NGINX' || true\n");
        sb.append("server {\n");
        sb.append("    listen 80 default_server;\n");
        sb.append("    server_name _;\n");
        sb.append("    location / { return 200 'ok'; }\n");
        sb.append("}\n");
        sb.append("NGINX\n\n");

        sb.append("systemctl restart nginx || true\n");
        return sb.toString();
    }

    static int countOccurrences(String text, String token) {
        if (token == null || token.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(token, from)) >= 0) {
            count++;
            from += token.length();
        }
        return count;
    }
}
