package com.xammer.fleet.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Opaque boot-time data handed to every instance of one template generation. Immutable.
 */
public final class BootstrapPayload {

    private final byte[] rawContent;
    private final String monitoringConfigTemplate;
    private final String hostnameToken;
    private final int tokenOccurrences;

    public BootstrapPayload(byte[] rawContent, String monitoringConfigTemplate, String hostnameToken, int tokenOccurrences) {
        this.rawContent = rawContent.clone();
        this.monitoringConfigTemplate = monitoringConfigTemplate;
        this.hostnameToken = hostnameToken;
        this.tokenOccurrences = tokenOccurrences;
    }

    public byte[] getRawContent() {
        return rawContent.clone();
    }

    public String getHostnameToken() {
        return hostnameToken;
    }

    public int getTokenOccurrences() {
        return tokenOccurrences;
    }

    public boolean hasHostnameToken() {
        return tokenOccurrences > 0;
    }

    /**
     * Base64 form, as accepted by the EC2 launch template {@code UserData} field.
     */
    public String encoded() {
        return Base64.getEncoder().encodeToString(rawContent);
    }

    public String asText() {
        return new String(rawContent, StandardCharsets.UTF_8);
    }

    /**
     * Reproduces the substitution the boot script performs on the instance ({@code sed s/TOKEN/host/g}).
     * Without a token the template comes back unchanged.
     */
    public String renderMonitoringConfig(String shortHostname) {
        if (!hasHostnameToken()) {
            return monitoringConfigTemplate;
        }
        return monitoringConfigTemplate.replace(hostnameToken, shortHostname);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BootstrapPayload)) {
            return false;
        }
        BootstrapPayload that = (BootstrapPayload) o;
        return Arrays.equals(rawContent, that.rawContent) && hostnameToken.equals(that.hostnameToken);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rawContent) + hostnameToken.hashCode();
    }

    @Override
    public String toString() {
        return "BootstrapPayload(bytes=" + rawContent.length + ", tokenOccurrences=" + tokenOccurrences + ")";
    }
}
