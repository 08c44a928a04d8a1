package com.xammer.fleet.domain;

import com.xammer.fleet.exception.InvalidConfigurationException;

import java.util.Objects;
import java.util.function.Function;

/**
 * The optional public front end of a fleet, either {@link Absent} or {@link Present}.
 * Every component that depends on the tier switches on this variant through
 * {@link #fold(Function, Function)} instead of testing an "enabled" flag.
 */
public abstract class TrafficTier {

    public static final int LISTENER_PORT = 443;
    public static final int TARGET_PORT = 80;
    public static final String HEALTH_CHECK_PATH = "/";

    private TrafficTier() {
    }

    public static TrafficTier absent(String externalAddress) {
        return new Absent(externalAddress);
    }

    /**
     * @throws InvalidConfigurationException when the certificate reference is blank
     */
    public static TrafficTier present(TrafficTierSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (spec.getCertificateRef() == null || spec.getCertificateRef().isBlank()) {
            throw new InvalidConfigurationException(
                    "trafficTier.certificateRef is required when the traffic tier is enabled");
        }
        return new Present(spec);
    }

    public abstract <T> T fold(Function<Absent, T> ifAbsent, Function<Present, T> ifPresent);

    public boolean isPresent() {
        return fold(absent -> false, present -> true);
    }

    public static final class Absent extends TrafficTier {
        private final String externalAddress;

        private Absent(String externalAddress) {
            this.externalAddress = externalAddress;
        }

        public String getExternalAddress() {
            return externalAddress;
        }

        @Override
        public <T> T fold(Function<Absent, T> ifAbsent, Function<Present, T> ifPresent) {
            return ifAbsent.apply(this);
        }

        @Override
        public String toString() {
            return "TrafficTier.Absent(externalAddress=" + externalAddress + ")";
        }
    }

    public static final class Present extends TrafficTier {
        private final TrafficTierSpec spec;

        private Present(TrafficTierSpec spec) {
            this.spec = spec;
        }

        public TrafficTierSpec getSpec() {
            return spec;
        }

        @Override
        public <T> T fold(Function<Absent, T> ifAbsent, Function<Present, T> ifPresent) {
            return ifPresent.apply(this);
        }

        @Override
        public String toString() {
            return "TrafficTier.Present(certificateRef=" + spec.getCertificateRef() + ")";
        }
    }
}
