package com.xammer.fleet.domain;

public enum HealthCheckMode {
    ENDPOINT_HEALTH("ELB"),
    SELF_REPORTED("EC2");

    private final String awsHealthCheckType;

    HealthCheckMode(String awsHealthCheckType) {
        this.awsHealthCheckType = awsHealthCheckType;
    }

    public String getAwsHealthCheckType() {
        return awsHealthCheckType;
    }

    public static HealthCheckMode of(TrafficTier tier) {
        return tier.fold(absent -> SELF_REPORTED, present -> ENDPOINT_HEALTH);
    }

    public static HealthCheckMode fromAwsHealthCheckType(String type) {
        return "ELB".equalsIgnoreCase(type) ? ENDPOINT_HEALTH : SELF_REPORTED;
    }
}
