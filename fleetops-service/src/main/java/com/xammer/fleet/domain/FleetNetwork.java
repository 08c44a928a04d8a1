package com.xammer.fleet.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Network resources a fleet runs in. {@code tierEndpoint} is null when the traffic tier is absent.
 */
@Value
@Builder
public class FleetNetwork {
    String vpcId;
    String fleetSecurityGroupId;
    SecurityPolicy securityPolicy;
    TrafficTierEndpoint tierEndpoint;
    String effectiveAddress;

    public Optional<String> targetGroupArn() {
        return Optional.ofNullable(tierEndpoint).map(TrafficTierEndpoint::getTargetGroupArn);
    }
}
