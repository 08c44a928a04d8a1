package com.xammer.fleet.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Identifiers of a provisioned traffic tier.
 */
@Value
@Builder
public class TrafficTierEndpoint {
    String securityGroupId;
    String loadBalancerArn;
    String dnsName;
    String targetGroupArn;
    String listenerArn;
}
