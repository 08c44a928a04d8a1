package com.xammer.fleet.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ordered list of resource actions a fleet definition resolves to. Computing it has no side effects.
 */
@Value
@Builder
public class ProvisioningPlan {
    String fleetName;
    SecurityPolicy securityPolicy;
    HealthCheckMode healthCheckMode;
    @Singular
    List<Step> steps;

    @Value
    public static class Step {
        int order;
        String resourceType;
        String name;
        String detail;
    }
}
