package com.xammer.fleet.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A fully validated fleet definition, ready to be provisioned.
 */
@Value
@Builder
public class FleetDefinition {
    FleetSpec fleet;
    TrafficTier trafficTier;
    RefreshSchedule refreshSchedule;
    String monitoringConfigTemplate;

    public String getName() {
        return fleet.getName();
    }
}
