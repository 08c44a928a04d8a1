package com.xammer.fleet.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of a fleet, returned by {@code describe}.
 */
@Value
@Builder
public class FleetState {
    String fleetId;
    CapacitySettings capacity;
    HealthCheckMode healthCheckMode;
    Integer templateGeneration; // null for fleets not managed in-process
    int liveMembers;
    int pendingMembers;
    RefreshStatus refreshStatus;
    String refreshId;
    String effectiveAddress;
    boolean trafficTierPresent;
    @Singular
    List<MemberView> members;

    @Value
    public static class MemberView {
        String instanceId;
        int generation;
        MemberLifecycle lifecycle;
    }
}
