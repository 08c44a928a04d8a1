package com.xammer.fleet.domain;

import lombok.Data;

import java.time.Instant;

/**
 * A running or launching instance. Mutated only under the owning controller's lock.
 */
@Data
public class FleetMember {
    private final String instanceId;
    private final int generation;
    private final String subnetId;
    private final Instant launchedAt;
    private MemberLifecycle lifecycle = MemberLifecycle.PENDING;

    public boolean isLive() {
        return lifecycle == MemberLifecycle.IN_SERVICE;
    }

    public boolean isActive() {
        return lifecycle == MemberLifecycle.PENDING || lifecycle == MemberLifecycle.IN_SERVICE;
    }
}
