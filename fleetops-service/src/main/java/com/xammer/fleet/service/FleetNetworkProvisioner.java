package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetDefinition;
import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.SecurityPolicy;

import java.util.Collection;

/**
 * Creates and removes the network side of a fleet: the optional traffic tier and the members' security boundary.
 */
public interface FleetNetworkProvisioner {

    FleetNetwork provision(FleetDefinition definition, SecurityPolicy policy);

    /**
     * Removes everything {@link #provision} created. Leftovers are logged, never thrown.
     *
     * @param terminatedInstanceIds members just terminated; teardown waits for them before removing their security group
     */
    void teardown(String fleetId, FleetNetwork network, Collection<String> terminatedInstanceIds);
}
