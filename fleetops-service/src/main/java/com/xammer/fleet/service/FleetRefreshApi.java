package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.RefreshOutcome;

import java.util.Optional;

/**
 * The two calls the refresh dispatcher is allowed to make: read a fleet, and start a refresh on it.
 */
public interface FleetRefreshApi {

    /**
     * @return the fleet state, or empty when no fleet has this id
     */
    Optional<FleetState> describe(String fleetId);

    RefreshOutcome startRefresh(String fleetId);
}
