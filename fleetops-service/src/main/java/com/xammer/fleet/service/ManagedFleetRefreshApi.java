package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.RefreshOutcome;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Refresh trigger for fleets whose capacity group runs in this service.
 */
@Service
@ConditionalOnProperty(name = "fleet.refresh.backend", havingValue = "managed", matchIfMissing = true)
public class ManagedFleetRefreshApi implements FleetRefreshApi {

    private final FleetRegistry registry;

    public ManagedFleetRefreshApi(FleetRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Optional<FleetState> describe(String fleetId) {
        return registry.find(fleetId).map(CapacityGroupController::snapshot);
    }

    @Override
    public RefreshOutcome startRefresh(String fleetId) {
        return registry.find(fleetId)
                .map(CapacityGroupController::startRollingRefresh)
                .orElseGet(() -> RefreshOutcome.rejected("fleet not found: " + fleetId, "NotFound"));
    }
}
