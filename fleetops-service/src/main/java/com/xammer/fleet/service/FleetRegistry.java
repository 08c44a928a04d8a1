package com.xammer.fleet.service;

import com.xammer.fleet.exception.FleetAlreadyExistsException;
import com.xammer.fleet.exception.FleetNotFoundException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fleet id to controller lookup. Dispatchers and API callers resolve fleets here by id on every use.
 */
@Component
public class FleetRegistry {

    private final Map<String, CapacityGroupController> controllers = new ConcurrentHashMap<>();

    public void register(CapacityGroupController controller) {
        CapacityGroupController existing = controllers.putIfAbsent(controller.getFleetId(), controller);
        if (existing != null) {
            throw new FleetAlreadyExistsException(controller.getFleetId());
        }
    }

    public Optional<CapacityGroupController> find(String fleetId) {
        if (fleetId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(controllers.get(fleetId));
    }

    public CapacityGroupController require(String fleetId) {
        return find(fleetId).orElseThrow(() -> new FleetNotFoundException(fleetId));
    }

    public boolean contains(String fleetId) {
        return controllers.containsKey(fleetId);
    }

    public void remove(String fleetId) {
        controllers.remove(fleetId);
    }

    public Collection<CapacityGroupController> all() {
        return new ArrayList<>(controllers.values());
    }
}
