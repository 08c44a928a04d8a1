package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetDefinition;
import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.RefreshPreferences;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class CapacityGroupControllerFactory {

    private final FleetCompute compute;
    private final TaskScheduler taskScheduler;
    private final RefreshPreferences refreshPreferences;
    private final Clock clock;

    public CapacityGroupControllerFactory(FleetCompute compute, TaskScheduler taskScheduler,
            RefreshPreferences refreshPreferences, Clock clock) {
        this.compute = compute;
        this.taskScheduler = taskScheduler;
        this.refreshPreferences = refreshPreferences;
        this.clock = clock;
    }

    public CapacityGroupController create(FleetDefinition definition, FleetNetwork network) {
        return new CapacityGroupController(definition.getName(), definition.getFleet(), definition.getTrafficTier(),
                network, compute, taskScheduler, refreshPreferences, clock);
    }
}
