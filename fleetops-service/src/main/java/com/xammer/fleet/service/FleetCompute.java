package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.HealthCheckMode;
import com.xammer.fleet.domain.MemberHealth;
import com.xammer.fleet.domain.TemplateGeneration;

/**
 * Compute backend behind a {@link CapacityGroupController}: instance templates and the instances launched from them.
 */
public interface FleetCompute {

    /**
     * Registers a template generation and makes it the default for new launches.
     *
     * @return backend reference of the registered template
     */
    String registerTemplate(String fleetId, FleetNetwork network, TemplateGeneration generation);

    /**
     * Removes a generation no member uses any more. Never called for the current generation.
     */
    void retireTemplate(String fleetId, TemplateGeneration generation);

    /**
     * Removes every template of the fleet. Part of fleet teardown.
     */
    void deleteTemplates(String fleetId);

    /**
     * Launches one member and, when the fleet has a traffic tier, registers it with the tier's target pool.
     *
     * @return the new instance id
     */
    String launchMember(String fleetId, FleetNetwork network, TemplateGeneration generation, String subnetId);

    MemberHealth checkHealth(FleetNetwork network, String instanceId, HealthCheckMode mode);

    /**
     * Deregisters the member from the target pool, if any, and terminates it regardless of its lifecycle state.
     */
    void terminateMember(FleetNetwork network, String instanceId);
}
