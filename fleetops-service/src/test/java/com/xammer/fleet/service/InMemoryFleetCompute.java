package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.HealthCheckMode;
import com.xammer.fleet.domain.MemberHealth;
import com.xammer.fleet.domain.TemplateGeneration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compute backend that records every call. Members report {@link MemberHealth#HEALTHY} unless overridden.
 */
class InMemoryFleetCompute implements FleetCompute {

    final List<String> events = new ArrayList<>();
    final List<String> launched = new ArrayList<>();
    final List<String> terminated = new ArrayList<>();
    final Map<String, MemberHealth> health = new HashMap<>();
    final Set<String> failOnTerminate = new HashSet<>();
    HealthCheckMode lastHealthMode;
    private int next = 1;

    @Override
    public String registerTemplate(String fleetId, FleetNetwork network, TemplateGeneration generation) {
        events.add("register:" + generation.getNumber());
        return "lt-" + fleetId + ":" + generation.getNumber();
    }

    @Override
    public void retireTemplate(String fleetId, TemplateGeneration generation) {
        events.add("retire:" + generation.getNumber());
    }

    @Override
    public void deleteTemplates(String fleetId) {
        events.add("delete-templates");
    }

    @Override
    public String launchMember(String fleetId, FleetNetwork network, TemplateGeneration generation, String subnetId) {
        String id = "i-" + next++;
        launched.add(id);
        events.add("launch:" + id + ":gen" + generation.getNumber() + ":" + subnetId);
        return id;
    }

    @Override
    public MemberHealth checkHealth(FleetNetwork network, String instanceId, HealthCheckMode mode) {
        lastHealthMode = mode;
        return health.getOrDefault(instanceId, MemberHealth.HEALTHY);
    }

    @Override
    public void terminateMember(FleetNetwork network, String instanceId) {
        if (failOnTerminate.contains(instanceId)) {
            throw new IllegalStateException("instance " + instanceId + " is stuck in shutting-down");
        }
        terminated.add(instanceId);
        events.add("terminate:" + instanceId);
    }
}
