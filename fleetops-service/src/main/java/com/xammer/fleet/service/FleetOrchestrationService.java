package com.xammer.fleet.service;

import com.xammer.fleet.domain.BootstrapPayload;
import com.xammer.fleet.domain.CapacitySettings;
import com.xammer.fleet.domain.FleetDefinition;
import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.ProvisioningPlan;
import com.xammer.fleet.domain.RefreshOutcome;
import com.xammer.fleet.domain.SecurityPolicy;
import com.xammer.fleet.domain.TemplateGeneration;
import com.xammer.fleet.dto.CapacityUpdateRequest;
import com.xammer.fleet.dto.DispatcherStatusDto;
import com.xammer.fleet.dto.FleetDefinitionRequest;
import com.xammer.fleet.dto.TemplateUpdateRequest;
import com.xammer.fleet.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point for fleet lifecycle operations. Definitions are validated in full before the first cloud call.
 */
@Service
public class FleetOrchestrationService {

    private static final Logger logger = LoggerFactory.getLogger(FleetOrchestrationService.class);

    private final FleetDefinitionValidator validator;
    private final BootstrapPayloadBuilder bootstrapPayloadBuilder;
    private final SecurityBoundaryResolver securityBoundaryResolver;
    private final FleetNetworkProvisioner networkProvisioner;
    private final CapacityGroupControllerFactory controllerFactory;
    private final FleetRegistry registry;
    private final RefreshDispatcherRegistry dispatcherRegistry;
    private final ProvisioningPlanner planner;

    public FleetOrchestrationService(FleetDefinitionValidator validator,
            BootstrapPayloadBuilder bootstrapPayloadBuilder,
            SecurityBoundaryResolver securityBoundaryResolver,
            FleetNetworkProvisioner networkProvisioner,
            CapacityGroupControllerFactory controllerFactory,
            FleetRegistry registry,
            RefreshDispatcherRegistry dispatcherRegistry,
            ProvisioningPlanner planner) {
        this.validator = validator;
        this.bootstrapPayloadBuilder = bootstrapPayloadBuilder;
        this.securityBoundaryResolver = securityBoundaryResolver;
        this.networkProvisioner = networkProvisioner;
        this.controllerFactory = controllerFactory;
        this.registry = registry;
        this.dispatcherRegistry = dispatcherRegistry;
        this.planner = planner;
    }

    public ProvisioningPlan plan(FleetDefinitionRequest request) {
        return planner.plan(validator.validate(request));
    }

    public FleetState createFleet(FleetDefinitionRequest request) {
        FleetDefinition definition = validator.validateNew(request);
        String fleetId = definition.getName();
        logger.info("Creating fleet {} ({}, tier {})", fleetId, definition.getFleet().getInstanceType(),
                definition.getTrafficTier().isPresent() ? "present" : "absent");

        BootstrapPayload payload = bootstrapPayloadBuilder.build(fleetId, definition.getMonitoringConfigTemplate());
        SecurityPolicy policy = securityBoundaryResolver.resolve(definition.getTrafficTier());

        FleetNetwork network = networkProvisioner.provision(definition, policy);
        CapacityGroupController controller = controllerFactory.create(definition, network);
        try {
            registry.register(controller);
        } catch (RuntimeException e) {
            networkProvisioner.teardown(fleetId, network, Collections.emptyList());
            throw e;
        }
        try {
            controller.start(payload);
        } catch (RuntimeException e) {
            logger.error("Fleet {}: start failed, rolling back", fleetId, e);
            registry.remove(fleetId);
            List<String> terminated = controller.delete();
            networkProvisioner.teardown(fleetId, network, terminated);
            throw e;
        }
        dispatcherRegistry.register(definition.getRefreshSchedule());
        logger.info("Fleet {} created, reachable at {}", fleetId, network.getEffectiveAddress());
        return controller.snapshot();
    }

    public FleetState describe(String fleetId) {
        return registry.require(fleetId).snapshot();
    }

    public List<FleetState> list() {
        return registry.all().stream()
                .map(CapacityGroupController::snapshot)
                .sorted(Comparator.comparing(FleetState::getFleetId))
                .collect(Collectors.toList());
    }

    public CapacitySettings updateCapacity(String fleetId, CapacityUpdateRequest request) {
        CapacityGroupController controller = registry.require(fleetId);
        CapacitySettings current = controller.getCapacity();
        if (request == null) {
            throw new InvalidConfigurationException("capacity update is required");
        }
        return controller.updateCapacity(
                request.getMinSize() != null ? request.getMinSize() : current.getMinSize(),
                request.getDesiredCapacity() != null ? request.getDesiredCapacity() : current.getDesiredCapacity(),
                request.getMaxSize() != null ? request.getMaxSize() : current.getMaxSize());
    }

    public TemplateGeneration replaceTemplate(String fleetId, TemplateUpdateRequest request) {
        CapacityGroupController controller = registry.require(fleetId);
        if (request == null) {
            throw new InvalidConfigurationException("template update is required");
        }
        BootstrapPayload payload = request.getMonitoringConfigTemplate() == null
                ? null
                : bootstrapPayloadBuilder.build(fleetId, request.getMonitoringConfigTemplate());
        return controller.replaceTemplate(blankToNull(request.getInstanceType()), blankToNull(request.getAmiReference()), payload);
    }

    public RefreshOutcome startRefresh(String fleetId) {
        return registry.require(fleetId).startRollingRefresh();
    }

    public DispatcherStatusDto dispatcherStatus(String fleetId) {
        return dispatcherRegistry.status(fleetId);
    }

    public void deleteFleet(String fleetId) {
        CapacityGroupController controller = registry.require(fleetId);
        logger.info("Deleting fleet {}", fleetId);
        dispatcherRegistry.cancel(fleetId);
        List<String> terminated = controller.delete();
        registry.remove(fleetId);
        networkProvisioner.teardown(fleetId, controller.getNetwork(), terminated);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
