package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetDefinition;
import com.xammer.fleet.domain.FleetSpec;
import com.xammer.fleet.domain.RefreshSchedule;
import com.xammer.fleet.domain.TrafficTier;
import com.xammer.fleet.domain.TrafficTierSpec;
import com.xammer.fleet.dto.FleetDefinitionRequest;
import com.xammer.fleet.exception.FleetAlreadyExistsException;
import com.xammer.fleet.exception.InvalidCapacityRangeException;
import com.xammer.fleet.exception.InvalidConfigurationException;
import com.xammer.fleet.util.AwsResourceNames;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Turns a {@link FleetDefinitionRequest} into a {@link FleetDefinition}, or fails with
 * {@link InvalidConfigurationException}. Runs before any provisioning call.
 */
@Component
public class FleetDefinitionValidator {

    private final FleetRegistry registry;
    private final int defaultIntervalDays;

    public FleetDefinitionValidator(FleetRegistry registry,
            @Value("${fleet.refresh.default-interval-days:30}") int defaultIntervalDays) {
        this.registry = registry;
        this.defaultIntervalDays = defaultIntervalDays;
    }

    public FleetDefinition validateNew(FleetDefinitionRequest request) {
        FleetDefinition definition = validate(request);
        if (registry.contains(definition.getName())) {
            throw new FleetAlreadyExistsException(definition.getName());
        }
        return definition;
    }

    public FleetDefinition validate(FleetDefinitionRequest request) {
        if (request == null) {
            throw new InvalidConfigurationException("fleet definition is required");
        }
        String name = request.getName();
        if (!AwsResourceNames.isValidFleetName(name)) {
            throw new InvalidConfigurationException("name must be 1-" + AwsResourceNames.MAX_FLEET_NAME_LENGTH
                    + " alphanumeric characters or hyphens: " + name);
        }
        requireText(request.getInstanceType(), "instanceType");
        requireText(request.getAmiReference(), "amiReference");

        int min = requireNumber(request.getMinSize(), "minSize");
        int desired = requireNumber(request.getDesiredCapacity(), "desiredCapacity");
        int max = requireNumber(request.getMaxSize(), "maxSize");
        validateCapacity(min, desired, max);

        List<String> subnets = normalizeSubnets(request.getSubnetIds(), "subnetIds");
        if (subnets.isEmpty()) {
            throw new InvalidConfigurationException("subnetIds must contain at least one subnet");
        }

        FleetSpec fleet = FleetSpec.builder()
                .name(name)
                .instanceType(request.getInstanceType().trim())
                .amiReference(request.getAmiReference().trim())
                .minSize(min)
                .desiredCapacity(desired)
                .maxSize(max)
                .subnetIds(subnets)
                .build();

        int intervalDays = request.getRefreshIntervalDays() == null ? defaultIntervalDays : request.getRefreshIntervalDays();
        if (intervalDays <= 0) {
            throw new InvalidConfigurationException("refreshIntervalDays must be a positive integer, got " + intervalDays);
        }

        return FleetDefinition.builder()
                .fleet(fleet)
                .trafficTier(toTrafficTier(request, subnets))
                .refreshSchedule(new RefreshSchedule(intervalDays, name))
                .monitoringConfigTemplate(request.getMonitoringConfigTemplate() == null ? "" : request.getMonitoringConfigTemplate())
                .build();
    }

    public static void validateCapacity(int minSize, int desiredCapacity, int maxSize) {
        if (minSize < 0 || minSize > desiredCapacity || desiredCapacity > maxSize) {
            throw new InvalidCapacityRangeException(minSize, desiredCapacity, maxSize);
        }
    }

    private TrafficTier toTrafficTier(FleetDefinitionRequest request, List<String> fleetSubnets) {
        FleetDefinitionRequest.TrafficTierRequest tier = request.getTrafficTier();
        if (tier == null || !tier.isEnabled()) {
            return TrafficTier.absent(request.getExternalAddress());
        }
        List<String> tierSubnets = normalizeSubnets(tier.getSubnetIds(), "trafficTier.subnetIds");
        return TrafficTier.present(TrafficTierSpec.builder()
                .certificateRef(tier.getCertificateRef() == null ? null : tier.getCertificateRef().trim())
                .subnetIds(tierSubnets.isEmpty() ? fleetSubnets : tierSubnets)
                .build());
    }

    private static List<String> normalizeSubnets(List<String> subnetIds, String field) {
        if (subnetIds == null) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String subnet : subnetIds) {
            if (subnet == null || subnet.isBlank()) {
                throw new InvalidConfigurationException(field + " must not contain blank entries");
            }
            unique.add(subnet.trim());
        }
        return new ArrayList<>(unique);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(field + " is required");
        }
    }

    private static int requireNumber(Integer value, String field) {
        if (value == null) {
            throw new InvalidConfigurationException(field + " is required");
        }
        return value;
    }
}
