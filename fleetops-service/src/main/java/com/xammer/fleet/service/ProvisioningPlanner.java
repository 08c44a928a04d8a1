package com.xammer.fleet.service;

import com.xammer.fleet.domain.BootstrapPayload;
import com.xammer.fleet.domain.FleetDefinition;
import com.xammer.fleet.domain.FleetSpec;
import com.xammer.fleet.domain.HealthCheckMode;
import com.xammer.fleet.domain.IngressRule;
import com.xammer.fleet.domain.ProvisioningPlan;
import com.xammer.fleet.domain.SecurityPolicy;
import com.xammer.fleet.domain.TrafficTier;
import com.xammer.fleet.domain.TrafficTierSpec;
import com.xammer.fleet.util.AwsResourceNames;
import org.springframework.stereotype.Service;

/**
 * Dry run of fleet creation: the resources {@link FleetOrchestrationService#createFleet} would create, in order.
 */
@Service
public class ProvisioningPlanner {

    private final SecurityBoundaryResolver securityBoundaryResolver;
    private final BootstrapPayloadBuilder bootstrapPayloadBuilder;

    public ProvisioningPlanner(SecurityBoundaryResolver securityBoundaryResolver,
            BootstrapPayloadBuilder bootstrapPayloadBuilder) {
        this.securityBoundaryResolver = securityBoundaryResolver;
        this.bootstrapPayloadBuilder = bootstrapPayloadBuilder;
    }

    public ProvisioningPlan plan(FleetDefinition definition) {
        String name = definition.getName();
        FleetSpec fleet = definition.getFleet();
        SecurityPolicy policy = securityBoundaryResolver.resolve(definition.getTrafficTier());
        HealthCheckMode mode = HealthCheckMode.of(definition.getTrafficTier());
        BootstrapPayload payload = bootstrapPayloadBuilder.build(name, definition.getMonitoringConfigTemplate());

        ProvisioningPlan.ProvisioningPlanBuilder plan = ProvisioningPlan.builder()
                .fleetName(name)
                .securityPolicy(policy)
                .healthCheckMode(mode);
        int[] order = {0};

        definition.getTrafficTier().<Void>fold(absent -> null, present -> {
            TrafficTierSpec tier = present.getSpec();
            IngressRule https = securityBoundaryResolver.tierIngress();
            plan.step(step(++order[0], "security-group", AwsResourceNames.tierSecurityGroup(name),
                    "ingress tcp/" + https.getPort() + " from " + https.getSource()));
            plan.step(step(++order[0], "load-balancer", AwsResourceNames.loadBalancer(name),
                    "application, internet-facing, subnets " + tier.getSubnetIds()));
            plan.step(step(++order[0], "target-group", AwsResourceNames.targetGroup(name),
                    "HTTP:" + TrafficTier.TARGET_PORT + ", health check GET " + TrafficTier.HEALTH_CHECK_PATH + " expects 200"));
            plan.step(step(++order[0], "listener", "HTTPS:" + TrafficTier.LISTENER_PORT,
                    "certificate " + tier.getCertificateRef() + ", forward to " + AwsResourceNames.targetGroup(name)));
            return null;
        });

        plan.step(step(++order[0], "security-group", AwsResourceNames.fleetSecurityGroup(name),
                "ingress tcp/" + policy.getPort() + " from " + policy.getIngress().getSource()
                        + " (" + policy.getSourceKind() + "), egress all to " + policy.getEgressCidr()
                        + (policy.isPermissiveDefault() ? ", PERMISSIVE DEFAULT: narrow fleet.security.fallback-cidr" : "")));
        plan.step(step(++order[0], "launch-template", AwsResourceNames.launchTemplate(name),
                "generation 1, " + fleet.getInstanceType() + ", image " + fleet.getAmiReference()
                        + ", user data " + payload.getRawContent().length + " bytes, hostname token "
                        + (payload.hasHostnameToken() ? "present" : "absent")));
        plan.step(step(++order[0], "capacity-group", name,
                "min " + fleet.getMinSize() + ", desired " + fleet.getDesiredCapacity() + ", max " + fleet.getMaxSize()
                        + ", subnets " + fleet.getSubnetIds() + ", health " + mode));
        plan.step(step(++order[0], "refresh-schedule", name,
                "rolling refresh every " + definition.getRefreshSchedule().getIntervalDays() + " day(s)"));
        return plan.build();
    }

    private static ProvisioningPlan.Step step(int order, String resourceType, String name, String detail) {
        return new ProvisioningPlan.Step(order, resourceType, name, detail);
    }
}
