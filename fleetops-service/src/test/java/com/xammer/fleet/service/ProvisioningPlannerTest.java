package com.xammer.fleet.service;

import com.xammer.fleet.domain.HealthCheckMode;
import com.xammer.fleet.domain.ProvisioningPlan;
import com.xammer.fleet.domain.SecurityPolicy;
import com.xammer.fleet.dto.FleetDefinitionRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProvisioningPlannerTest {

    private final FleetDefinitionValidator validator = new FleetDefinitionValidator(new FleetRegistry(), 30);
    private final ProvisioningPlanner planner = new ProvisioningPlanner(
            new SecurityBoundaryResolver(SecurityBoundaryResolver.DEFAULT_FALLBACK_CIDR),
            new BootstrapPayloadBuilder("PLACEHOLDER_HOSTNAME"));

    @Test
    void planWithoutTierSkipsBalancerResources() {
        ProvisioningPlan plan = planner.plan(validator.validate(FleetDefinitionValidatorTest.validRequest()));

        assertThat(plan.getSteps())
                .extracting(ProvisioningPlan.Step::getResourceType)
                .containsExactly("security-group", "launch-template", "capacity-group", "refresh-schedule");
        assertThat(plan.getHealthCheckMode()).isEqualTo(HealthCheckMode.SELF_REPORTED);
        assertThat(plan.getSecurityPolicy().getSourceKind()).isEqualTo(SecurityPolicy.SourceKind.STATIC_CIDR_BLOCK);
        assertThat(plan.getSteps().get(0).getDetail()).contains("PERMISSIVE DEFAULT");
    }

    @Test
    void planWithTierCreatesBalancerFirst() {
        FleetDefinitionRequest request = FleetDefinitionValidatorTest.validRequest();
        request.setTrafficTier(FleetDefinitionValidatorTest.tier("arn:aws:acm:ap-south-1:123456789012:certificate/abc"));

        ProvisioningPlan plan = planner.plan(validator.validate(request));

        assertThat(plan.getSteps())
                .extracting(ProvisioningPlan.Step::getName)
                .containsExactly("web-alb-sg", "web-alb", "web-tg", "HTTPS:443", "web-sg", "web-lt", "web", "web");
        assertThat(plan.getSteps())
                .extracting(ProvisioningPlan.Step::getOrder)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(plan.getHealthCheckMode()).isEqualTo(HealthCheckMode.ENDPOINT_HEALTH);
        assertThat(plan.getSteps().get(3).getDetail()).contains("forward to web-tg");
    }
}
