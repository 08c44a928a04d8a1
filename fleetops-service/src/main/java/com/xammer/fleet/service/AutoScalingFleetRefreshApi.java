package com.xammer.fleet.service;

import com.xammer.fleet.domain.CapacitySettings;
import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.HealthCheckMode;
import com.xammer.fleet.domain.RefreshOutcome;
import com.xammer.fleet.domain.RefreshPreferences;
import com.xammer.fleet.domain.RefreshStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.autoscaling.model.AutoScalingException;
import software.amazon.awssdk.services.autoscaling.model.AutoScalingGroup;
import software.amazon.awssdk.services.autoscaling.model.InstanceRefreshInProgressException;
import software.amazon.awssdk.services.autoscaling.model.LifecycleState;
import software.amazon.awssdk.services.autoscaling.model.RefreshPreferences.Builder;
import software.amazon.awssdk.services.autoscaling.model.RefreshStrategy;
import software.amazon.awssdk.services.autoscaling.model.StartInstanceRefreshResponse;

import java.util.List;
import java.util.Optional;

/**
 * Refresh trigger for fleets that are EC2 Auto Scaling groups, addressed by group name.
 * Uses exactly {@code autoscaling:DescribeAutoScalingGroups} and {@code autoscaling:StartInstanceRefresh}.
 */
@Service
@ConditionalOnProperty(name = "fleet.refresh.backend", havingValue = "autoscaling")
public class AutoScalingFleetRefreshApi implements FleetRefreshApi {

    private static final Logger logger = LoggerFactory.getLogger(AutoScalingFleetRefreshApi.class);

    private final AutoScalingClient autoScaling;
    private final RefreshPreferences preferences;

    public AutoScalingFleetRefreshApi(AutoScalingClient autoScaling, RefreshPreferences preferences) {
        this.autoScaling = autoScaling;
        this.preferences = preferences;
        logger.info("Refresh triggers go to EC2 Auto Scaling (min healthy {}%, warmup {}s)",
                preferences.getMinHealthyPercentage(), preferences.getInstanceWarmup().getSeconds());
    }

    @Override
    public Optional<FleetState> describe(String fleetId) {
        List<AutoScalingGroup> groups = autoScaling.describeAutoScalingGroups(r -> r.autoScalingGroupNames(fleetId))
                .autoScalingGroups();
        if (groups.isEmpty()) {
            return Optional.empty();
        }
        AutoScalingGroup group = groups.get(0);
        int inService = (int) group.instances().stream()
                .filter(i -> i.lifecycleState() == LifecycleState.IN_SERVICE)
                .count();
        int pending = (int) group.instances().stream()
                .filter(i -> i.lifecycleState() == LifecycleState.PENDING)
                .count();
        boolean tierAttached = !group.targetGroupARNs().isEmpty() || !group.loadBalancerNames().isEmpty();
        return Optional.of(FleetState.builder()
                .fleetId(group.autoScalingGroupName())
                .capacity(CapacitySettings.of(group.minSize(), group.desiredCapacity(), group.maxSize()))
                .healthCheckMode(HealthCheckMode.fromAwsHealthCheckType(group.healthCheckType()))
                .liveMembers(inService)
                .pendingMembers(pending)
                .refreshStatus(RefreshStatus.NONE)
                .trafficTierPresent(tierAttached)
                .build());
    }

    @Override
    public RefreshOutcome startRefresh(String fleetId) {
        try {
            StartInstanceRefreshResponse response = autoScaling.startInstanceRefresh(r -> r
                    .autoScalingGroupName(fleetId)
                    .strategy(RefreshStrategy.ROLLING)
                    .preferences(this::applyPreferences));
            logger.info("Started instance refresh for {}: {}", fleetId, response.instanceRefreshId());
            return RefreshOutcome.accepted(response.instanceRefreshId());
        } catch (InstanceRefreshInProgressException e) {
            logger.info("Instance refresh already in progress for {}", fleetId);
            return RefreshOutcome.alreadyInProgress(null);
        } catch (AutoScalingException e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            logger.error("AWS error starting instance refresh for {} ({})", fleetId, code, e);
            return RefreshOutcome.rejected(e.getMessage(), code);
        }
    }

    private void applyPreferences(Builder builder) {
        builder.minHealthyPercentage(preferences.getMinHealthyPercentage())
                .instanceWarmup((int) preferences.getInstanceWarmup().getSeconds());
    }
}
