package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.HealthCheckMode;
import com.xammer.fleet.domain.MemberHealth;
import com.xammer.fleet.domain.TemplateGeneration;
import com.xammer.fleet.domain.TrafficTier;
import com.xammer.fleet.exception.ProvisioningException;
import com.xammer.fleet.util.AwsResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.CreateLaunchTemplateResponse;
import software.amazon.awssdk.services.ec2.model.CreateLaunchTemplateVersionResponse;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.InstanceStatus;
import software.amazon.awssdk.services.ec2.model.LaunchTemplateSpecification;
import software.amazon.awssdk.services.ec2.model.LaunchTemplateTagSpecificationRequest;
import software.amazon.awssdk.services.ec2.model.RequestLaunchTemplateData;
import software.amazon.awssdk.services.ec2.model.ResourceType;
import software.amazon.awssdk.services.ec2.model.RunInstancesResponse;
import software.amazon.awssdk.services.ec2.model.SummaryStatus;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetDescription;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthDescription;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthStateEnum;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * EC2 launch templates and instances. Each template generation is a launch template version; the newest
 * version is made the default before any older one is deleted.
 */
@Service
public class Ec2FleetCompute implements FleetCompute {

    private static final Logger logger = LoggerFactory.getLogger(Ec2FleetCompute.class);

    static final String FLEET_TAG = "fleetops:fleet";
    static final String GENERATION_TAG = "fleetops:generation";

    private final Ec2Client ec2;
    private final ElasticLoadBalancingV2Client elbv2;

    // fleet id -> launch template id
    private final Map<String, String> launchTemplateIds = new ConcurrentHashMap<>();

    public Ec2FleetCompute(Ec2Client ec2, ElasticLoadBalancingV2Client elbv2) {
        this.ec2 = ec2;
        this.elbv2 = elbv2;
    }

    @Override
    public String registerTemplate(String fleetId, FleetNetwork network, TemplateGeneration generation) {
        RequestLaunchTemplateData data = RequestLaunchTemplateData.builder()
                .imageId(generation.getAmiReference())
                .instanceType(generation.getInstanceType())
                .securityGroupIds(network.getFleetSecurityGroupId())
                .userData(generation.getPayload().encoded())
                .tagSpecifications(LaunchTemplateTagSpecificationRequest.builder()
                        .resourceType(ResourceType.INSTANCE)
                        .tags(tag("Name", fleetId), tag(FLEET_TAG, fleetId),
                                tag(GENERATION_TAG, String.valueOf(generation.getNumber())))
                        .build())
                .build();
        try {
            String templateId = launchTemplateIds.get(fleetId);
            if (templateId == null) {
                CreateLaunchTemplateResponse created = ec2.createLaunchTemplate(r -> r
                        .launchTemplateName(AwsResourceNames.launchTemplate(fleetId))
                        .launchTemplateData(data));
                templateId = created.launchTemplate().launchTemplateId();
                launchTemplateIds.put(fleetId, templateId);
                logger.info("Created launch template {} for fleet {} (generation {})",
                        templateId, fleetId, generation.getNumber());
                return templateId + ":" + created.launchTemplate().latestVersionNumber();
            }

            String id = templateId;
            CreateLaunchTemplateVersionResponse version = ec2.createLaunchTemplateVersion(r -> r
                    .launchTemplateId(id)
                    .launchTemplateData(data)
                    .versionDescription("generation " + generation.getNumber()));
            String versionNumber = String.valueOf(version.launchTemplateVersion().versionNumber());
            ec2.modifyLaunchTemplate(r -> r.launchTemplateId(id).defaultVersion(versionNumber));
            logger.info("Registered launch template {} version {} for fleet {} (generation {})",
                    id, versionNumber, fleetId, generation.getNumber());
            return id + ":" + versionNumber;
        } catch (Ec2Exception e) {
            throw new ProvisioningException("Failed to register launch template for fleet " + fleetId, e);
        }
    }

    @Override
    public void retireTemplate(String fleetId, TemplateGeneration generation) {
        String ref = generation.getTemplateRef();
        if (ref == null) {
            return;
        }
        String[] parts = ref.split(":");
        try {
            ec2.deleteLaunchTemplateVersions(r -> r.launchTemplateId(parts[0]).versions(parts[1]));
            logger.info("Retired launch template {} version {} of fleet {}", parts[0], parts[1], fleetId);
        } catch (Ec2Exception e) {
            // an unused version left behind does not affect launches
            logger.warn("Could not delete launch template version {} of fleet {}: {}", ref, fleetId, e.getMessage());
        }
    }

    @Override
    public void deleteTemplates(String fleetId) {
        String templateId = launchTemplateIds.remove(fleetId);
        if (templateId == null) {
            return;
        }
        ec2.deleteLaunchTemplate(r -> r.launchTemplateId(templateId));
        logger.info("Deleted launch template {} of fleet {}", templateId, fleetId);
    }

    @Override
    public String launchMember(String fleetId, FleetNetwork network, TemplateGeneration generation, String subnetId) {
        String[] parts = generation.getTemplateRef().split(":");
        RunInstancesResponse response;
        try {
            response = ec2.runInstances(r -> r
                    .minCount(1)
                    .maxCount(1)
                    .subnetId(subnetId)
                    .launchTemplate(LaunchTemplateSpecification.builder()
                            .launchTemplateId(parts[0])
                            .version(parts[1])
                            .build()));
        } catch (Ec2Exception e) {
            throw new ProvisioningException("Failed to launch member for fleet " + fleetId + " in " + subnetId, e);
        }
        String instanceId = response.instances().get(0).instanceId();

        Optional<String> targetGroup = network.targetGroupArn();
        if (targetGroup.isPresent()) {
            try {
                elbv2.registerTargets(r -> r
                        .targetGroupArn(targetGroup.get())
                        .targets(target(instanceId)));
            } catch (SdkException e) {
                // not yet tracked by the caller
                try {
                    ec2.terminateInstances(r -> r.instanceIds(instanceId));
                } catch (SdkException te) {
                    logger.error("Could not terminate unregistered instance {} of fleet {}", instanceId, fleetId, te);
                }
                throw new ProvisioningException("Failed to register " + instanceId + " with target group "
                        + targetGroup.get() + " for fleet " + fleetId, e);
            }
        }
        logger.info("Launched {} for fleet {} (generation {}, subnet {})",
                instanceId, fleetId, generation.getNumber(), subnetId);
        return instanceId;
    }

    @Override
    public MemberHealth checkHealth(FleetNetwork network, String instanceId, HealthCheckMode mode) {
        if (mode == HealthCheckMode.ENDPOINT_HEALTH && network.targetGroupArn().isPresent()) {
            return endpointHealth(network.targetGroupArn().get(), instanceId);
        }
        return instanceHealth(instanceId);
    }

    private MemberHealth endpointHealth(String targetGroupArn, String instanceId) {
        List<TargetHealthDescription> descriptions = elbv2.describeTargetHealth(r -> r
                .targetGroupArn(targetGroupArn)
                .targets(target(instanceId))).targetHealthDescriptions();
        if (descriptions.isEmpty()) {
            return MemberHealth.INITIALIZING;
        }
        TargetHealthStateEnum state = descriptions.get(0).targetHealth().state();
        if (state == TargetHealthStateEnum.HEALTHY) {
            return MemberHealth.HEALTHY;
        }
        if (state == TargetHealthStateEnum.INITIAL) {
            return MemberHealth.INITIALIZING;
        }
        return MemberHealth.UNHEALTHY;
    }

    private MemberHealth instanceHealth(String instanceId) {
        List<InstanceStatus> statuses = ec2.describeInstanceStatus(r -> r
                .instanceIds(instanceId)
                .includeAllInstances(true)).instanceStatuses();
        if (statuses.isEmpty()) {
            return MemberHealth.INITIALIZING;
        }
        InstanceStatus status = statuses.get(0);
        String state = status.instanceState().nameAsString();
        if ("pending".equals(state)) {
            return MemberHealth.INITIALIZING;
        }
        if (!"running".equals(state)) {
            return MemberHealth.UNHEALTHY;
        }
        SummaryStatus instanceCheck = status.instanceStatus().status();
        SummaryStatus systemCheck = status.systemStatus().status();
        if (instanceCheck == SummaryStatus.OK && systemCheck == SummaryStatus.OK) {
            return MemberHealth.HEALTHY;
        }
        if (instanceCheck == SummaryStatus.IMPAIRED || systemCheck == SummaryStatus.IMPAIRED) {
            return MemberHealth.UNHEALTHY;
        }
        return MemberHealth.INITIALIZING;
    }

    @Override
    public void terminateMember(FleetNetwork network, String instanceId) {
        Optional<String> targetGroup = network.targetGroupArn();
        if (targetGroup.isPresent()) {
            try {
                elbv2.deregisterTargets(r -> r.targetGroupArn(targetGroup.get()).targets(target(instanceId)));
            } catch (RuntimeException e) {
                logger.warn("Could not deregister {} from {}: {}", instanceId, targetGroup.get(), e.getMessage());
            }
        }
        ec2.terminateInstances(r -> r.instanceIds(instanceId));
        logger.info("Terminated {}", instanceId);
    }

    private static TargetDescription target(String instanceId) {
        return TargetDescription.builder().id(instanceId).port(TrafficTier.TARGET_PORT).build();
    }

    private static Tag tag(String key, String value) {
        return Tag.builder().key(key).value(value).build();
    }
}
