package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetDefinition;
import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.SecurityPolicy;
import com.xammer.fleet.domain.TrafficTierEndpoint;
import com.xammer.fleet.exception.ProvisioningException;
import com.xammer.fleet.util.AwsResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.IpPermission;
import software.amazon.awssdk.services.ec2.model.IpRange;
import software.amazon.awssdk.services.ec2.model.UserIdGroupPair;

import java.util.Collection;

@Service
public class AwsFleetNetworkProvisioner implements FleetNetworkProvisioner {

    private static final Logger logger = LoggerFactory.getLogger(AwsFleetNetworkProvisioner.class);

    private final Ec2Client ec2;
    private final TrafficTierProvisioner trafficTierProvisioner;

    public AwsFleetNetworkProvisioner(Ec2Client ec2, TrafficTierProvisioner trafficTierProvisioner) {
        this.ec2 = ec2;
        this.trafficTierProvisioner = trafficTierProvisioner;
    }

    @Override
    public FleetNetwork provision(FleetDefinition definition, SecurityPolicy policy) {
        String fleetName = definition.getName();
        String vpcId = resolveVpc(definition);

        TrafficTierEndpoint endpoint = trafficTierProvisioner
                .provision(fleetName, vpcId, definition.getTrafficTier())
                .orElse(null);
        SecurityPolicy bound = endpoint == null ? policy : policy.bindTierGroup(endpoint.getSecurityGroupId());

        String groupId;
        try {
            groupId = ec2.createSecurityGroup(r -> r
                    .groupName(AwsResourceNames.fleetSecurityGroup(fleetName))
                    .description("Members of fleet " + fleetName)
                    .vpcId(vpcId)).groupId();
            ec2.authorizeSecurityGroupIngress(r -> r.groupId(groupId).ipPermissions(toPermission(bound)));
            // new groups allow all egress
        } catch (SdkException e) {
            trafficTierProvisioner.teardown(fleetName, endpoint);
            throw new ProvisioningException("Failed to create security group for fleet " + fleetName, e);
        }
        logger.info("Fleet {} security group {} accepts port {} from {} ({})",
                fleetName, groupId, bound.getPort(), bound.getIngress().getSource(), bound.getSourceKind());

        return FleetNetwork.builder()
                .vpcId(vpcId)
                .fleetSecurityGroupId(groupId)
                .securityPolicy(bound)
                .tierEndpoint(endpoint)
                .effectiveAddress(TrafficTierProvisioner.effectiveAddress(definition.getTrafficTier(), endpoint))
                .build();
    }

    @Override
    public void teardown(String fleetId, FleetNetwork network, Collection<String> terminatedInstanceIds) {
        if (!terminatedInstanceIds.isEmpty()) {
            try {
                ec2.waiter().waitUntilInstanceTerminated(r -> r.instanceIds(terminatedInstanceIds));
            } catch (SdkException e) {
                logger.warn("Fleet {}: members not confirmed terminated, continuing teardown: {}", fleetId, e.getMessage());
            }
        }
        trafficTierProvisioner.teardown(fleetId, network.getTierEndpoint());
        try {
            ec2.deleteSecurityGroup(r -> r.groupId(network.getFleetSecurityGroupId()));
        } catch (SdkException e) {
            logger.error("Teardown of security group {} for fleet {} left it behind: {}",
                    network.getFleetSecurityGroupId(), fleetId, e.getMessage());
        }
        logger.info("Fleet {} network torn down", fleetId);
    }

    private String resolveVpc(FleetDefinition definition) {
        String subnet = definition.getFleet().getSubnetIds().get(0);
        try {
            return ec2.describeSubnets(r -> r.subnetIds(subnet)).subnets().get(0).vpcId();
        } catch (SdkException | IndexOutOfBoundsException e) {
            throw new ProvisioningException("Cannot resolve VPC of subnet " + subnet, e);
        }
    }

    private static IpPermission toPermission(SecurityPolicy policy) {
        IpPermission.Builder permission = IpPermission.builder()
                .ipProtocol("tcp")
                .fromPort(policy.getPort())
                .toPort(policy.getPort());
        switch (policy.getSourceKind()) {
            case TRAFFIC_TIER_GROUP:
                permission.userIdGroupPairs(UserIdGroupPair.builder().groupId(policy.getIngress().getSource()).build());
                break;
            case STATIC_CIDR_BLOCK:
                permission.ipRanges(IpRange.builder().cidrIp(policy.getIngress().getSource()).build());
                break;
            default:
                throw new IllegalStateException("Unknown source kind " + policy.getSourceKind());
        }
        return permission.build();
    }
}
