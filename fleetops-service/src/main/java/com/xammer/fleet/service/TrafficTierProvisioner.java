package com.xammer.fleet.service;

import com.xammer.fleet.domain.IngressRule;
import com.xammer.fleet.domain.TrafficTier;
import com.xammer.fleet.domain.TrafficTierEndpoint;
import com.xammer.fleet.domain.TrafficTierSpec;
import com.xammer.fleet.exception.ProvisioningException;
import com.xammer.fleet.util.AwsResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.IpPermission;
import software.amazon.awssdk.services.ec2.model.IpRange;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ActionTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Certificate;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancer;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancerSchemeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancerTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Matcher;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ProtocolEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetTypeEnum;

import java.util.Optional;

/**
 * Application load balancer in front of a fleet: HTTPS listener on 443 forwarding to one HTTP target group
 * health-checked on {@code GET /}. Unhealthy targets stop receiving traffic; replacing them is left to the
 * capacity group.
 */
@Service
public class TrafficTierProvisioner {

    private static final Logger logger = LoggerFactory.getLogger(TrafficTierProvisioner.class);

    private final Ec2Client ec2;
    private final ElasticLoadBalancingV2Client elbv2;
    private final SecurityBoundaryResolver securityBoundaryResolver;

    public TrafficTierProvisioner(Ec2Client ec2, ElasticLoadBalancingV2Client elbv2,
            SecurityBoundaryResolver securityBoundaryResolver) {
        this.ec2 = ec2;
        this.elbv2 = elbv2;
        this.securityBoundaryResolver = securityBoundaryResolver;
    }

    /**
     * @return the endpoint, or empty when the tier is absent (no resource is touched)
     */
    public Optional<TrafficTierEndpoint> provision(String fleetName, String vpcId, TrafficTier tier) {
        return tier.fold(
                absent -> Optional.empty(),
                present -> Optional.of(create(fleetName, vpcId, present.getSpec())));
    }

    public static String effectiveAddress(TrafficTier tier, TrafficTierEndpoint endpoint) {
        return tier.fold(TrafficTier.Absent::getExternalAddress, present -> endpoint.getDnsName());
    }

    private TrafficTierEndpoint create(String fleetName, String vpcId, TrafficTierSpec spec) {
        TrafficTierEndpoint.TrafficTierEndpointBuilder created = TrafficTierEndpoint.builder();
        try {
            String groupId = ec2.createSecurityGroup(r -> r
                    .groupName(AwsResourceNames.tierSecurityGroup(fleetName))
                    .description("Traffic tier for fleet " + fleetName)
                    .vpcId(vpcId)).groupId();
            created.securityGroupId(groupId);

            IngressRule https = securityBoundaryResolver.tierIngress();
            ec2.authorizeSecurityGroupIngress(r -> r
                    .groupId(groupId)
                    .ipPermissions(IpPermission.builder()
                            .ipProtocol("tcp")
                            .fromPort(https.getPort())
                            .toPort(https.getPort())
                            .ipRanges(IpRange.builder().cidrIp(https.getSource()).build())
                            .build()));

            LoadBalancer balancer = elbv2.createLoadBalancer(r -> r
                    .name(AwsResourceNames.loadBalancer(fleetName))
                    .subnets(spec.getSubnetIds())
                    .securityGroups(groupId)
                    .scheme(LoadBalancerSchemeEnum.INTERNET_FACING)
                    .type(LoadBalancerTypeEnum.APPLICATION)).loadBalancers().get(0);
            created.loadBalancerArn(balancer.loadBalancerArn()).dnsName(balancer.dnsName());

            String targetGroupArn = elbv2.createTargetGroup(r -> r
                    .name(AwsResourceNames.targetGroup(fleetName))
                    .protocol(ProtocolEnum.HTTP)
                    .port(TrafficTier.TARGET_PORT)
                    .vpcId(vpcId)
                    .targetType(TargetTypeEnum.INSTANCE)
                    .healthCheckProtocol(ProtocolEnum.HTTP)
                    .healthCheckPath(TrafficTier.HEALTH_CHECK_PATH)
                    .matcher(Matcher.builder().httpCode("200").build())).targetGroups().get(0).targetGroupArn();
            created.targetGroupArn(targetGroupArn);

            String listenerArn = elbv2.createListener(r -> r
                    .loadBalancerArn(balancer.loadBalancerArn())
                    .protocol(ProtocolEnum.HTTPS)
                    .port(TrafficTier.LISTENER_PORT)
                    .certificates(Certificate.builder().certificateArn(spec.getCertificateRef()).build())
                    .defaultActions(Action.builder()
                            .type(ActionTypeEnum.FORWARD)
                            .targetGroupArn(targetGroupArn)
                            .build())).listeners().get(0).listenerArn();
            created.listenerArn(listenerArn);

            TrafficTierEndpoint endpoint = created.build();
            logger.info("Traffic tier for fleet {} ready at {} (listener {} -> target group {})",
                    fleetName, endpoint.getDnsName(), listenerArn, targetGroupArn);
            return endpoint;
        } catch (SdkException e) {
            logger.error("Traffic tier creation failed for fleet {}, removing partial resources", fleetName);
            teardown(fleetName, created.build());
            throw new ProvisioningException("Failed to create traffic tier for fleet " + fleetName, e);
        }
    }

    public void teardown(String fleetName, TrafficTierEndpoint endpoint) {
        if (endpoint == null) {
            return;
        }
        if (endpoint.getLoadBalancerArn() != null) {
            attempt(fleetName, "load balancer", () -> {
                elbv2.deleteLoadBalancer(r -> r.loadBalancerArn(endpoint.getLoadBalancerArn()));
                elbv2.waiter().waitUntilLoadBalancersDeleted(r -> r.loadBalancerArns(endpoint.getLoadBalancerArn()));
            });
        }
        if (endpoint.getTargetGroupArn() != null) {
            attempt(fleetName, "target group",
                    () -> elbv2.deleteTargetGroup(r -> r.targetGroupArn(endpoint.getTargetGroupArn())));
        }
        if (endpoint.getSecurityGroupId() != null) {
            attempt(fleetName, "tier security group",
                    () -> ec2.deleteSecurityGroup(r -> r.groupId(endpoint.getSecurityGroupId())));
        }
    }

    private void attempt(String fleetName, String what, Runnable action) {
        try {
            action.run();
        } catch (SdkException e) {
            logger.error("Teardown of {} for fleet {} left it behind: {}", what, fleetName, e.getMessage());
        }
    }
}
