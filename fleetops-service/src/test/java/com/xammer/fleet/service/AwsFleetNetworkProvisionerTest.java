package com.xammer.fleet.service;

import com.xammer.fleet.domain.FleetDefinition;
import com.xammer.fleet.domain.FleetNetwork;
import com.xammer.fleet.domain.FleetSpec;
import com.xammer.fleet.domain.SecurityPolicy;
import com.xammer.fleet.domain.TrafficTier;
import com.xammer.fleet.domain.TrafficTierEndpoint;
import com.xammer.fleet.domain.TrafficTierSpec;
import com.xammer.fleet.exception.ProvisioningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AuthorizeSecurityGroupIngressRequest;
import software.amazon.awssdk.services.ec2.model.AuthorizeSecurityGroupIngressResponse;
import software.amazon.awssdk.services.ec2.model.CreateSecurityGroupRequest;
import software.amazon.awssdk.services.ec2.model.CreateSecurityGroupResponse;
import software.amazon.awssdk.services.ec2.model.DeleteSecurityGroupRequest;
import software.amazon.awssdk.services.ec2.model.DeleteSecurityGroupResponse;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsResponse;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.IpPermission;
import software.amazon.awssdk.services.ec2.model.IpRange;
import software.amazon.awssdk.services.ec2.model.Subnet;
import software.amazon.awssdk.services.ec2.model.UserIdGroupPair;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AwsFleetNetworkProvisionerTest {

    private static final String CERT = "arn:aws:acm:ap-south-1:123456789012:certificate/abc";
    private static final TrafficTierEndpoint ENDPOINT = TrafficTierEndpoint.builder()
            .securityGroupId("sg-tier")
            .dnsName("web-alb-1.ap-south-1.elb.amazonaws.com")
            .targetGroupArn("arn:aws:elasticloadbalancing:ap-south-1:123456789012:targetgroup/web-tg/1")
            .build();

    private final SecurityBoundaryResolver resolver = new SecurityBoundaryResolver("10.0.0.0/8");
    private Ec2Client ec2;
    private TrafficTierProvisioner tierProvisioner;
    private AwsFleetNetworkProvisioner provisioner;

    @BeforeEach
    void setUp() {
        ec2 = mock(Ec2Client.class, Mockito.CALLS_REAL_METHODS);
        tierProvisioner = mock(TrafficTierProvisioner.class);
        provisioner = new AwsFleetNetworkProvisioner(ec2, tierProvisioner);

        doReturn(DescribeSubnetsResponse.builder()
                .subnets(Subnet.builder().subnetId("subnet-a").vpcId("vpc-1").build())
                .build())
                .when(ec2).describeSubnets(any(DescribeSubnetsRequest.class));
        doReturn(CreateSecurityGroupResponse.builder().groupId("sg-fleet").build())
                .when(ec2).createSecurityGroup(any(CreateSecurityGroupRequest.class));
        doReturn(AuthorizeSecurityGroupIngressResponse.builder().build())
                .when(ec2).authorizeSecurityGroupIngress(any(AuthorizeSecurityGroupIngressRequest.class));
    }

    private static FleetDefinition definition(TrafficTier tier) {
        return FleetDefinition.builder()
                .fleet(FleetSpec.builder()
                        .name("web")
                        .instanceType("t3.micro")
                        .amiReference("ami-123")
                        .minSize(1)
                        .desiredCapacity(2)
                        .maxSize(3)
                        .subnetId("subnet-a")
                        .build())
                .trafficTier(tier)
                .build();
    }

    private IpPermission authorizedPermission() {
        ArgumentCaptor<AuthorizeSecurityGroupIngressRequest> ingress =
                ArgumentCaptor.forClass(AuthorizeSecurityGroupIngressRequest.class);
        verify(ec2).authorizeSecurityGroupIngress(ingress.capture());
        assertThat(ingress.getValue().groupId()).isEqualTo("sg-fleet");
        assertThat(ingress.getValue().ipPermissions()).hasSize(1);
        return ingress.getValue().ipPermissions().get(0);
    }

    @Test
    void fleetWithoutTierAcceptsFallbackBlockOnly() {
        TrafficTier tier = TrafficTier.absent("10.0.0.9");
        when(tierProvisioner.provision("web", "vpc-1", tier)).thenReturn(Optional.empty());

        FleetNetwork network = provisioner.provision(definition(tier), resolver.resolve(tier));

        IpPermission permission = authorizedPermission();
        assertThat(permission.fromPort()).isEqualTo(80);
        assertThat(permission.toPort()).isEqualTo(80);
        assertThat(permission.ipRanges()).extracting(IpRange::cidrIp).containsExactly("10.0.0.0/8");
        assertThat(permission.userIdGroupPairs()).isEmpty();

        assertThat(network.getVpcId()).isEqualTo("vpc-1");
        assertThat(network.getFleetSecurityGroupId()).isEqualTo("sg-fleet");
        assertThat(network.getEffectiveAddress()).isEqualTo("10.0.0.9");
        assertThat(network.targetGroupArn()).isEmpty();
    }

    @Test
    void fleetBehindTierAcceptsTierGroupOnly() {
        TrafficTier tier = TrafficTier.present(TrafficTierSpec.builder().certificateRef(CERT).subnetId("subnet-a").build());
        when(tierProvisioner.provision("web", "vpc-1", tier)).thenReturn(Optional.of(ENDPOINT));

        FleetNetwork network = provisioner.provision(definition(tier), resolver.resolve(tier));

        IpPermission permission = authorizedPermission();
        assertThat(permission.fromPort()).isEqualTo(80);
        assertThat(permission.userIdGroupPairs()).extracting(UserIdGroupPair::groupId).containsExactly("sg-tier");
        assertThat(permission.ipRanges()).isEmpty();

        assertThat(network.getSecurityPolicy().getSourceKind()).isEqualTo(SecurityPolicy.SourceKind.TRAFFIC_TIER_GROUP);
        assertThat(network.getSecurityPolicy().getIngress().getSource()).isEqualTo("sg-tier");
        assertThat(network.getEffectiveAddress()).isEqualTo("web-alb-1.ap-south-1.elb.amazonaws.com");
        assertThat(network.targetGroupArn()).contains(ENDPOINT.getTargetGroupArn());
    }

    @Test
    void tierIsRemovedWhenFleetGroupCannotBeCreated() {
        TrafficTier tier = TrafficTier.present(TrafficTierSpec.builder().certificateRef(CERT).subnetId("subnet-a").build());
        when(tierProvisioner.provision("web", "vpc-1", tier)).thenReturn(Optional.of(ENDPOINT));
        doThrow(Ec2Exception.builder().message("InvalidGroup.Duplicate").build())
                .when(ec2).createSecurityGroup(any(CreateSecurityGroupRequest.class));

        assertThatThrownBy(() -> provisioner.provision(definition(tier), resolver.resolve(tier)))
                .isInstanceOf(ProvisioningException.class);

        verify(tierProvisioner).teardown("web", ENDPOINT);
        verify(ec2, never()).authorizeSecurityGroupIngress(any(AuthorizeSecurityGroupIngressRequest.class));
    }

    @Test
    void unknownSubnetFailsBeforeAnythingIsCreated() {
        TrafficTier tier = TrafficTier.absent("10.0.0.9");
        doReturn(DescribeSubnetsResponse.builder().subnets(List.of()).build())
                .when(ec2).describeSubnets(any(DescribeSubnetsRequest.class));

        assertThatThrownBy(() -> provisioner.provision(definition(tier), resolver.resolve(tier)))
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining("subnet-a");

        verify(tierProvisioner, never()).provision(anyString(), anyString(), any(TrafficTier.class));
        verify(ec2, never()).createSecurityGroup(any(CreateSecurityGroupRequest.class));
    }

    @Test
    void teardownRemovesTierAndFleetGroupWhenNoMembersRan() {
        doReturn(DeleteSecurityGroupResponse.builder().build())
                .when(ec2).deleteSecurityGroup(any(DeleteSecurityGroupRequest.class));
        FleetNetwork network = FleetNetwork.builder()
                .vpcId("vpc-1")
                .fleetSecurityGroupId("sg-fleet")
                .tierEndpoint(ENDPOINT)
                .build();

        provisioner.teardown("web", network, List.of());

        verify(tierProvisioner).teardown(eq("web"), eq(ENDPOINT));
        ArgumentCaptor<DeleteSecurityGroupRequest> deleted = ArgumentCaptor.forClass(DeleteSecurityGroupRequest.class);
        verify(ec2).deleteSecurityGroup(deleted.capture());
        assertThat(deleted.getValue().groupId()).isEqualTo("sg-fleet");
        verify(ec2, never()).waiter();
    }
}
