package com.xammer.fleet.service;

import com.xammer.fleet.domain.IngressRule;
import com.xammer.fleet.domain.SecurityPolicy;
import com.xammer.fleet.domain.TrafficTier;
import com.xammer.fleet.domain.TrafficTierSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityBoundaryResolverTest {

    private final SecurityBoundaryResolver resolver = new SecurityBoundaryResolver(SecurityBoundaryResolver.DEFAULT_FALLBACK_CIDR);

    private static TrafficTier present() {
        return TrafficTier.present(TrafficTierSpec.builder()
                .certificateRef("arn:aws:acm:ap-south-1:123456789012:certificate/abc")
                .subnetId("subnet-a")
                .build());
    }

    @Test
    void absentTierAllowsPortEightyFromFallbackRange() {
        SecurityPolicy policy = resolver.resolve(TrafficTier.absent("10.0.3.7"));

        assertThat(policy.getSourceKind()).isEqualTo(SecurityPolicy.SourceKind.STATIC_CIDR_BLOCK);
        assertThat(policy.getIngress()).isEqualTo(new IngressRule(80, "10.0.0.0/8"));
        assertThat(policy.getEgressCidr()).isEqualTo("0.0.0.0/0");
        assertThat(policy.isPermissiveDefault()).isTrue();
    }

    @Test
    void presentTierAllowsPortEightyOnlyFromTierGroup() {
        SecurityPolicy policy = resolver.resolve(present());

        assertThat(policy.getSourceKind()).isEqualTo(SecurityPolicy.SourceKind.TRAFFIC_TIER_GROUP);
        assertThat(policy.getPort()).isEqualTo(80);
        assertThat(policy.isPermissiveDefault()).isFalse();
        assertThat(policy.bindTierGroup("sg-0tier").getIngress().getSource()).isEqualTo("sg-0tier");
    }

    @Test
    void everyVariantYieldsExactlyOnePolicy() {
        for (TrafficTier tier : List.of(TrafficTier.absent(null), present())) {
            SecurityPolicy policy = resolver.resolve(tier);
            assertThat(policy).isNotNull();
            assertThat(policy.getSourceKind()).isEqualTo(tier.isPresent()
                    ? SecurityPolicy.SourceKind.TRAFFIC_TIER_GROUP
                    : SecurityPolicy.SourceKind.STATIC_CIDR_BLOCK);
        }
    }

    @Test
    void narrowedFallbackIsNotFlaggedPermissive() {
        SecurityPolicy policy = new SecurityBoundaryResolver("10.42.0.0/16").resolve(TrafficTier.absent(null));

        assertThat(policy.getIngress().getSource()).isEqualTo("10.42.0.0/16");
        assertThat(policy.isPermissiveDefault()).isFalse();
    }

    @Test
    void staticPolicyIgnoresTierBinding() {
        SecurityPolicy policy = resolver.resolve(TrafficTier.absent(null));

        assertThat(policy.bindTierGroup("sg-0tier")).isSameAs(policy);
    }

    @Test
    void tierGroupAcceptsHttpsFromAnywhere() {
        assertThat(resolver.tierIngress()).isEqualTo(new IngressRule(443, "0.0.0.0/0"));
    }
}
