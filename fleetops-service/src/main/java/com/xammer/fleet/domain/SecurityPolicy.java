package com.xammer.fleet.domain;

import lombok.Value;
import lombok.With;

/**
 * Ingress rule set for fleet members. Exactly one {@link SourceKind} is active per policy.
 */
@Value
public class SecurityPolicy {

    public static final String ANYWHERE = "0.0.0.0/0";
    public static final String TIER_GROUP_PLACEHOLDER = "traffic-tier-security-group";

    public enum SourceKind {
        TRAFFIC_TIER_GROUP,
        STATIC_CIDR_BLOCK
    }

    SourceKind sourceKind;
    @With
    IngressRule ingress;
    String egressCidr;
    boolean permissiveDefault;

    public int getPort() {
        return ingress.getPort();
    }

    /**
     * Binds a {@link SourceKind#TRAFFIC_TIER_GROUP} policy to the concrete group id of the provisioned tier.
     */
    public SecurityPolicy bindTierGroup(String tierSecurityGroupId) {
        if (sourceKind != SourceKind.TRAFFIC_TIER_GROUP) {
            return this;
        }
        return withIngress(new IngressRule(ingress.getPort(), tierSecurityGroupId));
    }
}
