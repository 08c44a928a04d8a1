package com.xammer.fleet.service;

import com.xammer.fleet.domain.IngressRule;
import com.xammer.fleet.domain.SecurityPolicy;
import com.xammer.fleet.domain.TrafficTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Chooses the single ingress rule fleet members accept, based on whether a traffic tier exists.
 */
@Service
public class SecurityBoundaryResolver {

    private static final Logger logger = LoggerFactory.getLogger(SecurityBoundaryResolver.class);

    public static final String DEFAULT_FALLBACK_CIDR = "10.0.0.0/8";

    private final String fallbackCidr;

    public SecurityBoundaryResolver(@Value("${fleet.security.fallback-cidr:" + DEFAULT_FALLBACK_CIDR + "}") String fallbackCidr) {
        this.fallbackCidr = fallbackCidr;
    }

    public SecurityPolicy resolve(TrafficTier tier) {
        return tier.fold(this::staticBlock, this::tierGroup);
    }

    /**
     * Rule on the tier's own group: HTTPS from anywhere.
     */
    public IngressRule tierIngress() {
        return new IngressRule(TrafficTier.LISTENER_PORT, SecurityPolicy.ANYWHERE);
    }

    private SecurityPolicy tierGroup(TrafficTier.Present tier) {
        return new SecurityPolicy(SecurityPolicy.SourceKind.TRAFFIC_TIER_GROUP,
                new IngressRule(TrafficTier.TARGET_PORT, SecurityPolicy.TIER_GROUP_PLACEHOLDER),
                SecurityPolicy.ANYWHERE,
                false);
    }

    private SecurityPolicy staticBlock(TrafficTier.Absent tier) {
        boolean permissive = DEFAULT_FALLBACK_CIDR.equals(fallbackCidr);
        if (permissive) {
            logger.warn("Security: no traffic tier, fleet accepts port {} from the default range {}. "
                    + "Narrow fleet.security.fallback-cidr for this deployment.", TrafficTier.TARGET_PORT, fallbackCidr);
        }
        return new SecurityPolicy(SecurityPolicy.SourceKind.STATIC_CIDR_BLOCK,
                new IngressRule(TrafficTier.TARGET_PORT, fallbackCidr),
                SecurityPolicy.ANYWHERE,
                permissive);
    }
}
