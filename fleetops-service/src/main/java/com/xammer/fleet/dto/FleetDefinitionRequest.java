package com.xammer.fleet.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Fleet definition as submitted by an operator. Validated by
 * {@link com.xammer.fleet.service.FleetDefinitionValidator} before anything is provisioned.
 */
@Data
@NoArgsConstructor
public class FleetDefinitionRequest {

    private String name;
    private String instanceType;
    private String amiReference;
    private Integer desiredCapacity;
    private Integer minSize;
    private Integer maxSize;
    private List<String> subnetIds;

    private TrafficTierRequest trafficTier;

    // Address reported for discovery when there is no traffic tier
    private String externalAddress;

    private Integer refreshIntervalDays;

    // Monitoring agent config; may contain the hostname token
    private String monitoringConfigTemplate;

    @Data
    @NoArgsConstructor
    public static class TrafficTierRequest {
        private boolean enabled;
        private String certificateRef;
        private List<String> subnetIds;
    }
}
