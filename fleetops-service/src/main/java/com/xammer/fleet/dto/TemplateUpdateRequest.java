package com.xammer.fleet.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New instance template revision. Null fields keep the current generation's value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateUpdateRequest {
    private String instanceType;
    private String amiReference;
    private String monitoringConfigTemplate;
}
