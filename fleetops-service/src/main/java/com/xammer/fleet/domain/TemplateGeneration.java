package com.xammer.fleet.domain;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One revision of the fleet's instance template. {@code templateRef} is assigned by the compute backend
 * once the revision has been registered.
 */
@Value
public class TemplateGeneration {
    int number;
    String instanceType;
    String amiReference;
    BootstrapPayload payload;
    Instant createdAt;
    @With
    String templateRef;
}
