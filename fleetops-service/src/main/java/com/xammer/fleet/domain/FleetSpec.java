package com.xammer.fleet.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Desired shape of a fleet. Instances are built from the validated
 * {@link com.xammer.fleet.dto.FleetDefinitionRequest}, never directly from user input.
 */
@Value
@Builder(toBuilder = true)
public class FleetSpec {
    String name;
    String instanceType;
    int desiredCapacity;
    int minSize;
    int maxSize;
    @Singular
    List<String> subnetIds; // ordered, de-duplicated
    String amiReference;

    public CapacitySettings initialCapacity() {
        return CapacitySettings.of(minSize, desiredCapacity, maxSize);
    }
}
