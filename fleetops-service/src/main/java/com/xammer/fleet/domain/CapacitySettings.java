package com.xammer.fleet.domain;

import lombok.Value;

/**
 * Versioned capacity bounds. A new instance with a higher version is published on every external edit.
 */
@Value
public class CapacitySettings {
    int minSize;
    int desiredCapacity;
    int maxSize;
    long version;

    public static CapacitySettings of(int minSize, int desiredCapacity, int maxSize) {
        return new CapacitySettings(minSize, desiredCapacity, maxSize, 1L);
    }

    public CapacitySettings next(int minSize, int desiredCapacity, int maxSize) {
        return new CapacitySettings(minSize, desiredCapacity, maxSize, version + 1);
    }
}
