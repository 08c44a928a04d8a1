package com.xammer.fleet.domain;

import lombok.Value;

import java.time.Duration;

@Value
public class RefreshPreferences {
    int minHealthyPercentage;
    Duration instanceWarmup;
    Duration stepInterval;
    Duration reconcileInterval;

    /**
     * Lowest live member count a refresh step may leave behind: the larger of {@code minSize}
     * and the healthy percentage of the desired capacity.
     */
    public int liveFloor(CapacitySettings capacity) {
        int healthyShare = (int) Math.ceil(capacity.getDesiredCapacity() * minHealthyPercentage / 100.0);
        return Math.max(capacity.getMinSize(), healthyShare);
    }
}
