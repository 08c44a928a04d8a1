package com.xammer.fleet.domain;

import lombok.Value;

import java.time.Duration;

@Value
public class RefreshSchedule {
    int intervalDays;
    String targetFleetId;

    public Duration getInterval() {
        return Duration.ofDays(intervalDays);
    }
}
