package com.xammer.fleet.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TrafficTierSpec {
    String certificateRef;
    @Singular
    List<String> subnetIds;
}
