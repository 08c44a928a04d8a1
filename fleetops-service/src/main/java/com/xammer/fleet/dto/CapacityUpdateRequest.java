package com.xammer.fleet.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CapacityUpdateRequest {
    private Integer minSize;
    private Integer desiredCapacity;
    private Integer maxSize;
}
