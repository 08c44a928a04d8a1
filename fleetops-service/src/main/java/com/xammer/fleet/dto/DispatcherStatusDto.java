package com.xammer.fleet.dto;

import com.xammer.fleet.domain.DispatchResult;
import com.xammer.fleet.domain.DispatcherState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DispatcherStatusDto {
    private String fleetId;
    private int intervalDays;
    private DispatcherState state;
    private DispatchResult lastResult;
}
