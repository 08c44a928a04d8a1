package com.xammer.fleet.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one dispatcher tick.
 */
@Value
public class DispatchResult {

    public static final String STARTED = "started";
    public static final String ERROR = "error";
    public static final String SKIPPED = "skipped";

    String fleetId;
    String status;
    String refreshId;
    String message;
    String code;
    Instant at;

    public static DispatchResult started(String fleetId, RefreshOutcome outcome, Instant at) {
        return new DispatchResult(fleetId, STARTED, outcome.getRefreshId(), outcome.getReason(), null, at);
    }

    public static DispatchResult error(String fleetId, String message, String code, Instant at) {
        return new DispatchResult(fleetId, ERROR, null, message, code, at);
    }

    public static DispatchResult skipped(String fleetId, Instant at) {
        return new DispatchResult(fleetId, SKIPPED, null, "previous tick still invoking", null, at);
    }

    public boolean isStarted() {
        return STARTED.equals(status);
    }
}
