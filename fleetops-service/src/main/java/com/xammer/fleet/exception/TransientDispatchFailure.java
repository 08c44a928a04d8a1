package com.xammer.fleet.exception;

/**
 * A refresh trigger that did not go through. Thrown by a dispatcher invocation and turned into an error
 * result by the tick; never retried within the same tick.
 */
public class TransientDispatchFailure extends FleetOpsException {

    private final String reason;
    private final String errorCode;

    public TransientDispatchFailure(String fleetId, String reason, String errorCode) {
        super("Refresh trigger failed for fleet " + fleetId + ": " + reason);
        this.reason = reason;
        this.errorCode = errorCode;
    }

    public TransientDispatchFailure(String fleetId, Throwable cause) {
        super("Refresh trigger failed for fleet " + fleetId + ": " + cause.getMessage(), cause);
        this.reason = cause.getMessage();
        this.errorCode = null;
    }

    public String getReason() {
        return reason;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
