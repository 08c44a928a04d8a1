package com.xammer.fleet.exception;

public class FleetOpsException extends RuntimeException {

    public FleetOpsException(String message) {
        super(message);
    }

    public FleetOpsException(String message, Throwable cause) {
        super(message, cause);
    }
}
