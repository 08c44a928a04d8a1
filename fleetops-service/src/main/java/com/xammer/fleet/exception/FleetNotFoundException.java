package com.xammer.fleet.exception;

public class FleetNotFoundException extends FleetOpsException {

    public FleetNotFoundException(String fleetId) {
        super("Fleet not found: " + fleetId);
    }
}
