package com.xammer.fleet.exception;

public class FleetAlreadyExistsException extends InvalidConfigurationException {

    public FleetAlreadyExistsException(String fleetId) {
        super("Fleet already exists: " + fleetId);
    }
}
