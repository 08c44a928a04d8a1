package com.xammer.fleet.exception;

/**
 * A fleet definition that cannot be provisioned. Always raised before any resource is created.
 */
public class InvalidConfigurationException extends FleetOpsException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
