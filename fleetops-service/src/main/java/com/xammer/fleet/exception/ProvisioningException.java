package com.xammer.fleet.exception;

/**
 * A cloud API call failed while creating or tearing down fleet resources.
 */
public class ProvisioningException extends FleetOpsException {

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
