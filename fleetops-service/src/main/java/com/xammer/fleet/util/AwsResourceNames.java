package com.xammer.fleet.util;

import java.util.regex.Pattern;

/**
 * Naming rules for the AWS resources derived from a fleet name.
 * Load balancer and target group names are capped at 32 characters.
 */
public final class AwsResourceNames {

    public static final int MAX_FLEET_NAME_LENGTH = 28;

    private static final Pattern FLEET_NAME = Pattern.compile("^[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?$");

    private AwsResourceNames() {
    }

    public static boolean isValidFleetName(String name) {
        return name != null && name.length() <= MAX_FLEET_NAME_LENGTH && FLEET_NAME.matcher(name).matches();
    }

    public static String loadBalancer(String fleetName) {
        return fleetName + "-alb";
    }

    public static String targetGroup(String fleetName) {
        return fleetName + "-tg";
    }

    public static String tierSecurityGroup(String fleetName) {
        return fleetName + "-alb-sg";
    }

    public static String fleetSecurityGroup(String fleetName) {
        return fleetName + "-sg";
    }

    public static String launchTemplate(String fleetName) {
        return fleetName + "-lt";
    }

    public static String logGroup(String fleetName) {
        return "/ec2/" + fleetName + "/messages";
    }
}
