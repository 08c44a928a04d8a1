package com.xammer.fleet.domain;

public enum MemberHealth {
    HEALTHY,
    INITIALIZING,
    UNHEALTHY
}
