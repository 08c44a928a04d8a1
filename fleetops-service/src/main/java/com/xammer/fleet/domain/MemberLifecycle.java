package com.xammer.fleet.domain;

public enum MemberLifecycle {
    PENDING,
    IN_SERVICE,
    TERMINATING,
    TERMINATED
}
