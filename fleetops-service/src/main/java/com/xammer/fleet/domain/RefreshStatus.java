package com.xammer.fleet.domain;

public enum RefreshStatus {
    NONE,
    IN_PROGRESS,
    SUCCESSFUL,
    CANCELLED
}
