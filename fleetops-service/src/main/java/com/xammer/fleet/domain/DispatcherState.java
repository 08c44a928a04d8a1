package com.xammer.fleet.domain;

public enum DispatcherState {
    IDLE,
    INVOKING
}
