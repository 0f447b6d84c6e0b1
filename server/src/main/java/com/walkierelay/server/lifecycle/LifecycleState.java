package com.walkierelay.server.lifecycle;

public enum LifecycleState {
    RUNNING,
    DRAINING,
    STOPPED
}
