package com.phillippitts.heartbeat.service.monitor;

/** Lifecycle state of the stale-detection monitor. */
public enum MonitorState {
    STOPPED,
    RUNNING
}
