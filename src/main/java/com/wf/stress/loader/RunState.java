package com.wf.stress.loader;

public enum RunState {
    INITIALIZING,
    PROVISIONING,
    AWAITING_HEALTH,
    RUNNING,
    DRAINING,
    CLEANUP,
    DONE
}
