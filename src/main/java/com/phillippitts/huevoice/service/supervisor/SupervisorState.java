package com.phillippitts.huevoice.service.supervisor;

public enum SupervisorState {
    NEW,
    RUNNING,
    RESTARTING,
    /** A restart failed or a fatal error arrived; the process should exit. */
    FAILED,
    STOPPED
}
