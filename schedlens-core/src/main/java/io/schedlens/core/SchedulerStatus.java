package io.schedlens.core;

/**
 * Coarse display status of the scheduler as a whole.
 */
public enum SchedulerStatus {
    SHUTDOWN,
    /** No job groups exist. */
    EMPTY,
    STARTED,
    /** Initialized but not started (standby). */
    READY
}
