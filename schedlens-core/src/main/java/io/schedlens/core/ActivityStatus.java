package io.schedlens.core;

/**
 * Coarse display status of a trigger.
 */
public enum ActivityStatus {
    ACTIVE,
    PAUSED,
    COMPLETE
}
