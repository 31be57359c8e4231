package io.schedlens.utils;

import io.schedlens.core.ActivityStatus;
import io.schedlens.core.SchedulerStatus;
import org.quartz.Trigger;

import java.util.Collection;

/**
 * Maps raw engine state to display statuses.
 */
public final class StatusResolver {
    private StatusResolver() {
    }

    /**
     * Precedence: shutdown, then emptiness, then started state.
     *
     * @param jobGroupNames null is treated as empty
     */
    public static SchedulerStatus schedulerStatus(boolean shutdown, Collection<String> jobGroupNames, boolean started) {
        if (shutdown) {
            return SchedulerStatus.SHUTDOWN;
        }
        if (jobGroupNames == null || jobGroupNames.isEmpty()) {
            return SchedulerStatus.EMPTY;
        }
        if (started) {
            return SchedulerStatus.STARTED;
        }
        return SchedulerStatus.READY;
    }

    /**
     * Lossy projection: everything except PAUSED and COMPLETE (NORMAL, BLOCKED, ERROR, NONE, null)
     * shows as ACTIVE.
     */
    public static ActivityStatus triggerStatus(Trigger.TriggerState state) {
        if (state == null) {
            return ActivityStatus.ACTIVE;
        }
        return switch (state) {
            case PAUSED -> ActivityStatus.PAUSED;
            case COMPLETE -> ActivityStatus.COMPLETE;
            default -> ActivityStatus.ACTIVE;
        };
    }
}
