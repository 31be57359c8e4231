package io.schedlens.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one trigger.
 *
 * <p>{@code endDate}, {@code nextFireDate} and {@code previousFireDate} are null when the engine
 * has no value for them. {@code scheduleSummary} is a short human-readable description of the
 * schedule, e.g. the cron expression or the repeat interval.
 */
public record TriggerData(

        // identity
        String name,
        String group,

        ActivityStatus status,

        // schedule
        Instant startDate,
        Instant endDate,
        Instant nextFireDate,
        Instant previousFireDate,

        String triggerType,
        String scheduleSummary
) {
    public TriggerData {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }
}
