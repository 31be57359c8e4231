package io.schedlens.core;

import java.util.List;
import java.util.Objects;

/**
 * A job and the triggers currently attached to it, in engine order.
 */
public record JobData(
        String name,
        String group,
        List<TriggerData> triggers
) {
    public JobData {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(group, "group must not be null");
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public boolean hasTriggers() {
        return !triggers.isEmpty();
    }
}
