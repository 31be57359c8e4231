package io.schedlens.core;

import java.util.Objects;

/**
 * Name-only trigger group entry; trigger groups are not populated with members.
 */
public record TriggerGroupData(String name) {
    public TriggerGroupData {
        Objects.requireNonNull(name, "name must not be null");
    }
}
