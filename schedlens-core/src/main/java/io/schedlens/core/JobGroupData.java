package io.schedlens.core;

import java.util.List;
import java.util.Objects;

public record JobGroupData(
        String name,
        List<JobData> jobs
) {
    public JobGroupData {
        Objects.requireNonNull(name, "name must not be null");
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }
}
