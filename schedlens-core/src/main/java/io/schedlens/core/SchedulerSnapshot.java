package io.schedlens.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable point-in-time view of a scheduler: groups, jobs and their triggers.
 *
 * <p>Each part reflects the engine at the moment it was read, so the snapshot as a whole may span
 * a few instants. In particular {@code jobsTotal} comes from a separate all-job-keys query and can
 * disagree with {@link #jobCount()} if jobs were added or removed in between.
 */
public record SchedulerSnapshot(

        // identity
        String name,
        String instanceId,
        SchedulerStatus status,

        // engine metadata
        boolean remote,
        int jobsExecuted,
        int jobsTotal,
        Instant runningSince,
        String schedulerType,

        // hierarchy
        List<JobGroupData> jobGroups,
        List<TriggerGroupData> triggerGroups
) {
    public SchedulerSnapshot {
        Objects.requireNonNull(status, "status must not be null");
        jobGroups = jobGroups == null ? List.of() : List.copyOf(jobGroups);
        triggerGroups = triggerGroups == null ? List.of() : List.copyOf(triggerGroups);
    }

    /**
     * Sum of the job counts of all job groups.
     */
    public int jobCount() {
        return jobGroups.stream().mapToInt(g -> g.jobs().size()).sum();
    }
}
