package io.schedlens;

import io.schedlens.core.EngineMetadata;
import io.schedlens.core.SchedulerEngineException;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Trigger;
import org.quartz.TriggerKey;

import java.util.List;
import java.util.Set;

/**
 * Read-only query contract against a live scheduling engine.
 *
 * <p>Every method may fail with {@link SchedulerEngineException}. Implementations must never
 * mutate scheduler state.
 */
public interface SchedulerEngine {
    boolean isShutdown();

    boolean isStarted();

    String schedulerName();

    String schedulerInstanceId();

    EngineMetadata metadata();

    Set<JobKey> jobKeys();

    Set<JobKey> jobKeysInGroup(String group);

    /**
     * Job group names in the order the engine reports them; possibly empty. {@code null} is
     * read as empty.
     */
    List<String> jobGroupNames();

    List<String> triggerGroupNames();

    /**
     * Full job definition, or {@code null} when no such job exists.
     *
     * @throws io.schedlens.core.JobDetailUnavailableException if the job exists but its
     *         definition cannot be materialized locally
     */
    JobDetail jobDetail(JobKey key);

    List<? extends Trigger> triggersOfJob(JobKey key);

    /**
     * The trigger, or {@code null} when no such trigger exists.
     */
    Trigger trigger(TriggerKey key);

    Trigger.TriggerState triggerState(TriggerKey key);
}
