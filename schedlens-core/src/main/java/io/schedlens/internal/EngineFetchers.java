package io.schedlens.internal;

import io.schedlens.SchedulerEngine;
import io.schedlens.core.FetchResult;
import io.schedlens.core.SchedulerEngineException;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Trigger;
import org.quartz.TriggerKey;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One method per engine query, each normalized to a {@link FetchResult}. Nothing here throws.
 */
public class EngineFetchers {

    private final SchedulerEngine engine;

    public EngineFetchers(SchedulerEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public FetchResult<List<String>> jobGroupNames() {
        return fetch("job group names", engine::jobGroupNames);
    }

    public FetchResult<List<String>> triggerGroupNames() {
        return fetch("trigger group names", engine::triggerGroupNames);
    }

    public FetchResult<Set<JobKey>> allJobKeys() {
        return fetch("job keys", engine::jobKeys);
    }

    public FetchResult<Set<JobKey>> jobKeysInGroup(String group) {
        return fetch("job keys of group " + group, () -> engine.jobKeysInGroup(group));
    }

    public FetchResult<JobDetail> jobDefinition(JobKey key) {
        return fetch("job " + key, () -> engine.jobDetail(key));
    }

    public FetchResult<List<? extends Trigger>> triggersOfJob(JobKey key) {
        return fetch("triggers of job " + key, () -> engine.triggersOfJob(key));
    }

    public FetchResult<Trigger> trigger(TriggerKey key) {
        return fetch("trigger " + key, () -> engine.trigger(key));
    }

    public FetchResult<Trigger.TriggerState> triggerState(TriggerKey key) {
        return fetch("state of trigger " + key, () -> engine.triggerState(key));
    }

    private static <T> FetchResult<T> fetch(String what, Supplier<T> query) {
        try {
            return FetchResult.of(query.get());
        } catch (SchedulerEngineException e) {
            return FetchResult.failed(e);
        } catch (RuntimeException e) {
            return FetchResult.failed(new SchedulerEngineException("Failed to fetch " + what, e));
        }
    }
}
