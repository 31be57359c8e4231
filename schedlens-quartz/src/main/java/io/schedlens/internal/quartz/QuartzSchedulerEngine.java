package io.schedlens.internal.quartz;

import io.schedlens.SchedulerEngine;
import io.schedlens.core.EngineMetadata;
import io.schedlens.core.JobDetailUnavailableException;
import io.schedlens.core.SchedulerEngineException;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SchedulerMetaData;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link SchedulerEngine} backed by a Quartz {@link Scheduler}, local or RMI remote.
 *
 * <p>Only read methods of the scheduler are called. Quartz reports job keys as hash sets, so keys
 * within a group are returned sorted by name to give the snapshot a stable order; group names keep
 * the order Quartz reports them in.
 *
 * <p>Failure mapping:
 * <ul>
 *   <li>{@link SchedulerException}: {@link SchedulerEngineException}</li>
 *   <li>{@code getJobDetail} failing because a class cannot be loaded or linked (a remote scheduler
 *       running jobs whose classes are missing locally or built for a newer JVM):
 *       {@link JobDetailUnavailableException}</li>
 * </ul>
 */
public class QuartzSchedulerEngine implements SchedulerEngine {

    private static final Comparator<JobKey> BY_NAME = Comparator.comparing(JobKey::getName);

    private final Scheduler scheduler;

    public QuartzSchedulerEngine(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @FunctionalInterface
    private interface Query<T> {
        T run() throws SchedulerException;
    }

    @Override
    public boolean isShutdown() {
        return query("shutdown flag", scheduler::isShutdown);
    }

    @Override
    public boolean isStarted() {
        return query("started flag", scheduler::isStarted);
    }

    @Override
    public String schedulerName() {
        return query("scheduler name", scheduler::getSchedulerName);
    }

    @Override
    public String schedulerInstanceId() {
        return query("scheduler instance id", scheduler::getSchedulerInstanceId);
    }

    @Override
    public EngineMetadata metadata() {
        SchedulerMetaData md = query("scheduler metadata", scheduler::getMetaData);
        Class<?> type = md.getSchedulerClass();
        return new EngineMetadata(
                md.isSchedulerRemote(),
                md.getNumberOfJobsExecuted(),
                md.getRunningSince() == null ? null : md.getRunningSince().toInstant(),
                type == null ? null : type.getSimpleName());
    }

    @Override
    public Set<JobKey> jobKeys() {
        return query("job keys", () -> scheduler.getJobKeys(GroupMatcher.anyJobGroup()));
    }

    @Override
    public Set<JobKey> jobKeysInGroup(String group) {
        Set<JobKey> keys = query("job keys of group " + group,
                () -> scheduler.getJobKeys(GroupMatcher.jobGroupEquals(group)));
        Set<JobKey> sorted = new LinkedHashSet<>();
        keys.stream().sorted(BY_NAME).forEach(sorted::add);
        return sorted;
    }

    @Override
    public List<String> jobGroupNames() {
        return query("job group names", scheduler::getJobGroupNames);
    }

    @Override
    public List<String> triggerGroupNames() {
        return query("trigger group names", scheduler::getTriggerGroupNames);
    }

    @Override
    public JobDetail jobDetail(JobKey key) {
        try {
            return scheduler.getJobDetail(key);
        } catch (SchedulerException e) {
            if (isClassResolutionFailure(e)) {
                throw new JobDetailUnavailableException("Job class of " + key + " cannot be loaded here", e);
            }
            throw new SchedulerEngineException("Failed to read job " + key, e);
        } catch (LinkageError e) {
            // e.g. UnsupportedClassVersionError: the job class was built for a newer JVM
            throw new JobDetailUnavailableException("Job class of " + key + " cannot be loaded here", e);
        } catch (RuntimeException e) {
            if (isClassResolutionFailure(e)) {
                throw new JobDetailUnavailableException("Job class of " + key + " cannot be loaded here", e);
            }
            throw e;
        }
    }

    @Override
    public List<? extends Trigger> triggersOfJob(JobKey key) {
        return query("triggers of job " + key, () -> scheduler.getTriggersOfJob(key));
    }

    @Override
    public Trigger trigger(TriggerKey key) {
        return query("trigger " + key, () -> scheduler.getTrigger(key));
    }

    @Override
    public Trigger.TriggerState triggerState(TriggerKey key) {
        return query("state of trigger " + key, () -> scheduler.getTriggerState(key));
    }

    private static <T> T query(String what, Query<T> q) {
        try {
            return q.run();
        } catch (SchedulerException e) {
            throw new SchedulerEngineException("Failed to read " + what, e);
        }
    }

    static boolean isClassResolutionFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ClassNotFoundException || t instanceof NoClassDefFoundError) {
                return true;
            }
        }
        return false;
    }
}
