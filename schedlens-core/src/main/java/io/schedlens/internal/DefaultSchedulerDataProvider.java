package io.schedlens.internal;

import io.schedlens.SchedulerDataProvider;
import io.schedlens.SchedulerEngine;
import io.schedlens.core.EngineMetadata;
import io.schedlens.core.FetchResult;
import io.schedlens.core.JobData;
import io.schedlens.core.JobDetailsData;
import io.schedlens.core.JobGroupData;
import io.schedlens.core.SchedulerEngineException;
import io.schedlens.core.SchedulerSnapshot;
import io.schedlens.core.SchedulerStatus;
import io.schedlens.core.TriggerData;
import io.schedlens.core.TriggerGroupData;
import io.schedlens.utils.StatusResolver;
import io.schedlens.utils.TriggerTypeClassifier;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles scheduler snapshots and detail views from independent engine queries.
 *
 * <p>Snapshot assembly is all-or-nothing: a failed query aborts {@link #getSnapshot()} rather than
 * leaving a hole in the hierarchy. The only isolated failure is the job-definition read in
 * {@link #getJobDetail(String, String)}, which degrades to a placeholder.
 *
 * <p>Typical usage:
 * <pre>{@code
 * SchedulerDataProvider provider = new DefaultSchedulerDataProvider(new QuartzSchedulerEngine(scheduler));
 *
 * SchedulerSnapshot snapshot = provider.getSnapshot();
 * provider.getJobDetail("nightly-report", "reports").ifPresent(view::show);
 * }</pre>
 */
public class DefaultSchedulerDataProvider implements SchedulerDataProvider, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DefaultSchedulerDataProvider.class);

    private final SchedulerEngine engine;
    private final EngineFetchers fetchers;
    private final TriggerTypeClassifier classifier;
    private final Options options;

    // null when fetchParallelism == 0
    private final ExecutorService fetchPool;
    private volatile boolean closed = false;

    public DefaultSchedulerDataProvider(SchedulerEngine engine) {
        this(engine, TriggerTypeClassifier.defaults(), Options.defaults());
    }

    public DefaultSchedulerDataProvider(SchedulerEngine engine, TriggerTypeClassifier classifier, Options options) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(options.detailUnavailableMessage(), "detailUnavailableMessage must not be null");
        if (options.fetchParallelism() < 0) {
            throw new IllegalArgumentException("fetchParallelism must not be negative");
        }
        this.fetchers = new EngineFetchers(engine);
        this.fetchPool = options.fetchParallelism() == 0 ? null : newFetchPool(options.fetchParallelism());
    }

    private static ExecutorService newFetchPool(int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("schedlens.fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public SchedulerSnapshot getSnapshot() {
        ensureOpen();
        Instant began = Instant.now();

        boolean shutdown = engine.isShutdown();
        String name = engine.schedulerName();
        String instanceId = engine.schedulerInstanceId();
        EngineMetadata metadata = engine.metadata();

        if (shutdown) {
            log.debug("Scheduler {} is shut down, returning empty snapshot", name);
            return new SchedulerSnapshot(
                    name,
                    instanceId,
                    SchedulerStatus.SHUTDOWN,
                    metadata.remote(),
                    metadata.jobsExecuted(),
                    0,
                    metadata.runningSince(),
                    metadata.schedulerType(),
                    List.of(),
                    List.of());
        }

        // Counted separately from the groups below; a concurrent add/remove can make the two differ.
        int jobsTotal = fetchers.allJobKeys().orElseThrow().size();

        List<String> groupNames = fetchers.jobGroupNames().toOptional().orElse(List.of());
        SchedulerStatus status = StatusResolver.schedulerStatus(false, groupNames, engine.isStarted());

        List<JobGroupData> jobGroups = new ArrayList<>(groupNames.size());
        for (String groupName : groupNames) {
            jobGroups.add(new JobGroupData(groupName, getJobs(groupName)));
        }

        List<TriggerGroupData> triggerGroups = fetchers.triggerGroupNames().toOptional().orElse(List.of()).stream()
                .map(TriggerGroupData::new)
                .toList();

        SchedulerSnapshot snapshot = new SchedulerSnapshot(
                name,
                instanceId,
                status,
                metadata.remote(),
                metadata.jobsExecuted(),
                jobsTotal,
                metadata.runningSince(),
                metadata.schedulerType(),
                jobGroups,
                triggerGroups);

        log.debug("Built snapshot of {} ({} job groups, {} jobs) in {} ms",
                name, jobGroups.size(), snapshot.jobCount(), Duration.between(began, Instant.now()).toMillis());
        return snapshot;
    }

    @Override
    public Optional<JobDetailsData> getJobDetail(String name, String group) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(group, "group must not be null");
        ensureOpen();
        if (engine.isShutdown()) {
            return Optional.empty();
        }

        JobKey key = new JobKey(name, group);
        JobData primaryData = getJobData(key);

        FetchResult<JobDetail> fetched = fetchers.jobDefinition(key);
        if (fetched instanceof FetchResult.Failed<JobDetail> failed) {
            if (failed.isDetailUnavailable()) {
                log.warn("Job definition of {} is not available: {}", key, failed.error().getMessage());
            } else {
                log.warn("Failed to read job definition of {}", key, failed.error());
            }
            return Optional.of(JobDetailsData.unavailable(primaryData, options.detailUnavailableMessage()));
        }
        if (!(fetched instanceof FetchResult.Present<JobDetail> present)) {
            return Optional.empty();
        }

        JobDetail job = present.value();
        return Optional.of(new JobDetailsData(primaryData, copyDataMap(job), jobProperties(job)));
    }

    @Override
    public Optional<TriggerData> getTriggerDetail(TriggerKey key) {
        Objects.requireNonNull(key, "key must not be null");
        ensureOpen();
        if (engine.isShutdown()) {
            return Optional.empty();
        }
        return fetchers.trigger(key).toOptional().map(this::getTriggerData);
    }

    /**
     * Releases the fetch pool. Any later call fails with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        closed = true;
        if (fetchPool == null) {
            return;
        }
        fetchPool.shutdown();
        try {
            if (!fetchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fetchPool.shutdownNow();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("provider is closed");
        }
    }

    /* ================= assembly ================= */

    private List<JobData> getJobs(String groupName) {
        List<JobKey> keys = List.copyOf(fetchers.jobKeysInGroup(groupName).orElseThrow());
        if (fetchPool == null || keys.size() < 2) {
            List<JobData> result = new ArrayList<>(keys.size());
            for (JobKey key : keys) {
                result.add(getJobData(key));
            }
            return result;
        }
        return fanOut(keys);
    }

    /**
     * Submits one task per job and joins them in key order, so the result order matches the
     * sequential path.
     */
    private List<JobData> fanOut(List<JobKey> keys) {
        List<Future<JobData>> futures = new ArrayList<>(keys.size());
        for (JobKey key : keys) {
            futures.add(fetchPool.submit(() -> getJobData(key)));
        }

        List<JobData> result = new ArrayList<>(keys.size());
        try {
            for (Future<JobData> future : futures) {
                result.add(future.get());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulerEngineException("Interrupted while building snapshot", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new SchedulerEngineException("Failed to build job data", cause);
        } finally {
            futures.forEach(f -> f.cancel(true));
        }
    }

    private JobData getJobData(JobKey key) {
        List<? extends Trigger> triggers = fetchers.triggersOfJob(key).orElseThrow();
        List<TriggerData> triggerData = new ArrayList<>(triggers.size());
        for (Trigger trigger : triggers) {
            triggerData.add(getTriggerData(trigger));
        }
        return new JobData(key.getName(), key.getGroup(), triggerData);
    }

    private TriggerData getTriggerData(Trigger trigger) {
        TriggerKey key = trigger.getKey();
        Trigger.TriggerState state = fetchers.triggerState(key).toOptional().orElse(null);
        return new TriggerData(
                key.getName(),
                key.getGroup(),
                StatusResolver.triggerStatus(state),
                toInstant(trigger.getStartTime()),
                toInstant(trigger.getEndTime()),
                toInstant(trigger.getNextFireTime()),
                toInstant(trigger.getPreviousFireTime()),
                classifier.classify(trigger),
                classifier.describe(trigger));
    }

    private static Map<String, Object> copyDataMap(JobDetail job) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (job.getJobDataMap() != null) {
            for (String key : job.getJobDataMap().getKeys()) {
                result.put(key, job.getJobDataMap().get(key));
            }
        }
        return result;
    }

    private static Map<String, Object> jobProperties(JobDetail job) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(JobDetailsData.DESCRIPTION, job.getDescription());
        props.put(JobDetailsData.FULL_NAME, job.getKey().getName());
        props.put(JobDetailsData.JOB_TYPE, jobType(job));
        props.put(JobDetailsData.DURABLE, job.isDurable());
        props.put(JobDetailsData.CONCURRENT_EXECUTION_DISALLOWED, job.isConcurrentExectionDisallowed());
        props.put(JobDetailsData.PERSIST_JOB_DATA_AFTER_EXECUTION, job.isPersistJobDataAfterExecution());
        props.put(JobDetailsData.REQUESTS_RECOVERY, job.requestsRecovery());
        return props;
    }

    private static String jobType(JobDetail job) {
        return job.getJobClass() == null ? null : job.getJobClass().getSimpleName();
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
