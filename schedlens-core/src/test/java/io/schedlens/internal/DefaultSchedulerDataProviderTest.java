package io.schedlens.internal;

import io.schedlens.SchedulerDataProvider;
import io.schedlens.core.ActivityStatus;
import io.schedlens.core.JobData;
import io.schedlens.core.JobDetailsData;
import io.schedlens.core.JobGroupData;
import io.schedlens.core.SchedulerEngineException;
import io.schedlens.core.SchedulerSnapshot;
import io.schedlens.core.SchedulerStatus;
import io.schedlens.core.TriggerData;
import io.schedlens.core.TriggerGroupData;
import io.schedlens.utils.TriggerTypeClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.quartz.CronScheduleBuilder;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobKey;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSchedulerDataProviderTest {

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");
    private static final Instant END = Instant.parse("2026-12-31T23:00:00Z");

    private final FakeSchedulerEngine engine = new FakeSchedulerEngine();
    private DefaultSchedulerDataProvider provider = new DefaultSchedulerDataProvider(engine);

    @AfterEach
    void tearDown() {
        provider.close();
    }

    @Test
    void shutdownEngineShouldYieldEmptySnapshotWithoutFurtherQueries() {
        engine.addJob(job("report", "reports"), simpleTrigger("every-minute", "reports", "report"));
        engine.shutdown = true;

        SchedulerSnapshot snapshot = provider.getSnapshot();

        assertEquals(SchedulerStatus.SHUTDOWN, snapshot.status());
        assertTrue(snapshot.jobGroups().isEmpty());
        assertTrue(snapshot.triggerGroups().isEmpty());
        assertEquals(0, snapshot.jobsTotal());
        assertEquals(List.of("metadata"), engine.queries);
    }

    @Test
    void shutdownEngineShouldReturnAbsentDetails() {
        engine.addJob(job("report", "reports"), simpleTrigger("every-minute", "reports", "report"));
        engine.shutdown = true;

        assertTrue(provider.getJobDetail("report", "reports").isEmpty());
        assertTrue(provider.getTriggerDetail("every-minute", "reports").isEmpty());
        assertTrue(engine.queries.isEmpty());
    }

    @Test
    void engineWithoutJobGroupsShouldBeEmpty() {
        SchedulerSnapshot snapshot = provider.getSnapshot();

        assertEquals(SchedulerStatus.EMPTY, snapshot.status());
        assertEquals(0, snapshot.jobsTotal());
    }

    @Test
    void startedEngineWithJobsShouldBeStarted() {
        engine.addJob(job("report", "reports"));

        assertEquals(SchedulerStatus.STARTED, provider.getSnapshot().status());
    }

    @Test
    void standbyEngineWithJobsShouldBeReady() {
        engine.addJob(job("report", "reports"));
        engine.started = false;

        assertEquals(SchedulerStatus.READY, provider.getSnapshot().status());
    }

    @Test
    void snapshotShouldCarryEngineIdentityAndMetadata() {
        engine.addJob(job("report", "reports"));

        SchedulerSnapshot snapshot = provider.getSnapshot();

        assertEquals("TestScheduler", snapshot.name());
        assertEquals("NON_CLUSTERED", snapshot.instanceId());
        assertFalse(snapshot.remote());
        assertEquals(42, snapshot.jobsExecuted());
        assertEquals(FakeSchedulerEngine.RUNNING_SINCE, snapshot.runningSince());
        assertEquals("StdScheduler", snapshot.schedulerType());
    }

    @Test
    void snapshotShouldFollowEngineOrderAcrossGroupsJobsAndTriggers() {
        engine.addJob(job("report", "reports"),
                        simpleTrigger("hourly", "reports", "report"),
                        cronTrigger("nightly", "nightly", "report"))
                .addJob(job("cleanup", "maintenance"), simpleTrigger("weekly", "maintenance", "cleanup"))
                .addJob(job("export", "reports"))
                .state(new TriggerKey("nightly", "nightly"), Trigger.TriggerState.PAUSED);

        SchedulerSnapshot snapshot = provider.getSnapshot();

        assertEquals(List.of("reports", "maintenance"),
                snapshot.jobGroups().stream().map(JobGroupData::name).toList());
        assertEquals(List.of("report", "export"),
                snapshot.jobGroups().get(0).jobs().stream().map(JobData::name).toList());
        assertEquals(List.of("reports", "nightly", "maintenance"),
                snapshot.triggerGroups().stream().map(TriggerGroupData::name).toList());

        JobData report = snapshot.jobGroups().get(0).jobs().get(0);
        assertEquals(2, report.triggers().size());

        TriggerData hourly = report.triggers().get(0);
        assertEquals("hourly", hourly.name());
        assertEquals("reports", hourly.group());
        assertEquals(ActivityStatus.ACTIVE, hourly.status());
        assertEquals(TriggerTypeClassifier.SIMPLE, hourly.triggerType());
        assertEquals("every 3600000 ms, repeat forever", hourly.scheduleSummary());
        assertEquals(START, hourly.startDate());
        assertEquals(END, hourly.endDate());
        assertNull(hourly.previousFireDate());

        TriggerData nightly = report.triggers().get(1);
        assertEquals(ActivityStatus.PAUSED, nightly.status());
        assertEquals(TriggerTypeClassifier.CRON, nightly.triggerType());
        assertTrue(nightly.scheduleSummary().startsWith("0 0 2 * * ?"));
        assertNull(nightly.endDate());

        assertFalse(snapshot.jobGroups().get(0).jobs().get(1).hasTriggers());
    }

    @Test
    void jobsTotalShouldComeFromAllJobKeysQueryEvenWhenGroupsDisagree() {
        engine.addJob(job("report", "reports"))
                .addJob(job("cleanup", "maintenance"))
                .ghost(new JobKey("late-arrival", "reports"));

        SchedulerSnapshot snapshot = provider.getSnapshot();

        assertEquals(3, snapshot.jobsTotal());
        assertEquals(2, snapshot.jobCount());
    }

    @Test
    void snapshotShouldAbortWhenAnyJobQueryFails() {
        engine.addJob(job("report", "reports"))
                .addJob(job("cleanup", "maintenance"))
                .broken(new JobKey("cleanup", "maintenance"));

        SchedulerEngineException e = assertThrows(SchedulerEngineException.class, provider::getSnapshot);
        assertTrue(e.getMessage().contains("cleanup"));
    }

    @Test
    void jobDetailShouldCopyDataMapVerbatim() {
        JobDetail report = JobBuilder.newJob(NoopJob.class)
                .withIdentity("report", "reports")
                .withDescription("Monthly revenue report")
                .usingJobData("retries", "3")
                .storeDurably()
                .requestRecovery()
                .build();
        engine.addJob(report, simpleTrigger("hourly", "reports", "report"));

        JobDetailsData detail = provider.getJobDetail("report", "reports").orElseThrow();

        assertEquals(Map.of("retries", "3"), detail.jobDataMap());
        assertFalse(detail.isDetailUnavailable());
        assertEquals(List.of(
                JobDetailsData.DESCRIPTION,
                JobDetailsData.FULL_NAME,
                JobDetailsData.JOB_TYPE,
                JobDetailsData.DURABLE,
                JobDetailsData.CONCURRENT_EXECUTION_DISALLOWED,
                JobDetailsData.PERSIST_JOB_DATA_AFTER_EXECUTION,
                JobDetailsData.REQUESTS_RECOVERY), List.copyOf(detail.jobProperties().keySet()));
        assertEquals("Monthly revenue report", detail.jobProperties().get(JobDetailsData.DESCRIPTION));
        assertEquals("report", detail.jobProperties().get(JobDetailsData.FULL_NAME));
        assertEquals("NoopJob", detail.jobProperties().get(JobDetailsData.JOB_TYPE));
        assertEquals(Boolean.TRUE, detail.jobProperties().get(JobDetailsData.DURABLE));
        assertEquals(Boolean.FALSE, detail.jobProperties().get(JobDetailsData.CONCURRENT_EXECUTION_DISALLOWED));
        assertEquals(Boolean.FALSE, detail.jobProperties().get(JobDetailsData.PERSIST_JOB_DATA_AFTER_EXECUTION));
        assertEquals(Boolean.TRUE, detail.jobProperties().get(JobDetailsData.REQUESTS_RECOVERY));

        assertEquals("report", detail.primaryData().name());
        assertEquals(1, detail.primaryData().triggers().size());
    }

    @Test
    void jobDetailShouldKeepNullDescription() {
        engine.addJob(job("report", "reports"));

        JobDetailsData detail = provider.getJobDetail("report", "reports").orElseThrow();

        assertTrue(detail.jobProperties().containsKey(JobDetailsData.DESCRIPTION));
        assertNull(detail.jobProperties().get(JobDetailsData.DESCRIPTION));
    }

    @Test
    void unreadableJobDefinitionShouldDegradeToSentinel() {
        JobKey key = new JobKey("remote-report", "reports");
        engine.addJob(job("remote-report", "reports"), simpleTrigger("hourly", "reports", "remote-report"))
                .unreadable(key);

        JobDetailsData detail = provider.getJobDetail("remote-report", "reports").orElseThrow();

        Map<String, Object> sentinel = Map.of(
                JobDetailsData.SENTINEL_KEY, SchedulerDataProvider.Options.DEFAULT_DETAIL_UNAVAILABLE_MESSAGE);
        assertEquals(sentinel, detail.jobDataMap());
        assertEquals(sentinel, detail.jobProperties());
        assertTrue(detail.isDetailUnavailable());

        assertEquals("remote-report", detail.primaryData().name());
        assertEquals("reports", detail.primaryData().group());
        assertEquals(List.of("hourly"),
                detail.primaryData().triggers().stream().map(TriggerData::name).toList());
    }

    @Test
    void basicJobDataShouldBeGatheredBeforeDefinitionFetch() {
        JobKey key = new JobKey("remote-report", "reports");
        engine.addJob(job("remote-report", "reports")).unreadable(key);

        provider.getJobDetail("remote-report", "reports");

        assertEquals(List.of("triggersOfJob:" + key, "jobDetail:" + key), engine.queries);
    }

    @Test
    void unexpectedDefinitionFailureShouldAlsoDegradeToSentinel() {
        JobKey key = new JobKey("report", "reports");
        engine.addJob(job("report", "reports"), simpleTrigger("hourly", "reports", "report"))
                .corruptDefinition(key);

        JobDetailsData detail = provider.getJobDetail("report", "reports").orElseThrow();

        assertTrue(detail.isDetailUnavailable());
        assertEquals(Map.of(JobDetailsData.SENTINEL_KEY, SchedulerDataProvider.Options.DEFAULT_DETAIL_UNAVAILABLE_MESSAGE),
                detail.jobDataMap());
        assertEquals("report", detail.primaryData().name());
        assertEquals(1, detail.primaryData().triggers().size());
    }

    @Test
    void failingTriggerStateShouldAbortSnapshot() {
        TriggerKey hourly = new TriggerKey("hourly", "reports");
        engine.addJob(job("report", "reports"), simpleTrigger("hourly", "reports", "report"))
                .brokenTrigger(hourly);

        SchedulerEngineException e = assertThrows(SchedulerEngineException.class, provider::getSnapshot);
        assertTrue(e.getMessage().contains("hourly"));
    }

    @Test
    void failingTriggerLookupShouldPropagateNotReadAsAbsent() {
        engine.addJob(job("report", "reports"), simpleTrigger("hourly", "reports", "report"))
                .brokenTrigger(new TriggerKey("hourly", "reports"));

        assertThrows(SchedulerEngineException.class, () -> provider.getTriggerDetail("hourly", "reports"));
    }

    @Test
    void sentinelMessageShouldBeConfigurable() {
        JobKey key = new JobKey("remote-report", "reports");
        engine.addJob(job("remote-report", "reports")).unreadable(key);
        provider = new DefaultSchedulerDataProvider(engine, TriggerTypeClassifier.defaults(),
                new SchedulerDataProvider.Options(0, "Job class missing on this node"));

        JobDetailsData detail = provider.getJobDetail("remote-report", "reports").orElseThrow();

        assertEquals("Job class missing on this node", detail.jobDataMap().get(JobDetailsData.SENTINEL_KEY));
    }

    @Test
    void missingJobShouldBeAbsent() {
        assertTrue(provider.getJobDetail("ghost", "reports").isEmpty());
    }

    @Test
    void missingTriggerShouldBeAbsent() {
        engine.addJob(job("report", "reports"), simpleTrigger("hourly", "reports", "report"));

        assertTrue(provider.getTriggerDetail("nope", "reports").isEmpty());
    }

    @Test
    void triggerDetailShouldResolveStatus() {
        engine.addJob(job("report", "reports"),
                        simpleTrigger("hourly", "reports", "report"),
                        cronTrigger("nightly", "reports", "report"))
                .state(new TriggerKey("hourly", "reports"), Trigger.TriggerState.COMPLETE)
                .state(new TriggerKey("nightly", "reports"), Trigger.TriggerState.BLOCKED);

        TriggerData hourly = provider.getTriggerDetail("hourly", "reports").orElseThrow();
        TriggerData nightly = provider.getTriggerDetail(new TriggerKey("nightly", "reports")).orElseThrow();

        assertEquals(ActivityStatus.COMPLETE, hourly.status());
        assertEquals(TriggerTypeClassifier.SIMPLE, hourly.triggerType());
        assertEquals(ActivityStatus.ACTIVE, nightly.status());
        assertEquals(TriggerTypeClassifier.CRON, nightly.triggerType());
    }

    @Test
    void parallelFetchShouldPreserveEngineOrder() {
        for (int i = 0; i < 20; i++) {
            String name = "job-" + i;
            engine.addJob(job(name, "batch"), simpleTrigger("t-" + i, "batch", name));
        }
        SchedulerSnapshot sequential = provider.getSnapshot();

        try (DefaultSchedulerDataProvider parallel = new DefaultSchedulerDataProvider(engine,
                TriggerTypeClassifier.defaults(),
                new SchedulerDataProvider.Options(4, SchedulerDataProvider.Options.DEFAULT_DETAIL_UNAVAILABLE_MESSAGE))) {
            SchedulerSnapshot fannedOut = parallel.getSnapshot();

            assertEquals(sequential.jobGroups(), fannedOut.jobGroups());
            assertEquals(20, fannedOut.jobCount());
        }
    }

    @Test
    void parallelFetchShouldPropagateJobFailure() {
        for (int i = 0; i < 5; i++) {
            engine.addJob(job("job-" + i, "batch"));
        }
        engine.broken(new JobKey("job-3", "batch"));

        try (DefaultSchedulerDataProvider parallel = new DefaultSchedulerDataProvider(engine,
                TriggerTypeClassifier.defaults(),
                new SchedulerDataProvider.Options(2, SchedulerDataProvider.Options.DEFAULT_DETAIL_UNAVAILABLE_MESSAGE))) {
            assertThrows(SchedulerEngineException.class, parallel::getSnapshot);
        }
    }

    @Test
    void negativeParallelismShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultSchedulerDataProvider(engine,
                TriggerTypeClassifier.defaults(), new SchedulerDataProvider.Options(-1, "n/a")));
    }

    @Test
    void unknownGroupNamesShouldReadAsEmpty() {
        engine.groupNamesUnknown = true;

        SchedulerSnapshot snapshot = provider.getSnapshot();

        assertEquals(SchedulerStatus.EMPTY, snapshot.status());
        assertTrue(snapshot.jobGroups().isEmpty());
    }

    @Test
    void closedProviderShouldFailFast() {
        engine.addJob(job("report", "reports"));
        DefaultSchedulerDataProvider parallel = new DefaultSchedulerDataProvider(engine,
                TriggerTypeClassifier.defaults(),
                new SchedulerDataProvider.Options(2, SchedulerDataProvider.Options.DEFAULT_DETAIL_UNAVAILABLE_MESSAGE));
        parallel.close();

        IllegalStateException e = assertThrows(IllegalStateException.class, parallel::getSnapshot);
        assertEquals("provider is closed", e.getMessage());
        assertThrows(IllegalStateException.class, () -> parallel.getJobDetail("report", "reports"));
        assertThrows(IllegalStateException.class, () -> parallel.getTriggerDetail("hourly", "reports"));
    }

    /* ================= fixtures ================= */

    private static JobDetail job(String name, String group) {
        return JobBuilder.newJob(NoopJob.class).withIdentity(name, group).build();
    }

    private static Trigger simpleTrigger(String name, String group, String jobName) {
        return TriggerBuilder.newTrigger()
                .withIdentity(name, group)
                .forJob(jobName, group)
                .startAt(Date.from(START))
                .endAt(Date.from(END))
                .withSchedule(SimpleScheduleBuilder.repeatHourlyForever())
                .build();
    }

    private static Trigger cronTrigger(String name, String group, String jobName) {
        return TriggerBuilder.newTrigger()
                .withIdentity(name, group)
                .forJob(jobName, "reports")
                .startAt(Date.from(START))
                .withSchedule(CronScheduleBuilder.cronSchedule("0 0 2 * * ?"))
                .build();
    }

    public static class NoopJob implements Job {
        @Override
        public void execute(JobExecutionContext context) {
            // no-op
        }
    }
}
