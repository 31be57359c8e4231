package io.schedlens.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * On-demand detail for a single job.
 *
 * <p>Both maps keep insertion order and may hold null values (e.g. a job without description),
 * so they are wrapped rather than copied with {@link Map#copyOf}.
 */
public record JobDetailsData(
        JobData primaryData,
        Map<String, Object> jobDataMap,
        Map<String, Object> jobProperties
) {
    public static final String DESCRIPTION = "Description";
    public static final String FULL_NAME = "Full name";
    public static final String JOB_TYPE = "Job type";
    public static final String DURABLE = "Durable";
    public static final String CONCURRENT_EXECUTION_DISALLOWED = "ConcurrentExecutionDisallowed";
    public static final String PERSIST_JOB_DATA_AFTER_EXECUTION = "PersistJobDataAfterExecution";
    public static final String REQUESTS_RECOVERY = "RequestsRecovery";

    /**
     * Key of the single placeholder entry used when the job definition cannot be read.
     */
    public static final String SENTINEL_KEY = "Data";

    public JobDetailsData {
        Objects.requireNonNull(primaryData, "primaryData must not be null");
        jobDataMap = freeze(jobDataMap);
        jobProperties = freeze(jobProperties);
    }

    /**
     * Detail whose job data map and properties each hold only the sentinel entry.
     */
    public static JobDetailsData unavailable(JobData primaryData, String message) {
        Map<String, Object> sentinel = Map.of(SENTINEL_KEY, message);
        return new JobDetailsData(primaryData, sentinel, sentinel);
    }

    /**
     * True when this detail carries the placeholder instead of the job definition.
     */
    public boolean isDetailUnavailable() {
        return jobProperties.size() == 1 && jobProperties.containsKey(SENTINEL_KEY);
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
