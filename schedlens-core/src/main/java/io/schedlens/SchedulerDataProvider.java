package io.schedlens;

import io.schedlens.core.JobDetailsData;
import io.schedlens.core.SchedulerSnapshot;
import io.schedlens.core.TriggerData;
import org.quartz.TriggerKey;

import java.util.Optional;

/**
 * Builds read-only views of a scheduler for presentation to an operator.
 *
 * <p>Every call builds a fresh object graph; nothing is cached between calls. An empty
 * {@link Optional} means "not found or engine unavailable"; unexpected engine failures surface as
 * {@link io.schedlens.core.SchedulerEngineException}.
 */
public interface SchedulerDataProvider {

    /**
     * Full hierarchy: job groups, their jobs, and each job's triggers.
     * Fails as a whole if any engine query fails.
     */
    SchedulerSnapshot getSnapshot();

    /**
     * Detail of one job. If the job exists but its definition cannot be read, the result carries a
     * placeholder entry instead of the data map and properties.
     */
    Optional<JobDetailsData> getJobDetail(String name, String group);

    Optional<TriggerData> getTriggerDetail(TriggerKey key);

    default Optional<TriggerData> getTriggerDetail(String name, String group) {
        return getTriggerDetail(new TriggerKey(name, group));
    }

    /**
     * Options for snapshot assembly.
     * <ul>
     *   <li>fetchParallelism: 0 builds on the calling thread; N &gt; 0 fans out per-job work over N threads</li>
     *   <li>detailUnavailableMessage: placeholder text used when a job definition cannot be read</li>
     * </ul>
     */
    record Options(int fetchParallelism, String detailUnavailableMessage) {
        public static final String DEFAULT_DETAIL_UNAVAILABLE_MESSAGE = "Not available for remote scheduler";

        public static Options defaults() {
            return new Options(0, DEFAULT_DETAIL_UNAVAILABLE_MESSAGE);
        }
    }
}
