package io.schedlens.config;

import io.schedlens.SchedulerDataProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for snapshot assembly.
 */
@ConfigurationProperties(prefix = "schedlens")
public class SchedLensProperties {
    private boolean enabled = true;
    private int fetchParallelism = 0; // 0 = calling thread only
    private String detailUnavailableMessage = SchedulerDataProvider.Options.DEFAULT_DETAIL_UNAVAILABLE_MESSAGE;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getFetchParallelism() {
        return fetchParallelism;
    }

    public void setFetchParallelism(int fetchParallelism) {
        this.fetchParallelism = fetchParallelism;
    }

    public String getDetailUnavailableMessage() {
        return detailUnavailableMessage;
    }

    public void setDetailUnavailableMessage(String detailUnavailableMessage) {
        this.detailUnavailableMessage = detailUnavailableMessage;
    }

    public SchedulerDataProvider.Options toOptions() {
        return new SchedulerDataProvider.Options(fetchParallelism, detailUnavailableMessage);
    }
}
