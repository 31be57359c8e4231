package io.schedlens.config;

import io.schedlens.SchedulerDataProvider;
import io.schedlens.SchedulerEngine;
import io.schedlens.internal.DefaultSchedulerDataProvider;
import io.schedlens.internal.quartz.QuartzSchedulerEngine;
import io.schedlens.utils.TriggerTypeClassifier;
import org.quartz.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.quartz.QuartzAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for snapshot components.
 *
 * <p>Activates once a Quartz {@link Scheduler} bean exists, e.g. the one created by Spring Boot's
 * own Quartz auto-configuration.
 */
@AutoConfiguration(after = QuartzAutoConfiguration.class)
@ConditionalOnClass({SchedulerDataProvider.class, Scheduler.class})
@ConditionalOnBean(Scheduler.class)
@EnableConfigurationProperties(SchedLensProperties.class)
@ConditionalOnProperty(prefix = "schedlens", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedLensConfig {
    private static final Logger log = LoggerFactory.getLogger(SchedLensConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public TriggerTypeClassifier triggerTypeClassifier() {
        return TriggerTypeClassifier.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerEngine schedulerEngine(Scheduler scheduler) {
        return new QuartzSchedulerEngine(scheduler);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(SchedulerDataProvider.class)
    public SchedulerDataProvider schedulerDataProvider(SchedulerEngine engine,
                                                       TriggerTypeClassifier classifier,
                                                       SchedLensProperties props) {
        log.info("SchedLens data provider enabled with fetchParallelism={}", props.getFetchParallelism());
        return new DefaultSchedulerDataProvider(engine, classifier, props.toOptions());
    }
}
