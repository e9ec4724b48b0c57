package io.governor.spring.boot;

import io.governor.micrometer.MicrometerGovernorMetrics;
import io.governor.spi.GovernorMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerGovernorMetrics} when Micrometer is on the classpath
 * and {@code enrichment.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link GovernorAutoConfiguration} so the {@link GovernorMetrics}
 * bean is available to the sweep, consumer, admin and cleaner.
 */
@AutoConfiguration(before = GovernorAutoConfiguration.class)
@ConditionalOnClass({MicrometerGovernorMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "enrichment.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(GovernorProperties.class)
public class GovernorMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(GovernorMetrics.class)
    public MicrometerGovernorMetrics micrometerGovernorMetrics(MeterRegistry meterRegistry,
                                                               GovernorProperties props) {
        return new MicrometerGovernorMetrics(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
