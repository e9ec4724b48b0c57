package io.governor.spring.boot;

import io.governor.micrometer.MicrometerGovernorMetrics;
import io.governor.spi.GovernorMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GovernorMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(GovernorMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerMetricsByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerGovernorMetrics"));
            assertInstanceOf(MicrometerGovernorMetrics.class, ctx.getBean(GovernorMetrics.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("enrichment.metrics.name-prefix=beers").run(ctx -> {
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("beers.sweep.queued").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("enrichment.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerGovernorMetrics")));
    }

    @Test
    void backsOffWhenCustomMetricsPresent() {
        runner.withUserConfiguration(CustomMetricsConfig.class).run(ctx ->
                assertFalse(ctx.getBean(GovernorMetrics.class) instanceof MicrometerGovernorMetrics));
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomMetricsConfig {
        @Bean
        GovernorMetrics customMetrics() {
            return new GovernorMetrics() {};
        }
    }
}
