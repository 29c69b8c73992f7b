package com.capitalallocator.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registry-wide settings for the allocator's meters. The meters themselves are defined in
 * {@link com.capitalallocator.observability.AllocationMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private static final String GUARDRAIL_LATENCY = "guardrail.evaluation.latency";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> allocatorCommonTags(
            @Value("${spring.application.name:capital-allocator}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }

    /** Publishes p50/p95/p99 for the guardrail timer so slow checks show up without a histogram backend. */
    @Bean
    public MeterFilter guardrailLatencyPercentiles() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (!GUARDRAIL_LATENCY.equals(id.getName())) {
                    return config;
                }
                return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .build()
                        .merge(config);
            }
        };
    }
}
