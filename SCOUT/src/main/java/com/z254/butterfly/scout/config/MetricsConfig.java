package com.z254.butterfly.scout.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for SCOUT service.
 * Run, agent, broker and context meters are registered by the components that own them.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> scoutCommonTags(
            @Value("${spring.application.name:scout}") String applicationName) {
        return registry -> registry.config().commonTags("service", applicationName);
    }
}
