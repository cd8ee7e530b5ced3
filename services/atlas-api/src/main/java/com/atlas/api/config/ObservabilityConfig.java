package com.atlas.api.config;

import com.atlas.database.DataSourceHealthCheck;
import com.atlas.observability.HealthCheckRegistry;
import com.atlas.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics and health probes.
 */
@Configuration
public class ObservabilityConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, AtlasServiceProperties service) {
        return new MetricFactory(meterRegistry, service.name());
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(DataSource dataSource) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(DataSourceHealthCheck.COMPONENT, new DataSourceHealthCheck(dataSource));
        return registry;
    }
}
