package org.kvplane.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.metric.KvMonitor;
import org.kvplane.metric.MicrometerKvMonitor;
import org.kvplane.metric.NoOpKvMonitor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MonitorClientConfig {

    /**
     * Report through Micrometer when a meter registry is present, otherwise drop all metrics
     */
    @Bean
    @ConditionalOnMissingBean(KvMonitor.class)
    public KvMonitor kvMonitor(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("No MeterRegistry found, creating NoOpKvMonitor - monitoring disabled");
            return NoOpKvMonitor.getInstance();
        }
        log.info("Creating MicrometerKvMonitor on {}", registry.getClass().getSimpleName());
        return new MicrometerKvMonitor(registry);
    }
}
