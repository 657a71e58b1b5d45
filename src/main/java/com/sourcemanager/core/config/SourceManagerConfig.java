package com.sourcemanager.core.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by the store and the migrator.
 * <p>
 * No actuator is on the classpath in CLI mode, so a {@link SimpleMeterRegistry}
 * is registered unless something else already provides a registry.
 */
@Configuration
public class SourceManagerConfig {

    private static final Logger log = LoggerFactory.getLogger(SourceManagerConfig.class);

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        log.debug("No MeterRegistry available; using in-memory SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
