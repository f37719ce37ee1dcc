package com.platform.governance.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans shared by the policy store and the translation engine.
 */
@Configuration
@EnableConfigurationProperties(GovernanceProperties.class)
public class EngineConfig {
    
    /**
     * Time source for policy effective dates and change log timestamps.
     * Translation never reads it; its time basis is the event's processedAt.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
