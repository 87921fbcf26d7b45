package com.companya.analytics.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ReplicaProperties.class)
public class ReplicaConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
