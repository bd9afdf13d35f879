package com.agentfleet.concurrency;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ConcurrencyConfig {

    @Bean
    public ConcurrencyGovernor concurrencyGovernor(ConcurrencyProperties properties) {
        return new ConcurrencyGovernor(properties.resolvePolicy(), Clock.systemUTC());
    }
}
