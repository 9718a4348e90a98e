package com.openmandi.pricing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PricingConfiguration {

    @Bean
    public Clock clock(PricingProperties properties) {
        return Clock.system(properties.getZone());
    }
}
