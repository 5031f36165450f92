package com.venueops.common.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties(VenueOpsProperties.class)
public class AppConfig {

    // Every time-window computation reads "now" from this clock
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
