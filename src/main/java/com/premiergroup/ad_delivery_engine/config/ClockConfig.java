package com.premiergroup.ad_delivery_engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration(proxyBeanMethods = false)
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Zone in which delivery events are cut into calendar days.
     */
    @Bean
    public ZoneId analyticsZone(@Value("${ad-engine.analytics.zone:UTC}") String zone) {
        return ZoneId.of(zone);
    }
}
