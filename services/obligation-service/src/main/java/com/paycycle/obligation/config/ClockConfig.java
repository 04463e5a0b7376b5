package com.paycycle.obligation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Source of "today" for the web layer. Services take the date as a parameter.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${obligation.time-zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
