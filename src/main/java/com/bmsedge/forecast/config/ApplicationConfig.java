package com.bmsedge.forecast.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ApplicationConfig {

    @Value("${forecasting.time-zone:UTC}")
    private String timeZone;

    /**
     * Clock that decides "today" for generated series
     */
    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timeZone));
    }
}
