package com.capitalallocator.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} every time-dependent component reads from. Tests pass a fixed clock
 * instead.
 */
@Configuration
public class ClockConfig {

    @Value("${allocator.time-zone:Asia/Kolkata}")
    private String timeZone;

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timeZone));
    }
}
