package com.funnelscope.service.core.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * UTC clock behind query deadlines: a run is cancelled once this clock passes its start plus the engine timeout.
 * Tests construct the engine with a fixed clock instead.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock funnelClock() {
        return Clock.systemUTC();
    }
}
