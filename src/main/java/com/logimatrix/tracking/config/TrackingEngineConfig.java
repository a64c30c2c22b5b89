package com.logimatrix.tracking.config;

import com.uber.h3core.H3Core;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;

/**
 * Core beans shared by the engines.
 *
 * The {@link Clock} is the only time source of the engine: timestamp sanity
 * checks, TTLs, ETA confidence and retention purges all read it, so tests can
 * swap in a fixed clock.
 */
@Configuration
@EnableConfigurationProperties(TrackingProperties.class)
public class TrackingEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * H3 loads a native library on creation; one instance is thread-safe and shared.
     */
    @Bean
    public H3Core h3Core() throws IOException {
        return H3Core.newInstance();
    }
}
