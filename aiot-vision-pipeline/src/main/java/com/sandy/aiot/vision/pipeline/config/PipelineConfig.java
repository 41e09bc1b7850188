package com.sandy.aiot.vision.pipeline.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    /** Processing-time clock; event time always comes from the readings. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
