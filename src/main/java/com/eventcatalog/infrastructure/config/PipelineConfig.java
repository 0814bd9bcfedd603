package com.eventcatalog.infrastructure.config;

import com.eventcatalog.domain.model.LocationContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Event pipeline configuration.
 */
@Configuration
public class PipelineConfig {

    @Value("${events.pipeline.default-city:}")
    private String defaultCity;

    @Value("${events.pipeline.default-state:}")
    private String defaultState;

    /**
     * Location used when an ingest run is started without one.
     */
    @Bean
    public LocationContext defaultLocationContext() {
        return new LocationContext(defaultCity, defaultState);
    }
}
