package com.floorplan.positioning.config;

import com.floorplan.positioning.algorithm.util.GeodesicDistance;
import com.floorplan.positioning.algorithm.util.HaversineDistanceCalculator;
import com.floorplan.positioning.engine.TransformEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the transform engine and the collaborators it and the session layer share.
 */
@Configuration
public class TransformEngineConfig {

    @Bean
    public GeodesicDistance geodesicDistance() {
        return new HaversineDistanceCalculator();
    }

    @Bean
    public TransformEngine transformEngine(GeodesicDistance geodesicDistance) {
        return new TransformEngine(geodesicDistance);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
