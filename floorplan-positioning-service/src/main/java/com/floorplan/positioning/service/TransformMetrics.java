package com.floorplan.positioning.service;

import com.floorplan.positioning.engine.CalibrationChangeEvent;
import com.floorplan.positioning.engine.TransformEngine;
import com.floorplan.positioning.engine.TransformResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Micrometer counters for transform queries and calibration changes.
 *
 * Calibration changes are counted through an engine listener, so they are recorded no matter
 * which caller mutated the engine.
 */
@Slf4j
@Component
public class TransformMetrics {

    static final String TRANSFORM_REQUESTS = "floorplan.transform.requests";
    static final String CALIBRATION_CHANGES = "floorplan.calibration.changes";
    static final String NO_TRANSFORM = "none";

    private final MeterRegistry meterRegistry;

    public TransformMetrics(MeterRegistry meterRegistry, TransformEngine transformEngine) {
        this.meterRegistry = meterRegistry;
        transformEngine.addListener(this::onCalibrationChanged);
        log.info("Transform metrics registered on {}", meterRegistry.getClass().getSimpleName());
    }

    /**
     * Counts one transform query by outcome and transform type.
     */
    public void recordTransform(TransformResult<?> result) {
        String type = result.transformType() != null ? result.transformType().getDisplayName() : NO_TRANSFORM;
        Counter.builder(TRANSFORM_REQUESTS)
                .description("Number of GPS to plan transform queries")
                .tag("outcome", result.status().name().toLowerCase(Locale.ROOT))
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    void onCalibrationChanged(CalibrationChangeEvent event) {
        Counter.builder(CALIBRATION_CHANGES)
                .description("Number of calibration changes")
                .tag("type", event.type().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }
}
