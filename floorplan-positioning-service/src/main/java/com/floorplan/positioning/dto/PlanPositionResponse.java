package com.floorplan.positioning.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.floorplan.positioning.engine.TransformStatus;

import java.time.Instant;

/**
 * Result of mapping a GPS fix onto the active plan. Pixel fields are only present on SUCCESS.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanPositionResponse(
        TransformStatus status,
        String message,
        Double pixelX,
        Double pixelY,
        String transformType,
        long calibrationVersion,
        Instant timestamp
) {}
