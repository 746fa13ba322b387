package com.floorplan.positioning.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.floorplan.positioning.engine.TransformStatus;

/**
 * Scale and translation that center the user's position on screen. The translation is absent
 * when the position cannot be mapped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViewportResponse(
        TransformStatus status,
        double scale,
        Double translateX,
        Double translateY
) {}
