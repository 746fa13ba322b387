package com.floorplan.positioning.dto;

import com.floorplan.positioning.engine.TransformStatus;

/**
 * Rotation for the position marker.
 *
 * @param status Status of the north angle the rotation is based on
 * @param headingDegrees Heading that was used, degrees clockwise from north
 * @param headingSource Sensor the heading came from
 * @param northAngle North angle in radians (0.0 unless status is SUCCESS)
 * @param rotation Marker rotation in radians
 */
public record MarkerOrientationResponse(
        TransformStatus status,
        double headingDegrees,
        HeadingSource headingSource,
        double northAngle,
        double rotation
) {}
