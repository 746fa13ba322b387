package com.floorplan.positioning.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sensor readings used to orient the position marker. All fields are optional; a missing reading
 * counts as 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrientationRequest {

    /**
     * GPS course over ground in degrees clockwise from north
     */
    private Double gpsHeading;

    /**
     * GPS speed in meters per second
     */
    @PositiveOrZero(message = "GPS speed must not be negative")
    private Double gpsSpeed;

    /**
     * Compass heading in degrees clockwise from north
     */
    private Double magneticHeading;

    /**
     * Rotation currently displayed, in radians. When present the result follows the shortest arc
     * from it.
     */
    private Double previousRotation;
}
