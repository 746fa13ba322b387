package com.floorplan.positioning.dto;

/**
 * Sensor a marker heading was taken from.
 */
public enum HeadingSource {
    GPS,
    MAGNETOMETER
}
