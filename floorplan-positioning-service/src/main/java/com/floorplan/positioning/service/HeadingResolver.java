package com.floorplan.positioning.service;

import com.floorplan.positioning.algorithm.util.AngleUtils;
import com.floorplan.positioning.config.FloorplanProperties;
import com.floorplan.positioning.dto.HeadingSource;
import com.floorplan.positioning.dto.OrientationRequest;
import org.springframework.stereotype.Component;

/**
 * Turns sensor headings into a marker rotation on the plan.
 *
 * The GPS course is only meaningful while moving, so it is used above the configured speed
 * threshold and the compass heading is used otherwise.
 *
 * Formula:
 * rotation = northAngle + heading · π / 180 + π / 2
 *
 * Where:
 * - northAngle: pixel-space direction of north, radians from +x
 * - heading: degrees clockwise from north
 * - π / 2: the marker artwork points up (-y) at rotation 0
 */
@Component
public class HeadingResolver {

    private static final double MARKER_ARTWORK_OFFSET = Math.PI / 2;

    public record MarkerOrientation(double headingDegrees, HeadingSource source, double rotation) {}

    private final FloorplanProperties properties;

    public HeadingResolver(FloorplanProperties properties) {
        this.properties = properties;
    }

    public MarkerOrientation resolve(OrientationRequest request, double northAngle) {
        double speed = orZero(request.getGpsSpeed());
        boolean useGps = speed > properties.getHeading().getGpsSpeedThresholdMps();
        HeadingSource source = useGps ? HeadingSource.GPS : HeadingSource.MAGNETOMETER;
        double heading = useGps ? orZero(request.getGpsHeading()) : orZero(request.getMagneticHeading());

        double rotation = northAngle + Math.toRadians(heading) + MARKER_ARTWORK_OFFSET;
        if (request.getPreviousRotation() != null) {
            rotation = AngleUtils.shortestArcTarget(request.getPreviousRotation(), rotation);
        }
        return new MarkerOrientation(heading, source, rotation);
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
