package com.floorplan.positioning.service;

import com.floorplan.positioning.algorithm.util.GeodesicDistance;
import com.floorplan.positioning.config.FloorplanProperties;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.CalibrationPoint;
import com.floorplan.positioning.exception.CalibrationRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates collected reference points before they become a calibration.
 *
 * Reference points tapped within a meter of each other give the solver nothing to work with:
 * the scale between them is dominated by GPS noise, and two such points make the calibration
 * degenerate. The collection flow rejects them so the user can pick a point further away.
 * The engine itself accepts any calibration.
 */
@Slf4j
@Component
public class CalibrationPointValidator {

    private final GeodesicDistance geodesicDistance;
    private final FloorplanProperties properties;

    public CalibrationPointValidator(GeodesicDistance geodesicDistance, FloorplanProperties properties) {
        this.geodesicDistance = geodesicDistance;
        this.properties = properties;
    }

    /**
     * Checks the point count and pairwise GPS separation.
     *
     * @param points Points in collection order
     * @return The calibration built from the points
     * @throws CalibrationRejectedException if the points cannot form a usable calibration
     */
    public Calibration validate(List<CalibrationPoint> points) {
        if (points == null || points.size() != Calibration.POINT_COUNT) {
            int count = points == null ? 0 : points.size();
            throw reject("Exactly " + Calibration.POINT_COUNT + " calibration points are required, got " + count);
        }

        double minSeparation = properties.getCalibration().getMinPointSeparationMeters();
        for (int i = 0; i < points.size(); i++) {
            for (int j = i + 1; j < points.size(); j++) {
                double distance = geodesicDistance.distanceMeters(points.get(i).world(), points.get(j).world());
                if (distance < minSeparation) {
                    throw reject(String.format(
                            "Calibration points %d and %d are %.2f m apart; at least %.2f m is required",
                            i + 1, j + 1, distance, minSeparation));
                }
            }
        }

        return Calibration.of(points);
    }

    private CalibrationRejectedException reject(String message) {
        log.warn("Calibration rejected: {}", message);
        return new CalibrationRejectedException(message);
    }
}
