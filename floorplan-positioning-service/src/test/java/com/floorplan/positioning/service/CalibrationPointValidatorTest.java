package com.floorplan.positioning.service;

import com.floorplan.positioning.algorithm.util.HaversineDistanceCalculator;
import com.floorplan.positioning.config.FloorplanProperties;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.CalibrationPoint;
import com.floorplan.positioning.exception.CalibrationRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Calibration Point Validator Tests")
class CalibrationPointValidatorTest {

    // Roughly 11 m of latitude
    private static final double TEN_METERS_DEG = 0.0001;

    private FloorplanProperties properties;
    private CalibrationPointValidator validator;

    @BeforeEach
    void setUp() {
        properties = new FloorplanProperties();
        validator = new CalibrationPointValidator(new HaversineDistanceCalculator(), properties);
    }

    @Test
    @DisplayName("should accept well separated points")
    void shouldAcceptSeparatedPoints() {
        List<CalibrationPoint> points = List.of(
            CalibrationPoint.of(40.0, -74.0, 0.0, 0.0),
            CalibrationPoint.of(40.0 + TEN_METERS_DEG, -74.0, 0.0, 100.0),
            CalibrationPoint.of(40.0, -74.0 + TEN_METERS_DEG, 100.0, 0.0));

        Calibration calibration = validator.validate(points);

        assertEquals(points, calibration.points());
    }

    @Test
    @DisplayName("should reject two points closer than a meter")
    void shouldRejectClosePoints() {
        List<CalibrationPoint> points = List.of(
            CalibrationPoint.of(40.0, -74.0, 0.0, 0.0),
            CalibrationPoint.of(40.0 + TEN_METERS_DEG, -74.0, 0.0, 100.0),
            CalibrationPoint.of(40.0 + TEN_METERS_DEG, -74.000005, 100.0, 0.0));

        CalibrationRejectedException ex =
            assertThrows(CalibrationRejectedException.class, () -> validator.validate(points));
        assertTrue(ex.getMessage().contains("points 2 and 3"), ex.getMessage());
    }

    @Test
    @DisplayName("should honor the configured minimum separation")
    void shouldHonorConfiguredSeparation() {
        properties.getCalibration().setMinPointSeparationMeters(50.0);
        List<CalibrationPoint> points = List.of(
            CalibrationPoint.of(40.0, -74.0, 0.0, 0.0),
            CalibrationPoint.of(40.0 + TEN_METERS_DEG, -74.0, 0.0, 100.0),
            CalibrationPoint.of(40.0, -74.0 + 0.01, 100.0, 0.0));

        assertThrows(CalibrationRejectedException.class, () -> validator.validate(points));
    }

    @Test
    @DisplayName("should reject anything but three points")
    void shouldRejectWrongCount() {
        List<CalibrationPoint> twoPoints = List.of(
            CalibrationPoint.of(40.0, -74.0, 0.0, 0.0),
            CalibrationPoint.of(41.0, -74.0, 0.0, 100.0));

        assertThrows(CalibrationRejectedException.class, () -> validator.validate(twoPoints));
        assertThrows(CalibrationRejectedException.class, () -> validator.validate(null));
    }
}
