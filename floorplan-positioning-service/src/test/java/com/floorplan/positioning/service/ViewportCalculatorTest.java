package com.floorplan.positioning.service;

import com.floorplan.positioning.config.FloorplanProperties;
import com.floorplan.positioning.dto.PixelPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Viewport Calculator Tests")
class ViewportCalculatorTest {

    private static final double DELTA = 1e-9;

    private final ViewportCalculator calculator = new ViewportCalculator(new FloorplanProperties());

    @Test
    @DisplayName("should fit the visible meters across the screen width")
    void shouldFitVisibleMeters() {
        // 200 m * 0.5 px/m * 2.0 display factor = 200 content points on a 400 point screen
        double scale = calculator.targetScale(OptionalDouble.of(0.5), 400.0, 1.0);

        assertEquals(2.0, scale, DELTA);
    }

    @Test
    @DisplayName("should clamp the scale to the configured range")
    void shouldClampScale() {
        assertEquals(20.0, calculator.targetScale(OptionalDouble.of(0.0001), 400.0, 1.0), DELTA);
        assertEquals(0.1, calculator.targetScale(OptionalDouble.of(1000.0), 400.0, 1.0), DELTA);
    }

    @Test
    @DisplayName("should keep the current scale when the plan scale is unknown")
    void shouldKeepCurrentScale() {
        assertEquals(3.5, calculator.targetScale(OptionalDouble.empty(), 400.0, 3.5), DELTA);
    }

    @Test
    @DisplayName("should place the pixel at the screen center")
    void shouldCenterPixel() {
        PixelPoint translation = calculator.centerOn(new PixelPoint(100.0, 50.0), 1.5, 400.0, 800.0);

        // content point (200, 100) at scale 1.5 is (300, 150); center is (200, 400)
        assertEquals(-100.0, translation.x(), DELTA);
        assertEquals(250.0, translation.y(), DELTA);
    }
}
