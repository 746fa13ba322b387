package com.floorplan.positioning.service;

import com.floorplan.positioning.config.FloorplanProperties;
import com.floorplan.positioning.dto.PixelPoint;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Computes the zoom and pan that center a plan pixel on screen.
 *
 * Plan images are drawn at {@code displayScaleFactor} times their native size, so content
 * coordinates are pixel coordinates times that factor.
 *
 * Formulas:
 * scale = screenWidth / (visibleMeters · pixelsPerMeter · displayScaleFactor), clamped
 * translate = screenCenter - scale · pixel · displayScaleFactor
 */
@Component
public class ViewportCalculator {

    private final FloorplanProperties properties;

    public ViewportCalculator(FloorplanProperties properties) {
        this.properties = properties;
    }

    /**
     * Scale at which {@code visibleMeters} of the plan span the screen width.
     *
     * @param pixelsPerMeter Plan scale, empty when unknown
     * @param screenWidth Screen width in screen points
     * @param currentScale Scale to keep when no target can be derived
     */
    public double targetScale(OptionalDouble pixelsPerMeter, double screenWidth, double currentScale) {
        FloorplanProperties.Viewport viewport = properties.getViewport();
        if (pixelsPerMeter.isEmpty() || pixelsPerMeter.getAsDouble() <= 0) {
            return currentScale;
        }
        double visibleContentWidth =
                viewport.getVisibleMeters() * pixelsPerMeter.getAsDouble() * viewport.getDisplayScaleFactor();
        double scale = screenWidth / visibleContentWidth;
        return Math.max(viewport.getMinScale(), Math.min(viewport.getMaxScale(), scale));
    }

    /**
     * Translation placing {@code pixel} at the screen center at the given scale.
     */
    public PixelPoint centerOn(PixelPoint pixel, double scale, double screenWidth, double screenHeight) {
        PixelPoint content = pixel.scale(properties.getViewport().getDisplayScaleFactor());
        return new PixelPoint(
                screenWidth / 2 - scale * content.x(),
                screenHeight / 2 - scale * content.y());
    }
}
