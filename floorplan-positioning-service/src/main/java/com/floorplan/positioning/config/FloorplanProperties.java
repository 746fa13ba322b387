package com.floorplan.positioning.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for plan calibration and display.
 * Maps to the 'floorplan' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "floorplan")
public class FloorplanProperties {

    private Calibration calibration = new Calibration();
    private Heading heading = new Heading();
    private Viewport viewport = new Viewport();

    @Data
    public static class Calibration {
        private double minPointSeparationMeters = 1.0;
    }

    @Data
    public static class Heading {
        private double gpsSpeedThresholdMps = 1.0;
    }

    @Data
    public static class Viewport {
        private double visibleMeters = 200.0;
        /** Plan images are drawn at twice their native pixel size. */
        private double displayScaleFactor = 2.0;
        private double minScale = 0.1;
        private double maxScale = 20.0;
    }
}
