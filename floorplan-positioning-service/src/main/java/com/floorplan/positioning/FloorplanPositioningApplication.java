package com.floorplan.positioning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Floor Plan Positioning Service.
 *
 * <p>Aligns floor plan images with GPS coordinates from three reference points and maps live GPS
 * fixes, headings and screen viewports onto the active plan.
 *
 * <p><strong>Key Responsibilities:</strong>
 *
 * <ul>
 *   <li>Holds the calibration of the active plan and derives the GPS to pixel transform from it
 *   <li>Validates collected reference points before they are applied
 *   <li>Persists calibrated plans to DynamoDB so they can be restored later
 * </ul>
 */
@SpringBootApplication
public class FloorplanPositioningApplication {

  public static void main(String[] args) {
    SpringApplication.run(FloorplanPositioningApplication.class, args);
  }
}
