package com.floorplan.positioning.dto;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * A saved plan with its calibration, stored as plain numeric fields so it can be restored without
 * recomputing anything.
 *
 * <p>Records written before three-point calibration existed have no third point; it restores as
 * (0.0, 0.0) on both sides.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@DynamoDbBean
public class SavedPlan {

  private static final double MISSING_COORDINATE = 0.0;

  private String id;
  private String name;
  private String filePath;

  private Double gps1Latitude;
  private Double gps1Longitude;
  private Double pixel1X;
  private Double pixel1Y;

  private Double gps2Latitude;
  private Double gps2Longitude;
  private Double pixel2X;
  private Double pixel2Y;

  private Double gps3Latitude;
  private Double gps3Longitude;
  private Double pixel3X;
  private Double pixel3Y;

  private Instant lastOpened;

  @DynamoDbPartitionKey
  @DynamoDbAttribute("plan_id")
  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  @DynamoDbAttribute("name")
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @DynamoDbAttribute("file_path")
  public String getFilePath() {
    return filePath;
  }

  public void setFilePath(String filePath) {
    this.filePath = filePath;
  }

  @DynamoDbAttribute("last_opened")
  public Instant getLastOpened() {
    return lastOpened;
  }

  public void setLastOpened(Instant lastOpened) {
    this.lastOpened = lastOpened;
  }

  /** Builds a record for a plan and its calibration. */
  public static SavedPlan of(String id, String name, String filePath, Calibration calibration, Instant lastOpened) {
    CalibrationPoint p1 = calibration.first();
    CalibrationPoint p2 = calibration.second();
    CalibrationPoint p3 = calibration.third();
    return SavedPlan.builder()
        .id(id)
        .name(name)
        .filePath(filePath)
        .gps1Latitude(p1.world().latitude())
        .gps1Longitude(p1.world().longitude())
        .pixel1X(p1.pixel().x())
        .pixel1Y(p1.pixel().y())
        .gps2Latitude(p2.world().latitude())
        .gps2Longitude(p2.world().longitude())
        .pixel2X(p2.pixel().x())
        .pixel2Y(p2.pixel().y())
        .gps3Latitude(p3.world().latitude())
        .gps3Longitude(p3.world().longitude())
        .pixel3X(p3.pixel().x())
        .pixel3Y(p3.pixel().y())
        .lastOpened(lastOpened)
        .build();
  }

  /**
   * Rebuilds the stored calibration.
   *
   * @throws IllegalStateException if point 1 or 2 is incomplete
   */
  public Calibration toCalibration() {
    return new Calibration(
        requiredPoint(1, gps1Latitude, gps1Longitude, pixel1X, pixel1Y),
        requiredPoint(2, gps2Latitude, gps2Longitude, pixel2X, pixel2Y),
        CalibrationPoint.of(
            orMissing(gps3Latitude), orMissing(gps3Longitude), orMissing(pixel3X), orMissing(pixel3Y)));
  }

  private CalibrationPoint requiredPoint(int index, Double latitude, Double longitude, Double x, Double y) {
    if (latitude == null || longitude == null || x == null || y == null) {
      throw new IllegalStateException("Saved plan " + id + " is missing calibration point " + index);
    }
    return CalibrationPoint.of(latitude, longitude, x, y);
  }

  private static double orMissing(Double value) {
    return value != null ? value : MISSING_COORDINATE;
  }
}
