package com.floorplan.positioning.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The three collected reference pairs for the active plan, in collection order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationRequest {

    @NotNull(message = "Calibration points are required")
    @Size(min = 3, max = 3, message = "Exactly 3 calibration points must be provided")
    private List<@NotNull(message = "Calibration point must not be null") @Valid CalibrationPointDto> points;

    public List<CalibrationPoint> toCalibrationPoints() {
        return points.stream().map(CalibrationPointDto::toCalibrationPoint).toList();
    }
}
