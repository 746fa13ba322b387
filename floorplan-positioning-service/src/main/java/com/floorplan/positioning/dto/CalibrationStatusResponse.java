package com.floorplan.positioning.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Snapshot of the active plan and its calibration.
 *
 * @param planName Active plan name, absent when no plan is loaded
 * @param filePath Active plan file path
 * @param savedPlanId Id of the saved record the plan was restored from or saved to
 * @param calibrated Whether a calibration is set
 * @param calibrationVersion Engine version counter
 * @param points Raw reference points, empty when uncalibrated
 * @param transformType Transform the calibration resolves to, absent when none
 * @param pixelsPerMeter Plan scale, absent when it cannot be derived
 * @param northAngle Direction of north in radians, 0.0 when unavailable
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalibrationStatusResponse(
        String planName,
        String filePath,
        String savedPlanId,
        boolean calibrated,
        long calibrationVersion,
        List<CalibrationPointDto> points,
        String transformType,
        Double pixelsPerMeter,
        double northAngle
) {}
