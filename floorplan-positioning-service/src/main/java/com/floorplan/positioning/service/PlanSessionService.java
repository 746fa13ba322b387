package com.floorplan.positioning.service;

import com.floorplan.positioning.dto.ActivePlan;
import com.floorplan.positioning.dto.CalibrationPoint;
import com.floorplan.positioning.dto.CalibrationStatusResponse;
import com.floorplan.positioning.dto.MarkerOrientationResponse;
import com.floorplan.positioning.dto.OrientationRequest;
import com.floorplan.positioning.dto.PlanPositionResponse;
import com.floorplan.positioning.dto.SavedPlanSummary;
import com.floorplan.positioning.dto.ViewportRequest;
import com.floorplan.positioning.dto.ViewportResponse;

import java.util.List;
import java.util.Optional;

/**
 * Service interface for the active plan session: which plan is shown, its calibration, and the
 * positioning queries answered against it.
 */
public interface PlanSessionService {

    /**
     * Makes a plan active. Any calibration of the previous plan is cleared first.
     *
     * @param name Display name of the plan
     * @param filePath Location of the plan image
     * @return The new active plan
     */
    ActivePlan loadPlan(String name, String filePath);

    /**
     * Validates the collected reference points and calibrates the active plan with them.
     *
     * @param points Three points in collection order
     * @return Status after calibration
     * @throws com.floorplan.positioning.exception.PlanNotLoadedException if no plan is active
     * @throws com.floorplan.positioning.exception.CalibrationRejectedException if the points are unusable
     */
    CalibrationStatusResponse calibrate(List<CalibrationPoint> points);

    /**
     * Discards the calibration of the active plan.
     */
    CalibrationStatusResponse clearCalibration();

    CalibrationStatusResponse currentStatus();

    Optional<ActivePlan> activePlan();

    /**
     * Maps a GPS fix onto the active plan. Never throws for calibration state; the outcome is in
     * the response status.
     */
    PlanPositionResponse locate(double latitude, double longitude);

    MarkerOrientationResponse orientation(OrientationRequest request);

    ViewportResponse viewport(ViewportRequest request);

    /**
     * Persists the active plan with its calibration.
     *
     * @throws com.floorplan.positioning.exception.PlanNotLoadedException if no plan is active
     * @throws com.floorplan.positioning.exception.CalibrationRequiredException if it is not calibrated
     */
    SavedPlanSummary saveActivePlan();

    /**
     * Loads a saved plan and applies its stored calibration.
     *
     * @throws com.floorplan.positioning.exception.SavedPlanNotFoundException if no such plan exists
     */
    CalibrationStatusResponse restorePlan(String id);

    /**
     * @return Saved plans, most recently opened first
     */
    List<SavedPlanSummary> listSavedPlans();

    void deleteSavedPlan(String id);
}
