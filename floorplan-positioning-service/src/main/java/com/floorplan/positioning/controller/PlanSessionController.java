package com.floorplan.positioning.controller;

import com.floorplan.positioning.dto.ActivePlan;
import com.floorplan.positioning.dto.CalibrationRequest;
import com.floorplan.positioning.dto.CalibrationStatusResponse;
import com.floorplan.positioning.dto.LoadPlanRequest;
import com.floorplan.positioning.dto.MarkerOrientationResponse;
import com.floorplan.positioning.dto.OrientationRequest;
import com.floorplan.positioning.dto.PlanPositionResponse;
import com.floorplan.positioning.dto.SavedPlanSummary;
import com.floorplan.positioning.dto.ViewportRequest;
import com.floorplan.positioning.dto.ViewportResponse;
import com.floorplan.positioning.service.PlanSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the active plan: loading, calibrating and positioning on it.
 *
 * Positioning queries answer 200 OK whatever the calibration state, with the outcome in the
 * response status. Session errors such as calibrating with no plan loaded map to HTTP error codes
 * through {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/plan")
@Tag(name = "Plan Session", description = "APIs for the active floor plan and its GPS calibration")
public class PlanSessionController {

    private final PlanSessionService planSessionService;

    public PlanSessionController(PlanSessionService planSessionService) {
        this.planSessionService = planSessionService;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Load plan", description = "Make a plan image active; clears any existing calibration")
    public ResponseEntity<ActivePlan> loadPlan(@Valid @RequestBody LoadPlanRequest request) {
        return ResponseEntity.ok(planSessionService.loadPlan(request.getName(), request.getFilePath()));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Plan status", description = "Active plan, calibration points, scale and north angle")
    public ResponseEntity<CalibrationStatusResponse> getStatus() {
        return ResponseEntity.ok(planSessionService.currentStatus());
    }

    @PutMapping(value = "/calibration", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Calibrate plan", description = "Set three GPS to pixel reference points for the active plan")
    public ResponseEntity<CalibrationStatusResponse> calibrate(@Valid @RequestBody CalibrationRequest request) {
        return ResponseEntity.ok(planSessionService.calibrate(request.toCalibrationPoints()));
    }

    @DeleteMapping(value = "/calibration", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Clear calibration", description = "Discard the calibration of the active plan")
    public ResponseEntity<CalibrationStatusResponse> clearCalibration() {
        return ResponseEntity.ok(planSessionService.clearCalibration());
    }

    @GetMapping(value = "/position", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Locate on plan", description = "Map a GPS fix to plan pixel coordinates")
    public ResponseEntity<PlanPositionResponse> locate(
            @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") double latitude,
            @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") double longitude) {
        return ResponseEntity.ok(planSessionService.locate(latitude, longitude));
    }

    @PostMapping(value = "/orientation", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Marker orientation", description = "Rotation of the position marker from GPS or compass heading")
    public ResponseEntity<MarkerOrientationResponse> orientation(@Valid @RequestBody OrientationRequest request) {
        return ResponseEntity.ok(planSessionService.orientation(request));
    }

    @PostMapping(value = "/viewport", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Viewport target", description = "Scale and translation that center the GPS fix on screen")
    public ResponseEntity<ViewportResponse> viewport(@Valid @RequestBody ViewportRequest request) {
        return ResponseEntity.ok(planSessionService.viewport(request));
    }

    @PostMapping(value = "/save", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Save plan", description = "Persist the active plan with its calibration")
    public ResponseEntity<SavedPlanSummary> save() {
        return ResponseEntity.status(HttpStatus.CREATED).body(planSessionService.saveActivePlan());
    }
}
