package com.floorplan.positioning.controller;

import com.floorplan.positioning.dto.CalibrationStatusResponse;
import com.floorplan.positioning.dto.SavedPlanSummary;
import com.floorplan.positioning.service.PlanSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for saved plans.
 */
@RestController
@RequestMapping("/api/plans")
@Tag(name = "Saved Plans", description = "APIs for listing, restoring and deleting saved plans")
public class SavedPlanController {

    private final PlanSessionService planSessionService;

    public SavedPlanController(PlanSessionService planSessionService) {
        this.planSessionService = planSessionService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List saved plans", description = "Saved plans, most recently opened first")
    public ResponseEntity<List<SavedPlanSummary>> list() {
        return ResponseEntity.ok(planSessionService.listSavedPlans());
    }

    @PostMapping(value = "/{id}/restore", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Restore plan", description = "Make a saved plan active with its stored calibration")
    public ResponseEntity<CalibrationStatusResponse> restore(@PathVariable String id) {
        return ResponseEntity.ok(planSessionService.restorePlan(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete saved plan")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        planSessionService.deleteSavedPlan(id);
        return ResponseEntity.noContent().build();
    }
}
