package com.floorplan.positioning.health;

import com.floorplan.positioning.dto.ActivePlan;
import com.floorplan.positioning.engine.TransformEngine;
import com.floorplan.positioning.service.PlanSessionService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Health indicator reporting the calibration state of the active plan.
 *
 * An uncalibrated plan is a normal state while the user collects reference points, so this
 * indicator is always UP and only contributes details.
 */
@Component("calibrationState")
public class CalibrationStateHealthIndicator implements HealthIndicator {

    private static final String PLAN_KEY = "plan";
    private static final String CALIBRATED_KEY = "calibrated";
    private static final String VERSION_KEY = "calibrationVersion";
    private static final String NO_PLAN = "none";

    private final PlanSessionService planSessionService;
    private final TransformEngine transformEngine;

    public CalibrationStateHealthIndicator(PlanSessionService planSessionService, TransformEngine transformEngine) {
        this.planSessionService = planSessionService;
        this.transformEngine = transformEngine;
    }

    @Override
    public Health health() {
        Optional<ActivePlan> plan = planSessionService.activePlan();
        return Health.up()
                .withDetail(PLAN_KEY, plan.map(ActivePlan::name).orElse(NO_PLAN))
                .withDetail(CALIBRATED_KEY, transformEngine.isCalibrated())
                .withDetail(VERSION_KEY, transformEngine.getVersion())
                .build();
    }
}
