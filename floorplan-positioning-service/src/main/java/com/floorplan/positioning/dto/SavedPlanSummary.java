package com.floorplan.positioning.dto;

import java.time.Instant;

public record SavedPlanSummary(String id, String name, String filePath, Instant lastOpened) {

    public static SavedPlanSummary from(SavedPlan plan) {
        return new SavedPlanSummary(plan.getId(), plan.getName(), plan.getFilePath(), plan.getLastOpened());
    }
}
