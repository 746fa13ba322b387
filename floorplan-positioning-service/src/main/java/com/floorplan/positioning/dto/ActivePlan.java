package com.floorplan.positioning.dto;

import java.util.Objects;

/**
 * The plan image currently shown. {@code savedPlanId} is set when the plan came from a saved
 * record, so saving again updates that record.
 */
public record ActivePlan(String name, String filePath, String savedPlanId) {

    public ActivePlan {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
    }

    public ActivePlan withSavedPlanId(String id) {
        return new ActivePlan(name, filePath, id);
    }
}
