package com.floorplan.positioning.repository;

import com.floorplan.positioning.dto.SavedPlan;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for saved plans and their calibrations.
 */
public interface SavedPlanRepository {

    /**
     * Returns all saved plans, most recently opened first.
     *
     * @return Saved plans sorted by lastOpened descending
     */
    List<SavedPlan> findAll();

    /**
     * Find a saved plan by id.
     *
     * @param id Plan id
     * @return Optional containing the plan if found, empty otherwise
     */
    Optional<SavedPlan> findById(String id);

    /**
     * Stores a plan. Any existing record with the same id or the same file path is replaced.
     *
     * @param plan Plan to store
     * @return The stored plan
     */
    SavedPlan save(SavedPlan plan);

    /**
     * Deletes a saved plan.
     *
     * @param id Plan id
     * @return true if a plan was deleted
     */
    boolean deleteById(String id);
}
