package com.floorplan.positioning.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to make a plan image the active plan.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadPlanRequest {

    @NotBlank(message = "Plan name is required")
    @Size(max = 200, message = "Plan name must be at most 200 characters")
    private String name;

    @NotBlank(message = "File path is required")
    private String filePath;
}
