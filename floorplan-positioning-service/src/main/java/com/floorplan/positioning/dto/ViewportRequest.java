package com.floorplan.positioning.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Screen geometry and GPS fix for centering the plan on the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViewportRequest {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be at least -90")
    @DecimalMax(value = "90.0", message = "Latitude must be at most 90")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be at least -180")
    @DecimalMax(value = "180.0", message = "Longitude must be at most 180")
    private Double longitude;

    @NotNull(message = "Screen width is required")
    @Positive(message = "Screen width must be positive")
    private Double screenWidth;

    @NotNull(message = "Screen height is required")
    @Positive(message = "Screen height must be positive")
    private Double screenHeight;

    @NotNull(message = "Current scale is required")
    @Positive(message = "Current scale must be positive")
    private Double currentScale;

    /**
     * Whether to zoom to the configured visible width, or keep the current scale
     */
    private boolean zoom;
}
