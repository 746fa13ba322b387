package com.floorplan.positioning.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One GPS ↔ pixel reference pair as it travels over the API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationPointDto {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be at least -90")
    @DecimalMax(value = "90.0", message = "Latitude must be at most 90")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be at least -180")
    @DecimalMax(value = "180.0", message = "Longitude must be at most 180")
    private Double longitude;

    /**
     * Pixel column in the plan image's native resolution
     */
    @NotNull(message = "Pixel x is required")
    private Double pixelX;

    /**
     * Pixel row in the plan image's native resolution, growing downwards
     */
    @NotNull(message = "Pixel y is required")
    private Double pixelY;

    public CalibrationPoint toCalibrationPoint() {
        return CalibrationPoint.of(latitude, longitude, pixelX, pixelY);
    }

    public static CalibrationPointDto from(CalibrationPoint point) {
        return CalibrationPointDto.builder()
                .latitude(point.world().latitude())
                .longitude(point.world().longitude())
                .pixelX(point.pixel().x())
                .pixelY(point.pixel().y())
                .build();
    }
}
