package com.bikeway.route.model.dto;

import com.bikeway.route.model.domain.Coordinate;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Coordinate", description = "Point coordinates")
public class CoordinateDto {
    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    @Schema(description = "Latitude", example = "37.626666")
    private Double lat;
    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    @Schema(description = "Longitude", example = "127.076764")
    private Double lng;

    public Coordinate toCoordinate() {
        return new Coordinate(lat, lng);
    }
}
