package com.bikeway.route.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "BoundingBox", description = "Geographic extent of a route or segment")
public class BoundingBoxDto {
    @Schema(description = "Minimum latitude", example = "37.6266")
    private double minLat;
    @Schema(description = "Minimum longitude", example = "127.0571")
    private double minLng;
    @Schema(description = "Maximum latitude", example = "37.6648")
    private double maxLat;
    @Schema(description = "Maximum longitude", example = "127.0767")
    private double maxLng;

    public static BoundingBoxDto empty() {
        return new BoundingBoxDto(0, 0, 0, 0);
    }

    /**
     * From the engine layout {@code [minLng, minLat, maxLng, maxLat]}.
     */
    public static BoundingBoxDto fromEngine(double[] bbox) {
        return new BoundingBoxDto(bbox[1], bbox[0], bbox[3], bbox[2]);
    }

    public BoundingBoxDto union(BoundingBoxDto other) {
        return new BoundingBoxDto(
                Math.min(minLat, other.minLat),
                Math.min(minLng, other.minLng),
                Math.max(maxLat, other.maxLat),
                Math.max(maxLng, other.maxLng));
    }
}
