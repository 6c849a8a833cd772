package com.bikeway.route.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Geometry", description = "Ordered route coordinates as [lng, lat, elevation]")
public class GeometryDto {
    private List<double[]> points;
}
