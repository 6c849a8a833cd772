package com.bikeway.route.service;

import com.bikeway.route.model.domain.BikeProfile;
import com.bikeway.route.model.domain.RouteCategory;
import com.bikeway.route.model.domain.Station;
import com.bikeway.route.model.dto.BoundingBoxDto;
import com.bikeway.route.model.dto.GeometryDto;
import com.bikeway.route.model.dto.RouteDto;
import com.bikeway.route.model.dto.RouteSegmentDto;
import com.bikeway.route.model.dto.RouteStationDto;
import com.bikeway.route.model.dto.SegmentType;
import com.bikeway.route.model.dto.SummaryDto;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.bikeway.route.util.GeoMetrics;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Engine paths to API segments and itineraries.
 */
@Service
public class RouteConverterService {

    /**
     * Biking segments additionally carry the bike-road ratio (0..1), the steepest climb and the
     * average gradient; walking segments never do.
     */
    public RouteSegmentDto buildSegment(SegmentType type, GraphHopperPath path) {
        SummaryDto summary = SummaryDto.builder()
                .distance(path.getDistance())
                .time(Math.round(path.getTime() / 1000.0))
                .ascent(path.getAscend())
                .descent(path.getDescend())
                .build();

        RouteSegmentDto.RouteSegmentDtoBuilder segment = RouteSegmentDto.builder()
                .type(type)
                .summary(summary)
                .bbox(segmentBox(path))
                .geometry(new GeometryDto(path.coordinates()));

        if (type == SegmentType.BIKING) {
            summary.setBikeRoadRatio(JourneyTotals.roundTwoDecimals(GeoMetrics.bikeRoadRatio(path) / 100));
            summary.setMaxGradient(GeoMetrics.maxGradients(path).maxUphill());
            summary.setAverageGradient(GeoMetrics.averageGradient(path));
            segment.profile(BikeProfile.fromCode(path.getProfile()));
        }
        return segment.build();
    }

    public RouteSegmentDto walking(GraphHopperPath path) {
        return buildSegment(SegmentType.WALKING, path);
    }

    public RouteSegmentDto biking(GraphHopperPath path, Station startStation, Station endStation) {
        RouteSegmentDto segment = buildSegment(SegmentType.BIKING, path);
        segment.setStartStation(RouteStationDto.from(startStation));
        segment.setEndStation(RouteStationDto.from(endStation));
        return segment;
    }

    /**
     * Itinerary from segments and the paths they were built from, in the same order.
     * The itinerary box is the union of the segment boxes.
     */
    public RouteDto assemble(RouteCategory category, List<RouteSegmentDto> segments, List<GraphHopperPath> paths,
                             Station startStation, Station endStation) {
        if (segments.size() != paths.size()) {
            throw new IllegalArgumentException("Each segment needs its source path");
        }
        JourneyTotals totals = new JourneyTotals();
        for (int i = 0; i < segments.size(); i++) {
            totals.add(segments.get(i), paths.get(i));
        }

        return RouteDto.builder()
                .routeCategory(category)
                .summary(totals.toSummary())
                .bbox(segments.stream()
                        .map(RouteSegmentDto::getBbox)
                        .reduce(BoundingBoxDto::union)
                        .orElseGet(BoundingBoxDto::empty))
                .startStation(RouteStationDto.from(startStation))
                .endStation(RouteStationDto.from(endStation))
                .segments(List.copyOf(segments))
                .build();
    }

    private BoundingBoxDto segmentBox(GraphHopperPath path) {
        double[] bbox = path.getBbox();
        if (bbox != null && bbox.length == 4) {
            return BoundingBoxDto.fromEngine(bbox);
        }
        return GeoMetrics.boundingBox(List.of(path));
    }
}
