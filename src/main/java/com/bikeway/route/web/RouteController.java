package com.bikeway.route.web;

import com.bikeway.route.model.domain.CategorizedPath;
import com.bikeway.route.model.dto.CircularRouteRequest;
import com.bikeway.route.model.dto.FullJourneyRequest;
import com.bikeway.route.model.dto.RouteResponse;
import com.bikeway.route.service.JourneyOrchestrationService;
import com.bikeway.route.service.RouteDetailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/routes")
@Tag(name = "Routes")
public class RouteController {

    private final JourneyOrchestrationService orchestrationService;
    private final RouteDetailService routeDetailService;

    public RouteController(JourneyOrchestrationService orchestrationService,
                           RouteDetailService routeDetailService) {
        this.orchestrationService = orchestrationService;
        this.routeDetailService = routeDetailService;
    }

    @PostMapping("/full-journey")
    @Operation(
            summary = "Plan a bike-share journey",
            description = "Walk to the nearest station, ride (through optional waypoints) and walk to the destination. "
                    + "A destination equal to the start plans a round trip through the waypoints."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Up to three itineraries, one per category",
                    content = @Content(schema = @Schema(implementation = RouteResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid coordinates or a round trip without waypoints"),
            @ApiResponse(responseCode = "422", description = "No bike station near start or destination")
    })
    public ResponseEntity<RouteResponse> fullJourney(
            @Valid @RequestBody
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "Journey points",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = FullJourneyRequest.class),
                            examples = {
                                    @ExampleObject(name = "Direct",
                                            value = "{\n  \"start\": { \"lat\": 37.626666, \"lng\": 127.076764 },\n  \"end\": { \"lat\": 37.664819, \"lng\": 127.057126 }\n}")
                            }
                    )
            ) FullJourneyRequest request) {
        return ResponseEntity.ok(orchestrationService.planJourney(request.toJourneyRequest()));
    }

    @PostMapping("/round-trip/recommend")
    @Operation(
            summary = "Recommend circular courses",
            description = "Circular rides of roughly the requested length, starting and ending at the nearest station"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Up to three courses; empty when none fits the distance",
                    content = @Content(schema = @Schema(implementation = RouteResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid coordinates or distance"),
            @ApiResponse(responseCode = "422", description = "No bike station near the start")
    })
    public ResponseEntity<RouteResponse> recommendCircular(@Valid @RequestBody CircularRouteRequest request) {
        return ResponseEntity.ok(orchestrationService.planJourney(request.toJourneyRequest()));
    }

    @PostMapping("/round-trip/search")
    @Operation(
            summary = "Plan an out-and-back ride",
            description = "Ride from the station nearest the start to the destination (through optional waypoints) "
                    + "and back to the same station"
    )
    public ResponseEntity<RouteResponse> outAndBack(@Valid @RequestBody FullJourneyRequest request) {
        return ResponseEntity.ok(orchestrationService.planOutAndBack(request.toJourneyRequest()));
    }

    @GetMapping("/{routeId}")
    @Operation(
            summary = "Route detail",
            description = "Full engine path behind a route id, including turn-by-turn instructions. "
                    + "Details are kept for a few minutes only."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Stored route",
                    content = @Content(schema = @Schema(implementation = CategorizedPath.class))),
            @ApiResponse(responseCode = "404", description = "Unknown or expired route id")
    })
    public ResponseEntity<CategorizedPath> routeDetail(
            @Parameter(description = "Route id from a planning response") @PathVariable String routeId) {
        return ResponseEntity.ok(routeDetailService.findRoute(routeId));
    }
}
