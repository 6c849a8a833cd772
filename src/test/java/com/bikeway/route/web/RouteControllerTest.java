package com.bikeway.route.web;

import com.bikeway.route.exception.NoRouteFoundException;
import com.bikeway.route.exception.RouteRecordNotFoundException;
import com.bikeway.route.exception.RoutingEngineException;
import com.bikeway.route.exception.StationUnavailableException;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.JourneyRequest;
import com.bikeway.route.model.domain.RouteCategory;
import com.bikeway.route.model.dto.RouteDto;
import com.bikeway.route.model.dto.RouteResponse;
import com.bikeway.route.model.dto.SummaryDto;
import com.bikeway.route.service.JourneyOrchestrationService;
import com.bikeway.route.service.RouteDetailService;
import com.bikeway.route.support.TestPaths;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RouteController.class)
class RouteControllerTest {

    private static final String DIRECT_BODY = """
            {
              "start": { "lat": 37.626666, "lng": 127.076764 },
              "end": { "lat": 37.664819, "lng": 127.057126 }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JourneyOrchestrationService orchestrationService;

    @MockBean
    private RouteDetailService routeDetailService;

    private static RouteResponse oneRoute() {
        RouteDto route = RouteDto.builder()
                .routeCategory(RouteCategory.BIKE_PRIORITY)
                .routeId("abc-12345678")
                .summary(SummaryDto.builder().distance(4235.7).time(1012).bikeRoadRatio(0.78).build())
                .segments(List.of())
                .build();
        return RouteResponse.builder().routes(List.of(route)).processingTime(42).build();
    }

    @Test
    void plansFullJourney() throws Exception {
        when(orchestrationService.planJourney(any())).thenReturn(oneRoute());

        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DIRECT_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routes[0].routeCategory").value("bike_priority"))
                .andExpect(jsonPath("$.routes[0].routeId").value("abc-12345678"))
                .andExpect(jsonPath("$.routes[0].summary.bikeRoadRatio").value(0.78))
                .andExpect(jsonPath("$.processingTime").value(42));

        ArgumentCaptor<JourneyRequest> request = ArgumentCaptor.forClass(JourneyRequest.class);
        verify(orchestrationService).planJourney(request.capture());
        assertThat(request.getValue().start()).isEqualTo(new Coordinate(37.626666, 127.076764));
        assertThat(request.getValue().waypointsOrEmpty()).isEmpty();
    }

    @Test
    void rejectsOutOfRangeLatitude() throws Exception {
        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "start": { "lat": 91.0, "lng": 127.0 },
                                  "end": { "lat": 37.6, "lng": 127.0 }
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.violations[0].field").value("start.lat"));

        verifyNoInteractions(orchestrationService);
    }

    @Test
    void rejectsMoreThanThreeWaypoints() throws Exception {
        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "start": { "lat": 37.5, "lng": 127.0 },
                                  "end": { "lat": 37.6, "lng": 127.1 },
                                  "waypoints": [
                                    { "lat": 37.51, "lng": 127.01 },
                                    { "lat": 37.52, "lng": 127.02 },
                                    { "lat": 37.53, "lng": 127.03 },
                                    { "lat": 37.54, "lng": 127.04 }
                                  ]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.violations[0].field").value("waypoints"));
    }

    @Test
    void malformedBodyIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"start\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void missingStationIsUnprocessable() throws Exception {
        when(orchestrationService.planJourney(any()))
                .thenThrow(new StationUnavailableException("start", new Coordinate(37.626666, 127.076764)));

        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DIRECT_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("STATION_UNAVAILABLE"))
                .andExpect(jsonPath("$.path").value("uri=/api/routes/full-journey"));
    }

    @Test
    void noRouteIsNotFound() throws Exception {
        when(orchestrationService.planJourney(any())).thenThrow(new NoRouteFoundException("No bike route"));

        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DIRECT_BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NO_ROUTE_FOUND"));
    }

    @Test
    void engineOutageIsServiceUnavailable() throws Exception {
        when(orchestrationService.planJourney(any()))
                .thenThrow(new RoutingEngineException("Routing engine is unreachable", new RuntimeException("refused")));

        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DIRECT_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("ROUTING_ENGINE_ERROR"));
    }

    @Test
    void unexpectedFailureHidesDetails() throws Exception {
        when(orchestrationService.planJourney(any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/routes/full-journey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DIRECT_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("Unexpected error while planning the route"));
    }

    @Test
    void circularDistanceOutOfRangeIsRejected() throws Exception {
        mockMvc.perform(post("/api/routes/round-trip/recommend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "start": { "lat": 37.5, "lng": 127.0 }, "targetDistance": 50 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.violations[0].field").value("targetDistance"));
    }

    @Test
    void recommendsCircularCourses() throws Exception {
        when(orchestrationService.planJourney(any()))
                .thenReturn(RouteResponse.builder().routes(List.of()).processingTime(5).build());

        mockMvc.perform(post("/api/routes/round-trip/recommend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "start": { "lat": 37.5, "lng": 127.0 }, "targetDistance": 5000 }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routes").isEmpty());

        ArgumentCaptor<JourneyRequest> request = ArgumentCaptor.forClass(JourneyRequest.class);
        verify(orchestrationService).planJourney(request.capture());
        assertThat(request.getValue().end()).isNull();
        assertThat(request.getValue().targetDistance()).isEqualTo(5000.0);
    }

    @Test
    void searchesOutAndBack() throws Exception {
        when(orchestrationService.planOutAndBack(any())).thenReturn(oneRoute());

        mockMvc.perform(post("/api/routes/round-trip/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DIRECT_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routes.length()").value(1));
    }

    @Test
    void returnsStoredRouteDetail() throws Exception {
        when(routeDetailService.findRoute("abc-12345678")).thenReturn(TestPaths.categorized(
                TestPaths.path(5200, 1_200_000, "safe_bike"), RouteCategory.BIKE_PRIORITY, "abc-12345678"));

        mockMvc.perform(get("/api/routes/abc-12345678"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routeId").value("abc-12345678"))
                .andExpect(jsonPath("$.routeCategory").value("bike_priority"))
                .andExpect(jsonPath("$.distance").value(5200.0))
                .andExpect(jsonPath("$.profile").value("safe_bike"));
    }

    @Test
    void expiredRouteIsNotFound() throws Exception {
        when(routeDetailService.findRoute("gone")).thenThrow(new RouteRecordNotFoundException("gone"));

        mockMvc.perform(get("/api/routes/gone"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ROUTE_EXPIRED"));
    }
}
