package com.bikeway.route.service;

import com.bikeway.route.cache.RouteRecordStore;
import com.bikeway.route.client.GraphHopperClient;
import com.bikeway.route.config.RoutingProperties;
import com.bikeway.route.model.domain.CategorizedPath;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.RouteCategory;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.bikeway.route.support.TestPaths;
import com.bikeway.route.util.GeoMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RouteOptimizerServiceTest {

    private static final Coordinate START = new Coordinate(37.5, 127.0);
    private static final Coordinate END = new Coordinate(37.52, 127.03);

    @Mock
    private GraphHopperClient graphHopperClient;
    @Mock
    private RouteRecordStore routeRecordStore;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RoutingProperties properties;
    private RouteOptimizerService optimizer;

    @BeforeEach
    void setUp() {
        properties = new RoutingProperties();
        optimizer = new RouteOptimizerService(graphHopperClient, routeRecordStore, new RouteIdGenerator(),
                objectMapper, properties, Runnable::run);
    }

    @Test
    void diverseCandidatesFillAllThreeCategories() {
        GraphHopperPath safe = TestPaths.path(1500, 400_000, "safe_bike");
        GraphHopperPath shortFast = TestPaths.path(1000, 350_000, "fast_bike");
        GraphHopperPath quickFast = TestPaths.path(1200, 250_000, "fast_bike");

        List<CategorizedPath> result = optimizer.selectOptimal(List.of(shortFast, safe, quickFast));

        assertThat(result).extracting(CategorizedPath::getRouteCategory)
                .containsExactly(RouteCategory.BIKE_PRIORITY, RouteCategory.SHORTEST, RouteCategory.FASTEST);
        assertThat(result).extracting(CategorizedPath::getPath).containsExactly(safe, shortFast, quickFast);
        assertThat(result).extracting(CategorizedPath::getRouteId).doesNotHaveDuplicates().doesNotContainNull();
    }

    @Test
    void nearDuplicatesNeverFillTwoCategories() {
        GraphHopperPath safe = TestPaths.path(1000, 200_000, "safe_bike");
        GraphHopperPath twin = TestPaths.path(1005, 202_000, "fast_bike");

        List<CategorizedPath> result = optimizer.selectOptimal(List.of(safe, twin));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getRouteCategory()).isEqualTo(RouteCategory.BIKE_PRIORITY);
        assertThat(result.get(0).getPath()).isSameAs(safe);
    }

    @Test
    void noPairOfPicksIsSimilar() {
        List<GraphHopperPath> pool = List.of(
                TestPaths.path(1000, 200_000, "safe_bike"),
                TestPaths.path(1003, 201_000, "safe_bike"),
                TestPaths.path(1300, 180_000, "fast_bike"),
                TestPaths.path(1302, 181_000, "fast_bike"),
                TestPaths.path(950, 260_000, "fast_bike"));

        List<CategorizedPath> result = optimizer.selectOptimal(pool);

        for (int i = 0; i < result.size(); i++) {
            for (int j = i + 1; j < result.size(); j++) {
                assertThat(GeoMetrics.areSimilarPaths(result.get(i).getPath(), result.get(j).getPath())).isFalse();
            }
        }
        assertThat(result).hasSize(3);
    }

    @Test
    void bikePriorityFallsBackToFirstCandidateWithoutSafeProfile() {
        GraphHopperPath first = TestPaths.path(2000, 500_000, "fast_bike");
        GraphHopperPath second = TestPaths.path(1500, 300_000, "fast_bike");

        List<CategorizedPath> result = optimizer.selectOptimal(List.of(first, second));

        assertThat(result.get(0).getPath()).isSameAs(first);
        assertThat(result).extracting(CategorizedPath::getRouteCategory)
                .containsExactly(RouteCategory.BIKE_PRIORITY, RouteCategory.SHORTEST);
    }

    @Test
    void emptyPoolGivesNoRoutes() {
        assertThat(optimizer.selectOptimal(List.of())).isEmpty();
        verify(routeRecordStore, never()).save(anyString(), anyString());
    }

    @Test
    void everyPickIsStoredUnderItsRouteId() throws Exception {
        GraphHopperPath safe = TestPaths.path(1500, 400_000, "safe_bike");
        GraphHopperPath fast = TestPaths.path(1000, 250_000, "fast_bike");

        List<CategorizedPath> result = optimizer.selectOptimal(List.of(safe, fast));

        ArgumentCaptor<String> ids = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> bodies = ArgumentCaptor.forClass(String.class);
        verify(routeRecordStore, times(2)).save(ids.capture(), bodies.capture());
        assertThat(ids.getAllValues()).containsExactlyElementsOf(
                result.stream().map(CategorizedPath::getRouteId).toList());

        CategorizedPath stored = objectMapper.readValue(bodies.getAllValues().get(0), CategorizedPath.class);
        assertThat(stored.getRouteCategory()).isEqualTo(RouteCategory.BIKE_PRIORITY);
        assertThat(stored.getPath().getDistance()).isEqualTo(1500);
        assertThat(stored.getPath().getProfile()).isEqualTo("safe_bike");
    }

    @Test
    void storeFailureDoesNotAffectTheResult() {
        doThrow(new IllegalStateException("store down")).when(routeRecordStore).save(anyString(), anyString());

        List<CategorizedPath> result = optimizer.selectOptimal(List.of(TestPaths.path(1500, 400_000, "safe_bike")));

        assertThat(result).hasSize(1);
    }

    @Test
    void optimalRoutesSelectsFromMultiProfileCandidates() {
        when(graphHopperClient.multipleProfileRoutes(START, END)).thenReturn(List.of(
                TestPaths.path(1500, 400_000, "safe_bike"),
                TestPaths.path(1000, 350_000, "fast_bike")));

        assertThat(optimizer.optimalRoutes(START, END)).hasSize(2);
    }

    @Test
    void circularKeepsOnlyCandidatesInsideTheDistanceWindow() {
        GraphHopperPath tooShort = TestPaths.path(4400, 1_000_000, "safe_bike");
        GraphHopperPath lower = TestPaths.path(4600, 1_100_000, "fast_bike");
        GraphHopperPath upper = TestPaths.path(5200, 1_300_000, "safe_bike");
        when(graphHopperClient.circularRoutes(eq(START), eq(5000.0))).thenReturn(List.of(tooShort, lower, upper));

        List<CategorizedPath> result = optimizer.optimalCircularRoutes(START, 5000);

        assertThat(result).extracting(c -> c.getPath().getDistance()).containsExactlyInAnyOrder(4600.0, 5200.0);
        verify(graphHopperClient, times(properties.getCircular().getMaxAttempts())).circularRoutes(START, 5000.0);
    }

    @Test
    void circularStopsOnceEnoughDistinctCandidatesAreCollected() {
        when(graphHopperClient.circularRoutes(any(), eq(5000.0))).thenReturn(List.of(
                TestPaths.path(4600, 1_100_000, "fast_bike"),
                TestPaths.path(5000, 1_200_000, "safe_bike"),
                TestPaths.path(5200, 1_000_000, "fast_bike"),
                TestPaths.path(5400, 1_400_000, "safe_bike")));

        List<CategorizedPath> result = optimizer.optimalCircularRoutes(START, 5000);

        verify(graphHopperClient, times(1)).circularRoutes(START, 5000.0);
        assertThat(result).hasSize(3);
        assertThat(result).extracting(c -> c.getPath().getDistance()).doesNotContain(5400.0);
    }

    @Test
    void circularWithNothingInWindowIsEmptyNotAnError() {
        when(graphHopperClient.circularRoutes(any(), eq(5000.0)))
                .thenReturn(List.of(TestPaths.path(9000, 2_000_000, "safe_bike")));

        assertThat(optimizer.optimalCircularRoutes(START, 5000)).isEmpty();
    }
}
