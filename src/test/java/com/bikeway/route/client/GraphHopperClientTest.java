package com.bikeway.route.client;

import com.bikeway.route.config.RoutingProperties;
import com.bikeway.route.exception.NoRouteFoundException;
import com.bikeway.route.exception.RoutingEngineException;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphHopperClientTest {

    private static final Coordinate FROM = new Coordinate(37.5, 127.0);
    private static final Coordinate TO = new Coordinate(37.51, 127.01);

    private static final String TWO_PATHS = """
            {
              "paths": [
                {
                  "distance": 1520.4, "time": 361000, "ascend": 12.5, "descend": 8.0,
                  "points": {"type": "LineString", "coordinates": [[127.0, 37.5, 20.0], [127.01, 37.51, 24.5]]},
                  "bbox": [127.0, 37.5, 127.01, 37.51],
                  "instructions": [{"distance": 1520.4, "time": 361000, "text": "Continue", "sign": 0, "interval": [0, 1], "street_name": "Hwarang-ro"}],
                  "details": {"road_class": [[0, 1, "cycleway"]], "bike_network": [[0, 1, "lcn"]]}
                },
                {
                  "distance": 1610.0, "time": 340000, "ascend": 10.0, "descend": 6.0,
                  "points": {"type": "LineString", "coordinates": [[127.0, 37.5, 20.0], [127.01, 37.51, 22.0]]}
                }
              ],
              "info": {"took": 7}
            }
            """;

    private static final String NO_PATHS = "{\"paths\": [], \"info\": {\"took\": 1}}";

    private final Deque<Function<ClientRequest, Mono<ClientResponse>>> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new ArrayList<>();
    private GraphHopperClient client;

    @BeforeEach
    void setUp() {
        RoutingProperties properties = new RoutingProperties();
        properties.getEngine().setBaseUrl("http://engine.test:8989");

        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return responses.isEmpty()
                            ? Mono.just(json(NO_PATHS))
                            : responses.poll().apply(request);
                })
                .build();

        client = new GraphHopperClient(webClient, properties, new Random(42));
    }

    @Test
    void singleRoutePostsToRouteEndpointAndTagsProfile() {
        responses.add(request -> Mono.just(json(TWO_PATHS)));

        GraphHopperPath path = client.singleRoute(FROM, TO, "safe_bike");

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo("http://engine.test:8989/route");
        assertThat(path.getProfile()).isEqualTo("safe_bike");
        assertThat(path.getDistance()).isEqualTo(1520.4);
        assertThat(path.coordinates()).hasSize(2);
        assertThat(path.getDetails().getRoadClass().get(0).getValue()).isEqualTo("cycleway");
        assertThat(path.getInstructions().get(0).getStreetName()).isEqualTo("Hwarang-ro");
    }

    @Test
    void walkingRouteUsesConfiguredWalkingProfile() {
        responses.add(request -> Mono.just(json(TWO_PATHS)));

        assertThat(client.walkingRoute(FROM, TO).getProfile()).isEqualTo("foot");
    }

    @Test
    void emptyResultIsNoRouteFound() {
        responses.add(request -> Mono.just(json(NO_PATHS)));

        assertThatThrownBy(() -> client.singleRoute(FROM, TO, "fast_bike"))
                .isInstanceOf(NoRouteFoundException.class);
    }

    @Test
    void unreachableDestinationIsNoRouteFound() {
        responses.add(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"message\": \"Connection between locations not found\", \"hints\": []}")
                .build()));

        assertThatThrownBy(() -> client.singleRoute(FROM, TO, "safe_bike"))
                .isInstanceOf(NoRouteFoundException.class);
    }

    @Test
    void otherBadRequestStaysAnEngineFailure() {
        responses.add(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"message\": \"The requested profile 'safe_bike' does not exist\"}")
                .build()));

        assertThatThrownBy(() -> client.singleRoute(FROM, TO, "safe_bike"))
                .isInstanceOf(RoutingEngineException.class)
                .hasMessageContaining("400");
    }

    @Test
    void unreachableProfileIsSkippedInMultiProfileSearch() {
        responses.add(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"message\": \"Connection between locations not found\"}")
                .build()));
        responses.add(request -> Mono.just(json(TWO_PATHS)));

        List<GraphHopperPath> paths = client.multipleProfileRoutes(FROM, TO);

        assertThat(paths).extracting(GraphHopperPath::getProfile).containsOnly("fast_bike");
    }

    @Test
    void httpErrorIsRoutingEngineFailure() {
        responses.add(request -> Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"message\": \"boom\"}")
                .build()));

        assertThatThrownBy(() -> client.alternativeRoutes(FROM, TO, "safe_bike"))
                .isInstanceOf(RoutingEngineException.class)
                .hasMessageContaining("500");
    }

    @Test
    void transportErrorIsRoutingEngineFailure() {
        responses.add(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), request.method(), request.url(), request.headers())));

        assertThatThrownBy(() -> client.singleRoute(FROM, TO, "safe_bike"))
                .isInstanceOf(RoutingEngineException.class)
                .hasCauseInstanceOf(WebClientRequestException.class);
    }

    @Test
    void alternativesAreAllTaggedWithTheirProfile() {
        responses.add(request -> Mono.just(json(TWO_PATHS)));

        List<GraphHopperPath> paths = client.alternativeRoutes(FROM, TO, "fast_bike", 3);

        assertThat(paths).hasSize(2).allMatch(p -> "fast_bike".equals(p.getProfile()));
    }

    @Test
    void multipleProfileRoutesSkipsAFailingProfile() {
        responses.add(request -> Mono.just(json(TWO_PATHS)));
        responses.add(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build()));

        List<GraphHopperPath> paths = client.multipleProfileRoutes(FROM, TO);

        assertThat(requests).hasSize(2);
        assertThat(paths).hasSize(2).allMatch(p -> "safe_bike".equals(p.getProfile()));
    }

    @Test
    void multipleProfileRoutesConcatenatesInProfileOrder() {
        responses.add(request -> Mono.just(json(TWO_PATHS)));
        responses.add(request -> Mono.just(json(TWO_PATHS)));

        List<GraphHopperPath> paths = client.multipleProfileRoutes(FROM, TO);

        assertThat(paths).extracting(GraphHopperPath::getProfile)
                .containsExactly("safe_bike", "safe_bike", "fast_bike", "fast_bike");
    }

    @Test
    void circularRoutesToleratesEmptyAndFailingProfiles() {
        responses.add(request -> Mono.just(json(NO_PATHS)));
        responses.add(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), request.method(), request.url(), request.headers())));

        assertThat(client.circularRoutes(FROM, 5000)).isEmpty();
        assertThat(requests).hasSize(2);
    }

    @Test
    void circularRoutesCollectsBothProfiles() {
        responses.add(request -> Mono.just(json(TWO_PATHS)));
        responses.add(request -> Mono.just(json(TWO_PATHS)));

        List<GraphHopperPath> paths = client.circularRoutes(FROM, 5000);

        assertThat(paths).hasSize(4);
        assertThat(paths).filteredOn(p -> "fast_bike".equals(p.getProfile())).hasSize(2);
    }

    @Test
    void singleCircularRouteFailsHardWhenEmpty() {
        responses.add(request -> Mono.just(json(NO_PATHS)));

        assertThatThrownBy(() -> client.singleCircularRoute(FROM, "safe_bike", 3000))
                .isInstanceOf(NoRouteFoundException.class);
    }

    @Test
    void singleCircularRouteReturnsFirstPath() {
        responses.add(request -> Mono.just(json(TWO_PATHS)));

        GraphHopperPath path = client.singleCircularRoute(FROM, "fast_bike", 3000);

        assertThat(path.getDistance()).isEqualTo(1520.4);
        assertThat(path.getProfile()).isEqualTo("fast_bike");
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
