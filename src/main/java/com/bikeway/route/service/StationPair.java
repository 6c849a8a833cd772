package com.bikeway.route.service;

import com.bikeway.route.model.domain.Station;

public record StationPair(Station startStation, Station endStation) {
}
