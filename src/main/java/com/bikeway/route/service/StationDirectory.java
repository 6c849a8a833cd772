package com.bikeway.route.service;

import com.bikeway.route.model.domain.Station;

import java.util.List;

/**
 * Source of bike-share station data.
 */
public interface StationDirectory {

    /**
     * Stations around the point that currently have bikes, nearest first, availability already refreshed.
     */
    List<Station> findNearbyStations(double lat, double lng);

    /**
     * Raw inventory without any availability refresh.
     */
    List<Station> findAll();
}
