package com.urbanparking.availability.geo;

import com.urbanparking.availability.dto.NearbyResult;

import java.util.List;

/**
 * Read-only spatial structure over the bays of one snapshot.
 * Implementations are immutable once built and safe to share between threads.
 */
public interface SpatialIndex {

    /**
     * All bays whose great-circle distance to the point is at most {@code radiusMeters},
     * sorted by distance then bay id.
     */
    SpatialQueryResult queryRadius(double latitude, double longitude, double radiusMeters, QueryDeadline deadline);

    default List<NearbyResult> queryRadius(double latitude, double longitude, double radiusMeters) {
        return queryRadius(latitude, longitude, radiusMeters, QueryDeadline.none()).getMatches();
    }

    /**
     * The {@code k} bays closest to the point, no further than {@code maxRadiusMeters}.
     */
    SpatialQueryResult nearest(double latitude, double longitude, int k, double maxRadiusMeters,
                               QueryDeadline deadline);

    /** Number of bays held. */
    int size();

    /** Number of bays rejected while building because their coordinate was out of bounds. */
    int getDroppedCount();
}
