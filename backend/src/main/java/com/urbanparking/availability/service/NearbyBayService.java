package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.NearbyResponse;
import com.urbanparking.availability.dto.NearbyResult;
import com.urbanparking.availability.exception.InvalidQueryException;
import com.urbanparking.availability.geo.QueryDeadline;
import com.urbanparking.availability.geo.SpatialQueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Distance-ranked bay search over a published snapshot.
 *
 * Results are ordered strictly by distance; any availability-first ranking is left to
 * the caller.
 */
@Service
@Slf4j
public class NearbyBayService {

    private final int maxResults;
    private final double maxRadiusMeters;

    public NearbyBayService(@Value("${parking.nearby.max-results:20}") int maxResults,
                            @Value("${parking.nearby.max-radius-meters:5000}") double maxRadiusMeters) {
        this.maxResults = maxResults;
        this.maxRadiusMeters = maxRadiusMeters;
    }

    /**
     * Find bays within a radius of a point.
     *
     * @param state         published snapshot to search
     * @param latitude      query latitude
     * @param longitude     query longitude
     * @param radiusMeters  search radius, greater than zero
     * @param availableOnly restrict results to available bays
     * @param timeout       caller deadline, null for none
     * @return matches ascending by distance, capped at the configured maximum
     * @throws InvalidQueryException if the point or radius is invalid
     */
    public NearbyResponse findNearby(PublishedSnapshot state, double latitude, double longitude,
                                     double radiusMeters, boolean availableOnly, Duration timeout) {
        validatePoint(latitude, longitude);
        if (!Double.isFinite(radiusMeters) || radiusMeters <= 0) {
            throw new InvalidQueryException("Radius must be a positive number of meters, got " + radiusMeters);
        }
        if (radiusMeters > maxRadiusMeters) {
            throw new InvalidQueryException(String.format(
                    "Radius %s exceeds the maximum of %s meters", radiusMeters, maxRadiusMeters));
        }

        SpatialQueryResult found = state.getIndex()
                .queryRadius(latitude, longitude, radiusMeters, QueryDeadline.after(timeout));

        List<NearbyResult> matches = found.getMatches();
        if (availableOnly) {
            matches = matches.stream()
                    .filter(result -> result.getBay().isAvailable())
                    .collect(Collectors.toList());
        }

        boolean truncated = matches.size() > maxResults;
        List<NearbyResult> kept = truncated ? matches.subList(0, maxResults) : matches;
        if (!found.isComplete()) {
            log.warn("Nearby search at ({}, {}) r={} timed out after {} matches", latitude, longitude,
                    radiusMeters, matches.size());
        }

        return NearbyResponse.builder()
                .latitude(latitude)
                .longitude(longitude)
                .radiusMeters(radiusMeters)
                .snapshotVersion(state.getVersion())
                .results(Collections.unmodifiableList(kept))
                .totalMatches(matches.size())
                .truncated(truncated)
                .timedOut(!found.isComplete())
                .build();
    }

    /**
     * Find the {@code k} bays closest to a point, searching no further than the maximum radius.
     *
     * @throws InvalidQueryException if the point is invalid or k is outside [1, max results]
     */
    public NearbyResponse findNearest(PublishedSnapshot state, double latitude, double longitude, int k,
                                      Duration timeout) {
        validatePoint(latitude, longitude);
        if (k < 1 || k > maxResults) {
            throw new InvalidQueryException(String.format("k must be between 1 and %d, got %d", maxResults, k));
        }

        SpatialQueryResult found = state.getIndex()
                .nearest(latitude, longitude, k, maxRadiusMeters, QueryDeadline.after(timeout));

        return NearbyResponse.builder()
                .latitude(latitude)
                .longitude(longitude)
                .radiusMeters(maxRadiusMeters)
                .snapshotVersion(state.getVersion())
                .results(found.getMatches())
                .totalMatches(found.getMatches().size())
                .truncated(false)
                .timedOut(!found.isComplete())
                .build();
    }

    private static void validatePoint(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidQueryException("Latitude must be a finite value in [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidQueryException("Longitude must be a finite value in [-180, 180], got " + longitude);
        }
    }
}
