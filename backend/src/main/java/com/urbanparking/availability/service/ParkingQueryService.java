package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.BayDTO;
import com.urbanparking.availability.dto.CurrentStatusResponse;
import com.urbanparking.availability.dto.HeatmapCell;
import com.urbanparking.availability.dto.NearbyResponse;
import com.urbanparking.availability.dto.OverviewStats;
import com.urbanparking.availability.dto.StreetSummary;
import com.urbanparking.availability.exception.InvalidQueryException;
import com.urbanparking.availability.exception.ResourceNotFoundException;
import com.urbanparking.availability.model.Bay;
import com.urbanparking.availability.model.Snapshot;
import com.urbanparking.availability.util.GeoJSONConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of the engine. Each call reads the published state exactly once, so a
 * concurrent refresh can never mix two versions into one answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkingQueryService {

    private static final Comparator<StreetSummary> BUSIEST_FIRST = Comparator
            .comparingInt(StreetSummary::getTotalBays).reversed()
            .thenComparing(StreetSummary::getStreetName);

    private final RefreshCoordinator refreshCoordinator;
    private final NearbyBayService nearbyBayService;
    private final HeatmapService heatmapService;

    /**
     * Get current bay states, optionally limited to a bounding box and a maximum count
     *
     * @param bounds "lat1,lng1,lat2,lng2" in any corner order, or null for the whole region
     * @param limit  maximum number of bays, or null for all
     * @return bays of the current snapshot ordered by id
     * @throws InvalidQueryException if the bounds or limit are malformed
     */
    public CurrentStatusResponse getCurrentStatus(String bounds, Integer limit) {
        Envelope window = parseBounds(bounds);
        if (limit != null && limit <= 0) {
            throw new InvalidQueryException("Limit must be positive, got " + limit);
        }

        Snapshot snapshot = refreshCoordinator.current().getSnapshot();
        List<BayDTO> bays = new ArrayList<>();
        for (Bay bay : snapshot.getBays()) {
            if (limit != null && bays.size() >= limit) {
                break;
            }
            if (window == null || window.covers(new Coordinate(bay.getLongitude(), bay.getLatitude()))) {
                bays.add(GeoJSONConverter.convertToDTO(bay));
            }
        }
        return new CurrentStatusResponse(true, snapshot.getVersion(), snapshot.getCapturedAt(), bays.size(), bays);
    }

    public OverviewStats getOverviewStats() {
        return refreshCoordinator.current().getAggregates().getOverview();
    }

    /**
     * Street rollups ordered by bay count descending, then by name
     *
     * @param limit maximum number of streets, or null for all
     */
    public List<StreetSummary> getStreetsList(Integer limit) {
        if (limit != null && limit <= 0) {
            throw new InvalidQueryException("Limit must be positive, got " + limit);
        }
        return refreshCoordinator.current().getAggregates().getStreets().values().stream()
                .sorted(BUSIEST_FIRST)
                .limit(limit != null ? limit : Long.MAX_VALUE)
                .collect(Collectors.toList());
    }

    public NearbyResponse findNearbyParking(double latitude, double longitude, double radiusMeters,
                                            boolean availableOnly, Long timeoutMillis) {
        return nearbyBayService.findNearby(refreshCoordinator.current(), latitude, longitude, radiusMeters,
                availableOnly, toTimeout(timeoutMillis));
    }

    public NearbyResponse findNearest(double latitude, double longitude, int k, Long timeoutMillis) {
        return nearbyBayService.findNearest(refreshCoordinator.current(), latitude, longitude, k,
                toTimeout(timeoutMillis));
    }

    public List<HeatmapCell> getHeatmap(double cellSizeMeters) {
        // whole meters, so near-identical sizes share one cache entry
        double cellSize = Double.isFinite(cellSizeMeters) ? Math.rint(cellSizeMeters) : cellSizeMeters;
        return heatmapService.buildGrid(refreshCoordinator.current().getSnapshot(), cellSize);
    }

    /**
     * @throws ResourceNotFoundException if the current snapshot has no bay with this id
     */
    public BayDTO getBay(String bayId) {
        return refreshCoordinator.current().getSnapshot().findBay(bayId)
                .map(GeoJSONConverter::convertToDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Parking bay not found with id: " + bayId));
    }

    public Map<String, Object> getCurrentStatusGeoJSON() {
        Snapshot snapshot = refreshCoordinator.current().getSnapshot();
        return GeoJSONConverter.convertToGeoJSON(snapshot.getBays(), snapshot.getVersion());
    }

    public Map<String, Object> getEngineStatus() {
        PublishedSnapshot state = refreshCoordinator.current();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "API is working");
        status.put("snapshotVersion", state.getVersion());
        status.put("capturedAt", state.getSnapshot().getCapturedAt());
        status.put("parkingBaysCount", state.getSnapshot().size());
        status.put("streetCount", state.getSnapshot().getStreets().size());
        return status;
    }

    private static Duration toTimeout(Long timeoutMillis) {
        if (timeoutMillis == null) {
            return null;
        }
        if (timeoutMillis < 0) {
            throw new InvalidQueryException("Timeout must not be negative, got " + timeoutMillis);
        }
        return Duration.ofMillis(timeoutMillis);
    }

    static Envelope parseBounds(String bounds) {
        if (bounds == null || bounds.isBlank()) {
            return null;
        }
        String[] parts = bounds.split(",");
        if (parts.length != 4) {
            throw new InvalidQueryException("Bounds must be lat1,lng1,lat2,lng2, got " + bounds);
        }
        double[] values = new double[4];
        for (int i = 0; i < 4; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new InvalidQueryException("Bounds must be numeric, got " + bounds, e);
            }
            if (!Double.isFinite(values[i])) {
                throw new InvalidQueryException("Bounds must be finite, got " + bounds);
            }
        }
        // x = longitude, y = latitude
        return new Envelope(values[1], values[3], values[0], values[2]);
    }
}
