package com.urbanparking.availability.controller;

import com.urbanparking.availability.dto.BayDTO;
import com.urbanparking.availability.dto.CurrentStatusResponse;
import com.urbanparking.availability.dto.HeatmapCell;
import com.urbanparking.availability.dto.NearbyResponse;
import com.urbanparking.availability.dto.OverviewStats;
import com.urbanparking.availability.dto.StreetSummary;
import com.urbanparking.availability.service.ParkingQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/parking")
@RequiredArgsConstructor
@Slf4j
public class ParkingController {

    private final ParkingQueryService parkingQueryService;

    @GetMapping("/test")
    public ResponseEntity<Map<String, Object>> testApi() {
        return ResponseEntity.ok(parkingQueryService.getEngineStatus());
    }

    /**
     * Current state of every bay, optionally limited to a bounding box.
     *
     * @param bounds optional "lat1,lng1,lat2,lng2"
     * @param limit  optional maximum number of bays
     */
    @GetMapping("/current")
    public ResponseEntity<CurrentStatusResponse> getCurrentStatus(
            @RequestParam(required = false) String bounds,
            @RequestParam(required = false) Integer limit) {
        log.info("Fetching current bay status, bounds: {}, limit: {}", bounds, limit);
        return ResponseEntity.ok(parkingQueryService.getCurrentStatus(bounds, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<OverviewStats> getOverviewStats() {
        log.info("Fetching overview statistics");
        return ResponseEntity.ok(parkingQueryService.getOverviewStats());
    }

    @GetMapping("/streets")
    public ResponseEntity<List<StreetSummary>> getStreetsList(
            @RequestParam(required = false) Integer limit) {
        log.info("Fetching street summaries, limit: {}", limit);
        return ResponseEntity.ok(parkingQueryService.getStreetsList(limit));
    }

    /**
     * Bays within a radius of a point, closest first.
     *
     * @param lat           latitude of the search centre
     * @param lng           longitude of the search centre
     * @param radius        search radius in metres
     * @param availableOnly only return bays that are currently free
     * @param timeoutMs     optional deadline; a late search returns what it found with timedOut set
     */
    @GetMapping("/nearby")
    public ResponseEntity<NearbyResponse> findNearbyParking(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(defaultValue = "500") double radius,
            @RequestParam(defaultValue = "false") boolean availableOnly,
            @RequestParam(required = false) Long timeoutMs) {
        log.info("Finding parking near ({}, {}) within {}m, availableOnly: {}", lat, lng, radius, availableOnly);
        return ResponseEntity.ok(parkingQueryService.findNearbyParking(lat, lng, radius, availableOnly, timeoutMs));
    }

    @GetMapping("/nearest")
    public ResponseEntity<NearbyResponse> findNearest(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(defaultValue = "5") int k,
            @RequestParam(required = false) Long timeoutMs) {
        log.info("Finding {} nearest bays to ({}, {})", k, lat, lng);
        return ResponseEntity.ok(parkingQueryService.findNearest(lat, lng, k, timeoutMs));
    }

    @GetMapping("/heatmap")
    public ResponseEntity<List<HeatmapCell>> getHeatmap(
            @RequestParam(defaultValue = "200") double cellSize) {
        log.info("Building occupancy heatmap with {}m cells", cellSize);
        return ResponseEntity.ok(parkingQueryService.getHeatmap(cellSize));
    }

    @GetMapping("/bays/{id}")
    public ResponseEntity<BayDTO> getBay(@PathVariable String id) {
        log.info("Fetching bay {}", id);
        return ResponseEntity.ok(parkingQueryService.getBay(id));
    }

    @GetMapping("/geojson")
    public ResponseEntity<Map<String, Object>> getCurrentStatusGeoJSON() {
        log.info("Fetching current bay status as GeoJSON");
        return ResponseEntity.ok(parkingQueryService.getCurrentStatusGeoJSON());
    }
}
