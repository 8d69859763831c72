package com.urbanparking.availability.geo;

import com.urbanparking.availability.dto.NearbyResult;
import com.urbanparking.availability.exception.InvalidCoordinateException;
import com.urbanparking.availability.model.Bay;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Fixed-cell grid over bay coordinates.
 *
 * Bays are bucketed by the (row, column) of a {@link GridProjection}. A radius query
 * visits only the cells of the window that can hold a match and filters candidates with
 * an exact haversine check. A nearest query walks rings of cells outward from the query
 * cell and stops as soon as no unvisited ring can beat the current k-th distance.
 */
@Slf4j
public final class GridSpatialIndex implements SpatialIndex {

    // meridian length of one degree on the spherical earth used by GeoDistance
    private static final double METERS_PER_DEGREE_ON_SPHERE =
            Math.toRadians(1d) * GeoDistance.EARTH_RADIUS_METERS;

    private final BoundingRegion region;
    private final GridProjection projection;
    private final Map<Long, List<Bay>> cells;
    private final int size;
    private final int droppedCount;

    // extent of occupied cells
    private final int minRow;
    private final int maxRow;
    private final int minColumn;
    private final int maxColumn;

    private GridSpatialIndex(BoundingRegion region, GridProjection projection, Map<Long, List<Bay>> cells,
                             int size, int droppedCount) {
        this.region = region;
        this.projection = projection;
        this.cells = cells;
        this.size = size;
        this.droppedCount = droppedCount;

        int rowLow = Integer.MAX_VALUE;
        int rowHigh = Integer.MIN_VALUE;
        int columnLow = Integer.MAX_VALUE;
        int columnHigh = Integer.MIN_VALUE;
        for (long key : cells.keySet()) {
            int row = GridProjection.rowOfKey(key);
            int column = GridProjection.columnOfKey(key);
            rowLow = Math.min(rowLow, row);
            rowHigh = Math.max(rowHigh, row);
            columnLow = Math.min(columnLow, column);
            columnHigh = Math.max(columnHigh, column);
        }
        this.minRow = rowLow;
        this.maxRow = rowHigh;
        this.minColumn = columnLow;
        this.maxColumn = columnHigh;
    }

    /**
     * Build an index over the given bays. A bay outside the region is dropped and logged
     * rather than failing the whole build.
     */
    public static GridSpatialIndex build(List<Bay> bays, BoundingRegion region, double cellSizeMeters) {
        GridProjection projection = new GridProjection(region, cellSizeMeters);
        Map<Long, List<Bay>> cells = new HashMap<>();
        int accepted = 0;
        int dropped = 0;

        for (Bay bay : bays) {
            try {
                region.requireContains(bay.getBayId(), bay.getLatitude(), bay.getLongitude());
            } catch (InvalidCoordinateException e) {
                log.warn("Dropping bay from spatial index: {}", e.getMessage());
                dropped++;
                continue;
            }
            long key = GridProjection.cellKey(projection.rowOf(bay.getLatitude()),
                    projection.columnOf(bay.getLongitude()));
            cells.computeIfAbsent(key, k -> new ArrayList<>()).add(bay);
            accepted++;
        }

        for (Map.Entry<Long, List<Bay>> entry : cells.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }

        log.debug("Built grid index: {} bays in {} cells of {} m, {} dropped",
                accepted, cells.size(), cellSizeMeters, dropped);
        return new GridSpatialIndex(region, projection, cells, accepted, dropped);
    }

    @Override
    public SpatialQueryResult queryRadius(double latitude, double longitude, double radiusMeters,
                                          QueryDeadline deadline) {
        if (cells.isEmpty() || !(radiusMeters >= 0) || !Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            return new SpatialQueryResult(Collections.emptyList(), true);
        }

        double latDelta = GeoDistance.metersToLatitudeDegrees(radiusMeters);
        double south = latitude - latDelta;
        double north = latitude + latDelta;
        double lngDelta = GeoDistance.metersToLongitudeDegrees(radiusMeters,
                Math.max(Math.abs(south), Math.abs(north)));

        int rowFrom = Math.max(minRow, projection.rowOf(south));
        int rowTo = Math.min(maxRow, projection.rowOf(north));
        int columnFrom;
        int columnTo;
        if (lngDelta >= 180d) {
            columnFrom = minColumn;
            columnTo = maxColumn;
        } else {
            columnFrom = Math.max(minColumn, projection.columnOf(longitude - lngDelta));
            columnTo = Math.min(maxColumn, projection.columnOf(longitude + lngDelta));
        }
        if (rowFrom > rowTo || columnFrom > columnTo) {
            return new SpatialQueryResult(Collections.emptyList(), true);
        }

        List<NearbyResult> matches = new ArrayList<>();
        boolean complete = true;
        long windowCells = (long) (rowTo - rowFrom + 1) * (columnTo - columnFrom + 1);

        if (windowCells > cells.size()) {
            // sparse grid relative to the window: walk the occupied cells instead
            for (Map.Entry<Long, List<Bay>> entry : cells.entrySet()) {
                if (deadline.isExpired()) {
                    complete = false;
                    break;
                }
                int row = GridProjection.rowOfKey(entry.getKey());
                int column = GridProjection.columnOfKey(entry.getKey());
                if (row >= rowFrom && row <= rowTo && column >= columnFrom && column <= columnTo) {
                    collectWithin(entry.getValue(), latitude, longitude, radiusMeters, matches);
                }
            }
        } else {
            scan:
            for (int row = rowFrom; row <= rowTo; row++) {
                for (int column = columnFrom; column <= columnTo; column++) {
                    if (deadline.isExpired()) {
                        complete = false;
                        break scan;
                    }
                    List<Bay> cell = cells.get(GridProjection.cellKey(row, column));
                    if (cell != null) {
                        collectWithin(cell, latitude, longitude, radiusMeters, matches);
                    }
                }
            }
        }

        matches.sort(NearbyResult.BY_DISTANCE);
        return new SpatialQueryResult(Collections.unmodifiableList(matches), complete);
    }

    @Override
    public SpatialQueryResult nearest(double latitude, double longitude, int k, double maxRadiusMeters,
                                      QueryDeadline deadline) {
        if (k <= 0 || cells.isEmpty() || !(maxRadiusMeters >= 0)
                || !Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            return new SpatialQueryResult(Collections.emptyList(), true);
        }

        // worst case: max-heap on the ordering, head is the current k-th best
        PriorityQueue<NearbyResult> best = new PriorityQueue<>(k + 1, NearbyResult.BY_DISTANCE.reversed());
        boolean complete = true;

        double ringMeters = minimumCellExtentMeters(latitude);
        int centerRow = projection.rowOf(latitude);
        int centerColumn = projection.columnOf(longitude);
        int ringsToExtent = Math.max(
                Math.max(Math.abs(centerRow - minRow), Math.abs(centerRow - maxRow)),
                Math.max(Math.abs(centerColumn - minColumn), Math.abs(centerColumn - maxColumn)));
        int ringsToRadius = (int) Math.min(Integer.MAX_VALUE - 1L, (long) Math.ceil(maxRadiusMeters / ringMeters) + 1);
        int maxRing = Math.min(ringsToExtent, ringsToRadius);
        long blockCells = (long) (2 * (long) maxRing + 1) * (2 * (long) maxRing + 1);

        if (blockCells > cells.size()) {
            for (List<Bay> cell : cells.values()) {
                if (deadline.isExpired()) {
                    complete = false;
                    break;
                }
                offerAll(cell, latitude, longitude, maxRadiusMeters, k, best);
            }
        } else {
            for (int ring = 0; ring <= maxRing; ring++) {
                if (deadline.isExpired()) {
                    complete = false;
                    break;
                }
                visitRing(centerRow, centerColumn, ring, latitude, longitude, maxRadiusMeters, k, best);

                // every bay not yet visited lies more than `ring` cells away on some axis
                double unvisitedLowerBound = ring * ringMeters;
                if (best.size() == k && best.peek().getDistanceMeters() <= unvisitedLowerBound) {
                    break;
                }
                if (unvisitedLowerBound > maxRadiusMeters) {
                    break;
                }
            }
        }

        List<NearbyResult> matches = new ArrayList<>(best);
        matches.sort(NearbyResult.BY_DISTANCE);
        return new SpatialQueryResult(Collections.unmodifiableList(matches), complete);
    }

    private void visitRing(int centerRow, int centerColumn, int ring, double latitude, double longitude,
                           double maxRadiusMeters, int k, PriorityQueue<NearbyResult> best) {
        if (ring == 0) {
            offerCell(centerRow, centerColumn, latitude, longitude, maxRadiusMeters, k, best);
            return;
        }
        int top = centerRow + ring;
        int bottom = centerRow - ring;
        int left = centerColumn - ring;
        int right = centerColumn + ring;

        int columnFrom = Math.max(left, minColumn);
        int columnTo = Math.min(right, maxColumn);
        for (int column = columnFrom; column <= columnTo; column++) {
            offerCell(top, column, latitude, longitude, maxRadiusMeters, k, best);
            offerCell(bottom, column, latitude, longitude, maxRadiusMeters, k, best);
        }
        int rowFrom = Math.max(bottom + 1, minRow);
        int rowTo = Math.min(top - 1, maxRow);
        for (int row = rowFrom; row <= rowTo; row++) {
            offerCell(row, left, latitude, longitude, maxRadiusMeters, k, best);
            offerCell(row, right, latitude, longitude, maxRadiusMeters, k, best);
        }
    }

    private void offerCell(int row, int column, double latitude, double longitude, double maxRadiusMeters,
                           int k, PriorityQueue<NearbyResult> best) {
        if (row < minRow || row > maxRow || column < minColumn || column > maxColumn) {
            return;
        }
        List<Bay> cell = cells.get(GridProjection.cellKey(row, column));
        if (cell != null) {
            offerAll(cell, latitude, longitude, maxRadiusMeters, k, best);
        }
    }

    private static void offerAll(List<Bay> bays, double latitude, double longitude, double maxRadiusMeters,
                                 int k, PriorityQueue<NearbyResult> best) {
        for (Bay bay : bays) {
            double distance = GeoDistance.haversineMeters(latitude, longitude, bay.getLatitude(), bay.getLongitude());
            if (distance > maxRadiusMeters) {
                continue;
            }
            NearbyResult candidate = new NearbyResult(bay, distance);
            if (best.size() < k) {
                best.add(candidate);
            } else if (NearbyResult.BY_DISTANCE.compare(candidate, best.peek()) < 0) {
                best.poll();
                best.add(candidate);
            }
        }
    }

    private static void collectWithin(List<Bay> bays, double latitude, double longitude, double radiusMeters,
                                      List<NearbyResult> out) {
        for (Bay bay : bays) {
            double distance = GeoDistance.haversineMeters(latitude, longitude, bay.getLatitude(), bay.getLongitude());
            if (distance <= radiusMeters) {
                out.add(new NearbyResult(bay, distance));
            }
        }
    }

    /**
     * Lower bound, in meters, on the height and width of any cell between the query
     * latitude and the indexed bays. Shrunk by 1% to absorb the spherical approximation.
     */
    private double minimumCellExtentMeters(double queryLatitude) {
        double maxAbsLatitude = Math.min(89.9, Math.max(region.getMaxAbsLatitude(), Math.abs(queryLatitude)));
        double height = projection.getLatStep() * METERS_PER_DEGREE_ON_SPHERE;
        double width = projection.getLngStep() * METERS_PER_DEGREE_ON_SPHERE * Math.cos(Math.toRadians(maxAbsLatitude));
        return Math.max(Math.min(height, width) * 0.99, 1e-6);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int getDroppedCount() {
        return droppedCount;
    }

    public int getCellCount() {
        return cells.size();
    }
}
