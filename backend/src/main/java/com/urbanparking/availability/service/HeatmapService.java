package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.HeatmapCell;
import com.urbanparking.availability.exception.InvalidQueryException;
import com.urbanparking.availability.geo.BoundingRegion;
import com.urbanparking.availability.geo.GridProjection;
import com.urbanparking.availability.model.Bay;
import com.urbanparking.availability.model.Snapshot;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets the bays of a snapshot into a fixed grid anchored at the south-west corner of
 * the service region.
 */
@Service
@Slf4j
public class HeatmapService {

    public static final String CACHE_NAME = "heatmapCache";

    private final BoundingRegion region;
    private final double minCellSizeMeters;
    private final double maxCellSizeMeters;

    public HeatmapService(BoundingRegion region,
                          @Value("${parking.heatmap.min-cell-size-meters:25}") double minCellSizeMeters,
                          @Value("${parking.heatmap.max-cell-size-meters:5000}") double maxCellSizeMeters) {
        this.region = region;
        this.minCellSizeMeters = minCellSizeMeters;
        this.maxCellSizeMeters = maxCellSizeMeters;
    }

    /**
     * Build the density grid of a snapshot. Only non-empty cells are returned, ordered
     * by row then column. Cached per snapshot version and cell size.
     *
     * @param snapshot       snapshot to bucket
     * @param cellSizeMeters edge length of a cell
     * @return non-empty cells
     * @throws InvalidQueryException if the cell size is not finite or outside the allowed range
     */
    @Cacheable(value = CACHE_NAME, key = "{#snapshot.version, #cellSizeMeters}")
    public List<HeatmapCell> buildGrid(Snapshot snapshot, double cellSizeMeters) {
        if (!Double.isFinite(cellSizeMeters)
                || cellSizeMeters < minCellSizeMeters || cellSizeMeters > maxCellSizeMeters) {
            throw new InvalidQueryException(String.format(
                    "Cell size must be between %s and %s meters, got %s",
                    minCellSizeMeters, maxCellSizeMeters, cellSizeMeters));
        }

        GridProjection projection = new GridProjection(region, cellSizeMeters);
        Map<Long, int[]> counts = new HashMap<>();
        for (Bay bay : snapshot.getBays()) {
            long key = GridProjection.cellKey(projection.rowOf(bay.getLatitude()),
                    projection.columnOf(bay.getLongitude()));
            int[] tally = counts.computeIfAbsent(key, k -> new int[2]);
            tally[0]++;
            if (bay.isAvailable()) {
                tally[1]++;
            }
        }

        List<HeatmapCell> cells = new ArrayList<>(counts.size());
        for (Map.Entry<Long, int[]> entry : counts.entrySet()) {
            int row = GridProjection.rowOfKey(entry.getKey());
            int column = GridProjection.columnOfKey(entry.getKey());
            int bayCount = entry.getValue()[0];
            int availableCount = entry.getValue()[1];
            Envelope bounds = projection.cellEnvelope(row, column);
            cells.add(new HeatmapCell(
                    row,
                    column,
                    bayCount,
                    availableCount,
                    AggregationService.occupancyRatio(availableCount, bayCount),
                    new double[]{bounds.getMinX(), bounds.getMinY(), bounds.getMaxX(), bounds.getMaxY()},
                    new double[]{bounds.centre().x, bounds.centre().y}));
        }
        cells.sort(Comparator.comparingInt(HeatmapCell::getRow).thenComparingInt(HeatmapCell::getColumn));

        log.debug("Built heatmap for snapshot {} at {} m: {} cells", snapshot.getVersion(), cellSizeMeters, cells.size());
        return Collections.unmodifiableList(cells);
    }
}
