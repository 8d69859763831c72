package com.urbanparking.availability.dto;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One non-empty cell of the density grid, used by the dashboard heatmap layer.
 */
@Value
@AllArgsConstructor
public class HeatmapCell {
    int row;
    int column;
    int bayCount;
    int availableCount;

    // availableCount / bayCount
    double occupancyRatio;

    // [west, south, east, north]
    double[] bounds;

    // [longitude, latitude], GeoJSON order
    double[] center;
}
