package com.urbanparking.availability.geo;

import org.locationtech.jts.geom.Envelope;

/**
 * Fixed lat/lng tiling anchored at the south-west corner of a {@link BoundingRegion}.
 * A cell is a pure function of the coordinate, the cell size and the region, so the
 * same bay always lands in the same (row, column) for the same parameters.
 */
public final class GridProjection {

    private final double originLatitude;
    private final double originLongitude;
    private final double latStep;
    private final double lngStep;

    public GridProjection(BoundingRegion region, double cellSizeMeters) {
        if (!Double.isFinite(cellSizeMeters) || cellSizeMeters <= 0) {
            throw new IllegalArgumentException("Cell size must be a positive number of meters: " + cellSizeMeters);
        }
        this.originLatitude = region.getMinLatitude();
        this.originLongitude = region.getMinLongitude();
        this.latStep = cellSizeMeters / GeoDistance.METERS_PER_DEGREE;
        this.lngStep = cellSizeMeters
                / (GeoDistance.METERS_PER_DEGREE * Math.cos(Math.toRadians(region.getCenterLatitude())));
    }

    public int rowOf(double latitude) {
        return (int) Math.floor((latitude - originLatitude) / latStep);
    }

    public int columnOf(double longitude) {
        return (int) Math.floor((longitude - originLongitude) / lngStep);
    }

    /** Cell bounds, x = longitude and y = latitude. */
    public Envelope cellEnvelope(int row, int column) {
        double south = originLatitude + row * latStep;
        double west = originLongitude + column * lngStep;
        return new Envelope(west, west + lngStep, south, south + latStep);
    }

    public double getLatStep() {
        return latStep;
    }

    public double getLngStep() {
        return lngStep;
    }

    /** Packs a (row, column) pair into one map key. */
    public static long cellKey(int row, int column) {
        return ((long) row << 32) | (column & 0xffffffffL);
    }

    public static int rowOfKey(long key) {
        return (int) (key >> 32);
    }

    public static int columnOfKey(long key) {
        return (int) key;
    }
}
