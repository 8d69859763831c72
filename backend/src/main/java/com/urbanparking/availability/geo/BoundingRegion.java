package com.urbanparking.availability.geo;

import com.urbanparking.availability.exception.InvalidCoordinateException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * The service area. Bay coordinates outside it are rejected at build time.
 * Wraps a JTS {@link Envelope} with x = longitude, y = latitude.
 */
public final class BoundingRegion {

    private final Envelope envelope;

    public BoundingRegion(double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {
        if (!(minLatitude < maxLatitude) || !(minLongitude < maxLongitude)) {
            throw new IllegalArgumentException(String.format(
                    "Invalid bounding region: lat [%s, %s], lng [%s, %s]",
                    minLatitude, maxLatitude, minLongitude, maxLongitude));
        }
        if (minLatitude < -90 || maxLatitude > 90 || minLongitude < -180 || maxLongitude > 180) {
            throw new IllegalArgumentException("Bounding region exceeds valid latitude/longitude range");
        }
        this.envelope = new Envelope(minLongitude, maxLongitude, minLatitude, maxLatitude);
    }

    public boolean contains(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && envelope.covers(new Coordinate(longitude, latitude));
    }

    /**
     * @throws InvalidCoordinateException if the point is not finite or lies outside the region
     */
    public void requireContains(String bayId, double latitude, double longitude) {
        if (!contains(latitude, longitude)) {
            throw new InvalidCoordinateException(String.format(
                    "Bay %s at (%s, %s) is outside the service region %s", bayId, latitude, longitude, this));
        }
    }

    public double getMinLatitude() {
        return envelope.getMinY();
    }

    public double getMaxLatitude() {
        return envelope.getMaxY();
    }

    public double getMinLongitude() {
        return envelope.getMinX();
    }

    public double getMaxLongitude() {
        return envelope.getMaxX();
    }

    public double getCenterLatitude() {
        return envelope.centre().y;
    }

    /** Largest absolute latitude in the region, where a degree of longitude is shortest. */
    public double getMaxAbsLatitude() {
        return Math.max(Math.abs(getMinLatitude()), Math.abs(getMaxLatitude()));
    }

    @Override
    public String toString() {
        return String.format("[lat(%.4f,%.4f) lng(%.4f,%.4f)]",
                getMinLatitude(), getMaxLatitude(), getMinLongitude(), getMaxLongitude());
    }
}
