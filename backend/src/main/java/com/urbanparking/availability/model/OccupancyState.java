package com.urbanparking.availability.model;

import java.util.Locale;

/**
 * Occupancy of a single bay as last reported by its in-ground sensor.
 */
public enum OccupancyState {
    AVAILABLE,
    OCCUPIED,
    UNKNOWN;

    /**
     * Map the free-text status of the sensor feed onto a state.
     * "Unoccupied" and "Present" are the values the city feed actually reports.
     *
     * @param status raw status description, may be null
     * @return the matching state, {@link #UNKNOWN} when unrecognised
     */
    public static OccupancyState fromStatus(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "unoccupied":
            case "available":
                return AVAILABLE;
            case "present":
            case "occupied":
                return OCCUPIED;
            default:
                return UNKNOWN;
        }
    }
}
