package com.urbanparking.availability.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Bay {
    @NonNull
    String bayId;

    double latitude;
    double longitude;

    // null when the feed carries no road segment for the bay
    String streetName;

    @NonNull
    OccupancyState state;

    Instant lastUpdated;

    String zoneNumber;

    public boolean isAvailable() {
        return state == OccupancyState.AVAILABLE;
    }

    public boolean hasStreet() {
        return streetName != null && !streetName.isBlank();
    }
}
