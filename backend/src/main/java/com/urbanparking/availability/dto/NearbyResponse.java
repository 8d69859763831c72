package com.urbanparking.availability.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NearbyResponse {
    double latitude;
    double longitude;
    double radiusMeters;
    long snapshotVersion;

    // ascending by distance, ties by bay id
    List<NearbyResult> results;

    // matches found before the result cap was applied
    int totalMatches;

    // more bays matched than the configured cap; the closest were kept
    boolean truncated;

    // the caller's deadline passed before the search finished
    boolean timedOut;
}
