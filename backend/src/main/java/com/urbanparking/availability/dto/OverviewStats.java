package com.urbanparking.availability.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class OverviewStats {
    int totalBays;
    int availableBays;
    int occupiedBays;
    int unknownBays;

    // availableBays / totalBays, 0 when there are no bays
    double occupancyRatio;

    long snapshotVersion;
    Instant capturedAt;
}
