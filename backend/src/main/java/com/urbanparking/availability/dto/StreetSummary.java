package com.urbanparking.availability.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StreetSummary {
    String streetName;
    int totalBays;
    int availableBays;
    int occupiedBays;
    int unknownBays;

    // availableBays / totalBays, 0 when the street has no bays
    double occupancyRatio;
}
