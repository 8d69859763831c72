package com.urbanparking.availability.geo;

import com.urbanparking.availability.dto.NearbyResult;
import lombok.Value;

import java.util.List;

@Value
public class SpatialQueryResult {
    // sorted by NearbyResult.BY_DISTANCE
    List<NearbyResult> matches;

    // false when the deadline passed before every candidate cell was scanned
    boolean complete;
}
