package com.urbanparking.availability.dto;

import lombok.Value;

import java.util.SortedMap;

/**
 * Statistics derived from one snapshot, computed once when the snapshot is built.
 */
@Value
public class SnapshotAggregates {
    OverviewStats overview;

    // keyed and ordered by street name
    SortedMap<String, StreetSummary> streets;
}
