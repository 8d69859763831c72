package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.SnapshotAggregates;
import com.urbanparking.availability.geo.SpatialIndex;
import com.urbanparking.availability.model.Snapshot;
import lombok.Value;

/**
 * A snapshot together with the index and aggregates built from it. Published as one
 * unit so a reader never pairs the index of one version with the data of another.
 */
@Value
public class PublishedSnapshot {
    Snapshot snapshot;
    SpatialIndex index;
    SnapshotAggregates aggregates;

    public long getVersion() {
        return snapshot.getVersion();
    }
}
