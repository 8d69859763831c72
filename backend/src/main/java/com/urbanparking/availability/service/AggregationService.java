package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.OverviewStats;
import com.urbanparking.availability.dto.SnapshotAggregates;
import com.urbanparking.availability.dto.StreetSummary;
import com.urbanparking.availability.model.Bay;
import com.urbanparking.availability.model.Snapshot;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Overview and per-street statistics of a snapshot. Stateless; the result depends on
 * nothing but the snapshot.
 */
@Service
public class AggregationService {

    /**
     * Share of available bays. Defined as 0 when there are no bays, never NaN.
     */
    public static double occupancyRatio(int available, int total) {
        return total > 0 ? (double) available / total : 0d;
    }

    /**
     * Aggregate a snapshot in a single pass over its bays.
     * Every street the snapshot declares gets a summary, including streets with no bays.
     *
     * @param snapshot snapshot to aggregate
     * @return overview statistics and street rollups keyed by street name
     */
    public SnapshotAggregates aggregate(Snapshot snapshot) {
        SortedMap<String, Tally> tallies = new TreeMap<>();
        for (String street : snapshot.getStreets()) {
            tallies.put(street, new Tally());
        }

        Tally overall = new Tally();
        for (Bay bay : snapshot.getBays()) {
            overall.add(bay);
            if (bay.hasStreet()) {
                tallies.computeIfAbsent(bay.getStreetName(), street -> new Tally()).add(bay);
            }
        }

        OverviewStats overview = OverviewStats.builder()
                .totalBays(overall.total)
                .availableBays(overall.available)
                .occupiedBays(overall.occupied)
                .unknownBays(overall.unknown)
                .occupancyRatio(occupancyRatio(overall.available, overall.total))
                .snapshotVersion(snapshot.getVersion())
                .capturedAt(snapshot.getCapturedAt())
                .build();

        SortedMap<String, StreetSummary> streets = new TreeMap<>();
        tallies.forEach((street, tally) -> streets.put(street, StreetSummary.builder()
                .streetName(street)
                .totalBays(tally.total)
                .availableBays(tally.available)
                .occupiedBays(tally.occupied)
                .unknownBays(tally.unknown)
                .occupancyRatio(occupancyRatio(tally.available, tally.total))
                .build()));

        return new SnapshotAggregates(overview, Collections.unmodifiableSortedMap(streets));
    }

    private static final class Tally {
        int total;
        int available;
        int occupied;
        int unknown;

        void add(Bay bay) {
            total++;
            switch (bay.getState()) {
                case AVAILABLE:
                    available++;
                    break;
                case OCCUPIED:
                    occupied++;
                    break;
                default:
                    unknown++;
                    break;
            }
        }
    }
}
