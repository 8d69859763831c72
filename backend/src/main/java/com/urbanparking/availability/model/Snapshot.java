package com.urbanparking.availability.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, versioned set of bay states. A refresh always produces a new instance;
 * a published snapshot is never modified.
 */
@Getter
public final class Snapshot {

    private final long version;
    private final Instant capturedAt;
    private final List<Bay> bays;
    private final SortedSet<String> streets;

    @Getter(AccessLevel.NONE)
    private final Map<String, Bay> baysById;

    private Snapshot(long version, Instant capturedAt, List<Bay> bays, SortedSet<String> streets) {
        this.version = version;
        this.capturedAt = capturedAt;
        this.bays = bays;
        this.streets = streets;
        Map<String, Bay> index = new LinkedHashMap<>();
        for (Bay bay : bays) {
            if (index.putIfAbsent(bay.getBayId(), bay) != null) {
                throw new IllegalArgumentException("Duplicate bay id in snapshot: " + bay.getBayId());
            }
        }
        this.baysById = Collections.unmodifiableMap(index);
    }

    /**
     * Create a snapshot. Bays are copied and sorted by id; the declared street set is the
     * union of {@code declaredStreets} and the streets of the given bays.
     *
     * @throws IllegalArgumentException if two bays share an id
     */
    public static Snapshot of(long version, Instant capturedAt, Collection<Bay> bays,
                              Collection<String> declaredStreets) {
        List<Bay> sorted = new ArrayList<>(bays);
        sorted.sort(Comparator.comparing(Bay::getBayId));

        SortedSet<String> streets = new TreeSet<>();
        if (declaredStreets != null) {
            for (String street : declaredStreets) {
                if (street != null && !street.isBlank()) {
                    streets.add(street.trim());
                }
            }
        }
        for (Bay bay : sorted) {
            if (bay.hasStreet()) {
                streets.add(bay.getStreetName());
            }
        }
        return new Snapshot(version, capturedAt, Collections.unmodifiableList(sorted),
                Collections.unmodifiableSortedSet(streets));
    }

    public static Snapshot of(long version, Instant capturedAt, Collection<Bay> bays) {
        return of(version, capturedAt, bays, Collections.emptyList());
    }

    public static Snapshot empty() {
        return of(0L, Instant.EPOCH, Collections.emptyList());
    }

    public Optional<Bay> findBay(String bayId) {
        return Optional.ofNullable(baysById.get(bayId));
    }

    public int size() {
        return bays.size();
    }

    /**
     * Same bays and declared streets, ignoring version and capture time.
     */
    public boolean hasSameContentAs(Snapshot other) {
        return other != null && bays.equals(other.bays) && streets.equals(other.streets);
    }

    @Override
    public String toString() {
        return "Snapshot{version=" + version + ", capturedAt=" + capturedAt + ", bays=" + bays.size() + "}";
    }
}
