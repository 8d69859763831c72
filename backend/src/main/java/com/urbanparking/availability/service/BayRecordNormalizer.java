package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.RawBayRecord;
import com.urbanparking.availability.exception.IngestException;
import com.urbanparking.availability.exception.InvalidCoordinateException;
import com.urbanparking.availability.geo.BoundingRegion;
import com.urbanparking.availability.model.Bay;
import com.urbanparking.availability.model.OccupancyState;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns raw feed records into validated bays. A bad record is dropped and counted;
 * it never fails the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BayRecordNormalizer {

    private static final DateTimeFormatter CITY_EXPORT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            text -> LocalDateTime.parse(text, CITY_EXPORT_TIMESTAMP).toInstant(ZoneOffset.UTC));

    private final BoundingRegion region;

    @Value
    public static class NormalizedBatch {
        List<Bay> bays;
        int droppedCount;
        int duplicateCount;
    }

    public NormalizedBatch normalize(List<RawBayRecord> records) {
        Map<String, Bay> byId = new LinkedHashMap<>();
        int dropped = 0;
        int duplicates = 0;

        for (int i = 0; i < records.size(); i++) {
            Bay bay;
            try {
                bay = toBay(records.get(i));
            } catch (IngestException | InvalidCoordinateException e) {
                log.warn("Skipped invalid bay record #{}: {}", i, e.getMessage());
                dropped++;
                continue;
            }

            Bay existing = byId.get(bay.getBayId());
            if (existing != null) {
                duplicates++;
                if (isOlder(bay.getLastUpdated(), existing.getLastUpdated())) {
                    continue;
                }
            }
            byId.put(bay.getBayId(), bay);
        }

        if (duplicates > 0) {
            log.warn("Collapsed {} duplicate bay records, keeping the latest status of each bay", duplicates);
        }
        return new NormalizedBatch(Collections.unmodifiableList(new ArrayList<>(byId.values())), dropped, duplicates);
    }

    /**
     * @throws IngestException             if the record lacks an id or a readable, finite coordinate
     * @throws InvalidCoordinateException  if the coordinate lies outside the service region
     */
    Bay toBay(RawBayRecord record) {
        if (record == null) {
            throw new IngestException("Record is null");
        }
        String bayId = record.getKerbsideId() != null ? record.getKerbsideId().trim() : "";
        if (bayId.isEmpty()) {
            throw new IngestException("Record has no kerbside id");
        }
        double latitude = parseCoordinate(bayId, "latitude", record.getLatitude());
        double longitude = parseCoordinate(bayId, "longitude", record.getLongitude());
        region.requireContains(bayId, latitude, longitude);

        return Bay.builder()
                .bayId(bayId)
                .latitude(latitude)
                .longitude(longitude)
                .streetName(trimToNull(record.getRoadSegment()))
                .state(OccupancyState.fromStatus(record.getStatus()))
                .lastUpdated(parseTimestamp(bayId, record.getStatusTimestamp()))
                .zoneNumber(trimToNull(record.getZoneNumber()))
                .build();
    }

    private static double parseCoordinate(String bayId, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IngestException(String.format("Bay %s has no %s", bayId, field));
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IngestException(String.format("Bay %s has an unreadable %s '%s'", bayId, field, value), e);
        }
        if (!Double.isFinite(parsed)) {
            throw new IngestException(String.format("Bay %s has a non-finite %s '%s'", bayId, field, value));
        }
        return parsed;
    }

    /**
     * ISO instants and offsets are taken as given; local date-times, as the city export
     * writes them, are read as UTC. Anything else leaves the timestamp unknown.
     */
    static Instant parseTimestamp(String bayId, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("Ignoring unreadable status timestamp '{}' of bay {}: {}", value, bayId, lastError.getMessage());
        return null;
    }

    // a missing timestamp counts as older than any real one; ties go to the later record
    private static boolean isOlder(Instant candidate, Instant current) {
        if (candidate == null) {
            return current != null;
        }
        return current != null && candidate.isBefore(current);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
