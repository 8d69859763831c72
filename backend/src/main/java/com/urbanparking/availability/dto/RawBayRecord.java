package com.urbanparking.availability.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the sensor feed, before validation. Field aliases accept the column names
 * used by the city's open data export. Coordinates and the timestamp are kept as text
 * so that one malformed value only costs its own record; they are parsed by
 * {@link com.urbanparking.availability.service.BayRecordNormalizer}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawBayRecord {

    @JsonAlias({"kerbside_id", "KerbsideID"})
    private String kerbsideId;

    @JsonAlias("Latitude")
    private String latitude;

    @JsonAlias("Longitude")
    private String longitude;

    @JsonAlias("status_description")
    private String status;

    @JsonAlias({"road_segment", "road_segment_description", "RoadSegment"})
    private String roadSegment;

    @JsonAlias("zone_number")
    private String zoneNumber;

    @JsonAlias({"status_timestamp", "lastupdated"})
    private String statusTimestamp;
}
