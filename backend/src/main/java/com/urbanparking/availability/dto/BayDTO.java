package com.urbanparking.availability.dto;

import lombok.Data;

import java.time.Instant;

@Data
public class BayDTO {
    private String kerbsideId;
    private double latitude;
    private double longitude;
    private String status;
    private String roadSegment;
    private String zoneNumber;
    private Instant lastUpdated;
}
