package com.urbanparking.availability.dto;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class CurrentStatusResponse {
    boolean success;
    long snapshotVersion;
    Instant capturedAt;
    int count;
    List<BayDTO> data;
}
