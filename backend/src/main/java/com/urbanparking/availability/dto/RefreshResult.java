package com.urbanparking.availability.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RefreshResult {
    long version;
    int acceptedCount;

    // records rejected as malformed or out of bounds
    int droppedCount;

    // records superseded by a newer record for the same bay
    int duplicateCount;

    Instant capturedAt;
    long buildMillis;
}
