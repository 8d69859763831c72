package com.urbanparking.availability.dto;

import com.urbanparking.availability.model.Bay;
import lombok.Value;

import java.util.Comparator;

@Value
public class NearbyResult {

    /** Ascending distance, ties broken by bay id. */
    public static final Comparator<NearbyResult> BY_DISTANCE = Comparator
            .comparingDouble(NearbyResult::getDistanceMeters)
            .thenComparing(result -> result.getBay().getBayId());

    Bay bay;
    double distanceMeters;
}
