package com.urbanparking.availability.controller;

import com.urbanparking.availability.TestBays;
import com.urbanparking.availability.dto.NearbyResponse;
import com.urbanparking.availability.dto.NearbyResult;
import com.urbanparking.availability.dto.OverviewStats;
import com.urbanparking.availability.exception.InvalidQueryException;
import com.urbanparking.availability.exception.ResourceNotFoundException;
import com.urbanparking.availability.model.OccupancyState;
import com.urbanparking.availability.service.ParkingQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ParkingController.class)
class ParkingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ParkingQueryService parkingQueryService;

    @Test
    void nearbyReturnsRankedBays() throws Exception {
        NearbyResponse response = NearbyResponse.builder()
                .latitude(TestBays.CBD_LAT)
                .longitude(TestBays.CBD_LNG)
                .radiusMeters(100)
                .snapshotVersion(2)
                .results(List.of(new NearbyResult(
                        TestBays.bay("A", TestBays.CBD_LAT, TestBays.CBD_LNG, OccupancyState.AVAILABLE), 0)))
                .totalMatches(1)
                .build();
        when(parkingQueryService.findNearbyParking(TestBays.CBD_LAT, TestBays.CBD_LNG, 100, false, null))
                .thenReturn(response);

        mockMvc.perform(get("/api/parking/nearby")
                        .param("lat", String.valueOf(TestBays.CBD_LAT))
                        .param("lng", String.valueOf(TestBays.CBD_LNG))
                        .param("radius", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshotVersion", is(2)))
                .andExpect(jsonPath("$.results[0].bay.bayId", is("A")))
                .andExpect(jsonPath("$.truncated", is(false)));
    }

    @Test
    void nearbyDefaultsRadius() throws Exception {
        when(parkingQueryService.findNearbyParking(anyDouble(), anyDouble(), anyDouble(), anyBoolean(), isNull()))
                .thenReturn(NearbyResponse.builder().results(List.of()).build());

        mockMvc.perform(get("/api/parking/nearby").param("lat", "-37.81").param("lng", "144.96"))
                .andExpect(status().isOk());

        verify(parkingQueryService).findNearbyParking(-37.81, 144.96, 500, false, null);
    }

    @Test
    void missingCoordinateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/parking/nearby").param("lat", "-37.81"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Invalid Query")));
    }

    @Test
    void nonNumericCoordinateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/parking/nearby").param("lat", "north").param("lng", "144.96"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void invalidQueryIsBadRequest() throws Exception {
        when(parkingQueryService.findNearbyParking(-37.81, 144.96, 0, false, null))
                .thenThrow(new InvalidQueryException("Radius must be a positive number of meters, got 0.0"));

        mockMvc.perform(get("/api/parking/nearby")
                        .param("lat", "-37.81")
                        .param("lng", "144.96")
                        .param("radius", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Invalid Query")))
                .andExpect(jsonPath("$.message", is("Radius must be a positive number of meters, got 0.0")));
    }

    @Test
    void unknownBayIsNotFound() throws Exception {
        when(parkingQueryService.getBay("404")).thenThrow(new ResourceNotFoundException("Parking bay not found with id: 404"));

        mockMvc.perform(get("/api/parking/bays/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status", is(404)));
    }

    @Test
    void statsReturnOverview() throws Exception {
        when(parkingQueryService.getOverviewStats()).thenReturn(OverviewStats.builder()
                .totalBays(4)
                .availableBays(1)
                .occupiedBays(2)
                .unknownBays(1)
                .occupancyRatio(0.25)
                .snapshotVersion(3)
                .capturedAt(TestBays.CAPTURED_AT)
                .build());

        mockMvc.perform(get("/api/parking/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBays", is(4)))
                .andExpect(jsonPath("$.occupancyRatio", is(0.25)))
                .andExpect(jsonPath("$.capturedAt", is("2024-05-01T00:00:00Z")));
    }

    @Test
    void heatmapDefaultsCellSize() throws Exception {
        when(parkingQueryService.getHeatmap(200)).thenReturn(List.of());

        mockMvc.perform(get("/api/parking/heatmap"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()", is(0)));

        verify(parkingQueryService).getHeatmap(200);
    }

    @Test
    void unexpectedFailureIsServerError() throws Exception {
        when(parkingQueryService.getStreetsList(null)).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/parking/streets"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("System Error")));
    }
}
