package com.urbanparking.availability;

import com.github.benmanes.caffeine.cache.Cache;
import com.urbanparking.availability.service.HeatmapService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Refresh and query through the full application context.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ParkingAvailabilityApplicationTest {

    private static final String FEED = "{\"records\":["
            + "{\"kerbside_id\":\"A\",\"latitude\":-37.8136,\"longitude\":144.9631,"
            + "\"status_description\":\"Unoccupied\",\"road_segment\":\"Swanston St\"},"
            + "{\"kerbside_id\":\"B\",\"latitude\":-37.8091,\"longitude\":144.9631,"
            + "\"status_description\":\"Present\",\"road_segment\":\"Swanston St\"}],"
            + "\"streets\":[\"Collins St\"]}";

    private static final String OUT_OF_REGION = "{\"records\":["
            + "{\"kerbside_id\":\"S\",\"latitude\":-33.8688,\"longitude\":151.2093,\"status_description\":\"Present\"}]}";

    private static final String UNEVEN_FEED = "{\"records\":["
            + "{\"kerbside_id\":\"A\",\"latitude\":-37.8136,\"longitude\":144.9631,\"status_description\":\"Present\"},"
            + "{\"kerbside_id\":\"B\",\"latitude\":\"-37.8091\",\"longitude\":\"144.9631\","
            + "\"status_description\":\"Unoccupied\",\"status_timestamp\":\"2023-10-20 03:49:45\"},"
            + "{\"kerbside_id\":\"C\",\"latitude\":\"n/a\",\"longitude\":144.9631,\"status_description\":\"Present\"}]}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CacheManager cacheManager;

    @Test
    void refreshThenQuery() throws Exception {
        mockMvc.perform(post("/api/admin/refresh").contentType(MediaType.APPLICATION_JSON).content(FEED))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acceptedCount", is(2)));

        mockMvc.perform(get("/api/parking/nearby")
                        .param("lat", "-37.8136")
                        .param("lng", "144.9631")
                        .param("radius", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results", hasSize(1)))
                .andExpect(jsonPath("$.results[0].bay.bayId", is("A")));

        mockMvc.perform(get("/api/parking/streets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].streetName", is("Swanston St")))
                .andExpect(jsonPath("$[1].streetName", is("Collins St")))
                .andExpect(jsonPath("$[1].occupancyRatio", is(0.0)));

        mockMvc.perform(get("/api/parking/heatmap").param("cellSize", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].bayCount", is(1)));

        mockMvc.perform(post("/api/admin/refresh").contentType(MediaType.APPLICATION_JSON).content(OUT_OF_REGION))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/api/parking/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBays", is(2)))
                .andExpect(jsonPath("$.availableBays", is(1)));
    }

    @Test
    void oneUnreadableRecordDoesNotRejectTheFeed() throws Exception {
        mockMvc.perform(post("/api/admin/refresh").contentType(MediaType.APPLICATION_JSON).content(UNEVEN_FEED))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acceptedCount", is(2)))
                .andExpect(jsonPath("$.droppedCount", is(1)));

        mockMvc.perform(get("/api/parking/bays/B"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastUpdated", is("2023-10-20T03:49:45Z")));
    }

    @Test
    void heatmapCacheIsBounded() {
        CaffeineCache cache = (CaffeineCache) cacheManager.getCache(HeatmapService.CACHE_NAME);

        assertThat(cache).isNotNull();
        Cache<Object, Object> nativeCache = cache.getNativeCache();
        assertThat(nativeCache.policy().eviction()).hasValueSatisfying(
                eviction -> assertThat(eviction.getMaximum()).isEqualTo(64));
    }
}
