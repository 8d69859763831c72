package com.urbanparking.availability.service;

import com.urbanparking.availability.TestBays;
import com.urbanparking.availability.dto.BayDTO;
import com.urbanparking.availability.dto.CurrentStatusResponse;
import com.urbanparking.availability.dto.NearbyResponse;
import com.urbanparking.availability.dto.NearbyResult;
import com.urbanparking.availability.dto.RawBayRecord;
import com.urbanparking.availability.dto.StreetSummary;
import com.urbanparking.availability.exception.InvalidQueryException;
import com.urbanparking.availability.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.urbanparking.availability.TestBays.CBD_LAT;
import static com.urbanparking.availability.TestBays.CBD_LNG;
import static com.urbanparking.availability.TestBays.NORTH_500_LAT;
import static com.urbanparking.availability.TestBays.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ParkingQueryServiceTest {

    private RefreshCoordinator coordinator;
    private ParkingQueryService service;

    @BeforeEach
    void setUp() {
        coordinator = new RefreshCoordinator(
                new BayRecordNormalizer(TestBays.melbourne()),
                new AggregationService(),
                TestBays.melbourne(),
                Clock.fixed(TestBays.CAPTURED_AT, ZoneOffset.UTC),
                250);
        service = new ParkingQueryService(coordinator,
                new NearbyBayService(20, 5000),
                new HeatmapService(TestBays.melbourne(), 25, 5000));
    }

    private void loadCbd() {
        coordinator.refresh(List.of(
                record("A", CBD_LAT, CBD_LNG, "Unoccupied", "Swanston St"),
                record("B", NORTH_500_LAT, CBD_LNG, "Present", "Swanston St"),
                record("C", -37.8400, 144.9500, "Present", "Collins St"),
                record("D", -37.8200, 145.0000, "Unoccupied", null)),
                List.of("Lonsdale St"));
    }

    @Test
    void answersWithEmptyResultsBeforeFirstRefresh() {
        assertThat(service.getCurrentStatus(null, null).getCount()).isZero();
        assertThat(service.getOverviewStats().getSnapshotVersion()).isZero();
        assertThat(service.getStreetsList(null)).isEmpty();
        assertThat(service.findNearbyParking(CBD_LAT, CBD_LNG, 500, false, null).getResults()).isEmpty();
    }

    @Test
    void currentStatusFiltersByBoundsAndLimit() {
        loadCbd();

        CurrentStatusResponse all = service.getCurrentStatus(null, null);
        CurrentStatusResponse cbd = service.getCurrentStatus("-37.805,144.96,-37.815,144.97", null);
        CurrentStatusResponse limited = service.getCurrentStatus(null, 2);

        assertThat(all.getCount()).isEqualTo(4);
        assertThat(all.getSnapshotVersion()).isEqualTo(1);
        assertThat(cbd.getData()).extracting(BayDTO::getKerbsideId).containsExactly("A", "B");
        assertThat(limited.getData()).extracting(BayDTO::getKerbsideId).containsExactly("A", "B");
    }

    @Test
    void rejectsMalformedBoundsAndLimits() {
        assertThatThrownBy(() -> service.getCurrentStatus("1,2,3", null)).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> service.getCurrentStatus("a,b,c,d", null)).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> service.getCurrentStatus(null, 0)).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> service.getStreetsList(-1)).isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void boundsAcceptAnyCornerOrder() {
        Envelope window = ParkingQueryService.parseBounds("-37.80, 145.0, -37.85, 144.9");

        assertThat(window.getMinY()).isEqualTo(-37.85);
        assertThat(window.getMaxY()).isEqualTo(-37.80);
        assertThat(window.getMinX()).isEqualTo(144.9);
        assertThat(window.getMaxX()).isEqualTo(145.0);
        assertThat(ParkingQueryService.parseBounds(" ")).isNull();
    }

    @Test
    void streetsAreListedBusiestFirst() {
        loadCbd();

        List<StreetSummary> streets = service.getStreetsList(null);

        assertThat(streets).extracting(StreetSummary::getStreetName)
                .containsExactly("Swanston St", "Collins St", "Lonsdale St");
        assertThat(service.getStreetsList(1)).hasSize(1);
    }

    @Test
    void nearbyUsesThePublishedSnapshot() {
        loadCbd();

        assertThat(service.findNearbyParking(CBD_LAT, CBD_LNG, 1000, true, null).getResults())
                .extracting(r -> r.getBay().getBayId())
                .containsExactly("A");
        assertThat(service.findNearest(CBD_LAT, CBD_LNG, 2, null).getResults())
                .extracting(r -> r.getBay().getBayId())
                .containsExactly("A", "B");
    }

    @Test
    void rejectsNegativeTimeout() {
        assertThatThrownBy(() -> service.findNearbyParking(CBD_LAT, CBD_LNG, 500, false, -1L))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void looksUpSingleBay() {
        loadCbd();

        assertThat(service.getBay("C").getRoadSegment()).isEqualTo("Collins St");
        assertThatThrownBy(() -> service.getBay("missing")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void exportsGeoJsonWithLongitudeFirst() {
        loadCbd();

        Map<String, Object> geoJson = service.getCurrentStatusGeoJSON();
        List<Map<String, Object>> features = (List<Map<String, Object>>) geoJson.get("features");
        Map<String, Object> geometry = (Map<String, Object>) features.get(0).get("geometry");

        assertThat(geoJson.get("type")).isEqualTo("FeatureCollection");
        assertThat(features).hasSize(4);
        assertThat((List<Double>) geometry.get("coordinates")).containsExactly(CBD_LNG, CBD_LAT);
    }

    @Test
    void heatmapCoversAllBays() {
        loadCbd();

        assertThat(service.getHeatmap(200).stream().mapToInt(cell -> cell.getBayCount()).sum()).isEqualTo(4);
    }

    @Test
    void heatmapCellSizeIsRoundedToWholeMeters() {
        HeatmapService heatmapService = mock(HeatmapService.class);
        ParkingQueryService rounding = new ParkingQueryService(coordinator, new NearbyBayService(20, 5000),
                heatmapService);

        rounding.getHeatmap(199.6);
        rounding.getHeatmap(200.4);

        verify(heatmapService, times(2)).buildGrid(any(), eq(200.0));
    }

    @Test
    void nearbyResultsComeFromOneVersionWhileRefreshing() throws Exception {
        int readers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(readers);
        AtomicBoolean writing = new AtomicBoolean(true);
        ConcurrentLinkedQueue<String> problems = new ConcurrentLinkedQueue<>();
        CountDownLatch started = new CountDownLatch(readers);

        for (int r = 0; r < readers; r++) {
            pool.submit(() -> {
                started.countDown();
                while (writing.get()) {
                    try {
                        NearbyResponse response = service.findNearbyParking(CBD_LAT, CBD_LNG, 2000, false, null);
                        String prefix = "V" + response.getSnapshotVersion() + "-";
                        for (NearbyResult result : response.getResults()) {
                            if (!result.getBay().getBayId().startsWith(prefix)) {
                                problems.add(result.getBay().getBayId() + " answered for version "
                                        + response.getSnapshotVersion());
                            }
                        }
                    } catch (RuntimeException e) {
                        problems.add(e.toString());
                    }
                }
            });
        }

        started.await(5, TimeUnit.SECONDS);
        Random random = new Random(7L);
        for (int i = 1; i <= 30; i++) {
            List<RawBayRecord> records = new ArrayList<>();
            int count = 10 + random.nextInt(200);
            for (int j = 0; j < count; j++) {
                records.add(record("V" + i + "-" + j, CBD_LAT + random.nextDouble() * 0.01,
                        CBD_LNG + random.nextDouble() * 0.01, "Present", "Collins St"));
            }
            coordinator.refresh(records);
        }
        writing.set(false);
        pool.shutdown();

        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(problems).isEmpty();
        assertThat(service.findNearbyParking(CBD_LAT, CBD_LNG, 2000, false, null).getResults())
                .isNotEmpty()
                .allSatisfy(result -> assertThat(result.getBay().getBayId()).startsWith("V30-"));
    }

    @Test
    void engineStatusReportsVersionAndCount() {
        loadCbd();

        Map<String, Object> status = service.getEngineStatus();

        assertThat(status).containsEntry("snapshotVersion", 1L).containsEntry("parkingBaysCount", 4);
    }
}
