package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.RawBayRecord;
import com.urbanparking.availability.dto.RefreshResult;
import com.urbanparking.availability.dto.SnapshotAggregates;
import com.urbanparking.availability.exception.IngestException;
import com.urbanparking.availability.geo.BoundingRegion;
import com.urbanparking.availability.geo.GridSpatialIndex;
import com.urbanparking.availability.model.Snapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the published snapshot.
 *
 * A refresh builds the snapshot, its spatial index and its aggregates on private
 * structures and publishes all three with one reference swap. Readers call
 * {@link #current()} once per query and never wait on a build. Builds are serialized;
 * a failed build leaves the previous state serving.
 */
@Service
@Slf4j
public class RefreshCoordinator {

    private final BayRecordNormalizer normalizer;
    private final AggregationService aggregationService;
    private final BoundingRegion region;
    private final Clock clock;
    private final double indexCellSizeMeters;

    private final AtomicReference<PublishedSnapshot> published;
    private final ReentrantLock buildLock = new ReentrantLock();

    // guarded by buildLock
    private long lastVersion;

    public RefreshCoordinator(BayRecordNormalizer normalizer,
                              AggregationService aggregationService,
                              BoundingRegion region,
                              Clock clock,
                              @Value("${parking.index.cell-size-meters:250}") double indexCellSizeMeters) {
        this.normalizer = normalizer;
        this.aggregationService = aggregationService;
        this.region = region;
        this.clock = clock;
        this.indexCellSizeMeters = indexCellSizeMeters;
        this.published = new AtomicReference<>(assemble(Snapshot.empty()));
    }

    /**
     * The most recently published state. Before the first refresh this is an empty
     * version-0 snapshot.
     */
    public PublishedSnapshot current() {
        return published.get();
    }

    public RefreshResult refresh(List<RawBayRecord> records) {
        return refresh(records, Collections.emptyList());
    }

    /**
     * Build and publish a new snapshot from raw records.
     *
     * @param records raw feed records; bad records are dropped and counted
     * @param streets street catalogue, streets that must appear in rollups even without bays
     * @return outcome of the refresh with the published version
     * @throws IngestException if the input is missing, empty or has no usable record;
     *                         the previous snapshot stays published
     */
    @CacheEvict(value = HeatmapService.CACHE_NAME, allEntries = true)
    public RefreshResult refresh(List<RawBayRecord> records, Collection<String> streets) {
        if (records == null) {
            throw new IngestException("Refresh input is missing");
        }
        if (records.isEmpty()) {
            throw new IngestException("Refresh input contains no records");
        }

        buildLock.lock();
        try {
            long started = System.nanoTime();
            log.info("Building snapshot from {} records (serving version {})", records.size(), published.get().getVersion());

            BayRecordNormalizer.NormalizedBatch batch = normalizer.normalize(records);
            if (batch.getBays().isEmpty()) {
                throw new IngestException(String.format(
                        "None of the %d records could be used", records.size()));
            }

            long version = lastVersion + 1;
            Instant capturedAt = clock.instant();
            Snapshot snapshot = Snapshot.of(version, capturedAt, batch.getBays(), streets);
            PublishedSnapshot next = assemble(snapshot);

            published.set(next);
            lastVersion = version;

            long buildMillis = (System.nanoTime() - started) / 1_000_000;
            int dropped = batch.getDroppedCount() + next.getIndex().getDroppedCount();
            log.info("Published snapshot version {}: {} bays, {} dropped, {} duplicates in {} ms",
                    version, snapshot.size(), dropped, batch.getDuplicateCount(), buildMillis);

            return RefreshResult.builder()
                    .version(version)
                    .acceptedCount(next.getIndex().size())
                    .droppedCount(dropped)
                    .duplicateCount(batch.getDuplicateCount())
                    .capturedAt(capturedAt)
                    .buildMillis(buildMillis)
                    .build();
        } catch (IngestException e) {
            log.error("Refresh failed, version {} keeps serving: {}", published.get().getVersion(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Refresh failed, version {} keeps serving", published.get().getVersion(), e);
            throw new IngestException("Refresh failed: " + e.getMessage(), e);
        } finally {
            buildLock.unlock();
        }
    }

    private PublishedSnapshot assemble(Snapshot snapshot) {
        GridSpatialIndex index = GridSpatialIndex.build(snapshot.getBays(), region, indexCellSizeMeters);
        SnapshotAggregates aggregates = aggregationService.aggregate(snapshot);
        return new PublishedSnapshot(snapshot, index, aggregates);
    }
}
