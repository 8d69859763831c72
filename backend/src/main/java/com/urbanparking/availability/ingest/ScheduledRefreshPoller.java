package com.urbanparking.availability.ingest;

import com.urbanparking.availability.dto.RefreshRequest;
import com.urbanparking.availability.service.RefreshQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Polls the bay feed and hands each fetch to the refresh queue
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledRefreshPoller {

    private final BayRecordSource bayRecordSource;
    private final RefreshQueue refreshQueue;

    @Value("${parking.refresh.polling-enabled:false}")
    private boolean pollingEnabled;

    /**
     * Poll the feed every ten minutes by default, the sensor feed's own update interval
     */
    @Scheduled(fixedDelayString = "${parking.refresh.interval-ms:600000}",
            initialDelayString = "${parking.refresh.initial-delay-ms:5000}")
    public void pollBayFeed() {
        if (!pollingEnabled) {
            return;
        }

        try {
            RefreshRequest feed = bayRecordSource.fetch();
            log.debug("Fetched {} bay records, submitting refresh", feed.getRecords().size());

            refreshQueue.submit(feed.getRecords(), feed.getStreets())
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.error("Scheduled refresh failed: {}", error.getMessage());
                        } else {
                            log.info("Scheduled refresh published version {} ({} bays)",
                                    result.getVersion(), result.getAcceptedCount());
                        }
                    });
        } catch (Exception e) {
            log.error("Error polling bay feed: {}", e.getMessage());
        }
    }
}
