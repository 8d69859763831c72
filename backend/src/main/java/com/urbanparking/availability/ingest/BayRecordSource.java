package com.urbanparking.availability.ingest;

import com.urbanparking.availability.dto.RefreshRequest;

/**
 * Upstream feed of bay states, polled on a schedule.
 */
public interface BayRecordSource {

    /**
     * Fetch the full current feed.
     *
     * @throws com.urbanparking.availability.exception.IngestException if the feed cannot be read
     */
    RefreshRequest fetch();
}
