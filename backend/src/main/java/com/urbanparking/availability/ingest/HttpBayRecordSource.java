package com.urbanparking.availability.ingest;

import com.urbanparking.availability.dto.RefreshRequest;
import com.urbanparking.availability.exception.IngestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Reads the sensor feed as JSON ({@code records} plus optional {@code streets}) from an
 * HTTP endpoint.
 */
@Component
@Slf4j
public class HttpBayRecordSource implements BayRecordSource {

    private final RestTemplate restTemplate;
    private final String sourceUrl;

    public HttpBayRecordSource(RestTemplate restTemplate,
                               @Value("${parking.refresh.source-url:http://localhost:3000/parking/sensors}") String sourceUrl) {
        this.restTemplate = restTemplate;
        this.sourceUrl = sourceUrl;
    }

    @Override
    public RefreshRequest fetch() {
        log.debug("Fetching bay feed from {}", sourceUrl);
        RefreshRequest feed;
        try {
            feed = restTemplate.getForObject(sourceUrl, RefreshRequest.class);
        } catch (RestClientException e) {
            throw new IngestException("Unable to read bay feed from " + sourceUrl, e);
        }
        if (feed == null || feed.getRecords() == null) {
            throw new IngestException("Empty response from bay feed " + sourceUrl);
        }
        return feed;
    }
}
