package com.urbanparking.availability.config;

import com.urbanparking.availability.geo.BoundingRegion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Core beans of the availability engine: service region, clock, refresh executor and
 * the HTTP client used to poll the bay feed.
 */
@Configuration
@EnableScheduling
@Slf4j
public class ParkingEngineConfig {

    /**
     * Service region; defaults cover the Melbourne CBD and inner suburbs
     */
    @Bean
    public BoundingRegion boundingRegion(
            @Value("${parking.bounds.min-latitude:-37.90}") double minLatitude,
            @Value("${parking.bounds.max-latitude:-37.75}") double maxLatitude,
            @Value("${parking.bounds.min-longitude:144.88}") double minLongitude,
            @Value("${parking.bounds.max-longitude:145.05}") double maxLongitude) {
        BoundingRegion region = new BoundingRegion(minLatitude, maxLatitude, minLongitude, maxLongitude);
        log.info("Service region: {}", region);
        return region;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single worker; refresh builds never run in parallel
     */
    @Bean(name = "refreshExecutor")
    public ThreadPoolTaskExecutor refreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("snapshot-refresh-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${parking.refresh.connect-timeout-ms:5000}") long connectTimeoutMs,
                                     @Value("${parking.refresh.read-timeout-ms:30000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
