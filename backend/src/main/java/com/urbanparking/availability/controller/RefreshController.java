package com.urbanparking.availability.controller;

import com.urbanparking.availability.dto.RefreshRequest;
import com.urbanparking.availability.dto.RefreshResult;
import com.urbanparking.availability.service.RefreshQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

/**
 * Entry point for ingestion collaborators that push a full feed instead of waiting for
 * the poller.
 */
@RestController
@RequestMapping("/api/admin/refresh")
@RequiredArgsConstructor
@Slf4j
public class RefreshController {

    private final RefreshQueue refreshQueue;

    @PostMapping
    public ResponseEntity<RefreshResult> triggerRefresh(@Valid @RequestBody RefreshRequest request) {
        log.info("Received refresh request with {} records and {} declared streets",
                request.getRecords().size(), request.getStreets() != null ? request.getStreets().size() : 0);
        return ResponseEntity.ok(refreshQueue.submitAndWait(request.getRecords(), request.getStreets()));
    }
}
