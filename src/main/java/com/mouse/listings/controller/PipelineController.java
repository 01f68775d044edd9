package com.mouse.listings.controller;

import com.mouse.listings.config.PipelineConfig;
import com.mouse.listings.exception.StoreUnavailableException;
import com.mouse.listings.model.RunSummary;
import com.mouse.listings.model.StoreStats;
import com.mouse.listings.service.ListingPipeline;
import com.mouse.listings.service.ListingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final ListingPipeline pipeline;
    private final ListingStore listingStore;
    private final PipelineConfig pipelineConfig;

    @PostMapping("/run")
    public ResponseEntity<RunSummary> run() {
        if (pipeline.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        RunSummary summary = pipeline.runOnce();
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats(@RequestParam(name = "latest", required = false) Integer latest) {
        int limit = latest != null ? latest : pipelineConfig.getStatsLatestLimit();
        return ResponseEntity.ok(listingStore.stats(Math.max(0, limit)));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        log.error("Store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }
}
