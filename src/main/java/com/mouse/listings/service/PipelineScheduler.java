package com.mouse.listings.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.scheduler.enabled", havingValue = "true")
public class PipelineScheduler {

    private final ListingPipeline pipeline;

    @Scheduled(initialDelayString = "${pipeline.initial-delay-ms:0}", fixedDelayString = "${pipeline.interval-ms:43200000}")
    public void scheduledRun() {
        try {
            pipeline.runOnce();
        } catch (Exception e) {
            log.error("Scheduled run failed, next cycle will retry", e);
        }
    }
}
