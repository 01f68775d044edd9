package com.mouse.listings.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Data
public class PipelineConfig {

    @Value("${pipeline.interval-ms:43200000}")
    private long intervalMs;

    @Value("${pipeline.notify.enabled:true}")
    private boolean notifyEnabled;

    @Value("${pipeline.stats.latest-limit:3}")
    private int statsLatestLimit;
}
