package com.mouse.listings.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineSchedulerTest {

    @Mock
    private ListingPipeline pipeline;

    @InjectMocks
    private PipelineScheduler scheduler;

    @Test
    void scheduledRun_unexpectedError_doesNotEscapeScheduler() {
        when(pipeline.runOnce()).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> scheduler.scheduledRun()).doesNotThrowAnyException();
        verify(pipeline, times(1)).runOnce();
    }
}
