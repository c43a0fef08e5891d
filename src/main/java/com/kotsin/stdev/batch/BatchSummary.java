package com.kotsin.stdev.batch;

import com.kotsin.stdev.monitoring.ProcessingMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSummary {
    private Instant start;
    private Instant end;
    private String statePath;
    private int securities;
    private Instant highWaterMark;
    private ProcessingMetrics.Summary metrics;
}
