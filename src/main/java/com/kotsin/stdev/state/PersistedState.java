package com.kotsin.stdev.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.stdev.model.PriceField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * On-disk layout of the state file.
 *
 * Boxed types throughout so that a missing JSON property reads as null and is caught by validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PersistedState {

    private Integer formatVersion;
    private Integer windowSize;
    private Instant highWaterMark;
    private Instant savedAt;
    private Integer entityCount;
    private Map<String, PersistedEntity> entities;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PersistedEntity {
        private Instant lastTimestamp;
        private Map<PriceField, PersistedWindow> windows;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PersistedWindow {
        private List<Double> values;
        /** Sums below are of {@code value - anchor} */
        private Double anchor;
        private Double sum;
        private Double sumOfSquares;
        private Double peakSumOfSquares;
        private Integer evictionsSinceRebuild;
        private Double lastStdev;
    }
}
