package com.kotsin.stdev.config;

import com.kotsin.stdev.model.MissingValuePolicy;
import com.kotsin.stdev.model.StdevMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the rolling stdev engine and its adapters.
 */
@Configuration
@ConfigurationProperties(prefix = "stdev")
@Data
public class StdevProperties {

    /**
     * Number of most recent samples held per field window
     */
    private int windowSize = ProcessingConstants.DEFAULT_WINDOW_SIZE;

    /**
     * Expected spacing between consecutive snapshots of one security
     */
    private Duration cadence = ProcessingConstants.DEFAULT_CADENCE;

    /**
     * Allowed deviation from the cadence before windows are reset
     */
    private Duration gapTolerance = ProcessingConstants.DEFAULT_GAP_TOLERANCE;

    /**
     * Samples a window needs before its stdev is emitted
     */
    private int minPeriods = ProcessingConstants.DEFAULT_MIN_PERIODS;

    /**
     * Location of the persisted window state
     */
    private String statePath = ProcessingConstants.DEFAULT_STATE_PATH;

    /**
     * History fetched before the batch start to warm windows up
     */
    private Duration lookback = ProcessingConstants.DEFAULT_LOOKBACK;

    private MissingValuePolicy missingValuePolicy = MissingValuePolicy.CARRY_FORWARD;

    private StdevMode stdevMode = StdevMode.POPULATION;

    /**
     * Field values with a larger magnitude are treated as absent
     */
    private double maxAbsValue = ProcessingConstants.DEFAULT_MAX_ABS_VALUE;

    private KafkaInput input = new KafkaInput();

    private KafkaOutput output = new KafkaOutput();

    @Data
    public static class KafkaInput {
        private Kafka kafka = new Kafka(ProcessingConstants.DEFAULT_SNAPSHOT_TOPIC);
    }

    @Data
    public static class KafkaOutput {
        private Kafka kafka = new Kafka(ProcessingConstants.DEFAULT_RESULT_TOPIC);
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private String topic;

        public Kafka() {
        }

        public Kafka(String topic) {
            this.topic = topic;
        }
    }
}
