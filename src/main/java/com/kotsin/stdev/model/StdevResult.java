package com.kotsin.stdev.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.serialization.Serializer;

import java.time.Instant;

/**
 * Rolling standard deviations of one security at one snapshot time.
 * A null stdev means the field had no defined statistic at that time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StdevResult {

    private String entityId;
    private Instant timestamp;
    private Double bidStdev;
    private Double midStdev;
    private Double askStdev;

    public Double get(PriceField field) {
        switch (field) {
            case BID:
                return bidStdev;
            case MID:
                return midStdev;
            case ASK:
                return askStdev;
            default:
                throw new IllegalArgumentException("Unknown field " + field);
        }
    }

    public boolean hasAnyValue() {
        return bidStdev != null || midStdev != null || askStdev != null;
    }

    private static final ObjectMapper SHARED_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static Serde<StdevResult> serde() {
        return Serdes.serdeFrom(new StdevResultSerializer(), new StdevResultDeserializer());
    }

    public static class StdevResultSerializer implements Serializer<StdevResult> {
        @Override
        public byte[] serialize(String topic, StdevResult data) {
            if (data == null) return null;
            try {
                return SHARED_MAPPER.writeValueAsBytes(data);
            } catch (Exception e) {
                throw new SerializationException("Serialization failed for StdevResult", e);
            }
        }
    }

    public static class StdevResultDeserializer implements Deserializer<StdevResult> {
        @Override
        public StdevResult deserialize(String topic, byte[] bytes) {
            if (bytes == null) return null;
            try {
                return SHARED_MAPPER.readValue(bytes, StdevResult.class);
            } catch (Exception e) {
                throw new SerializationException("Deserialization failed for StdevResult", e);
            }
        }
    }
}
