package com.kotsin.stdev.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.serialization.Serializer;

import java.time.Instant;

/**
 * Hourly price snapshot for one security.
 *
 * Any of bid/mid/ask may be null when the upstream snapshot had no value for that field.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Snapshot {

    @JsonAlias({"security_id", "securityId"})
    String entityId;

    @JsonAlias({"snap_time", "snapTime"})
    Instant timestamp;

    Double bid;
    Double mid;
    Double ask;

    private static final ObjectMapper SHARED_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static Serde<Snapshot> serde() {
        return Serdes.serdeFrom(new SnapshotSerializer(), new SnapshotDeserializer());
    }

    public static class SnapshotSerializer implements Serializer<Snapshot> {
        @Override
        public byte[] serialize(String topic, Snapshot data) {
            if (data == null) return null;
            try {
                return SHARED_MAPPER.writeValueAsBytes(data);
            } catch (Exception e) {
                throw new SerializationException("Serialization failed for Snapshot", e);
            }
        }
    }

    public static class SnapshotDeserializer implements Deserializer<Snapshot> {
        @Override
        public Snapshot deserialize(String topic, byte[] bytes) {
            if (bytes == null) return null;
            try {
                return SHARED_MAPPER.readValue(bytes, Snapshot.class);
            } catch (Exception e) {
                throw new SerializationException("Deserialization failed for Snapshot on topic " + topic, e);
            }
        }
    }
}
