package com.kotsin.stdev.model;

import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serde;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotTest {

    private final Serde<Snapshot> serde = Snapshot.serde();

    @Test
    @DisplayName("Serde keeps null fields null")
    void testSerdeRoundTrip() {
        Snapshot snapshot = Snapshot.builder()
            .entityId("AAA")
            .timestamp(Instant.parse("2024-01-01T05:00:00Z"))
            .bid(99.5)
            .ask(100.5)
            .build();

        byte[] bytes = serde.serializer().serialize("t", snapshot);
        Snapshot decoded = serde.deserializer().deserialize("t", bytes);

        assertEquals(snapshot, decoded);
        assertNull(decoded.getMid());
    }

    @Test
    @DisplayName("Upstream field names accepted")
    void testAliases() {
        String json = "{\"security_id\":\"XYZ\",\"snap_time\":\"2024-01-01T05:00:00Z\",\"mid\":10.0,\"venue\":\"X\"}";

        Snapshot decoded = serde.deserializer().deserialize("t", json.getBytes(StandardCharsets.UTF_8));

        assertEquals("XYZ", decoded.getEntityId());
        assertEquals(Instant.parse("2024-01-01T05:00:00Z"), decoded.getTimestamp());
        assertEquals(10.0, decoded.getMid());
        assertEquals(10.0, PriceField.MID.valueOf(decoded));
    }

    @Test
    @DisplayName("Malformed payload raises SerializationException")
    void testMalformed() {
        byte[] garbage = "{oops".getBytes(StandardCharsets.UTF_8);

        assertThrows(SerializationException.class, () -> serde.deserializer().deserialize("t", garbage));
    }

    @Test
    @DisplayName("Null payload is a tombstone")
    void testNullPayload() {
        assertNull(serde.deserializer().deserialize("t", null));
    }
}
