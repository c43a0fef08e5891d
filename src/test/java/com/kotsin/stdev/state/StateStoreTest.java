package com.kotsin.stdev.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kotsin.stdev.engine.StateMap;
import com.kotsin.stdev.model.MissingValuePolicy;
import com.kotsin.stdev.model.PriceField;
import com.kotsin.stdev.model.Snapshot;
import com.kotsin.stdev.retry.RetryHandler;
import com.kotsin.stdev.window.EntityState;
import com.kotsin.stdev.window.GapDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StateStore load/save, including every way a state file can be rejected.
 */
class StateStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final GapDetector HOURLY = new GapDetector(Duration.ofHours(1), Duration.ZERO);

    @TempDir
    Path tempDir;

    private StateStore store;
    private Path statePath;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        store = new StateStore(3, new RetryHandler(0), Clock.fixed(T0, ZoneOffset.UTC));
        statePath = tempDir.resolve("stdev-state.json");
    }

    // ========== Cold Start / Round Trip ==========

    @Test
    @DisplayName("Missing file: empty state")
    void testColdStart() {
        StateMap state = store.load(statePath);

        assertTrue(state.isEmpty());
        assertEquals(3, state.getWindowSize());
        assertNull(state.getHighWaterMark());
    }

    @Test
    @DisplayName("Save then load: windows, timestamps and high-water mark restored exactly")
    void testRoundTrip() {
        StateMap state = sampleState();

        store.save(statePath, state);
        StateMap loaded = store.load(statePath);

        assertEquals(2, loaded.size());
        assertEquals(state.getHighWaterMark(), loaded.getHighWaterMark());
        for (String entityId : List.of("AAA", "BBB")) {
            EntityState original = state.get(entityId).orElseThrow();
            EntityState restored = loaded.get(entityId).orElseThrow();
            assertEquals(original.getLastTimestamp(), restored.getLastTimestamp());
            for (PriceField field : PriceField.values()) {
                assertEquals(original.window(field).getValues(), restored.window(field).getValues(),
                    entityId + "/" + field);
                assertEquals(original.window(field).getLastStdev(), restored.window(field).getLastStdev());
                assertEquals(original.window(field).stdev(), restored.window(field).stdev());
            }
        }
    }

    @Test
    @DisplayName("Loaded windows continue bit for bit with the saved ones")
    void testRoundTripContinuesExactly() {
        StateMap state = sampleState();
        store.save(statePath, state);
        StateMap loaded = store.load(statePath);

        double[] next = {100000.00, 100000.02, 100000.01, 0.5, 0.51, 0.49, 1e-3};
        for (double value : next) {
            for (PriceField field : PriceField.values()) {
                state.get("AAA").orElseThrow().window(field).push(value);
                loaded.get("AAA").orElseThrow().window(field).push(value);
                assertEquals(state.get("AAA").orElseThrow().window(field).stdev(),
                    loaded.get("AAA").orElseThrow().window(field).stdev(), field + " after " + value);
            }
        }
    }

    @Test
    @DisplayName("Empty window and null last stdev survive a round trip")
    void testRoundTripEmptyWindow() {
        StateMap state = new StateMap(3);
        state.getOrCreate("AAA").observe(
            Snapshot.builder().entityId("AAA").timestamp(T0).bid(1.0).build(),
            HOURLY, MissingValuePolicy.CARRY_FORWARD, 1e12);
        state.advanceHighWaterMark(T0);

        store.save(statePath, state);
        EntityState restored = store.load(statePath).get("AAA").orElseThrow();

        assertTrue(restored.window(PriceField.MID).isEmpty());
        assertNull(restored.window(PriceField.MID).getLastStdev());
        assertEquals(List.of(1.0), restored.window(PriceField.BID).getValues());
    }

    @Test
    @DisplayName("Save leaves no temporary file behind and overwrites previous state")
    void testNoTempFileLeft() throws IOException {
        store.save(statePath, new StateMap(3));
        store.save(statePath, sampleState());

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of("stdev-state.json"),
                files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
        assertEquals(2, store.load(statePath).size());
    }

    @Test
    @DisplayName("Save creates missing parent directories")
    void testSaveCreatesDirectories() {
        Path nested = tempDir.resolve("a").resolve("b").resolve("state.json");

        store.save(nested, sampleState());

        assertTrue(Files.exists(nested));
    }

    // ========== Save Failure ==========

    @Test
    @DisplayName("Failed save raises and leaves the previous file untouched")
    void testSaveFailure() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        Path unwritable = blocker.resolve("state.json");

        StateStoreException ex = assertThrows(StateStoreException.class,
            () -> store.save(unwritable, sampleState()));
        assertTrue(ex.getMessage().contains("Failed to save state"));
        assertEquals("not a directory", Files.readString(blocker));
    }

    @Test
    @DisplayName("Save with a different window size rejected")
    void testSaveWindowSizeMismatch() {
        assertThrows(StateStoreException.class, () -> store.save(statePath, new StateMap(5)));
        assertFalse(Files.exists(statePath));
    }

    // ========== Corrupt Files ==========

    @Test
    @DisplayName("Invalid JSON rejected")
    void testInvalidJson() throws IOException {
        Files.writeString(statePath, "{ not json");

        StateStoreException ex = assertThrows(StateStoreException.class, () -> store.load(statePath));
        assertTrue(ex.getMessage().contains("Unreadable state file"));
    }

    @Test
    @DisplayName("Empty file rejected, not treated as cold start")
    void testEmptyFile() throws IOException {
        Files.writeString(statePath, "");

        assertThrows(StateStoreException.class, () -> store.load(statePath));
    }

    @Test
    @DisplayName("Null document rejected")
    void testNullDocument() throws IOException {
        Files.writeString(statePath, "null");

        StateStoreException ex = assertThrows(StateStoreException.class, () -> store.load(statePath));
        assertTrue(ex.getMessage().startsWith("Corrupt state file"));
    }

    @Test
    @DisplayName("Unknown format version rejected")
    void testWrongVersion() throws IOException {
        ObjectNode root = savedTree();
        root.put("formatVersion", 99);
        write(root);

        assertCorrupt("format version");
    }

    @Test
    @DisplayName("Window size mismatch names the fix")
    void testWindowSizeMismatch() throws IOException {
        ObjectNode root = savedTree();
        root.put("windowSize", 20);
        write(root);

        StateStoreException ex = assertThrows(StateStoreException.class, () -> store.load(statePath));
        assertTrue(ex.getMessage().contains("window size 20"));
        assertTrue(ex.getMessage().contains("move the file aside"));
    }

    @Test
    @DisplayName("Stored sums disagreeing with values rejected")
    void testSumsMismatch() throws IOException {
        ObjectNode root = savedTree();
        window(root, "AAA", "BID").put("sum", 12345.0);
        write(root);

        assertCorrupt("sums do not match");
    }

    @Test
    @DisplayName("Drifted sum of squares rejected")
    void testSumOfSquaresDrift() throws IOException {
        ObjectNode root = savedTree();
        ObjectNode bid = window(root, "AAA", "BID");
        bid.put("sumOfSquares", bid.get("sumOfSquares").asDouble() * 1.001);
        write(root);

        assertCorrupt("sums do not match");
    }

    @Test
    @DisplayName("Eviction count outside the window rejected")
    void testEvictionCountOutOfRange() throws IOException {
        ObjectNode root = savedTree();
        window(root, "AAA", "MID").put("evictionsSinceRebuild", 3);
        write(root);

        assertCorrupt("eviction count 3");
    }

    @Test
    @DisplayName("Window without an anchor rejected")
    void testMissingAnchor() throws IOException {
        ObjectNode root = savedTree();
        window(root, "BBB", "ASK").remove("anchor");
        write(root);

        assertCorrupt("missing values or sums");
    }

    @Test
    @DisplayName("More values than the window size rejected")
    void testTooManyValues() throws IOException {
        ObjectNode root = savedTree();
        ObjectNode bid = window(root, "AAA", "BID");
        ArrayNode values = bid.putArray("values");
        values.add(1.0).add(1.0).add(1.0).add(1.0);
        bid.put("sum", 4.0);
        bid.put("sumOfSquares", 4.0);
        write(root);

        assertCorrupt("more than window size");
    }

    @Test
    @DisplayName("Entity count mismatch rejected")
    void testEntityCountMismatch() throws IOException {
        ObjectNode root = savedTree();
        root.put("entityCount", 7);
        write(root);

        assertCorrupt("entity count");
    }

    @Test
    @DisplayName("Missing field window rejected")
    void testMissingWindow() throws IOException {
        ObjectNode root = savedTree();
        ((ObjectNode) root.path("entities").path("AAA").path("windows")).remove("ASK");
        write(root);

        assertCorrupt("no ASK window");
    }

    @Test
    @DisplayName("Entity newer than the high-water mark rejected")
    void testEntityAfterHighWaterMark() throws IOException {
        ObjectNode root = savedTree();
        root.put("highWaterMark", "2023-12-31T00:00:00Z");
        write(root);

        assertCorrupt("after high-water mark");
    }

    @Test
    @DisplayName("Negative last stdev rejected")
    void testNegativeLastStdev() throws IOException {
        ObjectNode root = savedTree();
        window(root, "BBB", "MID").put("lastStdev", -1.0);
        write(root);

        assertCorrupt("invalid last stdev");
    }

    // ========== Helpers ==========

    private StateMap sampleState() {
        StateMap state = new StateMap(3);
        double[][] aaa = {{1.0, 10.0, 100.0}, {2.0, 12.0, 101.0}, {4.0, 11.0, 103.0}, {8.0, 15.0, 99.0}};
        for (int h = 0; h < aaa.length; h++) {
            apply(state, "AAA", h, aaa[h][0], aaa[h][1], aaa[h][2]);
        }
        apply(state, "BBB", 0, 50.0, 50.5, 51.0);
        apply(state, "BBB", 1, 50.2, 50.6, 51.1);
        return state;
    }

    private void apply(StateMap state, String entityId, int hour, double bid, double mid, double ask) {
        Instant ts = T0.plus(Duration.ofHours(hour));
        EntityState entity = state.getOrCreate(entityId);
        entity.observe(Snapshot.builder().entityId(entityId).timestamp(ts).bid(bid).mid(mid).ask(ask).build(),
            HOURLY, MissingValuePolicy.CARRY_FORWARD, 1e12);
        for (PriceField field : PriceField.values()) {
            entity.window(field).stdev().ifPresent(entity.window(field)::rememberStdev);
        }
        state.advanceHighWaterMark(ts);
    }

    private ObjectNode savedTree() throws IOException {
        store.save(statePath, sampleState());
        return (ObjectNode) mapper.readTree(statePath.toFile());
    }

    private ObjectNode window(ObjectNode root, String entityId, String field) {
        return (ObjectNode) root.path("entities").path(entityId).path("windows").path(field);
    }

    private void write(ObjectNode root) throws IOException {
        Files.write(statePath, mapper.writeValueAsString(root).getBytes(StandardCharsets.UTF_8));
    }

    private void assertCorrupt(String detail) {
        StateStoreException ex = assertThrows(StateStoreException.class, () -> store.load(statePath));
        assertTrue(ex.getMessage().startsWith("Corrupt state file"), ex.getMessage());
        assertTrue(ex.getMessage().contains(detail), ex.getMessage());
    }
}
