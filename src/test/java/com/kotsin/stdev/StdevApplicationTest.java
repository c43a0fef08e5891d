package com.kotsin.stdev;

import com.kotsin.stdev.batch.ResultSink;
import com.kotsin.stdev.batch.SnapshotSource;
import com.kotsin.stdev.batch.StdevBatchService;
import com.kotsin.stdev.config.StdevProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "stdev.state-path=target/test-state/stdev-state.json")
@ActiveProfiles("test")
class StdevApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private StdevProperties properties;

    @Test
    @DisplayName("Context starts with Kafka adapters off")
    void testContextLoads() {
        assertNotNull(context.getBean(StdevBatchService.class));
        assertTrue(context.getBeansOfType(SnapshotSource.class).isEmpty());
        assertTrue(context.getBeansOfType(ResultSink.class).isEmpty());
    }

    @Test
    @DisplayName("Properties bound from application.properties")
    void testPropertiesBound() {
        assertEquals(20, properties.getWindowSize());
        assertEquals(Duration.ofHours(1), properties.getCadence());
        assertEquals(Duration.ofDays(7), properties.getLookback());
        assertEquals("target/test-state/stdev-state.json", properties.getStatePath());
    }
}
