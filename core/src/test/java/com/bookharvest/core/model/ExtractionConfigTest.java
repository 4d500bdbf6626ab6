package com.bookharvest.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionConfigTest {

    @Test
    void defaults_match_documented_values() {
        ExtractionConfig c = ExtractionConfig.defaults();
        assertEquals(10, c.getThreadThreshold());
        assertEquals(500, c.getAsyncThreshold());
        assertEquals(1000, c.getMultiprocessThreshold());
        assertEquals(8, c.getWorkerCount());
        assertEquals(15, c.getAsyncConcurrency());
        assertEquals(50, c.getBatchSize());
        assertEquals(5.0, c.getRequestsPerSecond());
        assertEquals(3, c.getMaxAttempts());
        assertEquals(Duration.ofMillis(500), c.getBaseRetryDelay());
        assertFalse(c.isForceSequential());
        assertTrue(c.isUseFastParser());
        assertTrue(c.getProcessCount() >= 1 && c.getProcessCount() <= 8);
        assertTrue(c.getRetryPages().isEmpty());
    }

    @Test
    void thresholds_must_be_ordered() {
        assertThrows(IllegalArgumentException.class,
                () -> ExtractionConfig.builder().threadThreshold(100).asyncThreshold(50).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExtractionConfig.builder().asyncThreshold(600).multiprocessThreshold(550).build());
    }

    @Test
    void rejects_out_of_range_values() {
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().requestsPerSecond(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().requestsPerSecond(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().sourceBaseUrl("ftp://x").build());
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().sourceBaseUrl("not a url").build());
        assertThrows(IllegalArgumentException.class,
                () -> ExtractionConfig.builder().baseRetryDelay(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExtractionConfig.builder().retryPages(Set.of(0)).build());
    }

    @Test
    void toBuilder_copies_every_field() {
        ExtractionConfig a = ExtractionConfig.builder()
                .workerCount(3).batchSize(9).requestsPerSecond(1.5)
                .retryPages(Set.of(4, 2)).sourceBaseUrl("http://localhost:1234")
                .build();
        ExtractionConfig b = a.toBuilder().build();
        assertEquals(3, b.getWorkerCount());
        assertEquals(9, b.getBatchSize());
        assertEquals(1.5, b.getRequestsPerSecond());
        assertEquals(Set.of(2, 4), b.getRetryPages());
        assertEquals("http://localhost:1234", b.getSourceBaseUrl());
    }

    @Test
    void retryPages_is_read_only() {
        ExtractionConfig c = ExtractionConfig.builder().retryPages(Set.of(1)).build();
        assertThrows(UnsupportedOperationException.class, () -> c.getRetryPages().add(2));
    }
}
