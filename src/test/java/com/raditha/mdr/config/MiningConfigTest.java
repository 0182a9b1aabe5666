package com.raditha.mdr.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MiningConfigTest {

    @Test
    void testDefaults() {
        MiningConfig config = MiningConfig.defaults();

        assertEquals(10, config.maxWindow());
        assertEquals(0.3, config.regionThreshold(), 0.001);
        assertEquals(0.3, config.recordThreshold1(), 0.001);
        assertEquals(0.3, config.recordThresholdN(), 0.001);
        assertEquals(3, config.minimumDepth());
    }

    @Test
    void testAllThresholds() {
        MiningConfig config = MiningConfig.allThresholds(0.5);

        assertEquals(0.5, config.regionThreshold(), 0.001);
        assertEquals(0.5, config.recordThreshold1(), 0.001);
        assertEquals(0.5, config.recordThresholdN(), 0.001);
        assertEquals(10, config.maxWindow());
    }

    @Test
    void testCopyHelpers() {
        MiningConfig config = MiningConfig.defaults().withMaxWindow(4).withMinimumDepth(1);

        assertEquals(4, config.maxWindow());
        assertEquals(1, config.minimumDepth());
        assertEquals(0.3, config.regionThreshold(), 0.001);
    }

    @Test
    void testBoundaryThresholdsAreAccepted() {
        assertDoesNotThrow(() -> new MiningConfig(1, 0.0, 1.0, 0.0, 0));
    }

    @Test
    void testInvalidMaxWindow() {
        assertThrows(IllegalArgumentException.class, () -> new MiningConfig(0, 0.3, 0.3, 0.3, 3));
        assertThrows(IllegalArgumentException.class, () -> new MiningConfig(-2, 0.3, 0.3, 0.3, 3));
    }

    @Test
    void testInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new MiningConfig(10, 1.1, 0.3, 0.3, 3));
        assertThrows(IllegalArgumentException.class, () -> new MiningConfig(10, 0.3, -0.1, 0.3, 3));
        assertThrows(IllegalArgumentException.class, () -> new MiningConfig(10, 0.3, 0.3, Double.NaN, 3));
        assertThrows(IllegalArgumentException.class, () -> MiningConfig.allThresholds(2.0));
    }

    @Test
    void testInvalidMinimumDepth() {
        assertThrows(IllegalArgumentException.class, () -> new MiningConfig(10, 0.3, 0.3, 0.3, -1));
    }
}
