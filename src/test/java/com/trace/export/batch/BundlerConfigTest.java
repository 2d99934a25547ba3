package com.trace.export.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BundlerConfigTest {

    @Test
    @DisplayName("Should create bundler config with defaults")
    void testDefaults() {
        BundlerConfig config = BundlerConfig.defaults();
        assertEquals(10, config.getBundleCountThreshold());
        assertEquals(Duration.ofSeconds(1), config.getDelayThreshold());
        assertEquals(1_000_000L, config.getBufferedItemLimit());
    }

    @Test
    @DisplayName("Zero buffered item limit selects the default")
    void testZeroLimitSelectsDefault() {
        BundlerConfig config = BundlerConfig.builder().bufferedItemLimit(0).build();
        assertEquals(BundlerConfig.DEFAULT_BUFFERED_ITEM_LIMIT, config.getBufferedItemLimit());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> BundlerConfig.builder().bundleCountThreshold(0));
        assertThrows(IllegalArgumentException.class, () -> BundlerConfig.builder().bufferedItemLimit(-1));
        assertThrows(IllegalArgumentException.class, () -> BundlerConfig.builder().delayThreshold(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> BundlerConfig.builder().delayThreshold(null));
    }
}
