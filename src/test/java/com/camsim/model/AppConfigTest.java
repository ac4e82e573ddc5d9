package com.camsim.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void parsesCommaSeparatedStops() {
        assertArrayEquals(new double[] { -2, -1, 0, 1.5 }, AppConfig.parseStops("-2, -1,0 ,1.5"), 1e-12);
    }

    @Test
    void rejectsMalformedStops() {
        assertThrows(IllegalArgumentException.class, () -> AppConfig.parseStops(""));
        assertThrows(IllegalArgumentException.class, () -> AppConfig.parseStops("0,uno"));
    }

    @Test
    void exposureModeNamesAreExact() {
        assertEquals(ExposureMode.SATURATION, ExposureMode.fromString("saturation"));
        assertThrows(IllegalArgumentException.class, () -> ExposureMode.fromString("Saturation"));
        assertThrows(IllegalArgumentException.class, () -> ExposureMode.fromString("bogus"));
    }
}
