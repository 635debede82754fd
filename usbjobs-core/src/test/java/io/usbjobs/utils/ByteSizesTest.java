package io.usbjobs.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ByteSizesTest {

    @Test
    void formatsAcrossUnits() {
        assertEquals("0 Bytes", ByteSizes.format(0));
        assertEquals("500 Bytes", ByteSizes.format(500));
        assertEquals("1 KB", ByteSizes.format(1024));
        assertEquals("1.5 KB", ByteSizes.format(1536));
        assertEquals("1 GB", ByteSizes.format(1L << 30));
        assertEquals("2.25 MB", ByteSizes.format(2359296));
    }
}
